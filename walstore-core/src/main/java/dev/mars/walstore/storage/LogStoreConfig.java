/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package dev.mars.walstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import java.util.function.Function;

/**
 * Configuration for a {@link FileLogStore}.
 * <p>
 * Configuration is resolved with the following priority (highest first):
 * <ol>
 *   <li>Programmatic values set via {@link Builder}</li>
 *   <li>System properties (e.g., {@code -Dwalstore.path=/var/lib/app/outbox.wal})</li>
 *   <li>Environment variables (e.g., {@code WALSTORE_PATH})</li>
 *   <li>Properties file ({@code walstore.properties} on classpath or in working directory)</li>
 *   <li>Default values</li>
 * </ol>
 *
 * <h2>Configuration Properties</h2>
 * <table border="1">
 *   <tr><th>Property</th><th>System Property</th><th>Env Variable</th><th>Default</th></tr>
 *   <tr><td>path</td><td>walstore.path</td><td>WALSTORE_PATH</td><td>~/.walstore/store.wal</td></tr>
 *   <tr><td>syncEnabled</td><td>walstore.syncEnabled</td><td>WALSTORE_SYNC_ENABLED</td><td>true</td></tr>
 *   <tr><td>readMode</td><td>walstore.readMode</td><td>WALSTORE_READ_MODE</td><td>LENIENT</td></tr>
 *   <tr><td>minFreeSpaceMb</td><td>walstore.minFreeSpaceMb</td><td>WALSTORE_MIN_FREE_SPACE_MB</td><td>16</td></tr>
 *   <tr><td>maxPayloadSizeMb</td><td>walstore.maxPayloadSizeMb</td><td>WALSTORE_MAX_PAYLOAD_SIZE_MB</td><td>16</td></tr>
 * </table>
 *
 * <h2>Example Properties File</h2>
 * <pre>
 * # walstore.properties
 * walstore.path=/var/lib/app/outbox.wal
 * walstore.syncEnabled=true
 * walstore.readMode=STRICT
 * walstore.minFreeSpaceMb=16
 * walstore.maxPayloadSizeMb=16
 * </pre>
 *
 * <h2>Programmatic Configuration</h2>
 * <pre>
 * LogStoreConfig config = LogStoreConfig.builder()
 *     .path(Path.of("/var/lib/app/outbox.wal"))
 *     .readMode(ReadMode.STRICT)
 *     .build();
 *
 * try (LogStore store = FileLogStore.open(config)) {
 *     store.append(payload);
 * }
 * </pre>
 */
public final class LogStoreConfig {

    private static final Logger LOG = LoggerFactory.getLogger(LogStoreConfig.class);

    private static final String PROPERTIES_FILE = "walstore.properties";

    // Property keys
    private static final String PROP_PATH = "walstore.path";
    private static final String PROP_SYNC_ENABLED = "walstore.syncEnabled";
    private static final String PROP_READ_MODE = "walstore.readMode";
    private static final String PROP_MIN_FREE_SPACE_MB = "walstore.minFreeSpaceMb";
    private static final String PROP_MAX_PAYLOAD_SIZE_MB = "walstore.maxPayloadSizeMb";

    // Environment variable keys
    private static final String ENV_PATH = "WALSTORE_PATH";
    private static final String ENV_SYNC_ENABLED = "WALSTORE_SYNC_ENABLED";
    private static final String ENV_READ_MODE = "WALSTORE_READ_MODE";
    private static final String ENV_MIN_FREE_SPACE_MB = "WALSTORE_MIN_FREE_SPACE_MB";
    private static final String ENV_MAX_PAYLOAD_SIZE_MB = "WALSTORE_MAX_PAYLOAD_SIZE_MB";

    // Defaults
    private static final Path DEFAULT_PATH = Path.of(System.getProperty("user.home"), ".walstore", "store.wal");
    private static final boolean DEFAULT_SYNC_ENABLED = true;
    private static final ReadMode DEFAULT_READ_MODE = ReadMode.LENIENT;
    private static final int DEFAULT_MIN_FREE_SPACE_MB = 16;
    private static final int DEFAULT_MAX_PAYLOAD_SIZE_MB = 16;

    private final Path path;
    private final boolean syncEnabled;
    private final ReadMode readMode;
    private final int minFreeSpaceMb;
    private final int maxPayloadSizeMb;

    private LogStoreConfig(Builder builder) {
        this.path = builder.path;
        this.syncEnabled = builder.syncEnabled;
        this.readMode = builder.readMode;
        this.minFreeSpaceMb = builder.minFreeSpaceMb;
        this.maxPayloadSizeMb = builder.maxPayloadSizeMb;
    }

    /** The log file. */
    public Path path() {
        return path;
    }

    /** Whether every append is fsynced before returning (should be true in production). */
    public boolean syncEnabled() {
        return syncEnabled;
    }

    /** How undecodable lines are treated on open, scan and compaction. */
    public ReadMode readMode() {
        return readMode;
    }

    /** Minimum free disk space in MB required before writes; 0 disables the check. */
    public int minFreeSpaceMb() {
        return minFreeSpaceMb;
    }

    /** Maximum payload size in MB per entry. */
    public int maxPayloadSizeMb() {
        return maxPayloadSizeMb;
    }

    /** Minimum free disk space in bytes. */
    public long minFreeSpaceBytes() {
        return (long) minFreeSpaceMb * 1024 * 1024;
    }

    /** Maximum payload size in bytes. */
    public int maxPayloadSizeBytes() {
        return maxPayloadSizeMb * 1024 * 1024;
    }

    /**
     * Returns a copy of this configuration pointing at another file.
     */
    public LogStoreConfig withPath(Path path) {
        return builder()
                .path(path)
                .syncEnabled(syncEnabled)
                .readMode(readMode)
                .minFreeSpaceMb(minFreeSpaceMb)
                .maxPayloadSizeMb(maxPayloadSizeMb)
                .build();
    }

    @Override
    public String toString() {
        return "LogStoreConfig{" +
                "path=" + path +
                ", syncEnabled=" + syncEnabled +
                ", readMode=" + readMode +
                ", minFreeSpaceMb=" + minFreeSpaceMb +
                ", maxPayloadSizeMb=" + maxPayloadSizeMb +
                '}';
    }

    /**
     * Creates a new builder with defaults resolved from system properties,
     * environment variables, and properties file.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Loads configuration from all sources with default priority.
     * Shorthand for {@code LogStoreConfig.builder().build()}.
     */
    public static LogStoreConfig load() {
        return builder().build();
    }

    /**
     * Builder for {@link LogStoreConfig}.
     * <p>
     * Values not explicitly set will be resolved from system properties,
     * environment variables, properties file, or defaults (in that order).
     */
    public static final class Builder {
        private Path path;
        private Boolean syncEnabled;
        private ReadMode readMode;
        private Integer minFreeSpaceMb;
        private Integer maxPayloadSizeMb;

        private final Properties fileProperties;

        private Builder() {
            this.fileProperties = loadPropertiesFile();
        }

        /** Sets the log file. */
        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        /** Sets the log file from a string path. */
        public Builder path(String path) {
            this.path = Path.of(path);
            return this;
        }

        /** Enables or disables fsync on append (default: true). */
        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        /** Sets the read mode (default: LENIENT). */
        public Builder readMode(ReadMode readMode) {
            this.readMode = readMode;
            return this;
        }

        /** Sets minimum free disk space in MB (default: 16). */
        public Builder minFreeSpaceMb(int minFreeSpaceMb) {
            this.minFreeSpaceMb = minFreeSpaceMb;
            return this;
        }

        /** Sets maximum payload size in MB (default: 16). */
        public Builder maxPayloadSizeMb(int maxPayloadSizeMb) {
            this.maxPayloadSizeMb = maxPayloadSizeMb;
            return this;
        }

        /**
         * Builds the configuration, resolving unset values from
         * system properties, environment variables, properties file, or defaults.
         *
         * @throws IllegalArgumentException if a size setting is out of range
         */
        public LogStoreConfig build() {
            if (path == null) {
                path = resolve(PROP_PATH, ENV_PATH, v -> Path.of(v.trim()), DEFAULT_PATH);
            }
            if (syncEnabled == null) {
                syncEnabled = resolve(PROP_SYNC_ENABLED, ENV_SYNC_ENABLED, Boolean::parseBoolean, DEFAULT_SYNC_ENABLED);
            }
            if (readMode == null) {
                readMode = resolve(PROP_READ_MODE, ENV_READ_MODE,
                        v -> ReadMode.valueOf(v.trim().toUpperCase(Locale.ROOT)), DEFAULT_READ_MODE);
            }
            if (minFreeSpaceMb == null) {
                minFreeSpaceMb = resolve(PROP_MIN_FREE_SPACE_MB, ENV_MIN_FREE_SPACE_MB,
                        v -> Integer.parseInt(v.trim()), DEFAULT_MIN_FREE_SPACE_MB);
            }
            if (maxPayloadSizeMb == null) {
                maxPayloadSizeMb = resolve(PROP_MAX_PAYLOAD_SIZE_MB, ENV_MAX_PAYLOAD_SIZE_MB,
                        v -> Integer.parseInt(v.trim()), DEFAULT_MAX_PAYLOAD_SIZE_MB);
            }

            if (minFreeSpaceMb < 0) {
                throw new IllegalArgumentException("minFreeSpaceMb must be >= 0: " + minFreeSpaceMb);
            }
            // Payload plus Base64 expansion must stay addressable as a single int-sized buffer
            if (maxPayloadSizeMb < 1 || maxPayloadSizeMb > 1024) {
                throw new IllegalArgumentException("maxPayloadSizeMb must be in [1, 1024]: " + maxPayloadSizeMb);
            }

            return new LogStoreConfig(this);
        }

        /**
         * Resolves a value: system property, then environment variable, then
         * properties file, then the default. A value that fails to parse is
         * logged and the next source is tried.
         */
        private <T> T resolve(String sysProp, String envVar, Function<String, T> parser, T defaultValue) {
            String[][] sources = {
                    {"system property " + sysProp, System.getProperty(sysProp)},
                    {"environment variable " + envVar, System.getenv(envVar)},
                    {PROPERTIES_FILE + " key " + sysProp, fileProperties.getProperty(sysProp)}
            };
            for (String[] source : sources) {
                String value = source[1];
                if (value == null || value.isBlank()) {
                    continue;
                }
                try {
                    return parser.apply(value);
                } catch (IllegalArgumentException e) {
                    LOG.warn("Ignoring invalid value '{}' from {}: {}", value, source[0], e.getMessage());
                }
            }
            return defaultValue;
        }

        private static Properties loadPropertiesFile() {
            Properties props = new Properties();

            // Try classpath first
            try (InputStream is = LogStoreConfig.class.getClassLoader()
                    .getResourceAsStream(PROPERTIES_FILE)) {
                if (is != null) {
                    props.load(is);
                    return props;
                }
            } catch (IOException e) {
                LOG.warn("Could not read {} from classpath: {}", PROPERTIES_FILE, e.getMessage());
            }

            // Try working directory
            Path localFile = Path.of(PROPERTIES_FILE);
            if (Files.exists(localFile)) {
                try (InputStream is = Files.newInputStream(localFile)) {
                    props.load(is);
                } catch (IOException e) {
                    LOG.warn("Could not read {}: {}", localFile.toAbsolutePath(), e.getMessage());
                }
            }

            return props;
        }
    }
}
