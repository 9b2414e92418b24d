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

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogStoreConfig resolution.
 * <p>
 * Tests system properties, default values, and configuration building.
 */
class LogStoreConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearSystemProperties() {
        System.clearProperty("walstore.path");
        System.clearProperty("walstore.syncEnabled");
        System.clearProperty("walstore.readMode");
        System.clearProperty("walstore.minFreeSpaceMb");
        System.clearProperty("walstore.maxPayloadSizeMb");
    }

    // ========================================================================
    // System Property Resolution Tests
    // ========================================================================

    @Nested
    @DisplayName("System Property Resolution")
    class SystemPropertyTests {

        @Test
        @DisplayName("System property path is respected")
        void testPathSystemProperty() {
            Path custom = tempDir.resolve("custom.wal");
            System.setProperty("walstore.path", custom.toString());

            assertEquals(custom, LogStoreConfig.builder().build().path());
        }

        @Test
        @DisplayName("System property syncEnabled=false is respected")
        void testSyncEnabledSystemPropertyFalse() {
            System.setProperty("walstore.syncEnabled", "false");

            assertFalse(LogStoreConfig.builder().build().syncEnabled());
        }

        @Test
        @DisplayName("System property readMode is case-insensitive")
        void testReadModeSystemProperty() {
            System.setProperty("walstore.readMode", " strict ");

            assertEquals(ReadMode.STRICT, LogStoreConfig.builder().build().readMode());
        }

        @Test
        @DisplayName("System property minFreeSpaceMb is respected")
        void testMinFreeSpaceMbSystemProperty() {
            System.setProperty("walstore.minFreeSpaceMb", "128");

            LogStoreConfig config = LogStoreConfig.builder().build();
            assertEquals(128, config.minFreeSpaceMb());
            assertEquals(128L * 1024 * 1024, config.minFreeSpaceBytes());
        }

        @Test
        @DisplayName("System property maxPayloadSizeMb is respected")
        void testMaxPayloadSizeMbSystemProperty() {
            System.setProperty("walstore.maxPayloadSizeMb", "32");

            LogStoreConfig config = LogStoreConfig.builder().build();
            assertEquals(32, config.maxPayloadSizeMb());
            assertEquals(32 * 1024 * 1024, config.maxPayloadSizeBytes());
        }

        @Test
        @DisplayName("Invalid integer system property falls back to default")
        void testInvalidIntSystemProperty() {
            System.setProperty("walstore.minFreeSpaceMb", "not-a-number");

            assertEquals(16, LogStoreConfig.builder().build().minFreeSpaceMb());
        }

        @Test
        @DisplayName("Invalid read mode falls back to default")
        void testInvalidReadModeSystemProperty() {
            System.setProperty("walstore.readMode", "paranoid");

            assertEquals(ReadMode.LENIENT, LogStoreConfig.builder().build().readMode());
        }

        @Test
        @DisplayName("Blank system property is ignored")
        void testBlankSystemProperty() {
            System.setProperty("walstore.maxPayloadSizeMb", "   ");

            assertEquals(16, LogStoreConfig.builder().build().maxPayloadSizeMb());
        }
    }

    // ========================================================================
    // Builder Tests
    // ========================================================================

    @Nested
    @DisplayName("Builder")
    class BuilderTests {

        @Test
        @DisplayName("Defaults")
        void testDefaults() {
            LogStoreConfig config = LogStoreConfig.load();

            assertEquals(Path.of(System.getProperty("user.home"), ".walstore", "store.wal"), config.path());
            assertTrue(config.syncEnabled());
            assertEquals(ReadMode.LENIENT, config.readMode());
            assertEquals(16, config.minFreeSpaceMb());
            assertEquals(16, config.maxPayloadSizeMb());
        }

        @Test
        @DisplayName("Programmatic values win over system properties")
        void testProgrammaticOverridesSystemProperty() {
            System.setProperty("walstore.readMode", "STRICT");
            System.setProperty("walstore.syncEnabled", "false");

            LogStoreConfig config = LogStoreConfig.builder()
                    .readMode(ReadMode.LENIENT)
                    .syncEnabled(true)
                    .path(tempDir.resolve("x.wal").toString())
                    .build();

            assertEquals(ReadMode.LENIENT, config.readMode());
            assertTrue(config.syncEnabled());
            assertEquals(tempDir.resolve("x.wal"), config.path());
        }

        @Test
        @DisplayName("withPath copies every other setting")
        void testWithPath() {
            LogStoreConfig original = LogStoreConfig.builder()
                    .path(tempDir.resolve("a.wal"))
                    .syncEnabled(false)
                    .readMode(ReadMode.STRICT)
                    .minFreeSpaceMb(0)
                    .maxPayloadSizeMb(4)
                    .build();

            LogStoreConfig copy = original.withPath(tempDir.resolve("b.wal"));

            assertEquals(tempDir.resolve("b.wal"), copy.path());
            assertFalse(copy.syncEnabled());
            assertEquals(ReadMode.STRICT, copy.readMode());
            assertEquals(0, copy.minFreeSpaceMb());
            assertEquals(4, copy.maxPayloadSizeMb());
        }

        @Test
        @DisplayName("Out-of-range sizes are rejected")
        void testRangeValidation() {
            assertThrows(IllegalArgumentException.class,
                    () -> LogStoreConfig.builder().maxPayloadSizeMb(0).build());
            assertThrows(IllegalArgumentException.class,
                    () -> LogStoreConfig.builder().maxPayloadSizeMb(2048).build());
            assertThrows(IllegalArgumentException.class,
                    () -> LogStoreConfig.builder().minFreeSpaceMb(-1).build());
        }

        @Test
        @DisplayName("toString lists every setting")
        void testToString() {
            String s = LogStoreConfig.builder().readMode(ReadMode.STRICT).build().toString();

            assertTrue(s.contains("readMode=STRICT"));
            assertTrue(s.contains("syncEnabled="));
            assertTrue(s.contains("maxPayloadSizeMb="));
        }
    }
}
