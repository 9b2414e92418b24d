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
package dev.mars.walstore.demo;

import dev.mars.walstore.storage.FileLogStore;
import dev.mars.walstore.storage.LogEntry;
import dev.mars.walstore.storage.LogStore;
import dev.mars.walstore.storage.LogStoreConfig;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Demo of the persist-before-process pattern.
 * <p>
 * Each message is appended to the log before it is "sent". Messages that are
 * acknowledged are removed; the rest stay in the log and are re-sent on the
 * next run:
 * <ol>
 *   <li>Replay anything left over from a previous run and re-send it</li>
 *   <li>Persist and send a message that succeeds, then remove it</li>
 *   <li>Persist and send a message that fails, leaving it in the log</li>
 * </ol>
 *
 * <h2>Configuration</h2>
 * Configuration is handled by {@link LogStoreConfig} with the following priority:
 * <ol>
 *   <li>Command-line argument (log file only)</li>
 *   <li>System properties: {@code -Dwalstore.path=/path -Dwalstore.readMode=STRICT ...}</li>
 *   <li>Environment variables: {@code WALSTORE_PATH, WALSTORE_READ_MODE, ...}</li>
 *   <li>Properties file: {@code walstore.properties} on classpath or working directory</li>
 *   <li>Defaults</li>
 * </ol>
 *
 * <h2>Usage</h2>
 * <pre>
 * mvn package -pl walstore-demo -am
 * java -cp "walstore-demo/target/*:..." dev.mars.walstore.demo.RecoveryDemo data/outbox.wal
 * </pre>
 *
 * @see LogStoreConfig
 */
public class RecoveryDemo {

    public static void main(String[] args) {
        System.out.println("+---------------------------------------+");
        System.out.println("|         WAL Recovery Demo             |");
        System.out.println("+---------------------------------------+");
        System.out.println();

        LogStoreConfig config = args.length > 0 && !args[0].isBlank()
                ? LogStoreConfig.builder().path(args[0]).build()
                : LogStoreConfig.load();

        System.out.println("Configuration: " + config);
        System.out.println();

        try (LogStore store = FileLogStore.open(config)) {
            System.out.println("[OK] Store opened at: " + store.path().toAbsolutePath()
                    + " (next id " + store.nextId() + ")");

            // 1. Anything still in the log was never acknowledged
            List<LogEntry> pending = store.readAll();
            System.out.println("[OK] Found " + pending.size() + " unacknowledged entries");
            for (LogEntry entry : pending) {
                System.out.println("    re-sending [" + entry.id() + "]: " + text(entry));
                if (send(entry, true)) {
                    store.remove(entry.id());
                    System.out.println("    [" + entry.id() + "] acknowledged and removed");
                }
            }

            // 2. Persist before processing, remove once acknowledged
            LogEntry first = store.append("Test persistent log 1".getBytes(StandardCharsets.UTF_8));
            System.out.println("\n[OK] Persisted [" + first.id() + "]: " + text(first));
            if (send(first, true)) {
                store.remove(first.id());
                System.out.println("[OK] [" + first.id() + "] acknowledged and removed");
            }

            // 3. Simulate a downstream failure: the entry stays in the log
            LogEntry second = store.append("Test persistent log 2".getBytes(StandardCharsets.UTF_8));
            System.out.println("[OK] Persisted [" + second.id() + "]: " + text(second));
            if (!send(second, false)) {
                System.out.println("[!!] [" + second.id() + "] not acknowledged, kept for replay");
            }

            System.out.println("\n+---------------------------------------+");
            System.out.println("|  Demo complete!                       |");
            System.out.println("|  Run again to see entries replayed.   |");
            System.out.println("+---------------------------------------+");
        }
    }

    /**
     * Stand-in for a downstream call.
     */
    private static boolean send(LogEntry entry, boolean succeed) {
        System.out.println("    sending [" + entry.id() + "] ... " + (succeed ? "ok" : "FAILED"));
        return succeed;
    }

    private static String text(LogEntry entry) {
        return new String(entry.data(), StandardCharsets.UTF_8);
    }
}
