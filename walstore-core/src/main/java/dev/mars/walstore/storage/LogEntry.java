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

import java.util.Arrays;

/**
 * A single write-ahead log entry.
 * <p>
 * Equality is by value, including the payload bytes.
 *
 * @param id        the store-assigned id, unique and increasing for the life of the store
 * @param timestamp creation time in seconds since the epoch
 * @param data      the payload (opaque bytes, never null)
 */
public record LogEntry(long id, long timestamp, byte[] data) {

    public LogEntry {
        if (data == null) {
            data = new byte[0];
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LogEntry)) {
            return false;
        }
        LogEntry other = (LogEntry) o;
        return id == other.id && timestamp == other.timestamp && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        int result = Long.hashCode(id);
        result = 31 * result + Long.hashCode(timestamp);
        return 31 * result + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "LogEntry{id=" + id + ", timestamp=" + timestamp + ", data=" + data.length + " bytes}";
    }
}
