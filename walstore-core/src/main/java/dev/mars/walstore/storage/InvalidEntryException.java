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

/**
 * Thrown when a stored line cannot be decoded into a {@link LogEntry}.
 * <p>
 * The codec raises it for every bad line; the store only lets it escape when
 * running in {@link ReadMode#STRICT}. Under {@link ReadMode#LENIENT} the line is
 * skipped and logged instead.
 */
public class InvalidEntryException extends StorageException {

    private final long lineNumber;

    public InvalidEntryException(String message) {
        this(message, -1L, null);
    }

    public InvalidEntryException(String message, Throwable cause) {
        this(message, -1L, cause);
    }

    public InvalidEntryException(String message, long lineNumber, Throwable cause) {
        super(message, cause);
        this.lineNumber = lineNumber;
    }

    /**
     * Returns the 1-based line number of the bad entry, or -1 if it was not
     * read from a file.
     */
    public long lineNumber() {
        return lineNumber;
    }
}
