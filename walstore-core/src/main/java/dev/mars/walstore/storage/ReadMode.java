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
 * Policy for stored lines that cannot be decoded.
 * <p>
 * The same mode governs recovery on open, full scans and compaction.
 */
public enum ReadMode {

    /** Any undecodable line fails the whole operation with {@link InvalidEntryException}. */
    STRICT,

    /** Undecodable lines are skipped (and kept as-is by compaction); only valid entries are returned. */
    LENIENT
}
