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
/**
 * Write-ahead log storage.
 * <p>
 * This package provides a durable, append-only record store:
 * <ul>
 *   <li>{@link dev.mars.walstore.storage.LogStore} - The store interface</li>
 *   <li>{@link dev.mars.walstore.storage.FileLogStore} - File-based implementation</li>
 *   <li>{@link dev.mars.walstore.storage.LogStoreConfig} - Layered configuration</li>
 *   <li>{@link dev.mars.walstore.storage.ReadMode} - Strict/lenient handling of bad lines</li>
 * </ul>
 * <p>
 * <b>Key Design Principles:</b>
 * <ul>
 *   <li><b>Persist-before-process:</b> An append is durable before it returns</li>
 *   <li><b>Crash-safe removal:</b> Compaction swaps in a fully written file with an atomic rename</li>
 *   <li><b>Sequential replay:</b> Unacknowledged entries are recovered in append order</li>
 * </ul>
 * <p>
 * <b>Limitations:</b> one open store per file. The lock file stops a second
 * {@code FileLogStore} from opening the same path, but processes that write
 * the file without it will corrupt the log. There is no segment rotation, size
 * cap or checksum; a scan reads the whole file into memory.
 *
 * @see dev.mars.walstore.storage.LogStore
 */
package dev.mars.walstore.storage;
