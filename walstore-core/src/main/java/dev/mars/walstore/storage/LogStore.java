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

import java.io.Closeable;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Durable, append-only record store.
 * <p>
 * Callers persist a payload before treating it as "in flight", then remove it
 * by id once it has been acknowledged downstream. After a crash, {@link #readAll()}
 * returns everything that was never acknowledged so it can be re-sent.
 * <p>
 * <b>Critical Contract:</b> {@link #append(byte[])} returns only after the entry is
 * durable (fsync). Every operation is synchronous and runs under exclusive access
 * to the backing file, so operations never interleave.
 * <p>
 * A store must be {@linkplain #close() closed} to release its file handle and lock.
 * Reading, writing or compacting a closed store throws {@link StorageException}.
 *
 * @see FileLogStore
 */
public interface LogStore extends Closeable {

    /**
     * Appends a payload as a new entry.
     * <p>
     * The entry receives the next id and the current time in epoch seconds.
     * A {@code null} payload is stored as an empty payload.
     *
     * @param payload the bytes to persist
     * @return the persisted entry
     * @throws SerializationException if the entry cannot be encoded (nothing is written)
     * @throws StorageException       if the write or fsync fails
     */
    LogEntry append(byte[] payload);

    /**
     * Returns every stored entry in storage order, using the configured {@link ReadMode}.
     * <p>
     * This is a snapshot: it changes neither the file nor the id counter.
     *
     * @throws InvalidEntryException in {@link ReadMode#STRICT} if any line is undecodable
     * @throws StorageException      if the file cannot be read
     */
    List<LogEntry> readAll();

    /**
     * Returns every stored entry in storage order, using the given read mode
     * for this call only.
     *
     * @param mode how undecodable lines are treated
     */
    List<LogEntry> readAll(ReadMode mode);

    /**
     * Removes the entry with the given id.
     * <p>
     * Exactly one entry is removed; if a file edited by hand carries the id more
     * than once, only the first is removed. Removing an id that is not present
     * is a no-op. The remaining entries keep their ids and relative order.
     *
     * @param id the id to remove
     * @throws StorageException if compaction fails; the previous file is left intact
     */
    void remove(long id);

    /**
     * Removes the entries whose ids are in {@code ids} with a single rewrite.
     * Each id removes at most one entry, as with {@link #remove(long)}.
     *
     * @param ids the ids to remove
     * @return the number of entries removed
     */
    int removeAll(Collection<Long> ids);

    /**
     * Removes every entry. The id counter is <b>not</b> reset.
     */
    void clear();

    /**
     * Returns the id the next append will receive.
     */
    long nextId();

    /**
     * Returns the backing file.
     */
    Path path();

    /**
     * Closes the store, releasing the file handle and lock. Idempotent.
     */
    @Override
    void close();
}
