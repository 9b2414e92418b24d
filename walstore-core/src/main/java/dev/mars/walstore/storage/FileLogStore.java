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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * File-based implementation of {@link LogStore}.
 * <p>
 * Entries are stored one per line as JSON (see {@link LogEntryCodec}), in the
 * order they were appended.
 * <p>
 * <b>Files:</b>
 * <pre>
 * dir/
 *  ├─ store.wal          // append-only JSON lines
 *  ├─ store.wal.lock     // exclusive lock, held while the store is open
 *  └─ store.wal.compact  // transient, only during remove()
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Every operation holds a single {@link ReentrantLock} for its full duration
 * (read/write + fsync), so appends, scans, removals and clears never interleave.
 * <p>
 * <b>Durability:</b>
 * <ul>
 *   <li>append: written at the end of the file and fsynced before returning</li>
 *   <li>remove: compaction writes a temp file, fsyncs it, then atomically renames
 *       it over the log (write temp → fsync → rename → fsync dir). A crash leaves
 *       either the old or the new log, never a partial one.</li>
 *   <li>clear: truncate to zero length, then fsync</li>
 * </ul>
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>File Locking:</b> Exclusive lock on a sibling lock file. A second open of
 *       the same path, from this JVM or another process, fails fast. Tools that
 *       write the log without taking the lock are not detected and will race.</li>
 *   <li><b>Torn Tail Repair:</b> On open, an unterminated final line left by a crash
 *       mid-append is terminated (if it decodes) or cut off.</li>
 *   <li><b>Disk Space Checking:</b> Checked on open and before large appends.</li>
 * </ul>
 *
 * @see LogStore
 * @see LogStoreConfig
 */
public final class FileLogStore implements LogStore {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(FileLogStore.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Record delimiter */
    private static final byte DELIMITER = '\n';

    /** Lock file suffix */
    private static final String LOCK_SUFFIX = ".lock";

    /** Compaction temp file suffix */
    private static final String COMPACT_SUFFIX = ".compact";

    /** Appends larger than this re-check free disk space */
    private static final int LARGE_WRITE_THRESHOLD = 1024 * 1024;

    // ========================================================================
    // State
    // ========================================================================

    /**
     * Guards the channel, the id counter and the closed flag.
     * <p>
     * <b>INVARIANT:</b> no read, write, truncate or channel swap happens without
     * holding this lock.
     */
    private final ReentrantLock lock = new ReentrantLock();

    private final LogStoreConfig config;
    private final Path path;
    private final LogEntryCodec codec;
    private final boolean syncEnabled;
    private final ReadMode readMode;
    private final int maxPayloadSize;
    private final long minFreeSpace;

    private FileChannel logChannel;
    private FileChannel lockChannel;
    private FileLock exclusiveLock;
    private long nextId;
    private volatile boolean closed = false;

    // ========================================================================
    // Open / Close
    // ========================================================================

    private FileLogStore(Path path, LogStoreConfig config) {
        this.config = config;
        this.path = path;
        this.syncEnabled = config.syncEnabled();
        this.readMode = config.readMode();
        this.maxPayloadSize = config.maxPayloadSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();
        this.codec = new LogEntryCodec(maxPayloadSize);

        if (!syncEnabled) {
            LOG.warn("FileLogStore created with fsync DISABLED. Do NOT use in production!");
        }
    }

    /**
     * Opens the store at {@code path} with configuration loaded from
     * system properties, environment variables, properties file, or defaults.
     *
     * @param path the log file, created if absent
     * @return the open store
     * @throws StorageException if the file cannot be created, locked or recovered
     */
    public static FileLogStore open(Path path) {
        return open(path, LogStoreConfig.load());
    }

    /**
     * Opens the store at the configured path.
     *
     * @see #open(Path, LogStoreConfig)
     */
    public static FileLogStore open(LogStoreConfig config) {
        return open(config.path(), config);
    }

    /**
     * Opens the store at {@code path}, recovering the id counter from existing content.
     * <p>
     * Under {@link ReadMode#STRICT} an undecodable line anywhere in the file fails
     * the open with {@link InvalidEntryException}.
     *
     * @param path   the log file, created (with missing parent directories) if absent
     * @param config the store configuration; its own path is ignored
     * @return the open store
     * @throws StorageException if the file cannot be created, locked or recovered
     */
    public static FileLogStore open(Path path, LogStoreConfig config) {
        FileLogStore store = new FileLogStore(path, config);
        store.openChannel();
        return store;
    }

    private void openChannel() {
        lock.lock();
        try {
            LOG.info("Opening log store at: {} (readMode={})", path, readMode);
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }

            // Acquire exclusive lock to prevent a second writer
            acquireExclusiveLock();
            deleteStaleCompactionFile();

            this.logChannel = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);

            checkDiskSpace();
            if (readMode == ReadMode.STRICT) {
                // Reject a bad file before repairTornTail touches it
                scan(readFully(), ReadMode.STRICT);
            }
            repairTornTail();

            List<LogEntry> entries = entriesOf(scan(readFully(), readMode));
            long maxId = -1L;
            for (LogEntry entry : entries) {
                maxId = Math.max(maxId, entry.id());
            }
            this.nextId = maxId + 1;

            LOG.info("Log store opened: path={}, size={} bytes, entries={}, nextId={}",
                    path, logChannel.size(), entries.size(), nextId);

        } catch (IOException e) {
            LOG.error("Failed to open log store at {}: {}", path, e.getMessage(), e);
            releaseResources();
            throw new StorageException("Failed to open log store at " + path, e);
        } catch (RuntimeException e) {
            LOG.error("Failed to open log store at {}: {}", path, e.getMessage());
            releaseResources();
            throw e;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            if (closed) {
                LOG.debug("Log store already closed, ignoring duplicate close()");
                return;
            }
            closed = true;
            LOG.info("Closing log store at: {}", path);
            releaseResources();
            LOG.info("Log store closed");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the configuration used by this store.
     */
    public LogStoreConfig config() {
        return config;
    }

    // ========================================================================
    // Log Operations
    // ========================================================================

    @Override
    public LogEntry append(byte[] payload) {
        byte[] data = payload != null ? payload.clone() : new byte[0];
        if (data.length > maxPayloadSize) {
            LOG.error("Payload too large: {} bytes (max: {})", data.length, maxPayloadSize);
            throw new StorageException("Payload too large: " + data.length +
                    " bytes (max: " + maxPayloadSize + ")");
        }

        lock.lock();
        try {
            ensureOpen();
            if (nextId < 0) {
                LOG.error("Id space exhausted for {}", path);
                throw new StorageException("Id space exhausted for " + path);
            }

            LogEntry entry = new LogEntry(nextId, Instant.now().getEpochSecond(), data);
            byte[] encoded = codec.encode(entry);
            ByteBuffer buf = ByteBuffer.allocate(encoded.length + 1);
            buf.put(encoded);
            buf.put(DELIMITER);
            buf.flip();

            long start;
            try {
                start = logChannel.size();
            } catch (IOException e) {
                LOG.error("Failed to append entry {}: {}", entry.id(), e.getMessage(), e);
                throw new StorageException("Failed to append entry " + entry.id(), e);
            }

            try {
                if (buf.remaining() > LARGE_WRITE_THRESHOLD) {
                    LOG.debug("Large write detected ({} bytes), checking disk space", buf.remaining());
                    checkDiskSpace();
                }
                writeFully(logChannel, buf, start);
                if (syncEnabled) {
                    logChannel.force(true);
                }
            } catch (IOException e) {
                LOG.error("Failed to append entry {}: {}", entry.id(), e.getMessage(), e);
                rollback(start, e);
                throw new StorageException("Failed to append entry " + entry.id(), e);
            }

            nextId++;
            LOG.debug("Appended entry: id={}, payloadSize={}, offset={}", entry.id(), data.length, start);
            return entry;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<LogEntry> readAll() {
        return readAll(readMode);
    }

    @Override
    public List<LogEntry> readAll(ReadMode mode) {
        lock.lock();
        try {
            ensureOpen();
            List<LogEntry> entries = entriesOf(scan(readFully(), mode));
            LOG.debug("Read {} entries from {}", entries.size(), path);
            return entries;
        } catch (IOException e) {
            LOG.error("Failed to read log store {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to read log store " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(long id) {
        compact(Set.of(id));
    }

    @Override
    public int removeAll(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            LOG.trace("removeAll called with no ids, no-op");
            return 0;
        }
        return compact(new HashSet<>(ids));
    }

    @Override
    public void clear() {
        lock.lock();
        try {
            ensureOpen();
            long size = logChannel.size();
            logChannel.truncate(0);
            if (syncEnabled) {
                logChannel.force(true);
            }
            LOG.info("Cleared log store {}: {} bytes discarded, nextId remains {}", path, size, nextId);
        } catch (IOException e) {
            LOG.error("Failed to clear log store {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to clear log store " + path, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long nextId() {
        lock.lock();
        try {
            return nextId;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public String toString() {
        return "FileLogStore{path=" + path + ", readMode=" + readMode + ", closed=" + closed + '}';
    }

    // ========================================================================
    // Compaction
    // ========================================================================

    /**
     * Rewrites the log without the entries whose ids are in {@code ids}. Each id
     * removes at most one entry, the first carrying it. Lines that do not decode
     * are carried over byte-for-byte.
     */
    private int compact(Set<Long> ids) {
        lock.lock();
        try {
            ensureOpen();
            byte[] content = readFully();
            List<Segment> segments = scan(content, readMode);
            Set<Long> pending = new HashSet<>(ids);

            ByteArrayOutputStream kept = new ByteArrayOutputStream(content.length);
            int removed = 0;
            for (Segment segment : segments) {
                if (segment.entry() != null && pending.remove(segment.entry().id())) {
                    removed++;
                    LOG.trace("Compaction drops entry {} at line {}", segment.entry().id(), segment.lineNumber());
                    continue;
                }
                kept.write(content, segment.offset(), segment.length());
                kept.write(DELIMITER);
            }

            if (removed == 0) {
                LOG.debug("No entries matched {} in {}, nothing to remove", ids, path);
                return 0;
            }

            byte[] compacted = kept.toByteArray();
            replaceLog(compacted);
            LOG.info("Compacted {}: removed {} entries, {} -> {} bytes",
                    path, removed, content.length, compacted.length);
            return removed;

        } catch (IOException e) {
            LOG.error("Failed to compact log store {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to remove entries from " + path, e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Atomically replaces the log with {@code content} and swaps the channel.
     * Must be called with the lock held.
     */
    private void replaceLog(byte[] content) throws IOException {
        Path tmpPath = compactionPath();
        try {
            try (FileChannel ch = FileChannel.open(tmpPath,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE)) {
                writeFully(ch, ByteBuffer.wrap(content), 0);
                if (syncEnabled) {
                    ch.force(true);
                    LOG.trace("Synced compaction file {}", tmpPath);
                }
            }
            Files.move(tmpPath, path,
                    StandardCopyOption.REPLACE_EXISTING,
                    StandardCopyOption.ATOMIC_MOVE);
            LOG.trace("Atomic rename: {} -> {}", tmpPath, path);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tmpPath);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }

        if (syncEnabled) {
            syncDirectory(path.toAbsolutePath().getParent());
        }

        // The old channel still points at the replaced inode
        FileChannel previous = logChannel;
        try {
            logChannel = FileChannel.open(path, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            LOG.error("Compacted log written but could not be reopened, closing store: {}", e.getMessage());
            logChannel = previous;
            closed = true;
            releaseResources();
            throw e;
        }
        closeChannel(previous, "replaced log channel");
    }

    // ========================================================================
    // Scanning
    // ========================================================================

    /**
     * One delimited line of the log.
     *
     * @param lineNumber 1-based line number
     * @param offset     start of the line in the scanned content
     * @param length     line length, excluding the delimiter
     * @param entry      the decoded entry, or null if the line did not decode
     */
    private record Segment(long lineNumber, int offset, int length, LogEntry entry) {
    }

    /**
     * Splits {@code content} into lines and decodes each one. Empty lines are
     * dropped. Undecodable lines fail the scan in STRICT mode and are returned
     * with a null entry in LENIENT mode.
     */
    private List<Segment> scan(byte[] content, ReadMode mode) {
        List<Segment> segments = new ArrayList<>();
        int skipped = 0;
        long lineNumber = 0;
        int start = 0;
        while (start < content.length) {
            int end = indexOf(content, DELIMITER, start);
            if (end < 0) {
                end = content.length;
            }
            lineNumber++;
            int length = end - start;

            if (!isBlank(content, start, length)) {
                try {
                    LogEntry entry = codec.decode(content, start, length);
                    segments.add(new Segment(lineNumber, start, length, entry));
                } catch (InvalidEntryException e) {
                    if (mode == ReadMode.STRICT) {
                        LOG.error("Invalid entry at line {} of {}: {}", lineNumber, path, e.getMessage());
                        throw new InvalidEntryException(
                                "Invalid entry at line " + lineNumber + " of " + path + ": " + e.getMessage(),
                                lineNumber, e);
                    }
                    LOG.warn("Skipping invalid entry at line {} of {}: {}", lineNumber, path, e.getMessage());
                    segments.add(new Segment(lineNumber, start, length, null));
                    skipped++;
                }
            }
            start = end + 1;
        }

        if (skipped > 0) {
            LOG.warn("Scan of {} skipped {} invalid line(s)", path, skipped);
        }
        return segments;
    }

    private static List<LogEntry> entriesOf(List<Segment> segments) {
        List<LogEntry> entries = new ArrayList<>(segments.size());
        for (Segment segment : segments) {
            if (segment.entry() != null) {
                entries.add(segment.entry());
            }
        }
        return entries;
    }

    /**
     * Reads the whole log from offset zero.
     */
    private byte[] readFully() throws IOException {
        long size = logChannel.size();
        if (size > Integer.MAX_VALUE - 8) {
            throw new StorageException("Log file too large to scan: " + size + " bytes");
        }

        ByteBuffer buf = ByteBuffer.allocate((int) size);
        long pos = 0;
        while (buf.hasRemaining()) {
            int read = logChannel.read(buf, pos);
            if (read < 0) {
                break;
            }
            pos += read;
        }
        LOG.trace("Read {} bytes from {}", pos, path);
        return buf.position() == buf.capacity() ? buf.array() : Arrays.copyOf(buf.array(), buf.position());
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Deals with an unterminated final line. Appending after it would glue two
     * entries together.
     * <p>
     * A line whose JSON is cut short is what a crash mid-append leaves behind and
     * is cut off. Any other final line, decodable or not, is kept and terminated;
     * scans then treat it like any other line. Strict opens validate the whole
     * file before this runs, so only lenient opens ever truncate.
     */
    private void repairTornTail() throws IOException {
        long size = logChannel.size();
        if (size == 0) {
            return;
        }
        ByteBuffer last = ByteBuffer.allocate(1);
        logChannel.read(last, size - 1);
        if (last.get(0) == DELIMITER) {
            return;
        }

        byte[] content = readFully();
        int tailStart = lastIndexOf(content, DELIMITER) + 1;
        int tailLength = content.length - tailStart;
        long lineNumber = countDelimiters(content) + 1;

        if (!isBlank(content, tailStart, tailLength) && !isTornWrite(content, tailStart, tailLength, lineNumber)) {
            writeFully(logChannel, ByteBuffer.wrap(new byte[]{DELIMITER}), size);
            if (syncEnabled) {
                logChannel.force(true);
            }
            LOG.warn("Terminated unterminated final line {} of {}", lineNumber, path);
            return;
        }

        LOG.warn("Truncating torn tail: {} bytes removed (file was {} bytes, valid data {} bytes)",
                tailLength, size, tailStart);
        logChannel.truncate(tailStart);
        if (syncEnabled) {
            logChannel.force(true);
        }
    }

    private boolean isTornWrite(byte[] content, int offset, int length, long lineNumber) {
        try {
            codec.decode(content, offset, length);
            return false;
        } catch (InvalidEntryException e) {
            if (LogEntryCodec.isTruncated(e)) {
                return true;
            }
            LOG.warn("Keeping undecodable final line {} of {}: {}", lineNumber, path, e.getMessage());
            return false;
        }
    }

    /**
     * Truncates the log back to {@code length} after a failed append.
     */
    private void rollback(long length, IOException cause) {
        try {
            logChannel.truncate(length);
            LOG.debug("Rolled back partial append to {} bytes", length);
        } catch (IOException e) {
            cause.addSuppressed(e);
            LOG.error("Could not roll back partial append on {}: {}", path, e.getMessage());
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += channel.write(buf, pos);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Log store is closed: " + path);
        }
    }

    private Path compactionPath() {
        return path.resolveSibling(path.getFileName() + COMPACT_SUFFIX);
    }

    private void deleteStaleCompactionFile() throws IOException {
        Path tmpPath = compactionPath();
        if (Files.deleteIfExists(tmpPath)) {
            LOG.warn("Deleted stale compaction file {} left by an interrupted remove", tmpPath);
        }
    }

    /**
     * Fsyncs a directory to ensure metadata changes (renames) are durable.
     * <p>
     * On Windows, this may fail or be a no-op. That's acceptable for development.
     * On Linux (ext4/xfs), this is critical for durability.
     */
    private void syncDirectory(Path dir) {
        if (dir == null) {
            return;
        }
        // Skip on Windows - directory sync isn't supported the same way
        if (System.getProperty("os.name").toLowerCase().contains("win")) {
            LOG.trace("Skipping directory sync on Windows");
            return;
        }

        try (FileChannel fc = FileChannel.open(dir, StandardOpenOption.READ)) {
            fc.force(true);
            LOG.trace("Directory synced: {}", dir);
        } catch (IOException e) {
            // Some systems don't support directory fsync - log but continue
            LOG.warn("Could not fsync directory {}: {}", dir, e.getMessage());
        }
    }

    /**
     * Acquires an exclusive lock on the sibling lock file.
     * <p>
     * Uses a separate lock file so that compaction can replace the log file
     * without losing the lock.
     *
     * @throws StorageException if the lock is held by another process or another store in this JVM
     */
    private void acquireExclusiveLock() throws IOException {
        Path lockPath = path.resolveSibling(path.getFileName() + LOCK_SUFFIX);
        LOG.debug("Acquiring exclusive lock: {}", lockPath);

        lockChannel = FileChannel.open(lockPath,
                StandardOpenOption.CREATE,
                StandardOpenOption.READ,
                StandardOpenOption.WRITE);

        try {
            exclusiveLock = lockChannel.tryLock();
            if (exclusiveLock == null) {
                lockChannel.close();
                LOG.error("Cannot acquire exclusive lock: another process holds the lock");
                throw new StorageException(
                        "Cannot acquire exclusive lock on " + path +
                        ". Another process may be using this store.");
            }
            LOG.debug("Exclusive lock acquired: {}", lockPath);
        } catch (OverlappingFileLockException e) {
            lockChannel.close();
            LOG.error("Cannot acquire exclusive lock: lock already held in this JVM");
            throw new StorageException(
                    "Cannot acquire exclusive lock on " + path + ": store already open in this JVM", e);
        }
    }

    /**
     * Closes the log channel and releases the exclusive lock.
     */
    private void releaseResources() {
        closeChannel(logChannel, "log channel");
        try {
            if (exclusiveLock != null && exclusiveLock.isValid()) {
                exclusiveLock.release();
                LOG.debug("Exclusive lock released");
            }
        } catch (IOException e) {
            LOG.warn("Could not release lock: {}", e.getMessage());
        }
        closeChannel(lockChannel, "lock channel");
    }

    private static void closeChannel(FileChannel channel, String name) {
        if (channel == null || !channel.isOpen()) {
            return;
        }
        try {
            channel.close();
            LOG.trace("Closed {}", name);
        } catch (IOException e) {
            LOG.warn("Error closing {}: {}", name, e.getMessage());
        }
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace() throws IOException {
        if (minFreeSpace <= 0) {
            return;
        }
        FileStore store = Files.getFileStore(path);
        long usableSpace = store.getUsableSpace();
        long usableSpaceMb = usableSpace / 1024 / 1024;
        long minFreeSpaceMb = minFreeSpace / 1024 / 1024;

        LOG.trace("Disk space check: {} MB available, {} MB required", usableSpaceMb, minFreeSpaceMb);

        if (usableSpace < minFreeSpace) {
            LOG.error("Insufficient disk space: {} MB available, need at least {} MB",
                    usableSpaceMb, minFreeSpaceMb);
            throw new StorageException(
                    "Insufficient disk space: " + usableSpaceMb + " MB available, " +
                    "need at least " + minFreeSpaceMb + " MB.");
        }
    }

    private static int indexOf(byte[] content, byte b, int from) {
        for (int i = from; i < content.length; i++) {
            if (content[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private static int lastIndexOf(byte[] content, byte b) {
        for (int i = content.length - 1; i >= 0; i--) {
            if (content[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private static long countDelimiters(byte[] content) {
        long count = 0;
        for (byte b : content) {
            if (b == DELIMITER) {
                count++;
            }
        }
        return count;
    }

    private static boolean isBlank(byte[] content, int offset, int length) {
        for (int i = offset; i < offset + length; i++) {
            byte b = content[i];
            if (b != ' ' && b != '\t' && b != '\r') {
                return false;
            }
        }
        return true;
    }
}
