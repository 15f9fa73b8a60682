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
package dev.mars.dbdb.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Semaphore;

/**
 * Single-file implementation of {@link Storage}.
 * <p>
 * <b>File Layout:</b>
 * <pre>
 * [0, 4096)      superblock: root address (u64, big-endian) + zero padding
 * [4096, EOF)    records:    length (u64, big-endian) + payload
 * </pre>
 * <p>
 * <b>Thread Safety:</b>
 * Writes, lock transitions and root commits are serialized on this instance.
 * Waiting for another handle's writer lock happens outside that monitor.
 * Reads are positional and take no lock; they only ever follow addresses that
 * a completed {@link #write(byte[])} has handed out.
 * <p>
 * <b>Protection Mechanisms:</b>
 * <ul>
 *   <li><b>Writer Lock:</b> An exclusive {@link FileLock} on the store file keeps
 *       other processes from writing. Handles inside this JVM first take a
 *       per-file permit, so a second handle waits for the lock instead of
 *       failing with an overlapping-lock error. The permit is dropped when
 *       the last handle on the file closes.</li>
 *   <li><b>Atomic Root:</b> The root address is the first 8 bytes of a
 *       sector-aligned superblock and is only written after all records it
 *       can reach have been forced to disk.</li>
 *   <li><b>Record Length Trust Boundary:</b> Lengths read from disk are checked
 *       against the file size and the configured maximum before allocating.</li>
 *   <li><b>Disk Space Checking:</b> Pre-flight check before large writes.</li>
 *   <li><b>Read-After-Write Verification:</b> Optional read-back of the
 *       committed root address.</li>
 * </ul>
 *
 * @see Storage
 */
public final class StorageFile implements Storage {

    // ========================================================================
    // Logger
    // ========================================================================

    private static final Logger LOG = LoggerFactory.getLogger(StorageFile.class);

    // ========================================================================
    // Constants
    // ========================================================================

    /** Size of the superblock; the first record starts on this boundary */
    public static final int SUPERBLOCK_SIZE = 4096;

    /** Width of the root address and of every record length prefix */
    public static final int INTEGER_LENGTH = 8;

    /** Writes above this size trigger a disk space check */
    private static final long LARGE_WRITE_BYTES = 1024 * 1024;

    /** One writer permit per open store file in this JVM, keyed by real path */
    private static final ConcurrentMap<Path, WriterPermit> WRITER_PERMITS = new ConcurrentHashMap<>();

    // ========================================================================
    // State
    // ========================================================================

    private final Path path;
    private final Path realPath;
    private final boolean syncEnabled;
    private final boolean verifyWrites;
    private final int maxRecordSize;
    private final long minFreeSpace;

    private final FileChannel channel;
    private final Semaphore writerPermit;
    private FileLock fileLock;
    private volatile boolean locked = false;
    private volatile boolean closed = false;

    // ========================================================================
    // Constructor
    // ========================================================================

    /**
     * Opens the store file with configuration loaded from system properties,
     * environment variables, properties file, or defaults.
     *
     * @param path the store file, created if absent
     * @see StorageConfig
     */
    public StorageFile(Path path) {
        this(path, StorageConfig.load());
    }

    /**
     * Opens the store file, creating it if absent, and makes sure the
     * superblock exists so the first record lands on the sector boundary.
     *
     * @param path   the store file
     * @param config the storage configuration
     * @throws StorageException if the file cannot be opened or initialized
     */
    public StorageFile(Path path, StorageConfig config) {
        this.path = Objects.requireNonNull(path, "path");
        Objects.requireNonNull(config, "config");
        this.syncEnabled = config.syncEnabled();
        this.verifyWrites = config.verifyWrites();
        this.maxRecordSize = config.maxRecordSizeBytes();
        this.minFreeSpace = config.minFreeSpaceBytes();

        LOG.info("Opening store file: path={}, syncEnabled={}, verifyWrites={}, maxRecordSize={} MB",
                path, syncEnabled, verifyWrites, config.maxRecordSizeMb());
        if (!syncEnabled) {
            LOG.warn("StorageFile opened with fsync DISABLED. Do NOT use in production!");
        }

        FileChannel ch = null;
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ch = FileChannel.open(path,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.READ,
                    StandardOpenOption.WRITE);
            this.realPath = path.toRealPath();
            this.writerPermit = register(realPath);
        } catch (IOException e) {
            LOG.error("Failed to open store file {}: {}", path, e.getMessage(), e);
            closeQuietly(ch);
            throw new StorageException("Failed to open store file " + path, e);
        }
        this.channel = ch;

        try {
            ensureSuperblock();
            LOG.info("Store file opened: path={}, size={} bytes, root={}", path, channel.size(), getRootAddress());
        } catch (IOException e) {
            LOG.error("Failed to initialize superblock of {}: {}", path, e.getMessage(), e);
            closeQuietly(channel);
            unregister(realPath);
            throw new StorageException("Failed to initialize superblock of " + path, e);
        } catch (RuntimeException e) {
            closeQuietly(channel);
            unregister(realPath);
            throw e;
        }
    }

    /** The store file path. */
    public Path path() {
        return path;
    }

    /**
     * Current file size in bytes, superblock included.
     */
    public long size() {
        ensureOpen();
        try {
            return channel.size();
        } catch (IOException e) {
            throw new StorageException("Failed to read size of " + path, e);
        }
    }

    // ========================================================================
    // Writer Lock
    // ========================================================================

    /**
     * {@inheritDoc}
     * <p>
     * The wait for another handle to release the lock happens outside this
     * handle's monitor, so {@link #close()} from another thread is not held up.
     * A handle closed during the wait fails with {@link StorageException}.
     */
    @Override
    public boolean lock() {
        synchronized (this) {
            ensureOpen();
            if (locked) {
                return false;
            }
        }
        LOG.debug("Acquiring writer lock: {}", path);
        writerPermit.acquireUninterruptibly();
        synchronized (this) {
            if (closed || locked) {
                writerPermit.release();
                ensureOpen();
                return false;
            }
            try {
                fileLock = channel.lock();
            } catch (IOException e) {
                writerPermit.release();
                LOG.error("Failed to acquire writer lock on {}: {}", path, e.getMessage(), e);
                throw new StorageException("Failed to acquire writer lock on " + path, e);
            } catch (RuntimeException e) {
                writerPermit.release();
                throw e;
            }
            locked = true;
        }
        LOG.debug("Writer lock acquired: {}", path);
        return true;
    }

    @Override
    public synchronized void unlock() {
        if (!locked) {
            return;
        }
        try {
            if (fileLock != null && fileLock.isValid()) {
                fileLock.release();
            }
            LOG.debug("Writer lock released: {}", path);
        } catch (IOException e) {
            LOG.error("Failed to release writer lock on {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to release writer lock on " + path, e);
        } finally {
            fileLock = null;
            locked = false;
            writerPermit.release();
        }
    }

    @Override
    public boolean isLocked() {
        return locked;
    }

    // ========================================================================
    // Records
    // ========================================================================

    @Override
    public long write(byte[] data) {
        Objects.requireNonNull(data, "data");
        ensureOpen();
        if (data.length > maxRecordSize) {
            LOG.error("Record too large: {} bytes (max: {})", data.length, maxRecordSize);
            throw new StorageException("Record too large: " + data.length +
                    " bytes (max: " + maxRecordSize + ")");
        }
        while (true) {
            lock();
            synchronized (this) {
                ensureOpen();
                // another thread on this handle may have committed in between
                if (locked) {
                    return append(data);
                }
            }
        }
    }

    private long append(byte[] data) {
        int recordSize = INTEGER_LENGTH + data.length;
        try {
            if (recordSize > LARGE_WRITE_BYTES) {
                LOG.debug("Large write detected ({} bytes), checking disk space", recordSize);
                checkDiskSpace();
            }

            long address = channel.size();
            ByteBuffer buf = ByteBuffer.allocate(recordSize);
            buf.putLong(data.length);
            buf.put(data);
            buf.flip();
            writeFully(buf, address);

            LOG.trace("Wrote record: address={}, payloadLen={}", address, data.length);
            return address;
        } catch (IOException e) {
            LOG.error("Failed to write record to {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to write record to " + path, e);
        }
    }

    @Override
    public byte[] read(long address) {
        ensureOpen();
        try {
            long fileSize = channel.size();
            if (address < SUPERBLOCK_SIZE || address > fileSize - INTEGER_LENGTH) {
                throw new MalformedRecordException("Record address " + address +
                        " outside data region [" + SUPERBLOCK_SIZE + ", " + fileSize + ")");
            }

            ByteBuffer lengthBuf = ByteBuffer.allocate(INTEGER_LENGTH);
            readFully(lengthBuf, address);
            long length = lengthBuf.getLong(0);

            if (length < 0 || length > maxRecordSize) {
                LOG.warn("Invalid record length at {}: {}", address, length);
                throw new MalformedRecordException("Invalid record length at " + address + ": " + length);
            }
            if (address + INTEGER_LENGTH + length > fileSize) {
                LOG.warn("Truncated record at {}: length {} exceeds file size {}", address, length, fileSize);
                throw new MalformedRecordException("Truncated record at " + address +
                        ": length " + length + " exceeds file size " + fileSize);
            }

            ByteBuffer payload = ByteBuffer.allocate((int) length);
            readFully(payload, address + INTEGER_LENGTH);
            LOG.trace("Read record: address={}, payloadLen={}", address, length);
            return payload.array();
        } catch (IOException e) {
            LOG.error("Failed to read record at {} from {}: {}", address, path, e.getMessage(), e);
            throw new StorageException("Failed to read record at " + address + " from " + path, e);
        }
    }

    // ========================================================================
    // Root Address
    // ========================================================================

    @Override
    public void commitRootAddress(long address) {
        while (true) {
            lock();
            synchronized (this) {
                ensureOpen();
                if (locked) {
                    publishRoot(address);
                    unlock();
                    return;
                }
            }
        }
    }

    private void publishRoot(long address) {
        try {
            long startNanos = System.nanoTime();
            // Records reachable from the new root must hit the disk before the root does
            if (syncEnabled) {
                channel.force(true);
            }

            ByteBuffer buf = ByteBuffer.allocate(INTEGER_LENGTH);
            buf.putLong(address);
            buf.flip();
            writeFully(buf, 0);

            if (syncEnabled) {
                channel.force(true);
            }
            if (verifyWrites) {
                verifyRootAddress(address);
            }
            LOG.debug("Root address committed: {} ({} us)", address, (System.nanoTime() - startNanos) / 1000);
        } catch (IOException e) {
            LOG.error("Failed to commit root address {} to {}: {}", address, path, e.getMessage(), e);
            throw new StorageException("Failed to commit root address to " + path, e);
        }
    }

    @Override
    public long getRootAddress() {
        ensureOpen();
        try {
            ByteBuffer buf = ByteBuffer.allocate(INTEGER_LENGTH);
            readFully(buf, 0);
            return buf.getLong(0);
        } catch (IOException e) {
            LOG.error("Failed to read root address from {}: {}", path, e.getMessage(), e);
            throw new StorageException("Failed to read root address from " + path, e);
        }
    }

    // ========================================================================
    // Lifecycle
    // ========================================================================

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            LOG.debug("Store already closed, ignoring duplicate close()");
            return;
        }
        try {
            unlock();
        } finally {
            closed = true;
            try {
                channel.close();
            } catch (IOException e) {
                LOG.warn("Error closing store file {}: {}", path, e.getMessage());
            }
            unregister(realPath);
            LOG.info("Store file closed: {}", path);
        }
    }

    // ========================================================================
    // Internal Helpers
    // ========================================================================

    /**
     * Pads the file with zeros up to {@link #SUPERBLOCK_SIZE}.
     * Only takes the writer lock when the file is actually too short.
     */
    private void ensureSuperblock() throws IOException {
        if (channel.size() >= SUPERBLOCK_SIZE) {
            return;
        }
        lock();
        try {
            long end = channel.size();
            if (end < SUPERBLOCK_SIZE) {
                writeFully(ByteBuffer.allocate((int) (SUPERBLOCK_SIZE - end)), end);
                if (syncEnabled) {
                    channel.force(true);
                }
                LOG.debug("Superblock initialized: padded {} bytes", SUPERBLOCK_SIZE - end);
            }
        } finally {
            unlock();
        }
    }

    private void writeFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            pos += channel.write(buf, pos);
        }
    }

    private void readFully(ByteBuffer buf, long position) throws IOException {
        long pos = position;
        while (buf.hasRemaining()) {
            int n = channel.read(buf, pos);
            if (n < 0) {
                throw new MalformedRecordException("Unexpected end of file at " + pos + " in " + path);
            }
            pos += n;
        }
    }

    /**
     * Reads the root address back and compares it with what was written.
     *
     * @throws StorageException if the stored value differs
     */
    private void verifyRootAddress(long expected) throws IOException {
        ByteBuffer buf = ByteBuffer.allocate(INTEGER_LENGTH);
        readFully(buf, 0);
        long stored = buf.getLong(0);
        if (stored != expected) {
            LOG.error("Root address verification failed: written={}, stored={}", expected, stored);
            throw new StorageException("Root address verification failed: written=" + expected +
                    ", stored=" + stored + ". Possible silent data corruption!");
        }
        LOG.trace("Root address verification passed: {}", expected);
    }

    /**
     * Checks that sufficient disk space is available.
     *
     * @throws StorageException if disk space is below minimum threshold
     */
    private void checkDiskSpace() throws IOException {
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

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Store file is closed: " + path);
        }
    }

    /**
     * Counts a new handle on {@code file} and returns the permit its handles share.
     */
    private static Semaphore register(Path file) {
        return WRITER_PERMITS.compute(file, (p, existing) -> {
            WriterPermit permit = existing != null ? existing : new WriterPermit();
            permit.handles++;
            return permit;
        }).semaphore;
    }

    /**
     * Drops a handle on {@code file}; the permit is forgotten with the last one.
     */
    private static void unregister(Path file) {
        WRITER_PERMITS.computeIfPresent(file, (p, permit) -> --permit.handles == 0 ? null : permit);
    }

    /** Number of open handles on {@code file} in this JVM. */
    static int openHandles(Path file) {
        WriterPermit permit = WRITER_PERMITS.get(file);
        return permit == null ? 0 : permit.handles;
    }

    private static void closeQuietly(FileChannel ch) {
        if (ch == null) {
            return;
        }
        try {
            ch.close();
        } catch (IOException e) {
            LOG.warn("Error closing channel after failed open: {}", e.getMessage());
        }
    }

    /** Writer permit and handle count shared by the handles of one file. */
    private static final class WriterPermit {
        final Semaphore semaphore = new Semaphore(1);
        int handles;
    }

    // ========================================================================
    // Exceptions
    // ========================================================================

    /**
     * Exception thrown when storage operations fail.
     */
    public static class StorageException extends RuntimeException {
        public StorageException(String message) {
            super(message);
        }

        public StorageException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Exception thrown when a record or its address is structurally invalid.
     */
    public static class MalformedRecordException extends StorageException {
        public MalformedRecordException(String message) {
            super(message);
        }
    }
}
