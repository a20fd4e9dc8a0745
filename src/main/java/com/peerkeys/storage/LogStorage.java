package com.peerkeys.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.zip.CRC32;

/**
 * Durable on-disk storage for byte values.
 * <p>
 * Every mutation is appended to a CRC-checked write-ahead log before it is applied to the
 * in-memory index. When the log grows past its limit the index is written to a snapshot and
 * the log is truncated. On open the snapshot is loaded and the log replayed on top of it;
 * replay stops at the first truncated or corrupt record and the log is cut back to the last
 * good record.
 * <p>
 * The directory is guarded by an exclusive {@code LOCK} file for as long as the storage is open.
 */
public class LogStorage implements Storage<byte[]> {

    private static final Logger logger = LoggerFactory.getLogger(LogStorage.class);

    public static final int MAX_KEY_LENGTH = 64 * 1024;
    public static final int MAX_VALUE_LENGTH = 16 * 1024 * 1024;
    public static final long DEFAULT_WAL_MAX_BYTES = 16L * 1024 * 1024;

    private static final int WAL_MAGIC = 0x504B4559; // "PKEY"
    private static final short WAL_VERSION = 1;
    private static final byte OP_PUT = 0x01;
    private static final byte OP_CLEAR = 0x03;
    private static final int HEADER_SIZE = 4 + 2 + 1 + 4 + 4;

    // Directories opened by this JVM. File locks are per process, and closing a second
    // channel on a locked file can drop the first channel's lock.
    private static final Set<Path> OPEN_DIRECTORIES = ConcurrentHashMap.newKeySet();

    private final Path directory;
    private final Path walPath;
    private final Path snapshotPath;
    private final boolean fsync;
    private final long walMaxBytes;
    private final ConcurrentHashMap<String, byte[]> index = new ConcurrentHashMap<>();
    private final Object walLock = new Object();
    private final WalChannelOpener walOpener;

    private final Path canonicalDirectory;
    private boolean registered;
    private FileChannel lockChannel;
    private FileLock lock;
    private FileChannel walChannel;
    private long walBytes;
    private volatile boolean closed;
    private volatile boolean failed;

    /**
     * Open storage in {@code directory} with fsync on every write and the default log limit.
     *
     * @param directory the directory holding the log, snapshot and lock files
     */
    public LogStorage(Path directory) {
        this(directory, true, DEFAULT_WAL_MAX_BYTES);
    }

    /**
     * Open storage in {@code directory}, creating it if needed.
     *
     * @param directory   the directory holding the log, snapshot and lock files
     * @param fsync       force every log append to disk before returning
     * @param walMaxBytes log size that triggers compaction into a snapshot
     * @throws StorageException if the directory cannot be prepared, is locked, or cannot be replayed
     */
    public LogStorage(Path directory, boolean fsync, long walMaxBytes) {
        this(directory, fsync, walMaxBytes,
                path -> FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE));
    }

    LogStorage(Path directory, boolean fsync, long walMaxBytes, WalChannelOpener walOpener) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (walMaxBytes <= 0) {
            throw new IllegalArgumentException("walMaxBytes must be positive, got: " + walMaxBytes);
        }
        this.directory = directory;
        this.canonicalDirectory = directory.toAbsolutePath().normalize();
        this.walPath = directory.resolve("wal.log");
        this.snapshotPath = directory.resolve("snapshot.dat");
        this.fsync = fsync;
        this.walMaxBytes = walMaxBytes;
        this.walOpener = walOpener;
        open();
    }

    private void open() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory", directory, e);
        }
        acquireLock();
        try {
            loadSnapshotIfPresent();
            long validLength = loadWalIfPresent();
            walChannel = walOpener.open(walPath);
            if (walChannel.size() > validLength) {
                logger.warn("Discarding {} bytes of damaged WAL at {}",
                        walChannel.size() - validLength, walPath.toAbsolutePath());
                walChannel.truncate(validLength);
            }
            walChannel.position(validLength);
            walBytes = validLength;
            logger.info("Opened log storage at {} ({} entries, wal={} bytes)",
                    directory.toAbsolutePath(), index.size(), walBytes);
        } catch (IOException | RuntimeException e) {
            if (walChannel != null) {
                try {
                    walChannel.close();
                } catch (IOException closeError) {
                    e.addSuppressed(closeError);
                }
                walChannel = null;
            }
            releaseLock();
            if (e instanceof StorageException) {
                throw (StorageException) e;
            }
            throw new StorageException("Failed to open WAL", walPath, e);
        }
    }

    private void acquireLock() {
        Path lockPath = directory.resolve("LOCK");
        if (!OPEN_DIRECTORIES.add(canonicalDirectory)) {
            throw new StorageException("Storage directory is already in use: " + canonicalDirectory);
        }
        registered = true;
        try {
            lockChannel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            lock = lockChannel.tryLock();
        } catch (OverlappingFileLockException e) {
            lock = null;
        } catch (IOException e) {
            releaseLock();
            throw new StorageException("Failed to lock storage directory", lockPath, e);
        }
        if (lock == null) {
            releaseLock();
            throw new StorageException("Storage directory is already in use: " + directory.toAbsolutePath());
        }
    }

    private void releaseLock() {
        try {
            if (lock != null && lock.isValid()) {
                lock.release();
            }
            if (lockChannel != null) {
                lockChannel.close();
            }
        } catch (IOException e) {
            logger.debug("Error releasing lock for {}: {}", directory, e.getMessage());
        } finally {
            lock = null;
            lockChannel = null;
            if (registered) {
                OPEN_DIRECTORIES.remove(canonicalDirectory);
                registered = false;
            }
        }
    }

    private void loadSnapshotIfPresent() throws IOException {
        if (!Files.exists(snapshotPath)) {
            return;
        }
        try (FileChannel channel = FileChannel.open(snapshotPath, StandardOpenOption.READ)) {
            long read = replayLog(channel);
            if (read < channel.size()) {
                throw new StorageException("Snapshot is damaged", snapshotPath, null);
            }
            logger.debug("Loaded snapshot from {}", snapshotPath.toAbsolutePath());
        }
    }

    /**
     * @return the length of the intact prefix of the log
     */
    private long loadWalIfPresent() throws IOException {
        if (!Files.exists(walPath)) {
            return 0;
        }
        try (FileChannel channel = FileChannel.open(walPath, StandardOpenOption.READ)) {
            long validLength = replayLog(channel);
            logger.debug("Replayed WAL from {}", walPath.toAbsolutePath());
            return validLength;
        }
    }

    private long replayLog(FileChannel channel) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_SIZE);
        long position = 0;
        while (true) {
            header.clear();
            int read = readFully(channel, header);
            if (read == -1) {
                break;
            }
            if (read < header.capacity()) {
                logger.warn("Truncated WAL record (header), stopping replay");
                break;
            }
            header.flip();
            int magic = header.getInt();
            short version = header.getShort();
            byte op = header.get();
            int keyLen = header.getInt();
            int valueLen = header.getInt();

            if (magic != WAL_MAGIC || version != WAL_VERSION) {
                logger.warn("Invalid WAL header (magic/version), stopping replay");
                break;
            }
            if (keyLen < 0 || keyLen > MAX_KEY_LENGTH) {
                logger.warn("Invalid WAL key length {}, stopping replay", keyLen);
                break;
            }
            if (valueLen < 0 || valueLen > MAX_VALUE_LENGTH) {
                logger.warn("Invalid WAL value length {}, stopping replay", valueLen);
                break;
            }

            int payloadSize = keyLen + valueLen + 4;
            ByteBuffer payload = ByteBuffer.allocate(payloadSize);
            int payloadRead = readFully(channel, payload);
            if (payloadRead < payloadSize) {
                logger.warn("Truncated WAL record (payload), stopping replay");
                break;
            }
            payload.flip();
            byte[] keyBytes = new byte[keyLen];
            payload.get(keyBytes);
            byte[] value = new byte[valueLen];
            payload.get(value);
            int checksum = payload.getInt();
            if (checksum(header.array(), keyBytes, value) != checksum) {
                logger.warn("WAL checksum mismatch, stopping replay");
                break;
            }

            applyRecord(op, new String(keyBytes, StandardCharsets.UTF_8), value);
            position += HEADER_SIZE + payloadSize;
        }
        return position;
    }

    private int readFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        int total = 0;
        while (buffer.hasRemaining()) {
            int read = channel.read(buffer);
            if (read == -1) {
                return total == 0 ? -1 : total;
            }
            total += read;
        }
        return total;
    }

    private void applyRecord(byte op, String key, byte[] value) {
        if (op == OP_PUT) {
            if (!key.isEmpty()) {
                index.put(key, value);
            }
            return;
        }
        if (op == OP_CLEAR) {
            index.clear();
            return;
        }
        logger.warn("Unknown WAL op {}, skipping", op);
    }

    private static int checksum(byte[] header, byte[] key, byte[] value) {
        CRC32 crc = new CRC32();
        crc.update(header, 0, HEADER_SIZE);
        crc.update(key, 0, key.length);
        crc.update(value, 0, value.length);
        return (int) crc.getValue();
    }

    private int writeRecordToChannel(FileChannel channel, byte op, String key, byte[] value) throws IOException {
        byte[] keyBytes = key.getBytes(StandardCharsets.UTF_8);
        int totalSize = HEADER_SIZE + keyBytes.length + value.length + 4;
        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.putInt(WAL_MAGIC);
        buffer.putShort(WAL_VERSION);
        buffer.put(op);
        buffer.putInt(keyBytes.length);
        buffer.putInt(value.length);
        buffer.put(keyBytes);
        buffer.put(value);
        buffer.putInt(checksum(buffer.array(), keyBytes, value));
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
        return totalSize;
    }

    /**
     * Append one record. On failure the log is cut back to its last complete record so later
     * appends stay replayable; if that is impossible the storage refuses further writes.
     */
    private void appendLocked(byte op, String key, byte[] value) throws IOException {
        long recordStart = walBytes;
        try {
            int written = writeRecordToChannel(walChannel, op, key, value);
            if (fsync) {
                walChannel.force(true);
            }
            walBytes = recordStart + written;
        } catch (IOException e) {
            try {
                walChannel.truncate(recordStart);
                walChannel.position(recordStart);
            } catch (IOException rollbackError) {
                e.addSuppressed(rollbackError);
                failed = true;
                logger.error("Cannot roll back torn WAL record at {}, refusing further writes",
                        walPath.toAbsolutePath(), rollbackError);
            }
            throw e;
        }
    }

    /**
     * Compact after a write that is already durable. A failed compaction does not undo the
     * write, so it is logged and the log position resynchronised instead of thrown.
     */
    private void compactAfterWriteLocked() {
        try {
            snapshotLocked();
        } catch (IOException e) {
            logger.warn("Compaction of {} failed, keeping the log", directory.toAbsolutePath(), e);
            resyncLocked();
        }
    }

    private void resyncLocked() {
        try {
            walBytes = walChannel.size();
            walChannel.position(walBytes);
        } catch (IOException e) {
            failed = true;
            logger.error("Cannot resynchronise WAL {}, refusing further writes", walPath.toAbsolutePath(), e);
        }
    }

    /**
     * Write the index to a fresh snapshot and truncate the log. Caller holds {@code walLock}.
     */
    private void snapshotLocked() throws IOException {
        Path tempSnapshot = snapshotPath.resolveSibling("snapshot.tmp");
        try (FileChannel snapshotChannel = FileChannel.open(tempSnapshot,
                StandardOpenOption.CREATE,
                StandardOpenOption.TRUNCATE_EXISTING,
                StandardOpenOption.WRITE)) {
            for (Map.Entry<String, byte[]> entry : index.entrySet()) {
                writeRecordToChannel(snapshotChannel, OP_PUT, entry.getKey(), entry.getValue());
            }
            snapshotChannel.force(true);
        }
        Files.move(tempSnapshot, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        walChannel.truncate(0);
        walChannel.position(0);
        walBytes = 0;
        logger.debug("Snapshot of {} entries written to {}", index.size(), snapshotPath.toAbsolutePath());
    }

    @Override
    public Optional<byte[]> get(String key) {
        ensureOpen();
        validateKey(key);
        byte[] value = index.get(key);
        logger.trace("GET key={} -> {}", key, value != null ? "FOUND" : "NOT_FOUND");
        return value != null ? Optional.of(Arrays.copyOf(value, value.length)) : Optional.empty();
    }

    @Override
    public void put(String key, byte[] value) {
        validateKey(key);
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        if (value.length > MAX_VALUE_LENGTH) {
            throw new IllegalArgumentException("Value too large: " + value.length + " bytes");
        }
        byte[] copy = Arrays.copyOf(value, value.length);
        synchronized (walLock) {
            ensureWritable();
            try {
                appendLocked(OP_PUT, key, copy);
            } catch (IOException e) {
                throw new StorageException("WAL write failed for key " + key, walPath, e);
            }
            index.put(key, copy);
            if (walBytes >= walMaxBytes) {
                compactAfterWriteLocked();
            }
        }
        logger.trace("PUT key={}, valueSize={}", key, copy.length);
    }

    @Override
    public void clear() {
        synchronized (walLock) {
            ensureWritable();
            try {
                appendLocked(OP_CLEAR, "", new byte[0]);
            } catch (IOException e) {
                throw new StorageException("Failed to clear storage", directory, e);
            }
            index.clear();
            compactAfterWriteLocked();
        }
        logger.debug("Log storage cleared at {}", directory.toAbsolutePath());
    }

    @Override
    public void close() {
        synchronized (walLock) {
            if (closed) {
                return;
            }
            closed = true;
            if (walChannel != null) {
                try {
                    walChannel.close();
                } catch (IOException e) {
                    logger.warn("Error closing WAL {}: {}", walPath, e.getMessage());
                }
            }
            releaseLock();
            index.clear();
        }
        logger.info("Log storage at {} closed", directory.toAbsolutePath());
    }

    /**
     * Compact the log into a snapshot now, regardless of its size.
     */
    public void compact() {
        synchronized (walLock) {
            ensureWritable();
            try {
                snapshotLocked();
            } catch (IOException e) {
                resyncLocked();
                throw new StorageException("Compaction failed", snapshotPath, e);
            }
        }
    }

    public int size() {
        ensureOpen();
        return index.size();
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @return bytes currently held in the write-ahead log
     */
    public long getWalBytes() {
        synchronized (walLock) {
            return walBytes;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Storage at " + directory + " is closed");
        }
    }

    private void ensureWritable() {
        ensureOpen();
        if (failed) {
            throw new StorageException("Storage is failed after an unrecoverable WAL error", walPath, null);
        }
    }

    private void validateKey(String key) {
        if (key == null || key.isEmpty()) {
            throw new IllegalArgumentException("Key cannot be null or empty");
        }
        if (key.length() > MAX_KEY_LENGTH / 4 && key.getBytes(StandardCharsets.UTF_8).length > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException("Key too long");
        }
    }

    interface WalChannelOpener {
        FileChannel open(Path path) throws IOException;
    }
}
