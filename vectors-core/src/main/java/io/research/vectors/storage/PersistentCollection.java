package io.research.vectors.storage;

import io.research.vectors.ChunkRecord;
import io.research.vectors.CollectionConfig;
import io.research.vectors.CorruptCollectionException;
import io.research.vectors.DimensionMismatchException;
import io.research.vectors.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Durable {@code id -> record} map rooted at a directory.
 *
 * <p>All records are held in memory in insertion order and every mutation is appended
 * to a {@link RecordLog} and forced to disk before the in-memory map changes. Reopening
 * the same root replays the log and exposes an equal collection.</p>
 *
 * <h2>Storage root</h2>
 * <ul>
 *   <li>{@code collection.json}: {@link CollectionDescriptor}, written once</li>
 *   <li>{@code records.log}: the record log</li>
 *   <li>{@code .lock}: exclusive process lock, when enabled</li>
 * </ul>
 *
 * <p>Not thread-safe. Callers serialise mutations against each other and against reads.</p>
 */
public final class PersistentCollection implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(PersistentCollection.class);

    public static final String LOCK_FILE = ".lock";

    private final Path root;
    private final CollectionDescriptor descriptor;
    private final int compactionThreshold;
    private final Map<String, ChunkRecord> records;
    private final RecordLog recordLog;
    private final FileChannel lockChannel;
    private final FileLock lock;
    private boolean closed;

    private PersistentCollection(Path root, CollectionDescriptor descriptor, int compactionThreshold,
                                 Map<String, ChunkRecord> records, RecordLog recordLog,
                                 FileChannel lockChannel, FileLock lock) {
        this.root = root;
        this.descriptor = descriptor;
        this.compactionThreshold = compactionThreshold;
        this.records = records;
        this.recordLog = recordLog;
        this.lockChannel = lockChannel;
        this.lock = lock;
    }

    /**
     * Opens the collection at {@code root}, creating it when the directory holds none.
     *
     * @throws DimensionMismatchException if an existing collection has another dimension
     * @throws CorruptCollectionException if existing files cannot be read back
     * @throws StorageException on any other I/O failure
     */
    public static PersistentCollection open(Path root, CollectionConfig config) {
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root " + root, e);
        }

        FileChannel lockChannel = null;
        FileLock lock = null;
        try {
            if (config.lockStorage()) {
                lockChannel = FileChannel.open(root.resolve(LOCK_FILE),
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                lock = acquireLock(lockChannel, root);
            }

            Path descriptorFile = root.resolve(CollectionDescriptor.FILE_NAME);
            Path logFile = root.resolve(RecordLog.FILE_NAME);
            Files.deleteIfExists(logFile.resolveSibling(logFile.getFileName() + ".tmp"));

            CollectionDescriptor descriptor;
            if (Files.exists(descriptorFile)) {
                descriptor = CollectionDescriptor.read(descriptorFile);
                if (descriptor.dimensions() != config.dimensions()) {
                    throw new DimensionMismatchException(descriptor.dimensions(), config.dimensions());
                }
            } else if (Files.exists(logFile)) {
                throw new CorruptCollectionException(descriptorFile, "descriptor missing next to existing record log");
            } else {
                descriptor = CollectionDescriptor.create(config.name(), config.dimensions());
                descriptor.write(descriptorFile);
                log.info("Created collection '{}' at {} ({}d)", descriptor.name(), root, descriptor.dimensions());
            }

            Map<String, ChunkRecord> records = new LinkedHashMap<>();
            RecordLog recordLog;
            if (Files.exists(logFile)) {
                recordLog = RecordLog.open(logFile, descriptor.dimensions(), new RecordLog.Replay() {
                    @Override
                    public void put(ChunkRecord record) {
                        records.remove(record.id());
                        records.put(record.id(), record);
                    }

                    @Override
                    public void delete(String id) {
                        records.remove(id);
                    }
                });
            } else {
                recordLog = RecordLog.create(logFile, descriptor.dimensions());
            }

            PersistentCollection collection = new PersistentCollection(root, descriptor,
                config.compactionThreshold(), records, recordLog, lockChannel, lock);
            log.info("Opened collection '{}' at {}: {} records, {} log frames",
                descriptor.name(), root, records.size(), recordLog.frameCount());
            return collection;
        } catch (IOException e) {
            releaseQuietly(lockChannel, root);
            throw new StorageException("Failed to open collection at " + root, e);
        } catch (RuntimeException e) {
            releaseQuietly(lockChannel, root);
            throw e;
        }
    }

    /**
     * Reads the descriptor of an existing collection without opening it.
     *
     * @throws StorageException if {@code root} holds no collection or cannot be read
     */
    public static CollectionDescriptor readDescriptor(Path root) {
        Path descriptorFile = root.resolve(CollectionDescriptor.FILE_NAME);
        if (!Files.exists(descriptorFile)) {
            throw new StorageException("No collection at " + root);
        }
        try {
            return CollectionDescriptor.read(descriptorFile);
        } catch (IOException e) {
            throw new StorageException("Failed to read " + descriptorFile, e);
        }
    }

    private static FileLock acquireLock(FileChannel channel, Path root) throws IOException {
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            throw new StorageException("Collection at " + root + " is already open in this process");
        }
        if (lock == null) {
            throw new StorageException("Collection at " + root + " is locked by another process");
        }
        return lock;
    }

    private static void releaseQuietly(FileChannel lockChannel, Path root) {
        if (lockChannel == null) {
            return;
        }
        try {
            // closing the channel releases its lock
            lockChannel.close();
        } catch (IOException e) {
            log.warn("Failed to release lock on {}", root, e);
        }
    }

    // ==================== Reads ====================

    public Optional<ChunkRecord> get(String id) {
        ensureOpen();
        return Optional.ofNullable(records.get(id));
    }

    public boolean contains(String id) {
        ensureOpen();
        return records.containsKey(id);
    }

    public int size() {
        ensureOpen();
        return records.size();
    }

    /**
     * Returns the records live at call time, in insertion order.
     *
     * <p>The stream is lazy over a snapshot: later mutations do not affect it.</p>
     */
    public Stream<ChunkRecord> all() {
        ensureOpen();
        return List.copyOf(records.values()).stream();
    }

    // ==================== Mutations ====================

    /**
     * Inserts or replaces a record. Returns once the change is on disk.
     */
    public void put(ChunkRecord record) {
        putAll(List.of(record));
    }

    /**
     * Inserts or replaces records with a single append and flush. A later record
     * with the same id as an earlier one in the list wins.
     */
    public void putAll(Collection<ChunkRecord> batch) {
        ensureOpen();
        if (batch.isEmpty()) {
            return;
        }
        recordLog.appendPuts(batch);
        for (ChunkRecord record : batch) {
            // re-insertion moves a replaced id to the end, matching replay order
            records.remove(record.id());
            records.put(record.id(), record);
        }
        log.debug("Stored {} records in '{}'", batch.size(), descriptor.name());
        maybeCompact();
    }

    /**
     * Removes a record. Missing ids are not an error.
     *
     * @return true if a record existed and was removed
     */
    public boolean remove(String id) {
        return removeAll(List.of(id)) == 1;
    }

    /**
     * Removes every listed id that exists, with a single append and flush.
     *
     * @return number of records removed
     */
    public int removeAll(Collection<String> ids) {
        ensureOpen();
        Set<String> present = new LinkedHashSet<>();
        for (String id : ids) {
            if (records.containsKey(id)) {
                present.add(id);
            }
        }
        if (present.isEmpty()) {
            return 0;
        }
        recordLog.appendDeletes(present);
        present.forEach(records::remove);
        log.debug("Removed {} records from '{}'", present.size(), descriptor.name());
        maybeCompact();
        return present.size();
    }

    /**
     * Removes every record matching {@code predicate}.
     *
     * @return number of records removed, 0 when nothing matches
     */
    public int removeWhere(Predicate<ChunkRecord> predicate) {
        ensureOpen();
        List<String> matching = new ArrayList<>();
        for (ChunkRecord record : records.values()) {
            if (predicate.test(record)) {
                matching.add(record.id());
            }
        }
        return removeAll(matching);
    }

    /**
     * Drops every record by replacing the log with an empty one.
     *
     * @return number of records removed
     */
    public int clear() {
        ensureOpen();
        int removed = records.size();
        recordLog.rewrite(List.of());
        records.clear();
        log.info("Cleared collection '{}' ({} records removed)", descriptor.name(), removed);
        return removed;
    }

    /**
     * Rewrites the log so it holds exactly one frame per live record.
     */
    public void compact() {
        ensureOpen();
        long before = recordLog.sizeBytes();
        long frames = recordLog.frameCount();
        recordLog.rewrite(List.copyOf(records.values()));
        log.info("Compacted collection '{}': {} frames -> {}, {} bytes -> {}",
            descriptor.name(), frames, records.size(), before, recordLog.sizeBytes());
    }

    private void maybeCompact() {
        long dead = deadFrames();
        if (dead > Math.max(compactionThreshold, records.size())) {
            // the mutation is already durable; a failed rewrite leaves the old log in place
            try {
                compact();
            } catch (StorageException e) {
                log.warn("Automatic compaction of '{}' failed, keeping {} dead frames: {}",
                    descriptor.name(), dead, e.getMessage());
            }
        }
    }

    // ==================== Metadata ====================

    /**
     * Number of log frames that no longer describe a live record.
     */
    public long deadFrames() {
        return recordLog.frameCount() - records.size();
    }

    /**
     * Bytes currently used by the record log.
     */
    public long sizeBytes() {
        return recordLog.sizeBytes();
    }

    public Path root() {
        return root;
    }

    public CollectionDescriptor descriptor() {
        return descriptor;
    }

    public int dimensions() {
        return descriptor.dimensions();
    }

    public String name() {
        return descriptor.name();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Forces and closes the log and releases the process lock. Idempotent.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            recordLog.close();
        } catch (IOException e) {
            throw new StorageException("Failed to close record log of " + root, e);
        } finally {
            if (lock != null) {
                try {
                    lock.release();
                } catch (IOException e) {
                    log.warn("Failed to release lock on {}", root, e);
                }
            }
            releaseQuietly(lockChannel, root);
        }
        log.info("Closed collection '{}' at {}", descriptor.name(), root);
    }

    private void ensureOpen() {
        if (closed) {
            throw new StorageException("Collection at " + root + " is closed");
        }
    }
}
