package tickstore.storage;

import org.rocksdb.Options;
import org.rocksdb.RocksDB;
import org.rocksdb.RocksDBException;
import org.rocksdb.WriteBatch;
import org.rocksdb.WriteOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.future.ListenableFuture;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Durable {@link Storage} backed by RocksDB.
 * <p>
 * Operations are queued by the caller and executed in submission order on the next
 * {@link #tick()}, so futures always complete on the event loop thread. Batch commits are
 * written as a single RocksDB {@link WriteBatch} with a synced write, which gives the
 * all-or-nothing guarantee {@link Storage#commit(StorageBatch)} requires across crashes.
 * <p>
 * Values are stored as an 8 byte big-endian timestamp followed by the raw value bytes.
 */
public class RocksDbStorage implements Storage, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RocksDbStorage.class);
    private static final int TIMESTAMP_BYTES = Long.BYTES;

    static {
        RocksDB.loadLibrary();
    }

    private final String path;
    private final Options options;
    private final WriteOptions writeOptions;
    private final RocksDB db;
    private final List<PendingOperation> pendingOperations = new ArrayList<>();
    private boolean closed;

    /**
     * Opens (or creates) a database in the given directory.
     *
     * @throws StorageException if the database cannot be opened
     */
    public RocksDbStorage(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be null or blank");
        }
        this.path = path;
        this.options = new Options().setCreateIfMissing(true);
        this.writeOptions = new WriteOptions().setSync(true);
        try {
            this.db = RocksDB.open(options, path);
        } catch (RocksDBException e) {
            writeOptions.close();
            options.close();
            throw new StorageException("Failed to open RocksDB at " + path, e);
        }
        log.info("Opened RocksDB storage at {}", path);
    }

    @Override
    public ListenableFuture<VersionedValue> get(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        byte[] keyCopy = key.clone();
        ListenableFuture<VersionedValue> future = new ListenableFuture<>();
        enqueue(future, () -> future.complete(read(keyCopy)));
        return future;
    }

    @Override
    public ListenableFuture<Boolean> set(byte[] key, VersionedValue value) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value cannot be null");
        }
        byte[] keyCopy = key.clone();
        ListenableFuture<Boolean> future = new ListenableFuture<>();
        enqueue(future, () -> {
            db.put(writeOptions, keyCopy, serialize(value));
            future.complete(true);
        });
        return future;
    }

    @Override
    public ListenableFuture<Boolean> commit(StorageBatch batch) {
        if (batch == null) {
            throw new IllegalArgumentException("Batch cannot be null");
        }
        batch.markSubmitted();
        ListenableFuture<Boolean> future = new ListenableFuture<>();
        enqueue(future, () -> {
            Map<BytesKey, VersionedValue> staged = batch.resolve(key -> readUnchecked(key.bytes()),
                    System.currentTimeMillis());
            try (WriteBatch writeBatch = new WriteBatch()) {
                for (Map.Entry<BytesKey, VersionedValue> entry : staged.entrySet()) {
                    if (entry.getValue() == null) {
                        writeBatch.delete(entry.getKey().bytes());
                    } else {
                        writeBatch.put(entry.getKey().bytes(), serialize(entry.getValue()));
                    }
                }
                db.write(writeOptions, writeBatch);
            }
            log.debug("Committed batch of {} operations touching {} keys", batch.size(), staged.size());
            future.complete(true);
        });
        return future;
    }

    private void enqueue(ListenableFuture<?> future, StorageAction action) {
        if (closed) {
            future.fail(new StorageException("Storage at " + path + " is closed"));
            return;
        }
        pendingOperations.add(new PendingOperation(action, future));
    }

    @Override
    public void tick() {
        if (pendingOperations.isEmpty()) {
            return;
        }
        List<PendingOperation> ready = new ArrayList<>(pendingOperations);
        pendingOperations.clear();
        for (PendingOperation operation : ready) {
            try {
                execute(operation);
            } catch (RuntimeException e) {
                failOrLog(operation.future(), e);
            }
        }
    }

    private void execute(PendingOperation operation) {
        if (closed) {
            operation.future().fail(new StorageException("Storage at " + path + " is closed"));
            return;
        }
        try {
            operation.action().run();
        } catch (RocksDBException e) {
            operation.future().fail(new StorageException("RocksDB operation failed", e));
        }
    }

    /**
     * Fails the operation if it is still pending. Otherwise the error came from a completion
     * callback; it is logged and the remaining operations of the tick still run.
     */
    private static void failOrLog(ListenableFuture<?> future, RuntimeException error) {
        if (future.isPending()) {
            try {
                future.fail(error instanceof StorageException ? error : new StorageException("Storage operation failed", error));
                return;
            } catch (RuntimeException callbackError) {
                error = callbackError;
            }
        }
        log.error("Completion callback of a storage operation failed", error);
    }

    private VersionedValue read(byte[] key) throws RocksDBException {
        byte[] stored = db.get(key);
        return stored == null ? null : deserialize(stored);
    }

    private VersionedValue readUnchecked(byte[] key) {
        try {
            return read(key);
        } catch (RocksDBException e) {
            throw new StorageException("Failed to read key during batch commit", e);
        }
    }

    static byte[] serialize(VersionedValue value) {
        byte[] data = value.value();
        return ByteBuffer.allocate(TIMESTAMP_BYTES + data.length)
                .putLong(value.timestamp())
                .put(data)
                .array();
    }

    static VersionedValue deserialize(byte[] stored) {
        if (stored.length < TIMESTAMP_BYTES) {
            throw new StorageException("Stored value is truncated: " + stored.length + " bytes");
        }
        ByteBuffer buffer = ByteBuffer.wrap(stored);
        long timestamp = buffer.getLong();
        byte[] data = new byte[buffer.remaining()];
        buffer.get(data);
        return new VersionedValue(data, timestamp);
    }

    /**
     * Closes the database. Operations still queued fail with a {@link StorageException},
     * which is what a crash looks like to their callers. Safe to call more than once.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<PendingOperation> abandoned = new ArrayList<>(pendingOperations);
        pendingOperations.clear();
        abandoned.forEach(operation ->
                failOrLog(operation.future(), new StorageException("Storage at " + path + " is closed")));
        db.close();
        writeOptions.close();
        options.close();
        log.info("Closed RocksDB storage at {}", path);
    }

    public String getPath() {
        return path;
    }

    @FunctionalInterface
    private interface StorageAction {
        void run() throws RocksDBException;
    }

    private record PendingOperation(StorageAction action, ListenableFuture<?> future) {
    }
}
