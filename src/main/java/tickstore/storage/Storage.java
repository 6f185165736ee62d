package tickstore.storage;

import tickstore.future.ListenableFuture;

/**
 * Interface for asynchronous, transactional key-value storage operations.
 * All operations return ListenableFuture to support non-blocking I/O
 * in the single-threaded event loop.
 */
public interface Storage {

    /**
     * Retrieves a value for the given key.
     *
     * @param key the key to retrieve
     * @return a future containing the versioned value, or null if the key was never written
     */
    ListenableFuture<VersionedValue> get(byte[] key);

    /**
     * Stores a value for the given key.
     *
     * @param key the key to store
     * @param value the versioned value to store
     * @return a future containing true if successful
     */
    ListenableFuture<Boolean> set(byte[] key, VersionedValue value);

    /**
     * Applies every operation of the batch atomically: either all of them become visible
     * or, if the future fails, none of them do. Operations are applied in queue order.
     *
     * @param batch the batch to apply; it must not have been submitted before
     * @return a future containing true once the batch is durable
     */
    ListenableFuture<Boolean> commit(StorageBatch batch);

    /**
     * Advances the storage by one tick.
     * This method processes pending operations and completes their futures.
     * Should be called by the event loop.
     */
    void tick();
}
