package tickstore.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.future.ListenableFuture;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Deterministic in-memory storage for simulation and tests.
 * <p>
 * Operations are queued and completed from {@link #tick()} after a configurable number of
 * ticks. Failures can be injected either randomly, with a seeded {@link Random}, or exactly with
 * {@link #failNextCommits(int)}. A failed commit leaves the stored data untouched.
 * <p>
 * The stored map outlives any component that uses this storage, so building a new component on
 * the same instance behaves like a process restart over durable data.
 */
public class SimulatedStorage implements Storage {

    private static final Logger log = LoggerFactory.getLogger(SimulatedStorage.class);

    private final Map<BytesKey, VersionedValue> dataStore = new HashMap<>();
    private final List<PendingOperation> pendingOperations = new ArrayList<>();
    private final Random random;
    private final int delayTicks;
    private final double failureProbability;

    private long currentTick = 0;
    private int commitFailuresToInject = 0;

    public SimulatedStorage(Random random) {
        this(random, 0, 0.0);
    }

    /**
     * @param random             seeded source of randomness for failure injection
     * @param delayTicks         ticks before an operation completes; 0 or 1 completes on the next tick
     * @param failureProbability probability in [0, 1] that any single operation fails
     */
    public SimulatedStorage(Random random, int delayTicks, double failureProbability) {
        if (random == null) {
            throw new IllegalArgumentException("Random generator cannot be null");
        }
        if (delayTicks < 0) {
            throw new IllegalArgumentException("Delay ticks cannot be negative");
        }
        if (failureProbability < 0.0 || failureProbability > 1.0) {
            throw new IllegalArgumentException("Failure probability must be between 0 and 1");
        }
        this.random = random;
        this.delayTicks = delayTicks;
        this.failureProbability = failureProbability;
    }

    @Override
    public ListenableFuture<VersionedValue> get(byte[] key) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        BytesKey bytesKey = new BytesKey(key);
        ListenableFuture<VersionedValue> future = new ListenableFuture<>();
        schedule(future, false, () -> future.complete(dataStore.get(bytesKey)));
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
        BytesKey bytesKey = new BytesKey(key);
        ListenableFuture<Boolean> future = new ListenableFuture<>();
        schedule(future, false, () -> {
            dataStore.put(bytesKey, value);
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
        schedule(future, true, () -> {
            Map<BytesKey, VersionedValue> staged;
            try {
                staged = batch.resolve(dataStore::get, currentTick);
            } catch (StorageException e) {
                future.fail(e);
                return;
            }
            staged.forEach((key, value) -> {
                if (value == null) {
                    dataStore.remove(key);
                } else {
                    dataStore.put(key, value);
                }
            });
            future.complete(true);
        });
        return future;
    }

    private void schedule(ListenableFuture<?> future, boolean isCommit, Runnable action) {
        long completionTick = currentTick + Math.max(1, delayTicks);
        pendingOperations.add(new PendingOperation(completionTick, isCommit, action, future));
    }

    @Override
    public void tick() {
        currentTick++;
        List<PendingOperation> ready = new ArrayList<>();
        Iterator<PendingOperation> iterator = pendingOperations.iterator();
        while (iterator.hasNext()) {
            PendingOperation operation = iterator.next();
            if (operation.completionTick() <= currentTick) {
                ready.add(operation);
                iterator.remove();
            }
        }
        for (PendingOperation operation : ready) {
            try {
                if (shouldFail(operation)) {
                    operation.future().fail(new StorageException("Simulated storage failure at tick " + currentTick));
                } else {
                    operation.action().run();
                }
            } catch (RuntimeException e) {
                failOrLog(operation.future(), e);
            }
        }
    }

    /**
     * Fails the operation if it is still pending. Otherwise the error came from a completion
     * callback; it is logged and the remaining operations of the tick still run.
     */
    private void failOrLog(ListenableFuture<?> future, RuntimeException error) {
        if (future.isPending()) {
            try {
                future.fail(error);
                return;
            } catch (RuntimeException callbackError) {
                error = callbackError;
            }
        }
        log.error("Completion callback of a storage operation failed at tick {}", currentTick, error);
    }

    private boolean shouldFail(PendingOperation operation) {
        if (operation.isCommit() && commitFailuresToInject > 0) {
            commitFailuresToInject--;
            return true;
        }
        return failureProbability > 0.0 && random.nextDouble() < failureProbability;
    }

    /**
     * Makes the next {@code count} batch commits fail without applying any of their operations.
     */
    public void failNextCommits(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Count cannot be negative");
        }
        this.commitFailuresToInject = count;
    }

    public int getPendingOperationCount() {
        return pendingOperations.size();
    }

    public long getCurrentTick() {
        return currentTick;
    }

    /**
     * Number of keys currently stored, for inspection in tests.
     */
    public int size() {
        return dataStore.size();
    }

    private record PendingOperation(long completionTick, boolean isCommit, Runnable action,
                                    ListenableFuture<?> future) {
    }
}
