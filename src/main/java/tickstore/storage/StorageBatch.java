package tickstore.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * An ordered set of write commands that a {@link Storage} applies as one all-or-nothing unit.
 * <p>
 * Commands are applied in the order they were queued, so a later command on the same key sees
 * the effect of an earlier one. A batch is built locally and becomes read-only once it has been
 * handed to {@link Storage#commit(StorageBatch)}; it cannot be submitted twice.
 */
public final class StorageBatch {

    public enum OperationType {
        SET,
        DELETE,
        /** Adds one to an unsigned decimal counter, treating an absent key as zero. */
        INCREMENT
    }

    /**
     * A single queued command. {@code value} is only present for {@link OperationType#SET}.
     */
    public record Operation(OperationType type, BytesKey key, VersionedValue value) {
        public Operation {
            if (type == null || key == null) {
                throw new IllegalArgumentException("Operation type and key cannot be null");
            }
            if (type == OperationType.SET && value == null) {
                throw new IllegalArgumentException("SET operation requires a value");
            }
        }
    }

    private final List<Operation> operations = new ArrayList<>();
    private boolean submitted;

    public StorageBatch set(byte[] key, VersionedValue value) {
        return add(OperationType.SET, key, value);
    }

    public StorageBatch delete(byte[] key) {
        return add(OperationType.DELETE, key, null);
    }

    public StorageBatch increment(byte[] key) {
        return add(OperationType.INCREMENT, key, null);
    }

    private StorageBatch add(OperationType type, byte[] key, VersionedValue value) {
        if (key == null) {
            throw new IllegalArgumentException("Key cannot be null");
        }
        if (submitted) {
            throw new IllegalStateException("Batch was already submitted");
        }
        operations.add(new Operation(type, new BytesKey(key), value));
        return this;
    }

    /**
     * Marks the batch as handed over to a storage backend. Called by backends from
     * {@link Storage#commit(StorageBatch)}.
     *
     * @throws IllegalStateException if the batch was already submitted
     */
    public void markSubmitted() {
        if (submitted) {
            throw new IllegalStateException("Batch was already submitted");
        }
        submitted = true;
    }

    /**
     * Resolves the batch against the current contents of a store into the final value of every
     * key it touches, in first-touch order. A {@code null} value in the result means the key is
     * deleted. Nothing is written; the caller applies the result in one step.
     *
     * @param currentValue reads the committed value of a key, {@code null} when absent
     * @param timestamp    timestamp given to counter values written by increments
     * @throws StorageException if an increment meets a value that is not a counter
     */
    public Map<BytesKey, VersionedValue> resolve(Function<BytesKey, VersionedValue> currentValue, long timestamp) {
        Map<BytesKey, VersionedValue> staged = new LinkedHashMap<>();
        for (Operation operation : operations) {
            BytesKey key = operation.key();
            switch (operation.type()) {
                case SET -> staged.put(key, operation.value());
                case DELETE -> staged.put(key, null);
                case INCREMENT -> {
                    VersionedValue current = staged.containsKey(key) ? staged.get(key) : currentValue.apply(key);
                    staged.put(key, new VersionedValue(CounterCodec.encode(CounterCodec.next(current)), timestamp));
                }
            }
        }
        return staged;
    }

    public boolean isSubmitted() {
        return submitted;
    }

    public List<Operation> operations() {
        return Collections.unmodifiableList(operations);
    }

    public int size() {
        return operations.size();
    }

    public boolean isEmpty() {
        return operations.isEmpty();
    }

    @Override
    public String toString() {
        return "StorageBatch{operations=" + operations.size() + ", submitted=" + submitted + '}';
    }
}
