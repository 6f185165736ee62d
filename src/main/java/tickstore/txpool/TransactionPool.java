package tickstore.txpool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * The transactions submitted for one tick, grouped by message type id.
 * <p>
 * Within a type, transactions keep their submission order. The pool is safe to fill from
 * submitting threads while the tick loop drains it with {@link #copyAndClear()}.
 */
public class TransactionPool {

    private final Map<String, List<TxData>> transactionsByType = new LinkedHashMap<>();
    private int size;

    /**
     * Appends a transaction under the given message type.
     *
     * @return the hash of the source transaction
     */
    public synchronized String addTransaction(String messageTypeId, Object payload, SignedTransaction tx) {
        if (messageTypeId == null || messageTypeId.isBlank()) {
            throw new IllegalArgumentException("Message type id cannot be null or blank");
        }
        if (tx == null) {
            throw new IllegalArgumentException("Source transaction cannot be null");
        }
        String txHash = tx.hash();
        transactionsByType.computeIfAbsent(messageTypeId, k -> new ArrayList<>())
                .add(new TxData(payload, txHash, tx));
        size++;
        return txHash;
    }

    /**
     * Returns the transactions of the given type in submission order; empty if there are none.
     */
    public synchronized List<TxData> forType(String messageTypeId) {
        List<TxData> transactions = transactionsByType.get(messageTypeId);
        return transactions == null ? List.of() : List.copyOf(transactions);
    }

    public synchronized Set<String> messageTypeIds() {
        return new LinkedHashSet<>(transactionsByType.keySet());
    }

    /**
     * Moves every transaction into a new pool and leaves this one empty.
     */
    public synchronized TransactionPool copyAndClear() {
        TransactionPool copy = new TransactionPool();
        transactionsByType.forEach((type, transactions) ->
                copy.transactionsByType.put(type, new ArrayList<>(transactions)));
        copy.size = size;
        transactionsByType.clear();
        size = 0;
        return copy;
    }

    public synchronized int size() {
        return size;
    }

    public synchronized boolean isEmpty() {
        return size == 0;
    }

    private synchronized Map<String, List<TxData>> snapshot() {
        Map<String, List<TxData>> copy = new LinkedHashMap<>();
        transactionsByType.forEach((type, transactions) -> copy.put(type, List.copyOf(transactions)));
        return copy;
    }

    /**
     * Two pools are equal when they hold the same transactions per type in the same order.
     * The order in which types were first seen does not matter.
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TransactionPool other)) return false;
        return snapshot().equals(other.snapshot());
    }

    @Override
    public int hashCode() {
        return Objects.hash(snapshot());
    }

    @Override
    public String toString() {
        Map<String, Integer> counts = new LinkedHashMap<>();
        snapshot().forEach((type, transactions) -> counts.put(type, transactions.size()));
        return "TransactionPool" + counts;
    }
}
