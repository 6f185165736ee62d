package tickstore.txpool;

/**
 * One pooled transaction: the decoded message payload, the hash identifying the
 * source transaction, and the source transaction itself.
 */
public record TxData(Object payload, String txHash, SignedTransaction tx) {

    public TxData {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (txHash == null || txHash.isBlank()) {
            throw new IllegalArgumentException("Transaction hash cannot be null or blank");
        }
        if (tx == null) {
            throw new IllegalArgumentException("Source transaction cannot be null");
        }
    }
}
