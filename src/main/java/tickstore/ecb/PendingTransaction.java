package tickstore.ecb;

import tickstore.txpool.SignedTransaction;

import java.util.Arrays;
import java.util.Objects;

/**
 * One journaled transaction of the in-flight tick: its message type, the hash of its source
 * transaction, the payload as encoded by the message type's own encoder, and the source
 * transaction.
 */
public record PendingTransaction(String typeId, String txHash, byte[] data, SignedTransaction tx) {

    public PendingTransaction {
        Objects.requireNonNull(typeId, "typeId");
        Objects.requireNonNull(txHash, "txHash");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(tx, "tx");
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof PendingTransaction other)) return false;
        return typeId.equals(other.typeId)
                && txHash.equals(other.txHash)
                && Arrays.equals(data, other.data)
                && tx.equals(other.tx);
    }

    @Override
    public int hashCode() {
        return Objects.hash(typeId, txHash, Arrays.hashCode(data), tx);
    }

    @Override
    public String toString() {
        return "PendingTransaction{typeId=" + typeId + ", txHash=" + txHash + ", data=" + data.length + " bytes}";
    }
}
