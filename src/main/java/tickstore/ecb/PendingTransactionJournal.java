package tickstore.ecb;

import tickstore.messaging.MessageCodec;
import tickstore.messaging.MessageCodecException;
import tickstore.messaging.MessageDescriptor;
import tickstore.messaging.MessageRegistry;
import tickstore.messaging.UnknownMessageTypeException;
import tickstore.txpool.TransactionPool;
import tickstore.txpool.TxData;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts a tick's {@link TransactionPool} to the journal value stored under the pending
 * transaction key, and back.
 * <p>
 * Entries are grouped by message type in descriptor order and keep submission order within a
 * type. Each payload is encoded by its own descriptor, then the whole entry list is encoded
 * once with the journal codec.
 */
final class PendingTransactionJournal {

    private final MessageCodec codec;

    PendingTransactionJournal(MessageCodec codec) {
        this.codec = codec;
    }

    /**
     * @throws UnknownMessageTypeException if the pool holds a type none of the descriptors has
     * @throws MessageCodecException       if a payload cannot be encoded by its descriptor
     */
    List<PendingTransaction> toPendingTransactions(List<MessageDescriptor<?>> descriptors, TransactionPool pool) {
        MessageRegistry registry = MessageRegistry.of(descriptors);
        for (String typeId : pool.messageTypeIds()) {
            if (!registry.contains(typeId)) {
                throw new UnknownMessageTypeException(typeId);
            }
        }

        List<PendingTransaction> pending = new ArrayList<>(pool.size());
        for (MessageDescriptor<?> descriptor : registry.descriptors()) {
            for (TxData txData : pool.forType(descriptor.getId())) {
                byte[] data = descriptor.encodeUnchecked(txData.payload());
                pending.add(new PendingTransaction(descriptor.getId(), txData.txHash(), data, txData.tx()));
            }
        }
        return pending;
    }

    byte[] encode(List<PendingTransaction> pending) {
        return codec.encode(pending);
    }

    List<PendingTransaction> decode(byte[] journal) {
        PendingTransaction[] entries = codec.decode(journal, PendingTransaction[].class);
        if (entries == null) {
            throw new MessageCodecException("Pending transaction journal is empty");
        }
        return List.of(entries);
    }

    /**
     * Builds a fresh pool from journal entries, decoding each payload with its descriptor.
     *
     * @throws UnknownMessageTypeException if an entry's type is not in the registry
     * @throws MessageCodecException       if a payload cannot be decoded, or an entry's hash does
     *                                     not match its source transaction
     */
    TransactionPool rebuildPool(List<PendingTransaction> pending, MessageRegistry registry) {
        TransactionPool pool = new TransactionPool();
        for (PendingTransaction entry : pending) {
            MessageDescriptor<?> descriptor = registry.get(entry.typeId());
            Object payload = descriptor.decode(entry.data());
            String txHash = pool.addTransaction(descriptor.getId(), payload, entry.tx());
            if (!txHash.equals(entry.txHash())) {
                throw new MessageCodecException("Journaled hash " + entry.txHash()
                        + " does not match source transaction hash " + txHash);
            }
        }
        return pool;
    }
}
