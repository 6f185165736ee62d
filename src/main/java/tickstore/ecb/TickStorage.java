package tickstore.ecb;

import tickstore.future.ListenableFuture;
import tickstore.messaging.MessageDescriptor;
import tickstore.txpool.TransactionPool;

import java.util.List;

/**
 * The tick commit protocol.
 * <p>
 * A tick is made durable in two steps. {@link #startNextTick} journals the tick's transactions
 * and advances the start counter in one atomic write; {@link #finalizeTick} writes the state
 * changes the simulation produced and advances the end counter in another. If the process dies
 * between the two, {@link #getTickNumbers()} reports start ahead of end and {@link #recover}
 * returns the journaled transactions so the tick can be simulated again and finalized.
 * <p>
 * Operations must be issued one at a time by a single writer, each after the previous one's
 * future resolved.
 */
public interface TickStorage {

    /**
     * Reads the start and end counters. Counters that were never written read as zero.
     */
    ListenableFuture<TickNumbers> getTickNumbers();

    /**
     * Journals the pool's transactions and increments the start counter, atomically.
     *
     * @param descriptors every message type known to the simulation; the journal groups
     *                    transactions by type in this order
     * @param pool        the transactions of the tick being started, possibly empty
     */
    ListenableFuture<Void> startNextTick(List<MessageDescriptor<?>> descriptors, TransactionPool pool);

    /**
     * Writes all state changes buffered since the tick started and increments the end counter,
     * atomically. Buffered changes are dropped only once the write succeeded.
     */
    ListenableFuture<Void> finalizeTick();

    /**
     * Rebuilds the transaction pool of a tick that was started but never finalized.
     * Only meaningful after {@link #getTickNumbers()} reported a tick in flight.
     *
     * @param descriptors message types used to decode the journaled payloads
     */
    ListenableFuture<TransactionPool> recover(List<MessageDescriptor<?>> descriptors);
}
