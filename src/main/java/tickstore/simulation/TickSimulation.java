package tickstore.simulation;

import tickstore.txpool.TransactionPool;

/**
 * The game logic run once per tick. It reads the tick's transactions and records the resulting
 * state changes in the entity command buffer it was built with.
 * <p>
 * It must be deterministic in its inputs: a recovered tick is simulated again with the same
 * transactions and must produce the same changes.
 */
@FunctionalInterface
public interface TickSimulation {

    TickSimulation NO_OP = (tick, pool) -> { };

    void simulate(long tick, TransactionPool pool);
}
