package tickstore.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.ecb.TickStorage;
import tickstore.future.ListenableFuture;
import tickstore.messaging.MessageDescriptor;
import tickstore.messaging.MessageRegistry;
import tickstore.txpool.TransactionPool;

import java.util.List;

/**
 * Runs the tick protocol around a {@link TickSimulation}.
 * <p>
 * {@link #startup()} checks the durable counters once and, if the previous process stopped in
 * the middle of a tick, recovers that tick's transactions, simulates it again and finalizes it.
 * After that every {@link #runTick()} drains the incoming transaction pool and performs
 * start, simulate and finalize for one tick.
 * <p>
 * Only one tick is processed at a time. Any failure is fatal for the driver: it moves to
 * {@link State#FAILED} and refuses further ticks, because skipping a tick would break the
 * atomicity of the durable tick history. Restarting the process recovers the interrupted tick.
 * <p>
 * Like other loop components the driver can be advanced with {@link #tick()}, which starts the
 * next game tick whenever the previous one has completed.
 */
public class TickDriver {

    private static final Logger log = LoggerFactory.getLogger(TickDriver.class);

    public enum State { NEW, STARTING, IDLE, RUNNING, FAILED }

    private final TickStorage tickStorage;
    private final MessageRegistry registry;
    private final TickSimulation simulation;
    private final TransactionPool incoming;
    private final TickManager tickManager;

    private State state = State.NEW;
    private Throwable failure;

    public TickDriver(TickStorage tickStorage, MessageRegistry registry, TickSimulation simulation,
                      TransactionPool incoming) {
        this(tickStorage, registry, simulation, incoming, new TickManager());
    }

    public TickDriver(TickStorage tickStorage, MessageRegistry registry, TickSimulation simulation,
                      TransactionPool incoming, TickManager tickManager) {
        if (tickStorage == null || registry == null || simulation == null || incoming == null || tickManager == null) {
            throw new IllegalArgumentException("TickStorage, registry, simulation, incoming pool and tick manager must be non-null");
        }
        this.tickStorage = tickStorage;
        this.registry = registry;
        this.simulation = simulation;
        this.incoming = incoming;
        this.tickManager = tickManager;
    }

    /**
     * Reads the counters and completes an interrupted tick if there is one.
     *
     * @return a future with the last completed tick once the driver is ready
     */
    public ListenableFuture<Long> startup() {
        if (state != State.NEW) {
            return ListenableFuture.failed(new IllegalStateException("Driver already started, state " + state));
        }
        state = State.STARTING;
        ListenableFuture<Long> ready = tickStorage.getTickNumbers().flatMap(numbers -> {
            tickManager.syncWith(numbers);
            if (!numbers.isTickInFlight()) {
                log.info("No interrupted tick, last completed tick is {}", Long.toUnsignedString(numbers.end()));
                return ListenableFuture.completed(numbers.end());
            }
            long tick = tickManager.getCurrentTick();
            log.warn("Tick {} was started but never finalized, recovering it", tick);
            List<MessageDescriptor<?>> descriptors = registry.descriptors();
            return tickStorage.recover(descriptors)
                    .flatMap(pool -> simulateAndFinalize(tick, pool));
        });
        return track(ready);
    }

    /**
     * Runs one complete tick with the transactions submitted since the previous one.
     *
     * @return a future with the number of the completed tick
     */
    public ListenableFuture<Long> runTick() {
        if (state != State.IDLE) {
            return ListenableFuture.failed(new IllegalStateException("Cannot run a tick in state " + state));
        }
        state = State.RUNNING;
        long tick = tickManager.beginTick();
        TransactionPool pool = incoming.copyAndClear();
        ListenableFuture<Long> done = tickStorage.startNextTick(registry.descriptors(), pool)
                .flatMap(started -> simulateAndFinalize(tick, pool));
        return track(done);
    }

    private ListenableFuture<Long> simulateAndFinalize(long tick, TransactionPool pool) {
        try {
            simulation.simulate(tick, pool);
        } catch (RuntimeException e) {
            return ListenableFuture.failed(new IllegalStateException("Simulation of tick " + tick + " failed", e));
        }
        return tickStorage.finalizeTick().map(finalized -> {
            long completed = tickManager.completeTick();
            log.debug("Completed tick {} with {} transactions", completed, pool.size());
            return completed;
        });
    }

    private ListenableFuture<Long> track(ListenableFuture<Long> future) {
        return future.onSuccess(tick -> state = State.IDLE).onFailure(error -> {
            state = State.FAILED;
            failure = error;
            log.error("Tick processing failed at tick {}, no further ticks will run", tickManager.getCurrentTick(), error);
        });
    }

    /**
     * Starts the next tick if the driver is idle; otherwise does nothing.
     */
    public void tick() {
        if (state == State.IDLE) {
            runTick();
        }
    }

    public State getState() {
        return state;
    }

    public boolean isFailed() {
        return state == State.FAILED;
    }

    /**
     * @return the error that stopped the driver, or null if it has not failed
     */
    public Throwable getFailure() {
        return failure;
    }

    public TickManager getTickManager() {
        return tickManager;
    }

    public TransactionPool getIncomingPool() {
        return incoming;
    }
}
