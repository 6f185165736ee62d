package tickstore.cmd;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.ecb.EntityCommandBuffer;
import tickstore.ecb.TracingTickStorage;
import tickstore.future.ListenableFuture;
import tickstore.messaging.MessageRegistry;
import tickstore.simulation.TickDriver;
import tickstore.simulation.TickSimulation;
import tickstore.storage.RocksDbStorage;
import tickstore.txpool.SignedTransaction;
import tickstore.txpool.TransactionPool;

import java.util.function.Function;

/**
 * Command-line server application running the tick loop over durable RocksDB storage.
 * <p>
 * On start it loads entity state, recovers a tick the previous process left unfinished, and
 * then runs one game tick per interval until stopped, the tick limit is reached or a tick fails.
 */
public class TickServerApplication {

    private static final Logger log = LoggerFactory.getLogger(TickServerApplication.class);

    private final TickStoreConfig config;
    private final MessageRegistry registry;
    private final Function<EntityCommandBuffer, TickSimulation> simulationFactory;
    private final TransactionPool incoming = new TransactionPool();

    private RocksDbStorage storage;
    private EntityCommandBuffer commandBuffer;
    private TracingTickStorage tickStorage;
    private TickDriver driver;
    private volatile boolean running = false;

    public TickServerApplication(TickStoreConfig config, MessageRegistry registry,
                                 Function<EntityCommandBuffer, TickSimulation> simulationFactory) {
        if (config == null || registry == null || simulationFactory == null) {
            throw new IllegalArgumentException("Config, registry and simulation factory must be non-null");
        }
        this.config = config;
        this.registry = registry;
        this.simulationFactory = simulationFactory;
    }

    /**
     * Opens storage and brings the tick history to a consistent state.
     *
     * @return true if the server is ready to run ticks
     */
    public boolean start() {
        log.info("Starting tick server with storage at {}", config.storagePath());
        try {
            this.storage = new RocksDbStorage(config.storagePath());
            this.commandBuffer = new EntityCommandBuffer(storage);
            this.tickStorage = new TracingTickStorage(commandBuffer);
            this.driver = new TickDriver(tickStorage, registry, simulationFactory.apply(commandBuffer), incoming);

            ListenableFuture<Long> ready = commandBuffer.load().flatMap(loaded -> driver.startup());
            awaitStorage(ready);
            if (ready.isFailed()) {
                log.error("Failed to start tick server", ready.getException());
                closeStorage();
                return false;
            }
            running = true;
            log.info("Tick server started, last completed tick {}", ready.getResult());
            return true;
        } catch (RuntimeException e) {
            log.error("Failed to start tick server", e);
            closeStorage();
            return false;
        }
    }

    private void awaitStorage(ListenableFuture<?> future) {
        while (future.isPending()) {
            storage.tick();
        }
    }

    /**
     * Queues a transaction for the next game tick.
     *
     * @return the transaction hash
     * @throws tickstore.messaging.UnknownMessageTypeException if the message type is not registered
     */
    public String submit(String messageTypeId, Object payload, SignedTransaction tx) {
        registry.get(messageTypeId);
        return incoming.addTransaction(messageTypeId, payload, tx);
    }

    public void runEventLoop() {
        if (!running) {
            log.error("Server not started. Call start() first.");
            return;
        }

        log.info("Starting event loop with tick interval {} ms", config.tickIntervalMs());
        while (running) {
            driver.tick();
            storage.tick();

            if (driver.isFailed()) {
                log.error("Stopping event loop: tick processing failed", driver.getFailure());
                break;
            }
            long completed = driver.getTickManager().getLastCompletedTick();
            if (driver.getState() == TickDriver.State.IDLE) {
                if (completed % config.statusEveryTicks() == 0) {
                    log.info("Completed tick {}, span stats {}", completed, tickStorage.getMetrics().snapshot());
                }
                if (config.maxTicks() > 0 && completed >= config.maxTicks()) {
                    log.info("Reached tick limit {}", config.maxTicks());
                    break;
                }
                try {
                    Thread.sleep(config.tickIntervalMs());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Event loop interrupted, shutting down...");
                    break;
                }
            }
        }
        running = false;
        log.info("Event loop stopped at tick {}", driver.getTickManager().getLastCompletedTick());
    }

    public void stop() {
        log.info("Stopping tick server...");
        running = false;
    }

    /**
     * Closes storage. A tick still in flight is left for recovery by the next start.
     */
    public void close() {
        running = false;
        closeStorage();
    }

    private void closeStorage() {
        if (storage != null) {
            storage.close();
            storage = null;
        }
    }

    public static void main(String[] args) {
        TickStoreConfig config;
        try {
            config = TickStoreConfig.fromArgs(args);
        } catch (IllegalArgumentException e) {
            log.error("Invalid arguments: {}", e.getMessage());
            System.exit(2);
            return;
        }

        TickServerApplication server = new TickServerApplication(config, new MessageRegistry(),
                buffer -> TickSimulation.NO_OP);
        if (!server.start()) {
            System.exit(1);
        }
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
        server.runEventLoop();
        server.close();
        if (server.driver.isFailed()) {
            System.exit(1);
        }
    }

    public TickDriver getDriver() { return driver; }
    public EntityCommandBuffer getCommandBuffer() { return commandBuffer; }
    public TracingTickStorage getTickStorage() { return tickStorage; }
    public boolean isRunning() { return running; }
}
