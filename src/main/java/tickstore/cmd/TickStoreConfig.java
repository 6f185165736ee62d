package tickstore.cmd;

/**
 * Settings of a tick server process.
 *
 * @param storagePath      directory of the RocksDB database
 * @param tickIntervalMs   pause between two game ticks
 * @param maxTicks         number of game ticks to run before stopping, 0 for no limit
 * @param statusEveryTicks how often the event loop logs its progress, in game ticks
 */
public record TickStoreConfig(String storagePath, long tickIntervalMs, long maxTicks, long statusEveryTicks) {

    public static final String DEFAULT_STORAGE_PATH = "data/tickstore";
    public static final long DEFAULT_TICK_INTERVAL_MS = 100;
    public static final long DEFAULT_STATUS_EVERY_TICKS = 100;

    public TickStoreConfig {
        if (storagePath == null || storagePath.isBlank()) {
            throw new IllegalArgumentException("Storage path cannot be null or blank");
        }
        if (tickIntervalMs < 0) {
            throw new IllegalArgumentException("Tick interval cannot be negative");
        }
        if (maxTicks < 0) {
            throw new IllegalArgumentException("Max ticks cannot be negative");
        }
        if (statusEveryTicks <= 0) {
            throw new IllegalArgumentException("Status interval must be positive");
        }
    }

    public static TickStoreConfig defaults() {
        return new TickStoreConfig(DEFAULT_STORAGE_PATH, DEFAULT_TICK_INTERVAL_MS, 0, DEFAULT_STATUS_EVERY_TICKS);
    }

    /**
     * Parses {@code --storage=}, {@code --tick-interval-ms=}, {@code --max-ticks=} and
     * {@code --status-every=} arguments; anything not given keeps its default.
     *
     * @throws IllegalArgumentException for unknown arguments or malformed numbers
     */
    public static TickStoreConfig fromArgs(String[] args) {
        String storagePath = DEFAULT_STORAGE_PATH;
        long tickIntervalMs = DEFAULT_TICK_INTERVAL_MS;
        long maxTicks = 0;
        long statusEveryTicks = DEFAULT_STATUS_EVERY_TICKS;
        for (String arg : args) {
            if (arg.startsWith("--storage=")) storagePath = arg.substring(10);
            else if (arg.startsWith("--tick-interval-ms=")) tickIntervalMs = parseLong(arg, 19);
            else if (arg.startsWith("--max-ticks=")) maxTicks = parseLong(arg, 12);
            else if (arg.startsWith("--status-every=")) statusEveryTicks = parseLong(arg, 15);
            else throw new IllegalArgumentException("Unknown argument: " + arg);
        }
        return new TickStoreConfig(storagePath, tickIntervalMs, maxTicks, statusEveryTicks);
    }

    private static long parseLong(String arg, int valueStart) {
        try {
            return Long.parseLong(arg.substring(valueStart));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number in argument: " + arg, e);
        }
    }
}
