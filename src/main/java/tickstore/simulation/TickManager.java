package tickstore.simulation;

import tickstore.ecb.TickNumbers;

/**
 * Single source of truth for the tick loop's notion of time: the last tick that was
 * completed and, while one is being processed, the tick in progress.
 * <p>
 * It mirrors the durable counters, it does not replace them; it is synchronised from
 * {@link TickNumbers} at startup.
 */
public final class TickManager {

    private long lastCompletedTick = 0;
    private boolean tickInProgress = false;

    /**
     * Aligns with the durable counters: the last completed tick is {@code end}.
     */
    public void syncWith(TickNumbers numbers) {
        this.lastCompletedTick = numbers.end();
        this.tickInProgress = numbers.isTickInFlight();
    }

    /**
     * Marks the next tick as in progress and returns its number.
     *
     * @throws IllegalStateException if a tick is already in progress
     */
    public long beginTick() {
        if (tickInProgress) {
            throw new IllegalStateException("Tick " + (lastCompletedTick + 1) + " is already in progress");
        }
        tickInProgress = true;
        return lastCompletedTick + 1;
    }

    /**
     * Marks the tick in progress as completed and returns its number.
     *
     * @throws IllegalStateException if no tick is in progress
     */
    public long completeTick() {
        if (!tickInProgress) {
            throw new IllegalStateException("No tick in progress");
        }
        tickInProgress = false;
        return ++lastCompletedTick;
    }

    public long getLastCompletedTick() {
        return lastCompletedTick;
    }

    public boolean isTickInProgress() {
        return tickInProgress;
    }

    /**
     * Number of the tick in progress, or of the next tick to start.
     */
    public long getCurrentTick() {
        return lastCompletedTick + 1;
    }
}
