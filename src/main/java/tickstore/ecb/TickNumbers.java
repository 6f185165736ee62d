package tickstore.ecb;

/**
 * The two durable tick counters as read from storage.
 * <p>
 * {@code start} counts ticks whose inputs were journaled, {@code end} counts ticks whose state
 * changes were committed. Both are unsigned 64-bit values. In every reachable state
 * {@code end <= start <= end + 1}; {@code start == end + 1} means a tick was started and not
 * finalized and must be recovered before a new one starts.
 */
public record TickNumbers(long start, long end) {

    public static final TickNumbers INITIAL = new TickNumbers(0, 0);

    public boolean isTickInFlight() {
        return start != end;
    }

    /**
     * Whether the counters satisfy {@code end <= start <= end + 1} (unsigned).
     */
    public boolean isConsistent() {
        return Long.compareUnsigned(end, start) <= 0 && Long.compareUnsigned(start - end, 1) <= 0;
    }

    TickNumbers afterStart() {
        return new TickNumbers(start + 1, end);
    }

    TickNumbers afterFinalize() {
        return new TickNumbers(start, end + 1);
    }

    @Override
    public String toString() {
        return "TickNumbers{start=" + Long.toUnsignedString(start) + ", end=" + Long.toUnsignedString(end) + '}';
    }
}
