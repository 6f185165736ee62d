package tickstore.ecb;

/**
 * Immutable snapshot of the counters kept for one traced span name.
 */
public record SpanStats(String name, long calls, long failures, long totalNanos, long maxNanos) {

    public double averageMillis() {
        return calls == 0 ? 0.0 : totalNanos / (double) calls / 1_000_000.0;
    }
}
