package tickstore.ecb;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Collects call counts and durations per span name.
 * Thread-safe, so a monitoring thread can snapshot while the tick loop records.
 */
public final class TickSpanMetrics {

    private final ConcurrentHashMap<String, Counters> spans = new ConcurrentHashMap<>();

    void record(String name, long elapsedNanos, boolean failed) {
        Counters counters = spans.computeIfAbsent(name, k -> new Counters());
        counters.calls.incrementAndGet();
        if (failed) {
            counters.failures.incrementAndGet();
        }
        counters.totalNanos.addAndGet(elapsedNanos);
        counters.maxNanos.accumulateAndGet(elapsedNanos, Math::max);
    }

    /**
     * @return stats for the span, or null if it was never recorded
     */
    public SpanStats get(String name) {
        Counters counters = spans.get(name);
        return counters == null ? null : counters.snapshot(name);
    }

    public List<SpanStats> snapshot() {
        return spans.entrySet().stream()
                .map(entry -> entry.getValue().snapshot(entry.getKey()))
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .collect(Collectors.toList());
    }

    public Map<String, Long> failureCounts() {
        return spans.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue().failures.get()));
    }

    private static final class Counters {
        private final AtomicLong calls = new AtomicLong();
        private final AtomicLong failures = new AtomicLong();
        private final AtomicLong totalNanos = new AtomicLong();
        private final AtomicLong maxNanos = new AtomicLong();

        SpanStats snapshot(String name) {
            return new SpanStats(name, calls.get(), failures.get(), totalNanos.get(), maxNanos.get());
        }
    }
}
