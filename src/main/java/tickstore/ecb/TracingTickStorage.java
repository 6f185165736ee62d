package tickstore.ecb;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tickstore.future.ListenableFuture;
import tickstore.messaging.MessageDescriptor;
import tickstore.txpool.TransactionPool;

import java.util.List;
import java.util.function.Supplier;

/**
 * Decorates a {@link TickStorage} with one span per protocol operation.
 * <p>
 * A span starts when the operation is called and ends when its future resolves. Durations and
 * failures go to the log and to {@link TickSpanMetrics}. Results and errors are passed through
 * untouched.
 */
public class TracingTickStorage implements TickStorage {

    private static final Logger log = LoggerFactory.getLogger(TracingTickStorage.class);

    public static final String SPAN_TICK_NUMBERS = "ecb.tick.numbers";
    public static final String SPAN_START = "ecb.tick.start";
    public static final String SPAN_FINALIZE = "ecb.tick.finalize";
    public static final String SPAN_RECOVER = "ecb.tick.recover";

    private final TickStorage delegate;
    private final TickSpanMetrics metrics;

    public TracingTickStorage(TickStorage delegate) {
        this(delegate, new TickSpanMetrics());
    }

    public TracingTickStorage(TickStorage delegate, TickSpanMetrics metrics) {
        if (delegate == null || metrics == null) {
            throw new IllegalArgumentException("Delegate and metrics cannot be null");
        }
        this.delegate = delegate;
        this.metrics = metrics;
    }

    @Override
    public ListenableFuture<TickNumbers> getTickNumbers() {
        return trace(SPAN_TICK_NUMBERS, delegate::getTickNumbers);
    }

    @Override
    public ListenableFuture<Void> startNextTick(List<MessageDescriptor<?>> descriptors, TransactionPool pool) {
        return trace(SPAN_START, () -> delegate.startNextTick(descriptors, pool));
    }

    @Override
    public ListenableFuture<Void> finalizeTick() {
        return trace(SPAN_FINALIZE, delegate::finalizeTick);
    }

    @Override
    public ListenableFuture<TransactionPool> recover(List<MessageDescriptor<?>> descriptors) {
        return trace(SPAN_RECOVER, () -> delegate.recover(descriptors));
    }

    private <T> ListenableFuture<T> trace(String span, Supplier<ListenableFuture<T>> operation) {
        long startNanos = System.nanoTime();
        log.trace("Span {} started", span);
        ListenableFuture<T> future;
        try {
            future = operation.get();
        } catch (RuntimeException e) {
            metrics.record(span, System.nanoTime() - startNanos, true);
            log.error("Span {} failed: {}", span, e.getMessage(), e);
            throw e;
        }
        future.onSuccess(result -> {
            long elapsed = System.nanoTime() - startNanos;
            metrics.record(span, elapsed, false);
            log.debug("Span {} finished in {} us", span, elapsed / 1_000);
        }).onFailure(error -> {
            long elapsed = System.nanoTime() - startNanos;
            metrics.record(span, elapsed, true);
            log.error("Span {} failed after {} us: {}", span, elapsed / 1_000, error.getMessage(), error);
        });
        return future;
    }

    public TickSpanMetrics getMetrics() {
        return metrics;
    }
}
