package tickstore.future;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A minimal single-threaded future completed by the event loop.
 * <p>
 * Storage backends hand these out for every operation and complete them from their own
 * {@code tick()}. Callbacks registered after completion run immediately on the caller's thread,
 * callbacks registered before completion run on the thread that completes the future.
 * <p>
 * Composition ({@link #map}, {@link #flatMap}, {@link #mapFailure}) lets multi-step protocols
 * be written as a chain without blocking the loop.
 *
 * @param <T> the result type
 */
public class ListenableFuture<T> {

    private enum State { PENDING, COMPLETED, FAILED }

    private State state = State.PENDING;
    private T result;
    private Throwable exception;

    private final List<Consumer<T>> successCallbacks = new ArrayList<>();
    private final List<Consumer<Throwable>> failureCallbacks = new ArrayList<>();

    public static <T> ListenableFuture<T> completed(T value) {
        ListenableFuture<T> future = new ListenableFuture<>();
        future.complete(value);
        return future;
    }

    public static <T> ListenableFuture<T> failed(Throwable error) {
        ListenableFuture<T> future = new ListenableFuture<>();
        future.fail(error);
        return future;
    }

    /**
     * Completes this future with the given value and notifies success callbacks.
     *
     * @throws IllegalStateException if the future is already completed or failed
     */
    public void complete(T value) {
        List<Consumer<T>> callbacks;
        synchronized (this) {
            if (state != State.PENDING) {
                throw new IllegalStateException("Future already " + state.name().toLowerCase());
            }
            this.result = value;
            this.state = State.COMPLETED;
            callbacks = new ArrayList<>(successCallbacks);
            successCallbacks.clear();
            failureCallbacks.clear();
        }
        callbacks.forEach(callback -> callback.accept(value));
    }

    /**
     * Fails this future with the given error and notifies failure callbacks.
     *
     * @throws IllegalStateException if the future is already completed or failed
     */
    public void fail(Throwable error) {
        if (error == null) {
            throw new IllegalArgumentException("Error cannot be null");
        }
        List<Consumer<Throwable>> callbacks;
        synchronized (this) {
            if (state != State.PENDING) {
                throw new IllegalStateException("Future already " + state.name().toLowerCase());
            }
            this.exception = error;
            this.state = State.FAILED;
            callbacks = new ArrayList<>(failureCallbacks);
            successCallbacks.clear();
            failureCallbacks.clear();
        }
        callbacks.forEach(callback -> callback.accept(error));
    }

    public ListenableFuture<T> onSuccess(Consumer<T> callback) {
        boolean runNow;
        synchronized (this) {
            runNow = state == State.COMPLETED;
            if (state == State.PENDING) {
                successCallbacks.add(callback);
            }
        }
        if (runNow) {
            callback.accept(result);
        }
        return this;
    }

    public ListenableFuture<T> onFailure(Consumer<Throwable> callback) {
        boolean runNow;
        synchronized (this) {
            runNow = state == State.FAILED;
            if (state == State.PENDING) {
                failureCallbacks.add(callback);
            }
        }
        if (runNow) {
            callback.accept(exception);
        }
        return this;
    }

    /**
     * Returns a future completed with {@code mapper} applied to this future's result.
     * An exception thrown by the mapper fails the returned future.
     */
    public <R> ListenableFuture<R> map(Function<? super T, ? extends R> mapper) {
        ListenableFuture<R> mapped = new ListenableFuture<>();
        onSuccess(value -> {
            R next;
            try {
                next = mapper.apply(value);
            } catch (RuntimeException e) {
                mapped.fail(e);
                return;
            }
            mapped.complete(next);
        });
        onFailure(mapped::fail);
        return mapped;
    }

    /**
     * Chains an asynchronous step that starts once this future completes successfully.
     * Failures of either step fail the returned future.
     */
    public <R> ListenableFuture<R> flatMap(Function<? super T, ListenableFuture<R>> next) {
        ListenableFuture<R> chained = new ListenableFuture<>();
        onSuccess(value -> {
            ListenableFuture<R> step;
            try {
                step = next.apply(value);
            } catch (RuntimeException e) {
                chained.fail(e);
                return;
            }
            step.onSuccess(chained::complete).onFailure(chained::fail);
        });
        onFailure(chained::fail);
        return chained;
    }

    /**
     * Returns a future that fails with {@code translator} applied to this future's error.
     * Successful results pass through unchanged.
     */
    public ListenableFuture<T> mapFailure(Function<Throwable, ? extends Throwable> translator) {
        ListenableFuture<T> translated = new ListenableFuture<>();
        onSuccess(translated::complete);
        onFailure(error -> translated.fail(translator.apply(error)));
        return translated;
    }

    public synchronized boolean isPending() {
        return state == State.PENDING;
    }

    public synchronized boolean isCompleted() {
        return state == State.COMPLETED;
    }

    public synchronized boolean isFailed() {
        return state == State.FAILED;
    }

    /**
     * @throws IllegalStateException if the future has not completed successfully
     */
    public synchronized T getResult() {
        if (state != State.COMPLETED) {
            throw new IllegalStateException("Future is " + state.name().toLowerCase() + ", no result available");
        }
        return result;
    }

    /**
     * @throws IllegalStateException if the future has not failed
     */
    public synchronized Throwable getException() {
        if (state != State.FAILED) {
            throw new IllegalStateException("Future is " + state.name().toLowerCase() + ", no exception available");
        }
        return exception;
    }
}
