package tickstore;

import tickstore.future.ListenableFuture;
import tickstore.storage.Storage;
import tickstore.txpool.SignedTransaction;

import java.nio.charset.StandardCharsets;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.fail;

/**
 * Utility methods for testing.
 */
public final class TestUtils {

    private static final int MAX_TICKS = 10_000;

    private TestUtils() {}

    /**
     * Ticks the given storages until the condition holds. Fails the test if it never does.
     */
    public static void runUntil(Supplier<Boolean> condition, Storage... storages) {
        int ticks = 0;
        while (!condition.get()) {
            for (Storage storage : storages) {
                storage.tick();
            }
            if (++ticks > MAX_TICKS) {
                fail("Condition not met after " + MAX_TICKS + " ticks");
            }
        }
    }

    /**
     * Ticks the storage until the future resolves and returns its result.
     * Fails the test if the future fails.
     */
    public static <T> T await(ListenableFuture<T> future, Storage storage) {
        runUntil(() -> !future.isPending(), storage);
        if (future.isFailed()) {
            fail("Future failed: " + future.getException(), future.getException());
        }
        return future.getResult();
    }

    /**
     * Ticks the storage until the future resolves and returns its failure.
     * Fails the test if the future completes successfully.
     */
    public static Throwable awaitFailure(ListenableFuture<?> future, Storage storage) {
        runUntil(() -> !future.isPending(), storage);
        if (future.isCompleted()) {
            fail("Expected failure but future completed with " + future.getResult());
        }
        return future.getException();
    }

    public static SignedTransaction signedTx(String personaTag, long nonce, String body) {
        return new SignedTransaction(personaTag, "test-namespace", nonce, "sig-" + personaTag + "-" + nonce,
                body.getBytes(StandardCharsets.UTF_8));
    }
}
