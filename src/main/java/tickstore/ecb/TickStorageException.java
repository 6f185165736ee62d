package tickstore.ecb;

/**
 * A tick protocol step failed. The message names the step, the cause carries the
 * underlying storage, codec or registry failure.
 * <p>
 * When a step fails nothing it would have written is visible in storage; the caller decides
 * whether to retry the step or stop. Skipping the tick is never correct.
 */
public class TickStorageException extends RuntimeException {

    public TickStorageException(String message) {
        super(message);
    }

    public TickStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
