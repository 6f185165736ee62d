package tickstore.messaging;

/**
 * A payload could not be encoded to, or decoded from, its stored byte form.
 */
public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
