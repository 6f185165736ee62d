package tickstore.storage;

/**
 * Raised by a storage backend when an operation could not be carried out:
 * transport or disk failures, a rejected commit, or a value that cannot be interpreted
 * the way the operation requires.
 * <p>
 * Backends deliver it by failing the operation's future; it is thrown directly only for
 * failures while opening or closing the backend.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
