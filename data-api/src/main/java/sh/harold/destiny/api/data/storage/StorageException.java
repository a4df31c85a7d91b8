package sh.harold.destiny.api.data.storage;

/**
 * Raised when a backend cannot complete a write or read that the caller
 * needs to know about.
 */
public class StorageException extends RuntimeException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
