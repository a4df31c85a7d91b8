package sh.harold.destiny.api.data.storage;

/**
 * Enumeration of supported storage backend types.
 */
public enum StorageType {
    /**
     * JSON file-based storage backend, one file per document
     */
    JSON,

    /**
     * In-memory storage backend (for testing)
     */
    IN_MEMORY
}
