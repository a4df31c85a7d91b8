package sh.harold.destiny.api.data.storage;

import java.nio.file.Path;

/**
 * Adapter interface for different storage backends.
 * Provides connection details and configuration for the chosen storage.
 */
public interface ConnectionAdapter {

    /**
     * Get the storage type for this adapter.
     *
     * @return The storage type (JSON or IN_MEMORY)
     */
    StorageType getStorageType();

    /**
     * Get the path for JSON file storage.
     * Only applicable for JSON storage type.
     *
     * @return The path to JSON storage directory, or null if not JSON storage
     */
    Path getJsonStoragePath();
}
