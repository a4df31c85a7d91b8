package sh.harold.destiny.api.data;

import sh.harold.destiny.api.data.impl.DataAPIImpl;
import sh.harold.destiny.api.data.storage.ConnectionAdapter;
import sh.harold.destiny.api.data.storage.StorageBackend;

import java.util.UUID;

/**
 * Main entry point for the Data API.
 * Provides scoped access to collections and documents.
 */
public interface DataAPI {

    /**
     * Factory method to create a DataAPI instance with the given connection adapter.
     *
     * @param adapter The connection adapter for storage backend
     * @return A new DataAPI instance
     */
    static DataAPI create(ConnectionAdapter adapter) {
        return DataAPIImpl.create(adapter);
    }

    /**
     * Access a top-level namespace.
     *
     * @param namespace The namespace name
     * @return The collection interface
     */
    Collection scoped(String namespace);

    /**
     * Direct access to the players namespace.
     *
     * @return The players collection
     */
    Collection players();

    /**
     * The namespace owned by a single player. Every per-player subsystem scopes
     * below this collection.
     *
     * @param id The UUID of the player
     * @return The player's collection
     */
    Collection player(UUID id);

    /**
     * Get the underlying storage backend backing this DataAPI instance.
     *
     * @return The storage backend implementation
     */
    StorageBackend getStorageBackend();

    /**
     * Release backend resources.
     */
    default void shutdown() {
        getStorageBackend().shutdown();
    }
}
