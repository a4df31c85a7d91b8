package sh.harold.destiny.api.data.impl;

import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.data.DataAPI;
import sh.harold.destiny.api.data.impl.json.JsonStorageBackend;
import sh.harold.destiny.api.data.storage.ConnectionAdapter;
import sh.harold.destiny.api.data.storage.StorageBackend;
import sh.harold.destiny.api.data.storage.StorageType;

import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default implementation of the DataAPI interface.
 * Routes operations to the appropriate storage backend.
 */
public class DataAPIImpl implements DataAPI {

    private static final String PLAYERS = "players";

    private final ConnectionAdapter adapter;
    private final StorageBackend backend;
    private final Map<String, Collection> collectionCache;

    private DataAPIImpl(ConnectionAdapter adapter, StorageBackend backend) {
        this.adapter = adapter;
        this.backend = backend;
        this.collectionCache = new ConcurrentHashMap<>();
    }

    /**
     * Factory method to create a DataAPI instance.
     *
     * @param adapter The connection adapter for storage backend
     * @return A new DataAPI instance
     */
    public static DataAPI create(ConnectionAdapter adapter) {
        Objects.requireNonNull(adapter, "adapter");
        return new DataAPIImpl(adapter, createBackend(adapter));
    }

    /**
     * Wrap an already constructed backend.
     *
     * @param backend The storage backend
     * @return A new DataAPI instance
     */
    public static DataAPI create(StorageBackend backend) {
        return new DataAPIImpl(null, Objects.requireNonNull(backend, "backend"));
    }

    private static StorageBackend createBackend(ConnectionAdapter adapter) {
        StorageType storageType = adapter.getStorageType();
        switch (storageType) {
            case JSON:
                if (adapter.getJsonStoragePath() != null) {
                    return new JsonStorageBackend(adapter.getJsonStoragePath());
                }
                throw new IllegalStateException("JSON storage path not available");

            case IN_MEMORY:
            default:
                return new InMemoryStorageBackend();
        }
    }

    @Override
    public Collection scoped(String namespace) {
        return collectionCache.computeIfAbsent(CollectionImpl.validateNamespace(namespace, false),
                name -> new CollectionImpl(name, backend));
    }

    @Override
    public Collection players() {
        return scoped(PLAYERS);
    }

    @Override
    public Collection player(UUID id) {
        Objects.requireNonNull(id, "id");
        return players().scoped(id.toString());
    }

    @Override
    public StorageBackend getStorageBackend() {
        return backend;
    }

    ConnectionAdapter getAdapter() {
        return adapter;
    }
}
