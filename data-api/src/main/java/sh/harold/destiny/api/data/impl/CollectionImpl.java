package sh.harold.destiny.api.data.impl;

import sh.harold.destiny.api.data.Collection;
import sh.harold.destiny.api.data.Document;
import sh.harold.destiny.api.data.storage.StorageBackend;
import sh.harold.destiny.api.data.storage.StorageException;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default implementation of the Collection interface.
 * Handles document operations for a specific collection.
 */
public class CollectionImpl implements Collection {

    private static final Logger LOGGER = Logger.getLogger(CollectionImpl.class.getName());
    static final String SEPARATOR = "/";

    private final String name;
    private final StorageBackend backend;

    public CollectionImpl(String name, StorageBackend backend) {
        this.name = validateNamespace(name, true);
        this.backend = Objects.requireNonNull(backend, "backend");
    }

    static String validateNamespace(String namespace, boolean allowNested) {
        Objects.requireNonNull(namespace, "namespace");
        if (namespace.isBlank()) {
            throw new IllegalArgumentException("Namespace must not be blank");
        }
        for (String segment : namespace.split(SEPARATOR, -1)) {
            if (segment.isBlank() || segment.equals(".") || segment.equals("..")) {
                throw new IllegalArgumentException("Invalid namespace segment in '" + namespace + "'");
            }
        }
        if (!allowNested && namespace.contains(SEPARATOR)) {
            throw new IllegalArgumentException("Namespace must not contain '" + SEPARATOR + "': " + namespace);
        }
        return namespace;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Collection scoped(String namespace) {
        return new CollectionImpl(name + SEPARATOR + validateNamespace(namespace, false), backend);
    }

    @Override
    public CompletableFuture<Document> selectAsync(String id) {
        return backend.getDocument(name, id);
    }

    @Override
    public Document select(String id) {
        try {
            Document doc = backend.getDocument(name, id).get();
            return doc != null ? doc : new DocumentImpl(name, id, null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new DocumentImpl(name, id, null);
        } catch (ExecutionException e) {
            // Unreadable values read as absent
            LOGGER.log(Level.WARNING, "Failed to read " + name + SEPARATOR + id, e.getCause());
            return new DocumentImpl(name, id, null);
        }
    }

    @Override
    public CompletableFuture<Document> createAsync(String id, Map<String, Object> data) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(data, "data");
        return backend.saveDocument(name, id, data)
                .thenApply(ignored -> new DocumentImpl(name, id, data));
    }

    @Override
    public Document set(String key, Map<String, Object> data) {
        try {
            return createAsync(key, data).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while writing " + name + SEPARATOR + key, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Failed to write " + name + SEPARATOR + key, cause);
        }
    }

    @Override
    public CompletableFuture<Boolean> deleteAsync(String id) {
        return backend.deleteDocument(name, id);
    }

    @Override
    public boolean remove(String key) {
        try {
            return backend.deleteDocument(name, key).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            LOGGER.log(Level.WARNING, "Failed to delete " + name + SEPARATOR + key, e.getCause());
            return false;
        }
    }

    @Override
    public CompletableFuture<List<String>> keysAsync() {
        return backend.listDocumentIds(name);
    }

    @Override
    public CompletableFuture<List<Document>> allAsync() {
        return backend.getAllDocuments(name);
    }

    @Override
    public CompletableFuture<Long> countAsync() {
        return backend.count(name);
    }

    @Override
    public String toString() {
        return "Collection{" + name + "}";
    }
}
