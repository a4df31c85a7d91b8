package sh.harold.destiny.api.data.impl;

import sh.harold.destiny.api.data.Document;
import sh.harold.destiny.api.data.storage.StorageBackend;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * In-memory implementation of StorageBackend.
 * Uses ConcurrentHashMap for thread-safe storage.
 */
public class InMemoryStorageBackend implements StorageBackend {

    // Structure: collection name -> document id -> document data
    private final Map<String, Map<String, Map<String, Object>>> storage = new ConcurrentHashMap<>();
    private final Executor executor;

    public InMemoryStorageBackend() {
        this(ForkJoinPool.commonPool());
    }

    public InMemoryStorageBackend(Executor executor) {
        this.executor = executor != null ? executor : ForkJoinPool.commonPool();
    }

    @Override
    public CompletableFuture<Document> getDocument(String collection, String id) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Map<String, Object>> collectionData = storage.get(collection);
            if (collectionData == null) {
                return new DocumentImpl(collection, id, null);
            }
            return new DocumentImpl(collection, id, collectionData.get(id));
        }, executor);
    }

    @Override
    public CompletableFuture<Void> saveDocument(String collection, String id, Map<String, Object> data) {
        return CompletableFuture.runAsync(() -> storage.computeIfAbsent(collection, k -> new ConcurrentHashMap<>())
                .put(id, new HashMap<>(data)), executor);
    }

    @Override
    public CompletableFuture<Boolean> deleteDocument(String collection, String id) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Map<String, Object>> collectionData = storage.get(collection);
            return collectionData != null && collectionData.remove(id) != null;
        }, executor);
    }

    @Override
    public CompletableFuture<List<String>> listDocumentIds(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Map<String, Object>> collectionData = storage.get(collection);
            return collectionData == null ? new ArrayList<>() : new ArrayList<>(collectionData.keySet());
        }, executor);
    }

    @Override
    public CompletableFuture<List<Document>> getAllDocuments(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Map<String, Object>> collectionData = storage.get(collection);
            List<Document> documents = new ArrayList<>();
            if (collectionData != null) {
                collectionData.forEach((id, data) -> documents.add(new DocumentImpl(collection, id, data)));
            }
            return documents;
        }, executor);
    }

    @Override
    public CompletableFuture<Long> count(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            Map<String, Map<String, Object>> collectionData = storage.get(collection);
            return collectionData == null ? 0L : (long) collectionData.size();
        }, executor);
    }

    /**
     * Clear all data (useful for testing)
     */
    public void clear() {
        storage.clear();
    }
}
