package sh.harold.destiny.api.data.storage;

import sh.harold.destiny.api.data.Document;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Storage backend abstraction. Collections are addressed by their full
 * {@code /}-joined name; documents by their id within that collection.
 */
public interface StorageBackend {

    /**
     * Read a document. A missing document resolves to one whose
     * {@link Document#exists()} is false, never to null.
     */
    CompletableFuture<Document> getDocument(String collection, String id);

    /**
     * Replace a document. Completes exceptionally with {@link StorageException}
     * when the write did not become durable.
     */
    CompletableFuture<Void> saveDocument(String collection, String id, Map<String, Object> data);

    CompletableFuture<Boolean> deleteDocument(String collection, String id);

    /**
     * Ids stored directly in the collection. Child collections are not listed.
     */
    CompletableFuture<List<String>> listDocumentIds(String collection);

    CompletableFuture<List<Document>> getAllDocuments(String collection);

    CompletableFuture<Long> count(String collection);

    /**
     * Release threads or handles held by the backend.
     */
    default void shutdown() {
    }
}
