package sh.harold.destiny.api.data;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * A namespace of documents keyed by string id. Collections nest through
 * {@link #scoped(String)}, giving every subsystem its own sub-store.
 */
public interface Collection {

    /**
     * Fully qualified name of this collection, namespaces joined with {@code /}.
     *
     * @return The collection name
     */
    String getName();

    /**
     * Open a child namespace of this collection.
     *
     * @param namespace The child namespace, must not be blank or contain {@code /}
     * @return The scoped sub-store
     */
    Collection scoped(String namespace);

    /**
     * Asynchronously select a document by its ID.
     *
     * @param id The document ID
     * @return Future resolving to the document, never null
     */
    CompletableFuture<Document> selectAsync(String id);

    /**
     * Select a document by its ID.
     * Blocks until the asynchronous operation completes.
     * A missing key yields a document whose {@link Document#exists()} is false.
     *
     * @param id The document ID
     * @return The document interface
     */
    default Document select(String id) {
        return selectAsync(id).join();
    }

    /**
     * Look up a stored value.
     *
     * @param key The key
     * @return The document, or empty when the key is absent or the stored value is empty
     */
    default Optional<Document> get(String key) {
        Document document = select(key);
        return document.exists() ? Optional.of(document) : Optional.empty();
    }

    /**
     * Asynchronously write a document, replacing any previous value.
     *
     * @param id   The document ID
     * @param data The document data
     * @return Future resolving to the written document
     */
    CompletableFuture<Document> createAsync(String id, Map<String, Object> data);

    /**
     * Write a document, replacing any previous value.
     * Blocks until the asynchronous operation completes.
     *
     * @param key  The key
     * @param data The value
     * @return The written document
     * @throws sh.harold.destiny.api.data.storage.StorageException if the backend rejects the write
     */
    default Document set(String key, Map<String, Object> data) {
        return createAsync(key, data).join();
    }

    /**
     * Asynchronously delete a document by its ID.
     *
     * @param id The document ID
     * @return Future resolving to true if the document was deleted, false otherwise
     */
    CompletableFuture<Boolean> deleteAsync(String id);

    /**
     * Delete a document by its ID.
     *
     * @param key The key
     * @return true if the document was deleted, false otherwise
     */
    default boolean remove(String key) {
        return deleteAsync(key).join();
    }

    /**
     * Asynchronously list the keys stored directly in this collection.
     *
     * @return Future resolving to the keys, in no particular order
     */
    CompletableFuture<List<String>> keysAsync();

    /**
     * List the keys stored directly in this collection.
     *
     * @return The keys, in no particular order
     */
    default List<String> keys() {
        return keysAsync().join();
    }

    /**
     * Asynchronously get all documents in the collection.
     *
     * @return Future resolving to a list of all documents
     */
    CompletableFuture<List<Document>> allAsync();

    /**
     * Get all documents in the collection.
     *
     * @return List of all documents
     */
    default List<Document> all() {
        return allAsync().join();
    }

    /**
     * Asynchronously count the documents in the collection.
     *
     * @return Future resolving to the document count
     */
    CompletableFuture<Long> countAsync();

    /**
     * Count the documents in the collection.
     *
     * @return The document count
     */
    default long count() {
        return countAsync().join();
    }
}
