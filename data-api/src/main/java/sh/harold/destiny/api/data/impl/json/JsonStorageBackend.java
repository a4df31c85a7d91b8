package sh.harold.destiny.api.data.impl.json;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.reflect.TypeToken;
import sh.harold.destiny.api.data.Document;
import sh.harold.destiny.api.data.impl.DocumentImpl;
import sh.harold.destiny.api.data.storage.StorageBackend;
import sh.harold.destiny.api.data.storage.StorageException;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON file-based implementation of StorageBackend.
 * Features:
 * - File-based document storage (each document as {collection}/{id}.json)
 * - Nested collections map onto nested directories
 * - Thread-safe file operations with per-collection locking
 * - In-memory LRU cache for performance
 * - Atomic file operations (write to temp, then rename)
 */
public class JsonStorageBackend implements StorageBackend {

    private static final Logger LOGGER = Logger.getLogger(JsonStorageBackend.class.getName());
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {
    }.getType();
    private static final String EXTENSION = ".json";

    // Default cache size
    private static final int DEFAULT_CACHE_SIZE = 1000;
    private final Path basePath;
    private final Gson gson;
    private final Executor executor;
    private final Map<String, ReadWriteLock> collectionLocks;
    private final LRUCache<String, Map<String, Object>> cache;
    private final boolean enableCache;

    public JsonStorageBackend(Path basePath) {
        this(basePath, DEFAULT_CACHE_SIZE, true, ForkJoinPool.commonPool());
    }

    public JsonStorageBackend(Path basePath, int cacheSize, boolean enableCache, Executor executor) {
        this.basePath = basePath;
        this.enableCache = enableCache;
        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();
        this.executor = executor != null ? executor : ForkJoinPool.commonPool();
        this.collectionLocks = new ConcurrentHashMap<>();
        this.cache = enableCache ? new LRUCache<>(cacheSize) : null;

        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new StorageException("Failed to create storage directory: " + basePath, e);
        }
    }

    @Override
    public CompletableFuture<Document> getDocument(String collection, String id) {
        return CompletableFuture.supplyAsync(() -> {
            String cacheKey = getCacheKey(collection, id);

            if (enableCache) {
                Map<String, Object> cached = cache.get(cacheKey);
                if (cached != null) {
                    return new DocumentImpl(collection, id, new HashMap<>(cached));
                }
            }

            ReadWriteLock lock = getCollectionLock(collection);
            lock.readLock().lock();
            try {
                Path documentPath = getDocumentPath(collection, id);
                if (!Files.exists(documentPath)) {
                    return new DocumentImpl(collection, id, null);
                }

                Map<String, Object> data = readFile(documentPath);
                if (enableCache && data != null) {
                    cache.put(cacheKey, new HashMap<>(data));
                }
                return new DocumentImpl(collection, id, data);
            } catch (IOException | JsonSyntaxException e) {
                LOGGER.log(Level.WARNING, "Unreadable document " + collection + "/" + id + ", treating as absent", e);
                return new DocumentImpl(collection, id, null);
            } finally {
                lock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Void> saveDocument(String collection, String id, Map<String, Object> data) {
        return CompletableFuture.runAsync(() -> {
            ReadWriteLock lock = getCollectionLock(collection);
            lock.writeLock().lock();
            try {
                Path documentPath = getDocumentPath(collection, id);
                Files.createDirectories(documentPath.getParent());
                Path tempPath = documentPath.resolveSibling(id + ".tmp");

                Files.writeString(tempPath, gson.toJson(data), StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING);
                Files.move(tempPath, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);

                if (enableCache) {
                    cache.put(getCacheKey(collection, id), new HashMap<>(data));
                }
            } catch (IOException e) {
                throw new StorageException("Failed to save document: " + collection + "/" + id, e);
            } finally {
                lock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Boolean> deleteDocument(String collection, String id) {
        return CompletableFuture.supplyAsync(() -> {
            ReadWriteLock lock = getCollectionLock(collection);
            lock.writeLock().lock();
            try {
                if (enableCache) {
                    cache.remove(getCacheKey(collection, id));
                }
                return Files.deleteIfExists(getDocumentPath(collection, id));
            } catch (IOException e) {
                throw new StorageException("Failed to delete document: " + collection + "/" + id, e);
            } finally {
                lock.writeLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<List<String>> listDocumentIds(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            ReadWriteLock lock = getCollectionLock(collection);
            lock.readLock().lock();
            try {
                return listIds(collection);
            } finally {
                lock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<List<Document>> getAllDocuments(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            ReadWriteLock lock = getCollectionLock(collection);
            lock.readLock().lock();
            try {
                List<Document> documents = new ArrayList<>();
                for (String id : listIds(collection)) {
                    Map<String, Object> data = enableCache ? cache.get(getCacheKey(collection, id)) : null;
                    if (data == null) {
                        try {
                            data = readFile(getDocumentPath(collection, id));
                        } catch (IOException | JsonSyntaxException e) {
                            LOGGER.log(Level.WARNING, "Skipping corrupted document " + collection + "/" + id, e);
                            continue;
                        }
                        if (enableCache && data != null) {
                            cache.put(getCacheKey(collection, id), new HashMap<>(data));
                        }
                    }
                    if (data != null) {
                        documents.add(new DocumentImpl(collection, id, new HashMap<>(data)));
                    }
                }
                return documents;
            } finally {
                lock.readLock().unlock();
            }
        }, executor);
    }

    @Override
    public CompletableFuture<Long> count(String collection) {
        return listDocumentIds(collection).thenApply(ids -> (long) ids.size());
    }

    @Override
    public void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
        }
    }

    private List<String> listIds(String collection) {
        Path collectionPath = basePath.resolve(collection);
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(collectionPath)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(collectionPath, "*" + EXTENSION)) {
            for (Path documentPath : stream) {
                if (Files.isRegularFile(documentPath)) {
                    String fileName = documentPath.getFileName().toString();
                    ids.add(fileName.substring(0, fileName.length() - EXTENSION.length()));
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list collection: " + collection, e);
        }
        return ids;
    }

    private Map<String, Object> readFile(Path documentPath) throws IOException {
        String json = Files.readString(documentPath, StandardCharsets.UTF_8);
        return gson.fromJson(json, MAP_TYPE);
    }

    private Path getDocumentPath(String collection, String id) {
        return basePath.resolve(collection).resolve(id + EXTENSION);
    }

    private String getCacheKey(String collection, String id) {
        return collection + ":" + id;
    }

    private ReadWriteLock getCollectionLock(String collection) {
        return collectionLocks.computeIfAbsent(collection, k -> new ReentrantReadWriteLock());
    }

    /**
     * Simple LRU cache implementation
     */
    private static final class LRUCache<K, V> {
        private final Map<K, V> cache;
        private final int capacity;

        private LRUCache(int capacity) {
            this.capacity = capacity;
            this.cache = Collections.synchronizedMap(new LinkedHashMap<K, V>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                    return size() > LRUCache.this.capacity;
                }
            });
        }

        V get(K key) {
            return cache.get(key);
        }

        void put(K key, V value) {
            cache.put(key, value);
        }

        void remove(K key) {
            cache.remove(key);
        }
    }
}
