package sh.harold.destiny.api.data.impl;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import sh.harold.destiny.api.data.Document;

import java.util.HashMap;
import java.util.Map;

/**
 * Default implementation of the Document interface.
 * Holds an immutable snapshot of the stored value.
 */
public class DocumentImpl implements Document {

    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();
    private final String collection;
    private final String id;
    private final Map<String, Object> data;

    public DocumentImpl(String collection, String id, Map<String, Object> data) {
        this.collection = collection;
        this.id = id;
        this.data = data != null ? new HashMap<>(data) : new HashMap<>();
    }

    @Override
    public Object get(String path) {
        return get(path, null);
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T> T get(String path, T defaultValue) {
        String[] parts = path.split("\\.");
        Object current = data;

        for (String part : parts) {
            if (current instanceof Map) {
                current = ((Map<?, ?>) current).get(part);
                if (current == null) {
                    return defaultValue;
                }
            } else {
                return defaultValue;
            }
        }

        return current != null ? (T) current : defaultValue;
    }

    @Override
    public boolean exists() {
        return !data.isEmpty();
    }

    @Override
    public Map<String, Object> toMap() {
        return new HashMap<>(data);
    }

    @Override
    public String toJson() {
        return gson.toJson(data);
    }

    @Override
    public String getId() {
        return id;
    }

    String getCollection() {
        return collection;
    }

    @Override
    public String toString() {
        return "Document{" + collection + "/" + id + "=" + data + "}";
    }
}
