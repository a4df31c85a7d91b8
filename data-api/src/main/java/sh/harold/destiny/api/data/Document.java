package sh.harold.destiny.api.data;

import java.util.Map;

/**
 * A single structured value stored under a key inside a {@link Collection}.
 * Provides read access to the stored fields.
 */
public interface Document {

    /**
     * Get a value from the document by path.
     * Supports nested paths like "stats.life".
     *
     * @param path The path to the value
     * @return The value at the path, or null if not found
     */
    Object get(String path);

    /**
     * Get a value from the document by path with a default value.
     *
     * @param <T>          The type of the value
     * @param path         The path to the value
     * @param defaultValue The default value if path doesn't exist
     * @return The value at the path, or defaultValue if not found
     */
    <T> T get(String path, T defaultValue);

    /**
     * Read a numeric field as an int. Backends that round-trip through JSON
     * hand numbers back as doubles, so callers should prefer this over a cast.
     *
     * @param path         The path to the value
     * @param defaultValue Returned when the field is absent or not numeric
     * @return The int value
     */
    default int getInt(String path, int defaultValue) {
        Object value = get(path);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    /**
     * Read a numeric field as a long.
     *
     * @param path         The path to the value
     * @param defaultValue Returned when the field is absent or not numeric
     * @return The long value
     */
    default long getLong(String path, long defaultValue) {
        Object value = get(path);
        if (value instanceof Number number) {
            return number.longValue();
        }
        return defaultValue;
    }

    /**
     * Read a boolean field.
     *
     * @param path         The path to the value
     * @param defaultValue Returned when the field is absent or not a boolean
     * @return The boolean value
     */
    default boolean getBoolean(String path, boolean defaultValue) {
        Object value = get(path);
        if (value instanceof Boolean bool) {
            return bool;
        }
        return defaultValue;
    }

    /**
     * Check if this document exists in the storage backend.
     * A stored empty map counts as absent.
     *
     * @return true if the document exists, false otherwise
     */
    boolean exists();

    /**
     * Get the storage identifier (key) for this document.
     *
     * @return The document identifier
     */
    String getId();

    /**
     * Convert the document to a Map representation.
     *
     * @return Map containing all document data
     */
    Map<String, Object> toMap();

    /**
     * Convert the document to a JSON string.
     *
     * @return JSON representation of the document
     */
    String toJson();
}
