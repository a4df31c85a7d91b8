package sh.harold.destiny.wheel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Typed reads over the maps SnakeYAML produces.
 */
final class YamlValues {

    private static final Logger LOGGER = LoggerFactory.getLogger(YamlValues.class);

    private YamlValues() {
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> getSection(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value instanceof String) {
            return (String) value;
        }
        return defaultValue;
    }

    static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return defaultValue;
    }

    static long getLong(Map<String, Object> map, String key, long defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return defaultValue;
    }

    static double getDouble(Map<String, Object> map, String key, double defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return defaultValue;
    }

    /**
     * Reads a list of exactly {@code size} numbers, or returns null.
     */
    static int[] getIntList(Map<String, Object> map, String key, int size) {
        Object value = map.get(key);
        if (!(value instanceof List<?> list) || list.size() != size) {
            return null;
        }
        int[] result = new int[size];
        for (int i = 0; i < size; i++) {
            if (!(list.get(i) instanceof Number number)) {
                return null;
            }
            result[i] = number.intValue();
        }
        return result;
    }

    /**
     * Reads a duration written as {@code 500ms}, {@code 30s}, {@code 5m}, {@code 2h}
     * or a bare number of seconds.
     */
    static Duration getDuration(Object raw, Duration defaultValue) {
        if (raw instanceof Number number) {
            return Duration.ofSeconds(number.longValue());
        }
        if (!(raw instanceof String)) {
            return defaultValue;
        }
        String durationStr = ((String) raw).trim().toLowerCase(Locale.ROOT);
        if (durationStr.isEmpty()) {
            return defaultValue;
        }

        try {
            if (durationStr.endsWith("ms")) {
                return Duration.ofMillis(Long.parseLong(durationStr.substring(0, durationStr.length() - 2)));
            } else if (durationStr.endsWith("s")) {
                return Duration.ofSeconds(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            } else if (durationStr.endsWith("m")) {
                return Duration.ofMinutes(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            } else if (durationStr.endsWith("h")) {
                return Duration.ofHours(Long.parseLong(durationStr.substring(0, durationStr.length() - 1)));
            }
            return Duration.ofSeconds(Long.parseLong(durationStr));
        } catch (NumberFormatException e) {
            LOGGER.warn("Invalid duration format: {}, using default: {}", durationStr, defaultValue);
            return defaultValue;
        }
    }

    /**
     * Maps a config key such as {@code damage-reduction} onto an enum constant.
     */
    static <E extends Enum<E>> E enumValue(Class<E> type, Object key) {
        String name = String.valueOf(key).trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        return Enum.valueOf(type, name);
    }
}
