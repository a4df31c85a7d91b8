package sh.harold.destiny.api.wheel.gem;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A revealed gem. Stored as a flat map keyed by field name, with enums written
 * as their ordinal.
 *
 * <p>{@link #EMPTY} stands in for a gem that could not be found.
 */
public record Gem(
        String uuid,
        boolean locked,
        GemAffinity affinity,
        GemQuality quality,
        BasicModifier basicModifier1,
        BasicModifier basicModifier2,
        SupremeModifier supremeModifier
) {

    public static final Gem EMPTY = new Gem("", false, GemAffinity.GREEN, GemQuality.LESSER,
            BasicModifier.NONE, BasicModifier.NONE, SupremeModifier.NONE);

    public static final String FIELD_UUID = "uuid";
    public static final String FIELD_LOCKED = "locked";
    public static final String FIELD_AFFINITY = "affinity";
    public static final String FIELD_QUALITY = "quality";
    public static final String FIELD_BASIC_1 = "basicModifier1";
    public static final String FIELD_BASIC_2 = "basicModifier2";
    public static final String FIELD_SUPREME = "supremeModifier";

    public Gem {
        Objects.requireNonNull(uuid, "uuid");
        Objects.requireNonNull(affinity, "affinity");
        Objects.requireNonNull(quality, "quality");
        Objects.requireNonNull(basicModifier1, "basicModifier1");
        Objects.requireNonNull(basicModifier2, "basicModifier2");
        Objects.requireNonNull(supremeModifier, "supremeModifier");
    }

    public boolean isEmpty() {
        return uuid.isEmpty();
    }

    public Gem withLocked(boolean locked) {
        return new Gem(uuid, locked, affinity, quality, basicModifier1, basicModifier2, supremeModifier);
    }

    public Gem withAffinity(GemAffinity affinity) {
        return new Gem(uuid, locked, affinity, quality, basicModifier1, basicModifier2, supremeModifier);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(FIELD_UUID, uuid);
        map.put(FIELD_LOCKED, locked);
        map.put(FIELD_AFFINITY, affinity.ordinal());
        map.put(FIELD_QUALITY, quality.ordinal());
        map.put(FIELD_BASIC_1, basicModifier1.ordinal());
        map.put(FIELD_BASIC_2, basicModifier2.ordinal());
        map.put(FIELD_SUPREME, supremeModifier.ordinal());
        return map;
    }

    /**
     * Rebuild a gem from its stored form. Numbers may arrive as any
     * {@link Number} subtype depending on the backend.
     *
     * @param uuid the key the gem was stored under
     * @param map  the stored value, possibly empty
     * @return the gem, or empty if the value is missing fields or holds unknown ordinals
     */
    public static Optional<Gem> fromMap(String uuid, Map<String, Object> map) {
        if (uuid == null || uuid.isEmpty() || map == null || map.isEmpty()) {
            return Optional.empty();
        }
        Object locked = map.get(FIELD_LOCKED);
        if (!(locked instanceof Boolean)) {
            return Optional.empty();
        }
        GemAffinity affinity = ordinal(GemAffinity.values(), map.get(FIELD_AFFINITY));
        GemQuality quality = ordinal(GemQuality.values(), map.get(FIELD_QUALITY));
        BasicModifier basic1 = ordinal(BasicModifier.values(), map.get(FIELD_BASIC_1));
        BasicModifier basic2 = ordinal(BasicModifier.values(), map.get(FIELD_BASIC_2));
        SupremeModifier supreme = ordinal(SupremeModifier.values(), map.get(FIELD_SUPREME));
        if (affinity == null || quality == null || basic1 == null || basic2 == null || supreme == null) {
            return Optional.empty();
        }
        return Optional.of(new Gem(uuid, (Boolean) locked, affinity, quality, basic1, basic2, supreme));
    }

    private static <E extends Enum<E>> E ordinal(E[] values, Object raw) {
        if (!(raw instanceof Number number)) {
            return null;
        }
        int index = number.intValue();
        return index >= 0 && index < values.length ? values[index] : null;
    }
}
