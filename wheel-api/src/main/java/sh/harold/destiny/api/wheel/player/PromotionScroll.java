package sh.harold.destiny.api.wheel.player;

/**
 * Scrolls that permanently grant extra wheel points once unlocked.
 */
public enum PromotionScroll {
    ABRIDGED("abridged", 3),
    BASIC("basic", 5),
    REVISED("revised", 9),
    EXTENDED("extended", 13),
    ADVANCED("advanced", 20);

    private final String key;
    private final int extraPoints;

    PromotionScroll(String key, int extraPoints) {
        this.key = key;
        this.extraPoints = extraPoints;
    }

    /**
     * Storage key, stable across renames of the constant.
     */
    public String getKey() {
        return key;
    }

    public int getExtraPoints() {
        return extraPoints;
    }
}
