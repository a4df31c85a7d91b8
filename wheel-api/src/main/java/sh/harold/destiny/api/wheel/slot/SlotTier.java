package sh.harold.destiny.api.wheel.slot;

/**
 * Slot categories. The numeric label doubles as the default point cap.
 */
public enum SlotTier {
    TIER_50(50),
    TIER_75(75),
    TIER_100(100),
    TIER_150(150),
    TIER_200(200);

    private final int defaultCap;

    SlotTier(int defaultCap) {
        this.defaultCap = defaultCap;
    }

    public int getDefaultCap() {
        return defaultCap;
    }

    /**
     * Look up the tier by its numeric label.
     *
     * @param label 50, 75, 100, 150 or 200
     * @return the tier
     * @throws IllegalArgumentException for any other label
     */
    public static SlotTier fromLabel(int label) {
        for (SlotTier tier : values()) {
            if (tier.defaultCap == label) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Unknown slot tier: " + label);
    }
}
