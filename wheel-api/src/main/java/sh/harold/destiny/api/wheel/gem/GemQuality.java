package sh.harold.destiny.api.wheel.gem;

/**
 * Gem tiers, cheapest first. Higher tiers roll more modifiers.
 */
public enum GemQuality {
    LESSER(1, false),
    REGULAR(2, false),
    GREATER(2, true),
    EPIC(2, true);

    private final int basicModifiers;
    private final boolean supremeModifier;

    GemQuality(int basicModifiers, boolean supremeModifier) {
        this.basicModifiers = basicModifiers;
        this.supremeModifier = supremeModifier;
    }

    public int getBasicModifiers() {
        return basicModifiers;
    }

    public boolean hasSupremeModifier() {
        return supremeModifier;
    }
}
