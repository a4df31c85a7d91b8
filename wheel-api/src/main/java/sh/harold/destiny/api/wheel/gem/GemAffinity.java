package sh.harold.destiny.api.wheel.gem;

import sh.harold.destiny.api.wheel.slot.WheelColor;

/**
 * Which colour a gem empowers. Affinities come in pairs that share a domain
 * and a gem can be switched to its partner.
 */
public enum GemAffinity {
    GREEN(WheelColor.GREEN),
    RED(WheelColor.RED),
    BLUE(WheelColor.BLUE),
    PURPLE(WheelColor.PURPLE);

    private final WheelColor color;

    GemAffinity(WheelColor color) {
        this.color = color;
    }

    public WheelColor getColor() {
        return color;
    }

    /**
     * @return the affinity a domain switch moves to
     */
    public GemAffinity getPartner() {
        return switch (this) {
            case GREEN -> PURPLE;
            case PURPLE -> GREEN;
            case RED -> BLUE;
            case BLUE -> RED;
        };
    }
}
