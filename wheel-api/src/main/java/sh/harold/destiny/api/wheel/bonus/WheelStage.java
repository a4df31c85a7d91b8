package sh.harold.destiny.api.wheel.bonus;

import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.api.wheel.slot.WheelColor;

import java.util.Optional;

/**
 * Revelation perks unlocked by a colour's stage. Green is shared by every
 * vocation; the other colours have one perk per vocation.
 */
public enum WheelStage {
    GIFT_OF_LIFE("Gift of Life", WheelColor.GREEN, Vocation.NONE),
    EXECUTIONERS_THROW("Executioner's Throw", WheelColor.RED, Vocation.KNIGHT),
    DIVINE_GRENADE("Divine Grenade", WheelColor.RED, Vocation.PALADIN),
    BEAM_MASTERY("Beam Mastery", WheelColor.RED, Vocation.SORCERER),
    BLESSING_OF_THE_GROVE("Blessing of the Grove", WheelColor.RED, Vocation.DRUID),
    COMBAT_MASTERY("Combat Mastery", WheelColor.BLUE, Vocation.KNIGHT),
    DIVINE_EMPOWERMENT("Divine Empowerment", WheelColor.BLUE, Vocation.PALADIN),
    DRAIN_BODY("Drain Body", WheelColor.BLUE, Vocation.SORCERER),
    TWIN_BURST("Twin Burst", WheelColor.BLUE, Vocation.DRUID),
    AVATAR_OF_STEEL("Avatar of Steel", WheelColor.PURPLE, Vocation.KNIGHT),
    AVATAR_OF_LIGHT("Avatar of Light", WheelColor.PURPLE, Vocation.PALADIN),
    AVATAR_OF_STORM("Avatar of Storm", WheelColor.PURPLE, Vocation.SORCERER),
    AVATAR_OF_NATURE("Avatar of Nature", WheelColor.PURPLE, Vocation.DRUID);

    public static final int MAX_STAGE = 3;

    private final String displayName;
    private final WheelColor color;
    private final Vocation vocation;

    WheelStage(String displayName, WheelColor color, Vocation vocation) {
        this.displayName = displayName;
        this.color = color;
        this.vocation = vocation;
    }

    public String getDisplayName() {
        return displayName;
    }

    public WheelColor getColor() {
        return color;
    }

    /**
     * @return the vocation owning this perk, or {@link Vocation#NONE} when shared
     */
    public Vocation getVocation() {
        return vocation;
    }

    public boolean isAvatar() {
        return color == WheelColor.PURPLE;
    }

    /**
     * The perk a vocation gets from a colour.
     */
    public static Optional<WheelStage> forColor(WheelColor color, Vocation vocation) {
        for (WheelStage stage : values()) {
            if (stage.color == color && (stage.vocation == Vocation.NONE || stage.vocation == vocation)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    public static Optional<WheelStage> byName(String name) {
        for (WheelStage stage : values()) {
            if (stage.displayName.equalsIgnoreCase(name)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }
}
