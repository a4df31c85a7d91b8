package sh.harold.destiny.api.wheel.bonus;

import java.util.Optional;

/**
 * Passive abilities that are either on or off.
 */
public enum WheelInstant {
    BATTLE_INSTINCT("Battle Instinct"),
    POSITIONAL_TACTICS("Positional Tactics"),
    BALLISTIC_MASTERY("Ballistic Mastery"),
    HEALING_LINK("Healing Link"),
    RUNIC_MASTERY("Runic Mastery"),
    FOCUS_MASTERY("Focus Mastery"),
    BATTLE_HEALING("Battle Healing");

    private final String displayName;

    WheelInstant(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<WheelInstant> byName(String name) {
        for (WheelInstant instant : values()) {
            if (instant.displayName.equalsIgnoreCase(name)) {
                return Optional.of(instant);
            }
        }
        return Optional.empty();
    }
}
