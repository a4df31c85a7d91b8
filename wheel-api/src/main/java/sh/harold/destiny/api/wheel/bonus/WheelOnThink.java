package sh.harold.destiny.api.wheel.bonus;

/**
 * Timers driven by the tick loop.
 */
public enum WheelOnThink {
    BATTLE_INSTINCT,
    POSITIONAL_TACTICS,
    BALLISTIC_MASTERY,
    COMBAT_MASTERY,
    DIVINE_EMPOWERMENT,
    FOCUS_MASTERY,
    GIFT_OF_LIFE,
    AVATAR_SPELL,
    AVATAR_FORGE
}
