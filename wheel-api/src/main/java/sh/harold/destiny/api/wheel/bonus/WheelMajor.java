package sh.harold.destiny.api.wheel.bonus;

/**
 * Skill bonuses that are set, not accumulated, usually by conditional masteries.
 */
public enum WheelMajor {
    MELEE,
    DISTANCE,
    SHIELD,
    MAGIC,
    DAMAGE,
    CRITICAL_DAMAGE,
    DEFENSE
}
