package sh.harold.destiny.api.wheel.bonus;

/**
 * Accumulating stat bonuses. Mitigation, leech, dodge and critical damage are
 * kept in hundredths of a percent.
 */
public enum WheelStat {
    LIFE,
    MANA,
    CAPACITY,
    MITIGATION,
    DAMAGE,
    HEALING,
    MELEE,
    DISTANCE,
    MAGIC,
    LIFE_LEECH,
    MANA_LEECH,
    DODGE,
    CRITICAL_DAMAGE
}
