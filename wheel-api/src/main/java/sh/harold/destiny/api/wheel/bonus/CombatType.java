package sh.harold.destiny.api.wheel.bonus;

/**
 * Damage categories that carry a resistance entry.
 */
public enum CombatType {
    PHYSICAL,
    ENERGY,
    EARTH,
    FIRE,
    LIFE_DRAIN,
    MANA_DRAIN,
    HEALING,
    DROWN,
    ICE,
    HOLY,
    DEATH
}
