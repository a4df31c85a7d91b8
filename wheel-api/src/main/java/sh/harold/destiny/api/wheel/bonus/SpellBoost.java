package sh.harold.destiny.api.wheel.bonus;

/**
 * Numeric fields of a {@link SpellBonus} that callers can query by kind.
 */
public enum SpellBoost {
    COOLDOWN,
    MANA,
    SECONDARY_GROUP_COOLDOWN,
    ADDITIONAL_TARGET,
    DURATION,
    CRITICAL_CHANCE,
    CRITICAL_DAMAGE,
    DAMAGE,
    DAMAGE_REDUCTION,
    HEAL,
    LIFE_LEECH,
    MANA_LEECH
}
