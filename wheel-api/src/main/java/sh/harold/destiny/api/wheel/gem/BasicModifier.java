package sh.harold.destiny.api.wheel.gem;

import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.WheelStat;

/**
 * Modifiers any gem can roll. Each one grants either a resistance or a stat.
 * Resistance values are in hundredths of a percent.
 */
public enum BasicModifier {
    NONE(null, null, 0),
    PHYSICAL_RESISTANCE(CombatType.PHYSICAL, null, 100),
    HOLY_RESISTANCE(CombatType.HOLY, null, 200),
    DEATH_RESISTANCE(CombatType.DEATH, null, 200),
    FIRE_RESISTANCE(CombatType.FIRE, null, 200),
    EARTH_RESISTANCE(CombatType.EARTH, null, 200),
    ICE_RESISTANCE(CombatType.ICE, null, 200),
    ENERGY_RESISTANCE(CombatType.ENERGY, null, 200),
    MANA_DRAIN_RESISTANCE(CombatType.MANA_DRAIN, null, 300),
    LIFE_DRAIN_RESISTANCE(CombatType.LIFE_DRAIN, null, 300),
    VOCATION_LIFE(null, WheelStat.LIFE, 25),
    VOCATION_MANA(null, WheelStat.MANA, 40),
    VOCATION_CAPACITY(null, WheelStat.CAPACITY, 50),
    MITIGATION(null, WheelStat.MITIGATION, 50);

    private final CombatType resistance;
    private final WheelStat stat;
    private final int value;

    BasicModifier(CombatType resistance, WheelStat stat, int value) {
        this.resistance = resistance;
        this.stat = stat;
        this.value = value;
    }

    /**
     * @return the resistance raised, or null when this modifier grants a stat
     */
    public CombatType getResistance() {
        return resistance;
    }

    /**
     * @return the stat raised, or null when this modifier grants a resistance
     */
    public WheelStat getStat() {
        return stat;
    }

    public int getValue() {
        return value;
    }
}
