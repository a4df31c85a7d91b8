package sh.harold.destiny.api.wheel.gem;

import sh.harold.destiny.api.wheel.bonus.SpellBoost;
import sh.harold.destiny.api.wheel.bonus.WheelStat;
import sh.harold.destiny.api.wheel.player.Vocation;

/**
 * Rare modifiers rolled only by the higher gem qualities. Generic ones raise a
 * stat; vocation ones boost a single spell.
 */
public enum SupremeModifier {
    NONE(Vocation.NONE, null, null, null, 0),
    DODGE(Vocation.NONE, WheelStat.DODGE, null, null, 25),
    CRITICAL_DAMAGE(Vocation.NONE, WheelStat.CRITICAL_DAMAGE, null, null, 150),
    LIFE_LEECH(Vocation.NONE, WheelStat.LIFE_LEECH, null, null, 100),
    MANA_LEECH(Vocation.NONE, WheelStat.MANA_LEECH, null, null, 50),
    KNIGHT_AVATAR_OF_STEEL_COOLDOWN(Vocation.KNIGHT, null, "Avatar of Steel", SpellBoost.COOLDOWN, 300000),
    KNIGHT_EXECUTIONERS_THROW_DAMAGE(Vocation.KNIGHT, null, "Executioner's Throw", SpellBoost.DAMAGE, 10),
    KNIGHT_FIERCE_BERSERK_DAMAGE(Vocation.KNIGHT, null, "Fierce Berserk", SpellBoost.DAMAGE, 5),
    PALADIN_AVATAR_OF_LIGHT_COOLDOWN(Vocation.PALADIN, null, "Avatar of Light", SpellBoost.COOLDOWN, 300000),
    PALADIN_DIVINE_GRENADE_DAMAGE(Vocation.PALADIN, null, "Divine Grenade", SpellBoost.DAMAGE, 10),
    PALADIN_DIVINE_CALDERA_DAMAGE(Vocation.PALADIN, null, "Divine Caldera", SpellBoost.DAMAGE, 5),
    SORCERER_AVATAR_OF_STORM_COOLDOWN(Vocation.SORCERER, null, "Avatar of Storm", SpellBoost.COOLDOWN, 300000),
    SORCERER_GREAT_DEATH_BEAM_DAMAGE(Vocation.SORCERER, null, "Great Death Beam", SpellBoost.DAMAGE, 10),
    SORCERER_HELLS_CORE_DAMAGE(Vocation.SORCERER, null, "Hell's Core", SpellBoost.DAMAGE, 5),
    DRUID_AVATAR_OF_NATURE_COOLDOWN(Vocation.DRUID, null, "Avatar of Nature", SpellBoost.COOLDOWN, 300000),
    DRUID_TERRA_BURST_DAMAGE(Vocation.DRUID, null, "Terra Burst", SpellBoost.DAMAGE, 10),
    DRUID_HEAL_FRIEND_HEAL(Vocation.DRUID, null, "Heal Friend", SpellBoost.HEAL, 10);

    private final Vocation vocation;
    private final WheelStat stat;
    private final String spell;
    private final SpellBoost boost;
    private final int value;

    SupremeModifier(Vocation vocation, WheelStat stat, String spell, SpellBoost boost, int value) {
        this.vocation = vocation;
        this.stat = stat;
        this.spell = spell;
        this.boost = boost;
        this.value = value;
    }

    /**
     * @return the vocation this modifier can roll for, {@link Vocation#NONE} for any
     */
    public Vocation getVocation() {
        return vocation;
    }

    public WheelStat getStat() {
        return stat;
    }

    public String getSpell() {
        return spell;
    }

    public SpellBoost getBoost() {
        return boost;
    }

    public int getValue() {
        return value;
    }

    public boolean isSpellModifier() {
        return spell != null;
    }

    public boolean isAvailableTo(Vocation vocation) {
        return this != NONE && (this.vocation == Vocation.NONE || this.vocation == vocation);
    }
}
