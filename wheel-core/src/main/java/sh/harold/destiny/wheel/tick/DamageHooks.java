package sh.harold.destiny.wheel.tick;

import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.player.CombatTarget;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.wheel.bonus.BonusAggregator;

import java.util.Objects;

/**
 * Read-only helpers for the combat pipeline. Every method computes a magnitude
 * from the current aggregated state and changes nothing.
 *
 * <p>Percent values are whole percents unless noted; leech values are in
 * hundredths of a percent.
 */
public class DamageHooks {

    private static final int[] BEAM_MASTERY_DAMAGE = {0, 7, 10, 14};
    private static final int[] DRAIN_BODY_LIFE_LEECH = {0, 200, 400, 600};
    private static final int[] DRAIN_BODY_MANA_LEECH = {0, 100, 200, 300};
    private static final int[] BLESSING_OF_THE_GROVE_LOW = {0, 10, 20, 30};
    private static final int[] BLESSING_OF_THE_GROVE_MEDIUM = {0, 5, 10, 15};
    private static final int[] TWIN_BURST_DAMAGE = {0, 10, 20, 30};
    private static final int[] EXECUTIONERS_THROW_DAMAGE = {0, 15, 30, 45};
    private static final int[] DIVINE_GRENADE_DAMAGE = {0, 5, 10, 15};

    static final int LOW_HEALTH_PERCENT = 30;
    static final int MEDIUM_HEALTH_PERCENT = 60;
    static final double BATTLE_HEALING_SHIELD_FACTOR = 0.2;

    private final PlayerContext player;
    private final BonusAggregator bonus;

    public DamageHooks(PlayerContext player, BonusAggregator bonus) {
        this.player = Objects.requireNonNull(player, "player");
        this.bonus = Objects.requireNonNull(bonus, "bonus");
    }

    /**
     * Leech granted against a target carrying the drain body debuff. The lower
     * of the perk stage and the debuff stage applies.
     *
     * @param mana mana leech if true, life leech otherwise
     */
    public int checkDrainBodyLeech(CombatTarget target, boolean mana) {
        if (target == null || !target.isMonster()) {
            return 0;
        }
        int stage = Math.min(bonus.getStage(WheelStage.DRAIN_BODY), target.getDrainBodyDebuffStage());
        if (stage <= 0) {
            return 0;
        }
        stage = Math.min(stage, WheelStage.MAX_STAGE);
        return mana ? DRAIN_BODY_MANA_LEECH[stage] : DRAIN_BODY_LIFE_LEECH[stage];
    }

    public int checkBeamMasteryDamage() {
        return BEAM_MASTERY_DAMAGE[bonus.getStage(WheelStage.BEAM_MASTERY)];
    }

    /**
     * Heal from battle healing, scaled by the shield skill and boosted at low health.
     */
    public int checkBattleHealingAmount() {
        int shield = player.getShieldSkill() + bonus.getMajorStat(WheelMajor.SHIELD);
        double amount = shield * BATTLE_HEALING_SHIELD_FACTOR;
        int healthPercent = healthPercent();
        if (healthPercent <= LOW_HEALTH_PERCENT) {
            amount *= 3;
        } else if (healthPercent <= MEDIUM_HEALTH_PERCENT) {
            amount *= 2;
        }
        return (int) amount;
    }

    /**
     * @return the battle healing amount while the instant is active, otherwise 0
     */
    public int healIfBattleHealingActive() {
        return bonus.getInstant(WheelInstant.BATTLE_HEALING) ? checkBattleHealingAmount() : 0;
    }

    /**
     * Extra healing on a wounded target.
     */
    public int checkBlessingGroveHealingByTarget(CombatTarget target) {
        if (target == null) {
            return 0;
        }
        int stage = bonus.getStage(WheelStage.BLESSING_OF_THE_GROVE);
        int healthPercent = target.getHealthPercent();
        if (healthPercent <= LOW_HEALTH_PERCENT) {
            return BLESSING_OF_THE_GROVE_LOW[stage];
        }
        if (healthPercent <= MEDIUM_HEALTH_PERCENT) {
            return BLESSING_OF_THE_GROVE_MEDIUM[stage];
        }
        return 0;
    }

    /**
     * Extra damage against a target that is still mostly healthy.
     */
    public int checkTwinBurstByTarget(CombatTarget target) {
        if (target == null || target.getHealthPercent() < MEDIUM_HEALTH_PERCENT) {
            return 0;
        }
        return TWIN_BURST_DAMAGE[bonus.getStage(WheelStage.TWIN_BURST)];
    }

    /**
     * Extra damage against a nearly dead target.
     */
    public int checkExecutionersThrow(CombatTarget target) {
        if (target == null || target.getHealthPercent() > LOW_HEALTH_PERCENT) {
            return 0;
        }
        return EXECUTIONERS_THROW_DAMAGE[bonus.getStage(WheelStage.EXECUTIONERS_THROW)];
    }

    /**
     * Extra damage against monsters.
     */
    public int checkDivineGrenade(CombatTarget target) {
        if (target == null || target.isPlayer()) {
            return 0;
        }
        return DIVINE_GRENADE_DAMAGE[bonus.getStage(WheelStage.DIVINE_GRENADE)];
    }

    /**
     * Resistance to one element, in whole percent.
     */
    public int checkElementSensitiveReduction(CombatType type) {
        return bonus.getResistance(type) / 100;
    }

    /**
     * Scale incoming damage by the bounded mitigation for its type.
     */
    public long adjustDamageBasedOnResistanceAndSkill(long damage, CombatType type) {
        if (damage <= 0) {
            return damage;
        }
        return Math.round(damage * bonus.getMitigationMultiplier(type));
    }

    private int healthPercent() {
        int max = player.getMaxHealth();
        return max <= 0 ? 0 : (int) ((long) player.getHealth() * 100 / max);
    }
}
