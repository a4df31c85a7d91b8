package sh.harold.destiny.wheel.tick;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelOnThink;
import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.wheel.bonus.BonusAggregator;
import sh.harold.destiny.wheel.config.WheelConfig;

import java.time.Clock;
import java.util.Objects;

/**
 * Periodic pass over the conditional masteries and the gift of life cooldown.
 *
 * <p>Masteries are re-evaluated once per mastery interval unless forced. The
 * gift of life cooldown counts down in whole seconds of clock time on every call.
 */
public class TickProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(TickProcessor.class);

    static final int BATTLE_INSTINCT_THRESHOLD = 5;
    static final int BATTLE_INSTINCT_SHIELD_PER_CREATURE = 6;
    static final int POSITIONAL_TACTICS_DISTANCE = 3;
    static final int BALLISTIC_MASTERY_CRITICAL_DAMAGE = 10;
    static final int FOCUS_MASTERY_DAMAGE = 35;
    private static final int[] COMBAT_MASTERY_DEFENSE = {0, 2, 4, 6};
    private static final int[] COMBAT_MASTERY_CRITICAL_DAMAGE = {0, 10, 20, 30};
    private static final int[] DIVINE_EMPOWERMENT_DAMAGE = {0, 8, 10, 12};

    private final PlayerContext player;
    private final WheelConfig config;
    private final BonusAggregator bonus;
    private final Clock clock;

    private long giftOfLifeCooldown;
    private long lastCooldownTick;

    public TickProcessor(PlayerContext player, WheelConfig config, BonusAggregator bonus, Clock clock) {
        this.player = Objects.requireNonNull(player, "player");
        this.config = Objects.requireNonNull(config, "config");
        this.bonus = Objects.requireNonNull(bonus, "bonus");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastCooldownTick = clock.millis();
    }

    /**
     * @param force re-evaluate the masteries even if their interval has not elapsed
     * @return true if the masteries were re-evaluated
     */
    public boolean onThink(boolean force) {
        long now = clock.millis();
        long elapsedSeconds = (now - lastCooldownTick) / 1000;
        if (elapsedSeconds > 0) {
            decreaseGiftOfCooldown(elapsedSeconds);
            lastCooldownTick += elapsedSeconds * 1000;
        }

        if (!force && now < bonus.getOnThinkTimer(WheelOnThink.BATTLE_INSTINCT)) {
            return false;
        }
        checkAbilities(now);
        return true;
    }

    private void checkAbilities(long now) {
        long next = now + config.getMasteryIntervalMillis();
        for (WheelOnThink timer : new WheelOnThink[]{WheelOnThink.BATTLE_INSTINCT, WheelOnThink.POSITIONAL_TACTICS,
                WheelOnThink.BALLISTIC_MASTERY, WheelOnThink.COMBAT_MASTERY, WheelOnThink.DIVINE_EMPOWERMENT}) {
            bonus.setOnThinkTimer(timer, next);
        }

        bonus.resetConditionalMajorStats();
        if (!player.isInFight() || player.isInProtectionZone()) {
            return;
        }

        int shield = 0;
        int melee = 0;
        int distance = 0;
        int criticalDamage = 0;
        int defense = 0;
        int damage = 0;

        if (bonus.getInstant(WheelInstant.BATTLE_INSTINCT)) {
            int nearby = player.countNearbyCreatures(1);
            if (nearby >= BATTLE_INSTINCT_THRESHOLD) {
                int extra = nearby - (BATTLE_INSTINCT_THRESHOLD - 1);
                melee += extra;
                shield += BATTLE_INSTINCT_SHIELD_PER_CREATURE * extra;
            }
        }
        if (bonus.getInstant(WheelInstant.POSITIONAL_TACTICS) && player.countNearbyCreatures(1) == 0) {
            distance += POSITIONAL_TACTICS_DISTANCE;
        }
        if (bonus.getInstant(WheelInstant.BALLISTIC_MASTERY) && player.isWieldingDistanceWeapon()) {
            criticalDamage += BALLISTIC_MASTERY_CRITICAL_DAMAGE;
        }
        int combatMastery = bonus.getStage(WheelStage.COMBAT_MASTERY);
        if (combatMastery > 0) {
            if (player.isWieldingShield()) {
                defense += COMBAT_MASTERY_DEFENSE[combatMastery];
            } else if (player.isWieldingTwoHandedWeapon()) {
                criticalDamage += COMBAT_MASTERY_CRITICAL_DAMAGE[combatMastery];
            }
        }
        int divineEmpowerment = bonus.getStage(WheelStage.DIVINE_EMPOWERMENT);
        if (divineEmpowerment > 0 && player.isOnDivineEmpowermentField()) {
            damage += DIVINE_EMPOWERMENT_DAMAGE[divineEmpowerment];
        }

        bonus.setMajorStat(WheelMajor.MELEE, melee);
        bonus.setMajorStat(WheelMajor.SHIELD, shield);
        bonus.setMajorStat(WheelMajor.DISTANCE, distance);
        bonus.setMajorStat(WheelMajor.CRITICAL_DAMAGE, criticalDamage);
        bonus.setMajorStat(WheelMajor.DEFENSE, defense);
        bonus.setMajorStat(WheelMajor.DAMAGE, damage);
    }

    // Gift of life

    public long getGiftOfCooldown() {
        return giftOfLifeCooldown;
    }

    /**
     * @param seconds remaining cooldown, clamped at 0
     */
    public void setGiftOfCooldown(long seconds) {
        giftOfLifeCooldown = Math.max(0, seconds);
    }

    public void decreaseGiftOfCooldown(long seconds) {
        if (giftOfLifeCooldown > 0) {
            giftOfLifeCooldown = Math.max(0, giftOfLifeCooldown - seconds);
        }
    }

    /**
     * Full cooldown for the current gift of life stage, 0 without the perk.
     */
    public long getGiftOfLifeTotalCooldown() {
        int stage = bonus.getStage(WheelStage.GIFT_OF_LIFE);
        return stage == 0 ? 0 : config.getGiftOfLifeCooldownSeconds(stage);
    }

    /**
     * Heal in percent of max health for the current stage, 0 without the perk.
     */
    public int getGiftOfLifeValue() {
        int stage = bonus.getStage(WheelStage.GIFT_OF_LIFE);
        return stage == 0 ? 0 : config.getGiftOfLifeHealPercent(stage);
    }

    /**
     * Trigger the gift of life if it is ready. Shortens the player's spell
     * cooldowns and starts the perk's own cooldown.
     *
     * @return hit points to heal, 0 if the perk is missing or cooling down
     */
    public int checkGiftOfLife() {
        int percent = getGiftOfLifeValue();
        if (percent == 0 || giftOfLifeCooldown > 0) {
            return 0;
        }
        int heal = (int) ((long) player.getMaxHealth() * percent / 100);
        player.reduceSpellCooldowns(config.getGiftOfLifeSpellCooldownReductionMillis());
        giftOfLifeCooldown = getGiftOfLifeTotalCooldown();
        LOGGER.debug("Gift of life healed player {} for {}, cooldown {}s", player.getId(), heal, giftOfLifeCooldown);
        return heal;
    }

    // Focus mastery

    /**
     * Charge the focus mastery bonus for the next damaging spell.
     *
     * @return false without the instant
     */
    public boolean armFocusMastery() {
        if (!bonus.getInstant(WheelInstant.FOCUS_MASTERY)) {
            return false;
        }
        bonus.setOnThinkTimer(WheelOnThink.FOCUS_MASTERY, clock.millis() + config.getMasteryIntervalMillis());
        return true;
    }

    /**
     * Consume the charged focus mastery bonus.
     *
     * @return damage bonus in percent, 0 if nothing is charged
     */
    public int checkFocusMasteryDamage() {
        if (bonus.getOnThinkTimer(WheelOnThink.FOCUS_MASTERY) <= clock.millis()) {
            return 0;
        }
        bonus.setOnThinkTimer(WheelOnThink.FOCUS_MASTERY, 0);
        return FOCUS_MASTERY_DAMAGE;
    }
}
