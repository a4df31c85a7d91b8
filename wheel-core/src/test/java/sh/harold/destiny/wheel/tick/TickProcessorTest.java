package sh.harold.destiny.wheel.tick;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelMajor;
import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.player.Vocation;
import sh.harold.destiny.wheel.MutableClock;
import sh.harold.destiny.wheel.bonus.BonusAggregator;
import sh.harold.destiny.wheel.config.PerkCatalog;
import sh.harold.destiny.wheel.config.WheelConfig;
import sh.harold.destiny.wheel.gem.GemVault;
import sh.harold.destiny.wheel.slot.SlotAllocator;

import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("TickProcessor Tests")
class TickProcessorTest {

    private PlayerContext player;
    private MutableClock clock;
    private BonusAggregator bonus;
    private TickProcessor tick;

    @BeforeEach
    void setUp() {
        player = mock(PlayerContext.class);
        when(player.getId()).thenReturn(UUID.randomUUID());
        when(player.getVocation()).thenReturn(Vocation.KNIGHT);
        when(player.isInFight()).thenReturn(true);
        when(player.getMaxHealth()).thenReturn(1_000);
        clock = new MutableClock(100_000);
        WheelConfig config = WheelConfig.defaults();
        bonus = new BonusAggregator(player, config, PerkCatalog.empty(),
                mock(SlotAllocator.class), mock(GemVault.class), clock);
        tick = new TickProcessor(player, config, bonus, clock);
    }

    @Test
    @DisplayName("Should raise melee and shield when surrounded by five or more creatures")
    void shouldApplyBattleInstinct() {
        bonus.setInstant(WheelInstant.BATTLE_INSTINCT, true);
        when(player.countNearbyCreatures(1)).thenReturn(7);

        tick.onThink(true);

        assertThat(bonus.getMajorStat(WheelMajor.MELEE)).isEqualTo(3);
        assertThat(bonus.getMajorStat(WheelMajor.SHIELD)).isEqualTo(18);

        when(player.countNearbyCreatures(1)).thenReturn(4);
        tick.onThink(true);

        assertThat(bonus.getMajorStat(WheelMajor.MELEE)).isZero();
        assertThat(bonus.getMajorStat(WheelMajor.SHIELD)).isZero();
    }

    @Test
    @DisplayName("Should raise distance when nothing is adjacent")
    void shouldApplyPositionalTactics() {
        bonus.setInstant(WheelInstant.POSITIONAL_TACTICS, true);
        when(player.countNearbyCreatures(1)).thenReturn(0);

        tick.onThink(true);

        assertThat(bonus.getMajorStat(WheelMajor.DISTANCE)).isEqualTo(TickProcessor.POSITIONAL_TACTICS_DISTANCE);
    }

    @Test
    @DisplayName("Should read weapon and field state for the remaining masteries")
    void shouldApplyEquipmentMasteries() {
        bonus.setInstant(WheelInstant.BALLISTIC_MASTERY, true);
        bonus.setStage(WheelStage.COMBAT_MASTERY, 2);
        bonus.setStage(WheelStage.DIVINE_EMPOWERMENT, 3);
        when(player.countNearbyCreatures(1)).thenReturn(1);
        when(player.isWieldingDistanceWeapon()).thenReturn(true);
        when(player.isWieldingShield()).thenReturn(true);
        when(player.isOnDivineEmpowermentField()).thenReturn(true);

        tick.onThink(true);

        assertThat(bonus.getMajorStat(WheelMajor.CRITICAL_DAMAGE)).isEqualTo(10);
        assertThat(bonus.getMajorStat(WheelMajor.DEFENSE)).isEqualTo(4);
        assertThat(bonus.getMajorStat(WheelMajor.DAMAGE)).isEqualTo(12);

        when(player.isWieldingShield()).thenReturn(false);
        when(player.isWieldingTwoHandedWeapon()).thenReturn(true);
        tick.onThink(true);

        assertThat(bonus.getMajorStat(WheelMajor.DEFENSE)).isZero();
        assertThat(bonus.getMajorStat(WheelMajor.CRITICAL_DAMAGE)).isEqualTo(30);
    }

    @Test
    @DisplayName("Should clear conditional bonuses outside combat and in protection zones")
    void shouldResetOutsideCombat() {
        bonus.setInstant(WheelInstant.BATTLE_INSTINCT, true);
        when(player.countNearbyCreatures(1)).thenReturn(8);
        tick.onThink(true);
        assertThat(bonus.getMajorStat(WheelMajor.SHIELD)).isPositive();

        when(player.isInFight()).thenReturn(false);
        tick.onThink(true);
        assertThat(bonus.getMajorStat(WheelMajor.SHIELD)).isZero();

        when(player.isInFight()).thenReturn(true);
        when(player.isInProtectionZone()).thenReturn(true);
        tick.onThink(true);
        assertThat(bonus.getMajorStat(WheelMajor.SHIELD)).isZero();
    }

    @Test
    @DisplayName("Should re-evaluate only once per interval unless forced")
    void shouldRespectInterval() {
        assertThat(tick.onThink(false)).isTrue();
        assertThat(tick.onThink(false)).isFalse();

        clock.advance(1_999);
        assertThat(tick.onThink(false)).isFalse();
        assertThat(tick.onThink(true)).isTrue();

        clock.advance(2_000);
        assertThat(tick.onThink(false)).isTrue();
    }

    @Test
    @DisplayName("Should heal, shorten spell cooldowns and start the cooldown")
    void shouldTriggerGiftOfLife() {
        assertThat(tick.checkGiftOfLife()).isZero();

        bonus.setStage(WheelStage.GIFT_OF_LIFE, 2);

        assertThat(tick.getGiftOfLifeValue()).isEqualTo(25);
        assertThat(tick.checkGiftOfLife()).isEqualTo(250);
        verify(player).reduceSpellCooldowns(60_000L);
        assertThat(tick.getGiftOfCooldown()).isEqualTo(72_000L).isEqualTo(tick.getGiftOfLifeTotalCooldown());
        assertThat(tick.checkGiftOfLife()).isZero();
    }

    @Test
    @DisplayName("Should count the cooldown down in whole seconds of clock time")
    void shouldDecayCooldown() {
        tick.setGiftOfCooldown(100);

        clock.advance(10_500);
        tick.onThink(false);
        assertThat(tick.getGiftOfCooldown()).isEqualTo(90);

        clock.advance(500);
        tick.onThink(false);
        assertThat(tick.getGiftOfCooldown()).isEqualTo(89);

        tick.decreaseGiftOfCooldown(500);
        assertThat(tick.getGiftOfCooldown()).isZero();

        tick.setGiftOfCooldown(-5);
        assertThat(tick.getGiftOfCooldown()).isZero();
    }

    @Test
    @DisplayName("Should hand out the focus mastery bonus once per charge")
    void shouldConsumeFocusMastery() {
        assertThat(tick.armFocusMastery()).isFalse();

        bonus.setInstant(WheelInstant.FOCUS_MASTERY, true);

        assertThat(tick.armFocusMastery()).isTrue();
        assertThat(tick.checkFocusMasteryDamage()).isEqualTo(TickProcessor.FOCUS_MASTERY_DAMAGE);
        assertThat(tick.checkFocusMasteryDamage()).isZero();
    }
}
