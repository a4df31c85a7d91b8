package sh.harold.destiny.wheel.tick;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.wheel.bonus.CombatType;
import sh.harold.destiny.api.wheel.bonus.WheelInstant;
import sh.harold.destiny.api.wheel.bonus.WheelStage;
import sh.harold.destiny.api.wheel.player.CombatTarget;
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

@DisplayName("DamageHooks Tests")
class DamageHooksTest {

    private PlayerContext player;
    private BonusAggregator bonus;
    private DamageHooks hooks;

    @BeforeEach
    void setUp() {
        player = mock(PlayerContext.class);
        when(player.getId()).thenReturn(UUID.randomUUID());
        when(player.getVocation()).thenReturn(Vocation.SORCERER);
        bonus = new BonusAggregator(player, WheelConfig.defaults(), PerkCatalog.empty(),
                mock(SlotAllocator.class), mock(GemVault.class), new MutableClock(0));
        hooks = new DamageHooks(player, bonus);
    }

    private static CombatTarget target(boolean monster, int healthPercent) {
        CombatTarget target = mock(CombatTarget.class);
        when(target.isMonster()).thenReturn(monster);
        when(target.isPlayer()).thenReturn(!monster);
        when(target.getHealthPercent()).thenReturn(healthPercent);
        return target;
    }

    @Test
    @DisplayName("Should scale beam mastery with its stage")
    void shouldScaleBeamMastery() {
        int[] expected = {0, 7, 10, 14};
        for (int stage = 0; stage <= WheelStage.MAX_STAGE; stage++) {
            bonus.setStage(WheelStage.BEAM_MASTERY, stage);

            assertThat(hooks.checkBeamMasteryDamage()).isEqualTo(expected[stage]);
        }
    }

    @Test
    @DisplayName("Should leech from debuffed monsters by the lower of both stages")
    void shouldLeechFromDebuffedMonsters() {
        bonus.setStage(WheelStage.DRAIN_BODY, 3);
        CombatTarget monster = target(true, 100);
        when(monster.getDrainBodyDebuffStage()).thenReturn(2);

        assertThat(hooks.checkDrainBodyLeech(monster, false)).isEqualTo(400);
        assertThat(hooks.checkDrainBodyLeech(monster, true)).isEqualTo(200);

        when(monster.getDrainBodyDebuffStage()).thenReturn(0);
        assertThat(hooks.checkDrainBodyLeech(monster, false)).isZero();
        assertThat(hooks.checkDrainBodyLeech(target(false, 100), false)).isZero();
        assertThat(hooks.checkDrainBodyLeech(null, false)).isZero();
    }

    @Test
    @DisplayName("Should boost battle healing at low health")
    void shouldBoostBattleHealing() {
        when(player.getShieldSkill()).thenReturn(100);
        when(player.getMaxHealth()).thenReturn(100);

        when(player.getHealth()).thenReturn(100);
        assertThat(hooks.checkBattleHealingAmount()).isEqualTo(20);
        when(player.getHealth()).thenReturn(50);
        assertThat(hooks.checkBattleHealingAmount()).isEqualTo(40);
        when(player.getHealth()).thenReturn(20);
        assertThat(hooks.checkBattleHealingAmount()).isEqualTo(60);

        assertThat(hooks.healIfBattleHealingActive()).isZero();
        bonus.setInstant(WheelInstant.BATTLE_HEALING, true);
        assertThat(hooks.healIfBattleHealingActive()).isEqualTo(60);
    }

    @Test
    @DisplayName("Should pick per-target bonuses by health and creature type")
    void shouldApplyTargetBonuses() {
        bonus.setStage(WheelStage.BLESSING_OF_THE_GROVE, 2);
        bonus.setStage(WheelStage.TWIN_BURST, 1);
        bonus.setStage(WheelStage.EXECUTIONERS_THROW, 3);
        bonus.setStage(WheelStage.DIVINE_GRENADE, 2);

        assertThat(hooks.checkBlessingGroveHealingByTarget(target(false, 25))).isEqualTo(20);
        assertThat(hooks.checkBlessingGroveHealingByTarget(target(false, 50))).isEqualTo(10);
        assertThat(hooks.checkBlessingGroveHealingByTarget(target(false, 90))).isZero();

        assertThat(hooks.checkTwinBurstByTarget(target(true, 80))).isEqualTo(10);
        assertThat(hooks.checkTwinBurstByTarget(target(true, 40))).isZero();

        assertThat(hooks.checkExecutionersThrow(target(true, 30))).isEqualTo(45);
        assertThat(hooks.checkExecutionersThrow(target(true, 31))).isZero();

        assertThat(hooks.checkDivineGrenade(target(true, 100))).isEqualTo(10);
        assertThat(hooks.checkDivineGrenade(target(false, 100))).isZero();
    }

    @Test
    @DisplayName("Should scale incoming damage by bounded mitigation")
    void shouldAdjustDamage() {
        bonus.addResistance(CombatType.FIRE, 2_000);

        assertThat(hooks.adjustDamageBasedOnResistanceAndSkill(1_000, CombatType.FIRE)).isEqualTo(800);
        assertThat(hooks.adjustDamageBasedOnResistanceAndSkill(1_000, CombatType.ICE)).isEqualTo(1_000);
        assertThat(hooks.checkElementSensitiveReduction(CombatType.FIRE)).isEqualTo(20);

        bonus.addResistance(CombatType.FIRE, 50_000);

        assertThat(hooks.adjustDamageBasedOnResistanceAndSkill(1_000, CombatType.FIRE)).isEqualTo(100);
        assertThat(hooks.adjustDamageBasedOnResistanceAndSkill(0, CombatType.FIRE)).isZero();
    }
}
