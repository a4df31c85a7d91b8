package sh.harold.destiny.wheel.slot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.wheel.player.PlayerContext;
import sh.harold.destiny.api.wheel.slot.SlotTier;
import sh.harold.destiny.api.wheel.slot.WheelColor;
import sh.harold.destiny.api.wheel.slot.WheelSlot;
import sh.harold.destiny.wheel.config.WheelConfig;

import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("SlotAllocator Tests")
class SlotAllocatorTest {

    private PlayerContext player;
    private AtomicInteger extra;
    private WheelConfig config;
    private SlotAllocator allocator;

    @BeforeEach
    void setUp() {
        player = mock(PlayerContext.class);
        when(player.getId()).thenReturn(UUID.randomUUID());
        when(player.getLevel()).thenReturn(60);
        extra = new AtomicInteger();
        config = WheelConfig.builder().minLevel(50).pointsPerLevel(1).build();
        allocator = new SlotAllocator(player, config, extra::get);
    }

    @Test
    @DisplayName("Should grant no points at the level threshold and one per level above it")
    void shouldComputeBudgetFromLevel() {
        when(player.getLevel()).thenReturn(50);
        assertThat(allocator.totalPoints(false)).isZero();

        when(player.getLevel()).thenReturn(10);
        assertThat(allocator.totalPoints(false)).isZero();

        when(player.getLevel()).thenReturn(60);
        assertThat(allocator.totalPoints(false)).isEqualTo(10);
    }

    @Test
    @DisplayName("Should add extra points only when asked")
    void shouldAddExtraPoints() {
        extra.set(8);

        assertThat(allocator.totalPoints(false)).isEqualTo(10);
        assertThat(allocator.totalPoints(true)).isEqualTo(18);
        assertThat(allocator.unusedPoints()).isEqualTo(18);
    }

    @Test
    @DisplayName("Should reject a value above the slot cap and accept the cap itself")
    void shouldEnforceCap() {
        allocator = new SlotAllocator(player, WheelConfig.builder().slotCap(SlotTier.TIER_50, 5).build(), extra::get);

        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 10)).isFalse();
        assertThat(allocator.getPoints(WheelSlot.GREEN_50)).isZero();

        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 5)).isTrue();
        assertThat(allocator.getPoints(WheelSlot.GREEN_50)).isEqualTo(5);
        assertThat(allocator.unusedPoints()).isEqualTo(5);
        assertThat(allocator.isSlotFull(WheelSlot.GREEN_50)).isTrue();
        assertThat(allocator.canSelectSlotFullOrPartial(WheelSlot.GREEN_50)).isFalse();
    }

    @Test
    @DisplayName("Should leave state untouched whenever a save is refused")
    void shouldNotMutateOnRejection() {
        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 4);
        int[] before = allocator.snapshot();

        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.RED_50, 7)).isFalse();
        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_200, 1)).isFalse();
        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 51)).isFalse();
        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, -1)).isFalse();

        assertThat(allocator.snapshot()).isEqualTo(before);
    }

    @Test
    @DisplayName("Should require a predecessor holding points")
    void shouldRequirePredecessor() {
        assertThat(allocator.canPlayerSelectPointOnSlot(WheelSlot.GREEN_50, true)).isTrue();
        assertThat(allocator.canPlayerSelectPointOnSlot(WheelSlot.GREEN_TOP_75, false)).isFalse();
        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_TOP_75, 1)).isFalse();

        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 1);

        assertThat(allocator.canPlayerSelectPointOnSlot(WheelSlot.GREEN_TOP_75, false)).isTrue();
        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_TOP_75, 1)).isTrue();
    }

    @Test
    @DisplayName("Should walk the whole chain when recursive")
    void shouldWalkChainWhenRecursive() {
        // A restored middle slot without its root satisfies only the shallow check
        allocator.restore(WheelSlot.GREEN_TOP_75, 1);

        assertThat(allocator.canPlayerSelectPointOnSlot(WheelSlot.GREEN_MIDDLE_100, false)).isTrue();
        assertThat(allocator.canPlayerSelectPointOnSlot(WheelSlot.GREEN_MIDDLE_100, true)).isFalse();
    }

    @Test
    @DisplayName("Should always allow clearing a slot")
    void shouldAllowClearing() {
        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 3);

        assertThat(allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 0)).isTrue();
        assertThat(allocator.usedPoints()).isZero();
    }

    @Test
    @DisplayName("Should sum points by colour")
    void shouldSumByColour() {
        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 3);
        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_TOP_75, 2);
        allocator.checkSavePointsBySlotType(WheelSlot.RED_50, 4);

        assertThat(allocator.getPointsByColor(WheelColor.GREEN)).isEqualTo(5);
        assertThat(allocator.getPointsByColor(WheelColor.RED)).isEqualTo(4);
        assertThat(allocator.getPointsByColor(WheelColor.BLUE)).isZero();
    }

    @Test
    @DisplayName("Should apply a batch whose prerequisites come later in slot order")
    void shouldApplyBatchAcrossPasses() {
        int[] requested = allocator.snapshot();
        requested[WheelSlot.GREEN_MIDDLE_100.getId()] = 1;
        requested[WheelSlot.GREEN_TOP_75.getId()] = 1;
        requested[WheelSlot.GREEN_50.getId()] = 1;

        SlotSaveResult result = allocator.applyBatch(requested, false);

        assertThat(result.isFullyApplied()).isTrue();
        assertThat(result.applied()).containsExactlyInAnyOrder(
                WheelSlot.GREEN_MIDDLE_100, WheelSlot.GREEN_TOP_75, WheelSlot.GREEN_50);
        assertThat(result.passes()).isEqualTo(3);
        assertThat(allocator.usedPoints()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should reject over-cap and over-budget entries individually")
    void shouldRejectBadEntriesIndividually() {
        int[] requested = allocator.snapshot();
        requested[WheelSlot.GREEN_50.getId()] = 4;
        requested[WheelSlot.RED_50.getId()] = 60;
        requested[WheelSlot.BLUE_50.getId()] = 7;

        SlotSaveResult result = allocator.applyBatch(requested, false);

        assertThat(result.applied()).containsExactly(WheelSlot.GREEN_50);
        assertThat(result.rejected()).containsExactly(WheelSlot.RED_50, WheelSlot.BLUE_50);
        assertThat(allocator.usedPoints()).isLessThanOrEqualTo(allocator.totalPoints(true));
    }

    @Test
    @DisplayName("Should refuse decreases unless allowed and let freed points fund increases")
    void shouldHandleDecreases() {
        allocator.checkSavePointsBySlotType(WheelSlot.GREEN_50, 10);
        int[] requested = allocator.snapshot();
        requested[WheelSlot.GREEN_50.getId()] = 2;
        requested[WheelSlot.RED_50.getId()] = 8;

        SlotSaveResult refused = allocator.applyBatch(requested, false);

        assertThat(refused.rejected()).containsExactly(WheelSlot.GREEN_50, WheelSlot.RED_50);
        assertThat(allocator.getPoints(WheelSlot.GREEN_50)).isEqualTo(10);

        SlotSaveResult allowed = allocator.applyBatch(requested, true);

        assertThat(allowed.isFullyApplied()).isTrue();
        assertThat(allocator.getPoints(WheelSlot.GREEN_50)).isEqualTo(2);
        assertThat(allocator.getPoints(WheelSlot.RED_50)).isEqualTo(8);
    }

    @Test
    @DisplayName("Should reject a batch of the wrong size")
    void shouldRejectWrongBatchSize() {
        assertThatThrownBy(() -> allocator.applyBatch(new int[10], true))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
