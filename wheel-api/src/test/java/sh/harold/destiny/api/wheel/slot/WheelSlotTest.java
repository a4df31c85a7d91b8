package sh.harold.destiny.api.wheel.slot;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("WheelSlot Tests")
class WheelSlotTest {

    @Test
    @DisplayName("Should number slots 1..36 in declaration order")
    void shouldNumberSlotsInOrder() {
        WheelSlot[] slots = WheelSlot.values();

        assertThat(slots).hasSize(WheelSlot.COUNT);
        for (int i = 0; i < slots.length; i++) {
            assertThat(slots[i].getId()).isEqualTo(i + 1);
            assertThat(WheelSlot.byId(i + 1)).isSameAs(slots[i]);
        }
    }

    @Test
    @DisplayName("Should place each colour's 50 slot at its quadrant centre")
    void shouldPlaceCentres() {
        for (WheelColor color : WheelColor.values()) {
            WheelSlot centre = WheelSlot.at(color.getCenterRow(), color.getCenterColumn()).orElseThrow();

            assertThat(centre.getColor()).isEqualTo(color);
            assertThat(centre.getTier()).isEqualTo(SlotTier.TIER_50);
            assertThat(centre.distanceToCenter()).isZero();
        }
    }

    @Test
    @DisplayName("Should give every colour the same nine-slot quadrant")
    void shouldBalanceQuadrants() {
        Map<WheelColor, Integer> capTotals = new EnumMap<>(WheelColor.class);
        Arrays.stream(WheelSlot.values())
                .forEach(slot -> capTotals.merge(slot.getColor(), slot.getTier().getDefaultCap(), Integer::sum));

        assertThat(capTotals).hasSize(4).allSatisfy((color, total) -> assertThat(total).isEqualTo(1000));
        assertThat(WheelSlot.GREEN_200.distanceToCenter()).isEqualTo(4);
        assertThat(WheelSlot.PURPLE_200.distanceToCenter()).isEqualTo(4);
    }

    @Test
    @DisplayName("Should reject ids outside the wheel")
    void shouldRejectOutOfRangeIds() {
        assertThatThrownBy(() -> WheelSlot.byId(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> WheelSlot.byId(37)).isInstanceOf(IllegalArgumentException.class);
        assertThat(WheelSlot.findById(37)).isEmpty();
        assertThat(WheelSlot.at(7, 1)).isEmpty();
    }
}
