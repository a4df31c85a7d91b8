package sh.harold.destiny.wheel.network;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import sh.harold.destiny.api.wheel.gem.BasicModifier;
import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.gem.GemQuality;
import sh.harold.destiny.api.wheel.gem.SupremeModifier;
import sh.harold.destiny.api.wheel.network.WheelMessageReader;
import sh.harold.destiny.api.wheel.network.WheelMessageWriter;
import sh.harold.destiny.api.wheel.player.PromotionScroll;
import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("WheelCodec Tests")
class WheelCodecTest {

    @Test
    @DisplayName("Should read one unsigned short per slot")
    void shouldReadSlotRequest() {
        WheelMessageReader reader = mock(WheelMessageReader.class);
        AtomicInteger next = new AtomicInteger();
        when(reader.readUnsignedShort()).thenAnswer(invocation -> next.incrementAndGet() * 2);

        int[] requested = WheelCodec.readSlotRequest(reader);

        assertThat(requested).hasSize(WheelSlot.COUNT + 1);
        assertThat(requested[0]).isZero();
        assertThat(requested[1]).isEqualTo(2);
        assertThat(requested[WheelSlot.COUNT]).isEqualTo(72);
        verify(reader, times(WheelSlot.COUNT)).readUnsignedShort();
    }

    @Test
    @DisplayName("Should keep the window's slot points out of callers' reach")
    void shouldCopySlotPoints() {
        int[] slots = new int[WheelSlot.COUNT + 1];
        slots[15] = 20;
        WheelWindow window = new WheelWindow("42", true, 0, 1, 30, 0, slots,
                EnumSet.noneOf(PromotionScroll.class), List.of(), Map.of(), 0, 0);

        slots[15] = 99;
        window.slotPoints()[15] = 99;

        assertThat(window.slotPoints()[15]).isEqualTo(20);
        WheelWindow same = new WheelWindow("42", true, 0, 1, 30, 0, window.slotPoints(),
                EnumSet.noneOf(PromotionScroll.class), List.of(), Map.of(), 0, 0);
        assertThat(same).isEqualTo(window).hasSameHashCodeAs(window);
    }

    @Test
    @DisplayName("Should stop after the view flag when the wheel is closed")
    void shouldWriteClosedWindow() {
        RecordingWriter writer = new RecordingWriter();

        WheelCodec.writeWindow(writer, WheelWindow.closed("42"));

        assertThat(writer.tokens).containsExactly("str:42", "byte:0");
    }

    @Test
    @DisplayName("Should write the full window in field order")
    void shouldWriteOpenWindow() {
        int[] slots = new int[WheelSlot.COUNT + 1];
        slots[1] = 10;
        slots[WheelSlot.COUNT] = 7;
        Gem gem = new Gem("5", true, GemAffinity.RED, GemQuality.GREATER,
                BasicModifier.FIRE_RESISTANCE, BasicModifier.VOCATION_LIFE, SupremeModifier.DODGE);
        WheelWindow window = new WheelWindow("42", true, 2, 1, 500, 23, slots,
                EnumSet.of(PromotionScroll.BASIC), List.of(gem), Map.of(GemAffinity.RED, 0), 30, 60);
        RecordingWriter writer = new RecordingWriter();

        WheelCodec.writeWindow(writer, window);

        List<String> expected = new ArrayList<>(List.of("str:42", "byte:1", "byte:2", "byte:1", "short:500", "short:23"));
        for (int id = 1; id <= WheelSlot.COUNT; id++) {
            expected.add("short:" + slots[id]);
        }
        expected.add("byte:" + PromotionScroll.values().length);
        for (PromotionScroll scroll : PromotionScroll.values()) {
            expected.add(scroll == PromotionScroll.BASIC ? "byte:1" : "byte:0");
        }
        expected.addAll(List.of("short:1", "str:5", "byte:1",
                "byte:" + GemAffinity.RED.ordinal(),
                "byte:" + GemQuality.GREATER.ordinal(),
                "byte:" + BasicModifier.FIRE_RESISTANCE.ordinal(),
                "byte:" + BasicModifier.VOCATION_LIFE.ordinal(),
                "byte:" + SupremeModifier.DODGE.ordinal()));
        for (GemAffinity affinity : GemAffinity.values()) {
            if (affinity == GemAffinity.RED) {
                expected.add("byte:1");
                expected.add("short:0");
            } else {
                expected.add("byte:0");
            }
        }
        expected.add("int:30");
        expected.add("int:60");

        assertThat(writer.tokens).containsExactlyElementsOf(expected);
    }

    @Test
    @DisplayName("Should reject a window with the wrong slot count")
    void shouldRejectShortSlotArray() {
        assertThatThrownBy(() -> new WheelWindow("1", true, 0, 0, 0, 0, new int[3],
                EnumSet.noneOf(PromotionScroll.class), List.of(), Map.of(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class RecordingWriter implements WheelMessageWriter {

        private final List<String> tokens = new ArrayList<>();

        @Override
        public void writeByte(int value) {
            tokens.add("byte:" + value);
        }

        @Override
        public void writeShort(int value) {
            tokens.add("short:" + value);
        }

        @Override
        public void writeInt(long value) {
            tokens.add("int:" + value);
        }

        @Override
        public void writeString(String value) {
            tokens.add("str:" + value);
        }
    }
}
