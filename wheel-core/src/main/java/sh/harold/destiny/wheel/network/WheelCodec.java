package sh.harold.destiny.wheel.network;

import sh.harold.destiny.api.wheel.gem.Gem;
import sh.harold.destiny.api.wheel.gem.GemAffinity;
import sh.harold.destiny.api.wheel.network.WheelMessageReader;
import sh.harold.destiny.api.wheel.network.WheelMessageWriter;
import sh.harold.destiny.api.wheel.player.PromotionScroll;
import sh.harold.destiny.api.wheel.slot.WheelSlot;

/**
 * Field order of the wheel messages. Byte layout is left to the reader and writer.
 */
public final class WheelCodec {

    private WheelCodec() {
    }

    /**
     * Read a save request: one unsigned short per slot, in slot id order.
     *
     * @return requested points indexed by slot id, index 0 unused
     */
    public static int[] readSlotRequest(WheelMessageReader reader) {
        int[] requested = new int[WheelSlot.COUNT + 1];
        for (int id = 1; id <= WheelSlot.COUNT; id++) {
            requested[id] = reader.readUnsignedShort();
        }
        return requested;
    }

    /**
     * Write the open-window payload. A window that may not be viewed stops after
     * the view flag.
     */
    public static void writeWindow(WheelMessageWriter writer, WheelWindow window) {
        writer.writeString(window.ownerId());
        writer.writeBoolean(window.canView());
        if (!window.canView()) {
            return;
        }
        writer.writeByte(window.options());
        writer.writeByte(window.vocationClientId());
        writer.writeShort(window.basePoints());
        writer.writeShort(window.extraPoints());

        int[] slots = window.slotPoints();
        for (int id = 1; id <= WheelSlot.COUNT; id++) {
            writer.writeShort(slots[id]);
        }

        writer.writeByte(PromotionScroll.values().length);
        for (PromotionScroll scroll : PromotionScroll.values()) {
            writer.writeBoolean(window.unlockedScrolls().contains(scroll));
        }

        writer.writeShort(window.revealedGems().size());
        for (Gem gem : window.revealedGems()) {
            writeGem(writer, gem);
        }

        for (GemAffinity affinity : GemAffinity.values()) {
            Integer index = window.activeGems().get(affinity);
            writer.writeBoolean(index != null);
            if (index != null) {
                writer.writeShort(index);
            }
        }

        writer.writeInt(window.giftOfLifeCooldown());
        writer.writeInt(window.giftOfLifeTotalCooldown());
    }

    private static void writeGem(WheelMessageWriter writer, Gem gem) {
        writer.writeString(gem.uuid());
        writer.writeBoolean(gem.locked());
        writer.writeByte(gem.affinity().ordinal());
        writer.writeByte(gem.quality().ordinal());
        writer.writeByte(gem.basicModifier1().ordinal());
        writer.writeByte(gem.basicModifier2().ordinal());
        writer.writeByte(gem.supremeModifier().ordinal());
    }
}
