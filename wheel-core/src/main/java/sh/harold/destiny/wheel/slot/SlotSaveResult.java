package sh.harold.destiny.wheel.slot;

import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of applying a batch of slot changes.
 *
 * @param applied  slots whose new value was stored
 * @param rejected slots whose change was refused, left at their previous value
 * @param passes   passes needed to settle prerequisite ordering
 */
public record SlotSaveResult(List<WheelSlot> applied, List<WheelSlot> rejected, int passes) {

    public SlotSaveResult {
        applied = List.copyOf(applied);
        rejected = List.copyOf(rejected);
    }

    /**
     * Result for a request that was refused as a whole.
     *
     * @param requested requested points by slot id
     * @param current   current points by slot id
     */
    public static SlotSaveResult rejectedAll(int[] requested, int[] current) {
        List<WheelSlot> rejected = new ArrayList<>();
        for (WheelSlot slot : WheelSlot.values()) {
            if (requested[slot.getId()] != current[slot.getId()]) {
                rejected.add(slot);
            }
        }
        return new SlotSaveResult(List.of(), rejected, 0);
    }

    public boolean isFullyApplied() {
        return rejected.isEmpty();
    }
}
