package sh.harold.destiny.wheel.slot;

import sh.harold.destiny.api.wheel.slot.WheelSlot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Prerequisite graph of the wheel. A slot can only take points once one of its
 * predecessors holds points. Predecessors are the orthogonal neighbours of the
 * same colour that sit one step closer to the colour's centre; centre slots
 * have none.
 */
public final class SlotLayout {

    /** Longest predecessor chain, from a corner slot down to the centre. */
    public static final int MAX_DEPTH;

    private static final Map<WheelSlot, List<WheelSlot>> PREDECESSORS;

    static {
        Map<WheelSlot, List<WheelSlot>> predecessors = new EnumMap<>(WheelSlot.class);
        int depth = 0;
        for (WheelSlot slot : WheelSlot.values()) {
            List<WheelSlot> found = new ArrayList<>(2);
            int[][] offsets = {{-1, 0}, {1, 0}, {0, -1}, {0, 1}};
            for (int[] offset : offsets) {
                Optional<WheelSlot> neighbour = WheelSlot.at(slot.getRow() + offset[0], slot.getColumn() + offset[1]);
                neighbour.filter(n -> n.getColor() == slot.getColor())
                        .filter(n -> n.distanceToCenter() == slot.distanceToCenter() - 1)
                        .ifPresent(found::add);
            }
            predecessors.put(slot, List.copyOf(found));
            depth = Math.max(depth, slot.distanceToCenter());
        }
        PREDECESSORS = Collections.unmodifiableMap(predecessors);
        MAX_DEPTH = depth;
    }

    private SlotLayout() {
    }

    public static List<WheelSlot> getPredecessors(WheelSlot slot) {
        return PREDECESSORS.get(slot);
    }

    public static boolean isRoot(WheelSlot slot) {
        return PREDECESSORS.get(slot).isEmpty();
    }
}
