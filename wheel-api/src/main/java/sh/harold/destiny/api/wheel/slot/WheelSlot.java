package sh.harold.destiny.api.wheel.slot;

import java.util.Optional;

/**
 * The 36 talent slots, numbered 1..36 row by row across a 6x6 grid.
 * Slot ids are part of the client protocol and of stored data, so the
 * declaration order must not change.
 */
public enum WheelSlot {
    GREEN_200(1, WheelColor.GREEN, SlotTier.TIER_200),
    GREEN_TOP_150(2, WheelColor.GREEN, SlotTier.TIER_150),
    GREEN_TOP_100(3, WheelColor.GREEN, SlotTier.TIER_100),
    RED_TOP_100(4, WheelColor.RED, SlotTier.TIER_100),
    RED_TOP_150(5, WheelColor.RED, SlotTier.TIER_150),
    RED_200(6, WheelColor.RED, SlotTier.TIER_200),
    GREEN_BOTTOM_150(7, WheelColor.GREEN, SlotTier.TIER_150),
    GREEN_MIDDLE_100(8, WheelColor.GREEN, SlotTier.TIER_100),
    GREEN_TOP_75(9, WheelColor.GREEN, SlotTier.TIER_75),
    RED_TOP_75(10, WheelColor.RED, SlotTier.TIER_75),
    RED_MIDDLE_100(11, WheelColor.RED, SlotTier.TIER_100),
    RED_BOTTOM_150(12, WheelColor.RED, SlotTier.TIER_150),
    GREEN_BOTTOM_100(13, WheelColor.GREEN, SlotTier.TIER_100),
    GREEN_BOTTOM_75(14, WheelColor.GREEN, SlotTier.TIER_75),
    GREEN_50(15, WheelColor.GREEN, SlotTier.TIER_50),
    RED_50(16, WheelColor.RED, SlotTier.TIER_50),
    RED_BOTTOM_75(17, WheelColor.RED, SlotTier.TIER_75),
    RED_BOTTOM_100(18, WheelColor.RED, SlotTier.TIER_100),
    BLUE_TOP_100(19, WheelColor.BLUE, SlotTier.TIER_100),
    BLUE_TOP_75(20, WheelColor.BLUE, SlotTier.TIER_75),
    BLUE_50(21, WheelColor.BLUE, SlotTier.TIER_50),
    PURPLE_50(22, WheelColor.PURPLE, SlotTier.TIER_50),
    PURPLE_TOP_75(23, WheelColor.PURPLE, SlotTier.TIER_75),
    PURPLE_TOP_100(24, WheelColor.PURPLE, SlotTier.TIER_100),
    BLUE_TOP_150(25, WheelColor.BLUE, SlotTier.TIER_150),
    BLUE_MIDDLE_100(26, WheelColor.BLUE, SlotTier.TIER_100),
    BLUE_BOTTOM_75(27, WheelColor.BLUE, SlotTier.TIER_75),
    PURPLE_BOTTOM_75(28, WheelColor.PURPLE, SlotTier.TIER_75),
    PURPLE_MIDDLE_100(29, WheelColor.PURPLE, SlotTier.TIER_100),
    PURPLE_TOP_150(30, WheelColor.PURPLE, SlotTier.TIER_150),
    BLUE_200(31, WheelColor.BLUE, SlotTier.TIER_200),
    BLUE_BOTTOM_150(32, WheelColor.BLUE, SlotTier.TIER_150),
    BLUE_BOTTOM_100(33, WheelColor.BLUE, SlotTier.TIER_100),
    PURPLE_BOTTOM_100(34, WheelColor.PURPLE, SlotTier.TIER_100),
    PURPLE_BOTTOM_150(35, WheelColor.PURPLE, SlotTier.TIER_150),
    PURPLE_200(36, WheelColor.PURPLE, SlotTier.TIER_200);

    public static final int COUNT = 36;
    private static final int GRID_WIDTH = 6;
    private static final WheelSlot[] BY_ID = new WheelSlot[COUNT + 1];

    static {
        for (WheelSlot slot : values()) {
            BY_ID[slot.id] = slot;
        }
    }

    private final int id;
    private final WheelColor color;
    private final SlotTier tier;

    WheelSlot(int id, WheelColor color, SlotTier tier) {
        this.id = id;
        this.color = color;
        this.tier = tier;
    }

    public int getId() {
        return id;
    }

    public WheelColor getColor() {
        return color;
    }

    public SlotTier getTier() {
        return tier;
    }

    /**
     * @return 1-based grid row
     */
    public int getRow() {
        return (id - 1) / GRID_WIDTH + 1;
    }

    /**
     * @return 1-based grid column
     */
    public int getColumn() {
        return (id - 1) % GRID_WIDTH + 1;
    }

    /**
     * Steps from this slot to the centre of its colour's quadrant.
     */
    public int distanceToCenter() {
        return Math.abs(getRow() - color.getCenterRow()) + Math.abs(getColumn() - color.getCenterColumn());
    }

    /**
     * @param id slot id in 1..36
     * @return the slot
     * @throws IllegalArgumentException if the id is out of range
     */
    public static WheelSlot byId(int id) {
        if (id < 1 || id > COUNT) {
            throw new IllegalArgumentException("Slot id out of range: " + id);
        }
        return BY_ID[id];
    }

    public static Optional<WheelSlot> findById(int id) {
        return id < 1 || id > COUNT ? Optional.empty() : Optional.of(BY_ID[id]);
    }

    /**
     * @return the slot at the given grid position, if any
     */
    public static Optional<WheelSlot> at(int row, int column) {
        if (row < 1 || row > GRID_WIDTH || column < 1 || column > GRID_WIDTH) {
            return Optional.empty();
        }
        return Optional.of(BY_ID[(row - 1) * GRID_WIDTH + column]);
    }
}
