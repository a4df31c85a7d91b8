package sh.harold.destiny.api.wheel.slot;

/**
 * The four talent trees of the wheel. Each owns one quadrant of the 6x6 slot
 * grid and grows outward from its centre slot.
 */
public enum WheelColor {
    GREEN(3, 3),
    RED(3, 4),
    BLUE(4, 3),
    PURPLE(4, 4);

    private final int centerRow;
    private final int centerColumn;

    WheelColor(int centerRow, int centerColumn) {
        this.centerRow = centerRow;
        this.centerColumn = centerColumn;
    }

    public int getCenterRow() {
        return centerRow;
    }

    public int getCenterColumn() {
        return centerColumn;
    }
}
