package org.lsst.cti.frame;

/**
 * The corner of a raw frame at which the readout electronics (ROE) sit. The
 * canonical orientation has the electronics at the bottom left, so that
 * parallel clocking moves charge towards row 0 and serial clocking towards
 * column 0.
 */
public enum RoeCorner {

    TOP_LEFT(0, 0, true, false),
    TOP_RIGHT(0, 1, true, true),
    BOTTOM_LEFT(1, 0, false, false),
    BOTTOM_RIGHT(1, 1, false, true);

    private final int row;
    private final int column;
    private final boolean flipsRows;
    private final boolean flipsColumns;

    RoeCorner(int row, int column, boolean flipsRows, boolean flipsColumns) {
        this.row = row;
        this.column = column;
        this.flipsRows = flipsRows;
        this.flipsColumns = flipsColumns;
    }

    /**
     * @return The (row, column) tuple identifying this corner
     */
    public int[] getTuple() {
        return new int[]{row, column};
    }

    /**
     * @return <code>true</code> if rotation to the canonical orientation
     * reverses the row order
     */
    public boolean flipsRows() {
        return flipsRows;
    }

    /**
     * @return <code>true</code> if rotation to the canonical orientation
     * reverses the column order
     */
    public boolean flipsColumns() {
        return flipsColumns;
    }

    public static RoeCorner fromTuple(int row, int column) {
        for (RoeCorner corner : values()) {
            if (corner.row == row && corner.column == column) {
                return corner;
            }
        }
        throw new IllegalArgumentException("Invalid readout electronics corner: (" + row + ", " + column + ")");
    }
}
