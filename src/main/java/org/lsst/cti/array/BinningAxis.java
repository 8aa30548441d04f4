package org.lsst.cti.array;

/**
 * The axis a 2D array is averaged over when it is reduced to a 1D line.
 */
public enum BinningAxis {
    /**
     * Average every column of a row, giving one value per row.
     */
    ACROSS_COLUMNS,
    /**
     * Average every row of a column, giving one value per column.
     */
    ACROSS_ROWS
}
