package org.lsst.cti.extract;

import org.lsst.cti.array.Array2D;

/**
 * Arrays shared by the extraction tests.
 */
class ExtractionFixtures {

    private ExtractionFixtures() {
    }

    /**
     * @return An array whose every pixel holds its row index
     */
    static Array2D rowIndexArray(int rows, int columns) {
        double[][] values = new double[rows][columns];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                values[y][x] = y;
            }
        }
        return Array2D.of(values);
    }

    /**
     * @return An array whose every pixel holds its column index
     */
    static Array2D columnIndexArray(int rows, int columns) {
        double[][] values = new double[rows][columns];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < columns; x++) {
                values[y][x] = x;
            }
        }
        return Array2D.of(values);
    }
}
