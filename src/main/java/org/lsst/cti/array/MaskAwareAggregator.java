package org.lsst.cti.array;

import java.util.List;
import org.lsst.cti.region.Shape2D;

/**
 * Stacking and binning of arrays which ignore masked pixels. A result pixel
 * is the mean of the unmasked contributors, and is itself masked (with value
 * zero) only when every contributor is masked.
 */
public class MaskAwareAggregator {

    private MaskAwareAggregator() {
    }

    /**
     * Per-pixel mean of a list of equally shaped arrays.
     *
     * @param arrays The arrays to stack
     * @return The stacked array
     */
    public static Array2D stackedArray(List<Array2D> arrays) {
        Shape2D shape = commonShape(arrays);
        double[] sums = new double[shape.getSize()];
        int[] counts = countUnmasked(arrays, shape, sums);
        boolean[][] masked = new boolean[shape.getRows()][shape.getColumns()];
        for (int i = 0; i < sums.length; i++) {
            if (counts[i] == 0) {
                masked[i / shape.getColumns()][i % shape.getColumns()] = true;
            } else {
                sums[i] /= counts[i];
            }
        }
        return Array2D.wrap(shape, sums, Mask2D.of(masked));
    }

    /**
     * The number of unmasked pixels contributing to each pixel of
     * {@link #stackedArray(java.util.List)}, for scaling a noise map in
     * quadrature.
     *
     * @param arrays The arrays to stack
     * @return The per-pixel contributor counts
     */
    public static Array2D stackedTotalPixels(List<Array2D> arrays) {
        Shape2D shape = commonShape(arrays);
        int[] counts = countUnmasked(arrays, shape, null);
        double[] values = new double[counts.length];
        boolean[][] masked = new boolean[shape.getRows()][shape.getColumns()];
        for (int i = 0; i < counts.length; i++) {
            values[i] = counts[i];
            masked[i / shape.getColumns()][i % shape.getColumns()] = counts[i] == 0;
        }
        return Array2D.wrap(shape, values, Mask2D.of(masked));
    }

    /**
     * Reduce an array to a line by averaging the unmasked pixels across the
     * given axis.
     *
     * @param array The array to bin
     * @param axis The axis averaged over
     * @return The binned line, one entry per row for
     * {@link BinningAxis#ACROSS_COLUMNS}, one per column otherwise
     */
    public static Array1D binnedLine(Array2D array, BinningAxis axis) {
        Shape2D shape = array.getShape();
        int length = axis == BinningAxis.ACROSS_COLUMNS ? shape.getRows() : shape.getColumns();
        double[] values = new double[length];
        int[] counts = new int[length];
        double[] data = array.data();
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (!array.isMasked(y, x)) {
                    int index = axis == BinningAxis.ACROSS_COLUMNS ? y : x;
                    values[index] += data[y * shape.getColumns() + x];
                    counts[index]++;
                }
            }
        }
        for (int i = 0; i < length; i++) {
            if (counts[i] > 0) {
                values[i] /= counts[i];
            }
        }
        return new Array1D(values, counts);
    }

    /**
     * Sum per-pixel contributor counts across the given axis.
     *
     * @param totalPixels Counts as produced by
     * {@link #stackedTotalPixels(java.util.List)}
     * @param axis The axis summed over
     * @return Line whose values are the total contributing pixels
     */
    public static Array1D binnedTotalPixels(Array2D totalPixels, BinningAxis axis) {
        Shape2D shape = totalPixels.getShape();
        int length = axis == BinningAxis.ACROSS_COLUMNS ? shape.getRows() : shape.getColumns();
        double[] values = new double[length];
        int[] counts = new int[length];
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (!totalPixels.isMasked(y, x)) {
                    int index = axis == BinningAxis.ACROSS_COLUMNS ? y : x;
                    values[index] += totalPixels.get(y, x);
                    counts[index]++;
                }
            }
        }
        return new Array1D(values, counts);
    }

    private static int[] countUnmasked(List<Array2D> arrays, Shape2D shape, double[] sums) {
        int[] counts = new int[shape.getSize()];
        for (Array2D array : arrays) {
            double[] data = array.data();
            for (int y = 0; y < shape.getRows(); y++) {
                for (int x = 0; x < shape.getColumns(); x++) {
                    if (!array.isMasked(y, x)) {
                        int i = y * shape.getColumns() + x;
                        counts[i]++;
                        if (sums != null) {
                            sums[i] += data[i];
                        }
                    }
                }
            }
        }
        return counts;
    }

    private static Shape2D commonShape(List<Array2D> arrays) {
        if (arrays.isEmpty()) {
            throw new IllegalArgumentException("Cannot stack an empty list of arrays");
        }
        Shape2D shape = arrays.get(0).getShape();
        for (Array2D array : arrays) {
            if (!shape.equals(array.getShape())) {
                throw new IllegalArgumentException("Cannot stack arrays of shape " + shape + " and " + array.getShape());
            }
        }
        return shape;
    }
}
