package org.lsst.cti.array;

import java.util.Arrays;
import java.util.List;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * An immutable 2D array of pixel values with an associated mask. Masked
 * pixels always hold the value zero, the original value is discarded when
 * the mask is applied.
 */
public class Array2D {

    private final Shape2D shape;
    private final double[] data;
    private final Mask2D mask;

    /**
     * Create an array from row-major data.
     *
     * @param shape The array shape
     * @param data Row-major values, copied
     * @param mask The mask, must have the same shape
     */
    public Array2D(Shape2D shape, double[] data, Mask2D mask) {
        if (data.length != shape.getSize()) {
            throw new IllegalArgumentException("Data length " + data.length + " does not match shape " + shape);
        }
        if (!shape.equals(mask.getShape())) {
            throw new IllegalArgumentException("Mask shape " + mask.getShape() + " does not match array shape " + shape);
        }
        this.shape = shape;
        this.mask = mask;
        this.data = applyMask(data.clone(), shape, mask);
    }

    private Array2D(Shape2D shape, Mask2D mask, double[] data) {
        this.shape = shape;
        this.mask = mask;
        this.data = data;
    }

    public static Array2D of(double[][] values) {
        Shape2D shape = Mask2D.shapeOf(values.length, values.length == 0 ? 0 : values[0].length);
        return new Array2D(shape, flatten(values, shape), Mask2D.unmasked(shape));
    }

    public static Array2D of(double[][] values, boolean[][] mask) {
        Shape2D shape = Mask2D.shapeOf(values.length, values.length == 0 ? 0 : values[0].length);
        return new Array2D(shape, flatten(values, shape), Mask2D.of(mask));
    }

    /**
     * Stack arrays with the same number of columns on top of each other,
     * keeping their masks.
     *
     * @param arrays The arrays, first one at row 0
     * @return The concatenated array
     */
    public static Array2D concatenateRows(List<Array2D> arrays) {
        if (arrays.isEmpty()) {
            throw new IllegalArgumentException("No arrays to concatenate");
        }
        Mask2D[] masks = new Mask2D[arrays.size()];
        for (int i = 0; i < masks.length; i++) {
            masks[i] = arrays.get(i).mask;
        }
        Mask2D mask = Mask2D.concatenateRows(Arrays.asList(masks));
        double[] data = new double[mask.getShape().getSize()];
        int position = 0;
        for (Array2D array : arrays) {
            System.arraycopy(array.data, 0, data, position, array.data.length);
            position += array.data.length;
        }
        return new Array2D(mask.getShape(), mask, data);
    }

    public Shape2D getShape() {
        return shape;
    }

    public Mask2D getMask() {
        return mask;
    }

    public double get(int y, int x) {
        return data[y * shape.getColumns() + x];
    }

    public boolean isMasked(int y, int x) {
        return mask.isMasked(y, x);
    }

    /**
     * Extract the slice <code>[y0:y1, x0:x1]</code> of this array, together
     * with the same slice of its mask.
     *
     * @param region The region to extract
     * @return A new array of the region's shape
     */
    public Array2D extract(Region region) {
        Mask2D.checkFits(region, shape);
        int columns = region.getTotalColumns();
        double[] result = new double[region.getTotalRows() * columns];
        for (int y = region.getY0(); y < region.getY1(); y++) {
            System.arraycopy(data, y * shape.getColumns() + region.getX0(), result, (y - region.getY0()) * columns, columns);
        }
        return new Array2D(region.getShape(), mask.extract(region), result);
    }

    /**
     * Add further masked pixels to this array.
     *
     * @param extra The additional mask, combined with the existing one
     * @return The new array
     */
    public Array2D masked(Mask2D extra) {
        Mask2D combined = mask.or(extra);
        return new Array2D(shape, combined, applyMask(data.clone(), shape, combined));
    }

    /**
     * Copy the unmasked values into a new array with every pixel outside the
     * given regions set to zero.
     *
     * @param regions The regions to keep
     * @return The new array, with the original mask
     */
    public Array2D keepingOnly(List<Region> regions) {
        return zeroed(regions, false);
    }

    /**
     * Copy the values into a new array with every pixel inside the given
     * regions set to zero.
     *
     * @param regions The regions to clear
     * @return The new array, with the original mask
     */
    public Array2D zeroedIn(List<Region> regions) {
        return zeroed(regions, true);
    }

    private Array2D zeroed(List<Region> regions, boolean inside) {
        Mask2D covered = Mask2D.fromRegions(shape, regions);
        double[] result = data.clone();
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (covered.isMasked(y, x) == inside) {
                    result[y * shape.getColumns() + x] = 0;
                }
            }
        }
        return new Array2D(shape, mask, result);
    }

    public double[][] toArray() {
        double[][] result = new double[shape.getRows()][shape.getColumns()];
        for (int y = 0; y < shape.getRows(); y++) {
            System.arraycopy(data, y * shape.getColumns(), result[y], 0, shape.getColumns());
        }
        return result;
    }

    // Shared with MaskAwareAggregator, never modified
    double[] data() {
        return data;
    }

    static Array2D wrap(Shape2D shape, double[] data, Mask2D mask) {
        return new Array2D(shape, mask, data);
    }

    private static double[] flatten(double[][] values, Shape2D shape) {
        double[] result = new double[shape.getSize()];
        for (int y = 0; y < values.length; y++) {
            if (values[y].length != shape.getColumns()) {
                throw new IllegalArgumentException("Ragged array, row " + y + " has " + values[y].length + " columns");
            }
            System.arraycopy(values[y], 0, result, y * shape.getColumns(), shape.getColumns());
        }
        return result;
    }

    private static double[] applyMask(double[] data, Shape2D shape, Mask2D mask) {
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (mask.isMasked(y, x)) {
                    data[y * shape.getColumns() + x] = 0;
                }
            }
        }
        return data;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + shape.hashCode();
        hash = 53 * hash + Arrays.hashCode(this.data);
        hash = 53 * hash + mask.hashCode();
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final Array2D other = (Array2D) obj;
        return this.shape.equals(other.shape) && Arrays.equals(this.data, other.data) && this.mask.equals(other.mask);
    }

    @Override
    public String toString() {
        return "Array2D{" + "shape=" + shape + ", mask=" + mask + '}';
    }
}
