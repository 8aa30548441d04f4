package org.lsst.cti.array;

import java.util.Arrays;
import java.util.List;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * An immutable boolean mask, where <code>true</code> marks a pixel which is
 * excluded from any calculation.
 */
public class Mask2D {

    private final Shape2D shape;
    private final boolean[] flags;

    private Mask2D(Shape2D shape, boolean[] flags) {
        this.shape = shape;
        this.flags = flags;
    }

    public static Mask2D unmasked(Shape2D shape) {
        return new Mask2D(shape, new boolean[shape.getSize()]);
    }

    public static Mask2D of(boolean[][] mask) {
        Shape2D shape = shapeOf(mask.length, mask.length == 0 ? 0 : mask[0].length);
        boolean[] flags = new boolean[shape.getSize()];
        for (int y = 0; y < mask.length; y++) {
            if (mask[y].length != shape.getColumns()) {
                throw new IllegalArgumentException("Ragged mask, row " + y + " has " + mask[y].length + " columns");
            }
            System.arraycopy(mask[y], 0, flags, y * shape.getColumns(), shape.getColumns());
        }
        return new Mask2D(shape, flags);
    }

    /**
     * Create a mask with every pixel inside any of the given regions masked.
     *
     * @param shape The shape of the mask
     * @param regions The regions to mask
     * @return The new mask
     */
    public static Mask2D fromRegions(Shape2D shape, List<Region> regions) {
        boolean[] flags = new boolean[shape.getSize()];
        for (Region region : regions) {
            checkFits(region, shape);
            for (int y = region.getY0(); y < region.getY1(); y++) {
                Arrays.fill(flags, y * shape.getColumns() + region.getX0(), y * shape.getColumns() + region.getX1(), true);
            }
        }
        return new Mask2D(shape, flags);
    }

    /**
     * Stack masks with the same number of columns on top of each other.
     *
     * @param masks The masks, first one at row 0
     * @return The concatenated mask
     */
    public static Mask2D concatenateRows(List<Mask2D> masks) {
        if (masks.isEmpty()) {
            throw new IllegalArgumentException("No masks to concatenate");
        }
        int columns = masks.get(0).shape.getColumns();
        int rows = 0;
        for (Mask2D mask : masks) {
            if (mask.shape.getColumns() != columns) {
                throw new IllegalArgumentException("Cannot concatenate masks with " + columns + " and " + mask.shape.getColumns() + " columns");
            }
            rows += mask.shape.getRows();
        }
        boolean[] flags = new boolean[rows * columns];
        int position = 0;
        for (Mask2D mask : masks) {
            System.arraycopy(mask.flags, 0, flags, position, mask.flags.length);
            position += mask.flags.length;
        }
        return new Mask2D(new Shape2D(rows, columns), flags);
    }

    public Shape2D getShape() {
        return shape;
    }

    public boolean isMasked(int y, int x) {
        return flags[y * shape.getColumns() + x];
    }

    public int getMaskedCount() {
        int count = 0;
        for (boolean flag : flags) {
            if (flag) {
                count++;
            }
        }
        return count;
    }

    public Mask2D extract(Region region) {
        checkFits(region, shape);
        boolean[] result = new boolean[region.getTotalRows() * region.getTotalColumns()];
        for (int y = region.getY0(); y < region.getY1(); y++) {
            System.arraycopy(flags, y * shape.getColumns() + region.getX0(), result, (y - region.getY0()) * region.getTotalColumns(), region.getTotalColumns());
        }
        return new Mask2D(region.getShape(), result);
    }

    public Mask2D invert() {
        boolean[] result = new boolean[flags.length];
        for (int i = 0; i < flags.length; i++) {
            result[i] = !flags[i];
        }
        return new Mask2D(shape, result);
    }

    /**
     * Combine with another mask of the same shape, masking a pixel if either
     * mask does.
     *
     * @param other The other mask
     * @return The combined mask
     */
    public Mask2D or(Mask2D other) {
        if (!shape.equals(other.shape)) {
            throw new IllegalArgumentException("Mask shapes differ: " + shape + " and " + other.shape);
        }
        boolean[] result = new boolean[flags.length];
        for (int i = 0; i < flags.length; i++) {
            result[i] = flags[i] || other.flags[i];
        }
        return new Mask2D(shape, result);
    }

    public boolean[][] toArray() {
        boolean[][] result = new boolean[shape.getRows()][shape.getColumns()];
        for (int y = 0; y < shape.getRows(); y++) {
            System.arraycopy(flags, y * shape.getColumns(), result[y], 0, shape.getColumns());
        }
        return result;
    }

    static Shape2D shapeOf(int rows, int columns) {
        if (rows == 0 || columns == 0) {
            throw new IllegalArgumentException("Empty array");
        }
        return new Shape2D(rows, columns);
    }

    static void checkFits(Region region, Shape2D shape) {
        if (!region.fitsWithin(shape)) {
            throw new LayoutException("Region " + region + " does not fit in array of shape " + shape);
        }
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 67 * hash + shape.hashCode();
        hash = 67 * hash + Arrays.hashCode(this.flags);
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
        final Mask2D other = (Mask2D) obj;
        return this.shape.equals(other.shape) && Arrays.equals(this.flags, other.flags);
    }

    @Override
    public String toString() {
        return "Mask2D{" + "shape=" + shape + ", masked=" + getMaskedCount() + '}';
    }
}
