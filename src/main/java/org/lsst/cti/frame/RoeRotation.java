package org.lsst.cti.frame;

import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Rotates arrays, masks and regions between the orientation in which a frame
 * was read out and the canonical orientation. Every rotation is its own
 * inverse, so the same call converts in either direction.
 */
public class RoeRotation {

    private RoeRotation() {
    }

    public static Array2D rotate(Array2D array, RoeCorner corner) {
        if (corner == RoeCorner.BOTTOM_LEFT) {
            return array;
        }
        Shape2D shape = array.getShape();
        double[] data = new double[shape.getSize()];
        for (int y = 0; y < shape.getRows(); y++) {
            int fromY = corner.flipsRows() ? shape.getRows() - 1 - y : y;
            for (int x = 0; x < shape.getColumns(); x++) {
                int fromX = corner.flipsColumns() ? shape.getColumns() - 1 - x : x;
                data[y * shape.getColumns() + x] = array.get(fromY, fromX);
            }
        }
        return new Array2D(shape, data, rotate(array.getMask(), corner));
    }

    public static Mask2D rotate(Mask2D mask, RoeCorner corner) {
        if (corner == RoeCorner.BOTTOM_LEFT) {
            return mask;
        }
        Shape2D shape = mask.getShape();
        boolean[][] flags = new boolean[shape.getRows()][shape.getColumns()];
        for (int y = 0; y < shape.getRows(); y++) {
            int fromY = corner.flipsRows() ? shape.getRows() - 1 - y : y;
            for (int x = 0; x < shape.getColumns(); x++) {
                int fromX = corner.flipsColumns() ? shape.getColumns() - 1 - x : x;
                flags[y][x] = mask.isMasked(fromY, fromX);
            }
        }
        return Mask2D.of(flags);
    }

    /**
     * Rotate a region defined on an array of the given shape.
     *
     * @param region The region, may be <code>null</code>
     * @param shape The shape of the array the region lies on
     * @param corner The readout electronics corner
     * @return The rotated region, or <code>null</code> if region was
     * <code>null</code>
     */
    public static Region rotate(Region region, Shape2D shape, RoeCorner corner) {
        if (region == null) {
            return null;
        }
        int y0 = region.getY0();
        int y1 = region.getY1();
        int x0 = region.getX0();
        int x1 = region.getX1();
        if (corner.flipsRows()) {
            y0 = shape.getRows() - region.getY1();
            y1 = shape.getRows() - region.getY0();
        }
        if (corner.flipsColumns()) {
            x0 = shape.getColumns() - region.getX1();
            x1 = shape.getColumns() - region.getX0();
        }
        return new Region(y0, y1, x0, x1);
    }
}
