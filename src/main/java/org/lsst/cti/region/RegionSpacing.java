package org.lsst.cti.region;

import java.util.List;

/**
 * Distances between the charge regions of a frame, which bound how far a
 * trail behind each region can be followed.
 */
public class RegionSpacing {

    private RegionSpacing() {
    }

    /**
     * The number of rows behind a region before the next region sharing any
     * of its columns starts, or the array edge if there is none.
     *
     * @param regions The charge regions
     * @param index The index of the region of interest
     * @param shape The array shape
     * @return The number of trailing rows
     */
    public static int parallelRowsBehind(List<Region> regions, int index, Shape2D shape) {
        Region region = regions.get(index);
        int limit = shape.getRows();
        for (Region other : regions) {
            if (other != region && other.getY0() >= region.getY1() && overlaps(other.getX0(), other.getX1(), region.getX0(), region.getX1())) {
                limit = Math.min(limit, other.getY0());
            }
        }
        return limit - region.getY1();
    }

    /**
     * The number of columns behind a region before the next region sharing
     * any of its rows starts, or the array edge if there is none.
     *
     * @param regions The charge regions
     * @param index The index of the region of interest
     * @param shape The array shape
     * @return The number of trailing columns
     */
    public static int serialColumnsBehind(List<Region> regions, int index, Shape2D shape) {
        Region region = regions.get(index);
        int limit = shape.getColumns();
        for (Region other : regions) {
            if (other != region && other.getX0() >= region.getX1() && overlaps(other.getY0(), other.getY1(), region.getY0(), region.getY1())) {
                limit = Math.min(limit, other.getX0());
            }
        }
        return limit - region.getX1();
    }

    private static boolean overlaps(int a0, int a1, int b0, int b1) {
        return a0 < b1 && b0 < a1;
    }
}
