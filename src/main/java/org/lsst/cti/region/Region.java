package org.lsst.cti.region;

/**
 * A rectangular region of a 2D array, given as (y0, y1, x0, x1). Rows run
 * from y0 (inclusive) to y1 (exclusive), columns from x0 (inclusive) to x1
 * (exclusive), so the region corresponds to the slice
 * <code>[y0:y1, x0:x1]</code>.
 * <p>
 * Rows count away from the readout register and columns away from the
 * readout electronics, once an array is in its canonical orientation.
 */
public class Region {

    private final int y0;
    private final int y1;
    private final int x0;
    private final int x1;

    public Region(int y0, int y1, int x0, int x1) {
        if (y0 < 0 || y1 < 0 || x0 < 0 || x1 < 0) {
            throw new RegionException("Region has negative coordinates: " + format(y0, y1, x0, x1));
        }
        if (y0 >= y1) {
            throw new RegionException("Region y0 must be less than y1: " + format(y0, y1, x0, x1));
        }
        if (x0 >= x1) {
            throw new RegionException("Region x0 must be less than x1: " + format(y0, y1, x0, x1));
        }
        this.y0 = y0;
        this.y1 = y1;
        this.x0 = x0;
        this.x1 = x1;
    }

    public int getY0() {
        return y0;
    }

    public int getY1() {
        return y1;
    }

    public int getX0() {
        return x0;
    }

    public int getX1() {
        return x1;
    }

    public int getTotalRows() {
        return y1 - y0;
    }

    public int getTotalColumns() {
        return x1 - x0;
    }

    public Shape2D getShape() {
        return new Shape2D(getTotalRows(), getTotalColumns());
    }

    /**
     * Test if this region lies entirely inside an array of the given shape.
     *
     * @param shape The array shape
     * @return <code>true</code> if the region fits
     */
    public boolean fitsWithin(Shape2D shape) {
        return y1 <= shape.getRows() && x1 <= shape.getColumns();
    }

    /**
     * The rows <code>[y0+p0, y0+p1)</code> at the front of this region, over
     * the same columns. Negative <code>p0</code> extends in front of the
     * region.
     *
     * @param p0 First row, relative to y0
     * @param p1 End row (exclusive), relative to y0
     * @return The front region
     */
    public Region parallelFrontRegion(int p0, int p1) {
        return new Region(y0 + p0, y0 + p1, x0, x1);
    }

    /**
     * The rows <code>[y1+p0, y1+p1)</code> trailing this region, over the
     * same columns.
     *
     * @param p0 First row, relative to y1
     * @param p1 End row (exclusive), relative to y1
     * @return The trailing region
     */
    public Region parallelTrailingRegion(int p0, int p1) {
        return new Region(y1 + p0, y1 + p1, x0, x1);
    }

    public Region serialFrontRegion(int p0, int p1) {
        return new Region(y0, y1, x0 + p0, x0 + p1);
    }

    public Region serialTrailingRegion(int p0, int p1) {
        return new Region(y0, y1, x1 + p0, x1 + p1);
    }

    /**
     * The full-width strip of rows covered by this region.
     *
     * @param shape The shape of the enclosing array
     * @return The region <code>(y0, y1, 0, columns)</code>
     */
    public Region serialFullRegion(Shape2D shape) {
        return new Region(y0, y1, 0, shape.getColumns());
    }

    /**
     * Columns <code>[x0+p0, x0+p1)</code> of this region, over every row
     * of the enclosing array.
     *
     * @param shape The shape of the enclosing array
     * @param p0 First column, relative to x0
     * @param p1 End column (exclusive), relative to x0
     * @return The column strip
     */
    public Region parallelFullRegion(Shape2D shape, int p0, int p1) {
        return new Region(0, shape.getRows(), x0 + p0, x0 + p1);
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 29 * hash + this.y0;
        hash = 29 * hash + this.y1;
        hash = 29 * hash + this.x0;
        hash = 29 * hash + this.x1;
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
        final Region other = (Region) obj;
        return this.y0 == other.y0 && this.y1 == other.y1 && this.x0 == other.x0 && this.x1 == other.x1;
    }

    @Override
    public String toString() {
        return format(y0, y1, x0, x1);
    }

    private static String format(int y0, int y1, int x0, int x1) {
        return "(" + y0 + ", " + y1 + ", " + x0 + ", " + x1 + ")";
    }
}
