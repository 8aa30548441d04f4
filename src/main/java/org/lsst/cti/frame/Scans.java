package org.lsst.cti.frame;

import java.util.Objects;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.RegionRemapper;
import org.lsst.cti.region.Shape2D;

/**
 * The prescan and overscan regions of a frame. Any of them may be absent
 * (<code>null</code>).
 */
public class Scans {

    public static final Scans NONE = new Scans(null, null, null);

    private final Region parallelOverscan;
    private final Region serialPrescan;
    private final Region serialOverscan;

    public Scans(Region parallelOverscan, Region serialPrescan, Region serialOverscan) {
        this.parallelOverscan = parallelOverscan;
        this.serialPrescan = serialPrescan;
        this.serialOverscan = serialOverscan;
    }

    public Region getParallelOverscan() {
        return parallelOverscan;
    }

    public Region getSerialPrescan() {
        return serialPrescan;
    }

    public Region getSerialOverscan() {
        return serialOverscan;
    }

    /**
     * Verify that every scan region present fits an array of the given
     * shape.
     *
     * @param shape The array shape
     * @throws LayoutException If a scan region lies outside the array
     */
    public void checkFits(Shape2D shape) {
        check("parallel overscan", parallelOverscan, shape);
        check("serial prescan", serialPrescan, shape);
        check("serial overscan", serialOverscan, shape);
    }

    public Scans rotated(Shape2D shape, RoeCorner corner) {
        return new Scans(RoeRotation.rotate(parallelOverscan, shape, corner),
                RoeRotation.rotate(serialPrescan, shape, corner),
                RoeRotation.rotate(serialOverscan, shape, corner));
    }

    /**
     * Remap the scans into the coordinates of an extraction window. Scans
     * which miss the window become absent.
     *
     * @param extraction The extraction window
     * @return The remapped scans
     */
    public Scans afterExtraction(Region extraction) {
        return new Scans(RegionRemapper.regionAfterExtraction(parallelOverscan, extraction),
                RegionRemapper.regionAfterExtraction(serialPrescan, extraction),
                RegionRemapper.regionAfterExtraction(serialOverscan, extraction));
    }

    private static void check(String name, Region region, Shape2D shape) {
        if (region != null && !region.fitsWithin(shape)) {
            throw new LayoutException("The " + name + " " + region + " does not fit in array of shape " + shape);
        }
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 23 * hash + Objects.hashCode(this.parallelOverscan);
        hash = 23 * hash + Objects.hashCode(this.serialPrescan);
        hash = 23 * hash + Objects.hashCode(this.serialOverscan);
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
        final Scans other = (Scans) obj;
        return Objects.equals(this.parallelOverscan, other.parallelOverscan)
                && Objects.equals(this.serialPrescan, other.serialPrescan)
                && Objects.equals(this.serialOverscan, other.serialOverscan);
    }

    @Override
    public String toString() {
        return "Scans{" + "parallelOverscan=" + parallelOverscan + ", serialPrescan=" + serialPrescan + ", serialOverscan=" + serialOverscan + '}';
    }
}
