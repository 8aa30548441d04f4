package org.lsst.cti.extract;

import java.util.ArrayList;
import java.util.List;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.frame.Scans;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Builds a smaller frame for serial CTI calibration by taking the same rows
 * of every charge region, over the full width of the frame, and stacking
 * them on top of each other.
 */
public class SerialCalibrationExtractor {

    private final Layout layout;

    public SerialCalibrationExtractor(Layout layout) {
        if (layout.getRegionList().isEmpty()) {
            throw new LayoutException("Serial calibration requires at least one charge region");
        }
        this.layout = layout;
    }

    /**
     * @return The full-width strip of rows of every charge region
     */
    public List<Region> calibrationRegionList() {
        List<Region> result = new ArrayList<>();
        for (Region region : layout.getRegionList()) {
            result.add(region.serialFullRegion(layout.getShape()));
        }
        return result;
    }

    public Array2D array2dFrom(Array2D array, PixelRange rows) {
        List<Array2D> blocks = new ArrayList<>();
        for (Region region : rowRegions(rows)) {
            blocks.add(array.extract(region));
        }
        return Array2D.concatenateRows(blocks);
    }

    public Mask2D mask2dFrom(Mask2D mask, PixelRange rows) {
        List<Mask2D> blocks = new ArrayList<>();
        for (Region region : rowRegions(rows)) {
            blocks.add(mask.extract(region));
        }
        return Mask2D.concatenateRows(blocks);
    }

    /**
     * The layout of the array produced by
     * {@link #array2dFrom(org.lsst.cti.array.Array2D, org.lsst.cti.extract.PixelRange)}.
     * Each charge region becomes one block of rows spanning the columns of
     * the first region, the serial scans keep their columns and the parallel
     * overscan is dropped.
     *
     * @param rows The rows taken from each region
     * @return The derived layout
     */
    public Layout extractedLayoutFrom(PixelRange rows) {
        checkRows(rows);
        int blocks = layout.getRegionList().size();
        Shape2D shape = new Shape2D(blocks * rows.getSize(), layout.getShape().getColumns());
        Region first = layout.getRegionList().get(0);
        List<Region> regions = new ArrayList<>(blocks);
        int offset = 0;
        for (int i = 0; i < blocks; i++) {
            regions.add(new Region(offset, offset + rows.getSize(), first.getX0(), first.getX1()));
            offset += rows.getSize();
        }
        Scans scans = layout.getScans();
        Scans extracted = new Scans(null, fullHeight(scans.getSerialPrescan(), shape), fullHeight(scans.getSerialOverscan(), shape));
        return new Layout(shape, regions, layout.getOriginalRoeCorner(), extracted);
    }

    private List<Region> rowRegions(PixelRange rows) {
        checkRows(rows);
        List<Region> result = new ArrayList<>();
        for (Region strip : calibrationRegionList()) {
            result.add(strip.parallelFrontRegion(rows.getStart(), rows.getEnd()));
        }
        return result;
    }

    private void checkRows(PixelRange rows) {
        int rowsMin = Integer.MAX_VALUE;
        for (Region region : layout.getRegionList()) {
            rowsMin = Math.min(rowsMin, region.getTotalRows());
        }
        if (rows.getStart() < 0 || rows.getEnd() > rowsMin) {
            throw new ExtractionSizeException("Rows " + rows + " exceed the " + rowsMin + " rows of the smallest charge region");
        }
    }

    private static Region fullHeight(Region scan, Shape2D shape) {
        return scan == null ? null : new Region(0, shape.getRows(), scan.getX0(), scan.getX1());
    }
}
