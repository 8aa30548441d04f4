package org.lsst.cti.layout;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.lsst.cti.extract.ChargeRegionArrays;
import org.lsst.cti.extract.ExtractionKind;
import org.lsst.cti.extract.Extractor;
import org.lsst.cti.extract.ParallelCalibrationExtractor;
import org.lsst.cti.extract.ParallelEPERExtractor;
import org.lsst.cti.extract.ParallelFPRExtractor;
import org.lsst.cti.extract.ParallelOverscanExtractor;
import org.lsst.cti.extract.ParallelPedestalExtractor;
import org.lsst.cti.extract.ParallelPreInjectionExtractor;
import org.lsst.cti.extract.SerialCalibrationExtractor;
import org.lsst.cti.extract.SerialEPERExtractor;
import org.lsst.cti.extract.SerialFPRExtractor;
import org.lsst.cti.extract.SerialOverscanExtractor;
import org.lsst.cti.extract.SerialOverscanNoEPERExtractor;
import org.lsst.cti.extract.SerialPrescanExtractor;
import org.lsst.cti.frame.RoeCorner;
import org.lsst.cti.frame.RoeRotation;
import org.lsst.cti.frame.Scans;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.RegionRemapper;
import org.lsst.cti.region.Shape2D;

/**
 * Describes where the charge regions and scans of a frame are. A layout is
 * immutable, cropping or rotating produces a new one.
 */
public class Layout {

    private final Shape2D shape;
    private final List<Region> regionList;
    private final RoeCorner originalRoeCorner;
    private final Scans scans;

    /**
     * Create a layout.
     *
     * @param shape The shape of the frame
     * @param regionList The charge regions, in order
     * @param originalRoeCorner The corner the frame was read out from
     * @param scans The prescan and overscan regions
     * @throws LayoutException If any region does not fit the shape
     */
    public Layout(Shape2D shape, List<Region> regionList, RoeCorner originalRoeCorner, Scans scans) {
        for (Region region : regionList) {
            if (!region.fitsWithin(shape)) {
                throw new LayoutException("Charge region " + region + " does not fit in array of shape " + shape);
            }
        }
        scans.checkFits(shape);
        this.shape = shape;
        this.regionList = Collections.unmodifiableList(new ArrayList<>(regionList));
        this.originalRoeCorner = originalRoeCorner;
        this.scans = scans;
    }

    public Layout(Shape2D shape, List<Region> regionList) {
        this(shape, regionList, RoeCorner.BOTTOM_LEFT, Scans.NONE);
    }

    public Shape2D getShape() {
        return shape;
    }

    public List<Region> getRegionList() {
        return regionList;
    }

    public RoeCorner getOriginalRoeCorner() {
        return originalRoeCorner;
    }

    public Scans getScans() {
        return scans;
    }

    public Region getParallelOverscan() {
        return scans.getParallelOverscan();
    }

    public Region getSerialPrescan() {
        return scans.getSerialPrescan();
    }

    public Region getSerialOverscan() {
        return scans.getSerialOverscan();
    }

    /**
     * @return The corner covering the parallel overscan rows and the serial
     * overscan columns, or <code>null</code> if either overscan is absent
     */
    public Region getPedestal() {
        Region parallelOverscan = scans.getParallelOverscan();
        Region serialOverscan = scans.getSerialOverscan();
        if (parallelOverscan == null || serialOverscan == null) {
            return null;
        }
        return new Region(parallelOverscan.getY0(), shape.getRows(), serialOverscan.getX0(), shape.getColumns());
    }

    /**
     * Rotate this layout, given in the orientation the frame was read out
     * in, to the canonical orientation.
     *
     * @param corner The corner the frame was read out from
     * @return The canonical layout
     */
    public Layout rotatedFrom(RoeCorner corner) {
        List<Region> rotated = new ArrayList<>(regionList.size());
        for (Region region : regionList) {
            rotated.add(RoeRotation.rotate(region, shape, corner));
        }
        return new Layout(shape, rotated, corner, scans.rotated(shape, corner));
    }

    /**
     * The layout of the array obtained by cropping this layout's array to
     * a window. Regions which miss the window are dropped.
     *
     * @param extraction The window
     * @return The cropped layout
     */
    public Layout extractedFrom(Region extraction) {
        if (!extraction.fitsWithin(shape)) {
            throw new LayoutException("Extraction region " + extraction + " does not fit in array of shape " + shape);
        }
        List<Region> remapped = new ArrayList<>();
        for (Region region : regionList) {
            Region after = RegionRemapper.regionAfterExtraction(region, extraction);
            if (after != null) {
                remapped.add(after);
            }
        }
        return new Layout(extraction.getShape(), remapped, originalRoeCorner, scans.afterExtraction(extraction));
    }

    /**
     * @return The number of rows between each region and the next one up the
     * array, in order of increasing y0
     */
    public List<Integer> pixelsBetweenRegions() {
        List<Region> sorted = regionsByRow();
        List<Integer> result = new ArrayList<>();
        for (int i = 0; i < sorted.size() - 1; i++) {
            result.add(sorted.get(i + 1).getY0() - sorted.get(i).getY1());
        }
        return result;
    }

    /**
     * @return The number of rows from the end of the last region to the far
     * edge of the array, including any parallel overscan
     */
    public int parallelRowsToArrayEdge() {
        int maxY1 = 0;
        for (Region region : regionList) {
            maxY1 = Math.max(maxY1, region.getY1());
        }
        return shape.getRows() - maxY1;
    }

    public int smallestParallelRowsBetweenRegions() {
        int result = parallelRowsToArrayEdge();
        for (int pixels : pixelsBetweenRegions()) {
            result = Math.min(result, pixels);
        }
        return result;
    }

    /**
     * The regions in front of, between and after the charge regions, over
     * the columns of the first region. Empty gaps are left out.
     *
     * @return The regions without injected charge
     */
    public List<Region> antiRegionList() {
        List<Region> result = new ArrayList<>();
        if (regionList.isEmpty()) {
            return result;
        }
        int x0 = regionList.get(0).getX0();
        int x1 = regionList.get(0).getX1();
        int start = 0;
        for (Region region : regionsByRow()) {
            if (region.getY0() > start) {
                result.add(new Region(start, region.getY0(), x0, x1));
            }
            start = region.getY1();
        }
        if (start < shape.getRows()) {
            result.add(new Region(start, shape.getRows(), x0, x1));
        }
        return result;
    }

    public Extractor extractor(ExtractionKind kind) {
        switch (kind) {
            case PARALLEL_FPR:
                return parallelFprExtractor();
            case PARALLEL_EPER:
                return parallelEperExtractor();
            case SERIAL_FPR:
                return serialFprExtractor();
            case SERIAL_EPER:
                return serialEperExtractor();
            case PARALLEL_OVERSCAN:
                return parallelOverscanExtractor();
            case SERIAL_PRESCAN:
                return serialPrescanExtractor();
            case SERIAL_OVERSCAN:
                return serialOverscanExtractor();
            case PARALLEL_PEDESTAL:
                return parallelPedestalExtractor();
            case PARALLEL_PRE_INJECTION:
                return parallelPreInjectionExtractor();
            case SERIAL_OVERSCAN_NO_EPER:
                return serialOverscanNoEperExtractor();
            default:
                throw new IllegalArgumentException("Unsupported extraction: " + kind);
        }
    }

    public ParallelFPRExtractor parallelFprExtractor() {
        return new ParallelFPRExtractor(shape, regionList);
    }

    public ParallelEPERExtractor parallelEperExtractor() {
        return new ParallelEPERExtractor(shape, regionList);
    }

    public SerialFPRExtractor serialFprExtractor() {
        return new SerialFPRExtractor(shape, regionList);
    }

    public SerialEPERExtractor serialEperExtractor() {
        return new SerialEPERExtractor(shape, regionList);
    }

    public ParallelOverscanExtractor parallelOverscanExtractor() {
        return new ParallelOverscanExtractor(shape, required("parallel overscan", getParallelOverscan()));
    }

    public SerialPrescanExtractor serialPrescanExtractor() {
        return new SerialPrescanExtractor(shape, required("serial prescan", getSerialPrescan()));
    }

    public SerialOverscanExtractor serialOverscanExtractor() {
        return new SerialOverscanExtractor(shape, required("serial overscan", getSerialOverscan()));
    }

    public ParallelPedestalExtractor parallelPedestalExtractor() {
        return new ParallelPedestalExtractor(shape, required("pedestal", getPedestal()));
    }

    public ParallelPreInjectionExtractor parallelPreInjectionExtractor() {
        return new ParallelPreInjectionExtractor(shape, regionList);
    }

    public SerialOverscanNoEPERExtractor serialOverscanNoEperExtractor() {
        return new SerialOverscanNoEPERExtractor(shape, regionList, required("serial overscan", getSerialOverscan()));
    }

    public ChargeRegionArrays chargeRegionArrays() {
        return new ChargeRegionArrays(this);
    }

    public ParallelCalibrationExtractor parallelCalibrationExtractor() {
        return new ParallelCalibrationExtractor(this);
    }

    public SerialCalibrationExtractor serialCalibrationExtractor() {
        return new SerialCalibrationExtractor(this);
    }

    // Rotation can reverse the list, extraction numbering relies on its order
    private List<Region> regionsByRow() {
        List<Region> sorted = new ArrayList<>(regionList);
        sorted.sort(Comparator.comparingInt(Region::getY0));
        return sorted;
    }

    private static Region required(String name, Region region) {
        if (region == null) {
            throw new LayoutException("Layout has no " + name);
        }
        return region;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 59 * hash + Objects.hashCode(this.shape);
        hash = 59 * hash + Objects.hashCode(this.regionList);
        hash = 59 * hash + Objects.hashCode(this.originalRoeCorner);
        hash = 59 * hash + Objects.hashCode(this.scans);
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
        final Layout other = (Layout) obj;
        return Objects.equals(this.shape, other.shape)
                && Objects.equals(this.regionList, other.regionList)
                && this.originalRoeCorner == other.originalRoeCorner
                && Objects.equals(this.scans, other.scans);
    }

    @Override
    public String toString() {
        return "Layout{" + "shape=" + shape + ", regionList=" + regionList + ", originalRoeCorner=" + originalRoeCorner + ", scans=" + scans + '}';
    }
}
