package org.lsst.cti.extract;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.cti.array.Array1D;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.array.MaskAwareAggregator;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Base class for extracting a strip of pixels from every charge region of a
 * frame, for example the first rows of each region (the parallel FPR) or the
 * rows trailing each region (the parallel EPER).
 * <p>
 * Each subclass counts pixels from its own reference edge of the region and
 * knows how many pixels every region has available from that edge.
 */
public abstract class Extractor {

    private static final Logger LOG = Logger.getLogger(Extractor.class.getName());

    private final Shape2D shape;
    private final List<Region> regionList;
    private final int totalRowsMin;
    private final int totalColumnsMin;

    protected Extractor(Shape2D shape, List<Region> regionList) {
        this.shape = shape;
        this.regionList = Collections.unmodifiableList(new ArrayList<>(regionList));
        int rowsMin = Integer.MAX_VALUE;
        int columnsMin = Integer.MAX_VALUE;
        for (Region region : regionList) {
            rowsMin = Math.min(rowsMin, region.getTotalRows());
            columnsMin = Math.min(columnsMin, region.getTotalColumns());
        }
        this.totalRowsMin = regionList.isEmpty() ? 0 : rowsMin;
        this.totalColumnsMin = regionList.isEmpty() ? 0 : columnsMin;
    }

    public abstract ExtractionKind getKind();

    /**
     * @return The axis averaged over when the stacked strips are binned
     */
    public abstract BinningAxis getBinningAxis();

    /**
     * The number of pixels region <code>index</code> offers from the
     * reference edge.
     *
     * @param index The region index
     * @return The available pixels
     */
    protected abstract int pixelsAvailable(int index);

    /**
     * Build the strip of a region covering the given pixels.
     *
     * @param region The charge region
     * @param pixels The pixels, relative to the reference edge
     * @return The strip
     */
    protected abstract Region regionFrom(Region region, PixelRange pixels);

    public Shape2D getShape() {
        return shape;
    }

    public List<Region> getRegionList() {
        return regionList;
    }

    public int getTotalRowsMin() {
        return totalRowsMin;
    }

    public int getTotalColumnsMin() {
        return totalColumnsMin;
    }

    /**
     * @return The largest number of pixels every region can provide
     */
    public int maximumExtractable() {
        int result = Integer.MAX_VALUE;
        for (int i = 0; i < regionList.size(); i++) {
            result = Math.min(result, pixelsAvailable(i));
        }
        return regionList.isEmpty() ? 0 : result;
    }

    protected PixelRange defaultPixels() {
        int maximum = maximumExtractable();
        if (maximum <= 0) {
            throw new ExtractionSizeException("No pixels available to extract for " + getKind());
        }
        return new PixelRange(0, maximum);
    }

    public List<Region> regionListFrom(ExtractionSettings settings) {
        List<Region> result = new ArrayList<>(regionList.size());
        if (regionList.isEmpty()) {
            return result;
        }
        PixelRange requested = settings.getPixels();
        if (requested == null && settings.getPixelsFromEnd() == null) {
            requested = defaultPixels();
        }
        for (int i = 0; i < regionList.size(); i++) {
            PixelRange pixels = pixelsFor(i, requested, settings);
            if (pixels == null) {
                LOG.log(Level.FINE, "{0} region {1} has no pixels to extract, skipped", new Object[]{getKind(), regionList.get(i)});
            } else {
                result.add(regionFrom(regionList.get(i), pixels));
            }
        }
        LOG.log(Level.FINE, "{0} extraction with {1} gave regions {2}", new Object[]{getKind(), settings, result});
        return result;
    }

    public List<Region> regionListFrom() {
        return regionListFrom(ExtractionSettings.defaults());
    }

    /**
     * @return The pixels of region <code>index</code>, or <code>null</code> if
     * uneven sizes are allowed and the region has none in the requested range
     */
    private PixelRange pixelsFor(int index, PixelRange requested, ExtractionSettings settings) {
        int available = pixelsAvailable(index);
        Integer fromEnd = settings.getPixelsFromEnd();
        if (fromEnd != null && fromEnd == ExtractionSettings.ALL_PIXELS) {
            if (available > 0) {
                return new PixelRange(0, available);
            }
            if (settings.isUnevenSizesAllowed()) {
                return null;
            }
            throw new ExtractionSizeException("Region " + regionList.get(index) + " has no pixels available for " + getKind());
        }
        if (fromEnd != null) {
            if (fromEnd < 1 || fromEnd > available) {
                throw new ExtractionSizeException("Cannot extract " + fromEnd + " pixels from end of region " + regionList.get(index) + " which has " + available);
            }
            return new PixelRange(available - fromEnd, available);
        }
        if (requested.getEnd() <= available) {
            return requested;
        }
        if (!settings.isUnevenSizesAllowed()) {
            throw new ExtractionSizeException("Pixels " + requested + " exceed the " + available + " available to region " + regionList.get(index) + " for " + getKind());
        }
        if (requested.getStart() >= available) {
            return null;
        }
        return new PixelRange(requested.getStart(), available);
    }

    /**
     * Extract the strip of every region, each with its part of the mask.
     *
     * @param array The frame, in canonical orientation
     * @param settings The extraction settings
     * @return One array per region, in region order
     */
    public List<Array2D> array2dListFrom(Array2D array, ExtractionSettings settings) {
        checkShape(array.getShape());
        List<Array2D> result = new ArrayList<>();
        for (Region region : regionListFrom(settings)) {
            result.add(array.extract(region));
        }
        return result;
    }

    public List<Array2D> array2dListFrom(Array2D array) {
        return array2dListFrom(array, ExtractionSettings.defaults());
    }

    /**
     * The mean of the strips of every region, ignoring masked pixels. Strips
     * of uneven size are aligned on the reference edge, missing pixels count
     * as masked, and a region with no pixels in range adds nothing.
     *
     * @param array The frame, in canonical orientation
     * @param settings The extraction settings
     * @return The stacked strip
     */
    public Array2D stackedArray2dFrom(Array2D array, ExtractionSettings settings) {
        return MaskAwareAggregator.stackedArray(stackable(array, settings));
    }

    public Array2D stackedArray2dFrom(Array2D array) {
        return stackedArray2dFrom(array, ExtractionSettings.defaults());
    }

    public Array2D stackedArray2dTotalPixelsFrom(Array2D array, ExtractionSettings settings) {
        return MaskAwareAggregator.stackedTotalPixels(stackable(array, settings));
    }

    /**
     * The stacked strip averaged across the axis orthogonal to the clocking
     * direction, giving the 1D profile of the FPR or EPER.
     *
     * @param array The frame, in canonical orientation
     * @param settings The extraction settings
     * @return The binned line
     */
    public Array1D binnedArray1dFrom(Array2D array, ExtractionSettings settings) {
        return MaskAwareAggregator.binnedLine(stackedArray2dFrom(array, settings), getBinningAxis());
    }

    public Array1D binnedArray1dFrom(Array2D array) {
        return binnedArray1dFrom(array, ExtractionSettings.defaults());
    }

    public Array1D binnedArray1dTotalPixelsFrom(Array2D array, ExtractionSettings settings) {
        return MaskAwareAggregator.binnedTotalPixels(stackedArray2dTotalPixelsFrom(array, settings), getBinningAxis());
    }

    /**
     * A mask of the frame shape flagging every extracted pixel.
     *
     * @param settings The extraction settings
     * @param invert If <code>true</code> flag every pixel not extracted
     * instead
     * @return The mask
     */
    public Mask2D maskFrom(ExtractionSettings settings, boolean invert) {
        Mask2D mask = Mask2D.fromRegions(shape, regionListFrom(settings));
        return invert ? mask.invert() : mask;
    }

    /**
     * A copy of the frame keeping only the extracted pixels, everything else
     * set to zero.
     *
     * @param array The frame, in canonical orientation
     * @param settings The extraction settings
     * @return The array, with the frame's shape and mask
     */
    public Array2D isolatedArray2dFrom(Array2D array, ExtractionSettings settings) {
        checkShape(array.getShape());
        return array.keepingOnly(regionListFrom(settings));
    }

    private List<Array2D> stackable(Array2D array, ExtractionSettings settings) {
        if (regionList.isEmpty()) {
            throw new LayoutException("No regions to stack for " + getKind());
        }
        List<Array2D> arrays = array2dListFrom(array, settings);
        if (arrays.isEmpty()) {
            throw new ExtractionSizeException("No region has pixels to stack for " + getKind() + " with " + settings);
        }
        int rows = 0;
        int columns = 0;
        for (Array2D a : arrays) {
            rows = Math.max(rows, a.getShape().getRows());
            columns = Math.max(columns, a.getShape().getColumns());
        }
        Shape2D stackShape = new Shape2D(rows, columns);
        List<Array2D> result = new ArrayList<>(arrays.size());
        for (Array2D a : arrays) {
            result.add(a.getShape().equals(stackShape) ? a : padded(a, stackShape));
        }
        return result;
    }

    private static Array2D padded(Array2D array, Shape2D shape) {
        double[] data = new double[shape.getSize()];
        boolean[][] mask = new boolean[shape.getRows()][shape.getColumns()];
        Shape2D original = array.getShape();
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (y < original.getRows() && x < original.getColumns()) {
                    data[y * shape.getColumns() + x] = array.get(y, x);
                    mask[y][x] = array.isMasked(y, x);
                } else {
                    mask[y][x] = true;
                }
            }
        }
        return new Array2D(shape, data, Mask2D.of(mask));
    }

    private void checkShape(Shape2D arrayShape) {
        if (!shape.equals(arrayShape)) {
            throw new LayoutException("Array shape " + arrayShape + " does not match layout shape " + shape);
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "shape=" + shape + ", regionList=" + regionList + '}';
    }
}
