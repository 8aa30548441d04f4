package org.lsst.cti.extract;

import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;

/**
 * Cuts a frame down to a band of columns over its full height, so that
 * parallel CTI can be calibrated on fewer pixels. The columns are counted
 * from the first column of the first charge region.
 */
public class ParallelCalibrationExtractor {

    private final Layout layout;

    public ParallelCalibrationExtractor(Layout layout) {
        if (layout.getRegionList().isEmpty()) {
            throw new LayoutException("Parallel calibration requires at least one charge region");
        }
        this.layout = layout;
    }

    /**
     * The window covering every row and the requested columns of the first
     * charge region.
     *
     * @param columns The columns, relative to the first region's x0
     * @return The extraction window
     * @throws ExtractionSizeException If the columns are wider than the
     * first charge region
     */
    public Region extractionRegionFrom(PixelRange columns) {
        Region first = layout.getRegionList().get(0);
        if (columns.getStart() < 0 || columns.getEnd() > first.getTotalColumns()) {
            throw new ExtractionSizeException("Columns " + columns + " exceed the " + first.getTotalColumns() + " columns of region " + first);
        }
        return first.parallelFullRegion(layout.getShape(), columns.getStart(), columns.getEnd());
    }

    public Array2D array2dFrom(Array2D array, PixelRange columns) {
        return array.extract(extractionRegionFrom(columns));
    }

    public Mask2D mask2dFrom(Mask2D mask, PixelRange columns) {
        return mask.extract(extractionRegionFrom(columns));
    }

    public Layout extractedLayoutFrom(PixelRange columns) {
        return layout.extractedFrom(extractionRegionFrom(columns));
    }
}
