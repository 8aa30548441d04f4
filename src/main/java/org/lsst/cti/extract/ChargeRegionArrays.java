package org.lsst.cti.extract;

import java.util.ArrayList;
import java.util.List;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;

/**
 * Full-frame views of a layout's charge regions. Each method returns an
 * array of the frame's shape, with the selected pixels kept and the rest set
 * to zero.
 */
public class ChargeRegionArrays {

    private final Layout layout;

    public ChargeRegionArrays(Layout layout) {
        this.layout = layout;
    }

    public Array2D regionsArray2dFrom(Array2D array) {
        checkShape(array);
        return array.keepingOnly(layout.getRegionList());
    }

    public Array2D nonRegionsArray2dFrom(Array2D array) {
        checkShape(array);
        return array.zeroedIn(layout.getRegionList());
    }

    /**
     * Keep the leading rows and the trailing rows of every charge region.
     *
     * @param array The frame, in canonical orientation
     * @param fprPixels Rows from the front of each region, or
     * <code>null</code> for none
     * @param eperPixels Rows behind each region, or <code>null</code> for none
     * @return The frame with only those rows kept
     */
    public Array2D parallelFprsAndEpersArray2dFrom(Array2D array, PixelRange fprPixels, PixelRange eperPixels) {
        return combined(array, layout.parallelFprExtractor(), fprPixels, layout.parallelEperExtractor(), eperPixels);
    }

    /**
     * Keep the leading columns and the trailing columns of every charge
     * region.
     *
     * @param array The frame, in canonical orientation
     * @param fprPixels Columns from the front of each region, or
     * <code>null</code> for none
     * @param eperPixels Columns behind each region, or <code>null</code> for
     * none
     * @return The frame with only those columns kept
     */
    public Array2D serialFprsAndEpersArray2dFrom(Array2D array, PixelRange fprPixels, PixelRange eperPixels) {
        return combined(array, layout.serialFprExtractor(), fprPixels, layout.serialEperExtractor(), eperPixels);
    }

    private Array2D combined(Array2D array, Extractor fpr, PixelRange fprPixels, Extractor eper, PixelRange eperPixels) {
        checkShape(array);
        List<Region> kept = new ArrayList<>();
        if (fprPixels != null) {
            kept.addAll(fpr.regionListFrom(new ExtractionSettings(fprPixels, null, false)));
        }
        if (eperPixels != null) {
            kept.addAll(eper.regionListFrom(new ExtractionSettings(eperPixels, null, false)));
        }
        return array.keepingOnly(kept);
    }

    private void checkShape(Array2D array) {
        if (!array.getShape().equals(layout.getShape())) {
            throw new LayoutException("Array shape " + array.getShape() + " does not match layout shape " + layout.getShape());
        }
    }
}
