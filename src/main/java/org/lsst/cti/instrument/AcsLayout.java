package org.lsst.cti.instrument;

import org.lsst.cti.array.Array2D;
import org.lsst.cti.bias.BiasCorrection;
import org.lsst.cti.bias.PrescanFittedBiasCorrection;
import org.lsst.cti.frame.Frame;
import org.lsst.cti.frame.RoeCorner;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;

/**
 * Quadrant geometry for the HST ACS/WFC detector. A full CCD array holds two
 * quadrants side by side; A and C are the left half, B and D the right, and
 * A and B are stored upside down relative to C and D.
 */
public class AcsLayout extends InstrumentLayout {

    private final char quadrant;

    public AcsLayout(char quadrant) {
        this(quadrant, ScanSizes.HST_ACS);
    }

    public AcsLayout(char quadrant, ScanSizes sizes) {
        super(sizes, cornerFor(quadrant));
        this.quadrant = quadrant;
    }

    public static RoeCorner cornerFor(char quadrant) {
        switch (quadrant) {
            case 'A':
                return RoeCorner.TOP_LEFT;
            case 'B':
                return RoeCorner.TOP_RIGHT;
            case 'C':
                return RoeCorner.BOTTOM_LEFT;
            case 'D':
                return RoeCorner.BOTTOM_RIGHT;
            default:
                throw new LayoutException("ACS quadrant must be A, B, C or D, not " + quadrant);
        }
    }

    /**
     * The standard ACS bias estimate, a fit to prescan columns 18-23 over
     * every row above the parallel overscan.
     *
     * @return The bias correction
     */
    public static BiasCorrection prescanBiasCorrection() {
        return new PrescanFittedBiasCorrection(18, 24, ScanSizes.HST_ACS.getParallelOverscanSize());
    }

    public char getQuadrant() {
        return quadrant;
    }

    /**
     * @return The part of the full CCD array holding this quadrant
     */
    public Region quadrantRegion() {
        int rows = getShape().getRows();
        int columns = getShape().getColumns();
        if (quadrant == 'A' || quadrant == 'C') {
            return new Region(0, rows, 0, columns);
        } else {
            return new Region(0, rows, columns, 2 * columns);
        }
    }

    /**
     * Cut this quadrant out of a full CCD array and rotate it to canonical
     * orientation.
     *
     * @param ccd The full CCD array
     * @return The canonical frame
     */
    public Frame frameFromCcd(Array2D ccd) {
        return frameFor(ccd.extract(quadrantRegion()));
    }
}
