package org.lsst.cti.frame;

import org.lsst.cti.array.Array1D;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.array.MaskAwareAggregator;
import org.lsst.cti.bias.BiasCorrection;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * A CCD frame held in the canonical orientation, together with the corner
 * its readout electronics were originally at and its scan regions.
 */
public class Frame {

    private final Array2D array;
    private final RoeCorner originalRoeCorner;
    private final Scans scans;

    /**
     * Create a frame from data which is already in canonical orientation.
     *
     * @param array The canonical array
     * @param originalRoeCorner The corner the data was read out from
     * @param scans The scan regions, in canonical orientation
     * @throws LayoutException If a scan region does not fit the array
     */
    public Frame(Array2D array, RoeCorner originalRoeCorner, Scans scans) {
        scans.checkFits(array.getShape());
        this.array = array;
        this.originalRoeCorner = originalRoeCorner;
        this.scans = scans;
    }

    /**
     * Create a frame from raw data as read out, rotating the data, its mask
     * and the scan regions into the canonical orientation.
     *
     * @param raw The raw array
     * @param originalRoeCorner The corner the data was read out from
     * @param originalScans The scan regions in the raw orientation
     * @return The canonical frame
     */
    public static Frame fromOriginalOrientation(Array2D raw, RoeCorner originalRoeCorner, Scans originalScans) {
        originalScans.checkFits(raw.getShape());
        return new Frame(RoeRotation.rotate(raw, originalRoeCorner), originalRoeCorner,
                originalScans.rotated(raw.getShape(), originalRoeCorner));
    }

    public Array2D getArray() {
        return array;
    }

    public RoeCorner getOriginalRoeCorner() {
        return originalRoeCorner;
    }

    public Scans getScans() {
        return scans;
    }

    public Array2D originalOrientation() {
        return RoeRotation.rotate(array, originalRoeCorner);
    }

    public Scans originalOrientationScans() {
        return scans.rotated(array.getShape(), originalRoeCorner);
    }

    /**
     * Crop the frame to a window, remapping the scan regions.
     *
     * @param extraction The window
     * @return The cropped frame
     */
    public Frame extractedFrom(Region extraction) {
        return new Frame(array.extract(extraction), originalRoeCorner, scans.afterExtraction(extraction));
    }

    public Frame parallelOverscanFrame() {
        return extractedFrom(required("parallel overscan", scans.getParallelOverscan()));
    }

    public Frame serialOverscanFrame() {
        return extractedFrom(required("serial overscan", scans.getSerialOverscan()));
    }

    /**
     * Subtract the bias estimated by the given correction from every pixel.
     *
     * @param biasCorrection The bias estimate
     * @return The corrected frame, with the same mask and scans
     */
    public Frame biasCorrected(BiasCorrection biasCorrection) {
        BiasCorrection.CorrectionFactors factors = biasCorrection.compute(array, scans);
        Shape2D shape = array.getShape();
        double[] corrected = new double[shape.getSize()];
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                corrected[y * shape.getColumns() + x] = array.get(y, x) - factors.correctionFactor(y, x);
            }
        }
        return new Frame(new Array2D(shape, corrected, array.getMask()), originalRoeCorner, scans);
    }

    /**
     * @return Mean of every column, averaging over the parallel direction
     */
    public Array1D binnedAcrossParallel() {
        return MaskAwareAggregator.binnedLine(array, BinningAxis.ACROSS_ROWS);
    }

    /**
     * @return Mean of every row, averaging over the serial direction
     */
    public Array1D binnedAcrossSerial() {
        return MaskAwareAggregator.binnedLine(array, BinningAxis.ACROSS_COLUMNS);
    }

    private static Region required(String name, Region region) {
        if (region == null) {
            throw new LayoutException("Frame has no " + name);
        }
        return region;
    }

    @Override
    public String toString() {
        return "Frame{" + "shape=" + array.getShape() + ", originalRoeCorner=" + originalRoeCorner + ", scans=" + scans + '}';
    }
}
