package org.lsst.cti.bias;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.frame.Scans;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;

/**
 * Fits a straight line in row number to a band of serial prescan columns,
 * and uses it as the bias of every pixel in that row. The last rows, which
 * lie in the parallel overscan, are left out of the fit.
 */
public class PrescanFittedBiasCorrection implements BiasCorrection {

    private static final Logger LOG = Logger.getLogger(PrescanFittedBiasCorrection.class.getName());

    private final int firstColumn;
    private final int endColumn;
    private final int overscanRows;

    /**
     * @param firstColumn First prescan column used, relative to the prescan
     * @param endColumn End column (exclusive), relative to the prescan
     * @param overscanRows Number of trailing rows excluded from the fit
     */
    public PrescanFittedBiasCorrection(int firstColumn, int endColumn, int overscanRows) {
        if (firstColumn < 0 || endColumn <= firstColumn || overscanRows < 0) {
            throw new IllegalArgumentException("Invalid prescan fit columns (" + firstColumn + ", " + endColumn + ") or overscan rows " + overscanRows);
        }
        this.firstColumn = firstColumn;
        this.endColumn = endColumn;
        this.overscanRows = overscanRows;
    }

    @Override
    public CorrectionFactors compute(Array2D data, Scans scans) {
        Region prescan = scans.getSerialPrescan();
        if (prescan == null) {
            throw new LayoutException("Prescan bias fit requires a serial prescan");
        }
        if (endColumn > prescan.getTotalColumns()) {
            throw new LayoutException("Prescan fit columns (" + firstColumn + ", " + endColumn + ") exceed prescan " + prescan);
        }
        int rows = prescan.getY1() - overscanRows;
        double n = 0;
        double sumX = 0;
        double sumY = 0;
        double sumXX = 0;
        double sumXY = 0;
        for (int y = prescan.getY0(); y < rows; y++) {
            for (int x = prescan.getX0() + firstColumn; x < prescan.getX0() + endColumn; x++) {
                if (!data.isMasked(y, x)) {
                    double value = data.get(y, x);
                    n++;
                    sumX += y;
                    sumY += value;
                    sumXX += (double) y * y;
                    sumXY += y * value;
                }
            }
        }
        double denominator = n * sumXX - sumX * sumX;
        if (n == 0 || denominator == 0) {
            throw new LayoutException("Not enough unmasked prescan pixels to fit bias");
        }
        double slope = (n * sumXY - sumX * sumY) / denominator;
        double intercept = (sumY - slope * sumX) / n;
        LOG.log(Level.FINE, "Prescan bias fit: {0} + {1} * row", new Object[]{intercept, slope});
        return (y, x) -> intercept + slope * y;
    }
}
