package org.lsst.cti.bias;

import org.lsst.cti.array.Array2D;
import org.lsst.cti.frame.Scans;

/**
 * Leaves the data unchanged.
 */
public class NullBiasCorrection implements BiasCorrection {

    private static final CorrectionFactors NONE = (y, x) -> 0;

    @Override
    public CorrectionFactors compute(Array2D data, Scans scans) {
        return NONE;
    }

}
