package org.lsst.cti.bias;

import org.lsst.cti.array.Array2D;
import org.lsst.cti.frame.Scans;

/**
 * Estimates the electronic bias of a canonical frame from its scans.
 */
public interface BiasCorrection {

    CorrectionFactors compute(Array2D data, Scans scans);

    public interface CorrectionFactors {

        public double correctionFactor(int y, int x);

    }
}
