package org.lsst.cti.extract;

import java.util.Collections;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts rows of the pedestal, the corner of the frame lying in both the
 * parallel and the serial overscan, counted from its first row.
 */
public class ParallelPedestalExtractor extends ParallelFPRExtractor {

    public ParallelPedestalExtractor(Shape2D shape, Region pedestal) {
        super(shape, Collections.singletonList(pedestal));
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.PARALLEL_PEDESTAL;
    }
}
