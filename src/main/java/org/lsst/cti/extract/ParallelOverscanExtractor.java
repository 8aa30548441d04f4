package org.lsst.cti.extract;

import java.util.Collections;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts rows of the parallel overscan, counted from its first row.
 */
public class ParallelOverscanExtractor extends ParallelFPRExtractor {

    public ParallelOverscanExtractor(Shape2D shape, Region parallelOverscan) {
        super(shape, Collections.singletonList(parallelOverscan));
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.PARALLEL_OVERSCAN;
    }
}
