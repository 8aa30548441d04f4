package org.lsst.cti.extract;

import java.util.List;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts the front pixel response of each charge region in the parallel
 * direction, i.e. rows counted from the first row of the region.
 */
public class ParallelFPRExtractor extends Extractor {

    public ParallelFPRExtractor(Shape2D shape, List<Region> regionList) {
        super(shape, regionList);
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.PARALLEL_FPR;
    }

    @Override
    public BinningAxis getBinningAxis() {
        return BinningAxis.ACROSS_COLUMNS;
    }

    @Override
    protected int pixelsAvailable(int index) {
        return getRegionList().get(index).getTotalRows();
    }

    @Override
    protected Region regionFrom(Region region, PixelRange pixels) {
        return region.parallelFrontRegion(pixels.getStart(), pixels.getEnd());
    }
}
