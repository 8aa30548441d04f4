package org.lsst.cti.extract;

import java.util.List;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.RegionSpacing;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts the extended pixel edge response trailing each charge region in
 * the parallel direction, i.e. rows counted from one past the last row of
 * the region. A region's trail ends where the next region starts, or at the
 * array edge.
 */
public class ParallelEPERExtractor extends Extractor {

    public ParallelEPERExtractor(Shape2D shape, List<Region> regionList) {
        super(shape, regionList);
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.PARALLEL_EPER;
    }

    @Override
    public BinningAxis getBinningAxis() {
        return BinningAxis.ACROSS_COLUMNS;
    }

    @Override
    protected int pixelsAvailable(int index) {
        return RegionSpacing.parallelRowsBehind(getRegionList(), index, getShape());
    }

    @Override
    protected Region regionFrom(Region region, PixelRange pixels) {
        return region.parallelTrailingRegion(pixels.getStart(), pixels.getEnd());
    }
}
