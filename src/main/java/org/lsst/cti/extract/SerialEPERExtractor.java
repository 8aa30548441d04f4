package org.lsst.cti.extract;

import java.util.List;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.RegionSpacing;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts the serial trails of each charge region, i.e. columns counted
 * from one past the last column of the region. These normally lie in the
 * serial overscan.
 */
public class SerialEPERExtractor extends Extractor {

    public SerialEPERExtractor(Shape2D shape, List<Region> regionList) {
        super(shape, regionList);
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.SERIAL_EPER;
    }

    @Override
    public BinningAxis getBinningAxis() {
        return BinningAxis.ACROSS_ROWS;
    }

    @Override
    protected int pixelsAvailable(int index) {
        return RegionSpacing.serialColumnsBehind(getRegionList(), index, getShape());
    }

    @Override
    protected Region regionFrom(Region region, PixelRange pixels) {
        return region.serialTrailingRegion(pixels.getStart(), pixels.getEnd());
    }
}
