package org.lsst.cti.extract;

import java.util.List;
import org.lsst.cti.array.BinningAxis;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts the front pixel response of each charge region in the serial
 * direction, i.e. columns counted from the first column of the region.
 */
public class SerialFPRExtractor extends Extractor {

    public SerialFPRExtractor(Shape2D shape, List<Region> regionList) {
        super(shape, regionList);
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.SERIAL_FPR;
    }

    @Override
    public BinningAxis getBinningAxis() {
        return BinningAxis.ACROSS_ROWS;
    }

    @Override
    protected int pixelsAvailable(int index) {
        return getRegionList().get(index).getTotalColumns();
    }

    @Override
    protected Region regionFrom(Region region, PixelRange pixels) {
        return region.serialFrontRegion(pixels.getStart(), pixels.getEnd());
    }
}
