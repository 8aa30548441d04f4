package org.lsst.cti.extract;

import java.util.ArrayList;
import java.util.List;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts columns of the serial overscan over the rows of each parallel
 * trail, where no serial EPER reaches the overscan. Columns are counted from
 * the first overscan column. A region with no parallel trail is left out.
 */
public class SerialOverscanNoEPERExtractor extends SerialFPRExtractor {

    public SerialOverscanNoEPERExtractor(Shape2D shape, List<Region> regionList, Region serialOverscan) {
        super(shape, trailBands(shape, regionList, serialOverscan));
    }

    private static List<Region> trailBands(Shape2D shape, List<Region> regionList, Region serialOverscan) {
        List<Region> trails = new ParallelEPERExtractor(shape, regionList)
                .regionListFrom(ExtractionSettings.allPixels().withUnevenSizesAllowed());
        List<Region> result = new ArrayList<>(trails.size());
        for (Region trail : trails) {
            result.add(new Region(trail.getY0(), trail.getY1(), serialOverscan.getX0(), serialOverscan.getX1()));
        }
        return result;
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.SERIAL_OVERSCAN_NO_EPER;
    }
}
