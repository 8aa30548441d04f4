package org.lsst.cti.extract;

import java.util.Collections;
import java.util.List;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts rows in front of the lowest charge region, over the columns of
 * the first region. These rows hold no injected charge, so they measure
 * constant backgrounds such as bias or stray light.
 */
public class ParallelPreInjectionExtractor extends ParallelFPRExtractor {

    public ParallelPreInjectionExtractor(Shape2D shape, List<Region> regionList) {
        super(shape, Collections.singletonList(preInjectionRegion(regionList)));
    }

    /**
     * @param regionList The charge regions
     * @return The rows from the readout register up to the lowest region
     * @throws LayoutException If there are no regions or the lowest starts
     * at the first row
     */
    public static Region preInjectionRegion(List<Region> regionList) {
        if (regionList.isEmpty()) {
            throw new LayoutException("Pre-injection extraction requires at least one charge region");
        }
        int y0Min = Integer.MAX_VALUE;
        for (Region region : regionList) {
            y0Min = Math.min(y0Min, region.getY0());
        }
        if (y0Min == 0) {
            throw new LayoutException("No rows in front of the charge regions " + regionList);
        }
        Region first = regionList.get(0);
        return new Region(0, y0Min, first.getX0(), first.getX1());
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.PARALLEL_PRE_INJECTION;
    }
}
