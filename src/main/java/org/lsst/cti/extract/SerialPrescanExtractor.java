package org.lsst.cti.extract;

import java.util.Collections;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts columns of the serial prescan, counted from its first column.
 */
public class SerialPrescanExtractor extends SerialFPRExtractor {

    public SerialPrescanExtractor(Shape2D shape, Region serialPrescan) {
        super(shape, Collections.singletonList(serialPrescan));
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.SERIAL_PRESCAN;
    }
}
