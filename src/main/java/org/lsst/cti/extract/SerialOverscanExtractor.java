package org.lsst.cti.extract;

import java.util.Collections;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Extracts columns of the serial overscan, counted from its first column.
 */
public class SerialOverscanExtractor extends SerialFPRExtractor {

    public SerialOverscanExtractor(Shape2D shape, Region serialOverscan) {
        super(shape, Collections.singletonList(serialOverscan));
    }

    @Override
    public ExtractionKind getKind() {
        return ExtractionKind.SERIAL_OVERSCAN;
    }
}
