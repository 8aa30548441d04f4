package org.lsst.cti.extract;

/**
 * The kinds of region a {@link Extractor} can cut out of a frame.
 */
public enum ExtractionKind {
    PARALLEL_FPR, PARALLEL_EPER, SERIAL_FPR, SERIAL_EPER,
    PARALLEL_OVERSCAN, SERIAL_PRESCAN, SERIAL_OVERSCAN,
    PARALLEL_PEDESTAL, PARALLEL_PRE_INJECTION, SERIAL_OVERSCAN_NO_EPER
}
