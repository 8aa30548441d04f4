package org.lsst.cti.layout;

/**
 * Thrown when regions are inconsistent with the array they describe, for
 * example a region which does not fit inside the array shape.
 */
public class LayoutException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LayoutException(String message) {
        super(message);
    }
}
