package org.lsst.cti.extract;

/**
 * Thrown when the pixels requested from an extraction exceed what the
 * regions can provide.
 */
public class ExtractionSizeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ExtractionSizeException(String message) {
        super(message);
    }
}
