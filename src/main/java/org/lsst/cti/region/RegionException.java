package org.lsst.cti.region;

/**
 * Thrown when a region is constructed from invalid coordinates.
 */
public class RegionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public RegionException(String message) {
        super(message);
    }
}
