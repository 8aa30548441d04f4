package org.lsst.cti.extract;

import java.util.Objects;

/**
 * Controls which pixels an {@link Extractor} takes from each region.
 * <p>
 * If <code>pixelsFromEnd</code> is set the last that many pixels available
 * to each region are taken, otherwise the explicit <code>pixels</code> range,
 * otherwise the extractor's default range. A <code>pixelsFromEnd</code> of
 * {@link #ALL_PIXELS} takes every pixel each region has, e.g. the full trail
 * behind each region for an EPER extraction.
 * <p>
 * With uneven sizes allowed each region is clipped to the pixels it has, and
 * a region with none in range is left out.
 */
public class ExtractionSettings {

    public static final int ALL_PIXELS = -1;

    private static final ExtractionSettings DEFAULTS = new ExtractionSettings(null, null, false);

    private final PixelRange pixels;
    private final Integer pixelsFromEnd;
    private final boolean unevenSizesAllowed;

    public ExtractionSettings(PixelRange pixels, Integer pixelsFromEnd, boolean unevenSizesAllowed) {
        this.pixels = pixels;
        this.pixelsFromEnd = pixelsFromEnd;
        this.unevenSizesAllowed = unevenSizesAllowed;
    }

    public static ExtractionSettings defaults() {
        return DEFAULTS;
    }

    public static ExtractionSettings pixels(int start, int end) {
        return new ExtractionSettings(new PixelRange(start, end), null, false);
    }

    public static ExtractionSettings pixelsFromEnd(int pixelsFromEnd) {
        return new ExtractionSettings(null, pixelsFromEnd, false);
    }

    public static ExtractionSettings allPixels() {
        return new ExtractionSettings(null, ALL_PIXELS, false);
    }

    /**
     * @return A copy of these settings which clips each region to the pixels
     * it has, instead of failing when a region is too small
     */
    public ExtractionSettings withUnevenSizesAllowed() {
        return new ExtractionSettings(pixels, pixelsFromEnd, true);
    }

    public PixelRange getPixels() {
        return pixels;
    }

    public Integer getPixelsFromEnd() {
        return pixelsFromEnd;
    }

    public boolean isUnevenSizesAllowed() {
        return unevenSizesAllowed;
    }

    @Override
    public int hashCode() {
        int hash = 5;
        hash = 97 * hash + Objects.hashCode(this.pixels);
        hash = 97 * hash + Objects.hashCode(this.pixelsFromEnd);
        hash = 97 * hash + (this.unevenSizesAllowed ? 1 : 0);
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ExtractionSettings other = (ExtractionSettings) obj;
        return this.unevenSizesAllowed == other.unevenSizesAllowed
                && Objects.equals(this.pixels, other.pixels)
                && Objects.equals(this.pixelsFromEnd, other.pixelsFromEnd);
    }

    @Override
    public String toString() {
        return "ExtractionSettings{" + "pixels=" + pixels + ", pixelsFromEnd=" + pixelsFromEnd + ", unevenSizesAllowed=" + unevenSizesAllowed + '}';
    }
}
