package org.lsst.cti.region;

/**
 * Computes where a region ends up after an array is cropped to an extraction
 * window.
 */
public class RegionRemapper {

    private RegionRemapper() {
    }

    /**
     * Map the interval <code>[x0Original, x1Original)</code> into the
     * coordinates of the window <code>[x0Extraction, x1Extraction)</code>.
     *
     * @param x0Original Start of the original interval
     * @param x1Original End of the original interval (exclusive)
     * @param x0Extraction Start of the extraction window
     * @param x1Extraction End of the extraction window (exclusive)
     * @return Two element array {x0, x1} in window coordinates, or
     * <code>null</code> if the intervals do not overlap
     */
    public static int[] x0x1AfterExtraction(int x0Original, int x1Original, int x0Extraction, int x1Extraction) {
        int start = Math.max(x0Original, x0Extraction);
        int end = Math.min(x1Original, x1Extraction);
        if (end <= start) {
            return null;
        }
        return new int[]{start - x0Extraction, end - x0Extraction};
    }

    /**
     * Map a region into the coordinates of an extraction window.
     *
     * @param original The region on the full array, may be <code>null</code>
     * @param extraction The extraction window
     * @return The part of the region inside the window, in window
     * coordinates, or <code>null</code> if the region misses the window
     */
    public static Region regionAfterExtraction(Region original, Region extraction) {
        if (original == null) {
            return null;
        }
        int[] y0y1 = x0x1AfterExtraction(original.getY0(), original.getY1(), extraction.getY0(), extraction.getY1());
        if (y0y1 == null) {
            return null;
        }
        int[] x0x1 = x0x1AfterExtraction(original.getX0(), original.getX1(), extraction.getX0(), extraction.getX1());
        if (x0x1 == null) {
            return null;
        }
        return new Region(y0y1[0], y0y1[1], x0x1[0], x0x1[1]);
    }
}
