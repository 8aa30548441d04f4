package org.lsst.cti.extract;

/**
 * A half-open range of pixels <code>[start, end)</code> counted from a
 * reference edge of a region. The start may be negative, selecting pixels in
 * front of the reference edge.
 */
public class PixelRange {

    private final int start;
    private final int end;

    public PixelRange(int start, int end) {
        if (start >= end) {
            throw new IllegalArgumentException("Pixel range start must be less than end: (" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    public int getSize() {
        return end - start;
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 71 * hash + this.start;
        hash = 71 * hash + this.end;
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
        final PixelRange other = (PixelRange) obj;
        return this.start == other.start && this.end == other.end;
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
