package org.lsst.cti.array;

import java.util.Arrays;

/**
 * A 1D line produced by binning a 2D array. Each entry carries the number of
 * unmasked pixels that contributed to it, and is masked when there were none.
 */
public class Array1D {

    private final double[] values;
    private final int[] counts;

    Array1D(double[] values, int[] counts) {
        if (values.length != counts.length) {
            throw new IllegalArgumentException("Values and counts differ in length");
        }
        this.values = values;
        this.counts = counts;
    }

    public int size() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public int getCount(int i) {
        return counts[i];
    }

    public boolean isMasked(int i) {
        return counts[i] == 0;
    }

    public double[] toArray() {
        return values.clone();
    }

    public int[] getCounts() {
        return counts.clone();
    }

    @Override
    public int hashCode() {
        int hash = 3;
        hash = 37 * hash + Arrays.hashCode(this.values);
        hash = 37 * hash + Arrays.hashCode(this.counts);
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
        final Array1D other = (Array1D) obj;
        return Arrays.equals(this.values, other.values) && Arrays.equals(this.counts, other.counts);
    }

    @Override
    public String toString() {
        return Arrays.toString(values);
    }
}
