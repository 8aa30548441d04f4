package org.lsst.cti.array;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;

public class MaskAwareAggregatorTest {

    @Test
    public void testStackUnmasked() {
        Array2D a = Array2D.of(new double[][]{{1, 2}, {3, 4}});
        Array2D b = Array2D.of(new double[][]{{3, 4}, {5, 6}});
        Array2D stacked = MaskAwareAggregator.stackedArray(Arrays.asList(a, b));
        assertArrayEquals(new double[]{2, 3}, stacked.toArray()[0], 1e-12);
        assertArrayEquals(new double[]{4, 5}, stacked.toArray()[1], 1e-12);
    }

    @Test
    public void testStackIgnoresMaskedPixels() {
        Array2D a = Array2D.of(new double[][]{{1, 2}}, new boolean[][]{{true, false}});
        Array2D b = Array2D.of(new double[][]{{5, 6}}, new boolean[][]{{false, false}});
        Array2D stacked = MaskAwareAggregator.stackedArray(Arrays.asList(a, b));
        assertEquals(5, stacked.get(0, 0), 1e-12);
        assertEquals(4, stacked.get(0, 1), 1e-12);
        assertFalse(stacked.isMasked(0, 0));
    }

    @Test
    public void testStackAllMasked() {
        Array2D a = Array2D.of(new double[][]{{1, 2}}, new boolean[][]{{true, false}});
        Array2D b = Array2D.of(new double[][]{{5, 6}}, new boolean[][]{{true, false}});
        Array2D stacked = MaskAwareAggregator.stackedArray(Arrays.asList(a, b));
        assertTrue(stacked.isMasked(0, 0));
        assertEquals(0, stacked.get(0, 0), 0);
        Array2D counts = MaskAwareAggregator.stackedTotalPixels(Arrays.asList(a, b));
        assertEquals(0, counts.get(0, 0), 0);
        assertEquals(2, counts.get(0, 1), 0);
    }

    @Test
    public void testStackingIdenticalArraysIsIdentity() {
        Array2D a = Array2D.of(new double[][]{{1.5, 2}, {3, 4}}, new boolean[][]{{false, true}, {false, false}});
        assertEquals(a, MaskAwareAggregator.stackedArray(Arrays.asList(a, a, a)));
    }

    @Test
    public void testBinnedLineAcrossColumns() {
        Array2D a = Array2D.of(new double[][]{{1, 3, 100}, {2, 2, 2}, {9, 9, 9}},
                new boolean[][]{{false, false, true}, {false, false, false}, {true, true, true}});
        Array1D line = MaskAwareAggregator.binnedLine(a, BinningAxis.ACROSS_COLUMNS);
        assertArrayEquals(new double[]{2, 2, 0}, line.toArray(), 1e-12);
        assertArrayEquals(new int[]{2, 3, 0}, line.getCounts());
        assertTrue(line.isMasked(2));
    }

    @Test
    public void testBinnedLineAcrossRows() {
        Array2D a = Array2D.of(new double[][]{{1, 4}, {3, 8}}, new boolean[][]{{false, true}, {false, false}});
        Array1D line = MaskAwareAggregator.binnedLine(a, BinningAxis.ACROSS_ROWS);
        assertArrayEquals(new double[]{2, 8}, line.toArray(), 1e-12);
        assertEquals(1, line.getCount(1));
    }

    @Test
    public void testBinnedTotalPixels() {
        Array2D a = Array2D.of(new double[][]{{1, 2}, {3, 4}}, new boolean[][]{{true, false}, {false, false}});
        Array2D counts = MaskAwareAggregator.stackedTotalPixels(Arrays.asList(a, a));
        Array1D line = MaskAwareAggregator.binnedTotalPixels(counts, BinningAxis.ACROSS_COLUMNS);
        assertArrayEquals(new double[]{2, 4}, line.toArray(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStackEmptyList() {
        MaskAwareAggregator.stackedArray(Collections.<Array2D>emptyList());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testStackDifferentShapes() {
        MaskAwareAggregator.stackedArray(Arrays.asList(Array2D.of(new double[][]{{1}}), Array2D.of(new double[][]{{1, 2}})));
    }
}
