package org.lsst.cti.mask;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;

public class CosmicRayMaskExpanderTest {

    private static Array2D singleHit(int rows, int columns, int y, int x) {
        double[][] values = new double[rows][columns];
        values[y][x] = 100;
        return Array2D.of(values);
    }

    @Test
    public void testParallelAndSerialRuns() {
        Mask2D mask = new CosmicRayMaskExpander(new CosmicRayBuffers(2, 1, 0)).expand(singleHit(6, 6, 3, 2));
        assertTrue(mask.isMasked(3, 2));
        assertTrue(mask.isMasked(2, 2));
        assertTrue(mask.isMasked(1, 2));
        assertFalse(mask.isMasked(0, 2));
        assertFalse(mask.isMasked(4, 2));
        assertTrue(mask.isMasked(3, 3));
        assertFalse(mask.isMasked(3, 4));
        assertFalse(mask.isMasked(3, 1));
        assertEquals(4, mask.getMaskedCount());
    }

    @Test
    public void testDiagonalBlock() {
        Mask2D mask = new CosmicRayMaskExpander(new CosmicRayBuffers(0, 0, 1)).expand(singleHit(6, 6, 3, 2));
        assertTrue(mask.isMasked(2, 3));
        assertTrue(mask.isMasked(2, 2));
        assertTrue(mask.isMasked(3, 3));
        assertEquals(4, mask.getMaskedCount());
    }

    @Test
    public void testClippedAtEdges() {
        Mask2D mask = new CosmicRayMaskExpander(CosmicRayBuffers.defaults()).expand(singleHit(4, 4, 0, 3));
        assertEquals(1, mask.getMaskedCount());
        assertTrue(mask.isMasked(0, 3));
    }

    @Test
    public void testDefaultBuffers() {
        Mask2D mask = new CosmicRayMaskExpander(CosmicRayBuffers.defaults()).expand(singleHit(20, 20, 15, 2));
        assertTrue(mask.isMasked(5, 2));
        assertFalse(mask.isMasked(4, 2));
        assertTrue(mask.isMasked(15, 12));
        assertFalse(mask.isMasked(15, 13));
        assertTrue(mask.isMasked(12, 5));
        assertFalse(mask.isMasked(11, 5));
        assertEquals(30, mask.getMaskedCount());
    }

    @Test
    public void testNoHits() {
        assertEquals(0, new CosmicRayMaskExpander().expand(Array2D.of(new double[3][3])).getMaskedCount());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeBuffer() {
        new CosmicRayBuffers(-1, 0, 0);
    }
}
