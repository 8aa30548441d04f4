package org.lsst.cti.frame;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import org.junit.Test;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

public class RoeRotationTest {

    private final Array2D array = Array2D.of(new double[][]{{1, 2, 3}, {4, 5, 6}},
            new boolean[][]{{true, false, false}, {false, false, false}});

    @Test
    public void testBottomLeftIsIdentity() {
        assertSame(array, RoeRotation.rotate(array, RoeCorner.BOTTOM_LEFT));
    }

    @Test
    public void testTopLeftReversesRows() {
        double[][] rotated = RoeRotation.rotate(array, RoeCorner.TOP_LEFT).toArray();
        assertArrayEquals(new double[]{4, 5, 6}, rotated[0], 0);
        assertArrayEquals(new double[]{0, 2, 3}, rotated[1], 0);
        assertTrue(RoeRotation.rotate(array, RoeCorner.TOP_LEFT).isMasked(1, 0));
    }

    @Test
    public void testBottomRightReversesColumns() {
        Array2D rotated = RoeRotation.rotate(array, RoeCorner.BOTTOM_RIGHT);
        assertArrayEquals(new double[]{3, 2, 0}, rotated.toArray()[0], 0);
        assertTrue(rotated.isMasked(0, 2));
    }

    @Test
    public void testTopRightReversesBoth() {
        Array2D rotated = RoeRotation.rotate(array, RoeCorner.TOP_RIGHT);
        assertArrayEquals(new double[]{6, 5, 4}, rotated.toArray()[0], 0);
        assertArrayEquals(new double[]{3, 2, 0}, rotated.toArray()[1], 0);
        assertTrue(rotated.isMasked(1, 2));
    }

    @Test
    public void testArrayRotationIsInvolution() {
        for (RoeCorner corner : RoeCorner.values()) {
            assertEquals(corner.name(), array, RoeRotation.rotate(RoeRotation.rotate(array, corner), corner));
        }
    }

    @Test
    public void testRegionRotation() {
        Shape2D shape = new Shape2D(10, 8);
        Region region = new Region(1, 3, 2, 5);
        assertEquals(region, RoeRotation.rotate(region, shape, RoeCorner.BOTTOM_LEFT));
        assertEquals(new Region(7, 9, 2, 5), RoeRotation.rotate(region, shape, RoeCorner.TOP_LEFT));
        assertEquals(new Region(1, 3, 3, 6), RoeRotation.rotate(region, shape, RoeCorner.BOTTOM_RIGHT));
        assertEquals(new Region(7, 9, 3, 6), RoeRotation.rotate(region, shape, RoeCorner.TOP_RIGHT));
    }

    @Test
    public void testRegionRotationIsInvolution() {
        Shape2D shape = new Shape2D(10, 8);
        Region region = new Region(0, 4, 5, 8);
        for (RoeCorner corner : RoeCorner.values()) {
            assertEquals(corner.name(), region, RoeRotation.rotate(RoeRotation.rotate(region, shape, corner), shape, corner));
        }
    }

    @Test
    public void testNullRegion() {
        assertNull(RoeRotation.rotate((Region) null, new Shape2D(2, 2), RoeCorner.TOP_RIGHT));
    }

    @Test
    public void testCornerTuples() {
        assertArrayEquals(new int[]{1, 0}, RoeCorner.BOTTOM_LEFT.getTuple());
        assertEquals(RoeCorner.TOP_RIGHT, RoeCorner.fromTuple(0, 1));
        assertEquals(RoeCorner.BOTTOM_RIGHT, RoeCorner.fromTuple(1, 1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidTuple() {
        RoeCorner.fromTuple(2, 0);
    }
}
