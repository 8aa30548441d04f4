package org.lsst.cti.region;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import org.junit.Test;

public class RegionTest {

    @Test
    public void testDimensions() {
        Region region = new Region(1, 4, 2, 7);
        assertEquals(3, region.getTotalRows());
        assertEquals(5, region.getTotalColumns());
        assertEquals(new Shape2D(3, 5), region.getShape());
    }

    @Test
    public void testEquality() {
        assertEquals(new Region(0, 1, 2, 3), new Region(0, 1, 2, 3));
        assertEquals(new Region(0, 1, 2, 3).hashCode(), new Region(0, 1, 2, 3).hashCode());
        assertNotEquals(new Region(0, 1, 2, 3), new Region(0, 1, 2, 4));
    }

    @Test
    public void testNegativeCoordinates() {
        try {
            Region region = new Region(-1, 2, 0, 1);
            fail("should not reach here: " + region);
        } catch (RegionException x) {
            assertTrue(x.getMessage().contains("negative"));
        }
    }

    @Test(expected = RegionException.class)
    public void testEmptyRows() {
        new Region(2, 2, 0, 1);
    }

    @Test(expected = RegionException.class)
    public void testReversedColumns() {
        new Region(0, 1, 3, 2);
    }

    @Test
    public void testFitsWithin() {
        Shape2D shape = new Shape2D(10, 5);
        assertTrue(new Region(0, 10, 0, 5).fitsWithin(shape));
        assertFalse(new Region(0, 11, 0, 5).fitsWithin(shape));
        assertFalse(new Region(0, 10, 4, 6).fitsWithin(shape));
    }

    @Test
    public void testFrontAndTrailingRegions() {
        Region region = new Region(2, 5, 1, 4);
        assertEquals(new Region(2, 3, 1, 4), region.parallelFrontRegion(0, 1));
        assertEquals(new Region(1, 4, 1, 4), region.parallelFrontRegion(-1, 2));
        assertEquals(new Region(5, 7, 1, 4), region.parallelTrailingRegion(0, 2));
        assertEquals(new Region(2, 5, 1, 3), region.serialFrontRegion(0, 2));
        assertEquals(new Region(2, 5, 4, 5), region.serialTrailingRegion(0, 1));
    }

    @Test
    public void testFullRegions() {
        Region region = new Region(2, 5, 1, 4);
        Shape2D shape = new Shape2D(8, 6);
        assertEquals(new Region(2, 5, 0, 6), region.serialFullRegion(shape));
        assertEquals(new Region(0, 8, 2, 3), region.parallelFullRegion(shape, 1, 2));
    }

    @Test(expected = RegionException.class)
    public void testFrontRegionBeforeArray() {
        new Region(0, 3, 0, 3).parallelFrontRegion(-1, 1);
    }
}
