package org.lsst.cti.region;

import static org.junit.Assert.assertEquals;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;

public class RegionSpacingTest {

    private final Shape2D shape = new Shape2D(10, 8);

    @Test
    public void testParallelRowsBehind() {
        List<Region> regions = Arrays.asList(new Region(1, 3, 0, 3), new Region(5, 7, 0, 3));
        assertEquals(2, RegionSpacing.parallelRowsBehind(regions, 0, shape));
        assertEquals(3, RegionSpacing.parallelRowsBehind(regions, 1, shape));
    }

    @Test
    public void testRegionInOtherColumnsIgnored() {
        List<Region> regions = Arrays.asList(new Region(1, 3, 0, 3), new Region(5, 7, 4, 6));
        assertEquals(7, RegionSpacing.parallelRowsBehind(regions, 0, shape));
    }

    @Test
    public void testSerialColumnsBehind() {
        List<Region> regions = Arrays.asList(new Region(0, 2, 1, 3), new Region(0, 2, 5, 6), new Region(4, 6, 1, 3));
        assertEquals(2, RegionSpacing.serialColumnsBehind(regions, 0, shape));
        assertEquals(2, RegionSpacing.serialColumnsBehind(regions, 1, shape));
        assertEquals(5, RegionSpacing.serialColumnsBehind(regions, 2, shape));
    }
}
