package org.lsst.cti.extract;

import static org.junit.Assert.assertEquals;
import java.util.Arrays;
import org.junit.Test;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

public class ChargeRegionArraysTest {

    private final ChargeRegionArrays arrays = new Layout(new Shape2D(10, 8),
            Arrays.asList(new Region(1, 3, 1, 5), new Region(5, 7, 1, 5))).chargeRegionArrays();
    private final Array2D array = positionArray();

    private static Array2D positionArray() {
        double[][] values = new double[10][8];
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 8; x++) {
                values[y][x] = 10 * y + x + 1;
            }
        }
        return Array2D.of(values);
    }

    @Test
    public void testRegions() {
        Array2D regions = arrays.regionsArray2dFrom(array);
        assertEquals(12, regions.get(1, 1), 0);
        assertEquals(65, regions.get(6, 4), 0);
        assertEquals(0, regions.get(0, 0), 0);
        assertEquals(0, regions.get(3, 1), 0);
        assertEquals(0, regions.get(1, 5), 0);
    }

    @Test
    public void testNonRegions() {
        Array2D nonRegions = arrays.nonRegionsArray2dFrom(array);
        assertEquals(0, nonRegions.get(1, 1), 0);
        assertEquals(0, nonRegions.get(6, 4), 0);
        assertEquals(1, nonRegions.get(0, 0), 0);
        assertEquals(32, nonRegions.get(3, 1), 0);
    }

    @Test
    public void testParallelFprsAndEpers() {
        Array2D kept = arrays.parallelFprsAndEpersArray2dFrom(array, new PixelRange(0, 1), new PixelRange(0, 1));
        assertEquals(13, kept.get(1, 2), 0);
        assertEquals(33, kept.get(3, 2), 0);
        assertEquals(53, kept.get(5, 2), 0);
        assertEquals(75, kept.get(7, 4), 0);
        assertEquals(0, kept.get(2, 2), 0);
        assertEquals(0, kept.get(4, 2), 0);
        assertEquals(0, kept.get(1, 0), 0);
    }

    @Test
    public void testSerialFprsOnly() {
        Array2D kept = arrays.serialFprsAndEpersArray2dFrom(array, new PixelRange(0, 1), null);
        assertEquals(12, kept.get(1, 1), 0);
        assertEquals(62, kept.get(6, 1), 0);
        assertEquals(0, kept.get(1, 2), 0);
        assertEquals(0, kept.get(1, 5), 0);
        Array2D withTrails = arrays.serialFprsAndEpersArray2dFrom(array, new PixelRange(0, 1), new PixelRange(0, 1));
        assertEquals(26, withTrails.get(2, 5), 0);
        assertEquals(0, withTrails.get(2, 6), 0);
    }

    @Test
    public void testNothingKept() {
        Array2D kept = arrays.parallelFprsAndEpersArray2dFrom(array, null, null);
        assertEquals(new Shape2D(10, 8), kept.getShape());
        assertEquals(0, kept.get(1, 1), 0);
    }

    @Test(expected = LayoutException.class)
    public void testShapeMismatch() {
        arrays.regionsArray2dFrom(Array2D.of(new double[10][7]));
    }
}
