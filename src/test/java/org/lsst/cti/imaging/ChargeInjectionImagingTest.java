package org.lsst.cti.imaging;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import org.junit.Before;
import org.junit.Test;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.extract.ExtractionSizeException;
import org.lsst.cti.extract.PixelRange;
import org.lsst.cti.frame.RoeCorner;
import org.lsst.cti.frame.Scans;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.mask.CosmicRayBuffers;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

public class ChargeInjectionImagingTest {

    private Layout layout;
    private Array2D image;
    private Array2D noise;
    private Array2D preCti;

    @Before
    public void setUp() {
        layout = new Layout(new Shape2D(6, 4), Arrays.asList(new Region(1, 3, 1, 3), new Region(4, 6, 1, 3)),
                RoeCorner.BOTTOM_LEFT, new Scans(null, new Region(0, 6, 0, 1), null));
        double[][] values = new double[6][4];
        double[][] ones = new double[6][4];
        for (int y = 0; y < 6; y++) {
            for (int x = 0; x < 4; x++) {
                values[y][x] = 10 * y + x;
                ones[y][x] = 1;
            }
        }
        image = Array2D.of(values);
        noise = Array2D.of(ones);
        preCti = Array2D.of(values);
    }

    @Test(expected = LayoutException.class)
    public void testShapeMismatch() {
        new ChargeInjectionImaging(image, Array2D.of(new double[5][4]), preCti, null, layout);
    }

    @Test
    public void testWithoutCosmicRayMap() {
        ChargeInjectionImaging imaging = new ChargeInjectionImaging(image, noise, preCti, null, layout);
        assertSame(imaging, imaging.withCosmicRayMask(CosmicRayBuffers.defaults()));
    }

    @Test
    public void testCosmicRayMask() {
        double[][] hits = new double[6][4];
        hits[2][2] = 1;
        ChargeInjectionImaging masked = new ChargeInjectionImaging(image, noise, preCti, Array2D.of(hits), layout)
                .withCosmicRayMask(new CosmicRayBuffers(1, 0, 0));
        assertTrue(masked.getImage().isMasked(2, 2));
        assertTrue(masked.getImage().isMasked(1, 2));
        assertTrue(masked.getNoiseMap().isMasked(1, 2));
        assertEquals(0, masked.getImage().get(2, 2), 0);
        assertFalse(masked.getImage().isMasked(3, 2));
        assertFalse(masked.getPreCtiData().isMasked(2, 2));
        assertEquals(2, masked.getMask().getMaskedCount());
    }

    @Test
    public void testParallelCalibration() {
        ChargeInjectionImaging reduced = new ChargeInjectionImaging(image, noise, preCti, null, layout)
                .parallelCalibrationFrom(new PixelRange(1, 2));
        assertEquals(new Shape2D(6, 1), reduced.getImage().getShape());
        assertEquals(52, reduced.getImage().get(5, 0), 0);
        assertEquals(Arrays.asList(new Region(1, 3, 0, 1), new Region(4, 6, 0, 1)), reduced.getLayout().getRegionList());
        assertNull(reduced.getCosmicRayMap());
    }

    @Test
    public void testSerialCalibration() {
        ChargeInjectionImaging reduced = new ChargeInjectionImaging(image, noise, preCti, null, layout)
                .serialCalibrationFrom(new PixelRange(0, 1));
        assertEquals(new Shape2D(2, 4), reduced.getImage().getShape());
        assertArrayEquals(new double[]{10, 11, 12, 13}, reduced.getImage().toArray()[0], 0);
        assertArrayEquals(new double[]{40, 41, 42, 43}, reduced.getPreCtiData().toArray()[1], 0);
        assertEquals(Arrays.asList(new Region(0, 1, 1, 3), new Region(1, 2, 1, 3)), reduced.getLayout().getRegionList());
        assertEquals(new Region(0, 2, 0, 1), reduced.getLayout().getSerialPrescan());
    }

    @Test
    public void testMaskCarriedIntoCalibration() {
        boolean[][] mask = new boolean[6][4];
        mask[4][3] = true;
        ChargeInjectionImaging reduced = new ChargeInjectionImaging(Array2D.of(image.toArray(), mask), noise, preCti, null, layout)
                .serialCalibrationFrom(new PixelRange(0, 1));
        assertTrue(reduced.getImage().isMasked(1, 3));
        assertTrue(reduced.getNoiseMap().isMasked(1, 3));
    }

    @Test(expected = ExtractionSizeException.class)
    public void testSerialCalibrationTooManyRows() {
        new ChargeInjectionImaging(image, noise, preCti, null, layout).serialCalibrationFrom(new PixelRange(0, 3));
    }
}
