package org.lsst.cti.extract;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import java.util.Arrays;
import org.junit.Test;
import org.lsst.cti.array.Array1D;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

public class CachingExtractorTest {

    private final Extractor extractor = new ParallelFPRExtractor(new Shape2D(10, 3),
            Arrays.asList(new Region(1, 4, 0, 3), new Region(5, 8, 0, 3)));

    @Test
    public void testRepeatedRequestIsCached() {
        CachingExtractor caching = new CachingExtractor(extractor);
        Array2D array = ExtractionFixtures.rowIndexArray(10, 3);
        Array2D first = caching.stackedArray2dFrom(array, ExtractionSettings.pixels(0, 3));
        Array2D second = caching.stackedArray2dFrom(array, ExtractionSettings.pixels(0, 3));
        assertSame(first, second);
        assertEquals(1, caching.stackedStats().hitCount());
        assertEquals(1, caching.stackedStats().missCount());
        assertEquals(extractor.stackedArray2dFrom(array, ExtractionSettings.pixels(0, 3)), first);
    }

    @Test
    public void testArraysMatchedByIdentity() {
        CachingExtractor caching = new CachingExtractor(extractor);
        caching.binnedArray1dFrom(ExtractionFixtures.rowIndexArray(10, 3), ExtractionSettings.defaults());
        Array1D binned = caching.binnedArray1dFrom(ExtractionFixtures.rowIndexArray(10, 3), ExtractionSettings.defaults());
        assertArrayEquals(new double[]{3, 4, 5}, binned.toArray(), 1e-12);
        assertEquals(2, caching.binnedStats().missCount());
    }

    @Test
    public void testDifferentSettingsNotShared() {
        CachingExtractor caching = new CachingExtractor(extractor);
        Array2D array = ExtractionFixtures.rowIndexArray(10, 3);
        Array1D all = caching.binnedArray1dFrom(array, ExtractionSettings.pixels(0, 3));
        Array1D last = caching.binnedArray1dFrom(array, ExtractionSettings.pixelsFromEnd(1));
        assertEquals(3, all.size());
        assertArrayEquals(new double[]{5}, last.toArray(), 1e-12);
        caching.logStats();
        caching.invalidateAll();
        caching.binnedArray1dFrom(array, ExtractionSettings.pixels(0, 3));
        assertEquals(3, caching.binnedStats().missCount());
    }

    @Test
    public void testCacheBoundedByPixels() {
        // Each entry weighs 30 frame pixels plus 9 stacked pixels
        CachingExtractor caching = new CachingExtractor(extractor, 80);
        for (int i = 0; i < 3; i++) {
            caching.stackedArray2dFrom(ExtractionFixtures.rowIndexArray(10, 3), ExtractionSettings.pixels(0, 3));
        }
        caching.cleanUp();
        assertTrue(caching.stackedStats().evictionCount() >= 1);
    }

    @Test(expected = ExtractionSizeException.class)
    public void testFailuresPropagate() {
        new CachingExtractor(extractor).stackedArray2dFrom(ExtractionFixtures.rowIndexArray(10, 3), ExtractionSettings.pixels(0, 4));
    }
}
