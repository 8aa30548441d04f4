package org.lsst.cti.extract;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.cti.array.Array1D;
import org.lsst.cti.array.Array2D;

/**
 * Wraps an {@link Extractor} and remembers the stacked arrays and binned
 * lines it computes, so that repeated requests for the same array and
 * settings (e.g. once per model evaluation in a fit) are only computed once.
 * Arrays are matched by identity, not by content.
 */
public class CachingExtractor {

    private static final Logger LOG = Logger.getLogger(CachingExtractor.class.getName());

    private final Extractor extractor;
    private final LoadingCache<ExtractionKey, Array2D> stackedCache;
    private final LoadingCache<ExtractionKey, Array1D> binnedCache;

    public CachingExtractor(Extractor extractor) {
        this(extractor, Long.getLong("org.lsst.cti.stackCacheMaxPixels", 20_000_000L));
    }

    /**
     * Create a caching extractor bounded by the pixels it keeps alive. Each
     * entry weighs the pixels of the frame it was computed from plus those
     * of the result, since the key holds on to the frame.
     *
     * @param extractor The extractor to wrap
     * @param maximumPixels The total weight of each cache
     */
    public CachingExtractor(Extractor extractor, long maximumPixels) {
        this.extractor = extractor;
        stackedCache = Caffeine.newBuilder()
                .maximumWeight(maximumPixels)
                .weigher((ExtractionKey key, Array2D stacked) -> key.getArray().getShape().getSize() + stacked.getShape().getSize())
                .recordStats()
                .build((ExtractionKey key) -> {
                    return Timed.execute(() -> {
                        return extractor.stackedArray2dFrom(key.getArray(), key.getSettings());
                    }, "Stacking %s with %s took %dms", extractor.getKind(), key.getSettings());
                });
        binnedCache = Caffeine.newBuilder()
                .maximumWeight(maximumPixels)
                .weigher((ExtractionKey key, Array1D binned) -> key.getArray().getShape().getSize() + binned.size())
                .recordStats()
                .build((ExtractionKey key) -> {
                    return Timed.execute(() -> {
                        return extractor.binnedArray1dFrom(key.getArray(), key.getSettings());
                    }, "Binning %s with %s took %dms", extractor.getKind(), key.getSettings());
                });
    }

    public Extractor getExtractor() {
        return extractor;
    }

    public Array2D stackedArray2dFrom(Array2D array, ExtractionSettings settings) {
        return stackedCache.get(new ExtractionKey(array, settings));
    }

    public Array1D binnedArray1dFrom(Array2D array, ExtractionSettings settings) {
        return binnedCache.get(new ExtractionKey(array, settings));
    }

    public CacheStats stackedStats() {
        return stackedCache.stats();
    }

    public CacheStats binnedStats() {
        return binnedCache.stats();
    }

    public void logStats() {
        LOG.log(Level.INFO, "{0} stacked cache: {1}", new Object[]{extractor.getKind(), stackedCache.stats()});
        LOG.log(Level.INFO, "{0} binned cache: {1}", new Object[]{extractor.getKind(), binnedCache.stats()});
    }

    void cleanUp() {
        stackedCache.cleanUp();
        binnedCache.cleanUp();
    }

    public void invalidateAll() {
        stackedCache.invalidateAll();
        binnedCache.invalidateAll();
    }

    static class ExtractionKey {

        private final Array2D array;
        private final ExtractionSettings settings;

        ExtractionKey(Array2D array, ExtractionSettings settings) {
            this.array = array;
            this.settings = settings;
        }

        Array2D getArray() {
            return array;
        }

        ExtractionSettings getSettings() {
            return settings;
        }

        @Override
        public int hashCode() {
            int hash = 7;
            hash = 19 * hash + System.identityHashCode(this.array);
            hash = 19 * hash + Objects.hashCode(this.settings);
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
            final ExtractionKey other = (ExtractionKey) obj;
            return this.array == other.array && Objects.equals(this.settings, other.settings);
        }
    }
}
