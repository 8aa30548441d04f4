package org.lsst.cti.imaging;

import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.extract.ParallelCalibrationExtractor;
import org.lsst.cti.extract.PixelRange;
import org.lsst.cti.extract.SerialCalibrationExtractor;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.mask.CosmicRayBuffers;
import org.lsst.cti.mask.CosmicRayMaskExpander;

/**
 * A charge injection exposure in canonical orientation: the observed image,
 * its noise map, the charge injected before CTI trailed it, an optional
 * cosmic ray map and the layout shared by all of them. Any reduction applied
 * to the dataset is applied identically to every array.
 */
public class ChargeInjectionImaging {

    private static final Logger LOG = Logger.getLogger(ChargeInjectionImaging.class.getName());

    private final Array2D image;
    private final Array2D noiseMap;
    private final Array2D preCtiData;
    private final Array2D cosmicRayMap;
    private final Layout layout;

    /**
     * Create a dataset.
     *
     * @param image The observed image
     * @param noiseMap The noise of each image pixel
     * @param preCtiData The injected charge before CTI
     * @param cosmicRayMap Cosmic ray hits, or <code>null</code> if unknown
     * @param layout The layout of every array
     * @throws LayoutException If an array does not have the layout's shape
     */
    public ChargeInjectionImaging(Array2D image, Array2D noiseMap, Array2D preCtiData, Array2D cosmicRayMap, Layout layout) {
        checkShape("image", image, layout);
        checkShape("noise map", noiseMap, layout);
        checkShape("pre-CTI data", preCtiData, layout);
        if (cosmicRayMap != null) {
            checkShape("cosmic ray map", cosmicRayMap, layout);
        }
        this.image = image;
        this.noiseMap = noiseMap;
        this.preCtiData = preCtiData;
        this.cosmicRayMap = cosmicRayMap;
        this.layout = layout;
    }

    public Array2D getImage() {
        return image;
    }

    public Array2D getNoiseMap() {
        return noiseMap;
    }

    public Array2D getPreCtiData() {
        return preCtiData;
    }

    public Array2D getCosmicRayMap() {
        return cosmicRayMap;
    }

    public Layout getLayout() {
        return layout;
    }

    public Mask2D getMask() {
        return image.getMask();
    }

    /**
     * Mask pixels of the image and noise map.
     *
     * @param mask The pixels to mask, added to those already masked
     * @return The masked dataset
     */
    public ChargeInjectionImaging applyMask(Mask2D mask) {
        return new ChargeInjectionImaging(image.masked(mask), noiseMap.masked(mask), preCtiData, cosmicRayMap, layout);
    }

    /**
     * Mask every cosmic ray hit and the charge it trails.
     *
     * @param buffers How far to grow the mask around each hit
     * @return The masked dataset, or this dataset if it has no cosmic ray map
     */
    public ChargeInjectionImaging withCosmicRayMask(CosmicRayBuffers buffers) {
        if (cosmicRayMap == null) {
            LOG.log(Level.FINE, "No cosmic ray map, nothing to mask");
            return this;
        }
        return applyMask(new CosmicRayMaskExpander(buffers).expand(cosmicRayMap));
    }

    /**
     * The dataset cut down to a band of columns of the first charge region,
     * over every row.
     *
     * @param columns The columns, relative to the first region
     * @return The reduced dataset
     */
    public ChargeInjectionImaging parallelCalibrationFrom(PixelRange columns) {
        ParallelCalibrationExtractor extractor = layout.parallelCalibrationExtractor();
        Mask2D mask = extractor.mask2dFrom(getMask(), columns);
        return new ChargeInjectionImaging(
                extractor.array2dFrom(image, columns),
                extractor.array2dFrom(noiseMap, columns),
                extractor.array2dFrom(preCtiData, columns),
                cosmicRayMap == null ? null : extractor.array2dFrom(cosmicRayMap, columns),
                extractor.extractedLayoutFrom(columns)).applyMask(mask);
    }

    /**
     * The dataset reduced to the same rows of every charge region, stacked
     * on top of each other over the full width of the frame.
     *
     * @param rows The rows, relative to the start of each region
     * @return The reduced dataset
     */
    public ChargeInjectionImaging serialCalibrationFrom(PixelRange rows) {
        SerialCalibrationExtractor extractor = layout.serialCalibrationExtractor();
        Mask2D mask = extractor.mask2dFrom(getMask(), rows);
        return new ChargeInjectionImaging(
                extractor.array2dFrom(image, rows),
                extractor.array2dFrom(noiseMap, rows),
                extractor.array2dFrom(preCtiData, rows),
                cosmicRayMap == null ? null : extractor.array2dFrom(cosmicRayMap, rows),
                extractor.extractedLayoutFrom(rows)).applyMask(mask);
    }

    private static void checkShape(String name, Array2D array, Layout layout) {
        if (!array.getShape().equals(layout.getShape())) {
            throw new LayoutException("The " + name + " has shape " + array.getShape() + " but the layout has " + layout.getShape());
        }
    }
}
