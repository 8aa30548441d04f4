package org.lsst.cti.mask;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.array.Mask2D;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * Turns a map of cosmic ray hits into a mask covering each hit and the
 * trail its charge leaves behind.
 */
public class CosmicRayMaskExpander {

    private static final Logger LOG = Logger.getLogger(CosmicRayMaskExpander.class.getName());

    private final CosmicRayBuffers buffers;

    public CosmicRayMaskExpander(CosmicRayBuffers buffers) {
        this.buffers = buffers;
    }

    public CosmicRayMaskExpander() {
        this(CosmicRayBuffers.fromSystemProperties());
    }

    /**
     * Build the mask for every pixel of the map with a positive value. Each
     * hit at (y, x) masks rows <code>[y-parallel, y]</code> of column x,
     * columns <code>[x, x+serial]</code> of row y and the block
     * <code>[y-diagonal, y] x [x, x+diagonal]</code>, clipped to the array.
     *
     * @param cosmicRayMap The cosmic ray map, in canonical orientation
     * @return The expanded mask
     */
    public Mask2D expand(Array2D cosmicRayMap) {
        Shape2D shape = cosmicRayMap.getShape();
        List<Region> regions = new ArrayList<>();
        int hits = 0;
        for (int y = 0; y < shape.getRows(); y++) {
            for (int x = 0; x < shape.getColumns(); x++) {
                if (cosmicRayMap.get(y, x) > 0) {
                    hits++;
                    regions.add(clipped(shape, y - buffers.getParallelBuffer(), y + 1, x, x + 1));
                    regions.add(clipped(shape, y, y + 1, x, x + buffers.getSerialBuffer() + 1));
                    regions.add(clipped(shape, y - buffers.getDiagonalBuffer(), y + 1, x, x + buffers.getDiagonalBuffer() + 1));
                }
            }
        }
        LOG.log(Level.FINE, "Expanding {0} cosmic ray hits with {1}", new Object[]{hits, buffers});
        return Mask2D.fromRegions(shape, regions);
    }

    private static Region clipped(Shape2D shape, int y0, int y1, int x0, int x1) {
        return new Region(Math.max(0, y0), Math.min(shape.getRows(), y1), Math.max(0, x0), Math.min(shape.getColumns(), x1));
    }
}
