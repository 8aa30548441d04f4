package org.lsst.cti.instrument;

import java.util.List;
import org.lsst.cti.array.Array2D;
import org.lsst.cti.frame.Frame;
import org.lsst.cti.frame.RoeCorner;
import org.lsst.cti.layout.Layout;
import org.lsst.cti.layout.LayoutException;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * The geometry of one readout quadrant of an instrument: its size, scans and
 * the corner its readout electronics sit at. Instruments differ only in
 * their default sizes and in how the corner is chosen.
 */
public abstract class InstrumentLayout {

    private final ScanSizes sizes;
    private final RoeCorner roeCorner;

    protected InstrumentLayout(ScanSizes sizes, RoeCorner roeCorner) {
        this.sizes = sizes;
        this.roeCorner = roeCorner;
    }

    public ScanSizes getSizes() {
        return sizes;
    }

    public RoeCorner getRoeCorner() {
        return roeCorner;
    }

    public Shape2D getShape() {
        return sizes.getShape();
    }

    /**
     * Build the canonical layout for charge regions given in the raw
     * orientation of this quadrant.
     *
     * @param originalRegionList The charge regions as read out
     * @return The canonical layout
     */
    public Layout layoutFor(List<Region> originalRegionList) {
        Shape2D shape = sizes.getShape();
        return new Layout(shape, originalRegionList, roeCorner, sizes.canonicalScans().rotated(shape, roeCorner))
                .rotatedFrom(roeCorner);
    }

    /**
     * Rotate a raw quadrant to its canonical frame.
     *
     * @param raw The quadrant as read out
     * @return The canonical frame with this quadrant's scans
     */
    public Frame frameFor(Array2D raw) {
        if (!raw.getShape().equals(sizes.getShape())) {
            throw new LayoutException("Array of shape " + raw.getShape() + " does not match quadrant shape " + sizes.getShape());
        }
        return Frame.fromOriginalOrientation(raw, roeCorner, sizes.canonicalScans().rotated(raw.getShape(), roeCorner));
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + "sizes=" + sizes + ", roeCorner=" + roeCorner + '}';
    }
}
