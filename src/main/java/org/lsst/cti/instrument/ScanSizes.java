package org.lsst.cti.instrument;

import org.lsst.cti.frame.Scans;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.Shape2D;

/**
 * The dimensions of an instrument's readout quadrant and of its prescan and
 * overscan areas.
 */
public class ScanSizes {

    public static final ScanSizes EUCLID_VIS = new ScanSizes(2086, 2128, 51, 29, 20);
    public static final ScanSizes HST_ACS = new ScanSizes(2068, 2072, 24, 0, 20);

    private final int parallelSize;
    private final int serialSize;
    private final int serialPrescanSize;
    private final int serialOverscanSize;
    private final int parallelOverscanSize;

    public ScanSizes(int parallelSize, int serialSize, int serialPrescanSize, int serialOverscanSize, int parallelOverscanSize) {
        if (serialPrescanSize < 0 || serialOverscanSize < 0 || parallelOverscanSize < 0) {
            throw new IllegalArgumentException("Scan sizes must not be negative");
        }
        if (serialPrescanSize + serialOverscanSize >= serialSize || parallelOverscanSize >= parallelSize) {
            throw new IllegalArgumentException("Scans leave no room for image pixels in quadrant of " + parallelSize + " x " + serialSize);
        }
        this.parallelSize = parallelSize;
        this.serialSize = serialSize;
        this.serialPrescanSize = serialPrescanSize;
        this.serialOverscanSize = serialOverscanSize;
        this.parallelOverscanSize = parallelOverscanSize;
    }

    public Shape2D getShape() {
        return new Shape2D(parallelSize, serialSize);
    }

    public int getSerialPrescanSize() {
        return serialPrescanSize;
    }

    public int getSerialOverscanSize() {
        return serialOverscanSize;
    }

    public int getParallelOverscanSize() {
        return parallelOverscanSize;
    }

    /**
     * The scan regions in canonical orientation. The parallel overscan is the
     * far rows between the prescan and serial overscan, the serial prescan
     * spans every row next to the readout electronics and the serial
     * overscan the rows below the parallel overscan at the far columns.
     *
     * @return The canonical scans, absent where the size is zero
     */
    public Scans canonicalScans() {
        Region parallelOverscan = parallelOverscanSize > 0
                ? new Region(parallelSize - parallelOverscanSize, parallelSize, serialPrescanSize, serialSize - serialOverscanSize)
                : null;
        Region serialPrescan = serialPrescanSize > 0
                ? new Region(0, parallelSize, 0, serialPrescanSize)
                : null;
        Region serialOverscan = serialOverscanSize > 0
                ? new Region(0, parallelSize - parallelOverscanSize, serialSize - serialOverscanSize, serialSize)
                : null;
        return new Scans(parallelOverscan, serialPrescan, serialOverscan);
    }

    @Override
    public String toString() {
        return "ScanSizes{" + "parallelSize=" + parallelSize + ", serialSize=" + serialSize + ", serialPrescanSize=" + serialPrescanSize + ", serialOverscanSize=" + serialOverscanSize + ", parallelOverscanSize=" + parallelOverscanSize + '}';
    }
}
