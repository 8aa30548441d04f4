package org.lsst.cti.instrument;

import java.util.logging.Level;
import java.util.logging.Logger;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import nom.tam.fits.header.Standard;
import org.lsst.cti.frame.RoeCorner;
import org.lsst.cti.layout.LayoutException;

/**
 * Quadrant geometry for the Euclid VIS focal plane. The readout corner of a
 * quadrant depends on which row of the focal plane its CCD is in (the last
 * character of the CCD id, 1-3 or 4-6) and on the quadrant letter E-H.
 */
public class EuclidLayout extends InstrumentLayout {

    private static final Logger LOG = Logger.getLogger(EuclidLayout.class.getName());

    public EuclidLayout(ScanSizes sizes, RoeCorner roeCorner) {
        super(sizes, roeCorner);
    }

    public static EuclidLayout forQuadrant(String ccdId, String quadrantId) {
        return new EuclidLayout(ScanSizes.EUCLID_VIS, cornerFor(ccdId, quadrantId));
    }

    public static RoeCorner cornerFor(String ccdId, String quadrantId) {
        if (ccdId == null || ccdId.isEmpty()) {
            throw new LayoutException("Missing Euclid CCD id");
        }
        char rowIndex = ccdId.charAt(ccdId.length() - 1);
        boolean lowerRows;
        if ("123".indexOf(rowIndex) >= 0) {
            lowerRows = true;
        } else if ("456".indexOf(rowIndex) >= 0) {
            lowerRows = false;
        } else {
            throw new LayoutException("Invalid Euclid CCD id: " + ccdId);
        }
        switch (quadrantId == null ? "" : quadrantId) {
            case "E":
                return lowerRows ? RoeCorner.BOTTOM_LEFT : RoeCorner.TOP_RIGHT;
            case "F":
                return lowerRows ? RoeCorner.BOTTOM_RIGHT : RoeCorner.TOP_LEFT;
            case "G":
                return lowerRows ? RoeCorner.TOP_RIGHT : RoeCorner.BOTTOM_LEFT;
            case "H":
                return lowerRows ? RoeCorner.TOP_LEFT : RoeCorner.BOTTOM_RIGHT;
            default:
                throw new LayoutException("Invalid Euclid quadrant id: " + quadrantId);
        }
    }

    /**
     * Read the quadrant geometry from a quadrant's extension header. A
     * missing OVRSCANY keyword means there is no parallel overscan.
     *
     * @param header The extension header
     * @return The layout
     * @throws FitsException If a required keyword is missing
     */
    public static EuclidLayout fromFitsHeader(Header header) throws FitsException {
        String ccdId = required(header, "CCDID").getStringValue("CCDID");
        String quadrantId = required(header, "QUADID").getStringValue("QUADID");
        required(header, "NAXIS1");
        required(header, "NAXIS2");
        required(header, "PRESCANX");
        required(header, "OVRSCANX");
        int serialSize = header.getIntValue(Standard.NAXIS1);
        int parallelSize = header.getIntValue(Standard.NAXIS2);
        ScanSizes sizes = new ScanSizes(parallelSize, serialSize,
                header.getIntValue("PRESCANX"),
                header.getIntValue("OVRSCANX"),
                header.getIntValue("OVRSCANY", 0));
        EuclidLayout layout = new EuclidLayout(sizes, cornerFor(ccdId, quadrantId));
        LOG.log(Level.FINE, "CCD {0} quadrant {1} has layout {2}", new Object[]{ccdId, quadrantId, layout});
        return layout;
    }

    private static Header required(Header header, String key) throws FitsException {
        if (!header.containsKey(key)) {
            throw new FitsException("Missing header keyword: " + key);
        }
        return header;
    }
}
