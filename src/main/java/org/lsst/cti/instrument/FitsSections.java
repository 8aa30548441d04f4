package org.lsst.cti.instrument;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.lsst.cti.region.Region;
import org.lsst.cti.region.RegionException;

/**
 * Conversion between FITS section strings such as DATASEC and regions. A
 * section <code>[x1:x2,y1:y2]</code> is 1-based and inclusive, so it maps to
 * the region <code>(y1-1, y2, x1-1, x2)</code>.
 */
public class FitsSections {

    private static final Pattern SECTION_PATTERN = Pattern.compile("\\[(\\d+):(\\d+),(\\d+):(\\d+)\\]");

    private FitsSections() {
    }

    public static Region parse(String section) throws FitsException {
        if (section == null) {
            throw new FitsException("Missing section");
        }
        Matcher matcher = SECTION_PATTERN.matcher(section.trim());
        if (!matcher.matches()) {
            throw new FitsException("Invalid section: " + section);
        }
        int x0 = Integer.parseInt(matcher.group(1)) - 1;
        int x1 = Integer.parseInt(matcher.group(2));
        int y0 = Integer.parseInt(matcher.group(3)) - 1;
        int y1 = Integer.parseInt(matcher.group(4));
        try {
            return new Region(y0, y1, x0, x1);
        } catch (RegionException x) {
            throw new FitsException("Invalid section: " + section, x);
        }
    }

    public static String format(Region region) {
        return "[" + (region.getX0() + 1) + ":" + region.getX1() + "," + (region.getY0() + 1) + ":" + region.getY1() + "]";
    }

    /**
     * Read a section keyword, e.g. DATASEC or BIASSEC, from a header.
     *
     * @param header The header
     * @param key The keyword
     * @return The region
     * @throws FitsException If the keyword is missing or malformed
     */
    public static Region fromHeader(Header header, String key) throws FitsException {
        String section = header.getStringValue(key);
        if (section == null) {
            throw new FitsException("Missing section keyword: " + key);
        }
        return parse(section);
    }
}
