package org.janelia.astrometry.wcs;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * World coordinate system keywords describing a celestial projection and its linear image mapping.
 *
 * Pixel coordinates follow the FITS convention: the center of the first pixel is (1,1)
 * and the second axis points up.  Unset values are null.
 */
public class WcsKeywords
        implements Serializable {

    public static final String DEFAULT_RADESYS = "ICRS";

    public String ctype1;
    public String ctype2;
    public Double crval1;
    public Double crval2;
    public Double crpix1;
    public Double crpix2;
    public Double cd1_1;
    public Double cd1_2;
    public Double cd2_1;
    public Double cd2_2;
    public Double cdelt1;
    public Double cdelt2;
    public Double crota1;
    public Double crota2;
    public Double lonpole;
    public Double latpole;
    public Double pv1_1;
    public Double pv1_2;
    public String radesys;
    public Double equinox;

    public WcsKeywords() {
    }

    public boolean hasLinearMapping() {
        return (crpix1 != null) && (crpix2 != null) &&
               (((cd1_1 != null) && (cd1_2 != null) && (cd2_1 != null) && (cd2_2 != null)) ||
                ((cdelt1 != null) && (cdelt2 != null)));
    }

    /**
     * Derives the legacy CDELT/CROTA keywords from the CD matrix.
     */
    public void deriveScaleAndRotation() {
        if ((cd1_1 == null) || (cd1_2 == null) || (cd2_1 == null) || (cd2_2 == null)) {
            return;
        }
        final double determinant = cd1_1 * cd2_2 - cd1_2 * cd2_1;
        final double sign = determinant < 0 ? -1.0 : 1.0;
        final double rotation = Math.atan2(sign * cd2_1, sign * cd1_1);
        final double scale1 = sign * Math.hypot(cd1_1, cd2_1);
        final double scale2 = (Math.abs(Math.cos(rotation)) > Math.abs(Math.sin(rotation))) ?
                              cd2_2 / Math.cos(rotation) : -cd1_2 / Math.sin(rotation);
        cdelt1 = scale1;
        cdelt2 = scale2;
        crota1 = Math.toDegrees(rotation);
        crota2 = crota1;
    }

    /**
     * Fills in the CD matrix from the legacy CDELT/CROTA keywords when it is missing.
     */
    public void deriveCdMatrix() {
        if ((cd1_1 != null) || (cdelt1 == null) || (cdelt2 == null)) {
            return;
        }
        final double rotation = Math.toRadians(crota2 == null ? (crota1 == null ? 0.0 : crota1) : crota2);
        cd1_1 = cdelt1 * Math.cos(rotation);
        cd1_2 = -cdelt2 * Math.sin(rotation);
        cd2_1 = cdelt1 * Math.sin(rotation);
        cd2_2 = cdelt2 * Math.cos(rotation);
    }

    /**
     * @return FITS header keywords for all set values, in standard order.
     */
    public List<FitsKeyword> toFitsKeywords() {
        final List<FitsKeyword> list = new ArrayList<>();
        addString(list, "CTYPE1", ctype1, "Axis1 projection");
        addString(list, "CTYPE2", ctype2, "Axis2 projection");
        addString(list, "RADESYS", radesys, "Reference system of celestial coordinates");
        addNumber(list, "EQUINOX", equinox, "Epoch of the mean equator and equinox (years)");
        addNumber(list, "CRPIX1", crpix1, "Axis1 reference pixel");
        addNumber(list, "CRPIX2", crpix2, "Axis2 reference pixel");
        addNumber(list, "CRVAL1", crval1, "Axis1 reference value (deg)");
        addNumber(list, "CRVAL2", crval2, "Axis2 reference value (deg)");
        addNumber(list, "PV1_1", pv1_1, "Native longitude of the reference point (deg)");
        addNumber(list, "PV1_2", pv1_2, "Native latitude of the reference point (deg)");
        addNumber(list, "LONPOLE", lonpole, "Native longitude of the celestial pole (deg)");
        addNumber(list, "LATPOLE", latpole, "Celestial latitude of the native pole (deg)");
        addNumber(list, "CD1_1", cd1_1, "Scale matrix (1,1)");
        addNumber(list, "CD1_2", cd1_2, "Scale matrix (1,2)");
        addNumber(list, "CD2_1", cd2_1, "Scale matrix (2,1)");
        addNumber(list, "CD2_2", cd2_2, "Scale matrix (2,2)");
        addNumber(list, "CDELT1", cdelt1, "Axis1 scale (deg/px)");
        addNumber(list, "CDELT2", cdelt2, "Axis2 scale (deg/px)");
        addNumber(list, "CROTA1", crota1, "Axis1 rotation angle (deg)");
        addNumber(list, "CROTA2", crota2, "Axis2 rotation angle (deg)");
        return list;
    }

    /**
     * @return WCS keywords parsed from the specified header keywords (unrelated keywords are ignored).
     *
     * @throws IllegalArgumentException
     *   if a WCS keyword has an invalid value.
     */
    public static WcsKeywords fromFitsKeywords(final List<FitsKeyword> keywords)
            throws IllegalArgumentException {

        final Map<String, FitsKeyword> byName = new HashMap<>();
        for (final FitsKeyword keyword : keywords) {
            byName.put(keyword.getName(), keyword);
        }

        final WcsKeywords wcs = new WcsKeywords();
        wcs.ctype1 = stringValue(byName, "CTYPE1");
        wcs.ctype2 = stringValue(byName, "CTYPE2");
        wcs.radesys = stringValue(byName, "RADESYS");
        wcs.equinox = numericValue(byName, "EQUINOX");
        wcs.crpix1 = numericValue(byName, "CRPIX1");
        wcs.crpix2 = numericValue(byName, "CRPIX2");
        wcs.crval1 = numericValue(byName, "CRVAL1");
        wcs.crval2 = numericValue(byName, "CRVAL2");
        wcs.pv1_1 = numericValue(byName, "PV1_1");
        wcs.pv1_2 = numericValue(byName, "PV1_2");
        wcs.lonpole = numericValue(byName, "LONPOLE");
        wcs.latpole = numericValue(byName, "LATPOLE");
        wcs.cd1_1 = numericValue(byName, "CD1_1");
        wcs.cd1_2 = numericValue(byName, "CD1_2");
        wcs.cd2_1 = numericValue(byName, "CD2_1");
        wcs.cd2_2 = numericValue(byName, "CD2_2");
        wcs.cdelt1 = numericValue(byName, "CDELT1");
        wcs.cdelt2 = numericValue(byName, "CDELT2");
        wcs.crota1 = numericValue(byName, "CROTA1");
        wcs.crota2 = numericValue(byName, "CROTA2");
        wcs.deriveCdMatrix();
        return wcs;
    }

    private static void addString(final List<FitsKeyword> list,
                                  final String name,
                                  final String value,
                                  final String comment) {
        if (value != null) {
            list.add(FitsKeyword.forString(name, value, comment));
        }
    }

    private static void addNumber(final List<FitsKeyword> list,
                                  final String name,
                                  final Double value,
                                  final String comment) {
        if (value != null) {
            list.add(FitsKeyword.forNumber(name, value, comment));
        }
    }

    private static String stringValue(final Map<String, FitsKeyword> byName,
                                      final String name) {
        final FitsKeyword keyword = byName.get(name);
        return keyword == null ? null : keyword.getStringValue();
    }

    private static Double numericValue(final Map<String, FitsKeyword> byName,
                                       final String name) {
        final FitsKeyword keyword = byName.get(name);
        return keyword == null ? null : keyword.getNumericValue();
    }

}
