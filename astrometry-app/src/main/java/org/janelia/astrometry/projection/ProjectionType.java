package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.wcs.WcsKeywords;

/**
 * Supported projection kinds keyed by their FITS projection code.
 */
public enum ProjectionType {

    GNOMONIC("TAN", 90.0),
    STEREOGRAPHIC("STG", 90.0),
    PLATE_CARREE("CAR", 0.0),
    MERCATOR("MER", 0.0),
    HAMMER_AITOFF("AIT", 0.0),
    ZENITHAL_EQUAL_AREA("ZEA", 90.0),
    ORTHOGRAPHIC("SIN", 90.0);

    private final String code;
    private final double defaultTheta0;

    ProjectionType(final String code,
                   final double defaultTheta0) {
        this.code = code;
        this.defaultTheta0 = defaultTheta0;
    }

    /**
     * @return three letter FITS projection code.
     */
    public String getCode() {
        return code;
    }

    public double getDefaultTheta0() {
        return defaultTheta0;
    }

    /**
     * @return projection of this kind centered on the specified reference point with default pole parameters.
     */
    public Projection build(final CelestialPoint referencePoint) {
        return build(referencePoint, null, null, null, null);
    }

    public Projection build(final CelestialPoint referencePoint,
                            final Double phi0,
                            final Double theta0,
                            final Double lonPole,
                            final Double latPole)
            throws IllegalArgumentException {
        final Projection projection;
        switch (this) {
            case GNOMONIC:
                projection = new GnomonicProjection(GnomonicProjection.DEFAULT_SCALE,
                                                    referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case STEREOGRAPHIC:
                projection = new StereographicProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case PLATE_CARREE:
                projection = new PlateCarreeProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case MERCATOR:
                projection = new MercatorProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case HAMMER_AITOFF:
                projection = new HammerAitoffProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case ZENITHAL_EQUAL_AREA:
                projection = new ZenithalEqualAreaProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            case ORTHOGRAPHIC:
                projection = new OrthographicProjection(referencePoint, phi0, theta0, lonPole, latPole);
                break;
            default:
                throw new IllegalArgumentException("unsupported projection type " + this);
        }
        return projection;
    }

    /**
     * @return projection type for a CTYPE value such as 'RA---TAN'.
     *
     * @throws IllegalArgumentException
     *   if the value does not name a supported projection.
     */
    public static ProjectionType fromCtype(final String ctype)
            throws IllegalArgumentException {
        if (ctype == null) {
            throw new IllegalArgumentException("missing CTYPE");
        }
        final String trimmed = ctype.replace("'", "").trim();
        if (trimmed.length() < 3) {
            throw new IllegalArgumentException("invalid CTYPE '" + ctype + "'");
        }
        return fromCode(trimmed.substring(trimmed.length() - 3));
    }

    public static ProjectionType fromCode(final String code)
            throws IllegalArgumentException {
        for (final ProjectionType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("unsupported projection code '" + code + "'");
    }

    /**
     * @return projection described by the specified WCS keywords.
     *
     * @throws IllegalArgumentException
     *   if the keywords do not describe a supported projection.
     */
    public static Projection fromWcs(final WcsKeywords wcs)
            throws IllegalArgumentException {
        if ((wcs.crval1 == null) || (wcs.crval2 == null)) {
            throw new IllegalArgumentException("WCS keywords must include CRVAL1 and CRVAL2");
        }
        final ProjectionType type = fromCtype(wcs.ctype1);
        return type.build(new CelestialPoint(wcs.crval1, wcs.crval2),
                          wcs.pv1_1,
                          wcs.pv1_2,
                          wcs.lonpole,
                          wcs.latpole);
    }

}
