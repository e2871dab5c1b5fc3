package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Zenithal equal area (ZEA) projection.
 */
public class ZenithalEqualAreaProjection
        extends ZenithalProjection {

    public ZenithalEqualAreaProjection(final CelestialPoint referencePoint,
                                       final Double phi0,
                                       final Double theta0,
                                       final Double lonPole,
                                       final Double latPole) {
        super(ProjectionType.ZENITHAL_EQUAL_AREA, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected double radius(final double theta) {
        return 360.0 / Math.PI * DegreeMath.sin((90.0 - theta) / 2.0);
    }

    @Override
    protected double theta(final double radius) {
        final double s = Math.PI / 360.0 * radius;
        if (s > 1.0) {
            return Double.NaN;
        }
        return 90.0 - 2.0 * DegreeMath.asin(s);
    }

}
