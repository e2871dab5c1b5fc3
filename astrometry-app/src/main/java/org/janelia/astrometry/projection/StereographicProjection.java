package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Stereographic (STG) projection.
 */
public class StereographicProjection
        extends ZenithalProjection {

    public StereographicProjection(final CelestialPoint referencePoint,
                                   final Double phi0,
                                   final Double theta0,
                                   final Double lonPole,
                                   final Double latPole) {
        super(ProjectionType.STEREOGRAPHIC, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected double radius(final double theta) {
        if (theta <= -90.0) {
            return Double.NaN;
        }
        return 360.0 / Math.PI * DegreeMath.tan((90.0 - theta) / 2.0);
    }

    @Override
    protected double theta(final double radius) {
        return 90.0 - 2.0 * DegreeMath.atan(Math.PI / 360.0 * radius);
    }

}
