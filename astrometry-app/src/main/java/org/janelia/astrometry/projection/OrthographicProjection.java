package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Orthographic (SIN) projection without slant parameters.
 * Only the hemisphere facing the reference point has a solution.
 */
public class OrthographicProjection
        extends ZenithalProjection {

    private static final double R0 = 180.0 / Math.PI;

    public OrthographicProjection(final CelestialPoint referencePoint,
                                  final Double phi0,
                                  final Double theta0,
                                  final Double lonPole,
                                  final Double latPole) {
        super(ProjectionType.ORTHOGRAPHIC, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected double radius(final double theta) {
        if (theta < 0.0) {
            return Double.NaN;
        }
        final double t = Math.toRadians(90.0 - theta);
        // cos(theta) loses precision next to the pole, use its series expansion there
        return R0 * ((t < 1.0e-5) ? t : DegreeMath.cos(theta));
    }

    @Override
    protected double theta(final double radius) {
        final double scaled = radius / R0;
        final double r2 = scaled * scaled;
        if (r2 < 0.5) {
            return DegreeMath.acos(Math.sqrt(r2));
        } else if (r2 <= 1.0) {
            return DegreeMath.asin(Math.sqrt(1.0 - r2));
        }
        return Double.NaN;
    }

}
