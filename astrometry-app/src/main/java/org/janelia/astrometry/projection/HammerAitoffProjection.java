package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Hammer-Aitoff (AIT) equal area projection.
 */
public class HammerAitoffProjection
        extends Projection {

    private static final double R0 = 180.0 / Math.PI;
    private static final double Z_MIN = 1.0 / Math.sqrt(2.0);

    public HammerAitoffProjection(final CelestialPoint referencePoint,
                                  final Double phi0,
                                  final Double theta0,
                                  final Double lonPole,
                                  final Double latPole) {
        super(ProjectionType.HAMMER_AITOFF, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected PlanePoint project(final double phi,
                                 final double theta) {
        final double cosTheta = DegreeMath.cos(theta);
        final double gamma = R0 * Math.sqrt(2.0 / (1.0 + cosTheta * DegreeMath.cos(phi / 2.0)));
        return new PlanePoint(2.0 * gamma * cosTheta * DegreeMath.sin(phi / 2.0),
                              gamma * DegreeMath.sin(theta));
    }

    @Override
    protected PlanePoint unproject(final double x,
                                   final double y) {
        final double bigX = Math.PI * x / 720.0;
        final double bigY = Math.PI * y / 360.0;
        final double z2 = 1.0 - bigX * bigX - bigY * bigY;
        if (z2 < Z_MIN * Z_MIN) {
            return null;
        }
        final double z = Math.sqrt(z2);
        return new PlanePoint(2.0 * DegreeMath.atan2(2.0 * z * bigX, 2.0 * z * z - 1.0),
                              DegreeMath.asin(Math.toRadians(y) * z));
    }

}
