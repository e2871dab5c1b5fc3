package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Mercator (MER) projection.  The native poles have no solution.
 */
public class MercatorProjection
        extends Projection {

    private static final double R0 = 180.0 / Math.PI;

    public MercatorProjection(final CelestialPoint referencePoint,
                              final Double phi0,
                              final Double theta0,
                              final Double lonPole,
                              final Double latPole) {
        super(ProjectionType.MERCATOR, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected PlanePoint project(final double phi,
                                 final double theta) {
        if (Math.abs(theta) >= 90.0) {
            return null;
        }
        return new PlanePoint(phi, R0 * Math.log(DegreeMath.tan((theta + 90.0) / 2.0)));
    }

    @Override
    protected PlanePoint unproject(final double x,
                                   final double y) {
        if (Math.abs(x) > 180.0) {
            return null;
        }
        return new PlanePoint(x, 2.0 * DegreeMath.atan(Math.exp(y / R0)) - 90.0);
    }

}
