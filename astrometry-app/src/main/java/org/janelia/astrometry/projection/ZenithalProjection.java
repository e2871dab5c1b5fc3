package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Base for zenithal (azimuthal) projections where the plane radius only depends on the native latitude.
 */
public abstract class ZenithalProjection
        extends Projection {

    protected ZenithalProjection(final ProjectionType type,
                                 final CelestialPoint referencePoint,
                                 final Double phi0,
                                 final Double theta0,
                                 final Double lonPole,
                                 final Double latPole) {
        super(type, referencePoint, phi0, theta0, lonPole, latPole);
    }

    /**
     * @return plane radius for the specified native latitude or NaN if there is no solution.
     */
    protected abstract double radius(final double theta);

    /**
     * @return native latitude for the specified plane radius or NaN if there is no solution.
     */
    protected abstract double theta(final double radius);

    @Override
    protected PlanePoint project(final double phi,
                                 final double theta) {
        final double r = radius(theta);
        if (Double.isNaN(r)) {
            return null;
        }
        return new PlanePoint(r * DegreeMath.sin(phi), -r * DegreeMath.cos(phi));
    }

    @Override
    protected PlanePoint unproject(final double x,
                                   final double y) {
        final double r = Math.sqrt(x * x + y * y);
        final double theta = theta(r);
        if (Double.isNaN(theta)) {
            return null;
        }
        final double phi = (r == 0.0) ? 0.0 : DegreeMath.atan2(x, -y);
        return new PlanePoint(phi, theta);
    }

}
