package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Plate carree (CAR) projection: native longitude and latitude are used directly as plane coordinates.
 */
public class PlateCarreeProjection
        extends Projection {

    public PlateCarreeProjection(final CelestialPoint referencePoint,
                                 final Double phi0,
                                 final Double theta0,
                                 final Double lonPole,
                                 final Double latPole) {
        super(ProjectionType.PLATE_CARREE, referencePoint, phi0, theta0, lonPole, latPole);
    }

    @Override
    protected PlanePoint project(final double phi,
                                 final double theta) {
        return new PlanePoint(phi, theta);
    }

    @Override
    protected PlanePoint unproject(final double x,
                                   final double y) {
        if ((Math.abs(x) > 180.0) || (Math.abs(y) > 90.0)) {
            return null;
        }
        return new PlanePoint(x, y);
    }

}
