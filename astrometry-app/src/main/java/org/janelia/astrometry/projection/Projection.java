package org.janelia.astrometry.projection;

import java.io.Serializable;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.wcs.WcsKeywords;

/**
 * Base for all spherical projections.
 *
 * A celestial point is first rotated into native spherical coordinates (see {@link SphericalRotation})
 * and then mapped onto the projection plane by the kind specific {@link #project} formula.
 * Plane coordinates are expressed in degrees.
 */
public abstract class Projection
        implements Serializable {

    private final ProjectionType type;
    private final CelestialPoint referencePoint;
    private final double phi0;
    private final double theta0;
    private final SphericalRotation rotation;

    /**
     * Creates a projection from its WCS description.
     *
     * @param  type            projection kind.
     * @param  referencePoint  celestial coordinates of the fiducial point (CRVAL1, CRVAL2).
     * @param  phi0            native longitude of the fiducial point (PV1_1) or null for the kind default.
     * @param  theta0          native latitude of the fiducial point (PV1_2) or null for the kind default.
     * @param  lonPole         native longitude of the celestial pole (LONPOLE) or null for the FITS default.
     * @param  latPole         celestial latitude of the native pole (LATPOLE) or null for the FITS default.
     *
     * @throws IllegalArgumentException
     *   if the parameters do not describe a valid projection.
     */
    protected Projection(final ProjectionType type,
                         final CelestialPoint referencePoint,
                         final Double phi0,
                         final Double theta0,
                         final Double lonPole,
                         final Double latPole)
            throws IllegalArgumentException {

        this.type = type;
        this.referencePoint = referencePoint;
        this.phi0 = (phi0 == null) ? 0.0 : phi0;
        this.theta0 = clampTheta0(theta0 == null ? type.getDefaultTheta0() : theta0);

        final double phiP = (lonPole == null) ? getDefaultLonPole(referencePoint.getDec(), this.phi0, this.theta0) : lonPole;

        this.rotation = new SphericalRotation(referencePoint.getRa(),
                                              referencePoint.getDec(),
                                              this.phi0,
                                              this.theta0,
                                              phiP,
                                              latPole);
    }

    public ProjectionType getType() {
        return type;
    }

    public CelestialPoint getReferencePoint() {
        return referencePoint;
    }

    public double getPhi0() {
        return phi0;
    }

    public double getTheta0() {
        return theta0;
    }

    public SphericalRotation getRotation() {
        return rotation;
    }

    /**
     * @return projection plane coordinates (degrees) for the specified celestial point,
     *         or null if the point is outside of this projection's domain.
     */
    public PlanePoint direct(final CelestialPoint celestialPoint) {
        final PlanePoint nativePoint = rotation.celestialToNative(celestialPoint.getRa(), celestialPoint.getDec());
        if (isNotFinite(nativePoint)) {
            return null;
        }
        final PlanePoint planePoint = project(nativePoint.getX(), nativePoint.getY());
        return isNotFinite(planePoint) ? null : planePoint;
    }

    /**
     * @return celestial coordinates for the specified projection plane point,
     *         or null if the point is outside of this projection's domain.
     */
    public CelestialPoint inverse(final PlanePoint planePoint) {
        final PlanePoint nativePoint = unproject(planePoint.getX(), planePoint.getY());
        if (isNotFinite(nativePoint)) {
            return null;
        }
        return rotation.nativeToCelestial(nativePoint);
    }

    /**
     * @return the WCS description of this projection (CTYPE, CRVAL, LONPOLE, LATPOLE and PV1_x).
     *         Image related keywords (CRPIX, CD) are left unset.
     */
    public WcsKeywords toWcs() {
        final WcsKeywords wcs = new WcsKeywords();
        wcs.ctype1 = "RA---" + type.getCode();
        wcs.ctype2 = "DEC--" + type.getCode();
        wcs.crval1 = referencePoint.getRa();
        wcs.crval2 = referencePoint.getDec();
        wcs.lonpole = rotation.getPhiP();
        wcs.latpole = rotation.getLatPole();
        if (phi0 != 0.0) {
            wcs.pv1_1 = phi0;
        }
        if (theta0 != type.getDefaultTheta0()) {
            wcs.pv1_2 = theta0;
        }
        return wcs;
    }

    /**
     * Maps native spherical coordinates onto the projection plane.
     *
     * @return plane point or null if there is no solution.
     */
    protected abstract PlanePoint project(final double phi,
                                          final double theta);

    /**
     * Maps a projection plane point back to native spherical coordinates.
     *
     * @return native (phi, theta) point or null if there is no solution.
     */
    protected abstract PlanePoint unproject(final double x,
                                            final double y);

    @Override
    public String toString() {
        return type.getCode() + "@" + referencePoint;
    }

    /**
     * @return the FITS default native longitude of the celestial pole.
     */
    public static double getDefaultLonPole(final double lat0,
                                           final double phi0,
                                           final double theta0) {
        double phiP = (lat0 < theta0) ? 180.0 : 0.0;
        phiP += phi0;
        if (phiP < -180.0) {
            phiP += 360.0;
        } else if (phiP > 180.0) {
            phiP -= 360.0;
        }
        return phiP;
    }

    private static double clampTheta0(final double theta0)
            throws IllegalArgumentException {
        if (Math.abs(theta0) > 90.0) {
            if (Math.abs(theta0) > 90.0 + 1.0e-5) {
                throw new IllegalArgumentException("invalid WCS coordinates: |theta0| " + theta0 + " > 90");
            }
            return theta0 > 90.0 ? 90.0 : -90.0;
        }
        return theta0;
    }

    private static boolean isNotFinite(final PlanePoint point) {
        return (point == null) || (! Double.isFinite(point.getX())) || (! Double.isFinite(point.getY()));
    }

}
