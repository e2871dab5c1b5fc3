package org.janelia.astrometry.projection;

import java.io.Serializable;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Rotation between celestial (ra, dec) and native spherical (phi, theta) coordinates
 * as defined by Calabretta and Greisen (2002), "Representations of celestial coordinates in FITS".
 *
 * Native coordinates are returned as {@link PlanePoint} instances with x = phi and y = theta (degrees).
 */
public class SphericalRotation
        implements Serializable {

    private static final double TOLERANCE = 1.0e-5;

    private final double alphaP;
    private final double deltaP;
    private final double phiP;
    private final double latPole;
    private final double cosDeltaP;
    private final double sinDeltaP;

    /**
     * @param  lng0     celestial longitude of the fiducial point (CRVAL1).
     * @param  lat0     celestial latitude of the fiducial point (CRVAL2).
     * @param  phi0     native longitude of the fiducial point.
     * @param  theta0   native latitude of the fiducial point.
     * @param  phiP     native longitude of the celestial pole (LONPOLE).
     * @param  latPole  requested celestial latitude of the native pole (LATPOLE) or null for the default (90).
     *
     * @throws IllegalArgumentException
     *   if the parameter combination does not describe a valid rotation.
     */
    public SphericalRotation(final double lng0,
                             final double lat0,
                             final double phi0,
                             final double theta0,
                             final double phiP,
                             final Double latPole)
            throws IllegalArgumentException {

        double latP = (latPole == null) ? 90.0 : latPole;
        double lngP;

        if (theta0 == 90.0) {
            // fiducial point at the native pole
            lngP = lng0;
            latP = lat0;
        } else {
            final double sinLat0 = DegreeMath.sin(lat0);
            final double cosLat0 = DegreeMath.cos(lat0);
            final double sinTheta0 = DegreeMath.sin(theta0);
            final double cosTheta0 = DegreeMath.cos(theta0);

            boolean latPDetermined = false;
            double sinPhiP = 0.0;
            double u = 0.0;
            double v = 0.0;

            if (phiP == phi0) {
                u = theta0;
                v = 90.0 - lat0;
            } else {
                sinPhiP = DegreeMath.sin(phiP - phi0);
                final double cosPhiP = DegreeMath.cos(phiP - phi0);
                final double x = cosTheta0 * cosPhiP;
                final double y = sinTheta0;
                final double z = Math.sqrt(x * x + y * y);
                if (z == 0.0) {
                    if (sinLat0 != 0.0) {
                        throw new IllegalArgumentException(
                                "invalid WCS coordinates: lat0 must be 0 when |phiP - phi0| = 90 and theta0 = 0");
                    }
                    // latP determined solely by LATPOLE
                    latPDetermined = true;
                    latP = Math.max(-90.0, Math.min(90.0, latP));
                } else {
                    double slz = sinLat0 / z;
                    if (Math.abs(slz) > 1.0) {
                        if ((Math.abs(slz) - 1.0) < TOLERANCE) {
                            slz = slz > 0 ? 1.0 : -1.0;
                        } else {
                            throw new IllegalArgumentException(
                                    "invalid WCS coordinates: |lat0| must not exceed asin(" + z + ")");
                        }
                    }
                    u = DegreeMath.atan2(y, x);
                    v = DegreeMath.acos(slz);
                }
            }

            if (! latPDetermined) {
                final double latP1 = DegreeMath.wrap(u + v, -180.0, 180.0 + TOLERANCE);
                final double latP2 = DegreeMath.wrap(u - v, -180.0, 180.0 + TOLERANCE);

                // pick the solution closest to the requested LATPOLE
                if (Math.abs(latP - latP1) < Math.abs(latP - latP2)) {
                    latP = (Math.abs(latP1) < 90.0 + TOLERANCE) ? latP1 : latP2;
                } else {
                    latP = (Math.abs(latP2) < 90.0 + TOLERANCE) ? latP2 : latP1;
                }

                if (Math.abs(latP) < 90.0 + TOLERANCE) {
                    latP = Math.max(-90.0, Math.min(90.0, latP));
                }
            }

            final double z = DegreeMath.cos(latP) * cosLat0;
            if (Math.abs(z) < TOLERANCE) {
                if (Math.abs(cosLat0) < TOLERANCE) {
                    // celestial pole at the fiducial point
                    lngP = lng0;
                } else if (latP > 0) {
                    // celestial north pole at the native pole
                    lngP = lng0 + phiP - phi0 - 180.0;
                } else {
                    // celestial south pole at the native pole
                    lngP = lng0 - phiP + phi0;
                }
            } else {
                final double x = (sinTheta0 - DegreeMath.sin(latP) * sinLat0) / z;
                final double y = sinPhiP * cosTheta0 / cosLat0;
                if ((x == 0.0) && (y == 0.0)) {
                    throw new IllegalArgumentException("invalid WCS coordinates: undefined pole longitude");
                }
                lngP = lng0 - DegreeMath.atan2(y, x);
            }

            // keep the sign of the native pole longitude consistent with the fiducial point
            if (lng0 >= 0) {
                if (lngP < 0) {
                    lngP += 360.0;
                } else if (lngP > 360.0) {
                    lngP -= 360.0;
                }
            } else {
                if (lngP > 0) {
                    lngP -= 360.0;
                } else if (lngP < -360.0) {
                    lngP += 360.0;
                }
            }
        }

        this.latPole = latP;
        this.alphaP = lngP;
        this.deltaP = 90.0 - latP;
        this.phiP = phiP;
        this.cosDeltaP = DegreeMath.cos(this.deltaP);
        this.sinDeltaP = DegreeMath.sin(this.deltaP);
    }

    /**
     * @return celestial longitude of the native pole.
     */
    public double getAlphaP() {
        return alphaP;
    }

    /**
     * @return polar distance of the native pole (90 - celestial latitude of the native pole).
     */
    public double getDeltaP() {
        return deltaP;
    }

    /**
     * @return native longitude of the celestial pole (LONPOLE).
     */
    public double getPhiP() {
        return phiP;
    }

    /**
     * @return celestial latitude of the native pole (LATPOLE).
     */
    public double getLatPole() {
        return latPole;
    }

    /**
     * @return native (phi, theta) coordinates for the specified celestial point.
     */
    public PlanePoint celestialToNative(final double ra,
                                        final double dec) {
        final double phi;
        final double theta;

        if (sinDeltaP == 0.0) {
            // simple change in origin of longitude
            if (deltaP == 0.0) {
                final double dPhi = DegreeMath.wrap(phiP - 180.0 - alphaP, 0.0, 360.0);
                phi = DegreeMath.wrap(ra + dPhi, -180.0, 180.0);
                theta = dec;
            } else {
                final double dPhi = DegreeMath.wrap(phiP + alphaP, 0.0, 360.0);
                phi = DegreeMath.wrap(dPhi - ra, -180.0, 180.0);
                theta = -dec;
            }
        } else {
            final double sinLat = DegreeMath.sin(dec);
            final double cosLat = DegreeMath.cos(dec);
            final double cosLat3 = cosLat * cosDeltaP;

            final double dLng = ra - alphaP;
            final double cosLng = DegreeMath.cos(dLng);

            double x = sinLat * sinDeltaP - cosLat3 * cosLng;
            if (Math.abs(x) < TOLERANCE) {
                // rearranged to reduce round off
                x = -DegreeMath.cos(dec + deltaP) + cosLat3 * (1.0 - cosLng);
            }
            final double y = -cosLat * DegreeMath.sin(dLng);

            final double dPhi;
            if ((x != 0.0) || (y != 0.0)) {
                dPhi = DegreeMath.atan2(y, x);
            } else {
                dPhi = (deltaP < 90.0) ? dLng - 180.0 : -dLng;
            }
            phi = DegreeMath.wrap(phiP + dPhi, -180.0, 180.0);
            theta = latitude(dec, dLng, cosLng, sinLat * cosDeltaP + cosLat * sinDeltaP * cosLng, x, y);
        }

        return new PlanePoint(phi, theta);
    }

    /**
     * @return celestial coordinates for the specified native (phi, theta) point.
     */
    public CelestialPoint nativeToCelestial(final PlanePoint nativePoint) {
        final double phi = nativePoint.getX();
        final double theta = nativePoint.getY();
        final double ra;
        final double dec;

        if (sinDeltaP == 0.0) {
            if (deltaP == 0.0) {
                ra = phi + DegreeMath.wrap(alphaP + 180.0 - phiP, 0.0, 360.0);
                dec = theta;
            } else {
                ra = DegreeMath.wrap(alphaP + phiP, 0.0, 360.0) - phi;
                dec = -theta;
            }
        } else {
            final double sinTheta = DegreeMath.sin(theta);
            final double cosTheta = DegreeMath.cos(theta);
            final double cosTheta3 = cosTheta * cosDeltaP;

            final double dPhi = phi - phiP;
            final double cosPhi = DegreeMath.cos(dPhi);

            double x = sinTheta * sinDeltaP - cosTheta3 * cosPhi;
            if (Math.abs(x) < TOLERANCE) {
                // rearranged to reduce round off
                x = -DegreeMath.cos(theta + deltaP) + cosTheta3 * (1.0 - cosPhi);
            }
            final double y = -cosTheta * DegreeMath.sin(dPhi);

            final double dLng;
            if ((Math.abs(x) > TOLERANCE) || (Math.abs(y) > TOLERANCE)) {
                dLng = DegreeMath.atan2(y, x);
            } else {
                // change of origin of longitude
                dLng = (deltaP < 90.0) ? dPhi + 180.0 : -dPhi;
            }
            ra = alphaP + dLng;
            dec = latitude(theta, dPhi, cosPhi, sinTheta * cosDeltaP + cosTheta * sinDeltaP * cosPhi, x, y);
        }

        final double clampedDec = Math.max(-90.0, Math.min(90.0, dec));
        return new CelestialPoint(CelestialPoint.normalizeRa(ra), clampedDec);
    }

    /**
     * Shared latitude computation for both rotation directions.
     */
    private double latitude(final double sourceLatitude,
                            final double deltaLongitude,
                            final double cosDeltaLongitude,
                            final double z,
                            final double x,
                            final double y) {
        double latitude;
        if ((deltaLongitude % 180.0) == 0.0) {
            latitude = sourceLatitude + cosDeltaLongitude * deltaP;
            if (latitude > 90.0) {
                latitude = 180.0 - latitude;
            }
            if (latitude < -90.0) {
                latitude = -180.0 - latitude;
            }
        } else if (Math.abs(z) > 0.99) {
            // alternative formula is more accurate close to the poles
            latitude = DegreeMath.acos(Math.min(1.0, Math.sqrt(x * x + y * y)));
            if (latitude * z < 0) {
                latitude = -latitude;
            }
        } else {
            latitude = DegreeMath.asin(z);
        }
        return latitude;
    }

}
