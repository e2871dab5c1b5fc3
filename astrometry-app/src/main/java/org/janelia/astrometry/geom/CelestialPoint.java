package org.janelia.astrometry.geom;

import java.io.Serializable;

/**
 * Equatorial coordinates in degrees.
 * Right ascension is normalized to [0, 360) and declination must be in [-90, 90].
 */
public class CelestialPoint
        implements Serializable {

    private final double ra;
    private final double dec;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private CelestialPoint() {
        this(0.0, 0.0);
    }

    public CelestialPoint(final double ra,
                          final double dec)
            throws IllegalArgumentException {
        if ((! Double.isFinite(ra)) || (! Double.isFinite(dec)) || (dec < -90.0) || (dec > 90.0)) {
            throw new IllegalArgumentException("invalid celestial coordinates (" + ra + ", " + dec + ")");
        }
        this.ra = normalizeRa(ra);
        this.dec = dec;
    }

    public double getRa() {
        return ra;
    }

    public double getDec() {
        return dec;
    }

    /**
     * @return great circle distance in degrees between this point and the specified point.
     */
    public double angularDistance(final CelestialPoint that) {
        // haversine formula stays accurate for the tiny separations compared during optimization
        final double sinHalfDeltaDec = Math.sin(Math.toRadians(that.dec - this.dec) / 2.0);
        final double sinHalfDeltaRa = Math.sin(Math.toRadians(that.ra - this.ra) / 2.0);
        final double h = sinHalfDeltaDec * sinHalfDeltaDec +
                         Math.cos(Math.toRadians(this.dec)) * Math.cos(Math.toRadians(that.dec)) *
                         sinHalfDeltaRa * sinHalfDeltaRa;
        return Math.toDegrees(2.0 * Math.asin(Math.min(1.0, Math.sqrt(h))));
    }

    /**
     * @return signed right ascension difference (that - this) in degrees, wrapped to [-180, 180).
     */
    public double raDelta(final CelestialPoint that) {
        double delta = (that.ra - this.ra) % 360.0;
        if (delta >= 180.0) {
            delta -= 360.0;
        } else if (delta < -180.0) {
            delta += 360.0;
        }
        return delta;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final CelestialPoint that = (CelestialPoint) o;
        return (Double.compare(that.ra, ra) == 0) && (Double.compare(that.dec, dec) == 0);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(ra) + Double.hashCode(dec);
    }

    @Override
    public String toString() {
        return "(" + ra + ", " + dec + ")";
    }

    public static double normalizeRa(final double ra) {
        double normalized = ra % 360.0;
        if (normalized < 0.0) {
            normalized += 360.0;
        }
        if (normalized >= 360.0) {
            normalized = 0.0;
        }
        return normalized;
    }
}
