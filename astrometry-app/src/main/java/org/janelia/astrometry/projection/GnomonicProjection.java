package org.janelia.astrometry.projection;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Gnomonic (TAN) projection.
 * Points at or beyond 90 degrees from the reference point have no solution.
 */
public class GnomonicProjection
        extends ZenithalProjection {

    /** Scale that produces plane coordinates in degrees. */
    public static final double DEFAULT_SCALE = 180.0 / Math.PI;

    private final double scale;

    public GnomonicProjection(final CelestialPoint referencePoint) {
        this(DEFAULT_SCALE, referencePoint);
    }

    public GnomonicProjection(final double scale,
                              final CelestialPoint referencePoint) {
        this(scale, referencePoint, null, null, null, null);
    }

    public GnomonicProjection(final double scale,
                              final CelestialPoint referencePoint,
                              final Double phi0,
                              final Double theta0,
                              final Double lonPole,
                              final Double latPole)
            throws IllegalArgumentException {
        super(ProjectionType.GNOMONIC, referencePoint, phi0, theta0, lonPole, latPole);
        if (! (scale > 0.0)) {
            throw new IllegalArgumentException("scale must be positive");
        }
        this.scale = scale;
    }

    public double getScale() {
        return scale;
    }

    @Override
    protected double radius(final double theta) {
        if (theta <= 0.0) {
            return Double.NaN;
        }
        return scale * DegreeMath.cos(theta) / DegreeMath.sin(theta);
    }

    @Override
    protected double theta(final double radius) {
        return DegreeMath.atan2(scale, radius);
    }

}
