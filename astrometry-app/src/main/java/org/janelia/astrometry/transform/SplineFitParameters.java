package org.janelia.astrometry.transform;

import java.io.Serializable;

/**
 * Settings used to fit a {@link SurfaceSplineTransform}.
 * Serialized with solutions so that a spline can be refitted identically from its control points.
 */
public class SplineFitParameters
        implements Serializable {

    public static final int DEFAULT_ORDER = 2;
    public static final double DEFAULT_SMOOTHING = 0.010;
    public static final double DEFAULT_REJECT_FRACTION = 0.10;
    public static final int DEFAULT_MAX_POINTS = 2100;

    private final int order;
    private final double smoothing;
    private final boolean simplify;
    private final double rejectFraction;
    private final double tolerance;
    private final int maxPoints;
    private final boolean incremental;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SplineFitParameters() {
        this(DEFAULT_ORDER, DEFAULT_SMOOTHING, false, DEFAULT_REJECT_FRACTION, 0.0, DEFAULT_MAX_POINTS, false);
    }

    /**
     * @param  order           spline order (2 = thin plate, up to 6).
     * @param  smoothing       smoothing factor, 0 for exact interpolation.
     * @param  simplify        whether to reduce well approximated regions before fitting.
     * @param  rejectFraction  fraction of the worst points rejected by the simplifier's robust plane fits.
     * @param  tolerance       simplifier tolerance in destination units (RMS of the plane fit residuals).
     * @param  maxPoints       maximum number of spline nodes retained.
     * @param  incremental     whether to fit the spline to the residuals of a baseline homography.
     */
    public SplineFitParameters(final int order,
                               final double smoothing,
                               final boolean simplify,
                               final double rejectFraction,
                               final double tolerance,
                               final int maxPoints,
                               final boolean incremental)
            throws IllegalArgumentException {
        if ((order < SurfaceSpline.MIN_ORDER) || (order > SurfaceSpline.MAX_ORDER)) {
            throw new IllegalArgumentException("spline order must be between " +
                                               SurfaceSpline.MIN_ORDER + " and " + SurfaceSpline.MAX_ORDER);
        }
        if (smoothing < 0) {
            throw new IllegalArgumentException("spline smoothing must not be negative");
        }
        if ((rejectFraction < 0) || (rejectFraction >= 1)) {
            throw new IllegalArgumentException("simplifier reject fraction must be in [0, 1)");
        }
        if (maxPoints < SurfaceSpline.getMinimumNumberOfNodes(order)) {
            throw new IllegalArgumentException("maximum number of spline points is too small for order " + order);
        }
        this.order = order;
        this.smoothing = smoothing;
        this.simplify = simplify;
        this.rejectFraction = rejectFraction;
        this.tolerance = tolerance;
        this.maxPoints = maxPoints;
        this.incremental = incremental;
    }

    /**
     * @return parameters for an exactly interpolating spline of the specified order.
     */
    public static SplineFitParameters interpolating(final int order) {
        return new SplineFitParameters(order, 0.0, false, DEFAULT_REJECT_FRACTION, 0.0, DEFAULT_MAX_POINTS, false);
    }

    public int getOrder() {
        return order;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public boolean isSimplify() {
        return simplify;
    }

    public double getRejectFraction() {
        return rejectFraction;
    }

    public double getTolerance() {
        return tolerance;
    }

    public int getMaxPoints() {
        return maxPoints;
    }

    public boolean isIncremental() {
        return incremental;
    }

    @Override
    public String toString() {
        return "{order: " + order + ", smoothing: " + smoothing + ", simplify: " + simplify +
               ", rejectFraction: " + rejectFraction + ", tolerance: " + tolerance +
               ", maxPoints: " + maxPoints + ", incremental: " + incremental + '}';
    }
}
