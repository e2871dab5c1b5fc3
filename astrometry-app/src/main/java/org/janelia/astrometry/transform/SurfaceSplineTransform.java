package org.janelia.astrometry.transform;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-linear plane to plane transform built from one {@link SurfaceSpline} per output axis.
 *
 * In incremental mode the splines model the residuals of a baseline homography fitted to the
 * same control points.  When more nodes than allowed remain after (optional) simplification,
 * the first nodes (in control point order) are kept and the transform is flagged as truncated.
 */
public class SurfaceSplineTransform
        implements PointTransform, Serializable {

    private final SplineFitParameters parameters;
    private final LinearTransform baseline;
    private final SurfaceSpline splineX;
    private final SurfaceSpline splineY;
    private final int numberOfControlPoints;
    private final boolean truncated;

    private SurfaceSplineTransform(final SplineFitParameters parameters,
                                   final LinearTransform baseline,
                                   final SurfaceSpline splineX,
                                   final SurfaceSpline splineY,
                                   final int numberOfControlPoints,
                                   final boolean truncated) {
        this.parameters = parameters;
        this.baseline = baseline;
        this.splineX = splineX;
        this.splineY = splineY;
        this.numberOfControlPoints = numberOfControlPoints;
        this.truncated = truncated;
    }

    /**
     * Fits a transform that maps source points onto destination points.
     *
     * @param  source       source control points (null entries are skipped together with their partner).
     * @param  destination  index aligned destination control points.
     * @param  weights      optional index aligned weights (null for uniform weights).
     * @param  parameters   fit settings.
     *
     * @throws InsufficientControlPointsException
     *   if too few valid control point pairs are available for the spline order.
     * @throws TransformFitException
     *   if the spline system cannot be solved.
     */
    public static SurfaceSplineTransform fit(final List<PlanePoint> source,
                                             final List<PlanePoint> destination,
                                             final double[] weights,
                                             final SplineFitParameters parameters)
            throws TransformFitException {

        if (source.size() != destination.size()) {
            throw new IllegalArgumentException("control point lists differ in size (" + source.size() +
                                               " versus " + destination.size() + ")");
        }

        final List<PlanePoint> validSource = new ArrayList<>(source.size());
        final List<PlanePoint> validDestination = new ArrayList<>(source.size());
        final List<Double> validWeights = new ArrayList<>(source.size());
        for (int i = 0; i < source.size(); i++) {
            if ((source.get(i) != null) && (destination.get(i) != null)) {
                validSource.add(source.get(i));
                validDestination.add(destination.get(i));
                validWeights.add(weights == null ? 1.0 : weights[i]);
            }
        }

        final int n = validSource.size();
        final int minimumNodes = SurfaceSpline.getMinimumNumberOfNodes(parameters.getOrder());
        if (n < minimumNodes) {
            throw new InsufficientControlPointsException(n, minimumNodes);
        }

        final LinearTransform baseline = parameters.isIncremental() ?
                                         Homography.fit(validSource, validDestination) : null;

        final double[] x = new double[n];
        final double[] y = new double[n];
        final double[] zx = new double[n];
        final double[] zy = new double[n];
        final double[] w = weights == null ? null : new double[n];
        for (int i = 0; i < n; i++) {
            final PlanePoint s = validSource.get(i);
            final PlanePoint d = validDestination.get(i);
            final PlanePoint base = (baseline == null) ? null : baseline.apply(s);
            x[i] = s.getX();
            y[i] = s.getY();
            zx[i] = (base == null) ? d.getX() : d.getX() - base.getX();
            zy[i] = (base == null) ? d.getY() : d.getY() - base.getY();
            if (w != null) {
                w[i] = validWeights.get(i);
            }
        }

        final int maxPoints = parameters.getMaxPoints();
        final SurfaceSpline splineX;
        final SurfaceSpline splineY;
        final boolean truncated;

        if (parameters.isSimplify()) {
            final SurfaceSimplifier simplifier = new SurfaceSimplifier(parameters.getTolerance(),
                                                                       parameters.getRejectFraction());
            final List<SurfaceSimplifier.SurfacePoint> simplifiedX = simplifier.simplify(x, y, zx, w);
            final List<SurfaceSimplifier.SurfacePoint> simplifiedY = simplifier.simplify(x, y, zy, w);
            truncated = (getNodeCandidateCount(simplifiedX, n, minimumNodes) > maxPoints) ||
                        (getNodeCandidateCount(simplifiedY, n, minimumNodes) > maxPoints);
            splineX = fitSimplified(simplifiedX, x, y, zx, w, parameters);
            splineY = fitSimplified(simplifiedY, x, y, zy, w, parameters);
            LOG.debug("fit: simplified {} control points to {} (x) and {} (y) nodes",
                      n, splineX.getNumberOfNodes(), splineY.getNumberOfNodes());
        } else {
            truncated = n > maxPoints;
            final int count = Math.min(n, maxPoints);
            final SurfaceSpline[] splines =
                    SurfaceSpline.fit(head(x, count), head(y, count),
                                      new double[][] { head(zx, count), head(zy, count) },
                                      w == null ? null : head(w, count),
                                      parameters.getOrder(),
                                      parameters.getSmoothing());
            splineX = splines[0];
            splineY = splines[1];
        }

        if (truncated) {
            LOG.warn("fit: number of spline nodes exceeds maximum of {}, extra control points were ignored",
                     maxPoints);
        }

        return new SurfaceSplineTransform(parameters, baseline, splineX, splineY, n, truncated);
    }

    public SplineFitParameters getParameters() {
        return parameters;
    }

    /**
     * @return number of valid control point pairs the transform was fitted to.
     */
    public int getNumberOfControlPoints() {
        return numberOfControlPoints;
    }

    /**
     * @return number of spline nodes actually used for the x and y axes.
     */
    public int[] getNumberOfNodes() {
        return new int[] { splineX.getNumberOfNodes(), splineY.getNumberOfNodes() };
    }

    /**
     * @return true if some control points were ignored because the maximum number of spline nodes was reached.
     */
    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public PlanePoint apply(final PlanePoint point) {
        double x = splineX.evaluate(point.getX(), point.getY());
        double y = splineY.evaluate(point.getX(), point.getY());
        if (baseline != null) {
            final PlanePoint base = baseline.apply(point);
            x += base.getX();
            y += base.getY();
        }
        return new PlanePoint(x, y);
    }

    @Override
    public String toString() {
        return "SurfaceSplineTransform{controlPoints: " + numberOfControlPoints +
               ", parameters: " + parameters + ", truncated: " + truncated + '}';
    }

    /**
     * @return number of nodes a simplified axis is fitted with before the maximum is applied
     *         (all control points when the simplifier left too few nodes).
     */
    private static int getNodeCandidateCount(final List<SurfaceSimplifier.SurfacePoint> simplified,
                                             final int numberOfControlPoints,
                                             final int minimumNodes) {
        return simplified.size() < minimumNodes ? numberOfControlPoints : simplified.size();
    }

    private static SurfaceSpline fitSimplified(final List<SurfaceSimplifier.SurfacePoint> simplified,
                                               final double[] x,
                                               final double[] y,
                                               final double[] z,
                                               final double[] w,
                                               final SplineFitParameters parameters)
            throws TransformFitException {

        final int minimumNodes = SurfaceSpline.getMinimumNumberOfNodes(parameters.getOrder());
        if (simplified.size() < minimumNodes) {
            // surface is so smooth that the simplifier left too few nodes, fit the full set instead
            final int count = Math.min(x.length, parameters.getMaxPoints());
            return SurfaceSpline.fit(head(x, count), head(y, count), new double[][] { head(z, count) },
                                     w == null ? null : head(w, count),
                                     parameters.getOrder(), parameters.getSmoothing())[0];
        }

        final int count = Math.min(simplified.size(), parameters.getMaxPoints());
        final double[] sx = new double[count];
        final double[] sy = new double[count];
        final double[] sz = new double[count];
        final double[] sw = new double[count];
        for (int i = 0; i < count; i++) {
            final SurfaceSimplifier.SurfacePoint point = simplified.get(i);
            sx[i] = point.getX();
            sy[i] = point.getY();
            sz[i] = point.getZ();
            sw[i] = point.getWeight();
        }
        return SurfaceSpline.fit(sx, sy, new double[][] { sz }, sw,
                                 parameters.getOrder(), parameters.getSmoothing())[0];
    }

    private static double[] head(final double[] values,
                                 final int count) {
        if (count == values.length) {
            return values;
        }
        final double[] result = new double[count];
        System.arraycopy(values, 0, result, 0, count);
        return result;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SurfaceSplineTransform.class);
}
