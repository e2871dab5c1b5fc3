package org.janelia.astrometry.transform;

import Jama.LUDecomposition;
import Jama.Matrix;

import java.io.Serializable;

/**
 * Scalar surface spline z = f(x, y): a polyharmonic radial basis function interpolant
 * with kernel r^(2m-2) ln(r) augmented by a polynomial of degree m-1, where m is the order.
 * Order 2 is the classic thin plate spline.
 *
 * Node coordinates are normalized (centered and scaled to roughly unit extent) before solving.
 * A positive smoothing factor turns the interpolating surface into an approximating one.
 */
public class SurfaceSpline
        implements Serializable {

    public static final int MIN_ORDER = 2;
    public static final int MAX_ORDER = 6;

    private final int order;
    private final double centerX;
    private final double centerY;
    private final double scale;
    private final double[] nodeX;
    private final double[] nodeY;
    private final double[] kernelWeights;
    private final double[] polynomialCoefficients;

    private SurfaceSpline(final int order,
                          final double centerX,
                          final double centerY,
                          final double scale,
                          final double[] nodeX,
                          final double[] nodeY,
                          final double[] kernelWeights,
                          final double[] polynomialCoefficients) {
        this.order = order;
        this.centerX = centerX;
        this.centerY = centerY;
        this.scale = scale;
        this.nodeX = nodeX;
        this.nodeY = nodeY;
        this.kernelWeights = kernelWeights;
        this.polynomialCoefficients = polynomialCoefficients;
    }

    /**
     * @return number of polynomial terms for the specified order.
     */
    public static int getNumberOfPolynomialTerms(final int order) {
        return order * (order + 1) / 2;
    }

    /**
     * @return minimum number of nodes needed to fit a spline of the specified order.
     */
    public static int getMinimumNumberOfNodes(final int order) {
        return Math.max(6, getNumberOfPolynomialTerms(order));
    }

    /**
     * Fits one spline per value column, all sharing the same nodes and therefore a single factorization.
     *
     * @param  x          node x coordinates.
     * @param  y          node y coordinates.
     * @param  values     one array of node values per spline to fit.
     * @param  weights    optional node weights (null for uniform weights), only used when smoothing.
     * @param  order      spline order in [2, 6].
     * @param  smoothing  smoothing factor (0 for an interpolating spline).
     *
     * @return fitted splines (one per value column).
     *
     * @throws InsufficientControlPointsException
     *   if fewer nodes than {@link #getMinimumNumberOfNodes} are provided.
     * @throws TransformFitException
     *   if the linear system is singular (e.g. duplicate nodes without smoothing).
     */
    public static SurfaceSpline[] fit(final double[] x,
                                      final double[] y,
                                      final double[][] values,
                                      final double[] weights,
                                      final int order,
                                      final double smoothing)
            throws TransformFitException, IllegalArgumentException {

        if ((order < MIN_ORDER) || (order > MAX_ORDER)) {
            throw new IllegalArgumentException("spline order must be between " + MIN_ORDER + " and " + MAX_ORDER);
        }
        if (smoothing < 0) {
            throw new IllegalArgumentException("spline smoothing must not be negative");
        }

        final int n = x.length;
        final int minimumNodes = getMinimumNumberOfNodes(order);
        if (n < minimumNodes) {
            throw new InsufficientControlPointsException(n, minimumNodes);
        }

        double cx = 0, cy = 0;
        for (int i = 0; i < n; i++) {
            cx += x[i];
            cy += y[i];
        }
        cx /= n;
        cy /= n;
        double extent = 0;
        for (int i = 0; i < n; i++) {
            extent = Math.max(extent, Math.max(Math.abs(x[i] - cx), Math.abs(y[i] - cy)));
        }
        if (extent == 0) {
            throw new TransformFitException("surface spline nodes all coincide");
        }

        final double[] nx = new double[n];
        final double[] ny = new double[n];
        for (int i = 0; i < n; i++) {
            nx[i] = (x[i] - cx) / extent;
            ny[i] = (y[i] - cy) / extent;
        }

        final int terms = getNumberOfPolynomialTerms(order);
        final int size = n + terms;
        final Matrix system = new Matrix(size, size);
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                final double dx = nx[i] - nx[j];
                final double dy = ny[i] - ny[j];
                final double k = kernel(dx * dx + dy * dy, order);
                system.set(i, j, k);
                system.set(j, i, k);
            }
            if (smoothing > 0) {
                final double weight = (weights == null) ? 1.0 : weights[i];
                if (! (weight > 0)) {
                    throw new IllegalArgumentException("spline node weights must be positive");
                }
                system.set(i, i, smoothing / weight);
            }
            final double[] monomials = monomials(nx[i], ny[i], order);
            for (int t = 0; t < terms; t++) {
                system.set(i, n + t, monomials[t]);
                system.set(n + t, i, monomials[t]);
            }
        }

        final Matrix rightHandSide = new Matrix(size, values.length);
        for (int column = 0; column < values.length; column++) {
            final double[] z = values[column];
            if (z.length != n) {
                throw new IllegalArgumentException("spline value column " + column + " has " + z.length +
                                                   " entries instead of " + n);
            }
            for (int i = 0; i < n; i++) {
                rightHandSide.set(i, column, z[i]);
            }
        }

        final LUDecomposition lu = new LUDecomposition(system);
        if (! lu.isNonsingular()) {
            throw new TransformFitException("surface spline system is singular, control points may be duplicated");
        }
        final Matrix solution = lu.solve(rightHandSide);

        final SurfaceSpline[] splines = new SurfaceSpline[values.length];
        for (int column = 0; column < values.length; column++) {
            final double[] kernelWeights = new double[n];
            final double[] coefficients = new double[terms];
            for (int i = 0; i < n; i++) {
                kernelWeights[i] = solution.get(i, column);
            }
            for (int t = 0; t < terms; t++) {
                coefficients[t] = solution.get(n + t, column);
            }
            for (final double value : kernelWeights) {
                if (! Double.isFinite(value)) {
                    throw new TransformFitException("surface spline system is numerically singular");
                }
            }
            splines[column] = new SurfaceSpline(order, cx, cy, extent, nx, ny, kernelWeights, coefficients);
        }
        return splines;
    }

    public int getOrder() {
        return order;
    }

    public int getNumberOfNodes() {
        return nodeX.length;
    }

    /**
     * @return spline value at the specified point.
     */
    public double evaluate(final double x,
                           final double y) {
        final double px = (x - centerX) / scale;
        final double py = (y - centerY) / scale;
        double z = 0;
        for (int i = 0; i < nodeX.length; i++) {
            final double dx = px - nodeX[i];
            final double dy = py - nodeY[i];
            z += kernelWeights[i] * kernel(dx * dx + dy * dy, order);
        }
        final double[] monomials = monomials(px, py, order);
        for (int t = 0; t < monomials.length; t++) {
            z += polynomialCoefficients[t] * monomials[t];
        }
        return z;
    }

    /**
     * Kernel r^(2m-2) ln(r) written in terms of r^2 = s: 0.5 s^(m-1) ln(s).
     */
    private static double kernel(final double squaredDistance,
                                 final int order) {
        if (squaredDistance == 0) {
            return 0;
        }
        double power = squaredDistance;
        for (int i = 2; i < order; i++) {
            power *= squaredDistance;
        }
        return 0.5 * power * Math.log(squaredDistance);
    }

    /**
     * @return monomials x^a y^b with a + b less than the order, in graded order.
     */
    private static double[] monomials(final double x,
                                      final double y,
                                      final int order) {
        final double[] result = new double[getNumberOfPolynomialTerms(order)];
        int t = 0;
        for (int degree = 0; degree < order; degree++) {
            for (int b = 0; b <= degree; b++) {
                final int a = degree - b;
                result[t++] = Math.pow(x, a) * Math.pow(y, b);
            }
        }
        return result;
    }

}
