package org.janelia.astrometry.transform;

import Jama.Matrix;

import java.util.ArrayList;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Least squares fits of linear transforms to point pairs.
 *
 * All fitting methods accept index aligned lists where either side of a pair may be null;
 * such pairs are ignored.
 */
public class Homography {

    /** Minimum number of valid pairs for an unconstrained fit. */
    public static final int MIN_SAMPLES = 4;

    /** Minimum number of valid pairs for a similarity (rotation + uniform scale) fit. */
    public static final int MIN_SIMILARITY_SAMPLES = 2;

    /**
     * Relative magnitude of the off-diagonal product (compared to the determinant) below which
     * the sign of the determinant instead of the off-diagonal product decides whether a pair set is mirrored.
     */
    public static final double DEFAULT_MIRROR_THRESHOLD = 1.0e-3;

    /**
     * Fits an unconstrained transform that maps points1 onto points2 by solving an independent
     * least squares regression for each output axis against the [x, y, 1] basis.
     *
     * @throws InsufficientSamplesException
     *   if fewer than {@link #MIN_SAMPLES} valid pairs exist or if they are degenerate (e.g. collinear).
     */
    public static LinearTransform fit(final List<PlanePoint> points1,
                                      final List<PlanePoint> points2)
            throws InsufficientSamplesException {

        final PairSet pairs = new PairSet(points1, points2);
        if (pairs.size() < MIN_SAMPLES) {
            throw new InsufficientSamplesException("linear fit needs at least " + MIN_SAMPLES +
                                                   " valid point pairs but only " + pairs.size() + " are available");
        }

        // normalize source coordinates to keep the least squares problem well conditioned
        final PlanePoint mean = pairs.mean1();
        final double scale = pairs.rmsDistance1(mean);
        if (scale == 0.0) {
            throw new InsufficientSamplesException("linear fit source points are all identical");
        }

        final int n = pairs.size();
        final Matrix design = new Matrix(n, 3);
        final Matrix targets = new Matrix(n, 2);
        for (int i = 0; i < n; i++) {
            final PlanePoint p1 = pairs.first.get(i);
            final PlanePoint p2 = pairs.second.get(i);
            design.set(i, 0, (p1.getX() - mean.getX()) / scale);
            design.set(i, 1, (p1.getY() - mean.getY()) / scale);
            design.set(i, 2, 1.0);
            targets.set(i, 0, p2.getX());
            targets.set(i, 1, p2.getY());
        }

        final Matrix solution;
        try {
            solution = design.solve(targets);
        } catch (final RuntimeException e) {
            throw new InsufficientSamplesException("linear fit source points are degenerate (collinear)", e);
        }

        final double[] m = new double[6];
        for (int axis = 0; axis < 2; axis++) {
            final double a = solution.get(0, axis) / scale;
            final double b = solution.get(1, axis) / scale;
            final double c = solution.get(2, axis) - a * mean.getX() - b * mean.getY();
            m[axis * 3] = a;
            m[axis * 3 + 1] = b;
            m[axis * 3 + 2] = c;
        }

        return new LinearTransform(m[0], m[1], m[2], m[3], m[4], m[5]);
    }

    /**
     * Fits a rotation + uniform scale transform that maps anchor1 exactly onto anchor2
     * and points1 onto points2 in the least squares sense.
     * Whether the pair set is mirrored is decided by {@link #isMirrored}.
     *
     * @throws InsufficientSamplesException
     *   if fewer than {@link #MIN_SIMILARITY_SAMPLES} valid pairs exist or all source points coincide with the anchor.
     */
    public static LinearTransform fitSimilarity(final List<PlanePoint> points1,
                                                final List<PlanePoint> points2,
                                                final PlanePoint anchor1,
                                                final PlanePoint anchor2)
            throws InsufficientSamplesException {
        final PairSet pairs = new PairSet(points1, points2);
        final boolean mirrored = isMirrored(pairs, anchor1, anchor2, DEFAULT_MIRROR_THRESHOLD);
        return solveSimilarity(pairs, anchor1, anchor2, mirrored);
    }

    /**
     * Fits a rotation + uniform scale + translation transform (optionally including a reflection)
     * that maps points1 onto points2 in the least squares sense.
     *
     * @throws InsufficientSamplesException
     *   if fewer than {@link #MIN_SIMILARITY_SAMPLES} valid pairs exist or all source points coincide.
     */
    public static LinearTransform fitSimilarity(final List<PlanePoint> points1,
                                                final List<PlanePoint> points2,
                                                final boolean mirrored)
            throws InsufficientSamplesException {
        final PairSet pairs = new PairSet(points1, points2);
        if (pairs.size() < MIN_SIMILARITY_SAMPLES) {
            throw new InsufficientSamplesException("similarity fit needs at least " + MIN_SIMILARITY_SAMPLES +
                                                   " valid point pairs but only " + pairs.size() + " are available");
        }
        return solveSimilarity(pairs, pairs.mean1(), pairs.mean2(), mirrored);
    }

    /**
     * Decides whether the pairs are related by a mirrored mapping by inspecting the sign of the
     * off-diagonal product of the unconstrained 2x2 fit about the anchors: a pure rotation has a
     * non-positive product while a reflection has a non-negative one.  When the product is too
     * small (relative to the determinant) to be conclusive, the sign of the determinant decides.
     */
    public static boolean isMirrored(final List<PlanePoint> points1,
                                     final List<PlanePoint> points2,
                                     final PlanePoint anchor1,
                                     final PlanePoint anchor2,
                                     final double threshold) {
        return isMirrored(new PairSet(points1, points2), anchor1, anchor2, threshold);
    }

    private static boolean isMirrored(final PairSet pairs,
                                      final PlanePoint anchor1,
                                      final PlanePoint anchor2,
                                      final double threshold) {
        double sxx = 0, sxy = 0, syy = 0;
        double sux = 0, suy = 0, svx = 0, svy = 0;
        for (int i = 0; i < pairs.size(); i++) {
            final double dx = pairs.first.get(i).getX() - anchor1.getX();
            final double dy = pairs.first.get(i).getY() - anchor1.getY();
            final double u = pairs.second.get(i).getX() - anchor2.getX();
            final double v = pairs.second.get(i).getY() - anchor2.getY();
            sxx += dx * dx;
            sxy += dx * dy;
            syy += dy * dy;
            sux += u * dx;
            suy += u * dy;
            svx += v * dx;
            svy += v * dy;
        }

        final double normalDeterminant = sxx * syy - sxy * sxy;
        if (normalDeterminant == 0.0) {
            LOG.debug("isMirrored: degenerate pair set, assuming no reflection");
            return false;
        }

        // [a b; c d] = [sux suy; svx svy] * inverse([sxx sxy; sxy syy])
        final double a = (sux * syy - suy * sxy) / normalDeterminant;
        final double b = (suy * sxx - sux * sxy) / normalDeterminant;
        final double c = (svx * syy - svy * sxy) / normalDeterminant;
        final double d = (svy * sxx - svx * sxy) / normalDeterminant;

        final double offDiagonalProduct = b * c;
        final double determinant = a * d - b * c;
        if (Math.abs(offDiagonalProduct) > threshold * Math.abs(determinant)) {
            return offDiagonalProduct > 0;
        }
        return determinant < 0;
    }

    private static LinearTransform solveSimilarity(final PairSet pairs,
                                                   final PlanePoint anchor1,
                                                   final PlanePoint anchor2,
                                                   final boolean mirrored)
            throws InsufficientSamplesException {

        if (pairs.size() < MIN_SIMILARITY_SAMPLES) {
            throw new InsufficientSamplesException("similarity fit needs at least " + MIN_SIMILARITY_SAMPLES +
                                                   " valid point pairs but only " + pairs.size() + " are available");
        }

        double sum = 0, sumA = 0, sumB = 0;
        for (int i = 0; i < pairs.size(); i++) {
            final double dx = pairs.first.get(i).getX() - anchor1.getX();
            final double dy = pairs.first.get(i).getY() - anchor1.getY();
            final double u = pairs.second.get(i).getX() - anchor2.getX();
            final double v = pairs.second.get(i).getY() - anchor2.getY();
            sum += dx * dx + dy * dy;
            if (mirrored) {
                // u = A dx + B dy, v = B dx - A dy
                sumA += u * dx - v * dy;
                sumB += u * dy + v * dx;
            } else {
                // u = A dx - B dy, v = B dx + A dy
                sumA += u * dx + v * dy;
                sumB += v * dx - u * dy;
            }
        }

        if (sum == 0.0) {
            throw new InsufficientSamplesException("similarity fit source points all coincide with the anchor");
        }

        final double a = sumA / sum;
        final double b = sumB / sum;
        final double m00, m01, m10, m11;
        if (mirrored) {
            m00 = a;  m01 = b;
            m10 = b;  m11 = -a;
        } else {
            m00 = a;  m01 = -b;
            m10 = b;  m11 = a;
        }

        return new LinearTransform(m00, m01, anchor2.getX() - m00 * anchor1.getX() - m01 * anchor1.getY(),
                                   m10, m11, anchor2.getY() - m10 * anchor1.getX() - m11 * anchor1.getY());
    }

    /**
     * Valid (non-null on both sides) pairs extracted from index aligned lists.
     */
    private static class PairSet {

        private final List<PlanePoint> first;
        private final List<PlanePoint> second;

        PairSet(final List<PlanePoint> points1,
                final List<PlanePoint> points2)
                throws IllegalArgumentException {
            if (points1.size() != points2.size()) {
                throw new IllegalArgumentException("point lists differ in size (" + points1.size() +
                                                   " versus " + points2.size() + ")");
            }
            this.first = new ArrayList<>(points1.size());
            this.second = new ArrayList<>(points2.size());
            for (int i = 0; i < points1.size(); i++) {
                final PlanePoint p1 = points1.get(i);
                final PlanePoint p2 = points2.get(i);
                if ((p1 != null) && (p2 != null)) {
                    first.add(p1);
                    second.add(p2);
                }
            }
        }

        int size() {
            return first.size();
        }

        PlanePoint mean1() {
            return mean(first);
        }

        PlanePoint mean2() {
            return mean(second);
        }

        double rmsDistance1(final PlanePoint center) {
            double sum = 0;
            for (final PlanePoint p : first) {
                sum += p.distanceSquared(center);
            }
            return Math.sqrt(sum / first.size());
        }

        private static PlanePoint mean(final List<PlanePoint> points) {
            double x = 0, y = 0;
            for (final PlanePoint p : points) {
                x += p.getX();
                y += p.getY();
            }
            return new PlanePoint(x / points.size(), y / points.size());
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(Homography.class);
}
