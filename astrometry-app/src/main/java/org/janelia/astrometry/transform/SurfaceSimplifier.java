package org.janelia.astrometry.transform;

import Jama.Matrix;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reduces a scattered scalar surface z = f(x, y) before it is interpolated by a {@link SurfaceSpline}.
 *
 * The point set is recursively split into quadrants.  A region whose robust plane fit
 * (after rejecting the largest residuals) stays within the tolerance is replaced by its centroid
 * and its four extreme points, all evaluated on the fitted plane.  Other regions are subdivided
 * until they become too small, in which case their points are kept unchanged.
 */
public class SurfaceSimplifier {

    /** Regions with at most this many points are never simplified. */
    public static final int MIN_REGION_POINTS = 8;

    private static final int MAX_DEPTH = 24;

    private final double tolerance;
    private final double rejectFraction;

    public SurfaceSimplifier(final double tolerance,
                             final double rejectFraction) {
        this.tolerance = tolerance;
        this.rejectFraction = rejectFraction;
    }

    /**
     * A retained (possibly synthesized) surface point.
     * The rank is the smallest input index represented by the point and keeps the input order meaningful.
     */
    public static class SurfacePoint {

        private final double x;
        private final double y;
        private final double z;
        private final double weight;
        private final int rank;

        public SurfacePoint(final double x,
                            final double y,
                            final double z,
                            final double weight,
                            final int rank) {
            this.x = x;
            this.y = y;
            this.z = z;
            this.weight = weight;
            this.rank = rank;
        }

        public double getX() {
            return x;
        }

        public double getY() {
            return y;
        }

        public double getZ() {
            return z;
        }

        public double getWeight() {
            return weight;
        }

        public int getRank() {
            return rank;
        }
    }

    /**
     * @param  weights  node weights or null for uniform weights.
     *
     * @return simplified surface points ordered by rank.
     */
    public List<SurfacePoint> simplify(final double[] x,
                                       final double[] y,
                                       final double[] z,
                                       final double[] weights) {

        final int[] all = new int[x.length];
        for (int i = 0; i < all.length; i++) {
            all[i] = i;
        }

        final List<SurfacePoint> retained = new ArrayList<>();
        simplifyRegion(x, y, z, weights, all, 0, retained);
        retained.sort(Comparator.comparingInt(SurfacePoint::getRank));

        LOG.debug("simplify: reduced {} points to {}", x.length, retained.size());

        return retained;
    }

    private void simplifyRegion(final double[] x,
                                final double[] y,
                                final double[] z,
                                final double[] weights,
                                final int[] region,
                                final int depth,
                                final List<SurfacePoint> retained) {

        if ((region.length <= MIN_REGION_POINTS) || (depth >= MAX_DEPTH)) {
            keepAll(x, y, z, weights, region, retained);
            return;
        }

        final double[] plane = fitPlane(x, y, z, region);
        if (plane != null) {
            final int[] inliers = selectInliers(x, y, z, region, plane);
            final double[] refined = fitPlane(x, y, z, inliers);
            if ((refined != null) && (rms(x, y, z, inliers, refined) <= tolerance)) {
                replaceWithPlane(x, y, weights, inliers, refined, retained);
                return;
            }
        }

        // split at the center of the region's bounding box
        double minX = Double.MAX_VALUE, maxX = -Double.MAX_VALUE, minY = Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
        for (final int i : region) {
            minX = Math.min(minX, x[i]);
            maxX = Math.max(maxX, x[i]);
            minY = Math.min(minY, y[i]);
            maxY = Math.max(maxY, y[i]);
        }
        final double splitX = (minX + maxX) / 2.0;
        final double splitY = (minY + maxY) / 2.0;

        final int[][] quadrants = new int[4][region.length];
        final int[] counts = new int[4];
        for (final int i : region) {
            final int q = (x[i] < splitX ? 0 : 1) + (y[i] < splitY ? 0 : 2);
            quadrants[q][counts[q]++] = i;
        }

        for (int q = 0; q < 4; q++) {
            if (counts[q] == region.length) {
                // all points share coordinates along both axes, nothing left to split
                keepAll(x, y, z, weights, region, retained);
                return;
            }
        }

        for (int q = 0; q < 4; q++) {
            if (counts[q] > 0) {
                simplifyRegion(x, y, z, weights, Arrays.copyOf(quadrants[q], counts[q]), depth + 1, retained);
            }
        }
    }

    private int[] selectInliers(final double[] x,
                                final double[] y,
                                final double[] z,
                                final int[] region,
                                final double[] plane) {
        final Integer[] order = new Integer[region.length];
        final double[] residuals = new double[region.length];
        for (int k = 0; k < region.length; k++) {
            final int i = region[k];
            order[k] = k;
            residuals[k] = Math.abs(z[i] - (plane[0] + plane[1] * x[i] + plane[2] * y[i]));
        }
        Arrays.sort(order, Comparator.comparingDouble(k -> residuals[k]));

        final int keep = Math.max(3, (int) Math.ceil(region.length * (1.0 - rejectFraction)));
        final int[] inliers = new int[Math.min(keep, region.length)];
        for (int k = 0; k < inliers.length; k++) {
            inliers[k] = region[order[k]];
        }
        Arrays.sort(inliers);
        return inliers;
    }

    /**
     * @return plane coefficients [a, b, c] of z = a + b x + c y or null if the points are collinear.
     */
    private static double[] fitPlane(final double[] x,
                                     final double[] y,
                                     final double[] z,
                                     final int[] indexes) {
        final Matrix design = new Matrix(indexes.length, 3);
        final Matrix targets = new Matrix(indexes.length, 1);
        for (int k = 0; k < indexes.length; k++) {
            final int i = indexes[k];
            design.set(k, 0, 1.0);
            design.set(k, 1, x[i]);
            design.set(k, 2, y[i]);
            targets.set(k, 0, z[i]);
        }
        try {
            final Matrix solution = design.solve(targets);
            return new double[] { solution.get(0, 0), solution.get(1, 0), solution.get(2, 0) };
        } catch (final RuntimeException e) {
            LOG.debug("fitPlane: degenerate region with {} points", indexes.length);
            return null;
        }
    }

    private static double rms(final double[] x,
                              final double[] y,
                              final double[] z,
                              final int[] indexes,
                              final double[] plane) {
        double sum = 0;
        for (final int i : indexes) {
            final double residual = z[i] - (plane[0] + plane[1] * x[i] + plane[2] * y[i]);
            sum += residual * residual;
        }
        return Math.sqrt(sum / indexes.length);
    }

    private static void replaceWithPlane(final double[] x,
                                         final double[] y,
                                         final double[] weights,
                                         final int[] inliers,
                                         final double[] plane,
                                         final List<SurfacePoint> retained) {
        int minXIndex = inliers[0], maxXIndex = inliers[0], minYIndex = inliers[0], maxYIndex = inliers[0];
        double cx = 0, cy = 0, weightSum = 0;
        for (final int i : inliers) {
            cx += x[i];
            cy += y[i];
            weightSum += weight(weights, i);
            if (x[i] < x[minXIndex]) {
                minXIndex = i;
            }
            if (x[i] > x[maxXIndex]) {
                maxXIndex = i;
            }
            if (y[i] < y[minYIndex]) {
                minYIndex = i;
            }
            if (y[i] > y[maxYIndex]) {
                maxYIndex = i;
            }
        }
        cx /= inliers.length;
        cy /= inliers.length;

        final int[] extremes = Arrays.stream(new int[] { minXIndex, maxXIndex, minYIndex, maxYIndex })
                .distinct().toArray();
        boolean centroidIsExtreme = false;
        for (final int i : extremes) {
            retained.add(new SurfacePoint(x[i], y[i], plane[0] + plane[1] * x[i] + plane[2] * y[i],
                                          weight(weights, i), i));
            centroidIsExtreme = centroidIsExtreme || ((x[i] == cx) && (y[i] == cy));
        }
        if (! centroidIsExtreme) {
            retained.add(new SurfacePoint(cx, cy, plane[0] + plane[1] * cx + plane[2] * cy,
                                          weightSum / inliers.length, inliers[0]));
        }
    }

    private static void keepAll(final double[] x,
                                final double[] y,
                                final double[] z,
                                final double[] weights,
                                final int[] region,
                                final List<SurfacePoint> retained) {
        for (final int i : region) {
            retained.add(new SurfacePoint(x[i], y[i], z[i], weight(weights, i), i));
        }
    }

    private static double weight(final double[] weights,
                                 final int i) {
        return weights == null ? 1.0 : weights[i];
    }

    private static final Logger LOG = LoggerFactory.getLogger(SurfaceSimplifier.class);
}
