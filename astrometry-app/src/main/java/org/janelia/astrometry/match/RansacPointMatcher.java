package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.InsufficientSamplesException;
import org.janelia.astrometry.transform.LinearTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outlier robust matcher for index aligned observed/predicted point lists.
 *
 * Each trial fits a similarity transform to a random pair of correspondences, collects the pairs
 * it explains within the tolerance, refits on that consensus set and rates it with a weighted sum of
 * <ul>
 *     <li>kLength: the fraction of valid pairs in the consensus set,</li>
 *     <li>kOverlap: the fraction of the observed bounding box area covered by the consensus set,</li>
 *     <li>kRegularity: the fraction of occupied grid cells that still contain consensus pairs,</li>
 *     <li>kRms: the consensus RMS residual relative to the tolerance (subtracted).</li>
 * </ul>
 * The best rated set wins.  Trials stop after maxIterations or once enough trials have run to
 * find the best set's inlier ratio with high confidence.
 */
public class RansacPointMatcher {

    public static final int DEFAULT_MAX_ITERATIONS = 1000;
    public static final int MIN_CONSENSUS_SIZE = 3;

    private static final int MIN_ITERATIONS = 100;
    private static final double CONFIDENCE = 0.999;
    private static final int REGULARITY_GRID_SIZE = 4;

    private final double tolerance;
    private final int maxIterations;
    private final double kLength;
    private final double kOverlap;
    private final double kRegularity;
    private final double kRms;
    private final boolean mirrored;
    private final Random random;

    public RansacPointMatcher(final double tolerance,
                              final int maxIterations,
                              final double kLength,
                              final double kOverlap,
                              final double kRegularity,
                              final double kRms,
                              final boolean mirrored,
                              final Random random)
            throws IllegalArgumentException {
        if (! (tolerance > 0)) {
            throw new IllegalArgumentException("RANSAC tolerance must be positive");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("RANSAC maxIterations must be positive");
        }
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.kLength = kLength;
        this.kOverlap = kOverlap;
        this.kRegularity = kRegularity;
        this.kRms = kRms;
        this.mirrored = mirrored;
        this.random = random;
    }

    /**
     * @param  observed   observed positions (null entries are ignored).
     * @param  predicted  index aligned predicted positions (null entries are ignored).
     *
     * @return best consensus set found.
     *
     * @throws InsufficientSamplesException
     *   if there are too few valid pairs or no consensus set with at least {@link #MIN_CONSENSUS_SIZE} pairs exists.
     */
    public RansacMatchResult match(final List<PlanePoint> observed,
                                   final List<PlanePoint> predicted)
            throws InsufficientSamplesException, IllegalArgumentException {

        if (observed.size() != predicted.size()) {
            throw new IllegalArgumentException("observed and predicted lists differ in size (" +
                                               observed.size() + " versus " + predicted.size() + ")");
        }

        final List<Integer> valid = new ArrayList<>(observed.size());
        for (int i = 0; i < observed.size(); i++) {
            if ((observed.get(i) != null) && (predicted.get(i) != null)) {
                valid.add(i);
            }
        }

        if (valid.size() < MIN_CONSENSUS_SIZE) {
            throw new InsufficientSamplesException("RANSAC needs at least " + MIN_CONSENSUS_SIZE +
                                                   " valid pairs but only " + valid.size() + " are available");
        }

        final Layout layout = new Layout(observed, valid);

        int[] bestInliers = null;
        LinearTransform bestTransform = null;
        double bestQuality = -Double.MAX_VALUE;
        double bestRms = 0;
        long requiredIterations = maxIterations;

        int iteration = 0;
        while ((iteration < maxIterations) && (iteration < Math.max(MIN_ITERATIONS, requiredIterations))) {
            iteration++;

            final int first = valid.get(random.nextInt(valid.size()));
            int second = valid.get(random.nextInt(valid.size()));
            if (first == second) {
                second = valid.get((valid.indexOf(first) + 1) % valid.size());
            }

            final PlanePoint p1 = predicted.get(first);
            final PlanePoint p2 = predicted.get(second);
            if (p1.distance(p2) < tolerance) {
                continue;
            }

            LinearTransform transform;
            try {
                transform = Homography.fitSimilarity(Arrays.asList(p1, p2),
                                                     Arrays.asList(observed.get(first), observed.get(second)),
                                                     mirrored);
            } catch (final InsufficientSamplesException e) {
                continue;
            }

            int[] inliers = findInliers(observed, predicted, valid, transform);
            if (inliers.length < 2) {
                continue;
            }

            // local optimization: refit on the consensus set
            try {
                final LinearTransform refined = fitSimilarity(observed, predicted, inliers);
                final int[] refinedInliers = findInliers(observed, predicted, valid, refined);
                if (refinedInliers.length >= inliers.length) {
                    transform = refined;
                    inliers = refinedInliers;
                }
            } catch (final InsufficientSamplesException e) {
                LOG.debug("match: failed to refit consensus set of {} pairs", inliers.length);
            }

            if (inliers.length < MIN_CONSENSUS_SIZE) {
                continue;
            }

            final double rms = rms(observed, predicted, inliers, transform);
            final double quality = kLength * inliers.length / valid.size() +
                                   kOverlap * layout.coverage(observed, inliers) +
                                   kRegularity * layout.regularity(observed, inliers) -
                                   kRms * rms / tolerance;

            if (quality > bestQuality) {
                bestQuality = quality;
                bestInliers = inliers;
                bestTransform = transform;
                bestRms = rms;
                requiredIterations = getRequiredIterations((double) inliers.length / valid.size());
            }
        }

        if (bestInliers == null) {
            throw new InsufficientSamplesException("RANSAC: unable to find a valid set of star pair matches");
        }

        final RansacMatchResult result = new RansacMatchResult(bestInliers, bestTransform, bestQuality, bestRms,
                                                               iteration);

        LOG.debug("match: found {} inliers among {} valid pairs after {} iterations",
                  bestInliers.length, valid.size(), iteration);

        return result;
    }

    /**
     * @return number of two point trials needed to draw an all inlier sample with high confidence.
     */
    static long getRequiredIterations(final double inlierRatio) {
        final double sampleSuccess = inlierRatio * inlierRatio;
        if (sampleSuccess >= 1.0) {
            return 1;
        }
        if (sampleSuccess <= 0.0) {
            return Long.MAX_VALUE;
        }
        return (long) Math.ceil(Math.log(1.0 - CONFIDENCE) / Math.log(1.0 - sampleSuccess));
    }

    private int[] findInliers(final List<PlanePoint> observed,
                              final List<PlanePoint> predicted,
                              final List<Integer> valid,
                              final LinearTransform transform) {
        final double tolerance2 = tolerance * tolerance;
        final int[] inliers = new int[valid.size()];
        int count = 0;
        for (final Integer i : valid) {
            if (transform.apply(predicted.get(i)).distanceSquared(observed.get(i)) <= tolerance2) {
                inliers[count++] = i;
            }
        }
        return Arrays.copyOf(inliers, count);
    }

    private LinearTransform fitSimilarity(final List<PlanePoint> observed,
                                          final List<PlanePoint> predicted,
                                          final int[] inliers)
            throws InsufficientSamplesException {
        final List<PlanePoint> from = new ArrayList<>(inliers.length);
        final List<PlanePoint> to = new ArrayList<>(inliers.length);
        for (final int i : inliers) {
            from.add(predicted.get(i));
            to.add(observed.get(i));
        }
        return Homography.fitSimilarity(from, to, mirrored);
    }

    private static double rms(final List<PlanePoint> observed,
                              final List<PlanePoint> predicted,
                              final int[] inliers,
                              final LinearTransform transform) {
        double sum = 0;
        for (final int i : inliers) {
            sum += transform.apply(predicted.get(i)).distanceSquared(observed.get(i));
        }
        return Math.sqrt(sum / inliers.length);
    }

    /**
     * Spatial layout of the valid observed points used to rate consensus sets.
     */
    private static class Layout {

        private final double x0;
        private final double y0;
        private final double cellWidth;
        private final double cellHeight;
        private final double area;
        private final int occupiedCells;

        Layout(final List<PlanePoint> observed,
               final List<Integer> valid) {
            final double[] bounds = bounds(observed, valid.stream().mapToInt(Integer::intValue).toArray());
            this.x0 = bounds[0];
            this.y0 = bounds[1];
            this.area = (bounds[2] - bounds[0]) * (bounds[3] - bounds[1]);
            this.cellWidth = Math.max((bounds[2] - bounds[0]) / REGULARITY_GRID_SIZE, Double.MIN_VALUE);
            this.cellHeight = Math.max((bounds[3] - bounds[1]) / REGULARITY_GRID_SIZE, Double.MIN_VALUE);
            this.occupiedCells = occupied(observed, valid.stream().mapToInt(Integer::intValue).toArray()).length;
        }

        double coverage(final List<PlanePoint> observed,
                        final int[] inliers) {
            if (area <= 0) {
                return 1.0;
            }
            final double[] bounds = bounds(observed, inliers);
            return (bounds[2] - bounds[0]) * (bounds[3] - bounds[1]) / area;
        }

        double regularity(final List<PlanePoint> observed,
                          final int[] inliers) {
            return occupiedCells == 0 ? 1.0 : (double) occupied(observed, inliers).length / occupiedCells;
        }

        private int[] occupied(final List<PlanePoint> observed,
                               final int[] indexes) {
            final boolean[] cells = new boolean[REGULARITY_GRID_SIZE * REGULARITY_GRID_SIZE];
            for (final int i : indexes) {
                final PlanePoint p = observed.get(i);
                final int cx = Math.min(REGULARITY_GRID_SIZE - 1, Math.max(0, (int) ((p.getX() - x0) / cellWidth)));
                final int cy = Math.min(REGULARITY_GRID_SIZE - 1, Math.max(0, (int) ((p.getY() - y0) / cellHeight)));
                cells[cy * REGULARITY_GRID_SIZE + cx] = true;
            }
            int count = 0;
            final int[] result = new int[cells.length];
            for (int c = 0; c < cells.length; c++) {
                if (cells[c]) {
                    result[count++] = c;
                }
            }
            return Arrays.copyOf(result, count);
        }

        private static double[] bounds(final List<PlanePoint> points,
                                       final int[] indexes) {
            double minX = Double.MAX_VALUE, minY = Double.MAX_VALUE, maxX = -Double.MAX_VALUE, maxY = -Double.MAX_VALUE;
            for (final int i : indexes) {
                final PlanePoint p = points.get(i);
                minX = Math.min(minX, p.getX());
                minY = Math.min(minY, p.getY());
                maxX = Math.max(maxX, p.getX());
                maxY = Math.max(maxY, p.getY());
            }
            return new double[] { minX, minY, maxX, maxY };
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(RansacPointMatcher.class);
}
