package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.transform.InsufficientSamplesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Pairs predicted catalog star positions with detected image stars.
 *
 * Every predicted position is paired with the nearest detected star inside the search box around it.
 * The tentative pairs are then filtered by a {@link RansacPointMatcher} so that only pairs consistent
 * with a common similarity transform survive.
 */
public class StarMatcher {

    private final StarQuadTree detectedStars;
    private final double searchRadius;
    private final double tolerance;
    private final long randomSeed;

    /**
     * @param  detectedStars  spatial index of detected star positions (corner origin pixels).
     * @param  searchRadius   half size of the box searched around each predicted position.
     * @param  tolerance      RANSAC inlier tolerance.
     * @param  randomSeed     seed for the RANSAC sampler (each match call starts from the same seed).
     */
    public StarMatcher(final StarQuadTree detectedStars,
                       final double searchRadius,
                       final double tolerance,
                       final long randomSeed) {
        this.detectedStars = detectedStars;
        this.searchRadius = searchRadius;
        this.tolerance = tolerance;
        this.randomSeed = randomSeed;
    }

    public double getSearchRadius() {
        return searchRadius;
    }

    public double getTolerance() {
        return tolerance;
    }

    /**
     * @param  predicted  predicted image positions (null entries are never matched).
     *
     * @return index aligned observed positions for the predicted positions.
     *
     * @throws InsufficientSamplesException
     *   if no consistent set of star pairs can be found.
     */
    public CorrespondenceSet match(final List<PlanePoint> predicted)
            throws InsufficientSamplesException {

        final List<PlanePoint> nearest = new ArrayList<>(predicted.size());
        for (final PlanePoint p : predicted) {
            PlanePoint found = null;
            if (p != null) {
                final int index = detectedStars.findNearest(p, searchRadius);
                if (index >= 0) {
                    found = detectedStars.get(index);
                }
            }
            nearest.add(found);
        }

        final RansacPointMatcher ransac = new RansacPointMatcher(tolerance,
                                                                 RansacPointMatcher.DEFAULT_MAX_ITERATIONS,
                                                                 1, 1, 1, 0,
                                                                 false,
                                                                 new Random(randomSeed));
        final RansacMatchResult result;
        try {
            result = ransac.match(nearest, predicted);
        } catch (final InsufficientSamplesException e) {
            throw new InsufficientSamplesException("unable to find a valid set of star pair matches", e);
        }

        final PlanePoint[] accepted = new PlanePoint[predicted.size()];
        for (final int i : result.getInlierIndexes()) {
            accepted[i] = nearest.get(i);
        }

        LOG.debug("match: accepted {} of {} predicted positions, ransac result is {}",
                  result.getNumberOfInliers(), predicted.size(), result);

        return new CorrespondenceSet(Arrays.asList(accepted), predicted);
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarMatcher.class);
}
