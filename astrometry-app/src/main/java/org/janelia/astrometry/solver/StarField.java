package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.StarQuadTree;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.DetectedStar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Detected image stars indexed for matching, together with the matching tolerance derived from them.
 */
public class StarField {

    /** Sources closer than this (pixels) to another source are considered conflicting and dropped. */
    public static final double CONFLICT_DISTANCE = 1.0;

    /** Detection boxes are inflated by the detector, so this much is removed before deriving the tolerance. */
    public static final double DETECTION_BOX_INFLATION = 2.0;

    public static final double MIN_TOLERANCE = 2.0;

    private final List<DetectedStar> stars;
    private final StarQuadTree tree;
    private final double tolerance;

    private StarField(final List<DetectedStar> stars,
                      final StarQuadTree tree,
                      final double tolerance) {
        this.stars = stars;
        this.tree = tree;
        this.tolerance = tolerance;
    }

    /**
     * Drops conflicting sources and indexes the remaining ones.
     *
     * @param  detectedStars  detected (and optionally PSF fitted) stars.
     * @param  minimumStars   minimum number of usable stars.
     *
     * @throws AlignmentFailedException
     *   if fewer than minimumStars usable stars remain.
     */
    public static StarField build(final List<DetectedStar> detectedStars,
                                  final int minimumStars)
            throws AlignmentFailedException {

        if (detectedStars.size() < minimumStars) {
            throw new AlignmentFailedException("insufficient stars detected: found " + detectedStars.size() +
                                               ", at least " + minimumStars + " are required");
        }

        final List<PlanePoint> allPositions = new ArrayList<>(detectedStars.size());
        for (final DetectedStar star : detectedStars) {
            allPositions.add(star.getPosition());
        }
        final StarQuadTree allTree = new StarQuadTree(allPositions);

        final List<DetectedStar> kept = new ArrayList<>(detectedStars.size());
        final List<PlanePoint> keptPositions = new ArrayList<>(detectedStars.size());
        for (final DetectedStar star : detectedStars) {
            final List<Integer> neighbors = allTree.search(star.getX() - CONFLICT_DISTANCE,
                                                           star.getY() - CONFLICT_DISTANCE,
                                                           star.getX() + CONFLICT_DISTANCE,
                                                           star.getY() + CONFLICT_DISTANCE);
            if (neighbors.size() == 1) {
                kept.add(star);
                keptPositions.add(star.getPosition());
            }
        }

        if (kept.size() < minimumStars) {
            throw new AlignmentFailedException("insufficient number of objects: found " + kept.size() +
                                               ", at least " + minimumStars + " are required");
        }

        double minimumSide = Double.MAX_VALUE;
        for (final DetectedStar star : kept) {
            minimumSide = Math.min(minimumSide, star.getMinimumBoxSide());
        }
        final double tolerance = Math.max(MIN_TOLERANCE, minimumSide - DETECTION_BOX_INFLATION);

        LOG.info("build: removed {} conflicting sources, indexed {} stars, matching tolerance is {} px",
                 detectedStars.size() - kept.size(), kept.size(), tolerance);

        return new StarField(Collections.unmodifiableList(kept), new StarQuadTree(keptPositions), tolerance);
    }

    public List<DetectedStar> getStars() {
        return stars;
    }

    public int size() {
        return stars.size();
    }

    public StarQuadTree getTree() {
        return tree;
    }

    /**
     * @return RANSAC tolerance (pixels) for star matching.
     */
    public double getTolerance() {
        return tolerance;
    }

    /**
     * @return half size (pixels) of the box searched around predicted star positions.
     */
    public double getSearchRadius() {
        return tolerance;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StarField.class);
}
