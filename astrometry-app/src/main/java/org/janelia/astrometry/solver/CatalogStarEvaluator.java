package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.astrometry.catalog.CatalogException;
import org.janelia.astrometry.catalog.CatalogLookup;
import org.janelia.astrometry.catalog.CatalogQueryResult;
import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.CorrespondenceSet;
import org.janelia.astrometry.match.MatchScore;
import org.janelia.astrometry.match.StarMatcher;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.transform.InsufficientSamplesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a solution by predicting where catalog stars fall in the image
 * and matching those predictions with the detected stars.
 */
public class CatalogStarEvaluator
        implements SolutionEvaluator {

    private final SolverParameters parameters;
    private final CatalogLookup catalogLookup;
    private final StarField starField;
    private final double limitMagnitude;
    private final List<String> warnings;
    private boolean reportedTruncation;

    /**
     * @param  parameters      solver settings.
     * @param  catalogLookup   source of reference stars.
     * @param  starField       detected image stars.
     * @param  limitMagnitude  faintest catalog magnitude to use.
     * @param  warnings        list that non fatal problems are reported to.
     */
    public CatalogStarEvaluator(final SolverParameters parameters,
                                final CatalogLookup catalogLookup,
                                final StarField starField,
                                final double limitMagnitude,
                                final List<String> warnings) {
        this.parameters = parameters;
        this.catalogLookup = catalogLookup;
        this.starField = starField;
        this.limitMagnitude = limitMagnitude;
        this.warnings = warnings;
        this.reportedTruncation = false;
    }

    /**
     * @param  center      image center.
     * @param  resolution  image scale (degrees per pixel).
     * @param  width       image width.
     * @param  height      image height.
     *
     * @return catalog stars covering the image, brightest first.
     *
     * @throws CatalogException
     *   if the catalog cannot be read or holds too few stars for the field.
     */
    public List<CatalogStar> loadCatalogStars(final CelestialPoint center,
                                              final double resolution,
                                              final int width,
                                              final int height)
            throws CatalogException {

        final double fov = getSearchDiameter(resolution, width, height);
        final CatalogQueryResult result = catalogLookup.load(center, fov, limitMagnitude);

        if (result.size() < parameters.minCatalogStars) {
            throw new CatalogException("insufficient stars found in catalog " + catalogLookup.getCatalogId() +
                                       ": found " + result.size() + ", at least " + parameters.minCatalogStars +
                                       " are required");
        }

        List<CatalogStar> stars = result.getStars();
        if ((result.isTruncated() || (stars.size() > parameters.maxStarsInSolution)) && (! reportedTruncation)) {
            reportedTruncation = true;
            final String warning = "catalog query exceeded the maximum number of stars, " +
                                   "only the brightest stars are used";
            warnings.add(warning);
            LOG.warn("loadCatalogStars: {}", warning);
        }
        if (stars.size() > parameters.maxStarsInSolution) {
            stars = stars.subList(0, parameters.maxStarsInSolution);
        }
        return stars;
    }

    @Override
    public StarEvaluation evaluate(final GeometricSolution solution)
            throws CatalogException, InsufficientSamplesException {

        final List<CatalogStar> catalogStars = loadCatalogStars(solution.getCenter(),
                                                                solution.getResolution(),
                                                                solution.getWidth(),
                                                                solution.getHeight());

        final Projection projection = parameters.buildProjection(solution.getCenter());
        final double width = solution.getWidth();
        final double height = solution.getHeight();

        final List<CatalogStar> predictedStars = new ArrayList<>();
        final List<PlanePoint> nativePoints = new ArrayList<>();
        final List<PlanePoint> predicted = new ArrayList<>();
        for (final CatalogStar star : catalogStars) {
            final PlanePoint p = solution.skyToImage(star.getPosition());
            if ((p != null) && (p.getX() >= 0) && (p.getY() >= 0) && (p.getX() <= width) && (p.getY() <= height)) {
                final PlanePoint nativePoint = projection.direct(star.getPosition());
                if (nativePoint != null) {
                    predictedStars.add(star);
                    nativePoints.add(nativePoint);
                    predicted.add(p);
                }
            }
        }

        final StarMatcher matcher = new StarMatcher(starField.getTree(),
                                                    starField.getSearchRadius(),
                                                    starField.getTolerance(),
                                                    parameters.randomSeed);
        CorrespondenceSet correspondences = matcher.match(predicted);

        // control points with identical coordinates make the spline systems singular
        final Set<Integer> duplicates = new TreeSet<>(CorrespondenceSet.findDuplicates(correspondences.getObserved()));
        correspondences = correspondences.withRejected(duplicates);
        final List<PlanePoint> keptNativePoints = new ArrayList<>(nativePoints);
        for (final Integer i : duplicates) {
            keptNativePoints.set(i, null);
        }
        final Set<Integer> nativeDuplicates = CorrespondenceSet.findDuplicates(keptNativePoints);
        correspondences = correspondences.withRejected(nativeDuplicates);
        for (final Integer i : nativeDuplicates) {
            keptNativePoints.set(i, null);
        }

        final MatchScore score = correspondences.getScore();

        LOG.info("evaluate: matching errors: median = {} px, sigma = {} px, peak = {} px, " +
                 "matched {} stars ({} rejected), score {}",
                 format(score.getMedianError()), format(score.getSigmaError()), format(score.getPeakError()),
                 score.getNumValid(), score.getNumRejected(), score.getScore());

        return new StarEvaluation(projection, predictedStars, keptNativePoints, correspondences, score);
    }

    /**
     * @return diameter (degrees) of the catalog region that covers the whole image.
     */
    public static double getSearchDiameter(final double resolution,
                                           final int width,
                                           final int height) {
        return resolution * Math.hypot(width, height);
    }

    private static String format(final double value) {
        return String.format("%.2f", value);
    }

    private static final Logger LOG = LoggerFactory.getLogger(CatalogStarEvaluator.class);
}
