package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.janelia.astrometry.catalog.CatalogLookup;
import org.janelia.astrometry.catalog.CatalogQueryResult;
import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.ImageRegion;
import org.janelia.astrometry.geom.PixelConvention;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.AlignmentResult;
import org.janelia.astrometry.service.AlignmentStrategy;
import org.janelia.astrometry.service.DetectedStar;
import org.janelia.astrometry.service.ReferenceTemplate;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.StarAlignmentService;
import org.janelia.astrometry.service.StarDetectionService;
import org.janelia.astrometry.service.TemplateStar;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.NoninvertibleTransformException;

/**
 * Synthetic star field with a known gnomonic solution for solver tests.
 *
 * The alignment service recognizes template stars by their flux (derived from the catalog magnitude)
 * and pairs them with the detected positions of the same stars.
 */
class SyntheticSky {

    static final int WIDTH = 2000;
    static final int HEIGHT = 1500;
    static final CelestialPoint CENTER = new CelestialPoint(150.0, 30.0);
    static final double RESOLUTION = 2.0 / 3600.0;
    static final double ROTATION_DEGREES = 10.0;
    static final double BOX_SIZE = 6.0;

    private final GeometricSolution truth;
    private final List<CatalogStar> catalogStars;
    private final List<DetectedStar> detectedStars;
    private final Map<Double, Integer> fluxToStarIndex;

    SyntheticSky(final int numberOfStars,
                 final double detectionNoise,
                 final long seed)
            throws NoninvertibleTransformException {

        this.truth = buildTruth();
        this.catalogStars = new ArrayList<>(numberOfStars);
        this.detectedStars = new ArrayList<>(numberOfStars);
        this.fluxToStarIndex = new HashMap<>();

        final Random random = new Random(seed);
        for (int i = 0; i < numberOfStars; i++) {
            final PlanePoint imagePoint = new PlanePoint(20.0 + random.nextDouble() * (WIDTH - 40.0),
                                                         20.0 + random.nextDouble() * (HEIGHT - 40.0));
            final CelestialPoint sky = truth.imageToSky(imagePoint);
            final double magnitude = 8.0 + i * 0.01;
            catalogStars.add(new CatalogStar(sky.getRa(), sky.getDec(), magnitude));
            detectedStars.add(new DetectedStar(imagePoint.getX() + random.nextGaussian() * detectionNoise,
                                               imagePoint.getY() + random.nextGaussian() * detectionNoise,
                                               BOX_SIZE,
                                               BOX_SIZE,
                                               1000.0 - i));
            fluxToStarIndex.put(TemplateAligner.getFlux(magnitude), i);
        }
    }

    static GeometricSolution buildTruth()
            throws NoninvertibleTransformException {
        final double cos = Math.cos(Math.toRadians(ROTATION_DEGREES)) * RESOLUTION;
        final double sin = Math.sin(Math.toRadians(ROTATION_DEGREES)) * RESOLUTION;
        final double cx = WIDTH / 2.0;
        final double cy = HEIGHT / 2.0;
        final LinearTransform imageToNative = new LinearTransform(-cos, -sin, cos * cx + sin * cy,
                                                                  -sin, cos, sin * cx - cos * cy);
        final Projection projection = ProjectionType.GNOMONIC.build(CENTER);
        return new GeometricSolution.Builder()
                .projection(projection)
                .size(WIDTH, HEIGHT)
                .linear(imageToNative, imageToNative.inverse())
                .center(CENTER)
                .resolution(RESOLUTION)
                .build();
    }

    GeometricSolution getTruth() {
        return truth;
    }

    List<CatalogStar> getCatalogStars() {
        return catalogStars;
    }

    List<DetectedStar> getDetectedStars() {
        return detectedStars;
    }

    SourceImage getImage() {
        return new SourceImage("synthetic", WIDTH, HEIGHT);
    }

    StarDetectionService getDetectionService() {
        return image -> detectedStars;
    }

    CatalogLookup getCatalogLookup() {
        return new CatalogLookup() {
            @Override
            public String getCatalogId() {
                return "synthetic";
            }

            @Override
            public CatalogQueryResult load(final CelestialPoint center,
                                           final double fovDegrees,
                                           final double limitMagnitude) {
                final List<CatalogStar> selected = new ArrayList<>();
                for (final CatalogStar star : catalogStars) {
                    if ((star.getMagnitude() <= limitMagnitude) &&
                        (center.angularDistance(star.getPosition()) <= fovDegrees / 2.0)) {
                        selected.add(star);
                    }
                }
                selected.sort(CatalogStar.BRIGHTEST_FIRST);
                return new CatalogQueryResult(selected, false);
            }
        };
    }

    /**
     * @param  failingRegionPoint  alignments of regions containing this image point fail (null for none).
     */
    RecordingAlignmentService getAlignmentService(final PlanePoint failingRegionPoint) {
        return new RecordingAlignmentService(failingRegionPoint);
    }

    /**
     * @return RMS distance (pixels) between the truth and the solution's image positions
     *         of celestial points on a grid covering the image.
     */
    double getGridRmsError(final GeometricSolution solution) {
        double sum = 0;
        int count = 0;
        for (int y = 0; y <= HEIGHT; y += HEIGHT / 10) {
            for (int x = 0; x <= WIDTH; x += WIDTH / 10) {
                final PlanePoint imagePoint = new PlanePoint(x, y);
                final PlanePoint solved = solution.skyToImage(truth.imageToSky(imagePoint));
                sum += solved.distanceSquared(imagePoint);
                count++;
            }
        }
        return Math.sqrt(sum / count);
    }

    class RecordingAlignmentService
            implements StarAlignmentService {

        private final PlanePoint failingRegionPoint;
        private final List<AlignmentStrategy> strategies;
        private boolean alwaysFail;

        RecordingAlignmentService(final PlanePoint failingRegionPoint) {
            this.failingRegionPoint = failingRegionPoint;
            this.strategies = new ArrayList<>();
            this.alwaysFail = false;
        }

        void setAlwaysFail(final boolean alwaysFail) {
            this.alwaysFail = alwaysFail;
        }

        List<AlignmentStrategy> getStrategies() {
            return Collections.unmodifiableList(strategies);
        }

        @Override
        public AlignmentResult align(final SourceImage image,
                                     final ReferenceTemplate template,
                                     final ImageRegion region,
                                     final AlignmentStrategy strategy)
                throws AlignmentFailedException {

            strategies.add(strategy);

            if (alwaysFail || ((region != null) && region.contains(failingRegionPoint))) {
                throw new AlignmentFailedException("no consistent star pattern found");
            }

            final List<PlanePoint> templatePoints = new ArrayList<>();
            final List<PlanePoint> imagePoints = new ArrayList<>();
            for (final TemplateStar templateStar : template.getStars()) {
                final Integer index = fluxToStarIndex.get(templateStar.getFlux());
                if (index != null) {
                    final PlanePoint imagePoint = detectedStars.get(index).getPosition();
                    if ((region == null) || region.contains(imagePoint)) {
                        templatePoints.add(templateStar.getPosition());
                        imagePoints.add(PixelConvention.CENTER_ORIGIN.fromCornerOrigin(imagePoint));
                    }
                }
            }

            if (templatePoints.size() < 4) {
                throw new AlignmentFailedException("too few star pairs");
            }

            return new AlignmentResult(templatePoints, imagePoints, PixelConvention.CENTER_ORIGIN);
        }
    }
}
