package org.janelia.astrometry.align;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.geom.ImageRegion;
import org.janelia.astrometry.geom.PixelConvention;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.RansacMatchResult;
import org.janelia.astrometry.match.RansacPointMatcher;
import org.janelia.astrometry.match.StarQuadTree;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.AlignmentResult;
import org.janelia.astrometry.service.AlignmentStrategy;
import org.janelia.astrometry.service.DetectedStar;
import org.janelia.astrometry.service.ReferenceTemplate;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.StarAlignmentService;
import org.janelia.astrometry.service.StarDetectionService;
import org.janelia.astrometry.service.TemplateStar;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.InsufficientSamplesException;
import org.janelia.astrometry.transform.LinearTransform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns image stars with template stars by matching triangles built from the brightest stars of each field.
 *
 * <ol>
 *   <li>Triangles are formed from every bright star and pairs of its nearest neighbors.</li>
 *   <li>Triangles with similar side ratios vote for the correspondence of their vertexes.</li>
 *   <li>Mutually best voted star pairs are filtered with RANSAC to find a similarity transform.</li>
 *   <li>All template stars are mapped into the image and paired with the nearest image star.</li>
 * </ol>
 *
 * The {@link AlignmentStrategy#POLYGON} strategy only matches triangles with the same orientation,
 * {@link AlignmentStrategy#TRIANGLE_SIMILARITY} also accepts mirrored fields.
 */
public class TriangleDescriptorAligner
        implements StarAlignmentService {

    public static final int DEFAULT_BRIGHTEST_STARS = 50;
    public static final int DEFAULT_NEIGHBORS = 8;
    public static final double DEFAULT_RATIO_TOLERANCE = 0.02;
    public static final double DEFAULT_MATCH_TOLERANCE = 3.0;

    /** Minimum number of pairs in a valid alignment. */
    public static final int MIN_ALIGNED_PAIRS = 4;

    private static final int MIN_VOTES = 2;
    private static final boolean[] DIRECT_ONLY = { false };
    private static final boolean[] BOTH = { false, true };

    private final StarDetectionService detectionService;
    private final int brightestStars;
    private final int neighbors;
    private final double ratioTolerance;
    private final double matchTolerance;
    private final long randomSeed;

    public TriangleDescriptorAligner(final StarDetectionService detectionService) {
        this(detectionService, DEFAULT_BRIGHTEST_STARS, DEFAULT_NEIGHBORS, DEFAULT_RATIO_TOLERANCE,
             DEFAULT_MATCH_TOLERANCE, 0L);
    }

    /**
     * @param  detectionService  source of image stars (corner origin coordinates).
     * @param  brightestStars    number of brightest stars used to build triangles.
     * @param  neighbors         number of nearest neighbors combined with each star.
     * @param  ratioTolerance    maximum side ratio difference of matching triangles.
     * @param  matchTolerance    maximum distance (in pixels) between paired stars.
     * @param  randomSeed        seed for RANSAC sampling.
     */
    public TriangleDescriptorAligner(final StarDetectionService detectionService,
                                     final int brightestStars,
                                     final int neighbors,
                                     final double ratioTolerance,
                                     final double matchTolerance,
                                     final long randomSeed)
            throws IllegalArgumentException {
        if (brightestStars < 3) {
            throw new IllegalArgumentException("at least 3 bright stars are needed to build triangles");
        }
        if (neighbors < 2) {
            throw new IllegalArgumentException("at least 2 neighbors are needed to build triangles");
        }
        this.detectionService = detectionService;
        this.brightestStars = brightestStars;
        this.neighbors = neighbors;
        this.ratioTolerance = ratioTolerance;
        this.matchTolerance = matchTolerance;
        this.randomSeed = randomSeed;
    }

    @Override
    public AlignmentResult align(final SourceImage image,
                                 final ReferenceTemplate template,
                                 final ImageRegion region,
                                 final AlignmentStrategy strategy)
            throws AlignmentFailedException {

        final List<PlanePoint> imagePoints = getImagePoints(image, region);
        final List<PlanePoint> templatePoints = getTemplatePoints(template);

        LOG.debug("align: entry, {} image stars in region {}, template {}, strategy {}",
                  imagePoints.size(), region, template, strategy);

        if ((imagePoints.size() < MIN_ALIGNED_PAIRS) || (templatePoints.size() < MIN_ALIGNED_PAIRS)) {
            throw new AlignmentFailedException("too few stars to align " + image.getName() + " (" +
                                               imagePoints.size() + " image stars, " + templatePoints.size() +
                                               " template stars)");
        }

        final List<PlanePoint> brightImagePoints = limit(imagePoints);
        final List<PlanePoint> brightTemplatePoints = limit(templatePoints);

        final int[][] votes = vote(brightTemplatePoints, brightImagePoints, strategy == AlignmentStrategy.POLYGON);

        final List<PlanePoint> candidateTemplatePoints = new ArrayList<>();
        final List<PlanePoint> candidateImagePoints = new ArrayList<>();
        for (int t = 0; t < votes.length; t++) {
            final int i = findBestVote(votes, t);
            if (i >= 0) {
                candidateTemplatePoints.add(brightTemplatePoints.get(t));
                candidateImagePoints.add(brightImagePoints.get(i));
            }
        }

        LOG.debug("align: found {} candidate pairs", candidateTemplatePoints.size());

        RansacMatchResult best = null;
        boolean mirrored = false;
        InsufficientSamplesException failure = null;
        for (final boolean tryMirrored : strategy == AlignmentStrategy.TRIANGLE_SIMILARITY ? BOTH : DIRECT_ONLY) {
            try {
                final RansacMatchResult result = consensus(candidateImagePoints, candidateTemplatePoints, tryMirrored);
                if ((best == null) || (result.getQuality() > best.getQuality())) {
                    best = result;
                    mirrored = tryMirrored;
                }
            } catch (final InsufficientSamplesException e) {
                LOG.debug("align: no consensus found (mirrored {})", tryMirrored);
                failure = e;
            }
        }

        if (best == null) {
            throw new AlignmentFailedException("no consistent triangle matches found for " + image.getName() +
                                               " (" + candidateTemplatePoints.size() + " candidate pairs)",
                                               new ArrayList<>(),
                                               failure);
        }

        LinearTransform templateToImage = best.getTransform();

        final StarQuadTree imageTree = new StarQuadTree(imagePoints);
        List<int[]> pairs = densify(templatePoints, imageTree, templateToImage);
        if (pairs.size() >= MIN_ALIGNED_PAIRS) {
            try {
                templateToImage = Homography.fitSimilarity(select(templatePoints, pairs, true),
                                                           select(imagePoints, pairs, false),
                                                           mirrored);
                pairs = densify(templatePoints, imageTree, templateToImage);
            } catch (final InsufficientSamplesException e) {
                LOG.debug("align: failed to refit densified pairs, keeping consensus transform");
            }
        }

        if (pairs.size() < MIN_ALIGNED_PAIRS) {
            throw new AlignmentFailedException("only " + pairs.size() + " star pairs could be aligned for " +
                                               image.getName() + ", at least " + MIN_ALIGNED_PAIRS +
                                               " are required");
        }

        final AlignmentResult result = new AlignmentResult(select(templatePoints, pairs, true),
                                                           select(imagePoints, pairs, false),
                                                           PixelConvention.CORNER_ORIGIN);

        LOG.debug("align: exit, aligned {} pairs (mirrored {})", result.size(), mirrored);

        return result;
    }

    private List<PlanePoint> getImagePoints(final SourceImage image,
                                            final ImageRegion region)
            throws AlignmentFailedException {
        final List<DetectedStar> detected;
        try {
            detected = new ArrayList<>(detectionService.detect(image));
        } catch (final AlignmentFailedException e) {
            throw e;
        } catch (final AstrometryException e) {
            throw new AlignmentFailedException("failed to detect stars in " + image.getName(), new ArrayList<>(), e);
        }
        detected.sort(Comparator.comparingDouble(DetectedStar::getFlux).reversed());
        final List<PlanePoint> points = new ArrayList<>(detected.size());
        for (final DetectedStar star : detected) {
            final PlanePoint position = star.getPosition();
            if ((region == null) || region.contains(position)) {
                points.add(position);
            }
        }
        return points;
    }

    private static List<PlanePoint> getTemplatePoints(final ReferenceTemplate template) {
        final List<TemplateStar> stars = new ArrayList<>(template.getStars());
        stars.sort(Comparator.comparingDouble(TemplateStar::getFlux).reversed());
        final List<PlanePoint> points = new ArrayList<>(stars.size());
        for (final TemplateStar star : stars) {
            points.add(star.getPosition());
        }
        return points;
    }

    private List<PlanePoint> limit(final List<PlanePoint> brightestFirst) {
        return brightestFirst.subList(0, Math.min(brightestStars, brightestFirst.size()));
    }

    /**
     * @return votes[t][i] counting how often template star t and image star i are corresponding
     *         vertexes of matching triangles.
     */
    private int[][] vote(final List<PlanePoint> templatePoints,
                         final List<PlanePoint> imagePoints,
                         final boolean oriented) {

        final List<StarTriangle> templateTriangles = StarTriangle.buildAll(templatePoints, neighbors, matchTolerance);
        final List<StarTriangle> imageTriangles = StarTriangle.buildAll(imagePoints, neighbors, matchTolerance);
        imageTriangles.sort(StarTriangle.BY_FIRST_RATIO);

        final double[] imageRatios = new double[imageTriangles.size()];
        for (int i = 0; i < imageRatios.length; i++) {
            imageRatios[i] = imageTriangles.get(i).getRatio1();
        }

        final int[][] votes = new int[templatePoints.size()][imagePoints.size()];
        int matchingTriangles = 0;
        for (final StarTriangle templateTriangle : templateTriangles) {
            int i = lowerBound(imageRatios, templateTriangle.getRatio1() - ratioTolerance);
            for (; (i < imageRatios.length) && (imageRatios[i] <= templateTriangle.getRatio1() + ratioTolerance); i++) {
                final StarTriangle imageTriangle = imageTriangles.get(i);
                if ((Math.abs(imageTriangle.getRatio2() - templateTriangle.getRatio2()) > ratioTolerance) ||
                    (oriented && (imageTriangle.isCounterClockwise() != templateTriangle.isCounterClockwise()))) {
                    continue;
                }
                for (int v = 0; v < 3; v++) {
                    votes[templateTriangle.getVertex(v)][imageTriangle.getVertex(v)]++;
                }
                matchingTriangles++;
            }
        }

        LOG.debug("vote: {} template and {} image triangles, {} matches",
                  templateTriangles.size(), imageTriangles.size(), matchingTriangles);

        return votes;
    }

    /**
     * @return image star with the most votes for template star t if t is also that image star's
     *         best voted template star, otherwise -1.
     */
    private static int findBestVote(final int[][] votes,
                                    final int t) {
        int best = -1;
        int bestVotes = MIN_VOTES - 1;
        for (int i = 0; i < votes[t].length; i++) {
            if (votes[t][i] > bestVotes) {
                best = i;
                bestVotes = votes[t][i];
            }
        }
        if (best >= 0) {
            for (int other = 0; other < votes.length; other++) {
                if ((other != t) && (votes[other][best] >= bestVotes)) {
                    return -1;
                }
            }
        }
        return best;
    }

    private RansacMatchResult consensus(final List<PlanePoint> imagePoints,
                                        final List<PlanePoint> templatePoints,
                                        final boolean mirrored)
            throws InsufficientSamplesException {
        final RansacPointMatcher matcher = new RansacPointMatcher(matchTolerance,
                                                                  RansacPointMatcher.DEFAULT_MAX_ITERATIONS,
                                                                  1, 1, 1, 0,
                                                                  mirrored,
                                                                  new Random(randomSeed));
        return matcher.match(imagePoints, templatePoints);
    }

    /**
     * @return (templateIndex, imageIndex) pairs where each image star is used at most once.
     */
    private List<int[]> densify(final List<PlanePoint> templatePoints,
                                  final StarQuadTree imageTree,
                                  final LinearTransform templateToImage) {

        final int[] templateForImage = new int[imageTree.size()];
        final double[] distanceForImage = new double[imageTree.size()];
        Arrays.fill(templateForImage, -1);

        for (int t = 0; t < templatePoints.size(); t++) {
            final PlanePoint predicted = templateToImage.apply(templatePoints.get(t));
            final int i = imageTree.findNearest(predicted, matchTolerance);
            if (i >= 0) {
                final double distance = imageTree.get(i).distance(predicted);
                if ((distance <= matchTolerance) &&
                    ((templateForImage[i] < 0) || (distance < distanceForImage[i]))) {
                    templateForImage[i] = t;
                    distanceForImage[i] = distance;
                }
            }
        }

        final List<int[]> pairs = new ArrayList<>();
        for (int i = 0; i < templateForImage.length; i++) {
            if (templateForImage[i] >= 0) {
                pairs.add(new int[] { templateForImage[i], i });
            }
        }
        return pairs;
    }

    private static List<PlanePoint> select(final List<PlanePoint> points,
                                           final List<int[]> pairs,
                                           final boolean templateSide) {
        final int side = templateSide ? 0 : 1;
        final List<PlanePoint> selected = new ArrayList<>(pairs.size());
        for (final int[] pair : pairs) {
            selected.add(points.get(pair[side]));
        }
        return selected;
    }

    private static int lowerBound(final double[] sorted,
                                  final double value) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (sorted[mid] < value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TriangleDescriptorAligner.class);
}
