package org.janelia.astrometry.align;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.ImageRegion;
import org.janelia.astrometry.geom.PixelConvention;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.AlignmentResult;
import org.janelia.astrometry.service.AlignmentStrategy;
import org.janelia.astrometry.service.DetectedStar;
import org.janelia.astrometry.service.ReferenceTemplate;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.TemplateStar;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link TriangleDescriptorAligner} class.
 */
public class TriangleDescriptorAlignerTest {

    private static final int WIDTH = 1200;
    private static final int HEIGHT = 900;

    private static final SourceImage IMAGE = new SourceImage("field.fits", WIDTH, HEIGHT);

    @Test
    public void testAlignRotatedField() throws Exception {

        final List<DetectedStar> imageStars = buildField(80, 11L);
        final ReferenceTemplate template = buildTemplate(imageStars, false, null);

        final TriangleDescriptorAligner aligner = new TriangleDescriptorAligner(image -> imageStars);
        final AlignmentResult result = aligner.align(IMAGE, template, null, AlignmentStrategy.POLYGON);

        Assert.assertEquals("invalid image convention", PixelConvention.CORNER_ORIGIN, result.getImageConvention());
        Assert.assertEquals("all stars should be aligned", imageStars.size(), result.size());
        validatePairs(result, false);
    }

    @Test
    public void testAlignMirroredField() throws Exception {

        final List<DetectedStar> imageStars = buildField(80, 23L);
        final ReferenceTemplate template = buildTemplate(imageStars, true, null);

        final TriangleDescriptorAligner aligner = new TriangleDescriptorAligner(image -> imageStars);
        final AlignmentResult result = aligner.align(IMAGE, template, null, AlignmentStrategy.TRIANGLE_SIMILARITY);

        Assert.assertEquals("all stars should be aligned", imageStars.size(), result.size());
        validatePairs(result, true);
    }

    @Test
    public void testAlignRegion() throws Exception {

        final List<DetectedStar> imageStars = buildField(120, 37L);
        final ImageRegion region = new ImageRegion(0, 0, WIDTH / 2.0, HEIGHT);
        final ReferenceTemplate template = buildTemplate(imageStars, false, region);

        final TriangleDescriptorAligner aligner = new TriangleDescriptorAligner(image -> imageStars);
        final AlignmentResult result = aligner.align(IMAGE, template, region, AlignmentStrategy.POLYGON);

        Assert.assertEquals("all region stars should be aligned", template.size(), result.size());
        for (final PlanePoint imagePoint : result.getImagePoints()) {
            Assert.assertTrue(imagePoint + " is outside " + region, region.contains(imagePoint));
        }
        validatePairs(result, false);
    }

    @Test
    public void testTooFewStars() {

        final List<DetectedStar> imageStars = buildField(3, 41L);
        final ReferenceTemplate template = buildTemplate(buildField(60, 43L), false, null);

        final TriangleDescriptorAligner aligner = new TriangleDescriptorAligner(image -> imageStars);
        try {
            aligner.align(IMAGE, template, null, AlignmentStrategy.POLYGON);
            Assert.fail("alignment of 3 stars should fail");
        } catch (final AlignmentFailedException e) {
            Assert.assertTrue("invalid message: " + e.getMessage(), e.getMessage().contains("too few stars"));
        }
    }

    @Test
    public void testDetectionFailureIsWrapped() {

        final TriangleDescriptorAligner aligner = new TriangleDescriptorAligner(image -> {
            throw new AlignmentFailedException("sensor saturated");
        });
        final ReferenceTemplate template = buildTemplate(buildField(60, 47L), false, null);
        try {
            aligner.align(IMAGE, template, null, AlignmentStrategy.POLYGON);
            Assert.fail("detection failure should be propagated");
        } catch (final AlignmentFailedException e) {
            Assert.assertEquals("invalid message", "sensor saturated", e.getMessage());
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBrightestStars() {
        new TriangleDescriptorAligner(image -> new ArrayList<>(), 2, 8, 0.02, 3.0, 0L);
    }

    private static void validatePairs(final AlignmentResult result,
                                      final boolean mirrored) {
        final List<PlanePoint> templatePoints = result.getTemplatePoints();
        final List<PlanePoint> imagePoints = result.getImagePoints();
        for (int i = 0; i < result.size(); i++) {
            final PlanePoint expected = toTemplate(imagePoints.get(i), mirrored);
            Assert.assertEquals("pair " + i + " is not a true correspondence",
                                0.0, expected.distance(templatePoints.get(i)), 1e-9);
        }
    }

    /**
     * @return stars at least 20 pixels apart with distinct fluxes (brightest first).
     */
    private static List<DetectedStar> buildField(final int numberOfStars,
                                                 final long seed) {
        final Random random = new Random(seed);
        final List<PlanePoint> points = new ArrayList<>();
        while (points.size() < numberOfStars) {
            final PlanePoint candidate = new PlanePoint(20 + random.nextDouble() * (WIDTH - 40),
                                                        20 + random.nextDouble() * (HEIGHT - 40));
            boolean isolated = true;
            for (final PlanePoint point : points) {
                if (point.distance(candidate) < 20) {
                    isolated = false;
                    break;
                }
            }
            if (isolated) {
                points.add(candidate);
            }
        }
        final List<DetectedStar> stars = new ArrayList<>(numberOfStars);
        for (int i = 0; i < points.size(); i++) {
            stars.add(new DetectedStar(points.get(i).getX(), points.get(i).getY(), 6, 6, 1000.0 - i));
        }
        return stars;
    }

    private static ReferenceTemplate buildTemplate(final List<DetectedStar> imageStars,
                                                   final boolean mirrored,
                                                   final ImageRegion region) {
        final List<TemplateStar> templateStars = new ArrayList<>();
        for (final DetectedStar star : imageStars) {
            if ((region == null) || region.contains(star.getPosition())) {
                final PlanePoint position = toTemplate(star.getPosition(), mirrored);
                templateStars.add(new TemplateStar(position.getX(), position.getY(), star.getFlux()));
            }
        }
        return new ReferenceTemplate(WIDTH, HEIGHT, templateStars, null);
    }

    private static PlanePoint toTemplate(final PlanePoint imagePoint,
                                         final boolean mirrored) {
        final double angle = Math.toRadians(30.0);
        final double scale = 0.8;
        final double x = mirrored ? WIDTH - imagePoint.getX() : imagePoint.getX();
        final double y = imagePoint.getY();
        return new PlanePoint(scale * (Math.cos(angle) * x - Math.sin(angle) * y) + 250.0,
                              scale * (Math.sin(angle) * x + Math.cos(angle) * y) - 40.0);
    }
}
