package org.janelia.astrometry.wcs;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.janelia.astrometry.solver.GeometricSolution;
import org.janelia.astrometry.solver.SolverParameters;
import org.janelia.astrometry.solver.StandardSolutionRefiner;
import org.janelia.astrometry.transform.LinearTransform;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link WcsSolutionConverter} class.
 */
public class WcsSolutionConverterTest {

    private static final int WIDTH = 2000;
    private static final int HEIGHT = 1500;
    private static final CelestialPoint CENTER = new CelestialPoint(210.5, -12.25);
    private static final double RESOLUTION = 1.5 / 3600.0;

    @Test
    public void testLinearKeywords() throws Exception {

        final GeometricSolution solution = buildLinearSolution();
        final WcsKeywords wcs = WcsSolutionConverter.toWcs(solution);

        Assert.assertEquals("invalid ctype1", "RA---TAN", wcs.ctype1);
        Assert.assertEquals("invalid ctype2", "DEC--TAN", wcs.ctype2);
        Assert.assertEquals("invalid radesys", WcsKeywords.DEFAULT_RADESYS, wcs.radesys);
        Assert.assertEquals("invalid crval1", CENTER.getRa(), wcs.crval1, 1.0e-12);
        Assert.assertEquals("invalid crval2", CENTER.getDec(), wcs.crval2, 1.0e-12);
        Assert.assertEquals("invalid crpix1", WIDTH / 2.0 + 0.5, wcs.crpix1, 1.0e-9);
        Assert.assertEquals("invalid crpix2", HEIGHT / 2.0 + 0.5, wcs.crpix2, 1.0e-9);
        Assert.assertEquals("invalid cdelt1 magnitude", RESOLUTION, Math.abs(wcs.cdelt1), 1.0e-15);
        Assert.assertEquals("invalid cdelt2 magnitude", RESOLUTION, Math.abs(wcs.cdelt2), 1.0e-15);

        final LinearTransform expected = solution.getLinearImageToNative();
        final LinearTransform actual = WcsSolutionConverter.toLinearTransform(wcs, HEIGHT);
        final PlanePoint p = new PlanePoint(123.0, 1234.0);
        Assert.assertEquals("x", expected.apply(p).getX(), actual.apply(p).getX(), 1.0e-12);
        Assert.assertEquals("y", expected.apply(p).getY(), actual.apply(p).getY(), 1.0e-12);
    }

    @Test
    public void testLegacyScaleKeywords() throws Exception {

        final WcsKeywords wcs = WcsSolutionConverter.toWcs(buildLinearSolution());
        final LinearTransform fromCd = WcsSolutionConverter.toLinearTransform(wcs, HEIGHT);

        wcs.cd1_1 = null;
        wcs.cd1_2 = null;
        wcs.cd2_1 = null;
        wcs.cd2_2 = null;
        final LinearTransform fromCdelt = WcsSolutionConverter.toLinearTransform(wcs, HEIGHT);

        final PlanePoint p = new PlanePoint(1999.0, 7.0);
        Assert.assertEquals("x", fromCd.apply(p).getX(), fromCdelt.apply(p).getX(), 1.0e-12);
        Assert.assertEquals("y", fromCd.apply(p).getY(), fromCdelt.apply(p).getY(), 1.0e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingLinearMapping() {
        final WcsKeywords wcs = new WcsKeywords();
        wcs.ctype1 = "RA---TAN";
        wcs.ctype2 = "DEC--TAN";
        wcs.crval1 = 10.0;
        wcs.crval2 = 20.0;
        WcsSolutionConverter.toLinearTransform(wcs, HEIGHT);
    }

    @Test
    public void testLinearSpecRoundTrip() throws Exception {

        final GeometricSolution solution = buildLinearSolution();
        final AstrometricSolutionSpec spec = WcsSolutionConverter.toSpec(solution);
        Assert.assertFalse("linear solution should not have splines", spec.hasSplines());

        final GeometricSolution restored =
                WcsSolutionConverter.fromSpec(AstrometricSolutionSpec.fromJson(spec.toJson()));

        Assert.assertFalse("restored solution should be linear", restored.hasSplineTransforms());
        Assert.assertEquals("invalid width", WIDTH, restored.getWidth());
        Assert.assertEquals("invalid height", HEIGHT, restored.getHeight());
        Assert.assertEquals("invalid resolution", RESOLUTION, restored.getResolution(), 1.0e-15);
        assertSameMapping(solution, restored, 1.0e-6);
    }

    @Test
    public void testSplineSpecRoundTrip() throws Exception {

        final GeometricSolution solution = buildSplineSolution();
        Assert.assertTrue("solution should have splines", solution.hasSplineTransforms());

        final AstrometricSolutionSpec spec = WcsSolutionConverter.toSpec(solution);
        Assert.assertTrue("spec should have splines", spec.hasSplines());
        Assert.assertEquals("invalid number of control points",
                            solution.getControlPoints().size(), spec.getSplines().size());

        final StringWriter writer = new StringWriter();
        spec.writeJson(writer);
        final AstrometricSolutionSpec parsed = AstrometricSolutionSpec.fromJson(new StringReader(writer.toString()));

        final GeometricSolution restored = WcsSolutionConverter.fromSpec(parsed);

        Assert.assertTrue("restored solution should have splines", restored.hasSplineTransforms());
        Assert.assertEquals("invalid center ra", solution.getCenter().getRa(), restored.getCenter().getRa(), 0.0);
        Assert.assertEquals("invalid center dec", solution.getCenter().getDec(), restored.getCenter().getDec(), 0.0);
        Assert.assertEquals("invalid resolution", solution.getResolution(), restored.getResolution(), 0.0);
        assertSameMapping(solution, restored, 1.0e-6);
    }

    @Test
    public void testFitsHeaderRoundTrip() throws Exception {

        final WcsKeywords wcs = WcsSolutionConverter.toWcs(buildLinearSolution());
        final List<FitsKeyword> parsed = new ArrayList<>();
        for (final FitsKeyword keyword : wcs.toFitsKeywords()) {
            final String card = keyword.toCard();
            Assert.assertEquals("invalid card length for " + keyword.getName(), FitsKeyword.CARD_LENGTH, card.length());
            parsed.add(FitsKeyword.parseCard(card));
        }

        final WcsKeywords restored = WcsKeywords.fromFitsKeywords(parsed);
        Assert.assertEquals("invalid ctype1", wcs.ctype1, restored.ctype1);
        Assert.assertEquals("invalid radesys", wcs.radesys, restored.radesys);
        Assert.assertEquals("invalid crpix1", wcs.crpix1, restored.crpix1);
        Assert.assertEquals("invalid crval2", wcs.crval2, restored.crval2);
        Assert.assertEquals("invalid cd1_2", wcs.cd1_2, restored.cd1_2);
        Assert.assertEquals("invalid cd2_1", wcs.cd2_1, restored.cd2_1);
    }

    @Test
    public void testQuotedStringCard() {
        final FitsKeyword keyword = FitsKeyword.forString("OBSERVER", "O'Brien", "who took it");
        final FitsKeyword parsed = FitsKeyword.parseCard(keyword.toCard());
        Assert.assertEquals("invalid name", "OBSERVER", parsed.getName());
        Assert.assertEquals("invalid value", "O'Brien", parsed.getStringValue());
        Assert.assertEquals("invalid comment", "who took it", parsed.getComment());
        Assert.assertNull("comment cards have no value", FitsKeyword.parseCard("COMMENT   plain text"));
    }

    private static void assertSameMapping(final GeometricSolution expected,
                                          final GeometricSolution actual,
                                          final double tolerancePixels) {
        final Random random = new Random(99);
        for (int i = 0; i < 50; i++) {
            final PlanePoint imagePoint = new PlanePoint(random.nextDouble() * WIDTH, random.nextDouble() * HEIGHT);
            final CelestialPoint expectedSky = expected.imageToSky(imagePoint);
            final CelestialPoint actualSky = actual.imageToSky(imagePoint);
            final double skyErrorPixels = expectedSky.angularDistance(actualSky) / RESOLUTION;
            Assert.assertEquals("sky position of point " + i, 0.0, skyErrorPixels, tolerancePixels);

            final PlanePoint expectedImage = expected.skyToImage(expectedSky);
            final PlanePoint actualImage = actual.skyToImage(expectedSky);
            Assert.assertEquals("image position of point " + i,
                                0.0, expectedImage.distance(actualImage), tolerancePixels);
        }
    }

    private static GeometricSolution buildLinearSolution() throws Exception {
        final double cos = Math.cos(Math.toRadians(25.0)) * RESOLUTION;
        final double sin = Math.sin(Math.toRadians(25.0)) * RESOLUTION;
        final LinearTransform imageToNative = new LinearTransform(-cos, sin, cos * WIDTH / 2.0 - sin * HEIGHT / 2.0,
                                                                  -sin, -cos, sin * WIDTH / 2.0 + cos * HEIGHT / 2.0);
        final Projection projection = ProjectionType.GNOMONIC.build(CENTER);
        return new GeometricSolution.Builder()
                .projection(projection)
                .size(WIDTH, HEIGHT)
                .linear(imageToNative, imageToNative.inverse())
                .center(CENTER)
                .resolution(RESOLUTION)
                .build();
    }

    private static GeometricSolution buildSplineSolution() throws Exception {

        final GeometricSolution linear = buildLinearSolution();
        final LinearTransform imageToNative = linear.getLinearImageToNative();

        final List<PlanePoint> imagePoints = new ArrayList<>();
        final List<PlanePoint> nativePoints = new ArrayList<>();
        final Random random = new Random(5);
        for (int i = 0; i < 300; i++) {
            final PlanePoint imagePoint = new PlanePoint(random.nextDouble() * WIDTH, random.nextDouble() * HEIGHT);
            final PlanePoint undistorted = imageToNative.apply(imagePoint);
            // mild barrel distortion around the image center
            final double dx = (imagePoint.getX() - WIDTH / 2.0) / WIDTH;
            final double dy = (imagePoint.getY() - HEIGHT / 2.0) / WIDTH;
            final double k = 1.0 - 0.002 * (dx * dx + dy * dy);
            imagePoints.add(imagePoint);
            nativePoints.add(new PlanePoint(undistorted.getX() * k, undistorted.getY() * k));
        }
        imagePoints.add(null);
        nativePoints.add(new PlanePoint(0.0, 0.0));

        final StandardSolutionRefiner refiner =
                new StandardSolutionRefiner(new SolverParameters(), null, new ArrayList<>());
        return refiner.fit(WIDTH, HEIGHT, linear.getProjection(), imagePoints, nativePoints, RESOLUTION, null);
    }
}
