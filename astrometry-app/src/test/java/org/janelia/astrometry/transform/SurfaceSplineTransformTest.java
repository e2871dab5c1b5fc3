package org.janelia.astrometry.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.PlanePoint;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SurfaceSplineTransform} class.
 */
public class SurfaceSplineTransformTest {

    @Test
    public void testInterpolatingSplineReproducesControlPoints() throws Exception {

        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        buildDistortedGrid(source, target, 40, 11);

        for (int order = 2; order <= 3; order++) {
            final SurfaceSplineTransform transform =
                    SurfaceSplineTransform.fit(source, target, null, SplineFitParameters.interpolating(order));
            Assert.assertFalse("should not be truncated", transform.isTruncated());
            Assert.assertEquals("control point count", source.size(), transform.getNumberOfControlPoints());
            for (int i = 0; i < source.size(); i++) {
                final PlanePoint p = transform.apply(source.get(i));
                Assert.assertEquals("order " + order + " x for point " + i, target.get(i).getX(), p.getX(), 1.0e-6);
                Assert.assertEquals("order " + order + " y for point " + i, target.get(i).getY(), p.getY(), 1.0e-6);
            }
        }
    }

    @Test
    public void testIncrementalSplineReproducesControlPoints() throws Exception {

        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        buildDistortedGrid(source, target, 30, 5);

        final SplineFitParameters parameters = new SplineFitParameters(2, 0.0, false, 0.1, 0.0, 2100, true);
        final SurfaceSplineTransform transform = SurfaceSplineTransform.fit(source, target, null, parameters);
        for (int i = 0; i < source.size(); i++) {
            final PlanePoint p = transform.apply(source.get(i));
            Assert.assertEquals("x for point " + i, target.get(i).getX(), p.getX(), 1.0e-6);
            Assert.assertEquals("y for point " + i, target.get(i).getY(), p.getY(), 1.0e-6);
        }
    }

    @Test
    public void testTruncation() throws Exception {

        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        buildDistortedGrid(source, target, 40, 3);

        final SplineFitParameters parameters = new SplineFitParameters(2, 0.0, false, 0.1, 0.0, 20, false);
        final SurfaceSplineTransform transform = SurfaceSplineTransform.fit(source, target, null, parameters);
        Assert.assertTrue("transform should be truncated", transform.isTruncated());
        Assert.assertEquals("x nodes", 20, transform.getNumberOfNodes()[0]);
    }

    @Test
    public void testTruncationWhenSimplifiedSurfaceHasTooFewNodes() throws Exception {

        // an exact plane collapses to 5 simplified nodes, so all control points are used instead
        final Random random = new Random(19);
        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            final double x = random.nextDouble() * 1000.0;
            final double y = random.nextDouble() * 800.0;
            source.add(new PlanePoint(x, y));
            target.add(new PlanePoint(0.5 * x - 0.1 * y + 10.0, 0.2 * x + 0.5 * y - 5.0));
        }

        final SplineFitParameters parameters = new SplineFitParameters(2, 0.01, true, 0.1, 0.25, 10, false);
        final SurfaceSplineTransform transform = SurfaceSplineTransform.fit(source, target, null, parameters);

        Assert.assertTrue("cap of 10 nodes was hit with 40 control points, transform should be truncated",
                          transform.isTruncated());
        Assert.assertEquals("x nodes", 10, transform.getNumberOfNodes()[0]);
        Assert.assertEquals("y nodes", 10, transform.getNumberOfNodes()[1]);
    }

    @Test
    public void testTruncationOfSimplifiedSurface() throws Exception {

        // noisy surfaces cannot be simplified, nearly every control point remains a node
        final Random random = new Random(23);
        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        for (int i = 0; i < 60; i++) {
            final double x = random.nextDouble() * 1000.0;
            final double y = random.nextDouble() * 800.0;
            source.add(new PlanePoint(x, y));
            target.add(new PlanePoint(x + 100.0 * (random.nextDouble() - 0.5),
                                      y + 100.0 * (random.nextDouble() - 0.5)));
        }

        final SplineFitParameters parameters = new SplineFitParameters(2, 0.01, true, 0.1, 0.25, 10, false);
        final SurfaceSplineTransform transform = SurfaceSplineTransform.fit(source, target, null, parameters);

        Assert.assertTrue("transform should be truncated", transform.isTruncated());
        Assert.assertEquals("x nodes", 10, transform.getNumberOfNodes()[0]);
        Assert.assertEquals("y nodes", 10, transform.getNumberOfNodes()[1]);
    }

    @Test
    public void testInsufficientControlPoints() throws Exception {
        final List<PlanePoint> source = new ArrayList<>();
        final List<PlanePoint> target = new ArrayList<>();
        buildDistortedGrid(source, target, 4, 7);
        try {
            SurfaceSplineTransform.fit(source, target, null, SplineFitParameters.interpolating(2));
            Assert.fail("fit with 4 points should fail");
        } catch (final InsufficientControlPointsException e) {
            Assert.assertEquals("available points", 4, e.getNumberOfPoints());
            Assert.assertEquals("required points", 6, e.getMinimumNumberOfPoints());
        }
    }

    private static void buildDistortedGrid(final List<PlanePoint> source,
                                           final List<PlanePoint> target,
                                           final int count,
                                           final long seed) {
        final Random random = new Random(seed);
        for (int i = 0; i < count; i++) {
            final double x = random.nextDouble() * 1000.0;
            final double y = random.nextDouble() * 800.0;
            final double r2 = ((x - 500) * (x - 500) + (y - 400) * (y - 400)) / 250000.0;
            source.add(new PlanePoint(x, y));
            target.add(new PlanePoint(0.5 * x + 10.0 + 3.0 * r2, 0.5 * y - 5.0 - 2.0 * r2));
        }
    }
}
