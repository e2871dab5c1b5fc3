package org.janelia.astrometry.transform;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Homography} class.
 */
public class HomographyTest {

    @Test
    public void testExactAffineFromFourPairs() throws Exception {
        final LinearTransform expected = new LinearTransform(1.5, -0.25, 100.0,
                                                             0.4, 0.9, -20.0);
        final List<PlanePoint> from = Arrays.asList(new PlanePoint(0, 0),
                                                    new PlanePoint(100, 0),
                                                    new PlanePoint(0, 80),
                                                    new PlanePoint(120, 95));
        final LinearTransform fitted = Homography.fit(from, expected.applyAll(from));

        final double[] expectedMatrix = expected.getMatrix();
        final double[] fittedMatrix = fitted.getMatrix();
        for (int i = 0; i < expectedMatrix.length; i++) {
            Assert.assertEquals("element " + i, expectedMatrix[i], fittedMatrix[i], 1.0e-9);
        }
    }

    @Test
    public void testNullPairsAreSkipped() throws Exception {
        final LinearTransform expected = new LinearTransform(2, 0, 1,
                                                             0, 2, 3);
        final List<PlanePoint> from = Arrays.asList(new PlanePoint(5, 5),
                                                    null,
                                                    new PlanePoint(10, 0),
                                                    new PlanePoint(0, 10),
                                                    new PlanePoint(10, 10),
                                                    new PlanePoint(-4, 2));
        final List<PlanePoint> to = new ArrayList<>(expected.applyAll(from));
        to.set(5, null);

        final LinearTransform fitted = Homography.fit(from, to);
        final PlanePoint p = fitted.apply(new PlanePoint(3, 7));
        Assert.assertEquals("x", 7.0, p.getX(), 1.0e-9);
        Assert.assertEquals("y", 17.0, p.getY(), 1.0e-9);

        to.set(4, null);
        try {
            Homography.fit(from, to);
            Assert.fail("fit with only 3 valid pairs should fail");
        } catch (final InsufficientSamplesException e) {
            Assert.assertTrue("message should mention available pairs", e.getMessage().contains("only 3"));
        }
    }

    @Test(expected = InsufficientSamplesException.class)
    public void testCollinearPointsFail() throws Exception {
        final List<PlanePoint> from = Arrays.asList(new PlanePoint(0, 0),
                                                    new PlanePoint(1, 1),
                                                    new PlanePoint(2, 2),
                                                    new PlanePoint(3, 3));
        Homography.fit(from, from);
    }

    @Test
    public void testSimilarity() throws Exception {
        final double angle = Math.toRadians(25.0);
        final double scale = 1.7;
        final LinearTransform expected = new LinearTransform(scale * Math.cos(angle), -scale * Math.sin(angle), 12,
                                                             scale * Math.sin(angle), scale * Math.cos(angle), -4);
        final List<PlanePoint> from = Arrays.asList(new PlanePoint(0, 0),
                                                    new PlanePoint(50, 10),
                                                    new PlanePoint(-20, 40));
        final LinearTransform fitted = Homography.fitSimilarity(from, expected.applyAll(from), false);

        final PlanePoint p = new PlanePoint(33, -21);
        Assert.assertEquals("x", expected.apply(p).getX(), fitted.apply(p).getX(), 1.0e-9);
        Assert.assertEquals("y", expected.apply(p).getY(), fitted.apply(p).getY(), 1.0e-9);
    }

    @Test
    public void testMirroredSimilarity() throws Exception {
        final LinearTransform mirror = new LinearTransform(-2, 0, 5,
                                                           0, 2, 7);
        final List<PlanePoint> from = Arrays.asList(new PlanePoint(0, 0),
                                                    new PlanePoint(50, 10),
                                                    new PlanePoint(-20, 40),
                                                    new PlanePoint(15, -30));
        final List<PlanePoint> to = mirror.applyAll(from);

        Assert.assertTrue("mirrored pairs not detected",
                          Homography.isMirrored(from, to, from.get(0), to.get(0),
                                                Homography.DEFAULT_MIRROR_THRESHOLD));

        final LinearTransform fitted = Homography.fitSimilarity(from, to, true);
        final PlanePoint p = new PlanePoint(8, 9);
        Assert.assertEquals("x", mirror.apply(p).getX(), fitted.apply(p).getX(), 1.0e-9);
        Assert.assertEquals("y", mirror.apply(p).getY(), fitted.apply(p).getY(), 1.0e-9);
    }
}
