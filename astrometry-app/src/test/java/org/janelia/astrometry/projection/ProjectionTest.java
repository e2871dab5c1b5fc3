package org.janelia.astrometry.projection;

import java.util.Random;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.wcs.WcsKeywords;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Projection} implementations.
 */
public class ProjectionTest {

    private static final CelestialPoint REFERENCE = new CelestialPoint(150.0, 30.0);

    @Test
    public void testRoundTripForAllTypes() {
        for (final ProjectionType type : ProjectionType.values()) {
            final Projection projection = type.build(REFERENCE);
            final Random random = new Random(42);
            int checked = 0;
            for (int i = 0; i < 1000; i++) {
                final CelestialPoint sky = new CelestialPoint(REFERENCE.getRa() - 30.0 + random.nextDouble() * 60.0,
                                                              random.nextDouble() * 60.0);
                final PlanePoint nativePoint = projection.direct(sky);
                if (nativePoint == null) {
                    continue;
                }
                final CelestialPoint roundTrip = projection.inverse(nativePoint);
                Assert.assertNotNull(type + " inverse failed for " + sky, roundTrip);

                final double dRa = sky.raDelta(roundTrip) * Math.cos(Math.toRadians(sky.getDec()));
                Assert.assertEquals(type + " ra mismatch for " + sky, 0.0, dRa, 1.0e-9);
                Assert.assertEquals(type + " dec mismatch for " + sky, sky.getDec(), roundTrip.getDec(), 1.0e-9);
                checked++;
            }
            Assert.assertTrue(type + " checked too few points (" + checked + ")", checked > 900);
        }
    }

    @Test
    public void testReferencePointMapsToOrigin() {
        for (final ProjectionType type : new ProjectionType[] {
                ProjectionType.GNOMONIC, ProjectionType.STEREOGRAPHIC,
                ProjectionType.ZENITHAL_EQUAL_AREA, ProjectionType.ORTHOGRAPHIC }) {
            final PlanePoint origin = type.build(REFERENCE).direct(REFERENCE);
            Assert.assertEquals(type + " x", 0.0, origin.getX(), 1.0e-12);
            Assert.assertEquals(type + " y", 0.0, origin.getY(), 1.0e-12);
        }
    }

    @Test
    public void testGnomonicScale() {
        final Projection projection = ProjectionType.GNOMONIC.build(new CelestialPoint(0.0, 0.0));
        final PlanePoint p = projection.direct(new CelestialPoint(0.0, 1.0));
        Assert.assertEquals("x", 0.0, p.getX(), 1.0e-12);
        Assert.assertEquals("y", Math.toDegrees(Math.tan(Math.toRadians(1.0))), p.getY(), 1.0e-12);
    }

    @Test
    public void testGnomonicRejectsOppositeHemisphere() {
        final Projection projection = ProjectionType.GNOMONIC.build(REFERENCE);
        Assert.assertNull("point 180 degrees away should not project",
                          projection.direct(new CelestialPoint(330.0, -30.0)));
    }

    @Test
    public void testWcsRoundTrip() {
        for (final ProjectionType type : ProjectionType.values()) {
            final Projection projection = type.build(REFERENCE);
            final WcsKeywords wcs = projection.toWcs();
            Assert.assertEquals("invalid CTYPE1 for " + type, "RA---" + type.getCode(), wcs.ctype1);

            final Projection parsed = ProjectionType.fromWcs(wcs);
            Assert.assertEquals("type", type, parsed.getType());

            final CelestialPoint sky = new CelestialPoint(152.0, 31.5);
            final PlanePoint expected = projection.direct(sky);
            final PlanePoint actual = parsed.direct(sky);
            Assert.assertEquals(type + " x", expected.getX(), actual.getX(), 1.0e-12);
            Assert.assertEquals(type + " y", expected.getY(), actual.getY(), 1.0e-12);
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedCtype() {
        ProjectionType.fromCtype("RA---XYZ");
    }
}
