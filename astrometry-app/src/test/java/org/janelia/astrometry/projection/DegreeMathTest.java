package org.janelia.astrometry.projection;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DegreeMath} class.
 */
public class DegreeMathTest {

    @Test
    public void testWrap() {
        Assert.assertEquals("in range value changed", 45.0, DegreeMath.wrap(45.0, 0.0, 360.0), 0.0);
        Assert.assertEquals("max should wrap to min", 0.0, DegreeMath.wrap(360.0, 0.0, 360.0), 0.0);
        Assert.assertEquals("invalid negative wrap", 355.0, DegreeMath.wrap(-725.0, 0.0, 360.0), 1e-9);
        Assert.assertEquals("invalid signed wrap", -170.0, DegreeMath.wrap(190.0, -180.0, 180.0), 1e-9);
        Assert.assertEquals("tolerance above max should be kept",
                            180.0, DegreeMath.wrap(180.0, -180.0, 180.0 + 1e-10), 0.0);
    }

    @Test(timeout = 1000)
    public void testWrapOfHugeAngle() {
        final double wrapped = DegreeMath.wrap(1e20, 0.0, 360.0);
        Assert.assertTrue("wrapped angle " + wrapped + " outside range", (wrapped >= 0.0) && (wrapped < 360.0));

        final double negative = DegreeMath.wrap(-1e20, -180.0, 180.0);
        Assert.assertTrue("wrapped angle " + negative + " outside range", (negative >= -180.0) && (negative < 180.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrapOfInfinityFails() {
        DegreeMath.wrap(Double.POSITIVE_INFINITY, 0.0, 360.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrapOfNaNFails() {
        DegreeMath.wrap(Double.NaN, -180.0, 180.0);
    }

    @Test
    public void testExactQuadrants() {
        Assert.assertEquals("invalid sin(180)", 0.0, DegreeMath.sin(180.0), 0.0);
        Assert.assertEquals("invalid cos(-90)", 0.0, DegreeMath.cos(-90.0), 0.0);
        Assert.assertEquals("invalid sin(270)", -1.0, DegreeMath.sin(270.0), 0.0);
    }
}
