package org.janelia.astrometry.solver;

import com.beust.jcommander.JCommander;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link SolverParameters} class.
 */
public class SolverParametersTest {

    @Test
    public void testAutoLimitMagnitude() {
        Assert.assertEquals("invalid magnitude for 1 degree", 14.5, SolverParameters.getAutoLimitMagnitude(1.0), 0.0);
        Assert.assertEquals("invalid magnitude for 2 degrees", 12.81, SolverParameters.getAutoLimitMagnitude(2.0), 0.0);
        Assert.assertEquals("narrow fields should be clamped",
                            SolverParameters.AUTO_MAGNITUDE_MAX, SolverParameters.getAutoLimitMagnitude(0.01), 0.0);
        Assert.assertEquals("wide fields should be clamped",
                            SolverParameters.AUTO_MAGNITUDE_MIN, SolverParameters.getAutoLimitMagnitude(100.0), 0.0);

        final SolverParameters parameters = new SolverParameters();
        Assert.assertEquals("auto magnitude should use the largest dimension",
                            14.5, parameters.getLimitMagnitude(1.0 / 2000.0, 2000, 1000), 0.0);
        parameters.limitMagnitude = 11.0;
        Assert.assertEquals("configured magnitude should be used",
                            11.0, parameters.getLimitMagnitude(1.0 / 2000.0, 2000, 1000), 0.0);
    }

    @Test
    public void testMaxItersNoImprovement() {
        final SolverParameters parameters = new SolverParameters();
        Assert.assertEquals("invalid patience with distortion correction", 4, parameters.getMaxItersNoImprovement());
        parameters.distortionCorrection = false;
        Assert.assertEquals("invalid patience without distortion correction", 2, parameters.getMaxItersNoImprovement());
    }

    @Test
    public void testBuildProjection() {
        final SolverParameters parameters = new SolverParameters();
        final CelestialPoint imageCenter = new CelestialPoint(45.0, 10.0);

        Projection projection = parameters.buildProjection(imageCenter);
        Assert.assertEquals("invalid default type", ProjectionType.GNOMONIC, projection.getType());
        Assert.assertEquals("projection should be centered on the image", imageCenter, projection.getReferencePoint());

        parameters.projection = ProjectionType.STEREOGRAPHIC;
        parameters.projectionOriginRa = 40.0;
        parameters.projectionOriginDec = 12.0;
        projection = parameters.buildProjection(imageCenter);
        Assert.assertEquals("invalid type", ProjectionType.STEREOGRAPHIC, projection.getType());
        Assert.assertEquals("projection should be centered on the fixed origin",
                            new CelestialPoint(40.0, 12.0), projection.getReferencePoint());
    }

    @Test
    public void testValidate() {
        new SolverParameters().validate();

        final SolverParameters partialOrigin = new SolverParameters();
        partialOrigin.projectionOriginRa = 10.0;
        assertInvalid(partialOrigin, "partial projection origin");

        final SolverParameters badCornerSize = new SolverParameters();
        badCornerSize.cornerSize = 0.5;
        assertInvalid(badCornerSize, "corner size");

        final SolverParameters cornersWithoutSplines = new SolverParameters();
        cornersWithoutSplines.distortedCorners = true;
        cornersWithoutSplines.distortionCorrection = false;
        assertInvalid(cornersWithoutSplines, "distorted corners without distortion correction");

        final SolverParameters modelWithoutSplines = new SolverParameters();
        modelWithoutSplines.distortionModelPath = "model.csv";
        modelWithoutSplines.distortionCorrection = false;
        assertInvalid(modelWithoutSplines, "distortion model without distortion correction");

        final SolverParameters badOrder = new SolverParameters();
        badOrder.splineOrder = 7;
        assertInvalid(badOrder, "spline order");

        final SolverParameters badIterations = new SolverParameters();
        badIterations.maxIterations = 0;
        assertInvalid(badIterations, "max iterations");
    }

    @Test
    public void testCommandLineParsing() {
        final SolverParameters parameters = new SolverParameters();
        JCommander.newBuilder()
                .addObject(parameters)
                .build()
                .parse("--projection", "ZENITHAL_EQUAL_AREA",
                       "--distortionCorrection", "false",
                       "--maxIterations", "25",
                       "--onlyOptimize");

        Assert.assertEquals("invalid projection", ProjectionType.ZENITHAL_EQUAL_AREA, parameters.projection);
        Assert.assertFalse("distortion correction should be disabled", parameters.distortionCorrection);
        Assert.assertEquals("invalid max iterations", Integer.valueOf(25), parameters.maxIterations);
        Assert.assertTrue("onlyOptimize should be set", parameters.onlyOptimize);
        Assert.assertTrue("parameters should serialize to JSON", parameters.toString().contains("ZENITHAL_EQUAL_AREA"));
    }

    private static void assertInvalid(final SolverParameters parameters,
                                      final String context) {
        try {
            parameters.validate();
            Assert.fail("validation should fail for " + context);
        } catch (final IllegalArgumentException e) {
            Assert.assertNotNull("message missing for " + context, e.getMessage());
        }
    }
}
