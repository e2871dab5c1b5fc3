package org.janelia.astrometry.solver;

import com.beust.jcommander.Parameter;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.json.JsonUtils;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.janelia.astrometry.transform.SplineFitParameters;

/**
 * Settings for {@link ImageSolver}.
 */
public class SolverParameters
        implements Serializable {

    public static final double AUTO_MAGNITUDE_MIN = 7.0;
    public static final double AUTO_MAGNITUDE_MAX = 20.0;

    @Parameter(
            names = "--projection",
            description = "Projection used for the solution")
    public ProjectionType projection = ProjectionType.GNOMONIC;

    @Parameter(
            names = "--projectionOriginRa",
            description = "Fixed right ascension (degrees) of the projection origin (omit to use the image center)")
    public Double projectionOriginRa;

    @Parameter(
            names = "--projectionOriginDec",
            description = "Fixed declination (degrees) of the projection origin (omit to use the image center)")
    public Double projectionOriginDec;

    @Parameter(
            names = "--limitMagnitude",
            description = "Faintest catalog magnitude to use (omit to derive it from the field of view)")
    public Double limitMagnitude;

    @Parameter(
            names = "--maxStarsInSolution",
            description = "Maximum number of (brightest) catalog stars matched per iteration")
    public Integer maxStarsInSolution = 50000;

    @Parameter(
            names = "--distortionCorrection",
            description = "Model optical distortion with surface splines",
            arity = 1)
    public boolean distortionCorrection = true;

    @Parameter(
            names = "--splineOrder",
            description = "Surface spline order (2 is a thin plate spline)")
    public Integer splineOrder = SplineFitParameters.DEFAULT_ORDER;

    @Parameter(
            names = "--splineSmoothing",
            description = "Surface spline smoothing factor (0 interpolates the control points exactly)")
    public Double splineSmoothing = SplineFitParameters.DEFAULT_SMOOTHING;

    @Parameter(
            names = "--enableSimplifier",
            description = "Simplify spline control point sets",
            arity = 1)
    public boolean enableSimplifier = true;

    @Parameter(
            names = "--simplifierRejectFraction",
            description = "Fraction of outlying points rejected by the simplifier's robust plane fits")
    public Double simplifierRejectFraction = SplineFitParameters.DEFAULT_REJECT_FRACTION;

    @Parameter(
            names = "--simplifierTolerance",
            description = "Simplifier plane fit tolerance in pixels")
    public Double simplifierTolerance = 0.25;

    @Parameter(
            names = "--maxSplinePoints",
            description = "Maximum number of control points retained for a spline")
    public Integer maxSplinePoints = SplineFitParameters.DEFAULT_MAX_POINTS;

    @Parameter(
            names = "--incrementalSpline",
            description = "Fit splines to the residuals of a baseline homography",
            arity = 1)
    public boolean incrementalSpline = false;

    @Parameter(
            names = "--distortedCorners",
            description = "Align 9 image cells separately to capture strong field distortion (requires distortion correction)",
            arity = 1)
    public boolean distortedCorners = false;

    @Parameter(
            names = "--cornerSize",
            description = "Relative size of the corner cells used when aligning distorted corners")
    public Double cornerSize = 0.25;

    @Parameter(
            names = "--optimizeSolution",
            description = "Iteratively refine the initial alignment",
            arity = 1)
    public boolean optimizeSolution = true;

    @Parameter(
            names = "--onlyOptimize",
            description = "Skip the initial alignment and refine an existing solution")
    public boolean onlyOptimize = false;

    @Parameter(
            names = "--maxIterations",
            description = "Maximum number of optimization iterations")
    public Integer maxIterations = 100;

    @Parameter(
            names = "--centerBlendThreshold",
            description = "Center moves (degrees) larger than this are damped by blending old and new centers")
    public Double centerBlendThreshold = 1.0;

    @Parameter(
            names = "--minDetectedStars",
            description = "Minimum number of detected image stars")
    public Integer minDetectedStars = 6;

    @Parameter(
            names = "--minCatalogStars",
            description = "Minimum number of catalog stars in the field")
    public Integer minCatalogStars = 10;

    @Parameter(
            names = "--minTemplateStars",
            description = "Minimum number of stars in a reference template")
    public Integer minTemplateStars = 8;

    @Parameter(
            names = "--maxAlignmentPairs",
            description = "Maximum number of star pairs taken from an alignment")
    public Integer maxAlignmentPairs = 4000;

    @Parameter(
            names = "--distortionModel",
            description = "Distortion model CSV file used to seed spline solutions (requires distortion correction)")
    public String distortionModelPath;

    @Parameter(
            names = "--generateDistortionModel",
            description = "Write a distortion model CSV file derived from the final solution to this path")
    public String generateDistortionModelPath;

    @Parameter(
            names = "--randomSeed",
            description = "Seed for the random sampling done while matching stars")
    public Long randomSeed = 0L;

    /**
     * @throws IllegalArgumentException
     *   if any parameter is out of range.
     */
    public void validate()
            throws IllegalArgumentException {

        if ((projectionOriginRa == null) != (projectionOriginDec == null)) {
            throw new IllegalArgumentException("both or neither of --projectionOriginRa and " +
                                               "--projectionOriginDec must be specified");
        }
        if ((cornerSize <= 0) || (cornerSize >= 0.5)) {
            throw new IllegalArgumentException("--cornerSize must be between 0 and 0.5");
        }
        if (maxIterations < 1) {
            throw new IllegalArgumentException("--maxIterations must be positive");
        }
        if (distortedCorners && (! distortionCorrection)) {
            throw new IllegalArgumentException("--distortedCorners requires distortion correction");
        }
        if ((distortionModelPath != null) && (! distortionCorrection)) {
            throw new IllegalArgumentException("--distortionModel requires distortion correction");
        }
        // constructing fit parameters checks order, smoothing and simplifier settings
        getSplineFitParameters(1.0);
    }

    /**
     * @return number of consecutive iterations without improvement that ends optimization.
     */
    public int getMaxItersNoImprovement() {
        return distortionCorrection ? 4 : 2;
    }

    /**
     * @param  imageCenter  celestial position of the image center.
     *
     * @return projection centered on the fixed origin (if configured) or the image center.
     */
    public Projection buildProjection(final CelestialPoint imageCenter) {
        final CelestialPoint origin = projectionOriginRa == null ?
                                      imageCenter : new CelestialPoint(projectionOriginRa, projectionOriginDec);
        return projection.build(origin);
    }

    /**
     * @param  tolerance  simplifier tolerance in the units of the spline's destination space.
     *
     * @return spline fit parameters for these settings.
     */
    public SplineFitParameters getSplineFitParameters(final double tolerance) {
        return new SplineFitParameters(splineOrder,
                                       splineSmoothing,
                                       enableSimplifier,
                                       simplifierRejectFraction,
                                       tolerance,
                                       maxSplinePoints,
                                       incrementalSpline);
    }

    /**
     * @return the configured limit magnitude or one derived from the field of view.
     */
    public double getLimitMagnitude(final double resolution,
                                    final int width,
                                    final int height) {
        return limitMagnitude == null ? getAutoLimitMagnitude(resolution * Math.max(width, height)) : limitMagnitude;
    }

    /**
     * Empirical limit that yields roughly a thousand stars at moderate galactic latitudes.
     *
     * @param  fovDegrees  largest image dimension in degrees.
     *
     * @return limit magnitude clamped to [7, 20] and rounded to hundredths.
     */
    public static double getAutoLimitMagnitude(final double fovDegrees) {
        final double m = 14.5 * Math.pow(fovDegrees, -0.179);
        return Math.round(100.0 * Math.min(AUTO_MAGNITUDE_MAX, Math.max(AUTO_MAGNITUDE_MIN, m))) / 100.0;
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.FAST_MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
