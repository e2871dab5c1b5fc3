package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.List;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.NoninvertibleTransformException;
import org.janelia.astrometry.transform.SplineFitParameters;
import org.janelia.astrometry.transform.SurfaceSplineTransform;
import org.janelia.astrometry.transform.TransformFitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fits solutions to image/native point pairs.
 *
 * Without distortion correction a homography and its inverse are fitted.  With distortion correction
 * independent image to native and native to image surface splines are fitted (a spline has no closed
 * form inverse) along with a linear approximation.  While a distortion model is active the splines are
 * fitted to the model's grid instead, after mapping it onto the sky with a homography derived from the
 * undistorted star positions.
 */
public class StandardSolutionRefiner
        implements SolutionRefiner {

    private final SolverParameters parameters;
    private final List<String> warnings;
    private DistortionModel distortionModel;

    /**
     * @param  parameters       solver settings.
     * @param  distortionModel  model to seed spline fits with (null for none).
     * @param  warnings         list that non fatal problems are reported to.
     */
    public StandardSolutionRefiner(final SolverParameters parameters,
                                   final DistortionModel distortionModel,
                                   final List<String> warnings) {
        this.parameters = parameters;
        this.distortionModel = distortionModel;
        this.warnings = warnings;
    }

    @Override
    public GeometricSolution refine(final GeometricSolution current,
                                    final StarEvaluation evaluation)
            throws TransformFitException, NoninvertibleTransformException {
        return fit(current.getWidth(),
                   current.getHeight(),
                   evaluation.getProjection(),
                   evaluation.getObservedImagePoints(),
                   evaluation.getNativePoints(),
                   current.getResolution(),
                   current.getCenter());
    }

    @Override
    public boolean isDistortionModelActive() {
        return distortionModel != null;
    }

    @Override
    public void dropDistortionModel() {
        distortionModel = null;
    }

    /**
     * @param  width           image width.
     * @param  height          image height.
     * @param  projection      projection the native points were computed with.
     * @param  imagePoints     image positions (null entries are skipped with their partner).
     * @param  nativePoints    index aligned native positions.
     * @param  resolution      approximate image scale (degrees per pixel) used to scale simplifier tolerances.
     * @param  previousCenter  center of the solution being refined (null if the new center should not be damped).
     *
     * @return solution fitted to the pairs.
     *
     * @throws TransformFitException
     *   if the transforms cannot be fitted or the image center falls outside the projection's domain.
     * @throws NoninvertibleTransformException
     *   if a linear solution cannot be inverted.
     */
    public GeometricSolution fit(final int width,
                                 final int height,
                                 final Projection projection,
                                 final List<PlanePoint> imagePoints,
                                 final List<PlanePoint> nativePoints,
                                 final double resolution,
                                 final CelestialPoint previousCenter)
            throws TransformFitException, NoninvertibleTransformException {

        final GeometricSolution.Builder builder = new GeometricSolution.Builder()
                .projection(projection)
                .size(width, height);

        if (distortionModel != null) {
            fitWithDistortionModel(builder, imagePoints, nativePoints);
        } else if (parameters.distortionCorrection) {
            fitSplines(builder, imagePoints, nativePoints, resolution);
        } else {
            final LinearTransform imageToNative = Homography.fit(imagePoints, nativePoints);
            builder.linear(imageToNative, imageToNative.inverse());
        }

        // provisional center so that the image center can be located through the new transforms
        final GeometricSolution provisional = builder.center(projection.getReferencePoint()).build();
        final CelestialPoint fittedCenter = provisional.imageToSky(provisional.getImageCenter());
        if (fittedCenter == null) {
            throw new TransformFitException("the fitted image center lies outside the " +
                                            projection.getType() + " projection domain");
        }

        final CelestialPoint center = previousCenter == null ?
                                      fittedCenter :
                                      blendCenters(previousCenter, fittedCenter, parameters.centerBlendThreshold);

        final LinearTransform linear = provisional.getLinearImageToNative();

        return provisional.toBuilder()
                .center(center)
                .resolution((linear.getScaleX() + linear.getScaleY()) / 2.0)
                .build();
    }

    /**
     * Replaces a center unless it moved further than the threshold, in which case the
     * previous and new centers are blended with weights 1/3 and 2/3.
     */
    public static CelestialPoint blendCenters(final CelestialPoint previous,
                                              final CelestialPoint fitted,
                                              final double thresholdDegrees) {
        if (previous.angularDistance(fitted) <= thresholdDegrees) {
            return fitted;
        }
        final double ra = previous.getRa() + previous.raDelta(fitted) * 2.0 / 3.0;
        final double dec = (previous.getDec() + 2.0 * fitted.getDec()) / 3.0;
        LOG.debug("blendCenters: damping center move from {} to {}", previous, fitted);
        return new CelestialPoint(ra, dec);
    }

    private void fitSplines(final GeometricSolution.Builder builder,
                            final List<PlanePoint> imagePoints,
                            final List<PlanePoint> nativePoints,
                            final double resolution)
            throws TransformFitException {

        final LinearTransform linear = Homography.fit(imagePoints, nativePoints);

        final SplineFitParameters imageToNativeParameters =
                parameters.getSplineFitParameters(parameters.simplifierTolerance * resolution);
        final SplineFitParameters nativeToImageParameters =
                parameters.getSplineFitParameters(parameters.simplifierTolerance);

        final SurfaceSplineTransform imageToNative =
                SurfaceSplineTransform.fit(imagePoints, nativePoints, null, imageToNativeParameters);
        final SurfaceSplineTransform nativeToImage =
                SurfaceSplineTransform.fit(nativePoints, imagePoints, null, nativeToImageParameters);

        reportTruncation(imageToNative, "image to native");
        reportTruncation(nativeToImage, "native to image");

        builder.spline(imageToNative, linear, nativeToImage, new ControlPoints(imagePoints, nativePoints, null));
    }

    private void fitWithDistortionModel(final GeometricSolution.Builder builder,
                                        final List<PlanePoint> imagePoints,
                                        final List<PlanePoint> nativePoints)
            throws TransformFitException {

        final List<PlanePoint> undistortedStars = new ArrayList<>(imagePoints.size());
        for (final PlanePoint p : imagePoints) {
            undistortedStars.add(p == null ? null : distortionModel.undistort(p));
        }

        final LinearTransform undistortedToNative = Homography.fit(undistortedStars, nativePoints);
        final List<PlanePoint> gridNative = undistortedToNative.applyAll(distortionModel.getUndistortedPoints());
        final List<PlanePoint> gridImage = distortionModel.getDistortedPoints();

        final SplineFitParameters interpolating = SplineFitParameters.interpolating(2);
        final SurfaceSplineTransform imageToNative =
                SurfaceSplineTransform.fit(gridImage, gridNative, null, interpolating);
        final SurfaceSplineTransform nativeToImage =
                SurfaceSplineTransform.fit(gridNative, gridImage, null, interpolating);

        builder.spline(imageToNative,
                       Homography.fit(gridImage, gridNative),
                       nativeToImage,
                       new ControlPoints(gridImage, gridNative, null));
    }

    private void reportTruncation(final SurfaceSplineTransform transform,
                                  final String direction) {
        if (transform.isTruncated()) {
            final String warning = "the " + direction + " spline exceeded " + parameters.maxSplinePoints +
                                   " control points and was truncated";
            if (! warnings.contains(warning)) {
                warnings.add(warning);
            }
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(StandardSolutionRefiner.class);
}
