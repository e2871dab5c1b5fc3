package org.janelia.astrometry.wcs;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.janelia.astrometry.solver.ControlPoints;
import org.janelia.astrometry.solver.GeometricSolution;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.NoninvertibleTransformException;
import org.janelia.astrometry.transform.SurfaceSplineTransform;
import org.janelia.astrometry.transform.TransformFitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts solutions to and from their WCS based persisted form.
 *
 * Solutions use corner origin pixels with the second axis pointing down while WCS pixels are
 * one based pixel centers with the second axis pointing up, so
 * <pre>
 *   fitsX = x + 0.5
 *   fitsY = height - y + 0.5
 * </pre>
 */
public class WcsSolutionConverter {

    private WcsSolutionConverter() {
    }

    /**
     * @return WCS keywords for the linear part of the solution.
     *
     * @throws NoninvertibleTransformException
     *   if the linear transform is singular.
     */
    public static WcsKeywords toWcs(final GeometricSolution solution)
            throws NoninvertibleTransformException {

        final LinearTransform linear = solution.getLinearImageToNative();
        final PlanePoint referencePixel = linear.inverse().apply(new PlanePoint(0.0, 0.0));

        final WcsKeywords wcs = solution.getProjection().toWcs();
        wcs.radesys = WcsKeywords.DEFAULT_RADESYS;
        wcs.crpix1 = referencePixel.getX() + 0.5;
        wcs.crpix2 = solution.getHeight() - referencePixel.getY() + 0.5;
        wcs.cd1_1 = linear.get(0, 0);
        wcs.cd1_2 = -linear.get(0, 1);
        wcs.cd2_1 = linear.get(1, 0);
        wcs.cd2_2 = -linear.get(1, 1);
        wcs.deriveScaleAndRotation();

        return wcs;
    }

    /**
     * @return the image to native transform described by the WCS linear mapping.
     *
     * @throws IllegalArgumentException
     *   if the keywords carry no linear mapping.
     */
    public static LinearTransform toLinearTransform(final WcsKeywords wcs,
                                                    final int height)
            throws IllegalArgumentException {

        wcs.deriveCdMatrix();
        if (! wcs.hasLinearMapping() || (wcs.cd1_1 == null)) {
            throw new IllegalArgumentException("WCS keywords must include CRPIX and a CD matrix or CDELT values");
        }

        final double offsetX = 0.5 - wcs.crpix1;
        final double offsetY = height + 0.5 - wcs.crpix2;
        return new LinearTransform(wcs.cd1_1, -wcs.cd1_2, wcs.cd1_1 * offsetX + wcs.cd1_2 * offsetY,
                                   wcs.cd2_1, -wcs.cd2_2, wcs.cd2_1 * offsetX + wcs.cd2_2 * offsetY);
    }

    /**
     * @throws NoninvertibleTransformException
     *   if the linear transform is singular.
     */
    public static AstrometricSolutionSpec toSpec(final GeometricSolution solution)
            throws NoninvertibleTransformException {

        SplineControlPointSpec splines = null;
        final ControlPoints controlPoints = solution.getControlPoints();
        if ((controlPoints != null) &&
            (solution.getImageToNative() instanceof SurfaceSplineTransform) &&
            (solution.getNativeToImage() instanceof SurfaceSplineTransform)) {
            splines = new SplineControlPointSpec(controlPoints.getImagePoints(),
                                                 controlPoints.getNativePoints(),
                                                 controlPoints.getWeights(),
                                                 ((SurfaceSplineTransform) solution.getImageToNative()).getParameters(),
                                                 ((SurfaceSplineTransform) solution.getNativeToImage()).getParameters());
        }

        return new AstrometricSolutionSpec(solution.getWidth(),
                                           solution.getHeight(),
                                           solution.getCenter().getRa(),
                                           solution.getCenter().getDec(),
                                           solution.getResolution(),
                                           toWcs(solution),
                                           splines);
    }

    /**
     * Rebuilds a solution, refitting its splines from the persisted control points.
     *
     * @throws IllegalArgumentException
     *   if the persisted solution does not describe a supported projection and linear mapping.
     * @throws TransformFitException
     *   if the splines cannot be refitted.
     * @throws NoninvertibleTransformException
     *   if the linear mapping is singular.
     */
    public static GeometricSolution fromSpec(final AstrometricSolutionSpec spec)
            throws IllegalArgumentException, TransformFitException, NoninvertibleTransformException {

        if (spec.getWcs() == null) {
            throw new IllegalArgumentException("persisted solution has no WCS keywords");
        }

        final Projection projection = ProjectionType.fromWcs(spec.getWcs());
        final LinearTransform linear = toLinearTransform(spec.getWcs(), spec.getHeight());

        final GeometricSolution.Builder builder = new GeometricSolution.Builder()
                .projection(projection)
                .size(spec.getWidth(), spec.getHeight())
                .center(projection.getReferencePoint());

        final SplineControlPointSpec splines = spec.getSplines();
        if (splines == null) {
            builder.linear(linear, linear.inverse());
        } else {
            final SurfaceSplineTransform imageToNative =
                    SurfaceSplineTransform.fit(splines.getImagePoints(),
                                               splines.getNativePoints(),
                                               splines.getWeights(),
                                               splines.getImageToNativeParameters());
            final SurfaceSplineTransform nativeToImage =
                    SurfaceSplineTransform.fit(splines.getNativePoints(),
                                               splines.getImagePoints(),
                                               splines.getWeights(),
                                               splines.getNativeToImageParameters());
            builder.spline(imageToNative,
                           linear,
                           nativeToImage,
                           new ControlPoints(splines.getImagePoints(),
                                             splines.getNativePoints(),
                                             splines.getWeights()));
        }

        final GeometricSolution provisional = builder.build();

        final CelestialPoint center;
        if ((spec.getCenterRa() != null) && (spec.getCenterDec() != null)) {
            center = new CelestialPoint(spec.getCenterRa(), spec.getCenterDec());
        } else {
            center = provisional.imageToSky(provisional.getImageCenter());
        }
        if (center == null) {
            throw new IllegalArgumentException("image center lies outside the " + projection.getType() +
                                               " projection domain");
        }

        final double resolution = spec.getResolution() == null ?
                                  (linear.getScaleX() + linear.getScaleY()) / 2.0 :
                                  spec.getResolution();

        final GeometricSolution solution = provisional.toBuilder()
                .center(center)
                .resolution(resolution)
                .build();

        LOG.debug("fromSpec: rebuilt {}", solution);

        return solution;
    }

    private static final Logger LOG = LoggerFactory.getLogger(WcsSolutionConverter.class);
}
