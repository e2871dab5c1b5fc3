package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.NoninvertibleTransformException;
import org.janelia.astrometry.transform.TransformFitException;

/**
 * Maps reference template pixels onto the native plane of a projection.
 */
public class TemplateGeometry {

    private final Projection projection;
    private final LinearTransform templateToNative;
    private final LinearTransform nativeToTemplate;
    private final int width;
    private final int height;

    public TemplateGeometry(final Projection projection,
                            final LinearTransform templateToNative,
                            final int width,
                            final int height)
            throws NoninvertibleTransformException {
        this.projection = projection;
        this.templateToNative = templateToNative;
        this.nativeToTemplate = templateToNative.inverse();
        this.width = width;
        this.height = height;
    }

    /**
     * Builds the geometry of a square template centered on the projection's reference point
     * with north up, east left and the specified scale.
     */
    public static TemplateGeometry forSeed(final Projection projection,
                                           final double resolution,
                                           final int size)
            throws NoninvertibleTransformException {
        final double half = resolution * size / 2.0;
        final LinearTransform templateToNative = new LinearTransform(-resolution, 0, half,
                                                                     0, -resolution, half);
        return new TemplateGeometry(projection, templateToNative, size, size);
    }

    public Projection getProjection() {
        return projection;
    }

    public LinearTransform getTemplateToNative() {
        return templateToNative;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return template position of the specified celestial point, or null if it cannot be projected.
     */
    public PlanePoint toTemplate(final CelestialPoint celestialPoint) {
        final PlanePoint nativePoint = projection.direct(celestialPoint);
        return nativePoint == null ? null : nativeToTemplate.apply(nativePoint);
    }

    /**
     * Estimates the image center from aligned pairs and re-expresses the pairs' native positions
     * in a projection built for that center.
     *
     * @param  pairs              aligned template/image pairs.
     * @param  imageWidth         image width.
     * @param  imageHeight        image height.
     * @param  projectionFactory  builds a projection for an image center.
     * @param  alignedCells       number of image regions the pairs came from.
     *
     * @throws TransformFitException
     *   if the pairs do not determine a usable mapping.
     */
    public ProjectedAlignment project(final AlignmentPairs pairs,
                                      final int imageWidth,
                                      final int imageHeight,
                                      final Function<CelestialPoint, Projection> projectionFactory,
                                      final int alignedCells)
            throws TransformFitException {

        final List<PlanePoint> nativePoints = templateToNative.applyAll(pairs.getTemplatePoints());
        final LinearTransform imageToNative = Homography.fit(pairs.getImagePoints(), nativePoints);
        final CelestialPoint center =
                projection.inverse(imageToNative.apply(new PlanePoint(imageWidth / 2.0, imageHeight / 2.0)));
        if (center == null) {
            throw new TransformFitException("estimated image center lies outside the " +
                                            projection.getType() + " projection domain");
        }

        final Projection centered = projectionFactory.apply(center);
        final List<PlanePoint> centeredNativePoints = new ArrayList<>(nativePoints.size());
        for (final PlanePoint p : nativePoints) {
            final CelestialPoint sky = projection.inverse(p);
            centeredNativePoints.add(sky == null ? null : centered.direct(sky));
        }

        return new ProjectedAlignment(centered, pairs.getImagePoints(), centeredNativePoints, alignedCells);
    }

    @Override
    public String toString() {
        return "{projection: " + projection + ", templateToNative: " + templateToNative +
               ", size: " + width + "x" + height + '}';
    }
}
