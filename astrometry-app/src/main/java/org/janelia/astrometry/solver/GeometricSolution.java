package org.janelia.astrometry.solver;

import java.io.Serializable;

import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.MatchScore;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.transform.LinearTransform;
import org.janelia.astrometry.transform.PointTransform;

/**
 * Immutable snapshot of an astrometric solution: the projection, the transforms between image
 * (corner origin pixels) and native plane coordinates, and the derived image center and scale.
 *
 * Derived solutions are built with {@link #toBuilder()} so that previously accepted snapshots are never changed.
 */
public class GeometricSolution
        implements Serializable {

    private final Projection projection;
    private final int width;
    private final int height;
    private final PointTransform imageToNative;
    private final LinearTransform linearImageToNative;
    private final PointTransform nativeToImage;
    private final CelestialPoint center;
    private final double resolution;
    private final ControlPoints controlPoints;
    private final MatchScore score;
    private final int iteration;

    private GeometricSolution(final Builder builder) {
        this.projection = builder.projection;
        this.width = builder.width;
        this.height = builder.height;
        this.imageToNative = builder.imageToNative;
        this.linearImageToNative = builder.linearImageToNative;
        this.nativeToImage = builder.nativeToImage;
        this.center = builder.center;
        this.resolution = builder.resolution;
        this.controlPoints = builder.controlPoints;
        this.score = builder.score;
        this.iteration = builder.iteration;
    }

    public Projection getProjection() {
        return projection;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public PlanePoint getImageCenter() {
        return new PlanePoint(width / 2.0, height / 2.0);
    }

    public PointTransform getImageToNative() {
        return imageToNative;
    }

    /**
     * @return linear approximation of the image to native transform (the transform itself for linear solutions).
     */
    public LinearTransform getLinearImageToNative() {
        return linearImageToNative;
    }

    public PointTransform getNativeToImage() {
        return nativeToImage;
    }

    public CelestialPoint getCenter() {
        return center;
    }

    /**
     * @return image scale in degrees per pixel.
     */
    public double getResolution() {
        return resolution;
    }

    /**
     * @return control points of a spline solution, or null for a linear solution.
     */
    public ControlPoints getControlPoints() {
        return controlPoints;
    }

    public boolean hasSplineTransforms() {
        return controlPoints != null;
    }

    /**
     * @return score of the star matches for this solution, or null if it has not been evaluated.
     */
    public MatchScore getScore() {
        return score;
    }

    public int getIteration() {
        return iteration;
    }

    /**
     * @return celestial position of the specified image point, or null if it has none.
     */
    public CelestialPoint imageToSky(final PlanePoint imagePoint) {
        final PlanePoint nativePoint = imageToNative.apply(imagePoint);
        return nativePoint == null ? null : projection.inverse(nativePoint);
    }

    /**
     * @return image position of the specified celestial point, or null if it cannot be projected.
     */
    public PlanePoint skyToImage(final CelestialPoint celestialPoint) {
        final PlanePoint nativePoint = projection.direct(celestialPoint);
        return nativePoint == null ? null : nativeToImage.apply(nativePoint);
    }

    /**
     * Measures how far this solution moved relative to a previous one using the displacement
     * of the image center and of the top left image corner.
     *
     * @return larger of the two displacements in arcseconds.
     */
    public double deltaArcsec(final GeometricSolution previous) {
        final PlanePoint corner = new PlanePoint(0, 0);
        final CelestialPoint thisCorner = imageToSky(corner);
        final CelestialPoint previousCorner = previous.imageToSky(corner);

        double cornerDelta = 0;
        if ((thisCorner != null) && (previousCorner != null)) {
            cornerDelta = displacementArcsec(previousCorner, thisCorner);
        }
        final double centerDelta = displacementArcsec(previous.center, center);

        return Math.max(cornerDelta, centerDelta);
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public String toString() {
        return "{center: " + center + ", resolution: " + (resolution * 3600.0) + " arcsec/px, projection: " +
               projection.getType() + ", spline: " + hasSplineTransforms() + ", score: " + score +
               ", iteration: " + iteration + '}';
    }

    private static double displacementArcsec(final CelestialPoint from,
                                             final CelestialPoint to) {
        final double dRa = from.raDelta(to) * Math.cos(Math.toRadians(to.getDec()));
        final double dDec = to.getDec() - from.getDec();
        return Math.sqrt(dRa * dRa + dDec * dDec) * 3600.0;
    }

    public static class Builder {

        private Projection projection;
        private int width;
        private int height;
        private PointTransform imageToNative;
        private LinearTransform linearImageToNative;
        private PointTransform nativeToImage;
        private CelestialPoint center;
        private double resolution;
        private ControlPoints controlPoints;
        private MatchScore score;
        private int iteration;

        public Builder() {
        }

        private Builder(final GeometricSolution solution) {
            this.projection = solution.projection;
            this.width = solution.width;
            this.height = solution.height;
            this.imageToNative = solution.imageToNative;
            this.linearImageToNative = solution.linearImageToNative;
            this.nativeToImage = solution.nativeToImage;
            this.center = solution.center;
            this.resolution = solution.resolution;
            this.controlPoints = solution.controlPoints;
            this.score = solution.score;
            this.iteration = solution.iteration;
        }

        public Builder projection(final Projection projection) {
            this.projection = projection;
            return this;
        }

        public Builder size(final int width,
                            final int height) {
            this.width = width;
            this.height = height;
            return this;
        }

        /**
         * Sets a linear solution: the linear transform serves as image to native transform
         * and its inverse as native to image transform.  Control points are cleared.
         */
        public Builder linear(final LinearTransform imageToNative,
                              final LinearTransform nativeToImage) {
            this.imageToNative = imageToNative;
            this.linearImageToNative = imageToNative;
            this.nativeToImage = nativeToImage;
            this.controlPoints = null;
            return this;
        }

        public Builder spline(final PointTransform imageToNative,
                              final LinearTransform linearImageToNative,
                              final PointTransform nativeToImage,
                              final ControlPoints controlPoints) {
            this.imageToNative = imageToNative;
            this.linearImageToNative = linearImageToNative;
            this.nativeToImage = nativeToImage;
            this.controlPoints = controlPoints;
            return this;
        }

        public Builder center(final CelestialPoint center) {
            this.center = center;
            return this;
        }

        public Builder resolution(final double resolution) {
            this.resolution = resolution;
            return this;
        }

        public Builder score(final MatchScore score) {
            this.score = score;
            return this;
        }

        public Builder iteration(final int iteration) {
            this.iteration = iteration;
            return this;
        }

        public GeometricSolution build()
                throws IllegalStateException {
            if ((projection == null) || (imageToNative == null) || (linearImageToNative == null) ||
                (nativeToImage == null) || (center == null)) {
                throw new IllegalStateException("solution requires a projection, transforms and a center");
            }
            if ((width < 1) || (height < 1)) {
                throw new IllegalStateException("solution requires positive image dimensions");
            }
            return new GeometricSolution(this);
        }
    }
}
