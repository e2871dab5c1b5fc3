package org.janelia.astrometry.geom;

/**
 * Pixel coordinate conventions.
 * Image coordinates are never mixed between conventions without an explicit conversion.
 */
public enum PixelConvention {

    /** The top-left corner of the first pixel is (0,0); the center of pixel (i,j) is (i+0.5, j+0.5). */
    CORNER_ORIGIN(0.0),

    /** Pixel index coordinates: the center of the first pixel is (0,0). */
    CENTER_ORIGIN(0.5);

    private final double offsetToCornerOrigin;

    PixelConvention(final double offsetToCornerOrigin) {
        this.offsetToCornerOrigin = offsetToCornerOrigin;
    }

    /**
     * @return the specified point (expressed in this convention) converted to {@link #CORNER_ORIGIN} coordinates.
     */
    public PlanePoint toCornerOrigin(final PlanePoint point) {
        return point == null ? null : point.plus(offsetToCornerOrigin, offsetToCornerOrigin);
    }

    /**
     * @return the specified {@link #CORNER_ORIGIN} point converted to this convention.
     */
    public PlanePoint fromCornerOrigin(final PlanePoint point) {
        return point == null ? null : point.plus(-offsetToCornerOrigin, -offsetToCornerOrigin);
    }
}
