package org.janelia.astrometry.geom;

import java.io.Serializable;

/**
 * Axis aligned rectangle in image coordinates.
 */
public class ImageRegion
        implements Serializable {

    private final double x0;
    private final double y0;
    private final double x1;
    private final double y1;

    public ImageRegion(final double x0,
                       final double y0,
                       final double x1,
                       final double y1)
            throws IllegalArgumentException {
        if ((x1 <= x0) || (y1 <= y0)) {
            throw new IllegalArgumentException("empty region [" + x0 + ", " + y0 + ", " + x1 + ", " + y1 + "]");
        }
        this.x0 = x0;
        this.y0 = y0;
        this.x1 = x1;
        this.y1 = y1;
    }

    public static ImageRegion forImage(final int width,
                                       final int height) {
        return new ImageRegion(0, 0, width, height);
    }

    public double getX0() {
        return x0;
    }

    public double getY0() {
        return y0;
    }

    public double getX1() {
        return x1;
    }

    public double getY1() {
        return y1;
    }

    public double getWidth() {
        return x1 - x0;
    }

    public double getHeight() {
        return y1 - y0;
    }

    public PlanePoint getCenter() {
        return new PlanePoint((x0 + x1) / 2.0, (y0 + y1) / 2.0);
    }

    /**
     * @return true if the specified point lies strictly inside this region.
     */
    public boolean contains(final PlanePoint point) {
        return (point != null) && contains(point.getX(), point.getY());
    }

    public boolean contains(final double x,
                            final double y) {
        return (x > x0) && (x < x1) && (y > y0) && (y < y1);
    }

    @Override
    public String toString() {
        return "[" + x0 + ", " + y0 + ", " + x1 + ", " + y1 + "]";
    }
}
