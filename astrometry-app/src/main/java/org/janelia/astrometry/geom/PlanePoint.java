package org.janelia.astrometry.geom;

import java.io.Serializable;

/**
 * Two dimensional point used both for projected (native plane, degrees) and image (pixel) coordinates.
 *
 * Image coordinates use the {@link PixelConvention#CORNER_ORIGIN} convention unless explicitly stated otherwise.
 */
public class PlanePoint
        implements Serializable {

    private final double x;
    private final double y;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private PlanePoint() {
        this(0.0, 0.0);
    }

    public PlanePoint(final double x,
                      final double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public PlanePoint plus(final double dx,
                           final double dy) {
        return new PlanePoint(x + dx, y + dy);
    }

    public double distance(final PlanePoint that) {
        return Math.hypot(that.x - x, that.y - y);
    }

    public double distanceSquared(final PlanePoint that) {
        final double dx = that.x - x;
        final double dy = that.y - y;
        return dx * dx + dy * dy;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final PlanePoint that = (PlanePoint) o;
        return (Double.compare(that.x, x) == 0) && (Double.compare(that.y, y) == 0);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
