package org.janelia.astrometry.service;

import java.io.Serializable;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Star found in the image: its centroid (corner origin pixels), the size of its detection box and its flux.
 */
public class DetectedStar
        implements Serializable {

    private final double x;
    private final double y;
    private final double boxWidth;
    private final double boxHeight;
    private final double flux;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private DetectedStar() {
        this(0.0, 0.0, 0.0, 0.0, 0.0);
    }

    public DetectedStar(final double x,
                        final double y,
                        final double boxWidth,
                        final double boxHeight,
                        final double flux) {
        this.x = x;
        this.y = y;
        this.boxWidth = boxWidth;
        this.boxHeight = boxHeight;
        this.flux = flux;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    public PlanePoint getPosition() {
        return new PlanePoint(x, y);
    }

    public double getBoxWidth() {
        return boxWidth;
    }

    public double getBoxHeight() {
        return boxHeight;
    }

    public double getMinimumBoxSide() {
        return Math.min(boxWidth, boxHeight);
    }

    public double getFlux() {
        return flux;
    }

    public DetectedStar withPosition(final double x,
                                     final double y) {
        return new DetectedStar(x, y, boxWidth, boxHeight, flux);
    }

    @Override
    public String toString() {
        return "{x: " + x + ", y: " + y + ", box: " + boxWidth + "x" + boxHeight + ", flux: " + flux + '}';
    }
}
