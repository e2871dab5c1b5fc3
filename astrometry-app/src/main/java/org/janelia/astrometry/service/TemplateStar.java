package org.janelia.astrometry.service;

import java.io.Serializable;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Synthetic star in a reference template.
 */
public class TemplateStar
        implements Serializable {

    private final double x;
    private final double y;
    private final double flux;

    public TemplateStar(final double x,
                        final double y,
                        final double flux) {
        this.x = x;
        this.y = y;
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

    public double getFlux() {
        return flux;
    }

    @Override
    public String toString() {
        return "{x: " + x + ", y: " + y + ", flux: " + flux + '}';
    }
}
