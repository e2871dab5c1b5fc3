package org.janelia.astrometry.service;

import java.io.Serializable;

import org.janelia.astrometry.geom.ImageRegion;

/**
 * Identifies the image being solved.
 * Pixel data stays with the collaborating services; the solver only needs the geometry.
 */
public class SourceImage
        implements Serializable {

    private final String name;
    private final int width;
    private final int height;

    public SourceImage(final String name,
                       final int width,
                       final int height)
            throws IllegalArgumentException {
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("image dimensions must be positive (" + width + "x" + height + ")");
        }
        this.name = name;
        this.width = width;
        this.height = height;
    }

    public String getName() {
        return name;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public ImageRegion getBounds() {
        return ImageRegion.forImage(width, height);
    }

    @Override
    public String toString() {
        return name + " (" + width + "x" + height + ")";
    }
}
