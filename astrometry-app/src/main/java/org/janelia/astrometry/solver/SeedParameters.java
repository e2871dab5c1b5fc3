package org.janelia.astrometry.solver;

import java.io.Serializable;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Approximate image center and scale used to start a solve.
 *
 * The scale is given either directly as a resolution (degrees per pixel) or
 * as a focal length (millimeters) with a pixel size (micrometers).
 */
public class SeedParameters
        implements Serializable {

    private final double ra;
    private final double dec;
    private final Double resolution;
    private final Double focalLength;
    private final Double pixelSize;
    private final int width;
    private final int height;

    public SeedParameters(final double ra,
                          final double dec,
                          final double resolution,
                          final int width,
                          final int height) {
        this(ra, dec, resolution, null, null, width, height);
    }

    private SeedParameters(final double ra,
                           final double dec,
                           final Double resolution,
                           final Double focalLength,
                           final Double pixelSize,
                           final int width,
                           final int height) {
        this.ra = ra;
        this.dec = dec;
        this.resolution = resolution;
        this.focalLength = focalLength;
        this.pixelSize = pixelSize;
        this.width = width;
        this.height = height;
    }

    public static SeedParameters fromFocalLength(final double ra,
                                                 final double dec,
                                                 final double focalLength,
                                                 final double pixelSize,
                                                 final int width,
                                                 final int height) {
        return new SeedParameters(ra, dec, null, focalLength, pixelSize, width, height);
    }

    /**
     * @throws SeedInvalidException
     *   if any value is missing or out of range.
     */
    public void validate()
            throws SeedInvalidException {

        if ((! Double.isFinite(ra)) || (! Double.isFinite(dec)) || (dec < -90.0) || (dec > 90.0)) {
            throw new SeedInvalidException("seed center (" + ra + ", " + dec + ") is not a valid celestial position");
        }
        if ((width < 1) || (height < 1)) {
            throw new SeedInvalidException("seed image dimensions must be positive (" + width + "x" + height + ")");
        }
        if (resolution == null) {
            if ((focalLength == null) || (pixelSize == null) || (! (focalLength > 0)) || (! (pixelSize > 0))) {
                throw new SeedInvalidException("seed must specify a positive resolution or " +
                                               "a positive focal length with a positive pixel size");
            }
        } else if ((! (resolution > 0)) || (! Double.isFinite(resolution))) {
            throw new SeedInvalidException("seed resolution must be positive (" + resolution + ")");
        }

        final double fov = getResolution() * Math.max(width, height);
        if (fov >= 180.0) {
            throw new SeedInvalidException("seed field of view (" + fov + " degrees) is too large");
        }
    }

    public CelestialPoint getCenter() {
        return new CelestialPoint(ra, dec);
    }

    /**
     * @return image scale in degrees per pixel.
     */
    public double getResolution() {
        if (resolution != null) {
            return resolution;
        }
        return resolutionFromFocalLength(focalLength, pixelSize);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @param  focalLength  focal length in millimeters.
     * @param  pixelSize    pixel size in micrometers.
     *
     * @return image scale in degrees per pixel.
     */
    public static double resolutionFromFocalLength(final double focalLength,
                                                   final double pixelSize) {
        return Math.toDegrees(Math.atan2(pixelSize / 1000.0, focalLength));
    }

    @Override
    public String toString() {
        return "{center: (" + ra + ", " + dec + "), resolution: " +
               (resolution != null || focalLength != null ? getResolution() * 3600.0 + " arcsec/px" : null) +
               ", size: " + width + "x" + height + '}';
    }
}
