package org.janelia.astrometry.wcs;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.io.StringReader;
import java.io.Writer;

import org.janelia.astrometry.json.JsonUtils;

/**
 * Persisted form of an astrometric solution: WCS keywords for the linear part plus,
 * for distortion corrected solutions, the control points needed to rebuild the splines.
 */
public class AstrometricSolutionSpec
        implements Serializable {

    private final int width;
    private final int height;
    private final Double centerRa;
    private final Double centerDec;
    private final Double resolution;
    private final WcsKeywords wcs;
    private final SplineControlPointSpec splines;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private AstrometricSolutionSpec() {
        this(0, 0, null, null, null, null, null);
    }

    public AstrometricSolutionSpec(final int width,
                                   final int height,
                                   final Double centerRa,
                                   final Double centerDec,
                                   final Double resolution,
                                   final WcsKeywords wcs,
                                   final SplineControlPointSpec splines) {
        this.width = width;
        this.height = height;
        this.centerRa = centerRa;
        this.centerDec = centerDec;
        this.resolution = resolution;
        this.wcs = wcs;
        this.splines = splines;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public Double getCenterRa() {
        return centerRa;
    }

    public Double getCenterDec() {
        return centerDec;
    }

    /**
     * @return image scale in degrees per pixel.
     */
    public Double getResolution() {
        return resolution;
    }

    public WcsKeywords getWcs() {
        return wcs;
    }

    /**
     * @return spline extension, or null for linear solutions.
     */
    public SplineControlPointSpec getSplines() {
        return splines;
    }

    public boolean hasSplines() {
        return splines != null;
    }

    public String toJson() {
        return JSON_HELPER.toJson(this);
    }

    public void writeJson(final Writer writer)
            throws IOException {
        JSON_HELPER.writeJson(this, writer);
    }

    public static AstrometricSolutionSpec fromJson(final String json) {
        return JSON_HELPER.fromJson(new StringReader(json));
    }

    public static AstrometricSolutionSpec fromJson(final Reader json) {
        return JSON_HELPER.fromJson(json);
    }

    private static final JsonUtils.Helper<AstrometricSolutionSpec> JSON_HELPER =
            new JsonUtils.Helper<>(AstrometricSolutionSpec.class);
}
