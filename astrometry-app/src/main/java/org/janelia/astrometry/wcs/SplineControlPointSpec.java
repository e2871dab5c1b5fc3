package org.janelia.astrometry.wcs;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.transform.SplineFitParameters;

/**
 * Control points and fit settings that reproduce the spline transforms of a solution.
 */
public class SplineControlPointSpec
        implements Serializable {

    private final List<PlanePoint> imagePoints;
    private final List<PlanePoint> nativePoints;
    private final double[] weights;
    private final SplineFitParameters imageToNativeParameters;
    private final SplineFitParameters nativeToImageParameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private SplineControlPointSpec() {
        this.imagePoints = new ArrayList<>();
        this.nativePoints = new ArrayList<>();
        this.weights = null;
        this.imageToNativeParameters = null;
        this.nativeToImageParameters = null;
    }

    public SplineControlPointSpec(final List<PlanePoint> imagePoints,
                                  final List<PlanePoint> nativePoints,
                                  final double[] weights,
                                  final SplineFitParameters imageToNativeParameters,
                                  final SplineFitParameters nativeToImageParameters) {
        this.imagePoints = new ArrayList<>(imagePoints);
        this.nativePoints = new ArrayList<>(nativePoints);
        this.weights = weights == null ? null : weights.clone();
        this.imageToNativeParameters = imageToNativeParameters;
        this.nativeToImageParameters = nativeToImageParameters;
    }

    /**
     * @return image (corner origin) control point positions.
     */
    public List<PlanePoint> getImagePoints() {
        return Collections.unmodifiableList(imagePoints);
    }

    public List<PlanePoint> getNativePoints() {
        return Collections.unmodifiableList(nativePoints);
    }

    public double[] getWeights() {
        return weights == null ? null : weights.clone();
    }

    public SplineFitParameters getImageToNativeParameters() {
        return imageToNativeParameters;
    }

    public SplineFitParameters getNativeToImageParameters() {
        return nativeToImageParameters;
    }

    public int size() {
        return imagePoints.size();
    }
}
