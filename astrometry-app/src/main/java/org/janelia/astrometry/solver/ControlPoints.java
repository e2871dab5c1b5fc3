package org.janelia.astrometry.solver;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Image/native point pairs a spline solution was fitted to.
 * Pairs with a missing side are dropped on construction, the order of the rest is preserved.
 */
public class ControlPoints
        implements Serializable {

    private final List<PlanePoint> imagePoints;
    private final List<PlanePoint> nativePoints;
    private final double[] weights;

    /**
     * @param  imagePoints   image positions (corner origin pixels).
     * @param  nativePoints  index aligned native plane positions.
     * @param  weights       optional index aligned weights (null for uniform weights).
     */
    public ControlPoints(final List<PlanePoint> imagePoints,
                         final List<PlanePoint> nativePoints,
                         final double[] weights)
            throws IllegalArgumentException {

        if (imagePoints.size() != nativePoints.size()) {
            throw new IllegalArgumentException("control point lists differ in size (" + imagePoints.size() +
                                               " versus " + nativePoints.size() + ")");
        }
        if ((weights != null) && (weights.length != imagePoints.size())) {
            throw new IllegalArgumentException("weight count " + weights.length +
                                               " does not match control point count " + imagePoints.size());
        }

        final List<PlanePoint> keptImage = new ArrayList<>(imagePoints.size());
        final List<PlanePoint> keptNative = new ArrayList<>(imagePoints.size());
        final double[] keptWeights = weights == null ? null : new double[weights.length];
        for (int i = 0; i < imagePoints.size(); i++) {
            if ((imagePoints.get(i) != null) && (nativePoints.get(i) != null)) {
                if (keptWeights != null) {
                    keptWeights[keptImage.size()] = weights[i];
                }
                keptImage.add(imagePoints.get(i));
                keptNative.add(nativePoints.get(i));
            }
        }

        this.imagePoints = Collections.unmodifiableList(keptImage);
        this.nativePoints = Collections.unmodifiableList(keptNative);
        this.weights = keptWeights == null ? null : Arrays.copyOf(keptWeights, keptImage.size());
    }

    public List<PlanePoint> getImagePoints() {
        return imagePoints;
    }

    public List<PlanePoint> getNativePoints() {
        return nativePoints;
    }

    /**
     * @return copy of the weights, or null for uniform weights.
     */
    public double[] getWeights() {
        return weights == null ? null : weights.clone();
    }

    public int size() {
        return imagePoints.size();
    }
}
