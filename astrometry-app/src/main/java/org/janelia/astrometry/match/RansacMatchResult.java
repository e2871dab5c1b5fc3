package org.janelia.astrometry.match;

import java.util.Arrays;

import org.janelia.astrometry.transform.LinearTransform;

/**
 * Best consensus set found by a {@link RansacPointMatcher}.
 */
public class RansacMatchResult {

    private final int[] inlierIndexes;
    private final LinearTransform transform;
    private final double quality;
    private final double rms;
    private final int iterations;

    public RansacMatchResult(final int[] inlierIndexes,
                             final LinearTransform transform,
                             final double quality,
                             final double rms,
                             final int iterations) {
        this.inlierIndexes = inlierIndexes;
        this.transform = transform;
        this.quality = quality;
        this.rms = rms;
        this.iterations = iterations;
    }

    /**
     * @return sorted indexes (into the matched lists) of the consensus pairs.
     */
    public int[] getInlierIndexes() {
        return inlierIndexes.clone();
    }

    public int getNumberOfInliers() {
        return inlierIndexes.length;
    }

    /**
     * @return similarity transform mapping predicted positions onto observed positions.
     */
    public LinearTransform getTransform() {
        return transform;
    }

    /**
     * @return weighted consensus quality used to rank candidate sets.
     */
    public double getQuality() {
        return quality;
    }

    /**
     * @return RMS residual of the consensus pairs.
     */
    public double getRms() {
        return rms;
    }

    public int getIterations() {
        return iterations;
    }

    @Override
    public String toString() {
        return "{inliers: " + inlierIndexes.length + ", quality: " + quality + ", rms: " + rms +
               ", iterations: " + iterations + ", first: " +
               Arrays.toString(Arrays.copyOf(inlierIndexes, Math.min(5, inlierIndexes.length))) + '}';
    }
}
