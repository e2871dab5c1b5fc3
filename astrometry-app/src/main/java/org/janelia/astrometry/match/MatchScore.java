package org.janelia.astrometry.match;

import java.io.Serializable;

/**
 * Quality summary of the matches between predicted and detected star positions.
 * Higher scores are better: score = round3(numValid / (1 + rms)).
 */
public class MatchScore
        implements Serializable {

    private final int numValid;
    private final int numRejected;
    private final double rms;
    private final double score;
    private final double medianError;
    private final double sigmaError;
    private final double peakError;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MatchScore() {
        this(0, 0, 0, 0, 0, 0);
    }

    public MatchScore(final int numValid,
                      final int numRejected,
                      final double rms,
                      final double medianError,
                      final double sigmaError,
                      final double peakError) {
        this.numValid = numValid;
        this.numRejected = numRejected;
        this.rms = rms;
        this.score = computeScore(numValid, rms);
        this.medianError = medianError;
        this.sigmaError = sigmaError;
        this.peakError = peakError;
    }

    /**
     * @param  errors  per pair distance (pixels) between predicted and matched positions.
     *
     * @return score for the specified matching errors.
     */
    public static MatchScore fromErrors(final double[] errors,
                                        final int numRejected) {
        double sum2 = 0;
        double peak = 0;
        for (final double e : errors) {
            sum2 += e * e;
            peak = Math.max(peak, e);
        }
        final double rms = errors.length > 0 ? Math.sqrt(sum2 / errors.length) : 0;
        final double median = RobustStatistics.median(errors);
        final double sigma = Math.sqrt(RobustStatistics.biweightMidvariance(errors, median));
        return new MatchScore(errors.length, numRejected, rms, median, sigma, peak);
    }

    public static double computeScore(final int numValid,
                                      final double rms) {
        return Math.round(numValid / (1.0 + rms) * 1000.0) / 1000.0;
    }

    public int getNumValid() {
        return numValid;
    }

    public int getNumRejected() {
        return numRejected;
    }

    public double getRms() {
        return rms;
    }

    public double getScore() {
        return score;
    }

    public double getMedianError() {
        return medianError;
    }

    public double getSigmaError() {
        return sigmaError;
    }

    public double getPeakError() {
        return peakError;
    }

    @Override
    public String toString() {
        return String.format("{score: %.3f, matched: %d, rejected: %d, rms: %.3f px, median: %.2f px, " +
                             "sigma: %.2f px, peak: %.2f px}",
                             score, numValid, numRejected, rms, medianError, sigmaError, peakError);
    }
}
