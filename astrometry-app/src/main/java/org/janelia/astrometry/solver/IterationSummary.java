package org.janelia.astrometry.solver;

/**
 * Progress record for one optimizer iteration.
 */
public class IterationSummary {

    private final int iteration;
    private final double score;
    private final double bestScore;
    private final double deltaArcsec;
    private final double rms;
    private final int numValid;

    public IterationSummary(final int iteration,
                            final double score,
                            final double bestScore,
                            final double deltaArcsec,
                            final double rms,
                            final int numValid) {
        this.iteration = iteration;
        this.score = score;
        this.bestScore = bestScore;
        this.deltaArcsec = deltaArcsec;
        this.rms = rms;
        this.numValid = numValid;
    }

    public int getIteration() {
        return iteration;
    }

    public double getScore() {
        return score;
    }

    /**
     * @return best score known after this iteration.
     */
    public double getBestScore() {
        return bestScore;
    }

    /**
     * @return solution displacement relative to the previous iteration.
     */
    public double getDeltaArcsec() {
        return deltaArcsec;
    }

    public double getRms() {
        return rms;
    }

    public int getNumValid() {
        return numValid;
    }

    @Override
    public String toString() {
        return "{iteration: " + iteration + ", score: " + score + ", bestScore: " + bestScore +
               ", deltaArcsec: " + deltaArcsec + ", rms: " + rms + ", numValid: " + numValid + '}';
    }
}
