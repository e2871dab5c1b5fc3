package org.janelia.astrometry;

/**
 * Base class for all checked failures raised while solving an image.
 *
 * When a failure happens inside the iterative optimizer, the iteration number and
 * the best score known at the time are attached so that callers can report how far
 * the solve progressed.
 */
public class AstrometryException
        extends Exception {

    private Integer iteration;
    private Double bestScore;

    public AstrometryException(final String message) {
        super(message);
    }

    public AstrometryException(final String message,
                               final Throwable cause) {
        super(message, cause);
    }

    /**
     * @return iteration in which this failure occurred (or null if it occurred outside the optimizer).
     */
    public Integer getIteration() {
        return iteration;
    }

    /**
     * @return best solution score known when this failure occurred (or null if no solution was scored yet).
     */
    public Double getBestScore() {
        return bestScore;
    }

    /**
     * Tags this failure with optimizer progress information.
     *
     * @return this exception (for chaining).
     */
    public AstrometryException withProgress(final Integer iteration,
                                            final Double bestScore) {
        this.iteration = iteration;
        this.bestScore = bestScore;
        return this;
    }

    @Override
    public String getMessage() {
        final String message = super.getMessage();
        if (iteration == null) {
            return message;
        }
        return message + " (iteration " + iteration + ", best score " + bestScore + ")";
    }
}
