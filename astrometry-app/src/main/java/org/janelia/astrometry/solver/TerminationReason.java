package org.janelia.astrometry.solver;

/**
 * Why a solve stopped.
 */
public enum TerminationReason {

    /** The configured number of consecutive iterations passed without a better score. */
    NO_IMPROVEMENT,

    /** The iteration cap was reached (the best solution is still returned). */
    MAX_ITERATIONS,

    /** Cancellation was requested between iterations or before any alignment cell succeeded. */
    CANCELLED,

    /** An iteration could not be fitted or evaluated (the best prior solution is returned). */
    ITERATION_FAILED,

    /** Optimization was disabled so the initial alignment is the result. */
    OPTIMIZATION_DISABLED,

    /** No initial solution could be established. */
    ALIGNMENT_FAILED
}
