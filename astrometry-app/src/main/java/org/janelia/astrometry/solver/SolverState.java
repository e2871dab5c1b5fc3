package org.janelia.astrometry.solver;

/**
 * Stages of a solve.
 */
public enum SolverState {
    SEED,
    ALIGNED,
    OPTIMIZING,
    CONVERGED,
    FAILED
}
