package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;

/**
 * Outcome of an {@link IterativeOptimizer} run.
 */
public class OptimizationResult {

    private final GeometricSolution bestSolution;
    private final TerminationReason terminationReason;
    private final int iterations;
    private final List<IterationSummary> history;
    private final AstrometryException error;

    public OptimizationResult(final GeometricSolution bestSolution,
                              final TerminationReason terminationReason,
                              final int iterations,
                              final List<IterationSummary> history,
                              final AstrometryException error) {
        this.bestSolution = bestSolution;
        this.terminationReason = terminationReason;
        this.iterations = iterations;
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
        this.error = error;
    }

    /**
     * @return historically best solution (not necessarily the one from the last iteration).
     */
    public GeometricSolution getBestSolution() {
        return bestSolution;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    /**
     * @return number of completed iterations.
     */
    public int getIterations() {
        return iterations;
    }

    public List<IterationSummary> getHistory() {
        return history;
    }

    /**
     * @return failure that ended optimization early, or null.
     */
    public AstrometryException getError() {
        return error;
    }
}
