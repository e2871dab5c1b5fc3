package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;

/**
 * Outcome of {@link ImageSolver#solve}.
 */
public class SolveResult {

    private final SolverState state;
    private final GeometricSolution solution;
    private final TerminationReason terminationReason;
    private final int iterations;
    private final List<IterationSummary> history;
    private final List<String> warnings;
    private final AstrometryException error;

    public SolveResult(final SolverState state,
                       final GeometricSolution solution,
                       final TerminationReason terminationReason,
                       final int iterations,
                       final List<IterationSummary> history,
                       final List<String> warnings,
                       final AstrometryException error) {
        this.state = state;
        this.solution = solution;
        this.terminationReason = terminationReason;
        this.iterations = iterations;
        this.history = Collections.unmodifiableList(new ArrayList<>(history));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.error = error;
    }

    public static SolveResult failed(final AstrometryException error,
                                     final List<String> warnings) {
        return new SolveResult(SolverState.FAILED, null, TerminationReason.ALIGNMENT_FAILED, 0,
                               Collections.emptyList(), warnings, error);
    }

    /**
     * @return result for a solve that was cancelled before an initial solution was found.
     */
    public static SolveResult cancelled(final SolverState state,
                                        final SolveCancelledException error,
                                        final List<String> warnings) {
        return new SolveResult(state, null, TerminationReason.CANCELLED, 0, Collections.emptyList(), warnings, error);
    }

    public SolverState getState() {
        return state;
    }

    public boolean isSolved() {
        return solution != null;
    }

    /**
     * @return best solution found, or null if the image could not be solved.
     */
    public GeometricSolution getSolution() {
        return solution;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public int getIterations() {
        return iterations;
    }

    public List<IterationSummary> getHistory() {
        return history;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    /**
     * @return failure that stopped the solve (or ended optimization early), or null.
     */
    public AstrometryException getError() {
        return error;
    }

    @Override
    public String toString() {
        return "{state: " + state + ", terminationReason: " + terminationReason + ", iterations: " + iterations +
               ", solution: " + solution + ", warnings: " + warnings +
               (error == null ? "" : ", error: " + error.getMessage()) + '}';
    }
}
