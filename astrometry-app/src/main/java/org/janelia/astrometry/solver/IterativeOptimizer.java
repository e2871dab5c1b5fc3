package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.List;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.catalog.CatalogException;
import org.janelia.astrometry.match.MatchScore;
import org.janelia.astrometry.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Repeats refit and evaluate cycles until the score stops improving.
 *
 * Every iteration refits the solution to the latest star matches, evaluates the new solution
 * and remembers it if its score strictly beats the best one seen so far.  Optimization stops after
 * a configured number of consecutive iterations without improvement, at the iteration cap, when
 * cancellation is requested (checked between iterations only) or when an iteration fails.  In every
 * case the best solution seen so far is returned.  Catalog failures are propagated.
 */
public class IterativeOptimizer {

    /** Consecutive non improving iterations after which an active distortion model is dropped. */
    public static final int DISTORTION_MODEL_PATIENCE = 2;

    private final SolutionRefiner refiner;
    private final SolutionEvaluator evaluator;
    private final int maxIterations;
    private final int maxItersNoImprovement;
    private final CancellationSignal cancellationSignal;

    public IterativeOptimizer(final SolutionRefiner refiner,
                              final SolutionEvaluator evaluator,
                              final int maxIterations,
                              final int maxItersNoImprovement,
                              final CancellationSignal cancellationSignal)
            throws IllegalArgumentException {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }
        if (maxItersNoImprovement < 1) {
            throw new IllegalArgumentException("maxItersNoImprovement must be positive");
        }
        this.refiner = refiner;
        this.evaluator = evaluator;
        this.maxIterations = maxIterations;
        this.maxItersNoImprovement = maxItersNoImprovement;
        this.cancellationSignal = cancellationSignal;
    }

    /**
     * @param  initial            evaluated starting solution.
     * @param  initialEvaluation  star matches for the starting solution.
     *
     * @throws CatalogException
     *   if reference stars cannot be loaded for an iteration.
     */
    public OptimizationResult optimize(final GeometricSolution initial,
                                       final StarEvaluation initialEvaluation)
            throws CatalogException {

        final ProcessTimer timer = new ProcessTimer();
        final List<IterationSummary> history = new ArrayList<>();

        GeometricSolution current = initial.toBuilder().score(initialEvaluation.getScore()).build();
        StarEvaluation currentEvaluation = initialEvaluation;
        GeometricSolution best = current;
        double bestScore = initialEvaluation.getScore().getScore();

        TerminationReason reason = null;
        AstrometryException error = null;
        int lastImprovement = 0;
        int iteration = 1;
        int completedIterations = 0;

        while (reason == null) {

            final GeometricSolution refined;
            final StarEvaluation evaluation;
            try {
                refined = refiner.refine(current, currentEvaluation);
                evaluation = evaluator.evaluate(refined);
            } catch (final CatalogException e) {
                throw (CatalogException) e.withProgress(iteration, bestScore);
            } catch (final AstrometryException e) {
                error = e.withProgress(iteration, bestScore);
                LOG.error("optimize: the image could not be fully solved, keeping the latest valid solution", e);
                reason = TerminationReason.ITERATION_FAILED;
                break;
            }

            final MatchScore score = evaluation.getScore();
            final GeometricSolution result = refined.toBuilder().score(score).iteration(iteration).build();
            final double delta = result.deltaArcsec(current);
            final boolean improved = score.getScore() > bestScore;

            current = result;
            currentEvaluation = evaluation;
            completedIterations = iteration;

            if (improved) {
                lastImprovement = 0;
                best = result;
                bestScore = score.getScore();
            } else {
                lastImprovement++;
            }

            history.add(new IterationSummary(iteration, score.getScore(), bestScore, delta,
                                             score.getRms(), score.getNumValid()));

            LOG.info("optimize: iteration {}, delta = {} arcsec ({} px), center {}, resolution {} arcsec/px, " +
                     "rms {} px ({} stars), score {}{}",
                     iteration,
                     String.format("%.3f", delta),
                     String.format("%.2f", delta / (result.getResolution() * 3600.0)),
                     result.getCenter(),
                     String.format("%.3f", result.getResolution() * 3600.0),
                     String.format("%.3f", score.getRms()),
                     score.getNumValid(),
                     score.getScore(),
                     improved ? " (improved)" : "");

            if (refiner.isDistortionModelActive() && (lastImprovement > DISTORTION_MODEL_PATIENCE)) {
                lastImprovement = 0;
                refiner.dropDistortionModel();
                LOG.info("optimize: solution with distortion model has converged, continuing without the model");
            }

            if (iteration >= maxIterations) {
                LOG.warn("optimize: reached maximum number of iterations ({})", maxIterations);
                reason = TerminationReason.MAX_ITERATIONS;
            } else if (lastImprovement >= maxItersNoImprovement) {
                LOG.info("optimize: no improvement in the last {} iterations", lastImprovement);
                reason = TerminationReason.NO_IMPROVEMENT;
            } else if (cancellationSignal.isCancelled()) {
                LOG.warn("optimize: cancellation requested after iteration {}", iteration);
                reason = TerminationReason.CANCELLED;
            }

            iteration++;
        }

        LOG.info("optimize: finished after {} iterations in {}, reason {}, best score {}",
                 completedIterations, timer, reason, bestScore);

        return new OptimizationResult(best, reason, completedIterations, history, error);
    }

    private static final Logger LOG = LoggerFactory.getLogger(IterativeOptimizer.class);
}
