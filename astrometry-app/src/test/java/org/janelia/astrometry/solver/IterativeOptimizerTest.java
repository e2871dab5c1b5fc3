package org.janelia.astrometry.solver;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.catalog.CatalogException;
import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.CorrespondenceSet;
import org.janelia.astrometry.match.MatchScore;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.projection.ProjectionType;
import org.janelia.astrometry.transform.LinearTransform;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link IterativeOptimizer} class.
 */
public class IterativeOptimizerTest {

    private static final Projection PROJECTION = ProjectionType.GNOMONIC.build(new CelestialPoint(80.0, 20.0));

    @Test
    public void testStopsWithoutImprovement() throws Exception {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(12, 11, 13, 13, 12, 20);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 2, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid reason", TerminationReason.NO_IMPROVEMENT, result.getTerminationReason());
        Assert.assertEquals("invalid number of iterations", 5, result.getIterations());
        Assert.assertEquals("invalid best iteration", 3, result.getBestSolution().getIteration());
        Assert.assertEquals("invalid best score", 13.0, result.getBestSolution().getScore().getScore(), 0.0);
        Assert.assertNull("no error expected", result.getError());

        final List<IterationSummary> history = result.getHistory();
        Assert.assertEquals("invalid history size", 5, history.size());
        double previousBest = 10.0;
        for (final IterationSummary summary : history) {
            Assert.assertTrue("best score decreased in iteration " + summary.getIteration(),
                              summary.getBestScore() >= previousBest);
            previousBest = summary.getBestScore();
        }
    }

    @Test
    public void testStopsOneIterationAfterPatienceIsExhausted() throws Exception {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(11, 10, 10, 10, 10, 10, 10);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 3, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid reason", TerminationReason.NO_IMPROVEMENT, result.getTerminationReason());
        Assert.assertEquals("should stop after 1 + 3 iterations", 4, result.getIterations());
        Assert.assertEquals("invalid best iteration", 1, result.getBestSolution().getIteration());
    }

    @Test
    public void testEqualScoreIsNotAnImprovement() throws Exception {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(10, 10, 10);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 2, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid number of iterations", 2, result.getIterations());
        Assert.assertEquals("initial solution should remain best", 0, result.getBestSolution().getIteration());
    }

    @Test
    public void testMaxIterations() throws Exception {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(11, 12, 13, 14, 15, 16);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 4, 2, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid reason", TerminationReason.MAX_ITERATIONS, result.getTerminationReason());
        Assert.assertEquals("invalid number of iterations", 4, result.getIterations());
        Assert.assertEquals("invalid best score", 14.0, result.getBestSolution().getScore().getScore(), 0.0);
    }

    @Test
    public void testCancellation() throws Exception {

        final CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(11, 12, 13);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 2, signal);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid reason", TerminationReason.CANCELLED, result.getTerminationReason());
        Assert.assertEquals("cancellation should be checked after the first iteration", 1, result.getIterations());
        Assert.assertEquals("invalid best score", 11.0, result.getBestSolution().getScore().getScore(), 0.0);
    }

    @Test
    public void testIterationFailureKeepsBestSolution() throws Exception {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(12, 11);
        evaluator.failure = new AstrometryException("no matches");
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 4, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertEquals("invalid reason", TerminationReason.ITERATION_FAILED, result.getTerminationReason());
        Assert.assertEquals("invalid number of completed iterations", 2, result.getIterations());
        Assert.assertEquals("invalid best iteration", 1, result.getBestSolution().getIteration());
        Assert.assertNotNull("error should be reported", result.getError());
        Assert.assertEquals("error should be tagged with the failed iteration",
                            Integer.valueOf(3), result.getError().getIteration());
        Assert.assertEquals("error should be tagged with the best score",
                            Double.valueOf(12.0), result.getError().getBestScore());
    }

    @Test
    public void testCatalogFailureIsPropagated() {

        final ScriptedEvaluator evaluator = new ScriptedEvaluator(12);
        evaluator.failure = new CatalogException("catalog offline");
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(new PassThroughRefiner(), evaluator, 100, 4, CancellationSignal.NONE);

        try {
            optimizer.optimize(buildSolution(), evaluation(10));
            Assert.fail("catalog failure should be propagated");
        } catch (final CatalogException e) {
            Assert.assertEquals("invalid iteration", Integer.valueOf(2), e.getIteration());
        }
    }

    @Test
    public void testDistortionModelIsDropped() throws Exception {

        final PassThroughRefiner refiner = new PassThroughRefiner();
        refiner.distortionModelActive = true;
        final ScriptedEvaluator evaluator = new ScriptedEvaluator(11, 10, 10, 10, 10, 10, 10, 10, 10, 10);
        final IterativeOptimizer optimizer =
                new IterativeOptimizer(refiner, evaluator, 100, 4, CancellationSignal.NONE);

        final OptimizationResult result = optimizer.optimize(buildSolution(), evaluation(10));

        Assert.assertFalse("distortion model should have been dropped", refiner.distortionModelActive);
        // model dropped after iteration 4 resets the patience counter, then 4 more non improving iterations
        Assert.assertEquals("invalid number of iterations", 8, result.getIterations());
        Assert.assertEquals("invalid reason", TerminationReason.NO_IMPROVEMENT, result.getTerminationReason());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidMaxIterations() {
        new IterativeOptimizer(new PassThroughRefiner(), new ScriptedEvaluator(), 0, 2, CancellationSignal.NONE);
    }

    static GeometricSolution buildSolution() {
        final double resolution = 1.0 / 3600.0;
        final LinearTransform linear = new LinearTransform(resolution, 0, -500 * resolution,
                                                           0, -resolution, 400 * resolution);
        return new GeometricSolution.Builder()
                .projection(PROJECTION)
                .size(1000, 800)
                .linear(linear, new LinearTransform(3600.0, 0, 500,
                                                    0, -3600.0, 400))
                .center(PROJECTION.getReferencePoint())
                .resolution(resolution)
                .build();
    }

    static StarEvaluation evaluation(final int score) {
        final List<PlanePoint> none = Collections.emptyList();
        return new StarEvaluation(PROJECTION,
                                  Collections.emptyList(),
                                  none,
                                  new CorrespondenceSet(none, none),
                                  new MatchScore(score, 0, 0.0, 0.0, 0.0, 0.0));
    }

    private static class PassThroughRefiner
            implements SolutionRefiner {

        private boolean distortionModelActive = false;

        @Override
        public GeometricSolution refine(final GeometricSolution current,
                                        final StarEvaluation evaluation) {
            return current.toBuilder().build();
        }

        @Override
        public boolean isDistortionModelActive() {
            return distortionModelActive;
        }

        @Override
        public void dropDistortionModel() {
            distortionModelActive = false;
        }
    }

    private static class ScriptedEvaluator
            implements SolutionEvaluator {

        private final List<Integer> scores;
        private int index = 0;
        private AstrometryException failure;

        ScriptedEvaluator(final Integer... scores) {
            this.scores = Arrays.asList(scores);
        }

        @Override
        public StarEvaluation evaluate(final GeometricSolution solution)
                throws AstrometryException {
            if (index >= scores.size()) {
                if (failure != null) {
                    throw failure;
                }
                throw new IllegalStateException("evaluation script exhausted");
            }
            return evaluation(scores.get(index++));
        }
    }
}
