package org.janelia.astrometry.solver;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.AstrometryException;
import org.janelia.astrometry.catalog.CatalogException;
import org.janelia.astrometry.catalog.CatalogLookup;
import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.DetectedStar;
import org.janelia.astrometry.service.PsfFitService;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.StarAlignmentService;
import org.janelia.astrometry.service.StarDetectionService;
import org.janelia.astrometry.transform.TransformFitException;
import org.janelia.astrometry.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes the astrometric solution of an image.
 *
 * <pre>
 *   SEED -> ALIGNED -> OPTIMIZING -> CONVERGED
 *     \         \
 *      +---------+--> FAILED
 * </pre>
 *
 * Stars are detected (and optionally PSF fitted), the image is aligned with a template rendered
 * from catalog stars around the seed and the resulting solution is iteratively refined against the catalog.
 *
 * Seed and catalog problems are thrown.  Any other failure before a solution exists produces
 * a {@link SolverState#FAILED} result.  Failures during optimization keep the best solution found.
 *
 * Instances are not thread safe, use one solver per thread.
 */
public class ImageSolver {

    private final SolverParameters parameters;
    private final StarDetectionService detectionService;
    private final PsfFitService psfFitService;
    private final CatalogLookup catalogLookup;
    private final TemplateAligner aligner;

    /**
     * @param  parameters        solver settings.
     * @param  detectionService  finds stars in images.
     * @param  psfFitService     refines detected star centroids (null to skip PSF fitting).
     * @param  alignmentService  registers images with reference templates.
     * @param  catalogLookup     source of reference stars.
     *
     * @throws IllegalArgumentException
     *   if the parameters are invalid.
     */
    public ImageSolver(final SolverParameters parameters,
                       final StarDetectionService detectionService,
                       final PsfFitService psfFitService,
                       final StarAlignmentService alignmentService,
                       final CatalogLookup catalogLookup)
            throws IllegalArgumentException {

        parameters.validate();

        this.parameters = parameters;
        this.detectionService = detectionService;
        this.psfFitService = psfFitService;
        this.catalogLookup = catalogLookup;
        this.aligner = new TemplateAligner(alignmentService,
                                           parameters.minTemplateStars,
                                           parameters.maxAlignmentPairs);
    }

    public SolverParameters getParameters() {
        return parameters;
    }

    public SolveResult solve(final SourceImage image,
                             final SeedParameters seed)
            throws SeedInvalidException, CatalogException {
        return solve(image, seed, null, CancellationSignal.NONE);
    }

    /**
     * @param  image               image to solve.
     * @param  seed                approximate center and scale of the image.
     * @param  existingSolution    solution to start from when only optimizing (ignored otherwise).
     * @param  cancellationSignal  checked between optimization iterations and alignment cells.
     *
     * @return the solve result (with state {@link SolverState#FAILED} if no solution could be found).
     *
     * @throws SeedInvalidException
     *   if the seed is invalid or does not describe the image.
     * @throws CatalogException
     *   if reference stars cannot be loaded.
     * @throws IllegalArgumentException
     *   if only optimization is requested without an existing solution.
     */
    public SolveResult solve(final SourceImage image,
                             final SeedParameters seed,
                             final GeometricSolution existingSolution,
                             final CancellationSignal cancellationSignal)
            throws SeedInvalidException, CatalogException, IllegalArgumentException {

        final ProcessTimer timer = new ProcessTimer();

        seed.validate();
        if ((seed.getWidth() != image.getWidth()) || (seed.getHeight() != image.getHeight())) {
            throw new SeedInvalidException("seed size " + seed.getWidth() + "x" + seed.getHeight() +
                                           " does not match image size " + image.getWidth() + "x" +
                                           image.getHeight());
        }
        if (parameters.onlyOptimize && (existingSolution == null)) {
            throw new IllegalArgumentException("an existing solution is required when only optimizing");
        }

        LOG.info("solve: entry, image {}, seed {}, state {}", image, seed, SolverState.SEED);

        final List<String> warnings = new ArrayList<>();

        SolverState state = SolverState.SEED;
        GeometricSolution solution;
        final CatalogStarEvaluator evaluator;
        final StandardSolutionRefiner refiner;
        final StarEvaluation evaluation;
        try {

            final StarField starField = detectStars(image);

            final double limitMagnitude = parameters.getLimitMagnitude(seed.getResolution(),
                                                                       image.getWidth(),
                                                                       image.getHeight());
            LOG.info("solve: using catalog stars up to magnitude {}", limitMagnitude);

            refiner = new StandardSolutionRefiner(parameters, loadDistortionModel(), warnings);
            evaluator = new CatalogStarEvaluator(parameters, catalogLookup, starField, limitMagnitude, warnings);

            if (parameters.onlyOptimize) {
                solution = existingSolution;
            } else {
                final List<CatalogStar> catalogStars = evaluator.loadCatalogStars(seed.getCenter(),
                                                                                  seed.getResolution(),
                                                                                  image.getWidth(),
                                                                                  image.getHeight());
                final InitialSolutionBuilder builder =
                        new InitialSolutionBuilder(parameters, aligner, refiner, cancellationSignal);
                solution = builder.build(image, seed, catalogStars);
            }

            evaluation = evaluator.evaluate(solution);
            solution = solution.toBuilder().score(evaluation.getScore()).iteration(0).build();

            state = logTransition(state, SolverState.ALIGNED);

        } catch (final CatalogException e) {
            throw e;
        } catch (final SolveCancelledException e) {
            LOG.warn("solve: exit, {} in state {}", e.getMessage(), state);
            return SolveResult.cancelled(state, e, warnings);
        } catch (final AlignmentFailedException e) {
            LOG.error("solve: image alignment failed, diagnostics: {}", e.getDiagnostics(), e);
            logTransition(state, SolverState.FAILED);
            return SolveResult.failed(e, warnings);
        } catch (final AstrometryException e) {
            LOG.error("solve: failed to find an initial solution", e);
            logTransition(state, SolverState.FAILED);
            return SolveResult.failed(e, warnings);
        }

        final SolveResult result;
        if (parameters.optimizeSolution || parameters.onlyOptimize) {

            state = logTransition(state, SolverState.OPTIMIZING);

            final IterativeOptimizer optimizer = new IterativeOptimizer(refiner,
                                                                        evaluator,
                                                                        parameters.maxIterations,
                                                                        parameters.getMaxItersNoImprovement(),
                                                                        cancellationSignal);
            final OptimizationResult optimizationResult = optimizer.optimize(solution, evaluation);

            state = logTransition(state, SolverState.CONVERGED);

            saveDistortionModel(optimizationResult.getBestSolution(), warnings);

            result = new SolveResult(state,
                                     optimizationResult.getBestSolution(),
                                     optimizationResult.getTerminationReason(),
                                     optimizationResult.getIterations(),
                                     optimizationResult.getHistory(),
                                     warnings,
                                     optimizationResult.getError());
        } else {
            saveDistortionModel(solution, warnings);
            result = new SolveResult(state,
                                     solution,
                                     TerminationReason.OPTIMIZATION_DISABLED,
                                     0,
                                     Collections.emptyList(),
                                     warnings,
                                     null);
        }

        LOG.info("solve: exit, solved {} in {}, result {}", image.getName(), timer, result);

        return result;
    }

    private StarField detectStars(final SourceImage image)
            throws AstrometryException {

        List<DetectedStar> stars = detectionService.detect(image);
        LOG.info("detectStars: found {} stars in {}", stars.size(), image.getName());

        if (stars.size() < parameters.minDetectedStars) {
            throw new AlignmentFailedException("insufficient stars detected: found " + stars.size() +
                                               ", at least " + parameters.minDetectedStars + " are required");
        }

        if (psfFitService != null) {
            stars = psfFitService.fit(image, stars);
            LOG.info("detectStars: kept {} stars after PSF fitting", stars.size());
        }

        return StarField.build(stars, parameters.minDetectedStars);
    }

    private DistortionModel loadDistortionModel()
            throws AstrometryException {

        if (parameters.distortionModelPath == null) {
            return null;
        }

        try {
            return DistortionModel.load(Paths.get(parameters.distortionModelPath));
        } catch (final IOException e) {
            throw new AstrometryException("failed to read distortion model " + parameters.distortionModelPath, e);
        }
    }

    private void saveDistortionModel(final GeometricSolution solution,
                                     final List<String> warnings) {

        if ((parameters.generateDistortionModelPath == null) || (solution == null)) {
            return;
        }

        try {
            DistortionModel.generate(solution).write(Paths.get(parameters.generateDistortionModelPath));
        } catch (final IOException | TransformFitException e) {
            LOG.warn("saveDistortionModel: failed to generate " + parameters.generateDistortionModelPath, e);
            warnings.add("distortion model was not generated: " + e.getMessage());
        }
    }

    private static SolverState logTransition(final SolverState from,
                                             final SolverState to) {
        LOG.info("logTransition: {} -> {}", from, to);
        return to;
    }

    private static final Logger LOG = LoggerFactory.getLogger(ImageSolver.class);
}
