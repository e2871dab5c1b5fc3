package org.janelia.astrometry.solver;

import java.util.List;

import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.transform.NoninvertibleTransformException;
import org.janelia.astrometry.transform.TransformFitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Establishes the first solution for an image by aligning it with a reference template
 * rendered around the seed center.
 */
public class InitialSolutionBuilder {

    private final SolverParameters parameters;
    private final TemplateAligner aligner;
    private final StandardSolutionRefiner refiner;
    private final CancellationSignal cancellationSignal;

    public InitialSolutionBuilder(final SolverParameters parameters,
                                  final TemplateAligner aligner,
                                  final StandardSolutionRefiner refiner,
                                  final CancellationSignal cancellationSignal) {
        this.parameters = parameters;
        this.aligner = aligner;
        this.refiner = refiner;
        this.cancellationSignal = cancellationSignal;
    }

    /**
     * @param  image  image to solve.
     * @param  seed   approximate center and scale.
     * @param  stars  catalog stars around the seed center (brightest first).
     *
     * @throws AlignmentFailedException
     *   if the image cannot be aligned with the reference template.
     * @throws SolveCancelledException
     *   if cancellation was requested before any distorted corner cell was aligned.
     * @throws TransformFitException
     *   if no solution can be fitted to the aligned pairs.
     * @throws NoninvertibleTransformException
     *   if the seed or fitted linear mapping is degenerate.
     */
    public GeometricSolution build(final SourceImage image,
                                   final SeedParameters seed,
                                   final List<CatalogStar> stars)
            throws AlignmentFailedException, SolveCancelledException, TransformFitException,
                   NoninvertibleTransformException {

        final int width = image.getWidth();
        final int height = image.getHeight();
        final TemplateGeometry seedGeometry = TemplateGeometry.forSeed(parameters.buildProjection(seed.getCenter()),
                                                                       seed.getResolution(),
                                                                       Math.max(width, height));

        final ProjectedAlignment alignment;
        if (parameters.distortionCorrection && parameters.distortedCorners) {
            final DistortedCornersAssembler assembler = new DistortedCornersAssembler(aligner,
                                                                                      parameters.cornerSize,
                                                                                      parameters::buildProjection,
                                                                                      cancellationSignal);
            alignment = assembler.assemble(image, stars, seedGeometry);
        } else {
            final AlignmentPairs pairs = aligner.align(image, stars, seedGeometry, null);
            alignment = seedGeometry.project(pairs, width, height, parameters::buildProjection, 1);
        }

        final GeometricSolution solution = refiner.fit(width,
                                                       height,
                                                       alignment.getProjection(),
                                                       alignment.getImagePoints(),
                                                       alignment.getNativePoints(),
                                                       seed.getResolution(),
                                                       null);

        LOG.info("build: initial alignment from {} pairs ({} aligned cells) gives {}",
                 alignment.size(), alignment.getAlignedCells(), solution);

        return solution;
    }

    private static final Logger LOG = LoggerFactory.getLogger(InitialSolutionBuilder.class);
}
