package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.geom.CelestialPoint;
import org.janelia.astrometry.geom.ImageRegion;
import org.janelia.astrometry.projection.Projection;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.transform.Homography;
import org.janelia.astrometry.transform.NoninvertibleTransformException;
import org.janelia.astrometry.transform.TransformFitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Aligns strongly distorted images region by region.
 *
 * The whole image is aligned once to estimate its center and to derive a template geometry that
 * coincides with the image frame.  The image is then split into 9 cells along the boundaries
 * [0, c, 1-c, 1] of each dimension (c = cornerSize) and every cell is aligned on its own.
 * Pairs from successful cells are pooled.  Failed cells are skipped, alignment only fails
 * when no cell succeeds.
 */
public class DistortedCornersAssembler {

    public static final double DEFAULT_CORNER_SIZE = 0.25;

    private static final String[] ROW_NAMES = { "top", "center", "bottom" };
    private static final String[] COLUMN_NAMES = { "left", "center", "right" };

    private final TemplateAligner aligner;
    private final double cornerSize;
    private final Function<CelestialPoint, Projection> projectionFactory;
    private final CancellationSignal cancellationSignal;

    public DistortedCornersAssembler(final TemplateAligner aligner,
                                     final double cornerSize,
                                     final Function<CelestialPoint, Projection> projectionFactory,
                                     final CancellationSignal cancellationSignal)
            throws IllegalArgumentException {
        if ((cornerSize <= 0) || (cornerSize >= 0.5)) {
            throw new IllegalArgumentException("cornerSize must be between 0 and 0.5");
        }
        this.aligner = aligner;
        this.cornerSize = cornerSize;
        this.projectionFactory = projectionFactory;
        this.cancellationSignal = cancellationSignal;
    }

    /**
     * @return the 9 cells (row major, top left first) for an image of the specified size.
     */
    public List<ImageRegion> getCells(final int width,
                                      final int height) {
        final double[] separators = { 0, cornerSize, 1 - cornerSize, 1 };
        final List<ImageRegion> cells = new ArrayList<>(9);
        for (int cellIndex = 0; cellIndex < 9; cellIndex++) {
            final int x = cellIndex % 3;
            final int y = cellIndex / 3;
            cells.add(new ImageRegion(separators[x] * width,
                                      separators[y] * height,
                                      separators[x + 1] * width,
                                      separators[y + 1] * height));
        }
        return cells;
    }

    /**
     * @param  image         image to align.
     * @param  stars         catalog stars around the seed center.
     * @param  seedGeometry  template geometry derived from the seed.
     *
     * @return pooled pairs of all successful cells expressed in a projection centered on the image.
     *
     * @throws AlignmentFailedException
     *   if the whole image alignment or every cell alignment fails.
     * @throws SolveCancelledException
     *   if cancellation was requested before any cell was aligned.
     * @throws TransformFitException
     *   if the whole image alignment does not determine a usable mapping.
     */
    public ProjectedAlignment assemble(final SourceImage image,
                                       final List<CatalogStar> stars,
                                       final TemplateGeometry seedGeometry)
            throws AlignmentFailedException, SolveCancelledException, TransformFitException {

        final int width = image.getWidth();
        final int height = image.getHeight();

        final AlignmentPairs wholeImagePairs = aligner.align(image, stars, seedGeometry, null);
        final ProjectedAlignment wholeImage =
                seedGeometry.project(wholeImagePairs, width, height, projectionFactory, 1);

        // template pixels now coincide with image pixels, so cells clip both in the same way
        final TemplateGeometry imageGeometry;
        try {
            imageGeometry = new TemplateGeometry(wholeImage.getProjection(),
                                                 Homography.fit(wholeImage.getImagePoints(),
                                                                wholeImage.getNativePoints()),
                                                 width,
                                                 height);
        } catch (final NoninvertibleTransformException e) {
            throw new TransformFitException("whole image alignment produced a degenerate mapping", e);
        }

        LOG.info("assemble: estimated image center {}", wholeImage.getProjection().getReferencePoint());

        final List<ImageRegion> cells = getCells(width, height);
        final List<AlignmentPairs> cellPairs = new ArrayList<>(cells.size());
        for (int cellIndex = 0; cellIndex < cells.size(); cellIndex++) {

            if (cancellationSignal.isCancelled()) {
                LOG.warn("assemble: cancellation requested, skipping remaining cells");
                break;
            }

            final String cellName = ROW_NAMES[cellIndex / 3] + "-" + COLUMN_NAMES[cellIndex % 3];
            LOG.info("assemble: aligning {} cell {}", cellName, cells.get(cellIndex));
            try {
                cellPairs.add(aligner.align(image, stars, imageGeometry, cells.get(cellIndex)));
            } catch (final AlignmentFailedException e) {
                LOG.warn("assemble: unable to align {} cell, skipping it", cellName, e);
            }
        }

        if (cellPairs.isEmpty()) {
            if (cancellationSignal.isCancelled()) {
                throw new SolveCancelledException("cancellation was requested before any image cell was aligned");
            }
            throw new AlignmentFailedException("none of the image cells could be aligned",
                                               TemplateAligner.ALIGNMENT_DIAGNOSTICS, null);
        }

        final AlignmentPairs pooled = AlignmentPairs.pool(cellPairs);

        LOG.info("assemble: pooled {} pairs from {} of {} cells", pooled.size(), cellPairs.size(), cells.size());

        return new ProjectedAlignment(imageGeometry.getProjection(),
                                      pooled.getImagePoints(),
                                      imageGeometry.getTemplateToNative().applyAll(pooled.getTemplatePoints()),
                                      cellPairs.size());
    }

    private static final Logger LOG = LoggerFactory.getLogger(DistortedCornersAssembler.class);
}
