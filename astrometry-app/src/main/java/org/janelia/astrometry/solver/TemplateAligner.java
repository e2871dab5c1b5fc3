package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.geom.ImageRegion;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.service.AlignmentFailedException;
import org.janelia.astrometry.service.AlignmentResult;
import org.janelia.astrometry.service.AlignmentStrategy;
import org.janelia.astrometry.service.ReferenceTemplate;
import org.janelia.astrometry.service.SourceImage;
import org.janelia.astrometry.service.StarAlignmentService;
import org.janelia.astrometry.service.TemplateStar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders reference templates from catalog stars and aligns images against them.
 *
 * Alignment starts with polygon descriptors.  If they fail, alignment is retried once with triangle
 * similarity descriptors (which also match mirrored images) and that strategy is kept for all later
 * alignments made by this instance.
 */
public class TemplateAligner {

    public static final List<String> ALIGNMENT_DIAGNOSTICS = Arrays.asList(
            "The seed center coordinates should be inside the image.",
            "The seed resolution should be within a factor of 2 of the correct value.",
            "Noisy, poorly tracked or badly focused images may need different star detection parameters.");

    private final StarAlignmentService alignmentService;
    private final int minTemplateStars;
    private final int maxPairs;
    private AlignmentStrategy strategy;

    public TemplateAligner(final StarAlignmentService alignmentService,
                           final int minTemplateStars,
                           final int maxPairs) {
        this.alignmentService = alignmentService;
        this.minTemplateStars = minTemplateStars;
        this.maxPairs = maxPairs;
        this.strategy = AlignmentStrategy.POLYGON;
    }

    public AlignmentStrategy getStrategy() {
        return strategy;
    }

    /**
     * @param  stars     catalog stars to render.
     * @param  geometry  template geometry.
     * @param  clip      template region to restrict stars to (null for the whole template).
     *
     * @throws AlignmentFailedException
     *   if too few stars fall inside the template.
     */
    public ReferenceTemplate render(final List<CatalogStar> stars,
                                    final TemplateGeometry geometry,
                                    final ImageRegion clip)
            throws AlignmentFailedException {

        final ImageRegion bounds = clip == null ? ImageRegion.forImage(geometry.getWidth(), geometry.getHeight()) : clip;

        final List<TemplateStar> templateStars = new ArrayList<>();
        for (final CatalogStar star : stars) {
            final PlanePoint p = geometry.toTemplate(star.getPosition());
            if ((p != null) && bounds.contains(p)) {
                templateStars.add(new TemplateStar(p.getX(), p.getY(), getFlux(star.getMagnitude())));
            }
        }

        if (templateStars.size() < minTemplateStars) {
            throw new AlignmentFailedException(
                    "found too few stars (" + templateStars.size() + ") for the reference template, " +
                    "the magnitude filter could be too strict or the catalog could be incomplete");
        }

        return new ReferenceTemplate(geometry.getWidth(), geometry.getHeight(), templateStars, clip);
    }

    /**
     * Renders a template and aligns the image against it.
     *
     * @param  image     image to align.
     * @param  stars     catalog stars to render.
     * @param  geometry  template geometry.
     * @param  clip      region (template and image) to restrict alignment to (null for everything).
     *
     * @return at most maxPairs matched pairs with image points in corner origin convention.
     *
     * @throws AlignmentFailedException
     *   if the template cannot be rendered or alignment fails with every strategy.
     */
    public AlignmentPairs align(final SourceImage image,
                                final List<CatalogStar> stars,
                                final TemplateGeometry geometry,
                                final ImageRegion clip)
            throws AlignmentFailedException {

        final ReferenceTemplate template = render(stars, geometry, clip);

        LOG.debug("align: aligning {} with template {} using {}", image, template, strategy);

        AlignmentResult result;
        try {
            result = alignmentService.align(image, template, clip, strategy);
        } catch (final AlignmentFailedException e) {
            if (strategy == AlignmentStrategy.TRIANGLE_SIMILARITY) {
                throw new AlignmentFailedException("the image could not be aligned with the reference star field",
                                                   ALIGNMENT_DIAGNOSTICS, e);
            }

            LOG.info("align: alignment with polygon descriptors failed ({}), retrying with triangle similarity",
                     e.getMessage());
            strategy = AlignmentStrategy.TRIANGLE_SIMILARITY;
            try {
                result = alignmentService.align(image, template, clip, strategy);
            } catch (final AlignmentFailedException retryFailure) {
                throw new AlignmentFailedException("the image could not be aligned with the reference star field",
                                                   ALIGNMENT_DIAGNOSTICS, retryFailure);
            }
        }

        final int numberOfPairs = Math.min(result.size(), maxPairs);
        final List<PlanePoint> templatePoints = new ArrayList<>(numberOfPairs);
        final List<PlanePoint> imagePoints = new ArrayList<>(numberOfPairs);
        for (int i = 0; i < numberOfPairs; i++) {
            templatePoints.add(result.getTemplatePoints().get(i));
            imagePoints.add(result.getImageConvention().toCornerOrigin(result.getImagePoints().get(i)));
        }

        LOG.info("align: matched {} star pairs{}", numberOfPairs,
                 numberOfPairs < result.size() ? " (" + result.size() + " found)" : "");

        return new AlignmentPairs(templatePoints, imagePoints);
    }

    /**
     * @return relative template flux for a catalog magnitude (0 for unknown magnitudes).
     */
    public static double getFlux(final Double magnitude) {
        return magnitude == null ? 0.0 : Math.pow(2.512, -1.5 - magnitude);
    }

    private static final Logger LOG = LoggerFactory.getLogger(TemplateAligner.class);
}
