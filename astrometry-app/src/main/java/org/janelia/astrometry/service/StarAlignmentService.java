package org.janelia.astrometry.service;

import org.janelia.astrometry.geom.ImageRegion;

/**
 * Matches the stars of a reference template with the stars of an image.
 */
public interface StarAlignmentService {

    /**
     * @param  image     image to align.
     * @param  template  synthetic reference star field.
     * @param  region    image region to restrict matching to (null for the whole image).
     * @param  strategy  descriptor used for matching.
     *
     * @return matched template/image star pairs.
     *
     * @throws AlignmentFailedException
     *   if no consistent set of pairs can be found.
     */
    AlignmentResult align(SourceImage image,
                          ReferenceTemplate template,
                          ImageRegion region,
                          AlignmentStrategy strategy)
            throws AlignmentFailedException;
}
