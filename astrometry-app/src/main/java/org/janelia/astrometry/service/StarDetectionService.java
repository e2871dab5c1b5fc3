package org.janelia.astrometry.service;

import java.util.List;

import org.janelia.astrometry.AstrometryException;

/**
 * Finds stars in an image.
 */
public interface StarDetectionService {

    /**
     * @return all stars detected in the image (corner origin pixel coordinates).
     *
     * @throws AstrometryException
     *   if detection fails.
     */
    List<DetectedStar> detect(SourceImage image)
            throws AstrometryException;
}
