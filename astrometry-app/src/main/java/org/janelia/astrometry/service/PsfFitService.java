package org.janelia.astrometry.service;

import java.util.List;

import org.janelia.astrometry.AstrometryException;

/**
 * Refines star centroids by fitting a point spread function around each seed position.
 */
public interface PsfFitService {

    /**
     * @return refined stars for the seeds whose fit succeeded (failed fits are dropped).
     *
     * @throws AstrometryException
     *   if fitting cannot be performed at all.
     */
    List<DetectedStar> fit(SourceImage image,
                           List<DetectedStar> seeds)
            throws AstrometryException;
}
