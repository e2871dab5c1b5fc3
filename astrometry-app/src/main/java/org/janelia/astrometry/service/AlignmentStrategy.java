package org.janelia.astrometry.service;

/**
 * Descriptor used to match reference template stars with image stars.
 */
public enum AlignmentStrategy {

    /** Orientation sensitive polygon descriptors (fails on mirrored images). */
    POLYGON,

    /** Triangle similarity descriptors (tolerates mirrored images). */
    TRIANGLE_SIMILARITY
}
