package org.janelia.astrometry.solver;

import org.janelia.astrometry.AstrometryException;

/**
 * The approximate center, scale or image geometry supplied to start a solve is unusable.
 */
public class SeedInvalidException
        extends AstrometryException {

    public SeedInvalidException(final String message) {
        super(message);
    }
}
