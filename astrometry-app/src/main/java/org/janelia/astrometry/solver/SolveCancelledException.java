package org.janelia.astrometry.solver;

import org.janelia.astrometry.AstrometryException;

/**
 * Cancellation was requested before an initial solution could be established.
 */
public class SolveCancelledException
        extends AstrometryException {

    public SolveCancelledException(final String message) {
        super(message);
    }
}
