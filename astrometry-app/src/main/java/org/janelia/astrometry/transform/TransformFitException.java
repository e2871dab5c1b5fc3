package org.janelia.astrometry.transform;

import org.janelia.astrometry.AstrometryException;

/**
 * Raised when a coordinate transform cannot be fitted to a set of point pairs.
 */
public class TransformFitException
        extends AstrometryException {

    public TransformFitException(final String message) {
        super(message);
    }

    public TransformFitException(final String message,
                                 final Throwable cause) {
        super(message, cause);
    }
}
