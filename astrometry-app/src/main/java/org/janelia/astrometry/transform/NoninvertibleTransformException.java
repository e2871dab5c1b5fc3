package org.janelia.astrometry.transform;

import org.janelia.astrometry.AstrometryException;

/**
 * Raised when the inverse of a singular or ill conditioned transform is requested.
 */
public class NoninvertibleTransformException
        extends AstrometryException {

    public NoninvertibleTransformException(final String message) {
        super(message);
    }
}
