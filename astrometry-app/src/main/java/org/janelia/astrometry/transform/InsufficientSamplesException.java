package org.janelia.astrometry.transform;

/**
 * Raised when too few (or degenerate) point pairs are available for a linear fit or a robust match.
 */
public class InsufficientSamplesException
        extends TransformFitException {

    public InsufficientSamplesException(final String message) {
        super(message);
    }

    public InsufficientSamplesException(final String message,
                                        final Throwable cause) {
        super(message, cause);
    }
}
