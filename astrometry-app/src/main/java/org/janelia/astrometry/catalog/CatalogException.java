package org.janelia.astrometry.catalog;

import org.janelia.astrometry.AstrometryException;

/**
 * Reference catalog could not be read or did not provide enough stars.
 */
public class CatalogException
        extends AstrometryException {

    public CatalogException(final String message) {
        super(message);
    }

    public CatalogException(final String message,
                            final Throwable cause) {
        super(message, cause);
    }
}
