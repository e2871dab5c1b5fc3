package org.janelia.astrometry.catalog;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Source of reference stars.
 */
public interface CatalogLookup {

    /**
     * @return identifier of the underlying catalog (used to key cached results).
     */
    String getCatalogId();

    /**
     * @param  center          center of the queried region.
     * @param  fovDegrees      diameter of the queried (circular) region.
     * @param  limitMagnitude  faintest magnitude to include (stars without a magnitude are always included).
     *
     * @return stars in the region ordered brightest first.
     *
     * @throws CatalogException
     *   if the catalog cannot be read.
     */
    CatalogQueryResult load(CelestialPoint center,
                            double fovDegrees,
                            double limitMagnitude)
            throws CatalogException;
}
