package org.janelia.astrometry.catalog;

import java.util.Objects;

import org.janelia.astrometry.geom.CelestialPoint;

/**
 * Cache key for catalog region queries.
 */
class CatalogQuery {

    private final String catalogId;
    private final CelestialPoint center;
    private final double fovDegrees;
    private final double limitMagnitude;

    CatalogQuery(final String catalogId,
                 final CelestialPoint center,
                 final double fovDegrees,
                 final double limitMagnitude) {
        this.catalogId = catalogId;
        this.center = center;
        this.fovDegrees = fovDegrees;
        this.limitMagnitude = limitMagnitude;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final CatalogQuery that = (CatalogQuery) o;
        return Double.compare(that.fovDegrees, fovDegrees) == 0 &&
               Double.compare(that.limitMagnitude, limitMagnitude) == 0 &&
               Objects.equals(catalogId, that.catalogId) &&
               Objects.equals(center, that.center);
    }

    @Override
    public int hashCode() {
        return Objects.hash(catalogId, center, fovDegrees, limitMagnitude);
    }

    @Override
    public String toString() {
        return catalogId + "@" + center + "/" + fovDegrees + "/" + limitMagnitude;
    }
}
