package org.janelia.astrometry.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Stars returned for a catalog region query, ordered brightest first.
 */
public class CatalogQueryResult {

    private final List<CatalogStar> stars;
    private final boolean truncated;

    /**
     * @param  stars      matching stars (any order, they are sorted here).
     * @param  truncated  true if the catalog held more matching stars than it returned.
     */
    public CatalogQueryResult(final List<CatalogStar> stars,
                              final boolean truncated) {
        final List<CatalogStar> sorted = new ArrayList<>(stars);
        sorted.sort(CatalogStar.BRIGHTEST_FIRST);
        this.stars = Collections.unmodifiableList(sorted);
        this.truncated = truncated;
    }

    public List<CatalogStar> getStars() {
        return stars;
    }

    public int size() {
        return stars.size();
    }

    public boolean isTruncated() {
        return truncated;
    }

    @Override
    public String toString() {
        return "{numberOfStars: " + stars.size() + ", truncated: " + truncated + '}';
    }
}
