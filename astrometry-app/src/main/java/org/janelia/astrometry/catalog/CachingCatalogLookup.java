package org.janelia.astrometry.catalog;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;

import java.util.concurrent.ExecutionException;

import org.janelia.astrometry.geom.CelestialPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded least recently used cache in front of another {@link CatalogLookup}.
 * Results are keyed by catalog identity, region and limit magnitude.
 * Failed loads are not cached.
 */
public class CachingCatalogLookup
        implements CatalogLookup {

    public static final long DEFAULT_MAXIMUM_SIZE = 16;

    private final CatalogLookup delegate;
    private final Cache<CatalogQuery, CatalogQueryResult> queryToResultCache;

    public CachingCatalogLookup(final CatalogLookup delegate) {
        this(delegate, DEFAULT_MAXIMUM_SIZE);
    }

    public CachingCatalogLookup(final CatalogLookup delegate,
                                final long maximumSize)
            throws IllegalArgumentException {
        if (maximumSize < 1) {
            throw new IllegalArgumentException("maximumSize must be positive");
        }
        this.delegate = delegate;
        this.queryToResultCache = CacheBuilder.newBuilder()
                .maximumSize(maximumSize)
                .recordStats()
                .build();
    }

    @Override
    public String getCatalogId() {
        return delegate.getCatalogId();
    }

    @Override
    public CatalogQueryResult load(final CelestialPoint center,
                                   final double fovDegrees,
                                   final double limitMagnitude)
            throws CatalogException {

        final CatalogQuery query = new CatalogQuery(delegate.getCatalogId(), center, fovDegrees, limitMagnitude);
        try {
            return queryToResultCache.get(query, () -> {
                LOG.debug("load: loading {}", query);
                return delegate.load(center, fovDegrees, limitMagnitude);
            });
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof CatalogException) {
                throw (CatalogException) e.getCause();
            }
            throw new CatalogException("failed to load " + query, e.getCause());
        }
    }

    public long size() {
        return queryToResultCache.size();
    }

    /**
     * @return a current snapshot of this cache's cumulative statistics.
     */
    public CacheStats stats() {
        return queryToResultCache.stats();
    }

    public void invalidateAll() {
        queryToResultCache.invalidateAll();
    }

    private static final Logger LOG = LoggerFactory.getLogger(CachingCatalogLookup.class);
}
