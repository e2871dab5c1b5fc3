package org.janelia.astrometry.catalog;

import java.util.Collections;

import org.janelia.astrometry.geom.CelestialPoint;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link CachingCatalogLookup} class.
 */
public class CachingCatalogLookupTest {

    @Test
    public void testCachedLoads() throws Exception {

        final CountingLookup delegate = new CountingLookup();
        final CachingCatalogLookup lookup = new CachingCatalogLookup(delegate, 2);

        final CelestialPoint center = new CelestialPoint(150.0, 30.0);
        final CatalogQueryResult first = lookup.load(center, 1.0, 12.0);
        final CatalogQueryResult second = lookup.load(new CelestialPoint(150.0, 30.0), 1.0, 12.0);

        Assert.assertSame("second load should be served from the cache", first, second);
        Assert.assertEquals("invalid number of delegate loads", 1, delegate.loadCount);
        Assert.assertEquals("invalid hit count", 1, lookup.stats().hitCount());

        lookup.load(center, 1.0, 13.0);
        Assert.assertEquals("different limit magnitude should miss", 2, delegate.loadCount);
        Assert.assertEquals("invalid cache size", 2, lookup.size());

        lookup.invalidateAll();
        lookup.load(center, 1.0, 12.0);
        Assert.assertEquals("invalidated entry should be reloaded", 3, delegate.loadCount);
    }

    @Test
    public void testFailuresAreNotCached() throws Exception {

        final CountingLookup delegate = new CountingLookup();
        delegate.fail = true;
        final CachingCatalogLookup lookup = new CachingCatalogLookup(delegate);
        final CelestialPoint center = new CelestialPoint(10.0, -5.0);

        try {
            lookup.load(center, 2.0, 10.0);
            Assert.fail("failed delegate load should be rethrown");
        } catch (final CatalogException e) {
            Assert.assertEquals("delegate exception should be rethrown", "test failure", e.getMessage());
        }

        delegate.fail = false;
        final CatalogQueryResult result = lookup.load(center, 2.0, 10.0);
        Assert.assertEquals("invalid number of delegate loads", 2, delegate.loadCount);
        Assert.assertEquals("invalid number of stars", 1, result.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidSize() {
        new CachingCatalogLookup(new CountingLookup(), 0);
    }

    private static class CountingLookup
            implements CatalogLookup {

        private int loadCount = 0;
        private boolean fail = false;

        @Override
        public String getCatalogId() {
            return "counting";
        }

        @Override
        public CatalogQueryResult load(final CelestialPoint center,
                                       final double fovDegrees,
                                       final double limitMagnitude)
                throws CatalogException {
            loadCount++;
            if (fail) {
                throw new CatalogException("test failure");
            }
            return new CatalogQueryResult(
                    Collections.singletonList(new CatalogStar(center.getRa(), center.getDec(), limitMagnitude)),
                    false);
        }
    }
}
