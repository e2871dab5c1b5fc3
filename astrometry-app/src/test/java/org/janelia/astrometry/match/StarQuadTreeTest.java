package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.janelia.astrometry.geom.PlanePoint;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StarQuadTree} class.
 */
public class StarQuadTreeTest {

    @Test
    public void testSearchMatchesBruteForce() {

        final List<PlanePoint> points = buildPoints(2000, 3);
        final StarQuadTree tree = new StarQuadTree(points, 8);

        Assert.assertEquals("invalid size", points.size(), tree.size());

        final Random random = new Random(11);
        for (int trial = 0; trial < 50; trial++) {
            final double x0 = random.nextDouble() * 900.0;
            final double y0 = random.nextDouble() * 700.0;
            final double x1 = x0 + random.nextDouble() * 150.0;
            final double y1 = y0 + random.nextDouble() * 150.0;

            final List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < points.size(); i++) {
                final PlanePoint p = points.get(i);
                if ((p.getX() >= x0) && (p.getX() <= x1) && (p.getY() >= y0) && (p.getY() <= y1)) {
                    expected.add(i);
                }
            }

            final List<Integer> actual = tree.search(x0, y0, x1, y1);
            Collections.sort(actual);
            Assert.assertEquals("invalid results for trial " + trial, expected, actual);
        }
    }

    @Test
    public void testFindNearest() {

        final List<PlanePoint> points = buildPoints(500, 5);
        final StarQuadTree tree = new StarQuadTree(points);

        final Random random = new Random(13);
        for (int trial = 0; trial < 100; trial++) {
            final PlanePoint location = new PlanePoint(random.nextDouble() * 1000.0, random.nextDouble() * 800.0);
            final double radius = 30.0;

            int expected = -1;
            double expectedDistance = Double.MAX_VALUE;
            for (int i = 0; i < points.size(); i++) {
                final PlanePoint p = points.get(i);
                final double distance = p.distanceSquared(location);
                if ((Math.abs(p.getX() - location.getX()) <= radius) &&
                    (Math.abs(p.getY() - location.getY()) <= radius) &&
                    (distance < expectedDistance)) {
                    expected = i;
                    expectedDistance = distance;
                }
            }

            Assert.assertEquals("invalid nearest point for trial " + trial,
                                expected, tree.findNearest(location, radius));
        }
    }

    @Test
    public void testEmptyAndCoincidentPoints() {
        final StarQuadTree empty = new StarQuadTree(new ArrayList<>());
        Assert.assertTrue("empty tree should find nothing", empty.search(-10, -10, 10, 10).isEmpty());
        Assert.assertEquals("empty tree should have no nearest point", -1, empty.findNearest(new PlanePoint(0, 0), 5));

        final List<PlanePoint> same = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            same.add(new PlanePoint(5.0, 5.0));
        }
        final StarQuadTree tree = new StarQuadTree(same, 4);
        Assert.assertEquals("all coincident points should be found", 100, tree.search(4, 4, 6, 6).size());
    }

    private static List<PlanePoint> buildPoints(final int count,
                                                final long seed) {
        final Random random = new Random(seed);
        final List<PlanePoint> points = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            points.add(new PlanePoint(random.nextDouble() * 1000.0, random.nextDouble() * 800.0));
        }
        return points;
    }
}
