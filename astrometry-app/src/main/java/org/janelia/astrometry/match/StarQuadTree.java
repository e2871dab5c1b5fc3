package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Bucket region quadtree over a fixed set of points supporting rectangular range searches.
 * Search results are indexes into the list the tree was built from.
 */
public class StarQuadTree {

    public static final int DEFAULT_BUCKET_CAPACITY = 16;

    private final List<PlanePoint> points;
    private final int bucketCapacity;
    private final Node root;

    public StarQuadTree(final List<PlanePoint> points) {
        this(points, DEFAULT_BUCKET_CAPACITY);
    }

    public StarQuadTree(final List<PlanePoint> points,
                        final int bucketCapacity) {
        this.points = Collections.unmodifiableList(new ArrayList<>(points));
        this.bucketCapacity = Math.max(1, bucketCapacity);

        final List<Integer> indexes = new ArrayList<>(points.size());
        double x0 = Double.MAX_VALUE, y0 = Double.MAX_VALUE, x1 = -Double.MAX_VALUE, y1 = -Double.MAX_VALUE;
        for (int i = 0; i < points.size(); i++) {
            final PlanePoint p = points.get(i);
            indexes.add(i);
            x0 = Math.min(x0, p.getX());
            y0 = Math.min(y0, p.getY());
            x1 = Math.max(x1, p.getX());
            y1 = Math.max(y1, p.getY());
        }
        this.root = indexes.isEmpty() ? null : build(indexes, x0, y0, x1, y1, 0);
    }

    public int size() {
        return points.size();
    }

    public PlanePoint get(final int index) {
        return points.get(index);
    }

    public List<PlanePoint> getPoints() {
        return points;
    }

    /**
     * @return indexes of all points inside the closed rectangle [x0, x1] x [y0, y1].
     */
    public List<Integer> search(final double x0,
                                final double y0,
                                final double x1,
                                final double y1) {
        final List<Integer> found = new ArrayList<>();
        if (root != null) {
            search(root, x0, y0, x1, y1, found);
        }
        return found;
    }

    /**
     * @return index of the point nearest to the specified location among those within the square
     *         of half size searchRadius centered on it, or -1 if there is none.
     */
    public int findNearest(final PlanePoint location,
                           final double searchRadius) {
        final List<Integer> candidates = search(location.getX() - searchRadius,
                                                location.getY() - searchRadius,
                                                location.getX() + searchRadius,
                                                location.getY() + searchRadius);
        int nearest = -1;
        double nearestDistance = Double.MAX_VALUE;
        for (final Integer candidate : candidates) {
            final double distance = points.get(candidate).distanceSquared(location);
            if (distance < nearestDistance) {
                nearest = candidate;
                nearestDistance = distance;
            }
        }
        return nearest;
    }

    private Node build(final List<Integer> indexes,
                       final double x0,
                       final double y0,
                       final double x1,
                       final double y1,
                       final int depth) {

        final Node node = new Node(x0, y0, x1, y1);

        // stop splitting when the bucket is small enough or the points cannot be separated any more
        if ((indexes.size() <= bucketCapacity) || (depth > 32) || ((x1 - x0) <= 0 && (y1 - y0) <= 0)) {
            node.indexes = indexes;
            return node;
        }

        final double xm = (x0 + x1) / 2.0;
        final double ym = (y0 + y1) / 2.0;
        final List<List<Integer>> quadrants = new ArrayList<>(4);
        for (int q = 0; q < 4; q++) {
            quadrants.add(new ArrayList<>());
        }
        for (final Integer i : indexes) {
            final PlanePoint p = points.get(i);
            quadrants.get((p.getX() <= xm ? 0 : 1) + (p.getY() <= ym ? 0 : 2)).add(i);
        }

        node.children = new Node[] {
                quadrants.get(0).isEmpty() ? null : build(quadrants.get(0), x0, y0, xm, ym, depth + 1),
                quadrants.get(1).isEmpty() ? null : build(quadrants.get(1), xm, y0, x1, ym, depth + 1),
                quadrants.get(2).isEmpty() ? null : build(quadrants.get(2), x0, ym, xm, y1, depth + 1),
                quadrants.get(3).isEmpty() ? null : build(quadrants.get(3), xm, ym, x1, y1, depth + 1)
        };
        return node;
    }

    private void search(final Node node,
                        final double x0,
                        final double y0,
                        final double x1,
                        final double y1,
                        final List<Integer> found) {
        if ((node.x1 < x0) || (node.x0 > x1) || (node.y1 < y0) || (node.y0 > y1)) {
            return;
        }
        if (node.indexes != null) {
            for (final Integer i : node.indexes) {
                final PlanePoint p = points.get(i);
                if ((p.getX() >= x0) && (p.getX() <= x1) && (p.getY() >= y0) && (p.getY() <= y1)) {
                    found.add(i);
                }
            }
        } else {
            for (final Node child : node.children) {
                if (child != null) {
                    search(child, x0, y0, x1, y1, found);
                }
            }
        }
    }

    private static class Node {
        private final double x0;
        private final double y0;
        private final double x1;
        private final double y1;
        private List<Integer> indexes;
        private Node[] children;

        Node(final double x0,
             final double y0,
             final double x1,
             final double y1) {
            this.x0 = x0;
            this.y0 = y0;
            this.x1 = x1;
            this.y1 = y1;
        }
    }

}
