package org.janelia.astrometry.align;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Triangle formed by three stars, described by scale and rotation invariant side ratios.
 *
 * Vertexes are ordered by the length of the side opposite to them (longest first),
 * so that the vertexes of two similar triangles correspond index by index.
 */
class StarTriangle {

    static final Comparator<StarTriangle> BY_FIRST_RATIO = Comparator.comparingDouble(t -> t.ratio1);

    private final int[] vertexes;
    private final double ratio1;
    private final double ratio2;
    private final boolean counterClockwise;

    private StarTriangle(final int[] vertexes,
                         final double ratio1,
                         final double ratio2,
                         final boolean counterClockwise) {
        this.vertexes = vertexes;
        this.ratio1 = ratio1;
        this.ratio2 = ratio2;
        this.counterClockwise = counterClockwise;
    }

    /**
     * @return triangle for the specified star indexes, or null if it is degenerate or has
     *         sides too similar in length to order vertexes reliably.
     */
    static StarTriangle build(final List<PlanePoint> points,
                              final int a,
                              final int b,
                              final int c,
                              final double minSideDifference) {

        final int[] indexes = { a, b, c };
        final double[] opposite = {
                points.get(b).distance(points.get(c)),
                points.get(a).distance(points.get(c)),
                points.get(a).distance(points.get(b))
        };

        // sort vertexes by opposite side length, longest first
        for (int i = 0; i < 2; i++) {
            for (int j = i + 1; j < 3; j++) {
                if (opposite[j] > opposite[i]) {
                    final double side = opposite[i];
                    opposite[i] = opposite[j];
                    opposite[j] = side;
                    final int index = indexes[i];
                    indexes[i] = indexes[j];
                    indexes[j] = index;
                }
            }
        }

        if ((opposite[2] <= 0) ||
            ((opposite[0] - opposite[1]) < minSideDifference) ||
            ((opposite[1] - opposite[2]) < minSideDifference)) {
            return null;
        }

        final PlanePoint p0 = points.get(indexes[0]);
        final PlanePoint p1 = points.get(indexes[1]);
        final PlanePoint p2 = points.get(indexes[2]);
        final double cross = (p1.getX() - p0.getX()) * (p2.getY() - p0.getY()) -
                             (p1.getY() - p0.getY()) * (p2.getX() - p0.getX());

        return new StarTriangle(indexes, opposite[1] / opposite[0], opposite[2] / opposite[0], cross > 0);
    }

    /**
     * Builds triangles from every star and each pair of its nearest neighbors.
     */
    static List<StarTriangle> buildAll(final List<PlanePoint> points,
                                       final int numberOfNeighbors,
                                       final double minSideDifference) {

        final List<StarTriangle> triangles = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            final int[] neighbors = findNearestNeighbors(points, i, numberOfNeighbors);
            for (int j = 0; j < neighbors.length; j++) {
                for (int k = j + 1; k < neighbors.length; k++) {
                    // each triangle is built once, from its lowest index vertex
                    if ((neighbors[j] > i) && (neighbors[k] > i)) {
                        final StarTriangle triangle = build(points, i, neighbors[j], neighbors[k], minSideDifference);
                        if (triangle != null) {
                            triangles.add(triangle);
                        }
                    }
                }
            }
        }
        return triangles;
    }

    int getVertex(final int index) {
        return vertexes[index];
    }

    double getRatio1() {
        return ratio1;
    }

    double getRatio2() {
        return ratio2;
    }

    boolean isCounterClockwise() {
        return counterClockwise;
    }

    private static int[] findNearestNeighbors(final List<PlanePoint> points,
                                              final int index,
                                              final int count) {
        final PlanePoint center = points.get(index);
        final List<Integer> others = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            if (i != index) {
                others.add(i);
            }
        }
        others.sort(Comparator.comparingDouble(i -> points.get(i).distanceSquared(center)));
        final int n = Math.min(count, others.size());
        final int[] neighbors = new int[n];
        for (int i = 0; i < n; i++) {
            neighbors[i] = others.get(i);
        }
        return neighbors;
    }

    @Override
    public String toString() {
        return "{vertexes: [" + vertexes[0] + ", " + vertexes[1] + ", " + vertexes[2] + "], ratios: [" +
               ratio1 + ", " + ratio2 + "], counterClockwise: " + counterClockwise + '}';
    }
}
