package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Index aligned observed and predicted positions.
 * A null observed entry means the predicted star has no accepted match.
 */
public class CorrespondenceSet {

    private final List<PlanePoint> observed;
    private final List<PlanePoint> predicted;

    public CorrespondenceSet(final List<PlanePoint> observed,
                             final List<PlanePoint> predicted)
            throws IllegalArgumentException {
        if (observed.size() != predicted.size()) {
            throw new IllegalArgumentException("observed and predicted lists differ in size (" +
                                               observed.size() + " versus " + predicted.size() + ")");
        }
        this.observed = Collections.unmodifiableList(new ArrayList<>(observed));
        this.predicted = Collections.unmodifiableList(new ArrayList<>(predicted));
    }

    public int size() {
        return observed.size();
    }

    public List<PlanePoint> getObserved() {
        return observed;
    }

    public List<PlanePoint> getPredicted() {
        return predicted;
    }

    public boolean isMatched(final int index) {
        return (observed.get(index) != null) && (predicted.get(index) != null);
    }

    public int getNumberOfMatches() {
        int count = 0;
        for (int i = 0; i < observed.size(); i++) {
            if (isMatched(i)) {
                count++;
            }
        }
        return count;
    }

    /**
     * @return copy of this set with the observed entries of the specified indexes cleared.
     */
    public CorrespondenceSet withRejected(final Collection<Integer> indexes) {
        final List<PlanePoint> kept = new ArrayList<>(observed);
        for (final Integer i : indexes) {
            kept.set(i, null);
        }
        return new CorrespondenceSet(kept, predicted);
    }

    /**
     * @return distance between predicted and observed positions for every matched pair (in index order).
     */
    public double[] getErrors() {
        final double[] errors = new double[getNumberOfMatches()];
        int count = 0;
        for (int i = 0; i < observed.size(); i++) {
            if (isMatched(i)) {
                errors[count++] = observed.get(i).distance(predicted.get(i));
            }
        }
        return errors;
    }

    public MatchScore getScore() {
        final double[] errors = getErrors();
        return MatchScore.fromErrors(errors, size() - errors.length);
    }

    /**
     * Sorts the non-null points lexicographically and reports every point equal to its predecessor.
     *
     * @return indexes of all but the first occurrence of each repeated position.
     */
    public static Set<Integer> findDuplicates(final List<PlanePoint> points) {
        final List<Integer> order = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            if (points.get(i) != null) {
                order.add(i);
            }
        }
        order.sort(Comparator.<Integer>comparingDouble(i -> points.get(i).getX())
                           .thenComparingDouble(i -> points.get(i).getY())
                           .thenComparingInt(i -> i));

        final Set<Integer> duplicates = new TreeSet<>();
        for (int k = 1; k < order.size(); k++) {
            if (points.get(order.get(k)).equals(points.get(order.get(k - 1)))) {
                duplicates.add(order.get(k));
            }
        }
        return duplicates;
    }
}
