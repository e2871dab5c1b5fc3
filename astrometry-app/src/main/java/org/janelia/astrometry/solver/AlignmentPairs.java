package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Index aligned template and image (corner origin) positions of stars matched by an alignment.
 */
public class AlignmentPairs {

    private final List<PlanePoint> templatePoints;
    private final List<PlanePoint> imagePoints;

    public AlignmentPairs(final List<PlanePoint> templatePoints,
                          final List<PlanePoint> imagePoints)
            throws IllegalArgumentException {
        if (templatePoints.size() != imagePoints.size()) {
            throw new IllegalArgumentException("template and image point lists differ in size (" +
                                               templatePoints.size() + " versus " + imagePoints.size() + ")");
        }
        this.templatePoints = Collections.unmodifiableList(new ArrayList<>(templatePoints));
        this.imagePoints = Collections.unmodifiableList(new ArrayList<>(imagePoints));
    }

    public List<PlanePoint> getTemplatePoints() {
        return templatePoints;
    }

    public List<PlanePoint> getImagePoints() {
        return imagePoints;
    }

    public int size() {
        return templatePoints.size();
    }

    /**
     * Concatenates pair sets in order, keeping only the first occurrence of identical pairs.
     */
    public static AlignmentPairs pool(final List<AlignmentPairs> pairSets) {
        final List<PlanePoint> template = new ArrayList<>();
        final List<PlanePoint> image = new ArrayList<>();
        final Set<Pair> seen = new HashSet<>();
        for (final AlignmentPairs pairs : pairSets) {
            for (int i = 0; i < pairs.size(); i++) {
                if (seen.add(new Pair(pairs.templatePoints.get(i), pairs.imagePoints.get(i)))) {
                    template.add(pairs.templatePoints.get(i));
                    image.add(pairs.imagePoints.get(i));
                }
            }
        }
        return new AlignmentPairs(template, image);
    }

    private static class Pair {

        private final PlanePoint template;
        private final PlanePoint image;

        Pair(final PlanePoint template,
             final PlanePoint image) {
            this.template = template;
            this.image = image;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) {
                return true;
            }
            if ((o == null) || (getClass() != o.getClass())) {
                return false;
            }
            final Pair that = (Pair) o;
            return Objects.equals(template, that.template) && Objects.equals(image, that.image);
        }

        @Override
        public int hashCode() {
            return Objects.hash(template, image);
        }
    }
}
