package org.janelia.astrometry.transform;

import java.util.ArrayList;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * A mapping between two planar coordinate systems.
 */
public interface PointTransform {

    /**
     * @return the transformed point.
     */
    PlanePoint apply(final PlanePoint point);

    /**
     * @return transformed points in the same order; null entries stay null.
     */
    default List<PlanePoint> applyAll(final List<PlanePoint> points) {
        final List<PlanePoint> transformed = new ArrayList<>(points.size());
        for (final PlanePoint point : points) {
            transformed.add(point == null ? null : apply(point));
        }
        return transformed;
    }

}
