package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.projection.Projection;

/**
 * Aligned stars expressed as image/native pairs in a projection centered on the estimated image center.
 */
public class ProjectedAlignment {

    private final Projection projection;
    private final List<PlanePoint> imagePoints;
    private final List<PlanePoint> nativePoints;
    private final int alignedCells;

    public ProjectedAlignment(final Projection projection,
                              final List<PlanePoint> imagePoints,
                              final List<PlanePoint> nativePoints,
                              final int alignedCells) {
        this.projection = projection;
        this.imagePoints = Collections.unmodifiableList(new ArrayList<>(imagePoints));
        this.nativePoints = Collections.unmodifiableList(new ArrayList<>(nativePoints));
        this.alignedCells = alignedCells;
    }

    public Projection getProjection() {
        return projection;
    }

    public List<PlanePoint> getImagePoints() {
        return imagePoints;
    }

    /**
     * @return native positions (null where a template star cannot be reprojected).
     */
    public List<PlanePoint> getNativePoints() {
        return nativePoints;
    }

    /**
     * @return number of image regions that were aligned successfully.
     */
    public int getAlignedCells() {
        return alignedCells;
    }

    public int size() {
        return imagePoints.size();
    }
}
