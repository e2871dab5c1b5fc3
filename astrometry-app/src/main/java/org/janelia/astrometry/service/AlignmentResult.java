package org.janelia.astrometry.service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.geom.PixelConvention;
import org.janelia.astrometry.geom.PlanePoint;

/**
 * Index aligned template/image star pairs produced by a {@link StarAlignmentService}.
 */
public class AlignmentResult {

    private final List<PlanePoint> templatePoints;
    private final List<PlanePoint> imagePoints;
    private final PixelConvention imageConvention;

    public AlignmentResult(final List<PlanePoint> templatePoints,
                           final List<PlanePoint> imagePoints,
                           final PixelConvention imageConvention)
            throws IllegalArgumentException {
        if (templatePoints.size() != imagePoints.size()) {
            throw new IllegalArgumentException("template and image point lists differ in size (" +
                                               templatePoints.size() + " versus " + imagePoints.size() + ")");
        }
        this.templatePoints = Collections.unmodifiableList(new ArrayList<>(templatePoints));
        this.imagePoints = Collections.unmodifiableList(new ArrayList<>(imagePoints));
        this.imageConvention = imageConvention;
    }

    public List<PlanePoint> getTemplatePoints() {
        return templatePoints;
    }

    /**
     * @return image points in the convention reported by {@link #getImageConvention()}.
     */
    public List<PlanePoint> getImagePoints() {
        return imagePoints;
    }

    public PixelConvention getImageConvention() {
        return imageConvention;
    }

    public int size() {
        return templatePoints.size();
    }
}
