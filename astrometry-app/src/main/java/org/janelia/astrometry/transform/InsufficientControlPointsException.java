package org.janelia.astrometry.transform;

/**
 * Raised when a surface spline is requested for fewer control points than its order requires.
 */
public class InsufficientControlPointsException
        extends TransformFitException {

    private final int numberOfPoints;
    private final int minimumNumberOfPoints;

    public InsufficientControlPointsException(final int numberOfPoints,
                                              final int minimumNumberOfPoints) {
        super("surface spline needs at least " + minimumNumberOfPoints + " control points but only " +
              numberOfPoints + " are available");
        this.numberOfPoints = numberOfPoints;
        this.minimumNumberOfPoints = minimumNumberOfPoints;
    }

    public int getNumberOfPoints() {
        return numberOfPoints;
    }

    public int getMinimumNumberOfPoints() {
        return minimumNumberOfPoints;
    }
}
