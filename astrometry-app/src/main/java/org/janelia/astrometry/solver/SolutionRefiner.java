package org.janelia.astrometry.solver;

import org.janelia.astrometry.AstrometryException;

/**
 * Fits a new solution to the star matches of the current one.
 */
public interface SolutionRefiner {

    /**
     * @param  current     solution the evaluation was made for.
     * @param  evaluation  star matches for the current solution.
     *
     * @return newly fitted solution (current is left unchanged).
     *
     * @throws AstrometryException
     *   if the transforms cannot be fitted.
     */
    GeometricSolution refine(GeometricSolution current,
                             StarEvaluation evaluation)
            throws AstrometryException;

    /**
     * @return true if refinement currently relies on a distortion model.
     */
    default boolean isDistortionModelActive() {
        return false;
    }

    /**
     * Stops using the distortion model for subsequent refinements.
     */
    default void dropDistortionModel() {
    }
}
