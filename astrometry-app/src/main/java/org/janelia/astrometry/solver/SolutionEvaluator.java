package org.janelia.astrometry.solver;

import org.janelia.astrometry.AstrometryException;

/**
 * Matches reference stars for a candidate solution and scores the result.
 */
public interface SolutionEvaluator {

    /**
     * @throws org.janelia.astrometry.catalog.CatalogException
     *   if reference stars cannot be loaded (fatal for the whole solve).
     * @throws AstrometryException
     *   if no usable matches can be found.
     */
    StarEvaluation evaluate(GeometricSolution solution)
            throws AstrometryException;
}
