package org.janelia.astrometry.solver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.astrometry.catalog.CatalogStar;
import org.janelia.astrometry.geom.PlanePoint;
import org.janelia.astrometry.match.CorrespondenceSet;
import org.janelia.astrometry.match.MatchScore;
import org.janelia.astrometry.projection.Projection;

/**
 * Result of matching catalog stars against detected stars for one solution.
 *
 * All lists are index aligned with the catalog stars that project into the image.
 * Unmatched entries are null.
 */
public class StarEvaluation {

    private final Projection projection;
    private final List<CatalogStar> catalogStars;
    private final List<PlanePoint> nativePoints;
    private final CorrespondenceSet correspondences;
    private final MatchScore score;

    /**
     * @param  projection       projection the native points were computed with.
     * @param  catalogStars     catalog stars predicted inside the image.
     * @param  nativePoints     native plane positions of the catalog stars (null for rejected duplicates).
     * @param  correspondences  observed image positions versus predicted image positions.
     * @param  score            score of the matches.
     */
    public StarEvaluation(final Projection projection,
                          final List<CatalogStar> catalogStars,
                          final List<PlanePoint> nativePoints,
                          final CorrespondenceSet correspondences,
                          final MatchScore score) {
        this.projection = projection;
        this.catalogStars = Collections.unmodifiableList(new ArrayList<>(catalogStars));
        this.nativePoints = Collections.unmodifiableList(new ArrayList<>(nativePoints));
        this.correspondences = correspondences;
        this.score = score;
    }

    public Projection getProjection() {
        return projection;
    }

    public List<CatalogStar> getCatalogStars() {
        return catalogStars;
    }

    public List<PlanePoint> getNativePoints() {
        return nativePoints;
    }

    /**
     * @return matched image positions (null where a catalog star has no accepted match).
     */
    public List<PlanePoint> getObservedImagePoints() {
        return correspondences.getObserved();
    }

    public CorrespondenceSet getCorrespondences() {
        return correspondences;
    }

    public MatchScore getScore() {
        return score;
    }
}
