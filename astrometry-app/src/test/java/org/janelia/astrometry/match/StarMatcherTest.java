package org.janelia.astrometry.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import org.janelia.astrometry.geom.PlanePoint;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link StarMatcher} and {@link CorrespondenceSet} classes.
 */
public class StarMatcherTest {

    @Test
    public void testMatchShiftedField() throws Exception {

        final List<PlanePoint> predicted = new ArrayList<>();
        final List<PlanePoint> detected = new ArrayList<>();
        for (int row = 0; row < 20; row++) {
            for (int column = 0; column < 20; column++) {
                final PlanePoint p = new PlanePoint(25.0 + column * 50.0, 25.0 + row * 50.0);
                predicted.add(p);
                // every seventh star is not detected
                if ((row * 20 + column) % 7 != 0) {
                    detected.add(new PlanePoint(p.getX() + 1.0, p.getY() - 0.5));
                }
            }
        }

        final StarMatcher matcher = new StarMatcher(new StarQuadTree(detected), 5.0, 2.0, 1234L);
        final CorrespondenceSet correspondences = matcher.match(predicted);

        Assert.assertEquals("invalid size", predicted.size(), correspondences.size());
        Assert.assertEquals("invalid number of matches", detected.size(), correspondences.getNumberOfMatches());

        for (int i = 0; i < predicted.size(); i++) {
            if (i % 7 == 0) {
                Assert.assertFalse("undetected star " + i + " should not be matched", correspondences.isMatched(i));
            } else {
                final PlanePoint observed = correspondences.getObserved().get(i);
                Assert.assertEquals("x for star " + i, predicted.get(i).getX() + 1.0, observed.getX(), 1.0e-9);
                Assert.assertEquals("y for star " + i, predicted.get(i).getY() - 0.5, observed.getY(), 1.0e-9);
            }
        }

        final MatchScore score = correspondences.getScore();
        Assert.assertEquals("invalid number of valid pairs", detected.size(), score.getNumValid());
        Assert.assertEquals("invalid number of rejected pairs",
                            predicted.size() - detected.size(), score.getNumRejected());
        Assert.assertEquals("invalid rms", Math.sqrt(1.25), score.getRms(), 1.0e-9);
        Assert.assertEquals("invalid score",
                            MatchScore.computeScore(detected.size(), Math.sqrt(1.25)), score.getScore(), 0.0);
    }

    @Test
    public void testWithRejected() {
        final List<PlanePoint> points = Arrays.asList(new PlanePoint(0, 0),
                                                      new PlanePoint(3, 4),
                                                      new PlanePoint(6, 8));
        final CorrespondenceSet set = new CorrespondenceSet(points, points);
        final CorrespondenceSet rejected = set.withRejected(Arrays.asList(0, 2));

        Assert.assertEquals("original set should be unchanged", 3, set.getNumberOfMatches());
        Assert.assertEquals("invalid number of matches after rejection", 1, rejected.getNumberOfMatches());
        Assert.assertTrue("remaining pair should be matched", rejected.isMatched(1));
    }

    @Test
    public void testFindDuplicates() {
        final List<PlanePoint> points = Arrays.asList(new PlanePoint(1, 2),
                                                      new PlanePoint(3, 4),
                                                      null,
                                                      new PlanePoint(1, 2),
                                                      new PlanePoint(3, 5),
                                                      new PlanePoint(1, 2));
        final Set<Integer> duplicates = CorrespondenceSet.findDuplicates(points);
        Assert.assertEquals("invalid duplicates", new ArrayList<>(Arrays.asList(3, 5)), new ArrayList<>(duplicates));
    }

    @Test
    public void testComputeScore() {
        Assert.assertEquals("invalid score", 66.667, MatchScore.computeScore(100, 0.5), 0.0);
        Assert.assertEquals("invalid score", 0.0, MatchScore.computeScore(0, 0.0), 0.0);
    }
}
