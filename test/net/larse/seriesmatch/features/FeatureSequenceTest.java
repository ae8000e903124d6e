package net.larse.seriesmatch.features;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.junit.Test;

public class FeatureSequenceTest {

  private static FeatureVector v(double t, double s, double r) {
    return new FeatureVector(t, s, r);
  }

  @Test
  public void testCoarsenEven() {
    FeatureSequence sequence = FeatureSequence.of(v(0, 0, 0), v(2, 4, 6), v(1, 1, 1), v(3, 3, 3));

    FeatureSequence coarse = sequence.coarsen();

    assertEquals(2, coarse.size());
    assertEquals(v(1, 2, 3), coarse.get(0));
    assertEquals(v(2, 2, 2), coarse.get(1));
  }

  @Test
  public void testCoarsenOddKeepsLast() {
    FeatureSequence sequence = FeatureSequence.of(v(0, 0, 0), v(2, 2, 2), v(7, 8, 9));

    FeatureSequence coarse = sequence.coarsen();

    assertEquals(2, coarse.size());
    assertEquals(v(1, 1, 1), coarse.get(0));
    assertEquals(v(7, 8, 9), coarse.get(1));
    assertEquals(1, FeatureSequence.of(v(1, 2, 3)).coarsen().size());
  }

  @Test
  public void testEuclideanDistance() {
    assertEquals(5.0, v(0, 3, 0).euclideanDistance(v(0, 0, 4)), 1e-12);
    assertEquals(0.0, v(1, 2, 3).euclideanDistance(v(1, 2, 3)), 0.0);
  }

  @Test
  public void testEmpty() {
    assertTrue(FeatureSequence.of(Collections.<FeatureVector>emptyList()).isEmpty());
    assertSame(FeatureSequence.empty(), FeatureSequence.of(Collections.<FeatureVector>emptyList()));
  }

  @Test(expected = SeriesMatchException.EmptySequence.class)
  public void testCandidateNeedsFeatures() {
    new Candidate("empty", FeatureSequence.empty());
  }

  @Test
  public void testMatchResultOrdering() {
    MatchResult a = new MatchResult("a", 1.0);
    MatchResult b = new MatchResult("b", 1.0);
    MatchResult c = new MatchResult("c", 0.5);

    assertTrue(a.compareTo(b) < 0);
    assertTrue(c.compareTo(a) < 0);
    assertEquals(0, a.compareTo(new MatchResult("a", 1.0)));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeDistance() {
    new MatchResult("a", -1);
  }
}
