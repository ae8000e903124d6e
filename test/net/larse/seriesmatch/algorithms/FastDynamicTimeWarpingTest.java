package net.larse.seriesmatch.algorithms;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import net.larse.seriesmatch.features.FeatureSequence;
import net.larse.seriesmatch.features.FeatureVector;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.junit.Before;
import org.junit.Test;

public class FastDynamicTimeWarpingTest {
  private Random random;

  @Before
  public void setUp() throws Exception {
    random = new Random(5);
  }

  private FeatureSequence wave(int length, double phase, double noise) {
    List<FeatureVector> vectors = new ArrayList<>();
    for (int i = 0; i < length; i++) {
      double t = 2 * Math.PI * i / 50.0 + phase;
      vectors.add(new FeatureVector(
          0.01 * i + noise * random.nextGaussian(),
          Math.sin(t) + noise * random.nextGaussian(),
          noise * random.nextGaussian()));
    }
    return FeatureSequence.of(vectors);
  }

  @Test
  public void testIdentityIsZero() {
    FeatureSequence a = wave(301, 0, 0.3);

    TimeWarpInfo info = FastDynamicTimeWarping.getWarpInfoBetween(a, a, 1,
        DistanceFunction.EUCLIDEAN);

    assertEquals(0.0, info.getDistance(), 1e-9);
    DynamicTimeWarpingTest.assertValidPath(info.getPath(), 301, 301);
  }

  @Test
  public void testNeverBelowExact() {
    for (int radius = 0; radius <= 3; radius++) {
      FeatureSequence a = wave(157, 0, 0.2);
      FeatureSequence b = wave(203, 0.7, 0.2);

      double exact = DynamicTimeWarping.getWarpDistBetween(a, b, DistanceFunction.EUCLIDEAN);
      TimeWarpInfo approx =
          FastDynamicTimeWarping.getWarpInfoBetween(a, b, radius, DistanceFunction.EUCLIDEAN);

      assertTrue("radius " + radius, approx.getDistance() >= exact - 1e-9);
      DynamicTimeWarpingTest.assertValidPath(approx.getPath(), 157, 203);
    }
  }

  @Test
  public void testCloseToExact() {
    FeatureSequence a = wave(400, 0, 0.05);
    FeatureSequence b = wave(360, 0.5, 0.05);

    double exact = DynamicTimeWarping.getWarpDistBetween(a, b, DistanceFunction.EUCLIDEAN);
    double approx = FastDynamicTimeWarping.getWarpDistBetween(a, b, 10,
        DistanceFunction.EUCLIDEAN);

    assertTrue(String.format("approx %f exact %f", approx, exact), approx <= exact * 1.1);
  }

  @Test
  public void testWideRadiusIsExact() {
    FeatureSequence a = wave(40, 0, 0.5);
    FeatureSequence b = wave(33, 1.0, 0.5);

    double exact = DynamicTimeWarping.getWarpDistBetween(a, b, DistanceFunction.EUCLIDEAN);
    // One halving; the widened coarse path then spans the whole coarse grid.
    double approx = FastDynamicTimeWarping.getWarpDistBetween(a, b, 20,
        DistanceFunction.EUCLIDEAN);

    assertEquals(exact, approx, 1e-9);
  }

  @Test
  public void testShortSequencesUseExact() {
    FeatureSequence a = wave(3, 0, 1.0);
    FeatureSequence b = wave(90, 0, 1.0);

    assertEquals(
        DynamicTimeWarping.getWarpDistBetween(a, b, DistanceFunction.EUCLIDEAN),
        FastDynamicTimeWarping.getWarpDistBetween(a, b, DistanceFunction.EUCLIDEAN),
        0.0);
  }

  @Test
  public void testNegativeRadiusTreatedAsZero() {
    FeatureSequence a = wave(64, 0, 0.1);
    FeatureSequence b = wave(64, 0.3, 0.1);

    assertEquals(
        FastDynamicTimeWarping.getWarpDistBetween(a, b, 0, DistanceFunction.EUCLIDEAN),
        FastDynamicTimeWarping.getWarpDistBetween(a, b, -4, DistanceFunction.EUCLIDEAN),
        0.0);
  }

  @Test(expected = SeriesMatchException.EmptySequence.class)
  public void testEmptySequence() {
    FastDynamicTimeWarping.getWarpDistBetween(FeatureSequence.empty(), wave(10, 0, 0),
        DistanceFunction.EUCLIDEAN);
  }

  @Test
  public void testExpandedWindowCoversProjectedPath() {
    FeatureSequence a = wave(20, 0, 0.1);
    FeatureSequence b = wave(15, 0, 0.1);
    FeatureSequence shrunkA = a.coarsen();
    FeatureSequence shrunkB = b.coarsen();
    WarpPath coarse = DynamicTimeWarping.getWarpInfoBetween(shrunkA, shrunkB,
        DistanceFunction.EUCLIDEAN).getPath();

    SearchWindow window = SearchWindow.expanded(coarse, shrunkA.size(), shrunkB.size(), 20, 15, 0);

    for (int k = 0; k < coarse.size(); k++) {
      int i = 2 * coarse.getI(k);
      int j = 2 * coarse.getJ(k);
      assertTrue(window.contains(i, j));
      assertTrue(window.contains(Math.min(19, i + 1), Math.min(14, j + 1)));
    }
    assertTrue(window.contains(0, 0));
    assertTrue(window.contains(19, 14));
    assertTrue(window.size() < 20L * 15L);
  }
}
