package net.larse.seriesmatch.features;

import static org.junit.Assert.assertEquals;

import net.larse.seriesmatch.helper.SeriesMatchException;
import net.larse.seriesmatch.timeseries.DecomposedSeries;
import net.larse.seriesmatch.timeseries.SeasonalDecomposition;
import net.larse.seriesmatch.timeseries.TimeSeries;
import org.junit.Test;

public class FeatureVectorBuilderTest {

  @Test
  public void testPairsByIndex() {
    NormalizedComponent trend = ZScoreNormalizer.normalize(new double[] {1, 2, 3});
    NormalizedComponent seasonal = ZScoreNormalizer.normalize(new double[] {5, 5, 5});
    NormalizedComponent residual = ZScoreNormalizer.normalize(new double[] {3, 2, 1});

    FeatureSequence sequence = FeatureVectorBuilder.build(trend, seasonal, residual);

    assertEquals(3, sequence.size());
    for (int i = 0; i < 3; i++) {
      assertEquals(trend.get(i), sequence.get(i).getTrend(), 0.0);
      assertEquals(0.0, sequence.get(i).getSeasonal(), 0.0);
      assertEquals(residual.get(i), sequence.get(i).getResidual(), 0.0);
    }
    assertEquals(-sequence.get(0).getTrend(), sequence.get(0).getResidual(), 1e-12);
  }

  @Test(expected = SeriesMatchException.LengthMismatch.class)
  public void testLengthMismatch() {
    FeatureVectorBuilder.build(
        ZScoreNormalizer.normalize(new double[] {1, 2, 3}),
        ZScoreNormalizer.normalize(new double[] {1, 2}),
        ZScoreNormalizer.normalize(new double[] {1, 2, 3}));
  }

  @Test
  public void testLengthFollowsSeries() {
    double[] values = new double[31];
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.cos(i) + 0.1 * i;
    }
    DecomposedSeries decomposed =
        new SeasonalDecomposition(6).decompose(TimeSeries.monthly(2000, 1, values));

    FeatureSequence sequence = FeatureVectorBuilder.build(decomposed);

    assertEquals(values.length, sequence.size());
  }

  @Test
  public void testFeaturesIgnoreUnitOfMeasure() {
    double[] values = new double[36];
    double[] tiny = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      values[i] = Math.sin(2 * Math.PI * i / 12) + 0.05 * i + 0.3 * Math.cos(1.7 * i);
      tiny[i] = 1e-13 * values[i];
    }
    SeasonalDecomposition decomposition = new SeasonalDecomposition(12);

    FeatureSequence expected =
        FeatureVectorBuilder.build(decomposition.decompose(TimeSeries.monthly(2000, 1, values)));
    FeatureSequence actual =
        FeatureVectorBuilder.build(decomposition.decompose(TimeSeries.monthly(2000, 1, tiny)));

    assertEquals(expected.size(), actual.size());
    for (int i = 0; i < expected.size(); i++) {
      assertEquals(expected.get(i).getTrend(), actual.get(i).getTrend(), 1e-6);
      assertEquals(expected.get(i).getSeasonal(), actual.get(i).getSeasonal(), 1e-6);
      assertEquals(expected.get(i).getResidual(), actual.get(i).getResidual(), 1e-6);
    }
  }

  @Test
  public void testFlatComponentsOfTinySineStayZero() {
    double[] tiny = new double[24];
    for (int i = 0; i < tiny.length; i++) {
      tiny[i] = 1e-13 * Math.sin(2 * Math.PI * i / 12);
    }

    FeatureSequence sequence = FeatureVectorBuilder.build(
        new SeasonalDecomposition(12).decompose(TimeSeries.monthly(2000, 1, tiny)));

    for (int i = 0; i < sequence.size(); i++) {
      assertEquals(0.0, sequence.get(i).getTrend(), 0.0);
      assertEquals(0.0, sequence.get(i).getResidual(), 0.0);
    }
  }
}
