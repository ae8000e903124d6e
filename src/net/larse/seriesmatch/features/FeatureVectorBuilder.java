package net.larse.seriesmatch.features;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import net.larse.seriesmatch.helper.ArrayHelper;
import net.larse.seriesmatch.helper.SeriesMatchException;
import net.larse.seriesmatch.timeseries.DecomposedSeries;

/** Pairs same-index entries of the three normalized components into feature vectors. */
public final class FeatureVectorBuilder {

  private FeatureVectorBuilder() {}

  /**
   * @throws SeriesMatchException.LengthMismatch if the components differ in length
   */
  public static FeatureSequence build(
      NormalizedComponent trend, NormalizedComponent seasonal, NormalizedComponent residual) {
    Preconditions.checkNotNull(trend, "trend");
    Preconditions.checkNotNull(seasonal, "seasonal");
    Preconditions.checkNotNull(residual, "residual");
    if (trend.size() != seasonal.size() || trend.size() != residual.size()) {
      throw new SeriesMatchException.LengthMismatch(String.format(
          "Component lengths differ: trend %d, seasonal %d, residual %d.",
          trend.size(), seasonal.size(), residual.size()));
    }

    List<FeatureVector> vectors = new ArrayList<>(trend.size());
    for (int i = 0; i < trend.size(); i++) {
      vectors.add(new FeatureVector(trend.get(i), seasonal.get(i), residual.get(i)));
    }
    return FeatureSequence.of(vectors);
  }

  /**
   * Normalizes each component of a decomposition on its own and pairs them up. Whether a
   * component is flat is judged against the magnitude of the decomposed series.
   */
  public static FeatureSequence build(DecomposedSeries decomposed) {
    double scale = ArrayHelper.maxAbs(decomposed.getSeries().getValues());
    return build(
        ZScoreNormalizer.normalize(decomposed.getTrend(), scale),
        ZScoreNormalizer.normalize(decomposed.getSeasonal(), scale),
        ZScoreNormalizer.normalize(decomposed.getResidual(), scale));
  }
}
