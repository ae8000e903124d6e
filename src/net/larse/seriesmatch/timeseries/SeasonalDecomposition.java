package net.larse.seriesmatch.timeseries;

import com.google.common.base.Preconditions;
import net.larse.seriesmatch.helper.ArrayHelper;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classical additive decomposition of a series into trend, seasonal and residual parts.
 *
 * The trend is a centered moving average over one period. Its undefined ends are filled by
 * extrapolating a line fitted to the nearest period of trend values. The seasonal part is the
 * mean deviation from the trend at each phase (index mod period), repeated over the series.
 * The residual is whatever is left, so trend + seasonal + residual gives back the series.
 */
public class SeasonalDecomposition {
  private static final Logger logger = LoggerFactory.getLogger(SeasonalDecomposition.class);

  public static final int DEFAULT_PERIOD = 12;

  private final int period;

  public SeasonalDecomposition() {
    this(DEFAULT_PERIOD);
  }

  public SeasonalDecomposition(int period) {
    Preconditions.checkArgument(period >= 2, "period must be at least 2, got %s", period);
    this.period = period;
  }

  public int getPeriod() {
    return period;
  }

  /**
   * @throws SeriesMatchException.InsufficientDataForDecomposition if the series is shorter
   *     than two periods
   * @throws SeriesMatchException.NonFiniteValue if a value is NaN or infinite
   */
  public DecomposedSeries decompose(TimeSeries series) {
    Preconditions.checkNotNull(series, "series");
    double[] y = series.getValues();
    if (y.length < 2 * period) {
      throw new SeriesMatchException.InsufficientDataForDecomposition(y.length, period);
    }
    int bad = ArrayHelper.firstNonFinite(y);
    if (bad >= 0) {
      throw new SeriesMatchException.NonFiniteValue(bad, y[bad]);
    }

    double[] trend = getTrend(y);
    double[] seasonal = getSeasonal(y, trend);
    double[] residual = getResidual(y, trend, seasonal);

    logger.debug("Decomposed {} values with period {}", y.length, period);
    return new DecomposedSeries(series, trend, seasonal, residual, period);
  }

  double[] getTrend(double[] y) {
    double[] trend = TimeSeriesUtils.movingAverage(y, period);
    TimeSeriesUtils.extrapolateTrend(trend, period);
    return trend;
  }

  double[] getSeasonal(double[] y, double[] trend) {
    double[] detrended = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      detrended[i] = y[i] - trend[i];
    }
    double[] means = TimeSeriesUtils.seasonalMeans(detrended, period);

    double[] seasonal = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      seasonal[i] = means[i % period];
    }
    return seasonal;
  }

  double[] getResidual(double[] y, double[] trend, double[] seasonal) {
    double[] residual = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      residual[i] = y[i] - trend[i] - seasonal[i];
    }
    return residual;
  }
}
