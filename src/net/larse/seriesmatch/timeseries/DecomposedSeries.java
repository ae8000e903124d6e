package net.larse.seriesmatch.timeseries;

import com.google.common.base.Preconditions;

/**
 * A series together with its additive trend, seasonal and residual components. All four
 * have the same length and no undefined values.
 */
public final class DecomposedSeries {
  private final TimeSeries series;
  private final double[] trend;
  private final double[] seasonal;
  private final double[] residual;
  private final int period;

  DecomposedSeries(TimeSeries series, double[] trend, double[] seasonal, double[] residual,
      int period) {
    Preconditions.checkArgument(trend.length == series.size()
        && seasonal.length == series.size() && residual.length == series.size(),
        "components must match the series length %s", series.size());
    this.series = series;
    this.trend = trend;
    this.seasonal = seasonal;
    this.residual = residual;
    this.period = period;
  }

  public TimeSeries getSeries() {
    return series;
  }

  public double[] getTrend() {
    return trend.clone();
  }

  public double[] getSeasonal() {
    return seasonal.clone();
  }

  public double[] getResidual() {
    return residual.clone();
  }

  public int getPeriod() {
    return period;
  }

  public int size() {
    return series.size();
  }
}
