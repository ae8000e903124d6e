package net.larse.seriesmatch.timeseries;

import java.util.Arrays;
import net.larse.seriesmatch.helper.ArrayHelper;
import net.larse.seriesmatch.helper.FitGenerator;
import org.apache.commons.math.stat.descriptive.moment.Mean;

/**
 * Kernels of the classical additive decomposition: a centered moving average for the trend,
 * a line fit to fill the trend edges and the per-phase means for the seasonal component.
 */
public class TimeSeriesUtils {

  /**
   * Half width of the centered moving average used for period np. Both odd and even periods
   * leave this many undefined values at each end.
   */
  public static int halfWindow(int np) {
    return np / 2;
  }

  /**
   * Centered moving average over one period.
   *
   * For an odd period the window holds np equal weights. For an even period it holds np + 1
   * weights, the two end ones halved, so the window stays centered.
   *
   * @param y the series
   * @param np periodicity, at least 2
   * @return the smoothed series with NaN where the window does not fit
   */
  public static double[] movingAverage(double[] y, int np) {
    double[] weights = filterWeights(np);
    int half = halfWindow(np);

    double[] trend = new double[y.length];
    Arrays.fill(trend, Double.NaN);

    for (int i = half; i < y.length - half; i++) {
      double sum = 0;
      for (int k = 0; k < weights.length; k++) {
        sum += weights[k] * y[i - half + k];
      }
      trend[i] = sum;
    }
    return trend;
  }

  static double[] filterWeights(int np) {
    double[] weights;
    if (np % 2 == 0) {
      weights = new double[np + 1];
      Arrays.fill(weights, 1.0 / np);
      weights[0] = 0.5 / np;
      weights[np] = 0.5 / np;
    } else {
      weights = new double[np];
      Arrays.fill(weights, 1.0 / np);
    }
    return weights;
  }

  /**
   * Fills the undefined ends of a trend in place. The head is extrapolated from a line fitted
   * to the first npoints defined values, the tail from a line fitted to the last npoints.
   *
   * @param trend a trend with NaN at the ends only
   * @param npoints number of defined values used by each line fit
   */
  public static void extrapolateTrend(double[] trend, int npoints) {
    int front = ArrayHelper.firstFinite(trend, 0, trend.length);
    int back = ArrayHelper.lastFinite(trend, 0, trend.length);
    if (front < 0 || back - front < 1) {
      // Not enough defined values to fit a line.
      return;
    }

    if (front > 0) {
      int frontLast = Math.min(front + npoints, back + 1);
      double[] line = fitSegment(trend, front, frontLast);
      for (int i = 0; i < front; i++) {
        trend[i] = line[0] * i + line[1];
      }
    }

    if (back < trend.length - 1) {
      int backFirst = Math.max(front, back + 1 - npoints);
      double[] line = fitSegment(trend, backFirst, back + 1);
      for (int i = back + 1; i < trend.length; i++) {
        trend[i] = line[0] * i + line[1];
      }
    }
  }

  /** Line through trend[start, end) against the index. */
  private static double[] fitSegment(double[] trend, int start, int end) {
    double[] x = new double[end - start];
    double[] y = new double[end - start];
    for (int i = start; i < end; i++) {
      x[i - start] = i;
      y[i - start] = trend[i];
    }
    return FitGenerator.fitLine(x, y);
  }

  /**
   * Mean of the detrended values at each phase position, centered so the np means sum to zero.
   *
   * @param detrended the series minus its trend
   * @param np periodicity
   */
  public static double[] seasonalMeans(double[] detrended, int np) {
    double[] means = new double[np];
    Mean mean = new Mean();
    for (int j = 0; j < np; j++) {
      int k = (detrended.length - j + np - 1) / np;
      double[] phase = new double[k];
      for (int i = 0; i < k; i++) {
        phase[i] = detrended[i * np + j];
      }
      means[j] = mean.evaluate(phase);
    }

    double center = mean.evaluate(means);
    for (int j = 0; j < np; j++) {
      means[j] -= center;
    }
    return means;
  }
}
