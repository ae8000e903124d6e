package net.larse.seriesmatch.features;

/**
 * The (mean, scale) pair of a z-score normalization. Immutable, so it can be kept and applied
 * again or inverted later.
 */
public final class ZScoreTransform {
  private final double mean;
  private final double std;
  private final double scale;

  ZScoreTransform(double mean, double std, boolean constant) {
    this.mean = mean;
    this.std = std;
    // A constant input is only centered.
    this.scale = constant ? 1.0 : std;
  }

  public double getMean() {
    return mean;
  }

  /** Population standard deviation of the fitted sequence. */
  public double getStd() {
    return std;
  }

  /** Divisor used when scaling; 1 for a constant sequence. */
  public double getScale() {
    return scale;
  }

  /** (x - mean) / scale for each x, NaN taken as 0. */
  public double[] transform(double[] values) {
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      double x = Double.isNaN(values[i]) ? 0.0 : values[i];
      result[i] = (x - mean) / scale;
    }
    return result;
  }

  /** z * scale + mean for each z. */
  public double[] inverse(double[] scaled) {
    double[] result = new double[scaled.length];
    for (int i = 0; i < scaled.length; i++) {
      result[i] = scaled[i] * scale + mean;
    }
    return result;
  }

  @Override
  public String toString() {
    return String.format("ZScoreTransform[mean=%s, std=%s]", mean, std);
  }
}
