package net.larse.seriesmatch.features;

/** The normalized (trend, seasonal, residual) values of a series at one timestamp. */
public final class FeatureVector {
  private final double trend;
  private final double seasonal;
  private final double residual;

  public FeatureVector(double trend, double seasonal, double residual) {
    this.trend = trend;
    this.seasonal = seasonal;
    this.residual = residual;
  }

  public double getTrend() {
    return trend;
  }

  public double getSeasonal() {
    return seasonal;
  }

  public double getResidual() {
    return residual;
  }

  public double euclideanDistance(FeatureVector other) {
    double dt = trend - other.trend;
    double ds = seasonal - other.seasonal;
    double dr = residual - other.residual;
    return Math.sqrt(dt * dt + ds * ds + dr * dr);
  }

  /** Component-wise mean of two vectors. */
  public FeatureVector midpoint(FeatureVector other) {
    return new FeatureVector(
        (trend + other.trend) / 2,
        (seasonal + other.seasonal) / 2,
        (residual + other.residual) / 2);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FeatureVector)) {
      return false;
    }
    FeatureVector other = (FeatureVector) o;
    return Double.compare(trend, other.trend) == 0
        && Double.compare(seasonal, other.seasonal) == 0
        && Double.compare(residual, other.residual) == 0;
  }

  @Override
  public int hashCode() {
    int result = Double.hashCode(trend);
    result = 31 * result + Double.hashCode(seasonal);
    return 31 * result + Double.hashCode(residual);
  }

  @Override
  public String toString() {
    return String.format("(%.4f, %.4f, %.4f)", trend, seasonal, residual);
  }
}
