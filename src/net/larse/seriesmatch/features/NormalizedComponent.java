package net.larse.seriesmatch.features;

/** A scaled component sequence and the transform that produced it. */
public final class NormalizedComponent {
  private final double[] values;
  private final ZScoreTransform transform;

  NormalizedComponent(double[] values, ZScoreTransform transform) {
    this.values = values;
    this.transform = transform;
  }

  public double[] getValues() {
    return values.clone();
  }

  public double get(int i) {
    return values[i];
  }

  public int size() {
    return values.length;
  }

  public ZScoreTransform getTransform() {
    return transform;
  }

  /** The component as it was before scaling, NaN entries read as 0. */
  public double[] inverse() {
    return transform.inverse(values);
  }
}
