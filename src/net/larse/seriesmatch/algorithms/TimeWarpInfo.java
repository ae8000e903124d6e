package net.larse.seriesmatch.algorithms;

/** Total cost of an optimal alignment together with the alignment itself. */
public final class TimeWarpInfo {
  private final double distance;
  private final WarpPath path;

  TimeWarpInfo(double distance, WarpPath path) {
    this.distance = distance;
    this.path = path;
  }

  public double getDistance() {
    return distance;
  }

  public WarpPath getPath() {
    return path;
  }

  @Override
  public String toString() {
    return "TimeWarpInfo[distance=" + distance + ", path length=" + path.size() + "]";
  }
}
