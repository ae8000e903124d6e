package net.larse.seriesmatch.features;

import com.google.common.base.Preconditions;
import com.google.common.collect.ComparisonChain;
import java.util.Objects;

/**
 * Distance of one candidate to the query. Lower is more similar. Results order by distance,
 * then by candidate name.
 */
public final class MatchResult implements Comparable<MatchResult> {
  private final String name;
  private final double distance;

  public MatchResult(String name, double distance) {
    this.name = Preconditions.checkNotNull(name, "name");
    Preconditions.checkArgument(distance >= 0, "distance must not be negative: %s", distance);
    this.distance = distance;
  }

  public String getName() {
    return name;
  }

  public double getDistance() {
    return distance;
  }

  @Override
  public int compareTo(MatchResult other) {
    return ComparisonChain.start()
        .compare(distance, other.distance)
        .compare(name, other.name)
        .result();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof MatchResult)) {
      return false;
    }
    MatchResult other = (MatchResult) o;
    return Double.compare(distance, other.distance) == 0 && name.equals(other.name);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, distance);
  }

  @Override
  public String toString() {
    return String.format("%s: %.6f", name, distance);
  }
}
