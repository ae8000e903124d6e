package net.larse.seriesmatch.features;

import com.google.common.base.Preconditions;
import net.larse.seriesmatch.helper.SeriesMatchException;
import net.larse.seriesmatch.timeseries.TimeSeries;

/**
 * A named reference series ready for matching. The source series rides along for reporting;
 * only the feature sequence is compared.
 */
public final class Candidate {
  private final String name;
  private final FeatureSequence features;
  private final TimeSeries source;

  /**
   * @throws SeriesMatchException.EmptySequence if features is empty
   */
  public Candidate(String name, FeatureSequence features, TimeSeries source) {
    this.name = Preconditions.checkNotNull(name, "name");
    this.features = Preconditions.checkNotNull(features, "features");
    this.source = source;
    if (features.isEmpty()) {
      throw new SeriesMatchException.EmptySequence("Candidate '" + name + "' has no features.");
    }
  }

  public Candidate(String name, FeatureSequence features) {
    this(name, features, null);
  }

  public String getName() {
    return name;
  }

  public FeatureSequence getFeatures() {
    return features;
  }

  /** The series the features were computed from, or null if it was not kept. */
  public TimeSeries getSource() {
    return source;
  }

  @Override
  public String toString() {
    return "Candidate[" + name + ", " + features.size() + "]";
  }
}
