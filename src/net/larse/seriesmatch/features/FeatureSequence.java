package net.larse.seriesmatch.features;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** One {@link FeatureVector} per timestamp of a series. This is what gets compared. */
public final class FeatureSequence {
  private static final FeatureSequence EMPTY = new FeatureSequence(ImmutableList.of());

  private final ImmutableList<FeatureVector> vectors;

  private FeatureSequence(ImmutableList<FeatureVector> vectors) {
    this.vectors = vectors;
  }

  public static FeatureSequence of(List<FeatureVector> vectors) {
    Preconditions.checkNotNull(vectors, "vectors");
    return vectors.isEmpty() ? EMPTY : new FeatureSequence(ImmutableList.copyOf(vectors));
  }

  public static FeatureSequence of(FeatureVector... vectors) {
    return of(ImmutableList.copyOf(vectors));
  }

  public static FeatureSequence empty() {
    return EMPTY;
  }

  public int size() {
    return vectors.size();
  }

  public boolean isEmpty() {
    return vectors.isEmpty();
  }

  public FeatureVector get(int i) {
    return vectors.get(i);
  }

  /**
   * Halves the resolution by averaging consecutive pairs. With an odd length the last vector
   * is kept as it is, so the result has ceil(size / 2) entries.
   */
  public FeatureSequence coarsen() {
    ImmutableList.Builder<FeatureVector> shrunk = ImmutableList.builder();
    int i = 0;
    for (; i + 1 < vectors.size(); i += 2) {
      shrunk.add(vectors.get(i).midpoint(vectors.get(i + 1)));
    }
    if (i < vectors.size()) {
      shrunk.add(vectors.get(i));
    }
    return new FeatureSequence(shrunk.build());
  }

  @Override
  public boolean equals(Object o) {
    return this == o
        || (o instanceof FeatureSequence && vectors.equals(((FeatureSequence) o).vectors));
  }

  @Override
  public int hashCode() {
    return vectors.hashCode();
  }

  @Override
  public String toString() {
    return "FeatureSequence[" + vectors.size() + "]";
  }
}
