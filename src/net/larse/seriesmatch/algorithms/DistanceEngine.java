package net.larse.seriesmatch.algorithms;

import com.google.common.base.Preconditions;
import net.larse.seriesmatch.features.FeatureSequence;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Elastic distance between two feature sequences with Euclidean local cost.
 *
 * {@link Mode#EXACT} always fills the full cost matrix. {@link Mode#APPROXIMATE} always
 * runs FastDTW. {@link Mode#AUTO} runs exact DTW unless either sequence is longer than the
 * approximation threshold. The two algorithms can return slightly different distances for
 * the same pair, so results are only comparable within one mode.
 */
public final class DistanceEngine {
  private static final Logger logger = LoggerFactory.getLogger(DistanceEngine.class);

  public static final int DEFAULT_APPROXIMATION_THRESHOLD = 1024;

  public enum Mode {
    EXACT,
    APPROXIMATE,
    AUTO
  }

  private final Mode mode;
  private final int approximationThreshold;
  private final int searchRadius;
  private final DistanceFunction distFn;

  /** AUTO mode with the default threshold and search radius. */
  public DistanceEngine() {
    this(Mode.AUTO, DEFAULT_APPROXIMATION_THRESHOLD,
        FastDynamicTimeWarping.DEFAULT_SEARCH_RADIUS);
  }

  public DistanceEngine(Mode mode, int approximationThreshold, int searchRadius) {
    this(mode, approximationThreshold, searchRadius, DistanceFunction.EUCLIDEAN);
  }

  public DistanceEngine(Mode mode, int approximationThreshold, int searchRadius,
      DistanceFunction distFn) {
    this.mode = Preconditions.checkNotNull(mode, "mode");
    Preconditions.checkArgument(approximationThreshold > 0,
        "approximation threshold must be positive, got %s", approximationThreshold);
    Preconditions.checkArgument(searchRadius >= 0,
        "search radius must not be negative, got %s", searchRadius);
    this.approximationThreshold = approximationThreshold;
    this.searchRadius = searchRadius;
    this.distFn = Preconditions.checkNotNull(distFn, "distFn");
  }

  public static DistanceEngine exact() {
    return new DistanceEngine(Mode.EXACT, DEFAULT_APPROXIMATION_THRESHOLD,
        FastDynamicTimeWarping.DEFAULT_SEARCH_RADIUS);
  }

  public static DistanceEngine approximate(int searchRadius) {
    return new DistanceEngine(Mode.APPROXIMATE, DEFAULT_APPROXIMATION_THRESHOLD, searchRadius);
  }

  public Mode getMode() {
    return mode;
  }

  /** True if a pair of these lengths would go through FastDTW. */
  public boolean isApproximate(int lengthA, int lengthB) {
    switch (mode) {
      case EXACT:
        return false;
      case APPROXIMATE:
        return true;
      default:
        return Math.max(lengthA, lengthB) > approximationThreshold;
    }
  }

  /**
   * @throws SeriesMatchException.EmptySequence if either sequence is empty
   */
  public double distance(FeatureSequence a, FeatureSequence b) {
    return warp(a, b).getDistance();
  }

  /**
   * Distance plus the optimal alignment.
   *
   * @throws SeriesMatchException.EmptySequence if either sequence is empty
   */
  public TimeWarpInfo warp(FeatureSequence a, FeatureSequence b) {
    Preconditions.checkNotNull(a, "a");
    Preconditions.checkNotNull(b, "b");
    if (a.isEmpty() || b.isEmpty()) {
      throw new SeriesMatchException.EmptySequence(String.format(
          "Cannot compare sequences of length %d and %d.", a.size(), b.size()));
    }

    if (isApproximate(a.size(), b.size())) {
      logger.debug("FastDTW (radius {}) on {} x {}", searchRadius, a.size(), b.size());
      return FastDynamicTimeWarping.getWarpInfoBetween(a, b, searchRadius, distFn);
    }
    logger.debug("Exact DTW on {} x {}", a.size(), b.size());
    return DynamicTimeWarping.getWarpInfoBetween(a, b, distFn);
  }

  @Override
  public String toString() {
    return String.format("DistanceEngine[mode=%s, threshold=%d, radius=%d]",
        mode, approximationThreshold, searchRadius);
  }
}
