/*
 * Copyright (c) 2015 LCMS Project Authors.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.seriesmatch.algorithms;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import net.larse.seriesmatch.features.Candidate;
import net.larse.seriesmatch.features.FeatureSequence;
import net.larse.seriesmatch.features.FeatureVectorBuilder;
import net.larse.seriesmatch.features.MatchResult;
import net.larse.seriesmatch.helper.SeriesMatchException;
import net.larse.seriesmatch.timeseries.DateColumnResolver;
import net.larse.seriesmatch.timeseries.DecomposedSeries;
import net.larse.seriesmatch.timeseries.SeasonalDecomposition;
import net.larse.seriesmatch.timeseries.TableSeriesExtractor;
import net.larse.seriesmatch.timeseries.TimeSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the reference series closest in shape to a query.
 *
 * Every series goes through the same steps: seasonal decomposition with one fixed period,
 * z-score normalization of trend, seasonal and residual on their own, and pairing into one
 * 3-D feature vector per timestamp. Candidates are then ranked by their warping distance to
 * the query's feature sequence.
 *
 * A reference series that fails feature extraction is left out and recorded; a query that
 * fails aborts the call.
 */
public final class SeriesMatcher {
  private static final Logger logger = LoggerFactory.getLogger(SeriesMatcher.class);

  public static class Args {
    static final String PREFIX = "seriesmatch.";

    /** Seasonal period used for every series of a run. */
    public int period = SeasonalDecomposition.DEFAULT_PERIOD;

    /** Number of closest candidates to return. */
    public int neighborCount = 5;

    /** Minimum share of parseable timestamps for a table column to be the time axis. */
    public double dateColumnThreshold = DateColumnResolver.DEFAULT_THRESHOLD;

    /** Which warping algorithm to use. */
    public DistanceEngine.Mode distanceMode = DistanceEngine.Mode.AUTO;

    /** In AUTO mode, sequences longer than this go through FastDTW. */
    public int approximationThreshold = DistanceEngine.DEFAULT_APPROXIMATION_THRESHOLD;

    /** FastDTW search radius, in cells of the coarser resolution. */
    public int searchRadius = FastDynamicTimeWarping.DEFAULT_SEARCH_RADIUS;

    public Args validate() {
      Preconditions.checkArgument(period >= 2, "period must be at least 2, got %s", period);
      Preconditions.checkArgument(neighborCount > 0,
          "neighborCount must be positive, got %s", neighborCount);
      Preconditions.checkArgument(dateColumnThreshold > 0 && dateColumnThreshold <= 1,
          "dateColumnThreshold must be in (0, 1], got %s", dateColumnThreshold);
      Preconditions.checkNotNull(distanceMode, "distanceMode");
      Preconditions.checkArgument(approximationThreshold > 0,
          "approximationThreshold must be positive, got %s", approximationThreshold);
      Preconditions.checkArgument(searchRadius >= 0,
          "searchRadius must not be negative, got %s", searchRadius);
      return this;
    }

    /**
     * Reads seriesmatch.* keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException for a value that does not parse or is out of range
     */
    public static Args fromProperties(Properties properties) {
      Args args = new Args();
      args.period = intProperty(properties, "period", args.period);
      args.neighborCount = intProperty(properties, "neighborCount", args.neighborCount);
      args.approximationThreshold =
          intProperty(properties, "approximationThreshold", args.approximationThreshold);
      args.searchRadius = intProperty(properties, "searchRadius", args.searchRadius);

      String threshold = properties.getProperty(PREFIX + "dateColumnThreshold");
      if (threshold != null) {
        Double value = Doubles.tryParse(threshold.trim());
        Preconditions.checkArgument(value != null,
            "%sdateColumnThreshold is not a number: %s", PREFIX, threshold);
        args.dateColumnThreshold = value;
      }

      String mode = properties.getProperty(PREFIX + "distanceMode");
      if (mode != null) {
        args.distanceMode = DistanceEngine.Mode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
      }
      return args.validate();
    }

    private static int intProperty(Properties properties, String key, int defaultValue) {
      String raw = properties.getProperty(PREFIX + key);
      if (raw == null) {
        return defaultValue;
      }
      Integer value = Ints.tryParse(raw.trim());
      Preconditions.checkArgument(value != null, "%s%s is not an integer: %s", PREFIX, key, raw);
      return value;
    }
  }

  private final Args args;
  private final SeasonalDecomposition decomposition;
  private final TableSeriesExtractor extractor;
  private final SimilarityRanker ranker;

  public SeriesMatcher() {
    this(new Args());
  }

  public SeriesMatcher(Args args) {
    this.args = args.validate();
    this.decomposition = new SeasonalDecomposition(args.period);
    this.extractor = new TableSeriesExtractor(new DateColumnResolver(args.dateColumnThreshold));
    this.ranker = new SimilarityRanker(engine(args));
  }

  /** Ranks on executor; the whole pass must finish within timeout. */
  public SeriesMatcher(Args args, ExecutorService executor, long timeout, TimeUnit timeUnit) {
    this.args = args.validate();
    this.decomposition = new SeasonalDecomposition(args.period);
    this.extractor = new TableSeriesExtractor(new DateColumnResolver(args.dateColumnThreshold));
    this.ranker = new SimilarityRanker(engine(args), executor, timeout, timeUnit);
  }

  private static DistanceEngine engine(Args args) {
    return new DistanceEngine(args.distanceMode, args.approximationThreshold, args.searchRadius);
  }

  public Args getArgs() {
    return args;
  }

  /** Series of targetColumn against the table's time column. */
  public TimeSeries fromTable(Map<String, ? extends List<?>> table, String targetColumn) {
    return extractor.extract(table, targetColumn);
  }

  public DecomposedSeries decompose(TimeSeries series) {
    return decomposition.decompose(series);
  }

  /**
   * Decomposes, normalizes and pairs up the components of series. The result has one vector
   * per value of series.
   */
  public FeatureSequence extractFeatures(TimeSeries series) {
    return FeatureVectorBuilder.build(decomposition.decompose(series));
  }

  public Candidate prepareCandidate(String name, TimeSeries series) {
    return new Candidate(name, extractFeatures(series), series);
  }

  /**
   * Extracts features for every reference series in map order. Series that fail are recorded
   * as failures instead of aborting the batch.
   */
  public CandidateSet prepareCandidates(Map<String, TimeSeries> references) {
    List<Candidate> candidates = new ArrayList<>(references.size());
    List<CandidateSet.Failure> failures = new ArrayList<>();
    for (Map.Entry<String, TimeSeries> reference : references.entrySet()) {
      try {
        candidates.add(prepareCandidate(reference.getKey(), reference.getValue()));
      } catch (SeriesMatchException e) {
        logger.warn("Excluding candidate '{}': {}", reference.getKey(), e.getMessage());
        failures.add(new CandidateSet.Failure(reference.getKey(), e));
      }
    }
    return new CandidateSet(candidates, failures);
  }

  /** The args.neighborCount candidates closest to query. */
  public List<MatchResult> findMatches(TimeSeries query, CandidateSet candidates) {
    return findMatches(extractFeatures(query), candidates);
  }

  public List<MatchResult> findMatches(FeatureSequence query, CandidateSet candidates) {
    return ranker.rank(query, candidates.getCandidates(), args.neighborCount);
  }

  /** Like {@link #findMatches(TimeSeries, CandidateSet)}, with the series attached. */
  public List<MatchReport> report(TimeSeries query, CandidateSet candidates) {
    List<MatchResult> matches = findMatches(query, candidates);
    List<MatchReport> reports = new ArrayList<>(matches.size());
    for (MatchResult match : matches) {
      Candidate candidate = candidates.find(match.getName());
      reports.add(new MatchReport(query, match.getName(),
          candidate == null ? null : candidate.getSource(), match.getDistance()));
    }
    return reports;
  }
}
