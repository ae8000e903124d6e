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
import com.google.common.base.Throwables;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import net.larse.seriesmatch.features.Candidate;
import net.larse.seriesmatch.features.FeatureSequence;
import net.larse.seriesmatch.features.MatchResult;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ranks candidates by their warping distance to a query and keeps the closest ones.
 *
 * Results are sorted by distance; equal distances are ordered by candidate name. With an
 * executor, one distance task per candidate is submitted and the pass either completes within
 * the timeout or fails as a whole.
 */
public class SimilarityRanker {
  private static final Logger logger = LoggerFactory.getLogger(SimilarityRanker.class);

  private final DistanceEngine engine;
  private final ExecutorService executor;
  private final long timeout;
  private final TimeUnit timeUnit;

  /** Computes distances on the calling thread. */
  public SimilarityRanker(DistanceEngine engine) {
    this.engine = Preconditions.checkNotNull(engine, "engine");
    this.executor = null;
    this.timeout = 0;
    this.timeUnit = TimeUnit.MILLISECONDS;
  }

  /**
   * Computes distances on executor. A non-positive timeout waits without limit.
   */
  public SimilarityRanker(DistanceEngine engine, ExecutorService executor, long timeout,
      TimeUnit timeUnit) {
    this.engine = Preconditions.checkNotNull(engine, "engine");
    this.executor = Preconditions.checkNotNull(executor, "executor");
    this.timeout = timeout;
    this.timeUnit = Preconditions.checkNotNull(timeUnit, "timeUnit");
  }

  public DistanceEngine getEngine() {
    return engine;
  }

  /**
   * @return the min(neighborCount, candidates.size()) closest candidates, closest first
   * @throws SeriesMatchException.InvalidNeighborCount if neighborCount is not positive
   * @throws SeriesMatchException.EmptyCandidateSet if there are no candidates
   * @throws SeriesMatchException.EmptySequence if the query is empty
   * @throws SeriesMatchException.RankingAborted if a parallel pass times out or is interrupted
   */
  public List<MatchResult> rank(FeatureSequence query, Collection<Candidate> candidates,
      int neighborCount) {
    if (neighborCount <= 0) {
      throw new SeriesMatchException.InvalidNeighborCount(neighborCount);
    }
    Preconditions.checkNotNull(candidates, "candidates");
    if (candidates.isEmpty()) {
      throw new SeriesMatchException.EmptyCandidateSet();
    }
    Preconditions.checkNotNull(query, "query");
    if (query.isEmpty()) {
      throw new SeriesMatchException.EmptySequence("Query has no features.");
    }

    List<MatchResult> results = executor == null
        ? scoreSequentially(query, candidates)
        : scoreInParallel(query, candidates);

    logger.debug("Ranked {} candidates, keeping {}", results.size(),
        Math.min(neighborCount, results.size()));
    return Ordering.<MatchResult>natural().leastOf(results, neighborCount);
  }

  private List<MatchResult> scoreSequentially(FeatureSequence query,
      Collection<Candidate> candidates) {
    List<MatchResult> results = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      results.add(score(query, candidate));
    }
    return results;
  }

  private List<MatchResult> scoreInParallel(FeatureSequence query,
      Collection<Candidate> candidates) {
    List<Callable<MatchResult>> tasks = new ArrayList<>(candidates.size());
    for (Candidate candidate : candidates) {
      tasks.add(() -> score(query, candidate));
    }

    List<Future<MatchResult>> futures;
    try {
      futures = timeout > 0
          ? executor.invokeAll(tasks, timeout, timeUnit)
          : executor.invokeAll(tasks);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SeriesMatchException.RankingAborted("Interrupted while ranking.", e);
    }

    List<MatchResult> results = new ArrayList<>(futures.size());
    for (Future<MatchResult> future : futures) {
      if (future.isCancelled()) {
        throw new SeriesMatchException.RankingAborted(String.format(
            "Ranking %d candidates did not finish within %d %s.",
            tasks.size(), timeout, timeUnit.toString().toLowerCase()));
      }
      try {
        results.add(future.get());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new SeriesMatchException.RankingAborted("Interrupted while ranking.", e);
      } catch (ExecutionException e) {
        Throwables.throwIfUnchecked(e.getCause());
        throw new SeriesMatchException.RankingAborted("Distance computation failed.",
            e.getCause());
      }
    }
    return results;
  }

  private MatchResult score(FeatureSequence query, Candidate candidate) {
    return new MatchResult(candidate.getName(), engine.distance(query, candidate.getFeatures()));
  }
}
