package net.larse.seriesmatch.algorithms;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.larse.seriesmatch.features.Candidate;
import net.larse.seriesmatch.helper.SeriesMatchException;

/**
 * Candidates that made it through feature extraction, plus a record of the ones that did not.
 */
public final class CandidateSet {

  /** A reference series left out of matching and the reason. */
  public static final class Failure {
    private final String name;
    private final SeriesMatchException cause;

    Failure(String name, SeriesMatchException cause) {
      this.name = name;
      this.cause = cause;
    }

    public String getName() {
      return name;
    }

    public SeriesMatchException getCause() {
      return cause;
    }

    @Override
    public String toString() {
      return name + ": " + cause.getMessage();
    }
  }

  private final ImmutableList<Candidate> candidates;
  private final ImmutableList<Failure> failures;

  CandidateSet(List<Candidate> candidates, List<Failure> failures) {
    this.candidates = ImmutableList.copyOf(candidates);
    this.failures = ImmutableList.copyOf(failures);
  }

  public static CandidateSet of(List<Candidate> candidates) {
    return new CandidateSet(candidates, ImmutableList.of());
  }

  public List<Candidate> getCandidates() {
    return candidates;
  }

  public List<Failure> getFailures() {
    return failures;
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  /** The candidate with this name, or null. */
  public Candidate find(String name) {
    for (Candidate candidate : candidates) {
      if (candidate.getName().equals(name)) {
        return candidate;
      }
    }
    return null;
  }
}
