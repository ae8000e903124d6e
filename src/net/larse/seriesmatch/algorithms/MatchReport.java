package net.larse.seriesmatch.algorithms;

import net.larse.seriesmatch.timeseries.TimeSeries;

/** A query, one of its matches and their distance, as handed to a plotting front end. */
public final class MatchReport {
  private final TimeSeries query;
  private final String name;
  private final TimeSeries matched;
  private final double distance;

  MatchReport(TimeSeries query, String name, TimeSeries matched, double distance) {
    this.query = query;
    this.name = name;
    this.matched = matched;
    this.distance = distance;
  }

  public TimeSeries getQuery() {
    return query;
  }

  public String getName() {
    return name;
  }

  /** The matched reference series, or null if its candidate did not keep it. */
  public TimeSeries getMatched() {
    return matched;
  }

  public double getDistance() {
    return distance;
  }

  @Override
  public String toString() {
    return String.format("MatchReport[%s, distance=%.6f]", name, distance);
  }
}
