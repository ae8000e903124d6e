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
package net.larse.seriesmatch.timeseries;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * An immutable, chronologically ordered sequence of (timestamp, value) pairs. Timestamps are
 * stored as epoch milliseconds (UTC).
 */
public final class TimeSeries {
  private final long[] timestamps;
  private final double[] values;

  public TimeSeries(long[] timestamps, double[] values) {
    Preconditions.checkNotNull(timestamps, "timestamps");
    Preconditions.checkNotNull(values, "values");
    Preconditions.checkArgument(timestamps.length == values.length,
        "%s timestamps for %s values", timestamps.length, values.length);
    for (int i = 1; i < timestamps.length; i++) {
      Preconditions.checkArgument(timestamps[i - 1] <= timestamps[i],
          "timestamps are not sorted at index %s", i);
    }
    this.timestamps = timestamps.clone();
    this.values = values.clone();
  }

  public static TimeSeries of(List<Instant> instants, double[] values) {
    long[] millis = new long[instants.size()];
    for (int i = 0; i < millis.length; i++) {
      millis[i] = instants.get(i).toEpochMilli();
    }
    return new TimeSeries(millis, values);
  }

  /**
   * Builds a monthly series starting at the first day of the given month. Handy for
   * seasonal data where only the ordering matters.
   */
  public static TimeSeries monthly(int startYear, int startMonth, double... values) {
    long[] millis = new long[values.length];
    LocalDate month = LocalDate.of(startYear, startMonth, 1);
    for (int i = 0; i < values.length; i++) {
      millis[i] = month.plusMonths(i).atStartOfDay(ZoneOffset.UTC).toInstant().toEpochMilli();
    }
    return new TimeSeries(millis, values);
  }

  public int size() {
    return values.length;
  }

  public boolean isEmpty() {
    return values.length == 0;
  }

  public double getValue(int i) {
    return values[i];
  }

  public long getTimestamp(int i) {
    return timestamps[i];
  }

  public Instant getInstant(int i) {
    return Instant.ofEpochMilli(timestamps[i]);
  }

  /** A copy of the values. */
  public double[] getValues() {
    return values.clone();
  }

  /** A copy of the timestamps. */
  public long[] getTimestamps() {
    return timestamps.clone();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TimeSeries)) {
      return false;
    }
    TimeSeries other = (TimeSeries) o;
    return Arrays.equals(timestamps, other.timestamps) && Arrays.equals(values, other.values);
  }

  @Override
  public int hashCode() {
    return 31 * Arrays.hashCode(timestamps) + Arrays.hashCode(values);
  }

  @Override
  public String toString() {
    if (values.length == 0) {
      return "TimeSeries[]";
    }
    return String.format("TimeSeries[%d values, %s .. %s]",
        values.length, getInstant(0), getInstant(values.length - 1));
  }
}
