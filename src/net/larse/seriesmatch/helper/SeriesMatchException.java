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
package net.larse.seriesmatch.helper;

/**
 * Base class of every reported failure in the matching pipeline. The concrete failures are
 * nested here so callers can catch the whole family or a single member.
 */
public class SeriesMatchException extends RuntimeException {
  private static final long serialVersionUID = 1;

  public SeriesMatchException(String message) {
    super(message);
  }

  public SeriesMatchException(String message, Throwable cause) {
    super(message, cause);
  }

  /** No column of a table parses as timestamps often enough. */
  public static class NoDateColumnFound extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public NoDateColumnFound(String message) {
      super(message);
    }
  }

  /** A series is shorter than two full seasonal periods. */
  public static class InsufficientDataForDecomposition extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    private final int length;
    private final int period;

    public InsufficientDataForDecomposition(int length, int period) {
      super(String.format(
          "Decomposition with period %d needs at least %d values, found %d.",
          period, 2 * period, length));
      this.length = length;
      this.period = period;
    }

    public int getLength() {
      return length;
    }

    public int getPeriod() {
      return period;
    }
  }

  /** A series value is NaN or infinite where a finite number is required. */
  public static class NonFiniteValue extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    private final int index;

    public NonFiniteValue(int index, double value) {
      super(String.format("Non-finite value %s at index %d.", value, index));
      this.index = index;
    }

    public int getIndex() {
      return index;
    }
  }

  public static class LengthMismatch extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public LengthMismatch(String message) {
      super(message);
    }
  }

  public static class EmptySequence extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public EmptySequence(String message) {
      super(message);
    }
  }

  public static class InvalidNeighborCount extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public InvalidNeighborCount(int neighborCount) {
      super("Neighbor count must be positive, got " + neighborCount + ".");
    }
  }

  public static class EmptyCandidateSet extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public EmptyCandidateSet() {
      super("No candidates to rank.");
    }
  }

  /** A parallel ranking pass did not complete. No partial results are kept. */
  public static class RankingAborted extends SeriesMatchException {
    private static final long serialVersionUID = 1;

    public RankingAborted(String message) {
      super(message);
    }

    public RankingAborted(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
