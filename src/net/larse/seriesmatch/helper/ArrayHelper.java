package net.larse.seriesmatch.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Find the first finite value in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int firstFinite(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = start; i < end; i++) {
      if (Double.isFinite(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /**
   * Find the last finite value in array, between start (incl) and end (excl). if end is
   * negative, it is taken as the number of entries from the end (ie: -1 = len-1).
   */
  public static int lastFinite(double[] array, int start, int end) {
    if (end < 0) {
      end = array.length + end;
    }
    for (int i = end - 1; i >= start; i--) {
      if (Double.isFinite(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /** Index of the first NaN or infinite entry, or -1 if every entry is finite. */
  public static int firstNonFinite(double[] array) {
    for (int i = 0; i < array.length; i++) {
      if (!Double.isFinite(array[i])) {
        return i;
      }
    }
    return -1;
  }

  /** Returns a copy of array with NaN entries replaced by 0. */
  public static double[] nanToZero(double[] array) {
    double[] result = new double[array.length];
    for (int i = 0; i < array.length; i++) {
      result[i] = Double.isNaN(array[i]) ? 0.0 : array[i];
    }
    return result;
  }

  /** Largest absolute value in array, 0 for an empty array. */
  public static double maxAbs(double[] array) {
    double max = 0;
    for (double v : array) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }
}
