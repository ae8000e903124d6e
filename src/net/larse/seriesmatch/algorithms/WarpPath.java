package net.larse.seriesmatch.algorithms;

import it.unimi.dsi.fastutil.ints.IntArrayList;

/**
 * An alignment between two sequences as a list of (i, j) index pairs running from (0, 0) to
 * (n - 1, m - 1). Each step advances i, j or both by one.
 */
public final class WarpPath {
  private final IntArrayList tsIindexes;
  private final IntArrayList tsJindexes;

  WarpPath(int capacity) {
    tsIindexes = new IntArrayList(capacity);
    tsJindexes = new IntArrayList(capacity);
  }

  void add(int i, int j) {
    tsIindexes.add(i);
    tsJindexes.add(j);
  }

  /** Paths are built from the end backwards; this puts them in forward order. */
  void reverse() {
    reverse(tsIindexes);
    reverse(tsJindexes);
  }

  private static void reverse(IntArrayList list) {
    for (int lo = 0, hi = list.size() - 1; lo < hi; lo++, hi--) {
      int tmp = list.getInt(lo);
      list.set(lo, list.getInt(hi));
      list.set(hi, tmp);
    }
  }

  public int size() {
    return tsIindexes.size();
  }

  public int getI(int k) {
    return tsIindexes.getInt(k);
  }

  public int getJ(int k) {
    return tsJindexes.getInt(k);
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder("[");
    for (int k = 0; k < size(); k++) {
      if (k > 0) {
        sb.append(", ");
      }
      sb.append('(').append(getI(k)).append(',').append(getJ(k)).append(')');
    }
    return sb.append(']').toString();
  }
}
