package net.larse.seriesmatch.algorithms;

import com.google.common.base.Preconditions;
import java.util.Arrays;

/**
 * The cells of an n x m cost matrix that a constrained warping search may visit, stored as
 * one contiguous column range per row.
 */
public final class SearchWindow {
  private final int[] minValues;
  private final int[] maxValues;
  private final int maxJ;

  private SearchWindow(int rows, int cols) {
    minValues = new int[rows];
    maxValues = new int[rows];
    Arrays.fill(minValues, Integer.MAX_VALUE);
    Arrays.fill(maxValues, Integer.MIN_VALUE);
    maxJ = cols - 1;
  }

  /** Every cell of an n x m matrix. */
  public static SearchWindow full(int n, int m) {
    SearchWindow window = new SearchWindow(n, m);
    for (int i = 0; i < n; i++) {
      window.markVisited(i, 0);
      window.markVisited(i, m - 1);
    }
    return window;
  }

  /**
   * Projects a path found on half-resolution sequences onto the full-resolution matrix and
   * widens it by radius coarse cells in every direction. Coarse cell (i, j) covers full rows
   * 2i and 2i + 1 and full columns 2j and 2j + 1.
   *
   * @param coarsePath optimal path between the shrunk sequences
   * @param coarseN length of the first shrunk sequence
   * @param coarseM length of the second shrunk sequence
   * @param n length of the first full sequence
   * @param m length of the second full sequence
   * @param radius extra coarse cells kept around the path
   */
  public static SearchWindow expanded(WarpPath coarsePath, int coarseN, int coarseM,
      int n, int m, int radius) {
    Preconditions.checkArgument(radius >= 0, "radius must not be negative");
    SearchWindow window = new SearchWindow(n, m);

    for (int k = 0; k < coarsePath.size(); k++) {
      int ci = coarsePath.getI(k);
      int cj = coarsePath.getJ(k);
      int loI = Math.max(0, ci - radius);
      int hiI = Math.min(coarseN - 1, ci + radius);
      int loJ = Math.max(0, cj - radius);
      int hiJ = Math.min(coarseM - 1, cj + radius);

      int firstCol = 2 * loJ;
      int lastCol = Math.min(m - 1, 2 * hiJ + 1);
      for (int a = loI; a <= hiI; a++) {
        for (int row = 2 * a; row <= Math.min(n - 1, 2 * a + 1); row++) {
          window.markVisited(row, firstCol);
          window.markVisited(row, lastCol);
        }
      }
    }

    for (int i = 0; i < n; i++) {
      Preconditions.checkState(window.minValues[i] <= window.maxValues[i],
          "projected path leaves row %s uncovered", i);
    }
    return window;
  }

  private void markVisited(int row, int col) {
    minValues[row] = Math.min(minValues[row], col);
    maxValues[row] = Math.max(maxValues[row], col);
  }

  public int maxI() {
    return minValues.length - 1;
  }

  public int maxJ() {
    return maxJ;
  }

  public int minJForI(int i) {
    return minValues[i];
  }

  public int maxJForI(int i) {
    return maxValues[i];
  }

  public boolean contains(int i, int j) {
    return i >= 0 && i < minValues.length && j >= minValues[i] && j <= maxValues[i];
  }

  /** Number of cells inside the window. */
  public long size() {
    long size = 0;
    for (int i = 0; i < minValues.length; i++) {
      size += maxValues[i] - minValues[i] + 1;
    }
    return size;
  }
}
