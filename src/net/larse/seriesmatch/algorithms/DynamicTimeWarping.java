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

import net.larse.seriesmatch.features.FeatureSequence;
import net.larse.seriesmatch.helper.SeriesMatchException;
import org.ejml.data.DenseMatrix64F;

/**
 * Dynamic time warping between two feature sequences.
 *
 * cost(i, j) = d(x[i], y[j]) + min(cost(i-1, j), cost(i, j-1), cost(i-1, j-1)) and the
 * distance is cost(n-1, m-1). The unconstrained version fills the whole n x m matrix; the
 * windowed version only fills the cells of a {@link SearchWindow} and keeps one row segment
 * per row, so its memory follows the window size.
 */
public final class DynamicTimeWarping {

  private DynamicTimeWarping() {}

  public static double getWarpDistBetween(FeatureSequence tsI, FeatureSequence tsJ,
      DistanceFunction distFn) {
    return getWarpInfoBetween(tsI, tsJ, distFn).getDistance();
  }

  /** Exact DTW over the full cost matrix. */
  public static TimeWarpInfo getWarpInfoBetween(FeatureSequence tsI, FeatureSequence tsJ,
      DistanceFunction distFn) {
    checkNotEmpty(tsI, tsJ);
    int n = tsI.size();
    int m = tsJ.size();

    DenseMatrix64F costMatrix = new DenseMatrix64F(n, m);
    costMatrix.set(0, 0, distFn.calcDistance(tsI, 0, tsJ, 0));
    for (int j = 1; j < m; j++) {
      costMatrix.set(0, j, costMatrix.get(0, j - 1) + distFn.calcDistance(tsI, 0, tsJ, j));
    }
    for (int i = 1; i < n; i++) {
      costMatrix.set(i, 0, costMatrix.get(i - 1, 0) + distFn.calcDistance(tsI, i, tsJ, 0));
      for (int j = 1; j < m; j++) {
        double minCost = min(
            costMatrix.get(i - 1, j),
            costMatrix.get(i, j - 1),
            costMatrix.get(i - 1, j - 1));
        costMatrix.set(i, j, minCost + distFn.calcDistance(tsI, i, tsJ, j));
      }
    }

    WarpPath path = backtrack(n, m, (i, j) -> costMatrix.get(i, j));
    return new TimeWarpInfo(costMatrix.get(n - 1, m - 1), path);
  }

  /**
   * DTW restricted to the cells of window. Cells outside the window count as unreachable.
   * The window must contain a connected path from (0, 0) to (n-1, m-1).
   */
  public static TimeWarpInfo getWarpInfoBetween(FeatureSequence tsI, FeatureSequence tsJ,
      SearchWindow window, DistanceFunction distFn) {
    checkNotEmpty(tsI, tsJ);
    int n = tsI.size();
    int m = tsJ.size();
    if (window.maxI() != n - 1 || window.maxJ() != m - 1) {
      throw new IllegalArgumentException(String.format(
          "window is %dx%d, sequences are %dx%d",
          window.maxI() + 1, window.maxJ() + 1, n, m));
    }

    WindowedCostMatrix costMatrix = new WindowedCostMatrix(window);
    for (int i = 0; i < n; i++) {
      for (int j = window.minJForI(i); j <= window.maxJForI(i); j++) {
        double localCost = distFn.calcDistance(tsI, i, tsJ, j);
        if (i == 0 && j == 0) {
          costMatrix.set(i, j, localCost);
        } else {
          double minCost = min(
              costMatrix.get(i - 1, j),
              costMatrix.get(i, j - 1),
              costMatrix.get(i - 1, j - 1));
          costMatrix.set(i, j, minCost + localCost);
        }
      }
    }

    double distance = costMatrix.get(n - 1, m - 1);
    if (Double.isInfinite(distance)) {
      throw new IllegalArgumentException("window does not connect (0, 0) to the last cell");
    }
    WarpPath path = backtrack(n, m, costMatrix::get);
    return new TimeWarpInfo(distance, path);
  }

  private static void checkNotEmpty(FeatureSequence tsI, FeatureSequence tsJ) {
    if (tsI.isEmpty() || tsJ.isEmpty()) {
      throw new SeriesMatchException.EmptySequence(String.format(
          "Cannot warp sequences of length %d and %d.", tsI.size(), tsJ.size()));
    }
  }

  private static double min(double a, double b, double c) {
    return Math.min(a, Math.min(b, c));
  }

  private interface CostLookup {
    double get(int i, int j);
  }

  /** Walks back from the last cell along the cheapest predecessor, diagonal first on ties. */
  private static WarpPath backtrack(int n, int m, CostLookup cost) {
    WarpPath path = new WarpPath(n + m);
    int i = n - 1;
    int j = m - 1;
    path.add(i, j);

    while (i > 0 || j > 0) {
      if (i == 0) {
        j--;
      } else if (j == 0) {
        i--;
      } else {
        double diagCost = cost.get(i - 1, j - 1);
        double leftCost = cost.get(i, j - 1);
        double downCost = cost.get(i - 1, j);
        if (diagCost <= leftCost && diagCost <= downCost) {
          i--;
          j--;
        } else if (leftCost < downCost) {
          j--;
        } else {
          i--;
        }
      }
      path.add(i, j);
    }

    path.reverse();
    return path;
  }

  /** Cumulative costs for the cells of a search window; everything else is infinite. */
  private static final class WindowedCostMatrix {
    private final SearchWindow window;
    private final double[][] rows;

    WindowedCostMatrix(SearchWindow window) {
      this.window = window;
      this.rows = new double[window.maxI() + 1][];
      for (int i = 0; i < rows.length; i++) {
        rows[i] = new double[window.maxJForI(i) - window.minJForI(i) + 1];
      }
    }

    double get(int i, int j) {
      if (!window.contains(i, j)) {
        return Double.POSITIVE_INFINITY;
      }
      return rows[i][j - window.minJForI(i)];
    }

    void set(int i, int j, double value) {
      rows[i][j - window.minJForI(i)] = value;
    }
  }
}
