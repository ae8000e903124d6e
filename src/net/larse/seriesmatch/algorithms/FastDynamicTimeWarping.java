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

/**
 * Implements the FastDTW approximation:
 * S. Salvador and P. Chan, FastDTW: Toward Accurate Dynamic Time Warping in Linear Time and
 * Space, Intelligent Data Analysis 11(5), 2007.
 *
 * Both sequences are halved in resolution until one of them is small enough for exact DTW.
 * The path found at each resolution is projected onto the next finer one and widened by the
 * search radius; DTW at that resolution only visits the resulting window.
 */
public final class FastDynamicTimeWarping {
  public static final int DEFAULT_SEARCH_RADIUS = 1;

  private FastDynamicTimeWarping() {}

  public static double getWarpDistBetween(FeatureSequence tsI, FeatureSequence tsJ,
      DistanceFunction distFn) {
    return getWarpInfoBetween(tsI, tsJ, DEFAULT_SEARCH_RADIUS, distFn).getDistance();
  }

  public static double getWarpDistBetween(FeatureSequence tsI, FeatureSequence tsJ,
      int searchRadius, DistanceFunction distFn) {
    return getWarpInfoBetween(tsI, tsJ, searchRadius, distFn).getDistance();
  }

  public static TimeWarpInfo getWarpInfoBetween(FeatureSequence tsI, FeatureSequence tsJ,
      int searchRadius, DistanceFunction distFn) {
    if (tsI.isEmpty() || tsJ.isEmpty()) {
      throw new SeriesMatchException.EmptySequence(String.format(
          "Cannot warp sequences of length %d and %d.", tsI.size(), tsJ.size()));
    }
    if (searchRadius < 0) {
      searchRadius = 0;
    }
    return fastDtw(tsI, tsJ, searchRadius, distFn);
  }

  private static TimeWarpInfo fastDtw(FeatureSequence tsI, FeatureSequence tsJ,
      int searchRadius, DistanceFunction distFn) {
    final int minTSsize = searchRadius + 2;

    if (tsI.size() <= minTSsize || tsJ.size() <= minTSsize) {
      // Small enough for full dynamic time warping.
      return DynamicTimeWarping.getWarpInfoBetween(tsI, tsJ, distFn);
    }

    FeatureSequence shrunkI = tsI.coarsen();
    FeatureSequence shrunkJ = tsJ.coarsen();

    // The window around the lower resolution path bounds the cells evaluated here.
    SearchWindow window = SearchWindow.expanded(
        fastDtw(shrunkI, shrunkJ, searchRadius, distFn).getPath(),
        shrunkI.size(),
        shrunkJ.size(),
        tsI.size(),
        tsJ.size(),
        searchRadius);

    return DynamicTimeWarping.getWarpInfoBetween(tsI, tsJ, window, distFn);
  }
}
