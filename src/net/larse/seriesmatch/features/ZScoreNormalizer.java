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
package net.larse.seriesmatch.features;

import com.google.common.base.Preconditions;
import net.larse.seriesmatch.helper.ArrayHelper;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;

/**
 * Z-score normalization of one sequence. Statistics come from that sequence alone; nothing is
 * kept between calls.
 */
public final class ZScoreNormalizer {
  /**
   * Relative bound under which a standard deviation counts as zero. Rounding noise in an
   * otherwise constant component must not be blown up to unit variance.
   */
  static final double CONSTANT_TOLERANCE = 1e-12;

  private ZScoreNormalizer() {}

  /**
   * Scales values to zero mean and unit variance (population). NaN entries are read as 0. A
   * sequence whose spread is negligible next to its own magnitude scales to all zeros.
   */
  public static NormalizedComponent normalize(double[] values) {
    return normalize(values, 0);
  }

  /**
   * Like {@link #normalize(double[])}, with the spread also judged against referenceScale.
   * A component of a decomposition passes the magnitude of the whole series here, so that
   * rounding noise left in a flat component counts as constant at any unit of measure.
   *
   * @param referenceScale a magnitude the spread must not be negligible against, at least 0
   */
  public static NormalizedComponent normalize(double[] values, double referenceScale) {
    Preconditions.checkNotNull(values, "values");
    Preconditions.checkArgument(referenceScale >= 0 && !Double.isInfinite(referenceScale),
        "referenceScale must be finite and not negative, got %s", referenceScale);
    double[] x = ArrayHelper.nanToZero(values);
    if (x.length == 0) {
      return new NormalizedComponent(new double[0], new ZScoreTransform(0, 0, true));
    }

    double mean = new Mean().evaluate(x);
    double std = new StandardDeviation(false).evaluate(x, mean);
    double scale = Math.max(referenceScale, ArrayHelper.maxAbs(x));
    boolean constant = std <= CONSTANT_TOLERANCE * scale;

    ZScoreTransform transform = new ZScoreTransform(mean, std, constant);
    double[] scaled = constant ? new double[x.length] : transform.transform(x);
    return new NormalizedComponent(scaled, transform);
  }
}
