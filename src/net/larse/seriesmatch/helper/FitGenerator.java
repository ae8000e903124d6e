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

import com.google.common.base.Preconditions;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.linsol.LinearSolver;

/**
 * A wrapper for OLS fitting.
 */
public class FitGenerator {
  private int numCols;
  private int numRows;

  private DenseMatrix64F matrixA;
  private DenseMatrix64F matrixB;

  public void init(int numCols, int numRows) {
    this.numCols = numCols;
    this.numRows = numRows;
    matrixA = new DenseMatrix64F(numRows, numCols);
    matrixB = new DenseMatrix64F(numRows, 1);
  }

  public void setObservation(int idx, int feature, double value) {
    matrixA.set(idx, feature, value);
  }

  public void setTarget(int idx, double target) {
    matrixB.set(idx, 0, target);
  }

  public double[] linearFit() {
    DenseMatrix64F matrixX = new DenseMatrix64F(numCols, 1);
    LinearSolver<DenseMatrix64F> solver =
        LinearSolverFactory.leastSquares(matrixA.getNumRows(), matrixA.getNumCols());
    if (solver.setA(matrixA) && solver.quality() != 0) {
      solver.solve(matrixB, matrixX);
    }
    // An unsolvable system leaves every coefficient at zero.
    return matrixX.getData();
  }

  /**
   * Fits y = slope * x + intercept over the given points.
   *
   * @return {slope, intercept}
   */
  public static double[] fitLine(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length, "x and y differ in length");
    Preconditions.checkArgument(x.length >= 2, "a line needs at least two points");

    FitGenerator fit = new FitGenerator();
    fit.init(2, x.length);
    for (int i = 0; i < x.length; i++) {
      fit.setObservation(i, 0, x[i]);
      fit.setObservation(i, 1, 1.0);
      fit.setTarget(i, y[i]);
    }
    return fit.linearFit();
  }
}
