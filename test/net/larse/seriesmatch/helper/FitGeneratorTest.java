package net.larse.seriesmatch.helper;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class FitGeneratorTest {

  @Test
  public void testFitLineExact() {
    double[] x = {3, 4, 5, 6, 7};
    double[] y = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      y[i] = 2.0 * x[i] - 1.5;
    }

    double[] line = FitGenerator.fitLine(x, y);

    assertEquals(2.0, line[0], 1e-9);
    assertEquals(-1.5, line[1], 1e-9);
  }

  @Test
  public void testFitLineLeastSquares() {
    double[] x = {0, 1, 2, 3};
    double[] y = {0.5, 0.5, 2.5, 2.5};

    double[] line = FitGenerator.fitLine(x, y);

    assertEquals(0.8, line[0], 1e-9);
    assertEquals(0.3, line[1], 1e-9);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testFitLineNeedsTwoPoints() {
    FitGenerator.fitLine(new double[] {1}, new double[] {1});
  }
}
