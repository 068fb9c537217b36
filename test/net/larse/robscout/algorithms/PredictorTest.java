package net.larse.robscout.algorithms;

import net.larse.robscout.helper.InvalidInputException;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class PredictorTest {
  FittedModel model;

  @Before
  public void setUp() throws Exception {
    // standardized beta (1, -0.5), x scales (2, 4), y scale 3
    model = new FittedModel(0.1, 0.01, new double[] {1, -0.5},
        new double[] {1, 2}, new double[] {2, 4}, 10, 3,
        new double[] {0.1}, new double[] {0.01}, new double[][] {{0.5}, {0.7}},
        new double[] {0.6});
  }

  @Test
  public void testRescaledCoefficientsAndIntercept() {
    assertArrayEquals(new double[] {1.5, -0.375}, model.rescaledCoefficients(), 1e-12);
    // 10 - (1 * 1.5 + 2 * -0.375)
    assertEquals(9.25, model.intercept(), 1e-12);
  }

  @Test
  public void testPredict() {
    DenseMatrix64F x = new DenseMatrix64F(2, 2, true,
        1, 2,
        3, 0);
    assertArrayEquals(new double[] {10, 13.75}, Predictor.predict(model, x, true), 1e-12);
    assertArrayEquals(new double[] {0.75, 4.5}, Predictor.predict(model, x, false), 1e-12);
  }

  @Test
  public void testPredictIsIdempotent() {
    DenseMatrix64F x = new DenseMatrix64F(3, 2, true, 1, 2, 3, 4, 5, 6);
    DenseMatrix64F copy = x.copy();
    double[] first = Predictor.predict(model, x, true);
    double[] second = Predictor.predict(model, x, true);
    assertArrayEquals(first, second, 0);
    assertArrayEquals(copy.data, x.data, 0);
  }

  @Test(expected = InvalidInputException.class)
  public void testColumnMismatch() {
    Predictor.predict(model, new DenseMatrix64F(2, 3), true);
  }

  @Test
  public void testModelIsDefensivelyCopied() {
    double[] coefficients = model.coefficients();
    coefficients[0] = 100;
    assertEquals(1, model.coefficients()[0], 0);
    double[][] errors = model.cvErrors();
    errors[0][0] = 100;
    assertEquals(0.5, model.cvErrors()[0][0], 0);
  }
}
