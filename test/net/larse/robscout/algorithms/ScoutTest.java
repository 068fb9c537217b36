package net.larse.robscout.algorithms;

import java.util.Arrays;
import java.util.List;
import net.larse.robscout.SimulatedData;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.UnsupportedOptionException;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.MatrixFeatures;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ScoutTest {
  DenseMatrix64F x;
  double[] y;

  @Before
  public void setUp() throws Exception {
    x = SimulatedData.ar1(40, 6, 0.4, SimulatedData.random(71));
    y = SimulatedData.response(x, SimulatedData.sparseBeta(6, 1, 4), 0.5,
        SimulatedData.random(72));
  }

  @Test
  public void testDefaultCovarianceMatchesSampleCovariance() {
    DenseMatrix64F s = Scout.estimateCovariance(x, "default", false);
    assertTrue(MatrixFeatures.isIdentical(MatrixHelper.covariance(x, false), s, 1e-10));
    assertArrayEquals(MatrixHelper.crossCovariance(x, y, false),
        Scout.estimateCovariance(x, y, "default", false), 1e-10);
  }

  @Test
  public void testSelectPrecision() {
    PrecisionSelector.Selection selection = Scout.selectPrecision(x, "winsor", "ebic");
    assertEquals(6, selection.precision().numRows);
    assertEquals(10, selection.scores().length);
  }

  @Test
  public void testFitWithSuppliedFoldsAndPredict() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.numFolds = 4;
    args.nlambda1 = 3;
    args.nlambda2 = 5;
    FittedModel model = Scout.fit(x, y, args, quarters(40));
    assertEquals(4, model.cvErrors().length);

    double[] yHat = Scout.predict(model, x, true);
    assertEquals(40, yHat.length);
    assertTrue(SimulatedData.rmse(yHat, y) < 1.5);
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownMethod() {
    Scout.estimateCovariance(x, "mcd", false);
  }

  private static List<int[]> quarters(int n) {
    int[][] parts = new int[4][];
    for (int f = 0; f < 4; f++) {
      int from = f * n / 4;
      int to = (f + 1) * n / 4;
      parts[f] = new int[to - from];
      for (int i = from; i < to; i++) {
        parts[f][i - from] = i;
      }
    }
    return Arrays.asList(parts);
  }
}
