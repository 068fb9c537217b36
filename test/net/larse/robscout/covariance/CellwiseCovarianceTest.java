package net.larse.robscout.covariance;

import org.ejml.data.DenseMatrix64F;
import org.junit.Test;

import static org.junit.Assert.*;

public class CellwiseCovarianceTest {

  @Test
  public void testSingleColumnSkipsImputation() {
    CellwiseImputer failing = x -> {
      throw new AssertionError("imputer should not run");
    };
    DenseMatrix64F x = new DenseMatrix64F(5, 1, true, 1, 2, 3, 4, 50);
    CellwiseCovariance estimator = new CellwiseCovariance(false, failing);
    assertSame(x, estimator.preprocess(x));
    assertEquals(1, estimator.estimate(x).numRows);
  }

  @Test
  public void testUsesImputedData() {
    CellwiseImputer zeroFirstRow = x -> {
      DenseMatrix64F copy = x.copy();
      for (int j = 0; j < x.numCols; j++) {
        copy.set(0, j, 0);
      }
      return copy;
    };
    DenseMatrix64F x = new DenseMatrix64F(3, 2, true,
        100, 100,
        1, 2,
        -1, -2);
    CellwiseCovariance estimator = new CellwiseCovariance(false, zeroFirstRow);
    // rows (0,0), (1,2), (-1,-2): var of first column = 1
    assertEquals(1, estimator.estimate(x).get(0, 0), 1e-12);
    // y is used as given
    assertEquals(2, estimator.estimate(x, new double[] {0, 2, -2})[0], 1e-12);
  }
}
