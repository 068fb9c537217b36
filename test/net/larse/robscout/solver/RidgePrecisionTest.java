package net.larse.robscout.solver;

import net.larse.robscout.helper.MatrixHelper;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.ejml.ops.MatrixFeatures;
import org.junit.Test;

import static org.junit.Assert.*;

public class RidgePrecisionTest {

  @Test
  public void testClosedFormOnDiagonal() {
    DenseMatrix64F s = CommonOps.diag(4, 1, 0.25);
    double lambda = 0.5;
    DenseMatrix64F theta = new RidgePrecision().solve(s, new double[] {lambda}).precision(0);
    double[] d = {4, 1, 0.25};
    for (int j = 0; j < 3; j++) {
      double expected = (-d[j] + Math.sqrt(d[j] * d[j] + 8 * lambda)) / (4 * lambda);
      assertEquals(expected, theta.get(j, j), 1e-10);
    }
    assertTrue(MatrixHelper.isOffDiagonalZero(theta) || MatrixHelper.maxAbsOffDiagonal(theta)
        < 1e-12);
  }

  @Test
  public void testStationarity() {
    DenseMatrix64F s = new DenseMatrix64F(3, 3, true,
        2, 0.8, 0.3,
        0.8, 1.5, 0.4,
        0.3, 0.4, 1);
    double lambda = 0.3;
    GlassoPath path = new RidgePrecision().solve(s, new double[] {lambda});
    DenseMatrix64F theta = path.precision(0);
    DenseMatrix64F sigma = path.covariance(0);
    // -inverse(theta) + s + 2 lambda theta = 0
    for (int i = 0; i < 3; i++) {
      for (int j = 0; j < 3; j++) {
        double gradient = -sigma.get(i, j) + s.get(i, j) + 2 * lambda * theta.get(i, j);
        assertEquals(0, gradient, 1e-10);
      }
    }
  }

  @Test
  public void testZeroPenaltyIsInverse() {
    DenseMatrix64F s = new DenseMatrix64F(2, 2, true, 2, 0.5, 0.5, 1);
    GlassoPath path = new RidgePrecision().solve(s, new double[] {0});
    DenseMatrix64F product = new DenseMatrix64F(2, 2);
    CommonOps.mult(s, path.precision(0), product);
    assertTrue(MatrixFeatures.isIdentity(product, 1e-10));
    assertTrue(MatrixFeatures.isIdentical(s, path.covariance(0), 1e-10));
  }
}
