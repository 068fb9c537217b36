package net.larse.robscout.solver;

import net.larse.robscout.SimulatedData;
import net.larse.robscout.helper.MatrixHelper;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.ejml.ops.MatrixFeatures;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class BlockCoordinateGlassoTest {
  DenseMatrix64F s;

  @Before
  public void setUp() throws Exception {
    DenseMatrix64F x = SimulatedData.ar1(200, 6, 0.5, SimulatedData.random(21));
    s = MatrixHelper.covariance(x, false);
  }

  @Test
  public void testLargePenaltyGivesDiagonalPrecision() {
    double lambda = MatrixHelper.maxAbsOffDiagonal(s) * 1.01;
    GlassoPath path = new BlockCoordinateGlasso().solve(s, new double[] {lambda});
    DenseMatrix64F theta = path.precision(0);
    assertTrue(MatrixHelper.isOffDiagonalZero(theta));
    for (int j = 0; j < 6; j++) {
      assertEquals(1 / (s.get(j, j) + lambda), theta.get(j, j), 1e-8);
    }
  }

  @Test
  public void testPrecisionInvertsCovariance() {
    GlassoPath path = new BlockCoordinateGlasso().solve(s, new double[] {0.2, 0.1, 0.05});
    assertEquals(3, path.size());
    for (int i = 0; i < path.size(); i++) {
      DenseMatrix64F product = new DenseMatrix64F(6, 6);
      CommonOps.mult(path.precision(i), path.covariance(i), product);
      assertTrue(MatrixFeatures.isIdentity(product, 1e-3));
      assertTrue(MatrixFeatures.isSymmetric(path.precision(i), 1e-12));
    }
  }

  @Test
  public void testSubgradientConditions() {
    double lambda = 0.1;
    GlassoPath path = new BlockCoordinateGlasso().solve(s, new double[] {lambda});
    DenseMatrix64F w = path.covariance(0);
    DenseMatrix64F theta = path.precision(0);
    for (int j = 0; j < 6; j++) {
      assertEquals(s.get(j, j) + lambda, w.get(j, j), 1e-10);
      for (int k = 0; k < 6; k++) {
        if (j == k) {
          continue;
        }
        double gap = w.get(j, k) - s.get(j, k);
        assertTrue(Math.abs(gap) <= lambda + 1e-3);
        if (Math.abs(theta.get(j, k)) > 1e-6) {
          // w_jk - s_jk = lambda * sign(theta_jk)
          assertEquals(Math.signum(theta.get(j, k)) * lambda, gap, 1e-3);
        }
      }
    }
  }

  @Test
  public void testSparsityGrowsWithPenalty() {
    double max = MatrixHelper.maxAbsOffDiagonal(s);
    GlassoPath path = new BlockCoordinateGlasso().solve(s,
        new double[] {0.9 * max, 0.5 * max, 0.01 * max});
    int previous = -1;
    for (int i = 0; i < path.size(); i++) {
      int nonZero = 0;
      for (double v : path.precision(i).data) {
        if (Math.abs(v) > 1e-8) {
          nonZero++;
        }
      }
      assertTrue(nonZero >= previous);
      previous = nonZero;
    }
  }
}
