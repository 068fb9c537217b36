package net.larse.robscout.covariance;

import net.larse.robscout.SimulatedData;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.UnsupportedOptionException;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.MatrixFeatures;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class CovarianceMethodTest {
  DenseMatrix64F x;
  double[] y;

  @Before
  public void setUp() throws Exception {
    x = SimulatedData.ar1(200, 4, 0.6, SimulatedData.random(7));
    y = SimulatedData.response(x, SimulatedData.sparseBeta(4, 0, 2), 0.5,
        SimulatedData.random(8));
  }

  @Test
  public void testFromName() {
    assertEquals(CovarianceMethod.DEFAULT, CovarianceMethod.fromName("default"));
    assertEquals(CovarianceMethod.WINSOR, CovarianceMethod.fromName("Winsor"));
    assertEquals(CovarianceMethod.DDC, CovarianceMethod.fromName(" ddc "));
    assertEquals("wrap", CovarianceMethod.WRAP.tag());
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownMethodIsRejected() {
    CovarianceMethod.fromName("spearman");
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testNullMethodIsRejected() {
    CovarianceMethod.fromName(null);
  }

  @Test
  public void testDefaultIsEmpirical() {
    CovarianceEstimator estimator = CovarianceMethod.DEFAULT.create(false);
    assertTrue(MatrixFeatures.isIdentical(MatrixHelper.covariance(x, false),
        estimator.estimate(x), 0));
    assertArrayEquals(MatrixHelper.crossCovariance(x, y, false), estimator.estimate(x, y), 0);
    assertSame(x, estimator.preprocess(x));
  }

  @Test
  public void testEveryMethodGivesSymmetricEstimates() {
    for (CovarianceMethod method : CovarianceMethod.values()) {
      for (boolean correlation : new boolean[] {false, true}) {
        CovarianceEstimator estimator = method.create(correlation);
        DenseMatrix64F s = estimator.estimate(x);
        assertEquals(4, s.numRows);
        assertTrue(method.tag(), MatrixFeatures.isSymmetric(s, 1e-10));
        for (int j = 0; j < 4; j++) {
          assertTrue(s.get(j, j) > 0);
          if (correlation) {
            assertEquals(1, s.get(j, j), 1e-10);
          }
        }
        assertEquals(4, estimator.estimate(x, y).length);
        DenseMatrix64F cleaned = estimator.preprocess(x);
        assertEquals(x.numRows, cleaned.numRows);
        assertEquals(x.numCols, cleaned.numCols);
      }
    }
  }

  @Test
  public void testRobustMethodsAgreeWithDefaultOnCleanData() {
    DenseMatrix64F reference = CovarianceMethod.DEFAULT.create(true).estimate(x);
    for (CovarianceMethod method : CovarianceMethod.values()) {
      DenseMatrix64F r = method.create(true).estimate(x);
      for (int j = 0; j < 4; j++) {
        for (int k = 0; k < 4; k++) {
          assertEquals(method.tag(), reference.get(j, k), r.get(j, k), 0.15);
        }
      }
    }
  }

  @Test
  public void testRobustMethodsResistAnOutlier() {
    DenseMatrix64F dirty = x.copy();
    dirty.set(0, 0, 1000);
    dirty.set(0, 1, -1000);
    double clean = CovarianceMethod.DEFAULT.create(true).estimate(x).get(0, 1);
    double broken = CovarianceMethod.DEFAULT.create(true).estimate(dirty).get(0, 1);
    assertTrue(broken < 0);
    for (CovarianceMethod method : new CovarianceMethod[] {
        CovarianceMethod.WINSOR, CovarianceMethod.WRAP, CovarianceMethod.DDC}) {
      double robust = method.create(true).estimate(dirty).get(0, 1);
      assertEquals(method.tag(), clean, robust, 0.15);
    }
  }
}
