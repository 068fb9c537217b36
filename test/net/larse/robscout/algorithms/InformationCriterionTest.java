package net.larse.robscout.algorithms;

import net.larse.robscout.helper.UnsupportedOptionException;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.CommonOps;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class InformationCriterionTest {
  DenseMatrix64F theta;
  DenseMatrix64F identity;

  @Before
  public void setUp() throws Exception {
    theta = new DenseMatrix64F(3, 3, true,
        2, 0.5, 0,
        0.5, 2, 0,
        0, 0, 1);
    identity = CommonOps.identity(3);
  }

  @Test
  public void testLogLikelihood() {
    // det = 3.75, tr(theta) = 5
    double expected = -Math.log(3.75) + 5;
    assertEquals(expected, InformationCriterion.LOGLIK.score(theta, identity, 10), 1e-12);
    assertEquals(3, InformationCriterion.LOGLIK.score(identity, identity, 10), 1e-12);
  }

  @Test
  public void testBicCountsLowerTriangleWithDiagonal() {
    double loglik = -Math.log(3.75) + 5;
    double expected = loglik + Math.log(10) / 10 * 4;
    assertEquals(expected, InformationCriterion.BIC.score(theta, identity, 10), 1e-12);
  }

  @Test
  public void testEbicAddsOffDiagonalTerm() {
    double bic = InformationCriterion.BIC.score(theta, identity, 10);
    double expected = bic + 1 * 0.5 * 4 * Math.log(3) / 10;
    assertEquals(expected, InformationCriterion.EBIC.score(theta, identity, 10), 1e-12);
    // no edges, no extra term
    assertEquals(InformationCriterion.BIC.score(identity, identity, 10),
        InformationCriterion.EBIC.score(identity, identity, 10), 0);
  }

  @Test
  public void testTinyEntriesAreNotCounted() {
    DenseMatrix64F almostDiagonal = identity.copy();
    almostDiagonal.set(0, 1, 1e-10);
    almostDiagonal.set(1, 0, 1e-10);
    assertEquals(InformationCriterion.BIC.score(identity, identity, 10),
        InformationCriterion.BIC.score(almostDiagonal, identity, 10), 1e-9);
  }

  @Test
  public void testFiniteForPositiveDefiniteInput() {
    for (InformationCriterion criterion : InformationCriterion.values()) {
      assertFalse(Double.isInfinite(criterion.score(theta, theta, 25)));
      assertFalse(Double.isNaN(criterion.score(theta, theta, 25)));
    }
  }

  @Test
  public void testFromName() {
    assertEquals(InformationCriterion.BIC, InformationCriterion.fromName("bic"));
    assertEquals(InformationCriterion.EBIC, InformationCriterion.fromName(" EBIC "));
    assertEquals(InformationCriterion.LOGLIK, InformationCriterion.fromName("loglik"));
    assertEquals("ebic", InformationCriterion.EBIC.tag());
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownCriterion() {
    InformationCriterion.fromName("aic");
  }
}
