package net.larse.robscout.algorithms;

import java.util.Optional;
import net.larse.robscout.SimulatedData;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.UnsupportedOptionException;
import net.larse.robscout.solver.Solvers;
import org.ejml.data.DenseMatrix64F;
import org.ejml.ops.MatrixFeatures;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class PrecisionSelectorTest {
  DenseMatrix64F x;

  @Before
  public void setUp() throws Exception {
    x = SimulatedData.ar1(100, 8, 0.5, SimulatedData.random(31));
  }

  @Test
  public void testBestPenaltyIsOnThePathAtMinimumScore() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    PrecisionSelector.Selection selection = new PrecisionSelector(args).select(x);

    double[] lambdas = selection.path().lambdas();
    assertEquals(args.nlambda, lambdas.length);
    assertTrue(ArrayHelper.isStrictlyDecreasing(lambdas));
    double[] scores = selection.scores();
    int best = ArrayHelper.argMin(scores);
    assertEquals(lambdas[best], selection.lambda(), 0);
    assertSame(selection.path().precision(best), selection.precision());
  }

  @Test
  public void testExplicitPathIsUsed() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.lambdas = new double[] {0.3, 0.2, 0.1};
    args.criterion = "ebic";
    PrecisionSelector.Selection selection = new PrecisionSelector(args).select(x);
    assertArrayEquals(args.lambdas, selection.path().lambdas(), 0);
    assertEquals(3, selection.scores().length);
  }

  @Test
  public void testValidationRowsChangeTheScores() {
    DenseMatrix64F validation = SimulatedData.ar1(50, 8, 0.5, SimulatedData.random(32));
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.criterion = "loglik";
    PrecisionSelector selector = new PrecisionSelector(args);
    double[] inSample = selector.select(x).scores();
    PrecisionSelector.Selection heldOut = selector.select(x, Optional.of(validation));
    assertEquals(inSample.length, heldOut.scores().length);
    assertNotEquals(inSample[0], heldOut.scores()[0], 1e-12);
    int best = ArrayHelper.argMin(heldOut.scores());
    assertEquals(heldOut.path().lambda(best), heldOut.lambda(), 0);
  }

  @Test
  public void testOrthogonalColumnsGiveZeroPenalty() {
    DenseMatrix64F orthogonal = new DenseMatrix64F(4, 2, true,
        1, 1,
        -1, 1,
        1, -1,
        -1, -1);
    PrecisionSelector.Selection selection =
        new PrecisionSelector(new PrecisionSelector.Args()).select(orthogonal);
    assertEquals(1, selection.path().size());
    assertEquals(0, selection.lambda(), 0);
    assertEquals(0, selection.precision().get(0, 1), 0);
  }

  @Test
  public void testRidgeAndUnpenalizedNorms() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.graphNorm = Solvers.RIDGE;
    PrecisionSelector.Selection ridge = new PrecisionSelector(args).select(x);
    assertEquals(args.nlambda, ridge.path().size());

    args.graphNorm = Solvers.NO_PENALTY;
    PrecisionSelector.Selection none = new PrecisionSelector(args).select(x);
    assertEquals(1, none.path().size());
    assertTrue(MatrixFeatures.isSymmetric(none.precision(), 1e-10));
  }

  @Test
  public void testRobustMethod() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.method = "winsor";
    args.centerFunction = "median";
    args.scaleFunction = "mad";
    PrecisionSelector.Selection selection = new PrecisionSelector(args).select(x);
    assertTrue(selection.lambda() > 0);
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownCriterionFailsAtConstruction() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.criterion = "aic";
    new PrecisionSelector(args);
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownMethodFailsAtConstruction() {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.method = "kendall";
    new PrecisionSelector(args);
  }

  @Test(expected = InvalidInputException.class)
  public void testValidationWidthMustMatch() {
    new PrecisionSelector(new PrecisionSelector.Args())
        .select(x, Optional.of(new DenseMatrix64F(10, 3)));
  }
}
