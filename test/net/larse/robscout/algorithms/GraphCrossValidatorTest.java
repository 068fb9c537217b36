package net.larse.robscout.algorithms;

import java.util.Arrays;
import java.util.Collections;
import net.larse.robscout.SimulatedData;
import net.larse.robscout.covariance.CovarianceMethod;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.solver.BlockCoordinateGlasso;
import net.larse.robscout.solver.GlassoPath;
import net.larse.robscout.solver.GraphicalLassoSolver;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class GraphCrossValidatorTest {
  DenseMatrix64F x;
  GraphCrossValidator validator;

  @Before
  public void setUp() throws Exception {
    x = SimulatedData.ar1(60, 5, 0.6, SimulatedData.random(61));
    validator = new GraphCrossValidator(CovarianceMethod.DEFAULT.create(false),
        new BlockCoordinateGlasso(), InformationCriterion.LOGLIK);
  }

  @Test
  public void testSelectsFromThePath() {
    double[] lambdas = {0.4, 0.2, 0.1, 0.05};
    FoldAssignment folds = FoldAssignment.random(60, 3, SimulatedData.random(62));
    PrecisionSelector.Selection selection = validator.select(x, folds, lambdas);
    assertEquals(4, selection.scores().length);
    assertArrayEquals(lambdas, selection.path().lambdas(), 0);
    int best = ArrayHelper.argMin(selection.scores());
    assertEquals(lambdas[best], selection.lambda(), 0);
    // out-of-sample likelihood prefers some shrinkage away from the largest penalty
    assertTrue(best > 0);
  }

  @Test(expected = InvalidInputException.class)
  public void testSingleRowFoldIsRejected() {
    int[] rest = new int[59];
    for (int i = 0; i < 59; i++) {
      rest[i] = i + 1;
    }
    FoldAssignment folds = FoldAssignment.of(Arrays.asList(new int[] {0}, rest), 60, 2);
    validator.select(x, folds, new double[] {0.1});
  }

  @Test(expected = IllegalStateException.class)
  public void testRefitPathMustMatchRequestedPenalties() {
    // fold paths are complete; the full-data refit drops all but the first penalty
    GraphicalLassoSolver truncatingRefit = new GraphicalLassoSolver() {
      final BlockCoordinateGlasso glasso = new BlockCoordinateGlasso();
      int calls = 0;

      @Override
      public GlassoPath solve(DenseMatrix64F s, double[] lambdas) {
        GlassoPath path = glasso.solve(s, lambdas);
        if (++calls <= 3) {
          return path;
        }
        return new GlassoPath(new double[] {path.lambda(0)},
            Collections.singletonList(path.precision(0)),
            Collections.singletonList(path.covariance(0)));
      }
    };
    new GraphCrossValidator(CovarianceMethod.DEFAULT.create(false), truncatingRefit,
        InformationCriterion.LOGLIK)
        .select(x, FoldAssignment.random(60, 3, SimulatedData.random(63)),
            new double[] {0.4, 0.2});
  }

  @Test(expected = InvalidInputException.class)
  public void testFoldsMustMatchRows() {
    validator.select(x, FoldAssignment.random(30, 3, SimulatedData.random(1)),
        new double[] {0.1});
  }
}
