/*
 * Copyright (c) 2015 Zhiqiang Yang.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package net.larse.robscout.algorithms;

import net.larse.robscout.covariance.CovarianceEstimator;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.solver.GlassoPath;
import net.larse.robscout.solver.GraphicalLassoSolver;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Cross-validated choice of the graph penalty. For every fold the path is solved on the training
 * rows and each precision is scored against the covariance of the held-out rows. Scores are
 * averaged over folds and the winning penalty is refit on all rows.
 */
public class GraphCrossValidator {
  private static final Logger logger = LogManager.getLogger(GraphCrossValidator.class);

  private final CovarianceEstimator estimator;
  private final GraphicalLassoSolver solver;
  private final InformationCriterion criterion;

  public GraphCrossValidator(CovarianceEstimator estimator, GraphicalLassoSolver solver,
      InformationCriterion criterion) {
    this.estimator = estimator;
    this.solver = solver;
    this.criterion = criterion;
  }

  public PrecisionSelector.Selection select(DenseMatrix64F x, FoldAssignment folds,
      double[] lambdas) {
    if (folds.numRows() != x.numRows) {
      throw new InvalidInputException(String.format(
          "Folds cover %d rows but the data has %d", folds.numRows(), x.numRows));
    }

    // scores[lambda][fold]
    double[][] scores = new double[lambdas.length][folds.numFolds()];
    for (int k = 0; k < folds.numFolds(); k++) {
      int[] validationRows = folds.validationRows(k);
      if (validationRows.length < 2) {
        throw new InvalidInputException(
            "Fold " + k + " holds out fewer than 2 rows; its covariance is undefined");
      }
      DenseMatrix64F train = MatrixHelper.selectRows(x, folds.trainingRows(k));
      DenseMatrix64F validation = MatrixHelper.selectRows(x, validationRows);

      GlassoPath path = solver.solve(estimator.estimate(train), lambdas);
      checkPathLength(path, lambdas);
      DenseMatrix64F heldOut = estimator.estimate(validation);
      for (int i = 0; i < lambdas.length; i++) {
        scores[i][k] = criterion.score(path.precision(i), heldOut, train.numRows);
      }
    }

    double[] meanScores = ArrayHelper.rowMeans(scores);
    int best = ArrayHelper.argMin(meanScores);
    logger.debug("Cross-validated graph penalty {} over {} folds", lambdas[best],
        folds.numFolds());
    GlassoPath full = solver.solve(estimator.estimate(x), lambdas);
    checkPathLength(full, lambdas);
    return new PrecisionSelector.Selection(full, meanScores, best);
  }

  // Fold scores and the refit are indexed by the requested penalties.
  private static void checkPathLength(GlassoPath path, double[] lambdas) {
    if (path.size() != lambdas.length) {
      throw new IllegalStateException(String.format(
          "Solver returned %d precisions for %d penalties", path.size(), lambdas.length));
    }
  }
}
