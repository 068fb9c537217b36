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
package net.larse.robscout.solver;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.List;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.MatrixHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Graphical lasso by block coordinate descent (Friedman, Hastie and Tibshirani 2008).
 *
 * <p>The working covariance W starts at S (plus lambda on the diagonal when the diagonal is
 * penalized). Each column j is updated in turn by solving the lasso
 * min 1/2 b' W11 b - b' s12 + lambda |b|_1 by coordinate descent and setting w12 = W11 b, until
 * the mean absolute change of W drops below tolerance times the mean absolute off-diagonal of S.
 * The path is solved in the given order with warm starts.
 */
public class BlockCoordinateGlasso implements GraphicalLassoSolver {
  private static final Logger logger = LogManager.getLogger(BlockCoordinateGlasso.class);

  private static final double INNER_TOLERANCE = 1e-7;

  private final int maxIterations;
  private final int maxInnerIterations;
  private final double tolerance;
  private final boolean penalizeDiagonal;

  public BlockCoordinateGlasso() {
    this(100, 1000, 1e-4, true);
  }

  public BlockCoordinateGlasso(int maxIterations, int maxInnerIterations, double tolerance,
      boolean penalizeDiagonal) {
    Preconditions.checkArgument(maxIterations > 0 && maxInnerIterations > 0 && tolerance > 0);
    this.maxIterations = maxIterations;
    this.maxInnerIterations = maxInnerIterations;
    this.tolerance = tolerance;
    this.penalizeDiagonal = penalizeDiagonal;
  }

  @Override
  public GlassoPath solve(DenseMatrix64F s, double[] lambdas) {
    Preconditions.checkArgument(s.numRows == s.numCols, "covariance must be square");
    Preconditions.checkArgument(lambdas.length > 0, "empty penalty path");
    int p = s.numRows;

    double meanOffDiag = MatrixHelper.meanAbsOffDiagonal(s);
    double threshold = tolerance * (meanOffDiag > 0 ? meanOffDiag : 1);

    DenseMatrix64F w = s.copy();
    double[][] beta = new double[p][p];
    List<DenseMatrix64F> precisions = new ArrayList<>();
    List<DenseMatrix64F> covariances = new ArrayList<>();

    for (double lambda : lambdas) {
      Preconditions.checkArgument(lambda >= 0, "negative penalty %s", lambda);
      for (int j = 0; j < p; j++) {
        w.unsafe_set(j, j, s.unsafe_get(j, j) + (penalizeDiagonal ? lambda : 0));
      }

      boolean converged = p < 2;
      for (int iter = 0; iter < maxIterations && !converged; iter++) {
        double change = 0;
        for (int j = 0; j < p; j++) {
          double[] w12 = columnLasso(w, s, j, beta[j], lambda);
          for (int k = 0; k < p; k++) {
            if (k == j) {
              continue;
            }
            change += Math.abs(w12[k] - w.unsafe_get(k, j));
            w.unsafe_set(k, j, w12[k]);
            w.unsafe_set(j, k, w12[k]);
          }
        }
        converged = change / (p * (p - 1.0)) < threshold;
      }
      if (!converged) {
        logger.warn("glasso did not converge in {} iterations at lambda {}", maxIterations,
            lambda);
      }

      precisions.add(precision(w, beta));
      covariances.add(w.copy());
    }
    return new GlassoPath(lambdas, precisions, covariances);
  }

  /**
   * Coordinate descent for column j. Updates b in place (entry j is ignored) and returns
   * W11 * b, indexed like the full column.
   */
  private double[] columnLasso(DenseMatrix64F w, DenseMatrix64F s, int j, double[] b,
      double lambda) {
    int p = w.numRows;
    double[] g = new double[p];
    for (int k = 0; k < p; k++) {
      if (k == j) {
        continue;
      }
      double sum = 0;
      for (int l = 0; l < p; l++) {
        if (l != j) {
          sum += w.unsafe_get(k, l) * b[l];
        }
      }
      g[k] = sum;
    }

    for (int pass = 0; pass < maxInnerIterations; pass++) {
      double maxDelta = 0;
      for (int k = 0; k < p; k++) {
        if (k == j) {
          continue;
        }
        double wkk = w.unsafe_get(k, k);
        if (wkk <= 0) {
          continue;
        }
        double old = b[k];
        double r = s.unsafe_get(k, j) - (g[k] - wkk * old);
        double updated = ArrayHelper.softThreshold(r, lambda) / wkk;
        double delta = updated - old;
        if (delta != 0) {
          b[k] = updated;
          for (int l = 0; l < p; l++) {
            if (l != j) {
              g[l] += w.unsafe_get(l, k) * delta;
            }
          }
          maxDelta = Math.max(maxDelta, Math.abs(delta));
        }
      }
      if (maxDelta < INNER_TOLERANCE) {
        break;
      }
    }
    return g;
  }

  /** Precision from the converged W and column coefficients. */
  private static DenseMatrix64F precision(DenseMatrix64F w, double[][] beta) {
    int p = w.numRows;
    DenseMatrix64F theta = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      double denom = w.unsafe_get(j, j);
      for (int k = 0; k < p; k++) {
        if (k != j) {
          denom -= w.unsafe_get(k, j) * beta[j][k];
        }
      }
      double thetaJJ = 1.0 / Math.max(denom, 1e-12);
      theta.unsafe_set(j, j, thetaJJ);
      for (int k = 0; k < p; k++) {
        if (k != j) {
          theta.unsafe_set(k, j, -beta[j][k] * thetaJJ);
        }
      }
    }
    return MatrixHelper.symmetrize(theta);
  }
}
