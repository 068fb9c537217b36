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
import net.larse.robscout.helper.ArrayHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Lasso in covariance form: min 1/2 b' Sigma b - b' sigmaXy + lambda |b|_1, by cyclic coordinate
 * descent with warm starts along the path. With Sigma = X'X/(n-1) and sigmaXy = X'y/(n-1) this is
 * the usual lasso on centered data.
 */
public class CovarianceLasso implements PenalizedRegressionSolver {
  private static final Logger logger = LogManager.getLogger(CovarianceLasso.class);

  private final int maxPasses;
  private final double tolerance;

  public CovarianceLasso() {
    this(10000, 1e-7);
  }

  public CovarianceLasso(int maxPasses, double tolerance) {
    Preconditions.checkArgument(maxPasses > 0 && tolerance > 0);
    this.maxPasses = maxPasses;
    this.tolerance = tolerance;
  }

  @Override
  public RegressionPath solve(DenseMatrix64F sigma, double[] sigmaXy, double[] lambdas) {
    int p = sigmaXy.length;
    Preconditions.checkArgument(sigma.numRows == p && sigma.numCols == p,
        "sigma is %sx%s but sigmaXy has length %s", sigma.numRows, sigma.numCols, p);

    RegressionPath path = new RegressionPath(lambdas, p);
    double[] beta = new double[p];
    // gradient part: g = Sigma * beta
    double[] g = new double[p];

    for (int idx = 0; idx < lambdas.length; idx++) {
      double lambda = lambdas[idx];
      boolean converged = false;
      for (int pass = 0; pass < maxPasses && !converged; pass++) {
        double maxDelta = 0;
        for (int j = 0; j < p; j++) {
          double sjj = sigma.unsafe_get(j, j);
          if (sjj <= 0) {
            continue;
          }
          double old = beta[j];
          double r = sigmaXy[j] - (g[j] - sjj * old);
          double updated = ArrayHelper.softThreshold(r, lambda) / sjj;
          double delta = updated - old;
          if (delta != 0) {
            beta[j] = updated;
            for (int k = 0; k < p; k++) {
              g[k] += sigma.unsafe_get(k, j) * delta;
            }
            maxDelta = Math.max(maxDelta, Math.abs(delta));
          }
        }
        converged = maxDelta < tolerance;
      }
      if (!converged) {
        logger.warn("lasso did not converge in {} passes at lambda {}", maxPasses, lambda);
      }
      path.setWeights(idx, beta);
    }
    return path;
  }
}
