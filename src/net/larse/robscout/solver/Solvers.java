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

import net.larse.robscout.helper.UnsupportedOptionException;

/**
 * Default solvers for each penalty norm. Norm 0 means "no penalty", 1 the lasso (L1) penalty and 2
 * the ridge (squared L2) penalty.
 */
public final class Solvers {
  public static final int NO_PENALTY = 0;
  public static final int LASSO = 1;
  public static final int RIDGE = 2;

  private Solvers() {}

  /** Rejects norms other than 0, 1 and 2. */
  public static int checkNorm(int norm) {
    if (norm != NO_PENALTY && norm != LASSO && norm != RIDGE) {
      throw new UnsupportedOptionException("penalty norm", norm);
    }
    return norm;
  }

  /** Precision solver for the graph stage. */
  public static GraphicalLassoSolver graphSolver(int norm) {
    return checkNorm(norm) == LASSO ? new BlockCoordinateGlasso() : new RidgePrecision();
  }

  /** Coefficient solver for the regression stage. */
  public static PenalizedRegressionSolver regressionSolver(int norm) {
    return checkNorm(norm) == LASSO ? new CovarianceLasso() : new CovarianceRidge();
  }
}
