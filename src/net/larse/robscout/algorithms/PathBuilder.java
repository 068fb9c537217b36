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

import com.google.common.base.Preconditions;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.solver.Solvers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Penalty sequences for the graph and coefficient stages. Paths are log-spaced and decreasing,
 * from an upper bound lambdaMax down to lambdaMinRatio * lambdaMax. A zero upper bound, or the
 * "no penalty" norm, collapses the path to the single value 0.
 */
public final class PathBuilder {
  private static final Logger logger = LogManager.getLogger(PathBuilder.class);

  private PathBuilder() {}

  /**
   * nlambda log-spaced values from lambdaMax down to lambdaMinRatio * lambdaMax. Returns {0} when
   * lambdaMax is 0.
   */
  public static double[] lambdaPath(double lambdaMax, int nlambda, double lambdaMinRatio) {
    Preconditions.checkArgument(nlambda >= 1, "nlambda must be positive, got %s", nlambda);
    Preconditions.checkArgument(lambdaMax >= 0 && !Double.isInfinite(lambdaMax),
        "lambdaMax must be finite and non-negative, got %s", lambdaMax);
    Preconditions.checkArgument(lambdaMinRatio > 0 && (lambdaMinRatio < 1 || nlambda == 1),
        "lambdaMinRatio must be in (0, 1), got %s", lambdaMinRatio);
    if (lambdaMax == 0) {
      return new double[] {0};
    }
    if (nlambda == 1) {
      return new double[] {lambdaMax};
    }

    double logMax = Math.log(lambdaMax);
    double logMin = Math.log(lambdaMinRatio * lambdaMax);
    double step = (logMin - logMax) / (nlambda - 1);
    double[] lambdas = new double[nlambda];
    for (int i = 0; i < nlambda; i++) {
      lambdas[i] = Math.exp(logMax + i * step);
    }
    lambdas[0] = lambdaMax;
    lambdas[nlambda - 1] = lambdaMinRatio * lambdaMax;
    return lambdas;
  }

  /**
   * Graphical lasso path: lambdaMax is the largest absolute off-diagonal entry of s. A covariance
   * with an all-zero off-diagonal gives {0}.
   */
  public static double[] glassoPath(DenseMatrix64F s, int nlambda, double lambdaMinRatio) {
    if (MatrixHelper.isOffDiagonalZero(s)) {
      logger.warn("Off-diagonal of the covariance is zero; using the single penalty 0");
      return new double[] {0};
    }
    return lambdaPath(MatrixHelper.maxAbsOffDiagonal(s), nlambda, lambdaMinRatio);
  }

  /** Penalty path for the graph stage under the given norm. */
  public static double[] graphPath(DenseMatrix64F s, int norm, int nlambda,
      double lambdaMinRatio) {
    switch (Solvers.checkNorm(norm)) {
      case Solvers.LASSO:
        return glassoPath(s, nlambda, lambdaMinRatio);
      case Solvers.RIDGE:
        return lambdaPath(ridgeGraphMax(s), nlambda, lambdaMinRatio);
      default:
        return new double[] {0};
    }
  }

  /** Penalty path for the coefficient stage under the given norm. */
  public static double[] coefficientPath(double[] sigmaXy, int norm, int nlambda,
      double lambdaMinRatio) {
    switch (Solvers.checkNorm(norm)) {
      case Solvers.LASSO:
        return lambdaPath(ArrayHelper.maxAbs(sigmaXy), nlambda, lambdaMinRatio);
      case Solvers.RIDGE:
        return lambdaPath(ridgeCoefficientMax(sigmaXy), nlambda, lambdaMinRatio);
      default:
        return new double[] {0};
    }
  }

  /** Ridge bound for the coefficient stage: |sigmaXy|_2 * max_j |sigmaXy_j|. */
  static double ridgeCoefficientMax(double[] sigmaXy) {
    return Math.sqrt(MatrixHelper.dot(sigmaXy, sigmaXy)) * ArrayHelper.maxAbs(sigmaXy);
  }

  /**
   * Upper bound for the Frobenius-penalized precision: the squared largest eigenvalue of s. Past
   * it every eigenvalue is shrunk to within a factor of two of 1 / sqrt(2 lambda).
   */
  static double ridgeGraphMax(DenseMatrix64F s) {
    double[] values = new double[s.numRows];
    MatrixHelper.symmetricEigen(s, values);
    double top = Math.max(values[0], 0);
    return top * top;
  }
}
