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
import net.larse.robscout.helper.MatrixHelper;
import org.ejml.data.DenseMatrix64F;

/**
 * Ridge in covariance form, b = (Sigma + lambda I)^-1 sigmaXy. A zero penalty gives the
 * unpenalized (pseudo-inverse) solution.
 */
public class CovarianceRidge implements PenalizedRegressionSolver {

  @Override
  public RegressionPath solve(DenseMatrix64F sigma, double[] sigmaXy, double[] lambdas) {
    int p = sigmaXy.length;
    Preconditions.checkArgument(sigma.numRows == p && sigma.numCols == p);
    RegressionPath path = new RegressionPath(lambdas, p);
    for (int idx = 0; idx < lambdas.length; idx++) {
      DenseMatrix64F shifted = sigma.copy();
      for (int j = 0; j < p; j++) {
        shifted.unsafe_set(j, j, shifted.unsafe_get(j, j) + lambdas[idx]);
      }
      path.setWeights(idx, MatrixHelper.multiply(MatrixHelper.inverse(shifted), sigmaXy));
    }
    return path;
  }
}
