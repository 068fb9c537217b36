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

import java.util.ArrayList;
import java.util.List;
import net.larse.robscout.helper.MatrixHelper;
import org.ejml.data.DenseMatrix64F;

/**
 * Closed-form precision estimate for the squared Frobenius penalty,
 * min -log|T| + tr(S T) + lambda |T|_F^2.
 *
 * <p>The solution shares the eigenvectors of S; each eigenvalue d of S maps to
 * (-d + sqrt(d^2 + 8 lambda)) / (4 lambda). A zero penalty gives the pseudo-inverse of S, with S
 * itself as the covariance.
 */
public class RidgePrecision implements GraphicalLassoSolver {
  private static final double EIGEN_TOLERANCE = 1e-10;

  @Override
  public GlassoPath solve(DenseMatrix64F s, double[] lambdas) {
    int p = s.numRows;
    double[] d = new double[p];
    DenseMatrix64F vectors = MatrixHelper.symmetricEigen(s, d);
    double floor = EIGEN_TOLERANCE * Math.max(Math.abs(d[0]), 1);

    List<DenseMatrix64F> precisions = new ArrayList<>();
    List<DenseMatrix64F> covariances = new ArrayList<>();
    for (double lambda : lambdas) {
      double[] theta = new double[p];
      double[] sigma = new double[p];
      for (int i = 0; i < p; i++) {
        if (lambda > 0) {
          theta[i] = (-d[i] + Math.sqrt(d[i] * d[i] + 8 * lambda)) / (4 * lambda);
          sigma[i] = 1.0 / theta[i];
        } else {
          theta[i] = d[i] > floor ? 1.0 / d[i] : 0;
          sigma[i] = Math.max(d[i], 0);
        }
      }
      precisions.add(MatrixHelper.fromEigen(theta, vectors));
      covariances.add(MatrixHelper.fromEigen(sigma, vectors));
    }
    return new GlassoPath(lambdas, precisions, covariances);
  }
}
