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
package net.larse.robscout.covariance;

import com.google.common.base.Preconditions;
import net.larse.robscout.helper.MatrixHelper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Nearest positive definite matrix by Higham's (2002) alternating projections with Dykstra's
 * correction, followed by an eigenvalue floor that keeps the original diagonal. The defaults match
 * those of Matrix::nearPD.
 */
public class NearestPositiveDefinite implements PositiveDefiniteProjector {
  private static final Logger logger = LogManager.getLogger(NearestPositiveDefinite.class);

  private final double eigTolerance;
  private final double convTolerance;
  private final double posdTolerance;
  private final int maxIterations;

  public NearestPositiveDefinite() {
    this(1e-6, 1e-7, 1e-8, 100);
  }

  public NearestPositiveDefinite(double eigTolerance, double convTolerance, double posdTolerance,
      int maxIterations) {
    this.eigTolerance = eigTolerance;
    this.convTolerance = convTolerance;
    this.posdTolerance = posdTolerance;
    this.maxIterations = maxIterations;
  }

  @Override
  public DenseMatrix64F project(DenseMatrix64F a) {
    int n = a.numRows;
    Preconditions.checkArgument(n == a.numCols, "matrix must be square");

    DenseMatrix64F x = MatrixHelper.symmetrize(a.copy());
    DenseMatrix64F dykstra = new DenseMatrix64F(n, n);
    DenseMatrix64F r = new DenseMatrix64F(n, n);
    double[] values = new double[n];

    boolean converged = false;
    int iter = 0;
    while (iter < maxIterations && !converged) {
      DenseMatrix64F y = x;
      for (int i = 0; i < n * n; i++) {
        r.data[i] = y.data[i] - dykstra.data[i];
      }

      DenseMatrix64F vectors = MatrixHelper.symmetricEigen(r, values);
      double threshold = eigTolerance * values[0];
      double[] kept = new double[n];
      boolean any = false;
      for (int k = 0; k < n; k++) {
        if (values[k] > threshold) {
          kept[k] = values[k];
          any = true;
        }
      }
      if (!any) {
        throw new IllegalArgumentException("Matrix seems negative semi-definite");
      }
      x = MatrixHelper.fromEigen(kept, vectors);
      for (int i = 0; i < n * n; i++) {
        dykstra.data[i] = x.data[i] - r.data[i];
      }
      iter++;
      converged = infinityNorm(y, x) / infinityNorm(y, null) <= convTolerance;
    }
    if (!converged) {
      logger.warn("nearest PD projection did not converge in {} iterations", maxIterations);
    }

    // Make the result strictly positive definite while keeping its diagonal.
    DenseMatrix64F vectors = MatrixHelper.symmetricEigen(x, values);
    double eps = posdTolerance * Math.abs(values[0]);
    if (values[n - 1] < eps) {
      for (int k = 0; k < n; k++) {
        values[k] = Math.max(values[k], eps);
      }
      double[] oldDiag = new double[n];
      for (int i = 0; i < n; i++) {
        oldDiag[i] = x.unsafe_get(i, i);
      }
      x = MatrixHelper.fromEigen(values, vectors);
      double[] d = new double[n];
      for (int i = 0; i < n; i++) {
        d[i] = Math.sqrt(Math.max(eps, oldDiag[i]) / x.unsafe_get(i, i));
      }
      for (int i = 0; i < n; i++) {
        for (int j = 0; j < n; j++) {
          x.unsafe_set(i, j, d[i] * x.unsafe_get(i, j) * d[j]);
        }
      }
    }
    return x;
  }

  /** Max absolute row sum of (a - b), or of a when b is null. */
  private static double infinityNorm(DenseMatrix64F a, DenseMatrix64F b) {
    double max = 0;
    for (int i = 0; i < a.numRows; i++) {
      double sum = 0;
      for (int j = 0; j < a.numCols; j++) {
        double v = a.unsafe_get(i, j) - (b == null ? 0 : b.unsafe_get(i, j));
        sum += Math.abs(v);
      }
      max = Math.max(max, sum);
    }
    return max;
  }
}
