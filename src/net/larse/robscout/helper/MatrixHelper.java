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
package net.larse.robscout.helper;

import com.google.common.base.Preconditions;
import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;
import org.apache.commons.math.stat.correlation.Covariance;
import org.ejml.data.DenseMatrix64F;
import org.ejml.factory.DecompositionFactory;
import org.ejml.factory.LinearSolverFactory;
import org.ejml.interfaces.decomposition.EigenDecomposition;
import org.ejml.interfaces.decomposition.LUDecomposition;
import org.ejml.interfaces.linsol.LinearSolver;

/** Dense matrix utilities shared by the covariance, precision and coefficient stages. */
public class MatrixHelper {
  private static final Covariance COVARIANCE = new Covariance();

  /** Copy of column j. */
  public static double[] column(DenseMatrix64F x, int j) {
    double[] col = new double[x.numRows];
    for (int i = 0; i < x.numRows; i++) {
      col[i] = x.unsafe_get(i, j);
    }
    return col;
  }

  /** Writes values into column j. */
  public static void setColumn(DenseMatrix64F x, int j, double[] values) {
    Preconditions.checkArgument(values.length == x.numRows);
    for (int i = 0; i < x.numRows; i++) {
      x.unsafe_set(i, j, values[i]);
    }
  }

  /** New matrix made of the given rows of x, in order. */
  public static DenseMatrix64F selectRows(DenseMatrix64F x, int[] rows) {
    DenseMatrix64F result = new DenseMatrix64F(rows.length, x.numCols);
    for (int r = 0; r < rows.length; r++) {
      for (int j = 0; j < x.numCols; j++) {
        result.unsafe_set(r, j, x.unsafe_get(rows[r], j));
      }
    }
    return result;
  }

  public static double[] selectRows(double[] y, int[] rows) {
    double[] result = new double[rows.length];
    for (int r = 0; r < rows.length; r++) {
      result[r] = y[rows[r]];
    }
    return result;
  }

  /**
   * Sample covariance (n - 1 denominator) of the columns of x, or their Pearson correlation.
   * Correlations involving a constant column are 0, except on the diagonal.
   */
  public static DenseMatrix64F covariance(DenseMatrix64F x, boolean correlation) {
    int p = x.numCols;
    double[][] cols = new double[p][];
    for (int j = 0; j < p; j++) {
      cols[j] = column(x, j);
    }
    DenseMatrix64F s = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      for (int k = 0; k <= j; k++) {
        double v = COVARIANCE.covariance(cols[j], cols[k]);
        s.unsafe_set(j, k, v);
        s.unsafe_set(k, j, v);
      }
    }
    return correlation ? toCorrelation(s) : s;
  }

  /** Covariance (or correlation) of every column of x with y. */
  public static double[] crossCovariance(DenseMatrix64F x, double[] y, boolean correlation) {
    Preconditions.checkArgument(x.numRows == y.length, "x has %s rows, y has %s", x.numRows,
        y.length);
    double[] result = new double[x.numCols];
    double varY = COVARIANCE.covariance(y, y);
    for (int j = 0; j < x.numCols; j++) {
      double[] col = column(x, j);
      double cov = COVARIANCE.covariance(col, y);
      if (correlation) {
        double denom = Math.sqrt(COVARIANCE.covariance(col, col) * varY);
        result[j] = denom > 0 ? cov / denom : 0;
      } else {
        result[j] = cov;
      }
    }
    return result;
  }

  /** Pearson correlation, 0 when either vector has no spread. */
  public static double pearson(double[] x, double[] y) {
    double denom = Math.sqrt(COVARIANCE.covariance(x, x) * COVARIANCE.covariance(y, y));
    return denom > 0 ? COVARIANCE.covariance(x, y) / denom : 0;
  }

  private static DenseMatrix64F toCorrelation(DenseMatrix64F s) {
    int p = s.numRows;
    DenseMatrix64F r = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      for (int k = 0; k < p; k++) {
        if (j == k) {
          r.unsafe_set(j, k, 1);
          continue;
        }
        double denom = Math.sqrt(s.unsafe_get(j, j) * s.unsafe_get(k, k));
        r.unsafe_set(j, k, denom > 0 ? s.unsafe_get(j, k) / denom : 0);
      }
    }
    return r;
  }

  /** max |a_ij| over i != j. */
  public static double maxAbsOffDiagonal(DenseMatrix64F a) {
    double max = 0;
    for (int i = 0; i < a.numRows; i++) {
      for (int j = 0; j < a.numCols; j++) {
        if (i != j) {
          max = Math.max(max, Math.abs(a.unsafe_get(i, j)));
        }
      }
    }
    return max;
  }

  public static boolean isOffDiagonalZero(DenseMatrix64F a) {
    return maxAbsOffDiagonal(a) == 0;
  }

  /** Mean of |a_ij| over i != j, 0 for a 1x1 matrix. */
  public static double meanAbsOffDiagonal(DenseMatrix64F a) {
    int p = a.numRows;
    if (p < 2) {
      return 0;
    }
    double sum = 0;
    for (int i = 0; i < p; i++) {
      for (int j = 0; j < p; j++) {
        if (i != j) {
          sum += Math.abs(a.unsafe_get(i, j));
        }
      }
    }
    return sum / (p * (p - 1.0));
  }

  /**
   * log |det(a)|, taken from the diagonal of the LU factor. Returns negative infinity for a
   * singular matrix.
   */
  public static double logDeterminant(DenseMatrix64F a) {
    Preconditions.checkArgument(a.numRows == a.numCols);
    LUDecomposition<DenseMatrix64F> lu = DecompositionFactory.lu(a.numRows, a.numCols);
    if (!lu.decompose(a.copy())) {
      return Double.NEGATIVE_INFINITY;
    }
    DenseMatrix64F upper = lu.getUpper(null);
    double logDet = 0;
    for (int i = 0; i < upper.numRows; i++) {
      logDet += Math.log(Math.abs(upper.unsafe_get(i, i)));
    }
    return logDet;
  }

  /** trace(a * b) without forming the product. */
  public static double traceOfProduct(DenseMatrix64F a, DenseMatrix64F b) {
    Preconditions.checkArgument(a.numCols == b.numRows && a.numRows == b.numCols);
    double trace = 0;
    for (int i = 0; i < a.numRows; i++) {
      for (int k = 0; k < a.numCols; k++) {
        trace += a.unsafe_get(i, k) * b.unsafe_get(k, i);
      }
    }
    return trace;
  }

  /**
   * Inverse of a symmetric matrix. Uses Cholesky when a is positive definite and falls back to the
   * SVD pseudo-inverse otherwise.
   */
  public static DenseMatrix64F inverse(DenseMatrix64F a) {
    DenseMatrix64F result = new DenseMatrix64F(a.numRows, a.numCols);
    LinearSolver<DenseMatrix64F> solver = LinearSolverFactory.symmPosDef(a.numRows);
    if (solver.setA(a.copy()) && solver.quality() > 1e-12) {
      solver.invert(result);
      return result;
    }
    LinearSolver<DenseMatrix64F> pinv = LinearSolverFactory.pseudoInverse(true);
    if (!pinv.setA(a.copy())) {
      throw new RuntimeException("Pseudo inverse failed!");
    }
    pinv.invert(result);
    return result;
  }

  public static double[] multiply(DenseMatrix64F a, double[] v) {
    Preconditions.checkArgument(a.numCols == v.length);
    double[] result = new double[a.numRows];
    for (int i = 0; i < a.numRows; i++) {
      double sum = 0;
      for (int j = 0; j < a.numCols; j++) {
        sum += a.unsafe_get(i, j) * v[j];
      }
      result[i] = sum;
    }
    return result;
  }

  public static double dot(double[] a, double[] b) {
    Preconditions.checkArgument(a.length == b.length);
    double sum = 0;
    for (int i = 0; i < a.length; i++) {
      sum += a[i] * b[i];
    }
    return sum;
  }

  /** v' a v. */
  public static double quadraticForm(DenseMatrix64F a, double[] v) {
    return dot(v, multiply(a, v));
  }

  /**
   * Eigen decomposition of a symmetric matrix. Eigenvalues are written to values in decreasing
   * order and the matching unit eigenvectors to the columns of the returned matrix.
   */
  public static DenseMatrix64F symmetricEigen(DenseMatrix64F a, double[] values) {
    int n = a.numRows;
    Preconditions.checkArgument(n == a.numCols && values.length == n);
    EigenDecomposition<DenseMatrix64F> eig = DecompositionFactory.eig(n, true, true);
    if (!eig.decompose(a.copy())) {
      throw new RuntimeException("Eigen decomposition failed!");
    }
    double[] raw = new double[n];
    for (int i = 0; i < n; i++) {
      raw[i] = eig.getEigenvalue(i).getReal();
    }
    Integer[] order = IntStream.range(0, n).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble((Integer i) -> raw[i]).reversed());

    DenseMatrix64F vectors = new DenseMatrix64F(n, n);
    for (int c = 0; c < n; c++) {
      values[c] = raw[order[c]];
      DenseMatrix64F v = eig.getEigenVector(order[c]);
      for (int r = 0; r < n; r++) {
        vectors.unsafe_set(r, c, v.get(r, 0));
      }
    }
    return vectors;
  }

  /** vectors * diag(values) * vectors'. */
  public static DenseMatrix64F fromEigen(double[] values, DenseMatrix64F vectors) {
    int n = vectors.numRows;
    DenseMatrix64F result = new DenseMatrix64F(n, n);
    for (int i = 0; i < n; i++) {
      for (int j = 0; j <= i; j++) {
        double sum = 0;
        for (int k = 0; k < values.length; k++) {
          sum += vectors.unsafe_get(i, k) * values[k] * vectors.unsafe_get(j, k);
        }
        result.unsafe_set(i, j, sum);
        result.unsafe_set(j, i, sum);
      }
    }
    return result;
  }

  /** Replaces a with (a + a') / 2 in place. */
  public static DenseMatrix64F symmetrize(DenseMatrix64F a) {
    for (int i = 0; i < a.numRows; i++) {
      for (int j = 0; j < i; j++) {
        double v = 0.5 * (a.unsafe_get(i, j) + a.unsafe_get(j, i));
        a.unsafe_set(i, j, v);
        a.unsafe_set(j, i, v);
      }
    }
    return a;
  }
}
