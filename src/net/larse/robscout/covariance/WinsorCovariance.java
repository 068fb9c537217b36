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

import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.MedianAbsoluteDeviation;
import net.larse.robscout.helper.Standardizer;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.ejml.data.DenseMatrix64F;

/**
 * Covariance from adjusted multivariate winsorization, as described in Lafit et al. 2022.
 *
 * <p>The data are standardized with median and mad here, so data that has already been
 * standardized the same way is unaffected. The pairwise robust correlations are rescaled by the
 * mad of each column, and the X-only covariance is projected to the nearest positive definite
 * matrix since the pairwise construction does not guarantee it.
 */
public class WinsorCovariance implements CovarianceEstimator {
  // Clip used by preprocess(), in mad units.
  private static final double PREPROCESS_CLIP = 2.0;

  private final boolean correlation;
  private final BivariateCorrelation bivariate;
  private final PositiveDefiniteProjector projector;

  public WinsorCovariance(boolean correlation, BivariateCorrelation bivariate,
      PositiveDefiniteProjector projector) {
    this.correlation = correlation;
    this.bivariate = bivariate;
    this.projector = projector;
  }

  @Override
  public DenseMatrix64F estimate(DenseMatrix64F x) {
    int p = x.numCols;
    Standardizer.Standardized z = robustStandardizer().standardize(x);
    double[][] cols = new double[p][];
    for (int j = 0; j < p; j++) {
      cols[j] = MatrixHelper.column(z.matrix, j);
    }

    DenseMatrix64F cormat = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      cormat.unsafe_set(j, j, 1);
      for (int k = 0; k < j; k++) {
        double r = bivariate.correlation(cols[j], cols[k]);
        cormat.unsafe_set(j, k, r);
        cormat.unsafe_set(k, j, r);
      }
    }
    if (correlation) {
      return cormat;
    }

    double[] dispersion = dispersions(x);
    DenseMatrix64F cov = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      for (int k = 0; k < p; k++) {
        cov.unsafe_set(j, k, dispersion[j] * cormat.unsafe_get(j, k) * dispersion[k]);
      }
    }
    return projector.project(cov);
  }

  @Override
  public double[] estimate(DenseMatrix64F x, double[] y) {
    Standardizer standardizer = robustStandardizer();
    DenseMatrix64F zx = standardizer.standardize(x).matrix;
    double[] zy = standardizer.standardize(y).vector;

    double[] result = new double[x.numCols];
    for (int j = 0; j < x.numCols; j++) {
      result[j] = bivariate.correlation(MatrixHelper.column(zx, j), zy);
    }
    if (correlation) {
      return result;
    }
    double[] dispersion = dispersions(x);
    double dispersionY = new MedianAbsoluteDeviation().evaluate(y);
    for (int j = 0; j < result.length; j++) {
      result[j] *= dispersion[j] * dispersionY;
    }
    return result;
  }

  /** Clips every cell to median +/- 2 mad of its column. */
  @Override
  public DenseMatrix64F preprocess(DenseMatrix64F x) {
    Median median = new Median();
    double[] dispersion = dispersions(x);
    DenseMatrix64F result = x.copy();
    for (int j = 0; j < x.numCols; j++) {
      double center = median.evaluate(MatrixHelper.column(x, j));
      double lo = center - PREPROCESS_CLIP * dispersion[j];
      double hi = center + PREPROCESS_CLIP * dispersion[j];
      for (int i = 0; i < x.numRows; i++) {
        result.unsafe_set(i, j, Math.max(lo, Math.min(hi, x.unsafe_get(i, j))));
      }
    }
    return result;
  }

  private static Standardizer robustStandardizer() {
    return new Standardizer(new Median(), new MedianAbsoluteDeviation());
  }

  private static double[] dispersions(DenseMatrix64F x) {
    MedianAbsoluteDeviation mad = new MedianAbsoluteDeviation();
    double[] result = new double[x.numCols];
    for (int j = 0; j < x.numCols; j++) {
      result[j] = mad.evaluate(MatrixHelper.column(x, j));
    }
    return result;
  }
}
