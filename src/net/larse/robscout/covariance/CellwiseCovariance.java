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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Covariance of the predictors after cellwise outlier detection and imputation. The response is
 * used as given. Cellwise detection needs at least two columns; with fewer the imputation step is
 * skipped with a warning.
 */
public class CellwiseCovariance implements CovarianceEstimator {
  private static final Logger logger = LogManager.getLogger(CellwiseCovariance.class);

  private final boolean correlation;
  private final CellwiseImputer imputer;

  public CellwiseCovariance(boolean correlation, CellwiseImputer imputer) {
    this.correlation = correlation;
    this.imputer = imputer;
  }

  @Override
  public DenseMatrix64F estimate(DenseMatrix64F x) {
    return MatrixHelper.covariance(preprocess(x), correlation);
  }

  @Override
  public double[] estimate(DenseMatrix64F x, double[] y) {
    return MatrixHelper.crossCovariance(preprocess(x), y, correlation);
  }

  @Override
  public DenseMatrix64F preprocess(DenseMatrix64F x) {
    if (x.numCols < 2) {
      logger.warn("Input data had fewer than 2 columns. Skipping cellwise imputation.");
      return x;
    }
    return imputer.impute(x);
  }
}
