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

import org.ejml.data.DenseMatrix64F;

/**
 * A strategy for second-moment estimates of the predictors. Implementations are stateless apart
 * from their configuration and never modify their inputs.
 */
public interface CovarianceEstimator {
  /** p x p covariance (or correlation) of the columns of x. */
  DenseMatrix64F estimate(DenseMatrix64F x);

  /** Length-p covariance (or correlation) of each column of x with y. */
  double[] estimate(DenseMatrix64F x, double[] y);

  /**
   * The data the estimate is effectively computed from: imputed, wrapped or winsorized as the
   * strategy dictates. Used to score held-out rows on the same footing as the fit.
   *
   * <p>Statistics are re-estimated from x alone. Held-out rows are therefore processed on their
   * own, without the location, scale or cell predictions of the training rows.
   */
  default DenseMatrix64F preprocess(DenseMatrix64F x) {
    return x;
  }
}
