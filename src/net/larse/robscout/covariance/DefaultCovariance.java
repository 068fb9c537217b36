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
import org.ejml.data.DenseMatrix64F;

/** Empirical covariance, or Pearson correlation, of the raw columns. */
public class DefaultCovariance implements CovarianceEstimator {
  private final boolean correlation;

  public DefaultCovariance(boolean correlation) {
    this.correlation = correlation;
  }

  @Override
  public DenseMatrix64F estimate(DenseMatrix64F x) {
    return MatrixHelper.covariance(x, correlation);
  }

  @Override
  public double[] estimate(DenseMatrix64F x, double[] y) {
    return MatrixHelper.crossCovariance(x, y, correlation);
  }
}
