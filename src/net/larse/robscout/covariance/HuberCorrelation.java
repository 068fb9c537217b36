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
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.ChiSquaredDistributionImpl;

/**
 * Correlation based on bivariate winsorization of standardized data, following robustHD's
 * corHuber(type = "bivariate").
 *
 * <p>An initial correlation r0 is taken from the univariately winsorized data (clipped at
 * +/-const). Each point is then shrunk towards the origin by min(1, d / md), where md is its
 * Mahalanobis distance under [[1, r0], [r0, 1]] and d is the prob quantile of a chi-square with 2
 * degrees of freedom. The result is the Pearson correlation of the shrunken points.
 */
public class HuberCorrelation implements BivariateCorrelation {
  private static final double DEFAULT_CONST = 2.0;
  private static final double DEFAULT_PROB = 0.95;
  private static final double TOLERANCE = Math.sqrt(Math.ulp(1.0));

  private final double clip;
  private final double cutoff;

  public HuberCorrelation() {
    this(DEFAULT_CONST, DEFAULT_PROB);
  }

  public HuberCorrelation(double clip, double prob) {
    Preconditions.checkArgument(clip > 0 && prob > 0 && prob < 1);
    this.clip = clip;
    try {
      this.cutoff =
          Math.sqrt(new ChiSquaredDistributionImpl(2).inverseCumulativeProbability(prob));
    } catch (MathException e) {
      throw new RuntimeException(e.getMessage());
    }
  }

  @Override
  public double correlation(double[] x, double[] y) {
    Preconditions.checkArgument(x.length == y.length);
    int n = x.length;
    double[] xw = new double[n];
    double[] yw = new double[n];
    for (int i = 0; i < n; i++) {
      xw[i] = Math.max(-clip, Math.min(clip, x[i]));
      yw[i] = Math.max(-clip, Math.min(clip, y[i]));
    }
    double r0 = MatrixHelper.pearson(xw, yw);
    double det = 1 - r0 * r0;
    if (det < TOLERANCE) {
      // Perfectly (anti-)correlated after clipping; the distances are undefined.
      return r0;
    }

    for (int i = 0; i < n; i++) {
      double md2 = (x[i] * x[i] - 2 * r0 * x[i] * y[i] + y[i] * y[i]) / det;
      double md = Math.sqrt(Math.max(md2, 0));
      double weight = md > cutoff ? cutoff / md : 1.0;
      xw[i] = weight * x[i];
      yw[i] = weight * y[i];
    }
    return MatrixHelper.pearson(xw, yw);
  }
}
