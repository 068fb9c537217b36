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

import java.util.Locale;
import net.larse.robscout.helper.UnsupportedOptionException;

/** The covariance strategies, tagged by the names used in the argument holders. */
public enum CovarianceMethod {
  /** Empirical covariance of the raw columns. */
  DEFAULT,
  /** Pairwise Huber bivariate winsorization (Lafit et al. 2022). */
  WINSOR,
  /** Wrapping transform after robust location and scale. */
  WRAP,
  /** Cellwise outlier detection and imputation, then the empirical covariance. */
  DDC;

  /** Parses a method tag; unknown tags are rejected rather than silently replaced. */
  public static CovarianceMethod fromName(String name) {
    if (name == null) {
      throw new UnsupportedOptionException("covariance method", null);
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new UnsupportedOptionException("covariance method", name);
    }
  }

  /** An estimator for this method with the default collaborators. */
  public CovarianceEstimator create(boolean correlation) {
    switch (this) {
      case WINSOR:
        return new WinsorCovariance(correlation, new HuberCorrelation(),
            new NearestPositiveDefinite());
      case WRAP:
        return new WrapCovariance(correlation);
      case DDC:
        return new CellwiseCovariance(correlation, new DetectDeviatingCells());
      default:
        return new DefaultCovariance(correlation);
    }
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
