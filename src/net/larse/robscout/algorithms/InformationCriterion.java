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
package net.larse.robscout.algorithms;

import com.google.common.base.Preconditions;
import java.util.Locale;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.UnsupportedOptionException;
import org.ejml.data.DenseMatrix64F;

/**
 * Scores for a precision estimate Theta against a covariance estimate Sigma from n observations.
 * Lower is better.
 */
public enum InformationCriterion {
  /** Negative Gaussian log-likelihood up to constants: -log|Theta| + tr(Theta Sigma). */
  LOGLIK,
  /** BIC of Yuan and Lin (2007). */
  BIC,
  /** Extended BIC of Foygel and Drton (2010) with gamma = 0.5. */
  EBIC;

  public static final double NONZERO_TOLERANCE = 1e-8;
  public static final double EBIC_GAMMA = 0.5;

  public static InformationCriterion fromName(String name) {
    if (name == null) {
      throw new UnsupportedOptionException("criterion", null);
    }
    try {
      return valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new UnsupportedOptionException("criterion", name);
    }
  }

  public double score(DenseMatrix64F theta, DenseMatrix64F sigma, int n) {
    Preconditions.checkArgument(theta.numRows == sigma.numRows && theta.numCols == sigma.numCols,
        "precision and covariance dimensions differ");
    Preconditions.checkArgument(n >= 1, "n must be positive");

    double negLoglik =
        -MatrixHelper.logDeterminant(theta) + MatrixHelper.traceOfProduct(theta, sigma);
    if (this == LOGLIK) {
      return negLoglik;
    }

    // Non-zero entries of the lower triangle, with and without the diagonal.
    int p = theta.numRows;
    int offDiagonal = 0;
    int diagonal = 0;
    for (int i = 0; i < p; i++) {
      if (Math.abs(theta.unsafe_get(i, i)) > NONZERO_TOLERANCE) {
        diagonal++;
      }
      for (int j = 0; j < i; j++) {
        if (Math.abs(theta.unsafe_get(i, j)) > NONZERO_TOLERANCE) {
          offDiagonal++;
        }
      }
    }
    double bic = negLoglik + (Math.log(n) / n) * (offDiagonal + diagonal);
    if (this == BIC) {
      return bic;
    }
    return bic + offDiagonal * EBIC_GAMMA * 4 * Math.log(p) / n;
  }

  public String tag() {
    return name().toLowerCase(Locale.ROOT);
  }
}
