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

import com.google.common.annotations.VisibleForTesting;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.MedianAbsoluteDeviation;
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.NormalDistributionImpl;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Covariance of wrapped data (Raymaekers and Rousseeuw 2021).
 *
 * <p>Each column gets a one-step M estimate of location (Huber psi) and scale (clipped square
 * rho), both started from median and mad. Cells are then mapped through the wrapping function,
 * which is the identity near the center, bends back towards it further out and sends far
 * outliers to the center itself. The ordinary covariance of the wrapped data is returned.
 */
public class WrapCovariance implements CovarianceEstimator {
  private static final Logger logger = LogManager.getLogger(WrapCovariance.class);

  // Wrapping function constants for b = 1.5, c = 4.
  private static final double B = 1.5;
  private static final double C = 4.0;
  private static final double Q1 = 1.540793;
  private static final double Q2 = 0.8622731;

  // Huber constant for the location step and clipping constant for the scale step.
  private static final double HUBER_B = 1.5;
  private static final double SCALE_C = 2.5;

  private final boolean correlation;
  private final double scaleConsistency;

  public WrapCovariance(boolean correlation) {
    this.correlation = correlation;
    this.scaleConsistency = clippedSquareExpectation(SCALE_C);
  }

  @Override
  public DenseMatrix64F estimate(DenseMatrix64F x) {
    return MatrixHelper.covariance(preprocess(x), correlation);
  }

  @Override
  public double[] estimate(DenseMatrix64F x, double[] y) {
    return MatrixHelper.crossCovariance(preprocess(x), wrap(y), correlation);
  }

  @Override
  public DenseMatrix64F preprocess(DenseMatrix64F x) {
    DenseMatrix64F result = new DenseMatrix64F(x.numRows, x.numCols);
    for (int j = 0; j < x.numCols; j++) {
      MatrixHelper.setColumn(result, j, wrap(MatrixHelper.column(x, j)));
    }
    return result;
  }

  /** Wraps one variable around its robust location and scale. */
  @VisibleForTesting
  double[] wrap(double[] values) {
    double[] locScale = locationScale(values);
    double loc = locScale[0];
    double scale = locScale[1];
    if (!(scale > 0)) {
      logger.warn("Robust scale is {}; variable left unwrapped", scale);
      return values.clone();
    }
    double[] result = new double[values.length];
    for (int i = 0; i < values.length; i++) {
      result[i] = loc + scale * psi((values[i] - loc) / scale);
    }
    return result;
  }

  /** {location, scale} from one M step each, starting at median and mad. */
  @VisibleForTesting
  double[] locationScale(double[] values) {
    double loc0 = new Median().evaluate(values);
    double s0 = new MedianAbsoluteDeviation().evaluate(values);
    if (!(s0 > 0)) {
      return new double[] {loc0, s0};
    }

    double psiSum = 0;
    int inside = 0;
    double rhoSum = 0;
    for (double v : values) {
      double u = (v - loc0) / s0;
      psiSum += Math.max(-HUBER_B, Math.min(HUBER_B, u));
      if (Math.abs(u) <= HUBER_B) {
        inside++;
      }
      rhoSum += Math.min(u * u, SCALE_C * SCALE_C);
    }
    double loc = inside > 0 ? loc0 + s0 * psiSum / inside : loc0;
    double scale = s0 * Math.sqrt(rhoSum / values.length / scaleConsistency);
    return new double[] {loc, scale};
  }

  /** The wrapping function. */
  @VisibleForTesting
  static double psi(double z) {
    double a = Math.abs(z);
    if (a < B) {
      return z;
    }
    if (a <= C) {
      return Q1 * Math.tanh(Q2 * (C - a)) * Math.signum(z);
    }
    return 0;
  }

  /** E[min(Z^2, c^2)] for a standard normal Z. */
  private static double clippedSquareExpectation(double c) {
    try {
      double tail = 1 - new NormalDistributionImpl(0, 1).cumulativeProbability(c);
      double density = Math.exp(-0.5 * c * c) / Math.sqrt(2 * Math.PI);
      return (1 - 2 * tail) - 2 * c * density + 2 * c * c * tail;
    } catch (MathException e) {
      throw new RuntimeException(e.getMessage());
    }
  }
}
