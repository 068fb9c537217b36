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

import java.io.Serializable;
import net.larse.robscout.helper.ArrayHelper;

/**
 * The result of {@link StepwiseFitter}: the two selected penalties, coefficients on the
 * standardized scale, the intercept on the original scale, the standardization that links the
 * two, and the cross-validation errors the coefficient penalty was chosen from.
 */
public final class FittedModel implements Serializable {
  private static final long serialVersionUID = 1;

  private final double graphPenalty;
  private final double coefficientPenalty;
  private final double[] coefficients;
  private final double intercept;
  private final double[] xCenters;
  private final double[] xScales;
  private final double yCenter;
  private final double yScale;
  private final double[] graphLambdas;
  private final double[] coefficientLambdas;
  // [fold][penalty]
  private final double[][] cvErrors;
  private final double[] meanCvErrors;

  FittedModel(double graphPenalty, double coefficientPenalty, double[] coefficients,
      double[] xCenters, double[] xScales, double yCenter, double yScale,
      double[] graphLambdas, double[] coefficientLambdas, double[][] cvErrors,
      double[] meanCvErrors) {
    this.graphPenalty = graphPenalty;
    this.coefficientPenalty = coefficientPenalty;
    this.coefficients = coefficients.clone();
    this.xCenters = xCenters.clone();
    this.xScales = xScales.clone();
    this.yCenter = yCenter;
    this.yScale = yScale;
    this.graphLambdas = graphLambdas.clone();
    this.coefficientLambdas = coefficientLambdas.clone();
    this.cvErrors = new double[cvErrors.length][];
    for (int k = 0; k < cvErrors.length; k++) {
      this.cvErrors[k] = cvErrors[k].clone();
    }
    this.meanCvErrors = meanCvErrors.clone();

    double sum = 0;
    double[] rescaled = rescaledCoefficients();
    for (int j = 0; j < rescaled.length; j++) {
      sum += xCenters[j] * rescaled[j];
    }
    this.intercept = yCenter - sum;
  }

  public double graphPenalty() {
    return graphPenalty;
  }

  public double coefficientPenalty() {
    return coefficientPenalty;
  }

  /** Coefficients for standardized predictors and response. */
  public double[] coefficients() {
    return coefficients.clone();
  }

  /** Coefficients on the original scale: beta_j * yScale / xScale_j. */
  public double[] rescaledCoefficients() {
    double[] rescaled = new double[coefficients.length];
    for (int j = 0; j < coefficients.length; j++) {
      rescaled[j] = coefficients[j] * yScale / xScales[j];
    }
    return rescaled;
  }

  public double intercept() {
    return intercept;
  }

  public int numFeatures() {
    return coefficients.length;
  }

  public double[] xCenters() {
    return xCenters.clone();
  }

  public double[] xScales() {
    return xScales.clone();
  }

  public double yCenter() {
    return yCenter;
  }

  public double yScale() {
    return yScale;
  }

  public double[] graphLambdas() {
    return graphLambdas.clone();
  }

  public double[] coefficientLambdas() {
    return coefficientLambdas.clone();
  }

  public double[][] cvErrors() {
    double[][] copy = new double[cvErrors.length][];
    for (int k = 0; k < cvErrors.length; k++) {
      copy[k] = cvErrors[k].clone();
    }
    return copy;
  }

  public double[] meanCvErrors() {
    return meanCvErrors.clone();
  }

  @Override
  public String toString() {
    int nonZero = ArrayHelper.countNonZero(coefficients, 0);
    return String.format("FittedModel[lambda1=%g, lambda2=%g, %d of %d non-zero, intercept=%g]",
        graphPenalty, coefficientPenalty, nonZero, coefficients.length, intercept);
  }
}
