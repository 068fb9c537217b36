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

import net.larse.robscout.covariance.CovarianceEstimator;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.Standardizer;
import net.larse.robscout.solver.GraphicalLassoSolver;
import net.larse.robscout.solver.PenalizedRegressionSolver;
import net.larse.robscout.solver.RegressionPath;
import org.apache.commons.math.stat.descriptive.UnivariateStatistic;
import org.ejml.data.DenseMatrix64F;

/**
 * Coefficient stage for a fixed graph penalty.
 *
 * <p>The predictor covariance is replaced by the graph solver's regularized covariance at the
 * given penalty and the regression solver runs along the coefficient path against it. Each
 * coefficient vector is scored by its root mean squared prediction error on validation rows,
 * which go through the estimator's preprocessing first.
 *
 * <p>Instances hold no per-call state and may be shared between fold tasks.
 */
public class CoefficientSelector {
  private final CovarianceEstimator estimator;
  private final GraphicalLassoSolver graphSolver;
  private final PenalizedRegressionSolver regressionSolver;
  private final String centerFunction;
  private final boolean rescale;

  public CoefficientSelector(CovarianceEstimator estimator, GraphicalLassoSolver graphSolver,
      PenalizedRegressionSolver regressionSolver, String centerFunction, boolean rescale) {
    Standardizer.centerStatistic(centerFunction);
    this.estimator = estimator;
    this.graphSolver = graphSolver;
    this.regressionSolver = regressionSolver;
    this.centerFunction = centerFunction;
    this.rescale = rescale;
  }

  /**
   * Coefficients along lambdas for the training rows. When configured, each vector is rescaled
   * against the estimator's own covariance, not the regularized one.
   */
  public Fit fit(DenseMatrix64F x, double[] y, double graphPenalty, double[] lambdas) {
    if (y.length != x.numRows) {
      throw new InvalidInputException(String.format(
          "Response has %d entries but the data has %d rows", y.length, x.numRows));
    }
    DenseMatrix64F s = estimator.estimate(x);
    double[] sigmaXy = estimator.estimate(x, y);
    DenseMatrix64F sigmaHat = graphSolver.solve(s, new double[] {graphPenalty}).covariance(0);

    RegressionPath path = regressionSolver.solve(sigmaHat, sigmaXy, lambdas);
    double[][] coefficients = new double[path.numberOfLambdas][];
    for (int i = 0; i < path.numberOfLambdas; i++) {
      double[] beta = path.getWeights(i);
      coefficients[i] = rescale ? rescale(beta, s, sigmaXy) : beta;
    }
    return new Fit(path, coefficients);
  }

  /** Fits on the training rows and scores every penalty on the validation rows. */
  public Result select(DenseMatrix64F xTrain, double[] yTrain, DenseMatrix64F xValidation,
      double[] yValidation, double graphPenalty, double[] lambdas) {
    if (xValidation.numCols != xTrain.numCols || yValidation.length != xValidation.numRows) {
      throw new InvalidInputException(String.format(
          "Validation data is %dx%d with %d responses; training data has %d columns",
          xValidation.numRows, xValidation.numCols, yValidation.length, xTrain.numCols));
    }
    Fit fit = fit(xTrain, yTrain, graphPenalty, lambdas);

    // A fresh statistic per call; the commons-math ones keep internal buffers.
    UnivariateStatistic center = Standardizer.centerStatistic(centerFunction);
    double yCenter = center.evaluate(yTrain);
    double[] xCenters = new double[xTrain.numCols];
    for (int j = 0; j < xCenters.length; j++) {
      xCenters[j] = center.evaluate(MatrixHelper.column(xTrain, j));
    }
    DenseMatrix64F cleaned = estimator.preprocess(xValidation);

    double[] errors = new double[fit.coefficients.length];
    for (int i = 0; i < errors.length; i++) {
      errors[i] = rmspe(cleaned, yValidation, xCenters, yCenter, fit.coefficients[i]);
    }
    return new Result(fit, errors, ArrayHelper.argMin(errors));
  }

  /**
   * Least-squares refit along beta: beta * (beta' sigmaXy) / (beta' s beta), with s the
   * unregularized covariance of the stage. Zero vectors are returned as is.
   */
  static double[] rescale(double[] beta, DenseMatrix64F s, double[] sigmaXy) {
    double denominator = MatrixHelper.quadraticForm(s, beta);
    if (denominator == 0) {
      return beta;
    }
    double c = MatrixHelper.dot(beta, sigmaXy) / denominator;
    double[] scaled = new double[beta.length];
    for (int j = 0; j < beta.length; j++) {
      scaled[j] = c * beta[j];
    }
    return scaled;
  }

  static double rmspe(DenseMatrix64F x, double[] y, double[] xCenters, double yCenter,
      double[] beta) {
    double sum = 0;
    for (int i = 0; i < x.numRows; i++) {
      double prediction = yCenter;
      for (int j = 0; j < x.numCols; j++) {
        prediction += (x.unsafe_get(i, j) - xCenters[j]) * beta[j];
      }
      double residual = y[i] - prediction;
      sum += residual * residual;
    }
    return Math.sqrt(sum / x.numRows);
  }

  /** A regression path and the (possibly rescaled) coefficients taken from it. */
  public static class Fit {
    public final RegressionPath path;
    public final double[][] coefficients;

    Fit(RegressionPath path, double[][] coefficients) {
      this.path = path;
      this.coefficients = coefficients;
    }
  }

  /** Validation errors per penalty and the best index. */
  public static class Result {
    public final Fit fit;
    public final double[] errors;
    public final int index;

    Result(Fit fit, double[] errors, int index) {
      this.fit = fit;
      this.errors = errors;
      this.index = index;
    }

    public double lambda() {
      return fit.path.lambdas[index];
    }

    public double[] coefficients() {
      return fit.coefficients[index].clone();
    }
  }
}
