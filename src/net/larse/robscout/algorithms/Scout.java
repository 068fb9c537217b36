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

import java.util.List;
import java.util.Optional;
import net.larse.robscout.covariance.CovarianceMethod;
import org.ejml.data.DenseMatrix64F;

/**
 * Entry points for robust covariance-regularized regression.
 *
 * <pre>
 *   StepwiseFitter.Args args = new StepwiseFitter.Args();
 *   args.graphMethod = "ddc";
 *   args.coefficientMethod = "ddc";
 *   FittedModel model = Scout.fit(x, y, args);
 *   double[] yHat = Scout.predict(model, xNew, true);
 * </pre>
 */
public final class Scout {
  private Scout() {}

  /** Covariance (or correlation) of the columns of x by the named method. */
  public static DenseMatrix64F estimateCovariance(DenseMatrix64F x, String method,
      boolean correlation) {
    return CovarianceMethod.fromName(method).create(correlation).estimate(x);
  }

  /** Covariance (or correlation) of each column of x with y by the named method. */
  public static double[] estimateCovariance(DenseMatrix64F x, double[] y, String method,
      boolean correlation) {
    return CovarianceMethod.fromName(method).create(correlation).estimate(x, y);
  }

  /** Information-criterion precision selection with default settings for everything else. */
  public static PrecisionSelector.Selection selectPrecision(DenseMatrix64F x, String method,
      String criterion) {
    PrecisionSelector.Args args = new PrecisionSelector.Args();
    args.method = method;
    args.criterion = criterion;
    return selectPrecision(x, Optional.empty(), args);
  }

  public static PrecisionSelector.Selection selectPrecision(DenseMatrix64F x,
      Optional<DenseMatrix64F> validation, PrecisionSelector.Args args) {
    return new PrecisionSelector(args).select(x, validation);
  }

  public static FittedModel fit(DenseMatrix64F x, double[] y, StepwiseFitter.Args args) {
    return new StepwiseFitter(args).fit(x, y);
  }

  public static FittedModel fit(DenseMatrix64F x, double[] y, StepwiseFitter.Args args,
      List<int[]> folds) {
    return new StepwiseFitter(args).fit(x, y, Optional.of(folds));
  }

  public static double[] predict(FittedModel model, DenseMatrix64F x, boolean useIntercept) {
    return Predictor.predict(model, x, useIntercept);
  }
}
