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

import net.larse.robscout.helper.InvalidInputException;
import org.ejml.data.DenseMatrix64F;

/** Applies a {@link FittedModel} to new rows. */
public final class Predictor {
  private Predictor() {}

  /**
   * y = x * beta~ (+ intercept), where beta~ are the coefficients on the original scale.
   */
  public static double[] predict(FittedModel model, DenseMatrix64F x, boolean useIntercept) {
    if (x.numCols != model.numFeatures()) {
      throw new InvalidInputException(String.format(
          "Model has %d features but the data has %d columns", model.numFeatures(), x.numCols));
    }
    double[] beta = model.rescaledCoefficients();
    double offset = useIntercept ? model.intercept() : 0;
    double[] y = new double[x.numRows];
    for (int i = 0; i < x.numRows; i++) {
      double sum = offset;
      for (int j = 0; j < x.numCols; j++) {
        sum += x.unsafe_get(i, j) * beta[j];
      }
      y[i] = sum;
    }
    return y;
  }
}
