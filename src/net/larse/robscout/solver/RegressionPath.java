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
package net.larse.robscout.solver;

import net.larse.robscout.helper.ArrayHelper;

/**
 * Container for the coefficient vectors computed along a penalty path by a
 * {@link PenalizedRegressionSolver}.
 */
public class RegressionPath {
  // Number of lambda values
  public final int numberOfLambdas;

  // The value of lambdas for each solution, in the order they were solved
  public final double[] lambdas;

  // Weights for each solution
  public final double[][] weights;

  // Number of non-zero weights for each solution
  public final int[] nonZeroWeights;

  private final int numFeatures;

  public RegressionPath(double[] lambdas, int numFeatures) {
    this.numberOfLambdas = lambdas.length;
    this.lambdas = lambdas.clone();
    this.weights = new double[numberOfLambdas][numFeatures];
    this.nonZeroWeights = new int[numberOfLambdas];
    this.numFeatures = numFeatures;
  }

  public double[] getWeights(int lambdaIdx) {
    return weights[lambdaIdx].clone();
  }

  void setWeights(int lambdaIdx, double[] w) {
    System.arraycopy(w, 0, weights[lambdaIdx], 0, numFeatures);
    nonZeroWeights[lambdaIdx] = ArrayHelper.countNonZero(w, 0);
  }
}
