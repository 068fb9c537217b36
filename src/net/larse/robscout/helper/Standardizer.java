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
package net.larse.robscout.helper;

import org.apache.commons.math.stat.descriptive.UnivariateStatistic;
import org.apache.commons.math.stat.descriptive.moment.Mean;
import org.apache.commons.math.stat.descriptive.moment.StandardDeviation;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Centers and scales columns with a pair of univariate statistics, mean/sd by default and
 * median/mad for the robust variant.
 *
 * <p>A column whose scale is zero (or not finite) is centered but left unscaled; its recorded
 * scale is 1.
 */
public class Standardizer {
  private static final Logger logger = LogManager.getLogger(Standardizer.class);

  private final UnivariateStatistic center;
  private final UnivariateStatistic scale;

  public Standardizer(UnivariateStatistic center, UnivariateStatistic scale) {
    this.center = center;
    this.scale = scale;
  }

  public Standardizer(String centerName, String scaleName) {
    this(centerStatistic(centerName), scaleStatistic(scaleName));
  }

  /** "mean" or "median". */
  public static UnivariateStatistic centerStatistic(String name) {
    switch (name) {
      case "mean":
        return new Mean();
      case "median":
        return new Median();
      default:
        throw new UnsupportedOptionException("center function", name);
    }
  }

  /** "sd" or "mad". */
  public static UnivariateStatistic scaleStatistic(String name) {
    switch (name) {
      case "sd":
        return new StandardDeviation();
      case "mad":
        return new MedianAbsoluteDeviation();
      default:
        throw new UnsupportedOptionException("scale function", name);
    }
  }

  /** Standardizes the columns of x. */
  public Standardized standardize(DenseMatrix64F x) {
    double[] centers = new double[x.numCols];
    double[] scales = new double[x.numCols];
    DenseMatrix64F result = new DenseMatrix64F(x.numRows, x.numCols);
    for (int j = 0; j < x.numCols; j++) {
      double[] col = MatrixHelper.column(x, j);
      centers[j] = center.evaluate(col);
      scales[j] = checkedScale(scale.evaluate(col), "column " + j);
      for (int i = 0; i < col.length; i++) {
        result.unsafe_set(i, j, (col[i] - centers[j]) / scales[j]);
      }
    }
    return new Standardized(result, null, centers, scales);
  }

  /** Standardizes a single vector, typically the response. */
  public Standardized standardize(double[] y) {
    double c = center.evaluate(y);
    double s = checkedScale(scale.evaluate(y), "response");
    double[] result = new double[y.length];
    for (int i = 0; i < y.length; i++) {
      result[i] = (y[i] - c) / s;
    }
    return new Standardized(null, result, new double[] {c}, new double[] {s});
  }

  /** Applies previously computed column centers and scales to x. */
  public static DenseMatrix64F apply(DenseMatrix64F x, double[] centers, double[] scales) {
    if (centers.length != x.numCols || scales.length != x.numCols) {
      throw new InvalidInputException(String.format(
          "Expected %d columns, got %d", centers.length, x.numCols));
    }
    DenseMatrix64F result = new DenseMatrix64F(x.numRows, x.numCols);
    for (int i = 0; i < x.numRows; i++) {
      for (int j = 0; j < x.numCols; j++) {
        result.unsafe_set(i, j, (x.unsafe_get(i, j) - centers[j]) / scales[j]);
      }
    }
    return result;
  }

  private static double checkedScale(double s, String what) {
    if (s > 0 && !Double.isInfinite(s)) {
      return s;
    }
    logger.warn("Scale of {} is {}; leaving it unscaled", what, s);
    return 1;
  }

  /** Standardized data with the centers and scales that produced it. */
  public static class Standardized {
    public final DenseMatrix64F matrix;
    public final double[] vector;
    public final double[] centers;
    public final double[] scales;

    Standardized(DenseMatrix64F matrix, double[] vector, double[] centers, double[] scales) {
      this.matrix = matrix;
      this.vector = vector;
      this.centers = centers;
      this.scales = scales;
    }

    /** Wraps data that was centered and scaled elsewhere, or left as is. */
    public static Standardized of(DenseMatrix64F matrix, double[] vector, double[] centers,
        double[] scales) {
      return new Standardized(matrix, vector, centers, scales);
    }
  }
}
