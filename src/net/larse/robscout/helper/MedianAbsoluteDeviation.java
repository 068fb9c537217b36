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

import org.apache.commons.math.stat.descriptive.AbstractUnivariateStatistic;
import org.apache.commons.math.stat.descriptive.UnivariateStatistic;
import org.apache.commons.math.stat.descriptive.rank.Median;

/**
 * Median absolute deviation around the median, scaled by 1.4826 so that it is consistent for the
 * standard deviation of normal data (the same constant as R's mad()).
 */
public class MedianAbsoluteDeviation extends AbstractUnivariateStatistic {
  public static final double CONSISTENCY = 1.4826;

  private final Median median = new Median();

  @Override
  public double evaluate(double[] values, int begin, int length) {
    if (!test(values, begin, length)) {
      return Double.NaN;
    }
    double center = median.evaluate(values, begin, length);
    double[] deviations = new double[length];
    for (int i = 0; i < length; i++) {
      deviations[i] = Math.abs(values[begin + i] - center);
    }
    return CONSISTENCY * median.evaluate(deviations);
  }

  @Override
  public UnivariateStatistic copy() {
    return new MedianAbsoluteDeviation();
  }
}
