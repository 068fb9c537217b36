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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.MedianAbsoluteDeviation;
import org.apache.commons.math.MathException;
import org.apache.commons.math.distribution.ChiSquaredDistributionImpl;
import org.apache.commons.math.stat.descriptive.rank.Median;
import org.ejml.data.DenseMatrix64F;

/**
 * A detect-deviating-cells imputer in the spirit of Rousseeuw and Van den Bossche (2018).
 *
 * <ol>
 *   <li>Standardize each column by median and mad.
 *   <li>Flag cells whose robust z-score exceeds sqrt(qchisq(tolProb, 1)).
 *   <li>Correlate columns on their unflagged cells; columns with |r| >= corrLimit are linked.
 *   <li>Predict every cell from the linked columns of the same row (weighted by |r|), and also
 *       flag cells whose standardized residual from that prediction exceeds the cutoff.
 *   <li>Replace the flagged cells by their prediction, or by the column median when the column has
 *       no usable link.
 * </ol>
 */
public class DetectDeviatingCells implements CellwiseImputer {
  private static final int MIN_PAIRS = 3;

  private final double cutoff;
  private final double corrLimit;

  public DetectDeviatingCells() {
    this(0.99, 0.5);
  }

  public DetectDeviatingCells(double tolProb, double corrLimit) {
    this.corrLimit = corrLimit;
    try {
      this.cutoff =
          Math.sqrt(new ChiSquaredDistributionImpl(1).inverseCumulativeProbability(tolProb));
    } catch (MathException e) {
      throw new RuntimeException(e.getMessage());
    }
  }

  @Override
  public DenseMatrix64F impute(DenseMatrix64F x) {
    int n = x.numRows;
    int p = x.numCols;
    Median median = new Median();
    MedianAbsoluteDeviation mad = new MedianAbsoluteDeviation();

    double[] loc = new double[p];
    double[] scale = new double[p];
    double[][] z = new double[p][n];
    boolean[][] flagged = new boolean[p][n];
    for (int j = 0; j < p; j++) {
      double[] col = MatrixHelper.column(x, j);
      loc[j] = median.evaluate(col);
      double s = mad.evaluate(col);
      scale[j] = s > 0 ? s : 1;
      for (int i = 0; i < n; i++) {
        z[j][i] = (col[i] - loc[j]) / scale[j];
        flagged[j][i] = Math.abs(z[j][i]) > cutoff;
      }
    }

    double[][] r = cleanCorrelations(z, flagged);

    double[][] predicted = new double[p][n];
    for (int j = 0; j < p; j++) {
      IntArrayList links = new IntArrayList();
      for (int k = 0; k < p; k++) {
        if (k != j && Math.abs(r[j][k]) >= corrLimit) {
          links.add(k);
        }
      }
      for (int i = 0; i < n; i++) {
        double sum = 0;
        double weights = 0;
        for (int l = 0; l < links.size(); l++) {
          int k = links.getInt(l);
          if (flagged[k][i]) {
            continue;
          }
          double w = Math.abs(r[j][k]);
          sum += w * r[j][k] * z[k][i];
          weights += w;
        }
        predicted[j][i] = weights > 0 ? sum / weights : 0;
      }

      if (!links.isEmpty()) {
        flagLargeResiduals(z[j], predicted[j], flagged[j], mad);
      }
    }

    DenseMatrix64F result = x.copy();
    for (int j = 0; j < p; j++) {
      for (int i = 0; i < n; i++) {
        if (flagged[j][i]) {
          result.unsafe_set(i, j, loc[j] + scale[j] * predicted[j][i]);
        }
      }
    }
    return result;
  }

  /** Pairwise correlations using only rows where neither cell is flagged. */
  private static double[][] cleanCorrelations(double[][] z, boolean[][] flagged) {
    int p = z.length;
    int n = p == 0 ? 0 : z[0].length;
    double[][] r = new double[p][p];
    for (int j = 0; j < p; j++) {
      r[j][j] = 1;
      for (int k = 0; k < j; k++) {
        IntArrayList rows = new IntArrayList();
        for (int i = 0; i < n; i++) {
          if (!flagged[j][i] && !flagged[k][i]) {
            rows.add(i);
          }
        }
        if (rows.size() < MIN_PAIRS) {
          continue;
        }
        double[] a = new double[rows.size()];
        double[] b = new double[rows.size()];
        for (int l = 0; l < rows.size(); l++) {
          a[l] = z[j][rows.getInt(l)];
          b[l] = z[k][rows.getInt(l)];
        }
        r[j][k] = r[k][j] = MatrixHelper.pearson(a, b);
      }
    }
    return r;
  }

  private void flagLargeResiduals(double[] z, double[] predicted, boolean[] flagged,
      MedianAbsoluteDeviation mad) {
    IntArrayList clean = new IntArrayList();
    for (int i = 0; i < z.length; i++) {
      if (!flagged[i]) {
        clean.add(i);
      }
    }
    if (clean.size() < MIN_PAIRS) {
      return;
    }
    double[] residuals = new double[clean.size()];
    for (int l = 0; l < clean.size(); l++) {
      int i = clean.getInt(l);
      residuals[l] = z[i] - predicted[i];
    }
    double s = mad.evaluate(residuals);
    if (!(s > 0)) {
      return;
    }
    for (int i = 0; i < z.length; i++) {
      if (Math.abs(z[i] - predicted[i]) / s > cutoff) {
        flagged[i] = true;
      }
    }
  }
}
