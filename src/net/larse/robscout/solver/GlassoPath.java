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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ejml.data.DenseMatrix64F;

/**
 * The precision matrices produced by a {@link GraphicalLassoSolver}, one per penalty, together
 * with their inverses and the penalty sequence the solver actually used. Callers must read the
 * penalties from here rather than assume their request was used verbatim.
 */
public class GlassoPath {
  private final double[] lambdas;
  private final List<DenseMatrix64F> precisions;
  private final List<DenseMatrix64F> covariances;

  public GlassoPath(double[] lambdas, List<DenseMatrix64F> precisions,
      List<DenseMatrix64F> covariances) {
    if (lambdas.length != precisions.size() || lambdas.length != covariances.size()) {
      throw new IllegalArgumentException(String.format(
          "%d lambdas but %d precision and %d covariance matrices", lambdas.length,
          precisions.size(), covariances.size()));
    }
    this.lambdas = lambdas.clone();
    this.precisions = Collections.unmodifiableList(new ArrayList<>(precisions));
    this.covariances = Collections.unmodifiableList(new ArrayList<>(covariances));
  }

  public int size() {
    return lambdas.length;
  }

  public double[] lambdas() {
    return lambdas.clone();
  }

  public double lambda(int idx) {
    return lambdas[idx];
  }

  /** Estimated precision (inverse covariance) for penalty idx. */
  public DenseMatrix64F precision(int idx) {
    return precisions.get(idx);
  }

  /** Estimated covariance, the inverse of {@link #precision(int)}. */
  public DenseMatrix64F covariance(int idx) {
    return covariances.get(idx);
  }
}
