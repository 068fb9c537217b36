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

import java.util.Optional;
import net.larse.robscout.covariance.CovarianceEstimator;
import net.larse.robscout.covariance.CovarianceMethod;
import net.larse.robscout.helper.AlgorithmBase.ArgsBase;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.Standardizer;
import net.larse.robscout.solver.GlassoPath;
import net.larse.robscout.solver.GraphicalLassoSolver;
import net.larse.robscout.solver.Solvers;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Picks a sparse precision matrix along a penalty path by an information criterion.
 *
 * <p>The covariance of the (optionally standardized) data is handed to the graph solver once for
 * the whole path. Each precision on the path is scored against either the same covariance or,
 * when validation rows are given, the covariance of those rows. The lowest score wins; ties go
 * to the larger penalty.
 */
public class PrecisionSelector {
  private static final Logger logger = LogManager.getLogger(PrecisionSelector.class);

  public static class Args extends ArgsBase {
    @Doc(help = "Covariance method: default, winsor, wrap or ddc.")
    @Optional
    public String method = "default";

    @Doc(help = "Information criterion: loglik, bic or ebic.")
    @Optional
    public String criterion = "bic";

    @Doc(help = "Penalty norm on the precision: 0 = none, 1 = lasso, 2 = ridge.")
    @Optional
    public int graphNorm = Solvers.LASSO;

    @Doc(help = "Number of penalties on the computed path.")
    @Optional
    public int nlambda = 10;

    @Doc(help = "Smallest penalty as a fraction of the largest.")
    @Optional
    public double lambdaMinRatio = 0.1;

    @Doc(help = "Explicit penalty path, in decreasing order. Computed when null.")
    @Optional
    public double[] lambdas = null;

    @Doc(help = "Standardize the columns before estimating the covariance.")
    @Optional
    public boolean standardize = true;

    @Doc(help = "Center function used to standardize: mean or median.")
    @Optional
    public String centerFunction = "mean";

    @Doc(help = "Scale function used to standardize: sd or mad.")
    @Optional
    public String scaleFunction = "sd";

    @Doc(help = "Estimate correlations instead of covariances.")
    @Optional
    public boolean correlation = false;
  }

  private final Args args;
  private final CovarianceEstimator estimator;
  private final GraphicalLassoSolver solver;
  private final InformationCriterion criterion;

  public PrecisionSelector(Args args) {
    this(args, CovarianceMethod.fromName(args.method).create(args.correlation),
        Solvers.graphSolver(args.graphNorm));
  }

  public PrecisionSelector(Args args, CovarianceEstimator estimator,
      GraphicalLassoSolver solver) {
    Solvers.checkNorm(args.graphNorm);
    // Both statistics are resolved here so a bad name fails before any work.
    Standardizer.centerStatistic(args.centerFunction);
    Standardizer.scaleStatistic(args.scaleFunction);
    this.args = args;
    this.estimator = estimator;
    this.solver = solver;
    this.criterion = InformationCriterion.fromName(args.criterion);
  }

  public Selection select(DenseMatrix64F x) {
    return select(x, Optional.empty());
  }

  /**
   * Selects a precision for x. Validation rows, when present, are standardized with the
   * statistics of x and supply the covariance each candidate is scored against.
   */
  public Selection select(DenseMatrix64F x, Optional<DenseMatrix64F> validation) {
    if (x.numRows < 2 || x.numCols < 1) {
      throw new InvalidInputException(String.format(
          "Need at least 2 rows and 1 column, got %dx%d", x.numRows, x.numCols));
    }
    validation.ifPresent(v -> {
      if (v.numCols != x.numCols || v.numRows < 2) {
        throw new InvalidInputException(String.format(
            "Validation data is %dx%d but training data has %d columns",
            v.numRows, v.numCols, x.numCols));
      }
    });

    DenseMatrix64F train = x;
    Optional<DenseMatrix64F> test = validation;
    if (args.standardize) {
      Standardizer.Standardized std =
          new Standardizer(args.centerFunction, args.scaleFunction).standardize(x);
      train = std.matrix;
      test = validation.map(v -> Standardizer.apply(v, std.centers, std.scales));
    }

    DenseMatrix64F s = estimator.estimate(train);
    DenseMatrix64F eval = test.isPresent() ? estimator.estimate(test.get()) : s;
    double[] lambdas = args.lambdas != null
        ? args.lambdas.clone()
        : PathBuilder.graphPath(s, args.graphNorm, args.nlambda, args.lambdaMinRatio);
    return score(s, eval, train.numRows, lambdas);
  }

  /**
   * Runs the solver on s along lambdas and scores each precision against eval with n
   * observations.
   */
  Selection score(DenseMatrix64F s, DenseMatrix64F eval, int n, double[] lambdas) {
    GlassoPath path = solver.solve(s, lambdas);
    double[] scores = new double[path.size()];
    for (int i = 0; i < scores.length; i++) {
      scores[i] = criterion.score(path.precision(i), eval, n);
    }
    Selection selection = new Selection(path, scores, ArrayHelper.argMin(scores));
    logger.debug("Selected graph penalty {} by {} from {} candidates", selection.lambda(),
        criterion.tag(), scores.length);
    return selection;
  }

  /** The scored path and the index of its best entry. */
  public static class Selection {
    private final GlassoPath path;
    private final double[] scores;
    private final int index;

    Selection(GlassoPath path, double[] scores, int index) {
      this.path = path;
      this.scores = scores;
      this.index = index;
    }

    public double lambda() {
      return path.lambda(index);
    }

    public DenseMatrix64F precision() {
      return path.precision(index);
    }

    public DenseMatrix64F covariance() {
      return path.covariance(index);
    }

    public double[] scores() {
      return scores.clone();
    }

    public GlassoPath path() {
      return path;
    }
  }
}
