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

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.MoreExecutors;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import net.larse.robscout.covariance.CovarianceEstimator;
import net.larse.robscout.covariance.CovarianceMethod;
import net.larse.robscout.helper.AlgorithmBase.ArgsBase;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.Standardizer;
import net.larse.robscout.helper.UnsupportedOptionException;
import net.larse.robscout.solver.GraphicalLassoSolver;
import net.larse.robscout.solver.PenalizedRegressionSolver;
import net.larse.robscout.solver.Solvers;
import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomGenerator;
import org.apache.commons.math.stat.descriptive.UnivariateStatistic;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.ejml.data.DenseMatrix64F;

/**
 * Two-stage tuning of a covariance-regularized regression.
 *
 * <p>The graph penalty is chosen once on all rows, by information criterion or by
 * cross-validation. With it held fixed, the coefficient penalty is chosen by K-fold
 * cross-validated prediction error, and both are then refit on all rows. Because the graph
 * penalty sees every row, the coefficient-stage error is somewhat optimistic.
 *
 * <p>A fitter runs once. Create a new one for every fit.
 */
public class StepwiseFitter {
  private static final Logger logger = LogManager.getLogger(StepwiseFitter.class);

  /** Progress of a fit. Each stage is entered once, in order. */
  public enum Stage {
    INIT,
    GRAPH_SELECTED,
    CV_COEFFICIENT_SELECTED,
    FINAL_FIT,
    DONE
  }

  /** How the graph penalty is chosen. */
  public enum GraphSelection {
    CRITERION,
    CROSS_VALIDATION;

    public static GraphSelection fromName(String name) {
      if (name == null) {
        throw new UnsupportedOptionException("graph selection", null);
      }
      switch (name.trim().toLowerCase(Locale.ROOT)) {
        case "criterion":
          return CRITERION;
        case "cv":
          return CROSS_VALIDATION;
        default:
          throw new UnsupportedOptionException("graph selection", name);
      }
    }
  }

  public static class Args extends ArgsBase {
    @Doc(help = "Number of cross-validation folds.")
    @Optional
    public int numFolds = 5;

    @Doc(help = "Penalty norm on the precision: 0 = none, 1 = lasso, 2 = ridge.")
    @Optional
    public int graphNorm = Solvers.LASSO;

    @Doc(help = "Penalty norm on the coefficients: 0 = none, 1 = lasso, 2 = ridge.")
    @Optional
    public int coefficientNorm = Solvers.LASSO;

    @Doc(help = "Number of graph penalties on the computed path.")
    @Optional
    public int nlambda1 = 10;

    @Doc(help = "Smallest graph penalty as a fraction of the largest.")
    @Optional
    public double lambdaMinRatio1 = 0.1;

    @Doc(help = "Explicit graph penalty path, decreasing. Computed when null.")
    @Optional
    public double[] lambdas1 = null;

    @Doc(help = "Number of coefficient penalties on the computed path.")
    @Optional
    public int nlambda2 = 10;

    @Doc(help = "Smallest coefficient penalty as a fraction of the largest.")
    @Optional
    public double lambdaMinRatio2 = 0.01;

    @Doc(help = "Explicit coefficient penalty path, decreasing. Computed when null.")
    @Optional
    public double[] lambdas2 = null;

    @Doc(help = "Covariance method for the graph stage: default, winsor, wrap or ddc.")
    @Optional
    public String graphMethod = "default";

    @Doc(help = "Covariance method for the coefficient stage: default, winsor, wrap or ddc.")
    @Optional
    public String coefficientMethod = "default";

    @Doc(help = "Information criterion for the graph stage: loglik, bic or ebic.")
    @Optional
    public String criterion = "bic";

    @Doc(help = "Graph penalty selection: criterion or cv.")
    @Optional
    public String graphSelection = "criterion";

    @Doc(help = "Center function: mean or median.")
    @Optional
    public String centerFunction = "mean";

    @Doc(help = "Scale function: sd or mad.")
    @Optional
    public String scaleFunction = "sd";

    @Doc(help = "Standardize predictors and response before fitting.")
    @Optional
    public boolean standardize = true;

    @Doc(help = "Rescale each coefficient vector to undo the penalty's shrinkage.")
    @Optional
    public boolean rescale = true;

    @Doc(help = "Estimate correlations instead of covariances.")
    @Optional
    public boolean correlation = false;

    @Doc(help = "Seed for the random fold assignment.")
    @Optional
    public long seed = 1234;

    @Doc(help = "Worker threads for the fold tasks. 1 runs them on the calling thread.")
    @Optional
    public int threads = 1;
  }

  private final Args args;
  private final CovarianceEstimator graphEstimator;
  private final CovarianceEstimator coefficientEstimator;
  private final GraphicalLassoSolver graphSolver;
  private final PenalizedRegressionSolver regressionSolver;
  private final InformationCriterion criterion;
  private final GraphSelection graphSelection;

  private Stage stage = Stage.INIT;
  private boolean started = false;

  public StepwiseFitter(Args args) {
    this(args,
        CovarianceMethod.fromName(args.graphMethod).create(args.correlation),
        CovarianceMethod.fromName(args.coefficientMethod).create(args.correlation),
        Solvers.graphSolver(args.graphNorm),
        Solvers.regressionSolver(args.coefficientNorm));
  }

  public StepwiseFitter(Args args, CovarianceEstimator graphEstimator,
      CovarianceEstimator coefficientEstimator, GraphicalLassoSolver graphSolver,
      PenalizedRegressionSolver regressionSolver) {
    Solvers.checkNorm(args.graphNorm);
    Solvers.checkNorm(args.coefficientNorm);
    Standardizer.centerStatistic(args.centerFunction);
    Standardizer.scaleStatistic(args.scaleFunction);
    Preconditions.checkArgument(args.threads >= 1, "threads must be positive");
    this.args = args;
    this.graphEstimator = graphEstimator;
    this.coefficientEstimator = coefficientEstimator;
    this.graphSolver = graphSolver;
    this.regressionSolver = regressionSolver;
    this.criterion = InformationCriterion.fromName(args.criterion);
    this.graphSelection = GraphSelection.fromName(args.graphSelection);
  }

  public Stage stage() {
    return stage;
  }

  public FittedModel fit(DenseMatrix64F x, double[] y) {
    return fit(x, y, Optional.empty());
  }

  /**
   * Fits x and y. Supplied folds must be exactly {@code numFolds} non-empty, disjoint sets of
   * 0-based rows that together cover every row.
   */
  public FittedModel fit(DenseMatrix64F x, double[] y, Optional<List<int[]>> folds) {
    if (started) {
      throw new IllegalStateException("StepwiseFitter already used; stage is " + stage);
    }
    started = true;
    logger.debug(args.describe());

    // INIT: all validation happens before any estimation.
    validate(x, y);
    FoldAssignment assignment = folds.isPresent()
        ? FoldAssignment.of(folds.get(), x.numRows, args.numFolds)
        : FoldAssignment.random(x.numRows, args.numFolds, newRandom());
    if (graphSelection == GraphSelection.CROSS_VALIDATION) {
      validateGraphFolds(assignment);
    }

    Standardizer.Standardized xs;
    Standardizer.Standardized ys;
    if (args.standardize) {
      Standardizer standardizer = new Standardizer(args.centerFunction, args.scaleFunction);
      xs = standardizer.standardize(x);
      ys = standardizer.standardize(y);
    } else {
      xs = unscaled(x);
      ys = unscaled(y);
    }
    DenseMatrix64F xStd = xs.matrix;
    double[] yStd = ys.vector;

    // GRAPH_SELECTED
    DenseMatrix64F s = graphEstimator.estimate(xStd);
    double[] lambdas1 = args.lambdas1 != null
        ? args.lambdas1.clone()
        : PathBuilder.graphPath(s, args.graphNorm, args.nlambda1, args.lambdaMinRatio1);
    PrecisionSelector.Selection graph;
    if (graphSelection == GraphSelection.CROSS_VALIDATION) {
      graph = new GraphCrossValidator(graphEstimator, graphSolver, criterion)
          .select(xStd, assignment, lambdas1);
    } else {
      graph = precisionSelector().score(s, s, xStd.numRows, lambdas1);
    }
    double graphPenalty = graph.lambda();
    advance(Stage.GRAPH_SELECTED);
    logger.info("Graph penalty {} selected by {}", graphPenalty,
        graphSelection == GraphSelection.CRITERION ? criterion.tag() : "cross-validation");

    // CV_COEFFICIENT_SELECTED
    CoefficientSelector selector = new CoefficientSelector(coefficientEstimator, graphSolver,
        regressionSolver, args.centerFunction, args.rescale);
    double[] lambdas2 = args.lambdas2 != null
        ? args.lambdas2.clone()
        : PathBuilder.coefficientPath(coefficientEstimator.estimate(xStd, yStd),
            args.coefficientNorm, args.nlambda2, args.lambdaMinRatio2);
    double[][] cvErrors = crossValidate(selector, xStd, yStd, assignment, graphPenalty, lambdas2);
    double[] meanErrors = ArrayHelper.rowMeans(transpose(cvErrors));
    int best = ArrayHelper.argMin(meanErrors);
    double coefficientPenalty = lambdas2[best];
    advance(Stage.CV_COEFFICIENT_SELECTED);
    logger.info("Coefficient penalty {} selected with mean RMSPE {}", coefficientPenalty,
        meanErrors[best]);

    // FINAL_FIT
    CoefficientSelector.Fit fit = selector.fit(xStd, yStd, graphPenalty, lambdas2);
    advance(Stage.FINAL_FIT);
    logger.info("Final fit keeps {} of {} coefficients", fit.path.nonZeroWeights[best],
        xStd.numCols);

    FittedModel model = new FittedModel(graphPenalty, coefficientPenalty,
        fit.coefficients[best], xs.centers, xs.scales, ys.centers[0], ys.scales[0],
        graph.path().lambdas(), lambdas2, cvErrors, meanErrors);
    advance(Stage.DONE);
    logger.debug("Fitted {}", model);
    return model;
  }

  private void validate(DenseMatrix64F x, double[] y) {
    if (x.numRows < 2 || x.numCols < 1) {
      throw new InvalidInputException(String.format(
          "Need at least 2 rows and 1 column, got %dx%d", x.numRows, x.numCols));
    }
    if (y.length != x.numRows) {
      throw new InvalidInputException(String.format(
          "Response has %d entries but the data has %d rows", y.length, x.numRows));
    }
    if (args.numFolds < 2 || args.numFolds > x.numRows) {
      throw new InvalidInputException(String.format(
          "numFolds must be in [2, %d], got %d", x.numRows, args.numFolds));
    }
  }

  // Each held-out fold needs its own covariance for scoring the graph path.
  private static void validateGraphFolds(FoldAssignment folds) {
    for (int k = 0; k < folds.numFolds(); k++) {
      int size = folds.validationRows(k).length;
      if (size < 2) {
        throw new InvalidInputException(String.format(
            "Graph cross-validation needs at least 2 rows per fold; fold %d has %d", k, size));
      }
    }
  }

  /** RMSPE per fold and coefficient penalty, in fold order regardless of thread count. */
  private double[][] crossValidate(CoefficientSelector selector, DenseMatrix64F x, double[] y,
      FoldAssignment folds, double graphPenalty, double[] lambdas) {
    List<Callable<double[]>> tasks = new ArrayList<>();
    for (int k = 0; k < folds.numFolds(); k++) {
      int[] train = folds.trainingRows(k);
      int[] validation = folds.validationRows(k);
      tasks.add(() -> selector.select(
          MatrixHelper.selectRows(x, train), MatrixHelper.selectRows(y, train),
          MatrixHelper.selectRows(x, validation), MatrixHelper.selectRows(y, validation),
          graphPenalty, lambdas).errors);
    }

    ExecutorService executor = args.threads > 1
        ? Executors.newFixedThreadPool(Math.min(args.threads, tasks.size()))
        : MoreExecutors.newDirectExecutorService();
    try {
      List<Future<double[]>> futures = executor.invokeAll(tasks);
      double[][] errors = new double[futures.size()][];
      for (int k = 0; k < futures.size(); k++) {
        errors[k] = futures.get(k).get();
      }
      return errors;
    } catch (ExecutionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new RuntimeException("Fold task failed", e.getCause());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new RuntimeException("Interrupted during cross-validation", e);
    } finally {
      executor.shutdown();
    }
  }

  private PrecisionSelector precisionSelector() {
    PrecisionSelector.Args selectorArgs = new PrecisionSelector.Args();
    selectorArgs.criterion = args.criterion;
    selectorArgs.graphNorm = args.graphNorm;
    selectorArgs.standardize = false;
    return new PrecisionSelector(selectorArgs, graphEstimator, graphSolver);
  }

  private RandomGenerator newRandom() {
    RandomGenerator random = new JDKRandomGenerator();
    random.setSeed(args.seed);
    return random;
  }

  private void advance(Stage next) {
    Preconditions.checkState(next.ordinal() == stage.ordinal() + 1,
        "Cannot move from %s to %s", stage, next);
    stage = next;
  }

  // Raw data with the configured centers and unit scales.
  private Standardizer.Standardized unscaled(DenseMatrix64F x) {
    double[] scales = new double[x.numCols];
    Arrays.fill(scales, 1);
    double[] centers = new double[x.numCols];
    UnivariateStatistic center = Standardizer.centerStatistic(args.centerFunction);
    for (int j = 0; j < x.numCols; j++) {
      centers[j] = center.evaluate(MatrixHelper.column(x, j));
    }
    return Standardizer.Standardized.of(x, null, centers, scales);
  }

  private Standardizer.Standardized unscaled(double[] y) {
    double center = Standardizer.centerStatistic(args.centerFunction).evaluate(y);
    return Standardizer.Standardized.of(null, y, new double[] {center}, new double[] {1});
  }

  private static double[][] transpose(double[][] table) {
    double[][] result = new double[table[0].length][table.length];
    for (int i = 0; i < table.length; i++) {
      for (int j = 0; j < table[i].length; j++) {
        result[j][i] = table[i][j];
      }
    }
    return result;
  }
}
