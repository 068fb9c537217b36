package net.larse.robscout.algorithms;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import net.larse.robscout.SimulatedData;
import net.larse.robscout.helper.ArrayHelper;
import net.larse.robscout.helper.InvalidInputException;
import net.larse.robscout.helper.MatrixHelper;
import net.larse.robscout.helper.UnsupportedOptionException;
import net.larse.robscout.solver.Solvers;
import org.apache.commons.math.random.RandomGenerator;
import org.ejml.data.DenseMatrix64F;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

/**
 * AR(1) predictors with rho = 0.5, n = 50, p = 40, five unit coefficients and a signal to noise
 * ratio of 1, scored on 1000 clean test rows.
 */
public class StepwiseFitterTest {
  static final int N = 50;
  static final int P = 40;
  static final double RHO = 0.5;

  DenseMatrix64F x;
  double[] y;
  DenseMatrix64F xTest;
  double[] yTest;
  double sigma;

  @Before
  public void setUp() throws Exception {
    double[] beta = SimulatedData.sparseBeta(P, 0, 8, 16, 24, 32);
    sigma = Math.sqrt(MatrixHelper.quadraticForm(SimulatedData.ar1Covariance(P, RHO), beta));

    RandomGenerator random = SimulatedData.random(2024);
    x = SimulatedData.ar1(N, P, RHO, random);
    y = SimulatedData.response(x, beta, sigma, random);
    xTest = SimulatedData.ar1(1000, P, RHO, random);
    yTest = SimulatedData.response(xTest, beta, sigma, random);
  }

  private double normalizedRmspe(FittedModel model) {
    return SimulatedData.rmse(Predictor.predict(model, xTest, true), yTest) / sigma;
  }

  @Test
  public void testEndToEndOnCleanData() {
    StepwiseFitter fitter = new StepwiseFitter(new StepwiseFitter.Args());
    assertEquals(StepwiseFitter.Stage.INIT, fitter.stage());
    FittedModel model = fitter.fit(x, y);
    assertEquals(StepwiseFitter.Stage.DONE, fitter.stage());

    assertEquals(P, model.numFeatures());
    assertEquals(10, model.coefficientLambdas().length);
    assertTrue(ArrayHelper.isStrictlyDecreasing(model.coefficientLambdas()));
    assertEquals(5, model.cvErrors().length);
    assertEquals(10, model.cvErrors()[0].length);
    assertEquals(model.coefficientLambdas()[ArrayHelper.argMin(model.meanCvErrors())],
        model.coefficientPenalty(), 0);
    assertTrue(Arrays.stream(model.graphLambdas())
        .anyMatch(l -> l == model.graphPenalty()));

    double error = normalizedRmspe(model);
    assertTrue("normalized RMSPE " + error, error > 0.9);

    // predicting the training mean everywhere
    double[] mean = new double[yTest.length];
    Arrays.fill(mean, Arrays.stream(y).average().getAsDouble());
    double nullError = SimulatedData.rmse(mean, yTest) / sigma;
    assertTrue(String.format("%f vs null model %f", error, nullError), error < 0.97 * nullError);

    // plain lasso on the sample covariance, no graph penalty and no rescaling
    StepwiseFitter.Args lasso = new StepwiseFitter.Args();
    lasso.graphNorm = Solvers.NO_PENALTY;
    lasso.rescale = false;
    double lassoError = normalizedRmspe(new StepwiseFitter(lasso).fit(x, y));
    assertTrue(String.format("%f vs lasso %f", error, lassoError), error < 1.15 * lassoError);
  }

  @Test
  public void testCellwiseRobustFitBeatsDefaultOnContaminatedData() {
    DenseMatrix64F dirty = SimulatedData.contaminate(x, 0.1, 10, SimulatedData.random(99));

    FittedModel plain = new StepwiseFitter(new StepwiseFitter.Args()).fit(dirty, y);

    StepwiseFitter.Args robust = new StepwiseFitter.Args();
    robust.graphMethod = "ddc";
    robust.coefficientMethod = "ddc";
    robust.centerFunction = "median";
    robust.scaleFunction = "mad";
    FittedModel cellwise = new StepwiseFitter(robust).fit(dirty, y);

    double plainError = normalizedRmspe(plain);
    double cellwiseError = normalizedRmspe(cellwise);
    assertTrue(String.format("ddc %f vs default %f", cellwiseError, plainError),
        cellwiseError < plainError);
  }

  @Test
  public void testThreadCountDoesNotChangeTheModel() {
    StepwiseFitter.Args single = new StepwiseFitter.Args();
    single.nlambda1 = 4;
    single.nlambda2 = 5;
    StepwiseFitter.Args pooled = new StepwiseFitter.Args();
    pooled.nlambda1 = 4;
    pooled.nlambda2 = 5;
    pooled.threads = 3;

    FittedModel a = new StepwiseFitter(single).fit(x, y);
    FittedModel b = new StepwiseFitter(pooled).fit(x, y);
    assertArrayEquals(a.meanCvErrors(), b.meanCvErrors(), 0);
    assertArrayEquals(a.coefficients(), b.coefficients(), 0);
    assertEquals(a.intercept(), b.intercept(), 0);
  }

  @Test
  public void testSuppliedFoldsAndCrossValidatedGraph() {
    List<int[]> folds = Arrays.asList(range(0, 25), range(25, 50));
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.numFolds = 2;
    args.graphSelection = "cv";
    args.graphNorm = Solvers.RIDGE;
    args.coefficientNorm = Solvers.RIDGE;
    args.nlambda1 = 4;
    args.nlambda2 = 4;
    FittedModel model = new StepwiseFitter(args).fit(x, y, Optional.of(folds));
    assertEquals(2, model.cvErrors().length);
    assertTrue(model.graphPenalty() > 0);
    assertFalse(Double.isNaN(model.intercept()));
  }

  @Test
  public void testPredictionIsIdempotent() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.nlambda1 = 3;
    args.nlambda2 = 3;
    FittedModel model = new StepwiseFitter(args).fit(x, y);
    assertArrayEquals(Predictor.predict(model, xTest, true),
        Predictor.predict(model, xTest, true), 0);
  }

  @Test(expected = IllegalStateException.class)
  public void testFitterRunsOnce() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.nlambda1 = 2;
    args.nlambda2 = 2;
    StepwiseFitter fitter = new StepwiseFitter(args);
    fitter.fit(x, y);
    fitter.fit(x, y);
  }

  @Test
  public void testInvalidFoldsFailBeforeAnyWork() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    StepwiseFitter fitter = new StepwiseFitter(args);
    try {
      fitter.fit(x, y, Optional.of(Collections.singletonList(range(0, 50))));
      fail("expected InvalidInputException");
    } catch (InvalidInputException e) {
      assertEquals(StepwiseFitter.Stage.INIT, fitter.stage());
    }
  }

  @Test
  public void testGraphCrossValidationRejectsSingleRowFoldsUpFront() {
    // 50 rows in 26 folds leaves two folds with a single row
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.numFolds = 26;
    args.graphSelection = "cv";
    StepwiseFitter fitter = new StepwiseFitter(args);
    try {
      fitter.fit(x, y);
      fail("expected InvalidInputException");
    } catch (InvalidInputException e) {
      assertEquals(StepwiseFitter.Stage.INIT, fitter.stage());
    }
  }

  @Test(expected = InvalidInputException.class)
  public void testTooManyFolds() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.numFolds = 51;
    new StepwiseFitter(args).fit(x, y);
  }

  @Test(expected = InvalidInputException.class)
  public void testResponseLengthMustMatch() {
    new StepwiseFitter(new StepwiseFitter.Args()).fit(x, new double[N - 1]);
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownGraphSelection() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.graphSelection = "holdout";
    new StepwiseFitter(args);
  }

  @Test(expected = UnsupportedOptionException.class)
  public void testUnknownNorm() {
    StepwiseFitter.Args args = new StepwiseFitter.Args();
    args.coefficientNorm = 3;
    new StepwiseFitter(args);
  }

  @Test
  public void testDescribeListsArguments() {
    String description = new StepwiseFitter.Args().describe();
    assertTrue(description.contains("numFolds = 5"));
    assertTrue(description.contains("graphMethod = default"));
  }

  private static int[] range(int from, int to) {
    int[] rows = new int[to - from];
    for (int i = 0; i < rows.length; i++) {
      rows[i] = from + i;
    }
    return rows;
  }
}
