package net.larse.robscout;

import org.apache.commons.math.random.JDKRandomGenerator;
import org.apache.commons.math.random.RandomGenerator;
import org.ejml.data.DenseMatrix64F;

/**
 * Gaussian AR(1) predictors, sparse linear responses and cellwise contamination for tests.
 */
public class SimulatedData {
  public static RandomGenerator random(long seed) {
    RandomGenerator random = new JDKRandomGenerator();
    random.setSeed(seed);
    return random;
  }

  /** Rows with corr(x_j, x_k) = rho^|j - k| and unit variances. */
  public static DenseMatrix64F ar1(int n, int p, double rho, RandomGenerator random) {
    DenseMatrix64F x = new DenseMatrix64F(n, p);
    double innovation = Math.sqrt(1 - rho * rho);
    for (int i = 0; i < n; i++) {
      double prev = random.nextGaussian();
      x.unsafe_set(i, 0, prev);
      for (int j = 1; j < p; j++) {
        prev = rho * prev + innovation * random.nextGaussian();
        x.unsafe_set(i, j, prev);
      }
    }
    return x;
  }

  public static DenseMatrix64F ar1Covariance(int p, double rho) {
    DenseMatrix64F sigma = new DenseMatrix64F(p, p);
    for (int j = 0; j < p; j++) {
      for (int k = 0; k < p; k++) {
        sigma.unsafe_set(j, k, Math.pow(rho, Math.abs(j - k)));
      }
    }
    return sigma;
  }

  /** Ones at the given indices, zero elsewhere. */
  public static double[] sparseBeta(int p, int... nonZero) {
    double[] beta = new double[p];
    for (int j : nonZero) {
      beta[j] = 1;
    }
    return beta;
  }

  /** x * beta plus Gaussian noise with standard deviation sigma. */
  public static double[] response(DenseMatrix64F x, double[] beta, double sigma,
      RandomGenerator random) {
    double[] y = new double[x.numRows];
    for (int i = 0; i < x.numRows; i++) {
      double sum = 0;
      for (int j = 0; j < x.numCols; j++) {
        sum += x.unsafe_get(i, j) * beta[j];
      }
      y[i] = sum + sigma * random.nextGaussian();
    }
    return y;
  }

  /** Copy of x with a fraction of its cells replaced by +value or -value at random. */
  public static DenseMatrix64F contaminate(DenseMatrix64F x, double fraction, double value,
      RandomGenerator random) {
    DenseMatrix64F result = x.copy();
    for (int i = 0; i < x.getNumElements(); i++) {
      if (random.nextDouble() < fraction) {
        result.data[i] = random.nextBoolean() ? value : -value;
      }
    }
    return result;
  }

  public static double rmse(double[] predicted, double[] actual) {
    double sum = 0;
    for (int i = 0; i < actual.length; i++) {
      double r = predicted[i] - actual[i];
      sum += r * r;
    }
    return Math.sqrt(sum / actual.length);
  }
}
