package net.larse.robscout.helper;

/** Static array manipulation functions. */
public class ArrayHelper {
  /**
   * Index of the smallest value in array, or -1 if the array is empty. Ties resolve to the first
   * occurrence, so on a decreasing penalty path the largest penalty wins. NaN entries are skipped
   * unless every entry is NaN, in which case the first index is returned.
   */
  public static int argMin(double[] array) {
    int index = -1;
    double min = Double.NaN;
    for (int i = 0; i < array.length; i++) {
      double v = array[i];
      if (Double.isNaN(v)) {
        continue;
      }
      if (index == -1 || v < min) {
        index = i;
        min = v;
      }
    }
    return index == -1 && array.length > 0 ? 0 : index;
  }

  /**
   * Mean of each row of a [rows][cols] table. Used to reduce per-fold errors, stored as
   * [penalty][fold], to one error per penalty.
   */
  public static double[] rowMeans(double[][] table) {
    double[] means = new double[table.length];
    for (int i = 0; i < table.length; i++) {
      double sum = 0;
      for (int j = 0; j < table[i].length; j++) {
        sum += table[i][j];
      }
      means[i] = table[i].length == 0 ? Double.NaN : sum / table[i].length;
    }
    return means;
  }

  /** True if every entry is strictly smaller than the one before it. */
  public static boolean isStrictlyDecreasing(double[] array) {
    for (int i = 1; i < array.length; i++) {
      if (!(array[i] < array[i - 1])) {
        return false;
      }
    }
    return true;
  }

  /** Largest absolute value in array, 0 for an empty array. */
  public static double maxAbs(double[] array) {
    double max = 0;
    for (double v : array) {
      max = Math.max(max, Math.abs(v));
    }
    return max;
  }

  /** Soft-thresholding operator sign(v) * max(|v| - t, 0). */
  public static double softThreshold(double v, double t) {
    if (v > t) {
      return v - t;
    }
    if (v < -t) {
      return v + t;
    }
    return 0;
  }

  /** Number of entries with absolute value above tolerance. */
  public static int countNonZero(double[] array, double tolerance) {
    int count = 0;
    for (double v : array) {
      if (Math.abs(v) > tolerance) {
        count++;
      }
    }
    return count;
  }
}
