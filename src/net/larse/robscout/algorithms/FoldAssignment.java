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

import it.unimi.dsi.fastutil.ints.IntArrayList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import net.larse.robscout.helper.InvalidInputException;
import org.apache.commons.lang3.ArrayUtils;
import org.apache.commons.math.random.RandomGenerator;

/**
 * A partition of the rows 0..n-1 into K disjoint, non-empty folds. Immutable once built.
 */
public final class FoldAssignment {
  private final int numRows;
  private final int[][] folds;

  private FoldAssignment(int numRows, int[][] folds) {
    this.numRows = numRows;
    this.folds = folds;
  }

  /**
   * Folds of near-equal size: labels 0..K-1 are dealt round-robin and then shuffled, so fold
   * sizes differ by at most one.
   */
  public static FoldAssignment random(int n, int k, RandomGenerator random) {
    checkCounts(n, k);
    int[] labels = new int[n];
    for (int i = 0; i < n; i++) {
      labels[i] = i % k;
    }
    // Fisher-Yates
    for (int i = n - 1; i > 0; i--) {
      int j = random.nextInt(i + 1);
      int tmp = labels[i];
      labels[i] = labels[j];
      labels[j] = tmp;
    }

    List<IntArrayList> members = new ArrayList<>();
    for (int f = 0; f < k; f++) {
      members.add(new IntArrayList());
    }
    for (int i = 0; i < n; i++) {
      members.get(labels[i]).add(i);
    }
    int[][] folds = new int[k][];
    for (int f = 0; f < k; f++) {
      folds[f] = members.get(f).toIntArray();
    }
    return new FoldAssignment(n, folds);
  }

  /**
   * Validates caller-supplied folds: exactly k non-empty parts which together cover each row of
   * 0..n-1 exactly once.
   */
  public static FoldAssignment of(List<int[]> parts, int n, int k) {
    checkCounts(n, k);
    if (parts.size() != k) {
      throw new InvalidInputException(String.format(
          "Expected %d folds, got %d", k, parts.size()));
    }
    boolean[] seen = new boolean[n];
    int[][] folds = new int[k][];
    for (int f = 0; f < k; f++) {
      int[] part = parts.get(f);
      if (ArrayUtils.isEmpty(part)) {
        throw new InvalidInputException("Fold " + f + " is empty");
      }
      for (int row : part) {
        if (row < 0 || row >= n) {
          throw new InvalidInputException(String.format(
              "Fold %d has row %d outside 0..%d", f, row, n - 1));
        }
        if (seen[row]) {
          throw new InvalidInputException("Row " + row + " appears in more than one fold");
        }
        seen[row] = true;
      }
      folds[f] = part.clone();
      Arrays.sort(folds[f]);
    }
    for (int row = 0; row < n; row++) {
      if (!seen[row]) {
        throw new InvalidInputException("Row " + row + " is not assigned to any fold");
      }
    }
    return new FoldAssignment(n, folds);
  }

  private static void checkCounts(int n, int k) {
    if (k < 2) {
      throw new InvalidInputException("Need at least 2 folds, got " + k);
    }
    if (k > n) {
      throw new InvalidInputException(String.format(
          "Cannot split %d rows into %d folds", n, k));
    }
  }

  public int numFolds() {
    return folds.length;
  }

  public int numRows() {
    return numRows;
  }

  /** Rows held out in fold k, ascending. */
  public int[] validationRows(int k) {
    return folds[k].clone();
  }

  /** All rows outside fold k, ascending. */
  public int[] trainingRows(int k) {
    boolean[] held = new boolean[numRows];
    for (int row : folds[k]) {
      held[row] = true;
    }
    IntArrayList rows = new IntArrayList(numRows - folds[k].length);
    for (int row = 0; row < numRows; row++) {
      if (!held[row]) {
        rows.add(row);
      }
    }
    return rows.toIntArray();
  }
}
