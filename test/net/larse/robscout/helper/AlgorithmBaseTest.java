package net.larse.robscout.helper;

import org.junit.Test;

import static org.junit.Assert.*;

public class AlgorithmBaseTest {

  static class Args extends AlgorithmBase.ArgsBase {
    @Doc(help = "Number of iterations.")
    @Optional
    public int iterations = 25;

    @Doc(help = "Penalty path.")
    public double[] lambdas = {2, 1};

    public int undocumented = 7;
  }

  @Test
  public void testDescribeListsDocumentedFields() {
    String description = new Args().describe();
    assertTrue(description.startsWith("Args"));
    assertTrue(description.contains("iterations = 25\tNumber of iterations."));
    assertTrue(description.contains("lambdas = [2.0, 1.0] (required)"));
    assertFalse(description.contains("undocumented"));
  }
}
