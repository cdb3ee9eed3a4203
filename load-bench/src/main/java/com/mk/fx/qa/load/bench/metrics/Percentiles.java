package com.mk.fx.qa.load.bench.metrics;

/** Nearest-rank percentiles over samples that are already sorted ascending. */
public final class Percentiles {

  private Percentiles() {
    // Utility class, no instantiation
  }

  /**
   * Returns the sample at rank {@code ceil(size * p / 100)}, as a zero-based index clamped to
   * {@code [0, size - 1]}, or {@code 0} when there are no samples.
   *
   * @param sortedAscending samples sorted ascending
   * @param percentile value between 0 and 100
   */
  public static double nearestRank(double[] sortedAscending, int percentile) {
    if (percentile < 0 || percentile > 100) {
      throw new IllegalArgumentException("Percentile must be between 0 and 100");
    }
    int size = sortedAscending.length;
    if (size == 0) {
      return 0.0;
    }
    int index = (int) Math.ceil(size * percentile / 100.0) - 1;
    return sortedAscending[Math.min(size - 1, Math.max(0, index))];
  }
}
