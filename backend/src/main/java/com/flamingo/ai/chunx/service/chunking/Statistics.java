package com.flamingo.ai.chunx.service.chunking;

import java.util.Arrays;
import java.util.List;

/** Numeric helpers for semantic grouping. */
public final class Statistics {

  private Statistics() {}

  /**
   * Median of {@code values}; the mean of the two middle values for an even count.
   *
   * @throws IllegalArgumentException if {@code values} is empty
   */
  public static double median(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("median of an empty sequence");
    }
    double[] sorted = values.clone();
    Arrays.sort(sorted);
    int mid = sorted.length / 2;
    if (sorted.length % 2 == 0) {
      return (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
    return sorted[mid];
  }

  /**
   * Population standard deviation of {@code values}.
   *
   * @throws IllegalArgumentException if {@code values} is empty
   */
  public static double standardDeviation(double[] values) {
    if (values.length == 0) {
      throw new IllegalArgumentException("standard deviation of an empty sequence");
    }
    double mean = 0.0;
    for (double v : values) {
      mean += v;
    }
    mean /= values.length;
    double variance = 0.0;
    for (double v : values) {
      variance += (v - mean) * (v - mean);
    }
    return Math.sqrt(variance / values.length);
  }

  /**
   * Cosine similarity, {@code 1 - cosine distance}. A zero vector has similarity 0 to anything.
   *
   * @throws IllegalArgumentException if the vectors differ in length
   */
  public static double cosineSimilarity(List<Float> a, List<Float> b) {
    if (a.size() != b.size()) {
      throw new IllegalArgumentException(
          "Vectors differ in dimension: " + a.size() + " vs " + b.size());
    }
    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (int i = 0; i < a.size(); i++) {
      double x = a.get(i);
      double y = b.get(i);
      dot += x * y;
      normA += x * x;
      normB += y * y;
    }
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    return dot / (Math.sqrt(normA) * Math.sqrt(normB));
  }
}
