package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;

/**
 * Similarity cutoff for semantic grouping: either a fixed value in {@code [0, 1]} or "auto",
 * which searches for a value that fits the chunk size constraints.
 */
public record SimilarityThreshold(Double value) {

  private static final SimilarityThreshold AUTO = new SimilarityThreshold(null);

  public SimilarityThreshold {
    if (value != null && (value.isNaN() || value < 0.0 || value > 1.0)) {
      throw new ChunkingConfigurationException(
          "threshold", "must be \"auto\" or a number in [0, 1], got " + value);
    }
  }

  public static SimilarityThreshold auto() {
    return AUTO;
  }

  public static SimilarityThreshold fixed(double value) {
    return new SimilarityThreshold(value);
  }

  public boolean isAuto() {
    return value == null;
  }

  @Override
  public String toString() {
    return isAuto() ? "auto" : String.valueOf(value);
  }
}
