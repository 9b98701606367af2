package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;
import java.util.List;

/**
 * Options for semantic grouping.
 *
 * @param chunkSize token budget per chunk
 * @param threshold fixed similarity cutoff or auto
 * @param minSentences minimum sentences per group; smaller groups are dropped
 * @param minChunkSize minimum group size in tokens targeted by the auto threshold search
 * @param thresholdStep resolution of the auto threshold search, in {@code (0, 1)}
 * @param delimiters sentence delimiters
 * @param minCharsPerSentence fragments whose trimmed length is below this are merged; 0 disables
 * @param similarityWindow neighbouring sentences on each side joined into the embedded context
 */
public record SemanticChunkerOptions(
    int chunkSize,
    SimilarityThreshold threshold,
    int minSentences,
    int minChunkSize,
    double thresholdStep,
    List<String> delimiters,
    int minCharsPerSentence,
    int similarityWindow) {

  public SemanticChunkerOptions {
    TokenChunkerOptions.requirePositiveChunkSize(chunkSize);
    if (threshold == null) {
      throw new ChunkingConfigurationException("threshold", "must not be null");
    }
    if (minSentences <= 0) {
      throw new ChunkingConfigurationException(
          "minSentences", "must be positive, got " + minSentences);
    }
    if (minChunkSize <= 0) {
      throw new ChunkingConfigurationException(
          "minChunkSize", "must be positive, got " + minChunkSize);
    }
    if (Double.isNaN(thresholdStep) || thresholdStep <= 0.0 || thresholdStep >= 1.0) {
      throw new ChunkingConfigurationException(
          "thresholdStep", "must be in (0, 1), got " + thresholdStep);
    }
    delimiters = SentenceChunkerOptions.requireDelimiters(delimiters);
    if (minCharsPerSentence < 0) {
      throw new ChunkingConfigurationException(
          "minCharsPerSentence", "must not be negative, got " + minCharsPerSentence);
    }
    if (similarityWindow < 0) {
      throw new ChunkingConfigurationException(
          "similarityWindow", "must not be negative, got " + similarityWindow);
    }
  }

  /** Defaults: 512 tokens, auto threshold, 1 sentence, 2 tokens, step 0.01, window 1. */
  public static SemanticChunkerOptions defaults() {
    return new SemanticChunkerOptions(
        512,
        SimilarityThreshold.auto(),
        1,
        2,
        0.01,
        SentenceChunkerOptions.DEFAULT_DELIMITERS,
        0,
        1);
  }
}
