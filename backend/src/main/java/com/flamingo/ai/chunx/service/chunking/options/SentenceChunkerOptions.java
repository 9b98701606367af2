package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;
import java.util.List;

/**
 * Options for sentence-boundary windows.
 *
 * @param chunkSize token budget per chunk
 * @param chunkOverlap token budget of trailing sentences carried into the next chunk, below
 *     {@code chunkSize}
 * @param minSentencesPerChunk sentences every chunk holds even past the budget, at least 1
 * @param delimiters non-empty list of non-empty sentence delimiters
 * @param shortSentenceThreshold fragments shorter than this many UTF-8 bytes are glued to the
 *     previous fragment, at least 1
 */
public record SentenceChunkerOptions(
    int chunkSize,
    int chunkOverlap,
    int minSentencesPerChunk,
    List<String> delimiters,
    int shortSentenceThreshold) {

  public static final List<String> DEFAULT_DELIMITERS = List.of(".", "!", "?", "\n");

  public SentenceChunkerOptions {
    TokenChunkerOptions.requirePositiveChunkSize(chunkSize);
    if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
      throw new ChunkingConfigurationException(
          "chunkOverlap",
          "must be non-negative and less than chunkSize (" + chunkSize + "), got " + chunkOverlap);
    }
    if (minSentencesPerChunk < 1) {
      throw new ChunkingConfigurationException(
          "minSentencesPerChunk", "must be at least 1, got " + minSentencesPerChunk);
    }
    delimiters = requireDelimiters(delimiters);
    if (shortSentenceThreshold < 1) {
      throw new ChunkingConfigurationException(
          "shortSentenceThreshold", "must be at least 1, got " + shortSentenceThreshold);
    }
  }

  public static SentenceChunkerOptions defaults() {
    return new SentenceChunkerOptions(512, 128, 1, DEFAULT_DELIMITERS, 6);
  }

  static List<String> requireDelimiters(List<String> delimiters) {
    if (delimiters == null || delimiters.isEmpty()) {
      throw new ChunkingConfigurationException(
          "delimiters", "must contain at least one delimiter");
    }
    for (String delimiter : delimiters) {
      if (delimiter == null || delimiter.isEmpty()) {
        throw new ChunkingConfigurationException("delimiters", "must not contain empty values");
      }
    }
    return List.copyOf(delimiters);
  }
}
