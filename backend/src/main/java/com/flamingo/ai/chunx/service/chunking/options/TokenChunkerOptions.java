package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;

/**
 * Options for fixed token windows.
 *
 * @param chunkSize tokens per window, positive
 * @param chunkOverlap overlap between windows; resolved to {@link #overlapTokens()}
 */
public record TokenChunkerOptions(int chunkSize, ChunkOverlap chunkOverlap) {

  public static final int DEFAULT_CHUNK_SIZE = 512;
  public static final double DEFAULT_OVERLAP_FRACTION = 0.25;

  public TokenChunkerOptions {
    requirePositiveChunkSize(chunkSize);
    if (chunkOverlap == null) {
      throw new ChunkingConfigurationException("chunkOverlap", "must not be null");
    }
    chunkOverlap.resolve(chunkSize);
  }

  public static TokenChunkerOptions defaults() {
    return new TokenChunkerOptions(
        DEFAULT_CHUNK_SIZE, ChunkOverlap.fraction(DEFAULT_OVERLAP_FRACTION));
  }

  /** Overlap in tokens for this chunk size. */
  public int overlapTokens() {
    return chunkOverlap.resolve(chunkSize);
  }

  static void requirePositiveChunkSize(int chunkSize) {
    if (chunkSize <= 0) {
      throw new ChunkingConfigurationException(
          "chunkSize", "must be positive, got " + chunkSize);
    }
  }
}
