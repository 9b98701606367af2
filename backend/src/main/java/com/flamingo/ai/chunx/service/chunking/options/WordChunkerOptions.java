package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;

/**
 * Options for word-boundary windows.
 *
 * @param chunkSize token budget per chunk, positive
 * @param chunkOverlap token budget for the trailing words repeated at the start of the next chunk
 */
public record WordChunkerOptions(int chunkSize, ChunkOverlap chunkOverlap) {

  public WordChunkerOptions {
    TokenChunkerOptions.requirePositiveChunkSize(chunkSize);
    if (chunkOverlap == null) {
      throw new ChunkingConfigurationException("chunkOverlap", "must not be null");
    }
    chunkOverlap.resolve(chunkSize);
  }

  public static WordChunkerOptions defaults() {
    return new WordChunkerOptions(
        TokenChunkerOptions.DEFAULT_CHUNK_SIZE,
        ChunkOverlap.fraction(TokenChunkerOptions.DEFAULT_OVERLAP_FRACTION));
  }

  public int overlapTokens() {
    return chunkOverlap.resolve(chunkSize);
  }
}
