package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.api.dto.request.ChunkRequest;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import java.util.List;

/** Service interface for chunking text with the configured tokenizer and embedding backend. */
public interface ChunkingService {

  /**
   * Splits text into fixed token windows.
   *
   * @param request text and option overrides
   * @return chunks in source order
   * @throws com.flamingo.ai.chunx.exception.ChunkingConfigurationException if options are invalid
   */
  List<Chunk> tokenChunk(ChunkRequest request);

  /**
   * Splits text into word-boundary windows.
   *
   * @param request text and option overrides
   * @return chunks in source order
   */
  List<Chunk> wordChunk(ChunkRequest request);

  /**
   * Splits text into sentence-boundary windows.
   *
   * @param request text and option overrides
   * @return sentence chunks in source order
   */
  List<SentenceChunk> sentenceChunk(ChunkRequest request);

  /**
   * Groups sentences by embedding similarity.
   *
   * @param request text and option overrides
   * @return sentence chunks in source order
   */
  List<SentenceChunk> semanticChunk(ChunkRequest request);
}
