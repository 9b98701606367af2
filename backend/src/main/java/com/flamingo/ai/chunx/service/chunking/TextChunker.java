package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.service.chunking.model.TextSpan;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import java.util.List;

/**
 * Splits text into chunks under one {@link ChunkingStrategy}.
 *
 * <p>Implementations are stateless and safe for concurrent use: every call works only on its own
 * text, tokenizer and options. Options are validated when they are constructed, so a call never
 * starts with an invalid configuration.
 *
 * @param <O> options type of the strategy
 * @param <C> chunk type produced
 */
public interface TextChunker<O, C extends TextSpan> {

  /**
   * Chunks {@code text}.
   *
   * @param text source text; blank text yields an empty list
   * @param tokenizer tokenizer used for every token count
   * @param options validated strategy options
   * @return chunks in source order
   */
  List<C> chunk(String text, Tokenizer tokenizer, O options);

  ChunkingStrategy strategy();
}
