package com.flamingo.ai.chunx.service.tokenizer;

import java.util.List;

/**
 * Tokenizer capability consumed by the chunkers.
 *
 * <p>Implementations must be deterministic for identical input. Failures surface as unchecked
 * exceptions and are propagated to the caller untouched.
 */
public interface Tokenizer {

  /**
   * Encodes {@code text} and reports the byte span of every token, in order.
   *
   * @param text the text to encode
   * @return one span per token; spans may have zero width
   */
  List<TokenSpan> encode(String text);

  /**
   * Counts the tokens assigned to {@code text} in isolation.
   *
   * @param text the text to count
   * @return number of tokens, zero-width tokens included
   */
  default int countTokens(String text) {
    return encode(text).size();
  }
}
