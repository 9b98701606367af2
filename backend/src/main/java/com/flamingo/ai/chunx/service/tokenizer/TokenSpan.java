package com.flamingo.ai.chunx.service.tokenizer;

/**
 * Half-open UTF-8 byte span of one token within the encoded text.
 *
 * @param startByte inclusive start
 * @param endByte exclusive end
 */
public record TokenSpan(int startByte, int endByte) {

  /** Zero-width spans belong to structural tokens that cover no text. */
  public boolean isEmpty() {
    return startByte == endByte;
  }
}
