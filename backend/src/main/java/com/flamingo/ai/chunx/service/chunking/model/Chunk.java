package com.flamingo.ai.chunx.service.chunking.model;

import com.google.common.base.Utf8;
import java.util.List;

/**
 * An addressable piece of source text.
 *
 * <p>{@code startByte} and {@code endByte} delimit the half-open range {@code [startByte,
 * endByte)} of the UTF-8 encoded source that {@code text} was cut from, so the byte length of
 * {@code text} always equals {@code endByte - startByte}.
 *
 * @param text exact substring of the source
 * @param startByte inclusive UTF-8 byte offset into the source
 * @param endByte exclusive UTF-8 byte offset into the source
 * @param tokenCount tokens the tokenizer assigns to {@code text} in isolation
 * @param embedding embedding vector of the sentence's context window; {@code null} unless produced
 *     by semantic sentence preparation
 */
public record Chunk(
    String text, int startByte, int endByte, int tokenCount, List<Float> embedding)
    implements TextSpan {

  public Chunk {
    if (text == null) {
      throw new IllegalArgumentException("text must not be null");
    }
    if (startByte < 0 || endByte < startByte) {
      throw new IllegalArgumentException(
          "Invalid byte span [" + startByte + ", " + endByte + ")");
    }
    if (Utf8.encodedLength(text) != endByte - startByte) {
      throw new IllegalArgumentException(
          "Byte span ["
              + startByte
              + ", "
              + endByte
              + ") does not match text of "
              + Utf8.encodedLength(text)
              + " bytes");
    }
    if (tokenCount < 0) {
      throw new IllegalArgumentException("tokenCount must not be negative: " + tokenCount);
    }
    embedding = embedding == null ? null : List.copyOf(embedding);
  }

  public Chunk(String text, int startByte, int endByte, int tokenCount) {
    this(text, startByte, endByte, tokenCount, null);
  }
}
