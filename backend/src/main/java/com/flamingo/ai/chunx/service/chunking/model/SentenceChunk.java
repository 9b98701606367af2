package com.flamingo.ai.chunx.service.chunking.model;

import java.util.List;

/**
 * A chunk assembled from consecutive sentence-level {@link Chunk}s.
 *
 * <p>The sentences are contiguous: their texts concatenate to {@code text}, their token counts sum
 * to {@code tokenCount}, and the first/last sentence delimit the span.
 *
 * @param text concatenated sentence text
 * @param startByte start of the first sentence
 * @param endByte end of the last sentence
 * @param tokenCount sum of the sentence token counts
 * @param sentences ordered, non-empty sentence chunks
 */
public record SentenceChunk(
    String text, int startByte, int endByte, int tokenCount, List<Chunk> sentences)
    implements TextSpan {

  public SentenceChunk {
    if (sentences == null || sentences.isEmpty()) {
      throw new IllegalArgumentException("A sentence chunk needs at least one sentence");
    }
    sentences = List.copyOf(sentences);
    Chunk first = sentences.get(0);
    Chunk last = sentences.get(sentences.size() - 1);
    if (first.startByte() != startByte || last.endByte() != endByte) {
      throw new IllegalArgumentException(
          "Span ["
              + startByte
              + ", "
              + endByte
              + ") does not match sentences ["
              + first.startByte()
              + ", "
              + last.endByte()
              + ")");
    }
    StringBuilder joined = new StringBuilder();
    int tokens = 0;
    int expectedStart = startByte;
    for (Chunk sentence : sentences) {
      if (sentence.startByte() != expectedStart) {
        throw new IllegalArgumentException(
            "Sentences are not contiguous at byte " + sentence.startByte());
      }
      expectedStart = sentence.endByte();
      joined.append(sentence.text());
      tokens += sentence.tokenCount();
    }
    if (!joined.toString().equals(text)) {
      throw new IllegalArgumentException("text must equal the concatenated sentence texts");
    }
    if (tokens != tokenCount) {
      throw new IllegalArgumentException(
          "tokenCount " + tokenCount + " does not equal the sentence total " + tokens);
    }
  }

  /** Builds a sentence chunk spanning the given consecutive sentences. */
  public static SentenceChunk of(List<Chunk> sentences) {
    if (sentences == null || sentences.isEmpty()) {
      throw new IllegalArgumentException("A sentence chunk needs at least one sentence");
    }
    StringBuilder text = new StringBuilder();
    int tokens = 0;
    for (Chunk sentence : sentences) {
      text.append(sentence.text());
      tokens += sentence.tokenCount();
    }
    return new SentenceChunk(
        text.toString(),
        sentences.get(0).startByte(),
        sentences.get(sentences.size() - 1).endByte(),
        tokens,
        sentences);
  }
}
