package com.flamingo.ai.chunx.service.chunking;

import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.List;

/**
 * Locates sentences in their source text.
 *
 * <p>A single cursor is carried from one sentence to the next and each search only looks past the
 * end of the previous match, so a sentence whose text repeats elsewhere in the source resolves to
 * the occurrence at its own position.
 */
public final class SpanResolver {

  /**
   * A sentence with its UTF-8 byte span.
   *
   * @param text sentence text
   * @param startByte inclusive start
   * @param endByte exclusive end
   */
  public record SentenceSpan(String text, int startByte, int endByte) {}

  private SpanResolver() {}

  /**
   * Resolves the span of every sentence, in order.
   *
   * <p>A sentence that cannot be found after the cursor is placed at the cursor.
   */
  public static List<SentenceSpan> resolve(String source, List<String> sentences) {
    List<SentenceSpan> spans = new ArrayList<>(sentences.size());
    int charCursor = 0;
    int byteCursor = 0;
    for (String sentence : sentences) {
      int length = Utf8.encodedLength(sentence);
      int found = source.indexOf(sentence, charCursor);
      if (found >= 0) {
        int start = byteCursor + Utf8.encodedLength(source.subSequence(charCursor, found));
        spans.add(new SentenceSpan(sentence, start, start + length));
        charCursor = found + sentence.length();
        byteCursor = start + length;
      } else {
        spans.add(new SentenceSpan(sentence, byteCursor, byteCursor + length));
        charCursor = Math.min(source.length(), charCursor + sentence.length());
        byteCursor += length;
      }
    }
    return spans;
  }
}
