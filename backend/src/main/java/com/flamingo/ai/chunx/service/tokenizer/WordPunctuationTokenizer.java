package com.flamingo.ai.chunx.service.tokenizer;

import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Tokenizer that emits one token per run of word characters and one per punctuation character.
 * Whitespace produces no tokens, so {@code "friend, how"} is three tokens.
 */
public class WordPunctuationTokenizer implements Tokenizer {

  private static final Pattern TOKEN =
      Pattern.compile("\\w+|[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

  @Override
  public List<TokenSpan> encode(String text) {
    List<TokenSpan> spans = new ArrayList<>();
    Matcher matcher = TOKEN.matcher(text);
    int charCursor = 0;
    int byteCursor = 0;
    while (matcher.find()) {
      byteCursor += Utf8.encodedLength(text.subSequence(charCursor, matcher.start()));
      int length = Utf8.encodedLength(matcher.group());
      spans.add(new TokenSpan(byteCursor, byteCursor + length));
      byteCursor += length;
      charCursor = matcher.end();
    }
    return spans;
  }

  @Override
  public int countTokens(String text) {
    Matcher matcher = TOKEN.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }
}
