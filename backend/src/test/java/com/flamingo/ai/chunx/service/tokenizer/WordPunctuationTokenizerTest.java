package com.flamingo.ai.chunx.service.tokenizer;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("WordPunctuationTokenizer Tests")
class WordPunctuationTokenizerTest {

  private final WordPunctuationTokenizer tokenizer = new WordPunctuationTokenizer();

  @Test
  @DisplayName("should emit words and punctuation as separate tokens")
  void shouldSeparateWordsAndPunctuation() {
    assertThat(tokenizer.encode("friend, how"))
        .containsExactly(new TokenSpan(0, 6), new TokenSpan(6, 7), new TokenSpan(8, 11));
    assertThat(tokenizer.countTokens("friend, how")).isEqualTo(3);
  }

  @Test
  @DisplayName("should report UTF-8 byte spans for non-ASCII words")
  void shouldReportByteSpans() {
    assertThat(tokenizer.encode("héllo wörld"))
        .containsExactly(new TokenSpan(0, 6), new TokenSpan(7, 13));
  }

  @Test
  @DisplayName("should produce no tokens for whitespace")
  void shouldIgnoreWhitespace() {
    assertThat(tokenizer.encode(" \t\n")).isEmpty();
    assertThat(tokenizer.countTokens("")).isZero();
  }
}
