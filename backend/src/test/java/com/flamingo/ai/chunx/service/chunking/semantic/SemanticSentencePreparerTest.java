package com.flamingo.ai.chunx.service.chunking.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chunx.service.chunking.SentenceSplitter;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SentenceChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SimilarityThreshold;
import com.flamingo.ai.chunx.service.embedding.EmbeddingFunction;
import com.flamingo.ai.chunx.service.tokenizer.WordPunctuationTokenizer;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("SemanticSentencePreparer Tests")
class SemanticSentencePreparerTest {

  @Mock private EmbeddingFunction embeddingFunction;

  private SemanticSentencePreparer preparer;

  @BeforeEach
  void setUp() {
    preparer = new SemanticSentencePreparer(new SentenceSplitter());
  }

  private static SemanticChunkerOptions options(int minChars, int window) {
    return new SemanticChunkerOptions(
        512,
        SimilarityThreshold.auto(),
        1,
        2,
        0.01,
        SentenceChunkerOptions.DEFAULT_DELIMITERS,
        minChars,
        window);
  }

  @Test
  @DisplayName("should embed each sentence with its neighbours")
  void shouldEmbedContextWindows() {
    String text = "A one. B two. C three.";
    List<String> windows = List.of("A one. B two.", "A one. B two. C three.", " B two. C three.");
    when(embeddingFunction.embed(windows))
        .thenReturn(List.of(List.of(1f, 0f), List.of(1f, 1f), List.of(0f, 1f)));

    List<Chunk> sentences =
        preparer.prepare(text, new WordPunctuationTokenizer(), embeddingFunction, options(0, 1));

    verify(embeddingFunction).embed(windows);
    assertThat(sentences).extracting(Chunk::text).containsExactly("A one.", " B two.", " C three.");
    assertThat(sentences).extracting(Chunk::tokenCount).containsExactly(3, 3, 3);
    assertThat(sentences.get(1).embedding()).containsExactly(1f, 1f);
    assertThat(sentences.get(2).startByte()).isEqualTo(13);
  }

  @Test
  @DisplayName("should build windows clipped at the text edges")
  void shouldBuildContextWindows() {
    List<String> sentences = List.of("a", "b", "c", "d");

    assertThat(SemanticSentencePreparer.buildContextWindows(sentences, 1))
        .containsExactly("ab", "abc", "bcd", "cd");
    assertThat(SemanticSentencePreparer.buildContextWindows(sentences, 2))
        .containsExactly("abc", "abcd", "abcd", "bcd");
    assertThat(SemanticSentencePreparer.buildContextWindows(sentences, 0))
        .containsExactly("a", "b", "c", "d");
  }

  @Test
  @DisplayName("should merge fragments with too few characters")
  void shouldMergeShortFragments() {
    List<String> sentences =
        preparer.splitSentences("Hi. Ok. This is a longer one.", options(12, 1));

    assertThat(sentences).containsExactly("Hi. Ok.", " This is a longer one.");
  }

  @Test
  @DisplayName("should keep every fragment when merging is disabled")
  void shouldKeepFragments_whenMergingDisabled() {
    assertThat(preparer.splitSentences("Hi. Ok.", options(0, 1))).containsExactly("Hi.", " Ok.");
  }
}
