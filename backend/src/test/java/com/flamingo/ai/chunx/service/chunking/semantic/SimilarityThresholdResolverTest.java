package com.flamingo.ai.chunx.service.chunking.semantic;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SentenceChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SimilarityThreshold;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SimilarityThresholdResolver Tests")
class SimilarityThresholdResolverTest {

  private static final double[] PAIRWISE = {1.0, 0.0, 1.0};
  private static final double[] SCORES = {1.0, 0.5, 0.5, 1.0};

  private SimilarityThresholdResolver resolver;
  private List<Chunk> sentences;

  @BeforeEach
  void setUp() {
    resolver = new SimilarityThresholdResolver();
    sentences = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      sentences.add(new Chunk("s" + i + ".", i * 3, i * 3 + 3, 3));
    }
  }

  private static SemanticChunkerOptions options(int chunkSize, int minChunkSize) {
    return new SemanticChunkerOptions(
        chunkSize,
        SimilarityThreshold.auto(),
        1,
        minChunkSize,
        0.01,
        SentenceChunkerOptions.DEFAULT_DELIMITERS,
        0,
        1);
  }

  @Test
  @DisplayName("should accept the first midpoint whose groups fit")
  void shouldReturnFirstValidMidpoint() {
    double threshold = resolver.resolve(sentences, PAIRWISE, SCORES, options(512, 2));

    double std = Math.sqrt(2.0 / 9.0);
    assertThat(threshold).isCloseTo(((1.0 - std) + 1.0) / 2.0, within(1e-9));
  }

  @Test
  @DisplayName("should stay within [0, 1] when groups remain too large")
  void shouldStayInRange_whenGroupsTooLarge() {
    double threshold = resolver.resolve(sentences, PAIRWISE, SCORES, options(4, 1));

    assertThat(threshold).isBetween(0.0, 1.0);
  }

  @Test
  @DisplayName("should stay within [0, 1] when groups remain too small")
  void shouldStayInRange_whenGroupsTooSmall() {
    double threshold = resolver.resolve(sentences, PAIRWISE, SCORES, options(512, 100));

    assertThat(threshold).isBetween(0.0, 1.0);
  }

  @Test
  @DisplayName("should search from the whole band when similarities are uniform")
  void shouldHandleUniformSimilarities() {
    double threshold =
        resolver.resolve(
            sentences,
            new double[] {0.8, 0.8, 0.8},
            new double[] {0.8, 0.8, 0.8, 0.8},
            options(512, 2));

    assertThat(threshold).isEqualTo(0.8);
  }
}
