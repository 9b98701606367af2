package com.flamingo.ai.chunx.service.chunking;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.chunx.api.dto.request.ChunkRequest;
import com.flamingo.ai.chunx.config.ChunkingProperties;
import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.semantic.SemanticChunker;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import com.flamingo.ai.chunx.service.tokenizer.WordPunctuationTokenizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("ChunkingServiceImpl Tests")
class ChunkingServiceImplTest {

  private static final String TEXT = "Hey there my friend, how is it going out there?";

  @Mock private SemanticChunker semanticChunker;
  @Captor private ArgumentCaptor<SemanticChunkerOptions> semanticOptionsCaptor;

  private ChunkingProperties properties;
  private MeterRegistry meterRegistry;
  private Tokenizer tokenizer;
  private ChunkingServiceImpl service;

  @BeforeEach
  void setUp() {
    properties = new ChunkingProperties();
    meterRegistry = new SimpleMeterRegistry();
    tokenizer = new WordPunctuationTokenizer();
    service =
        new ChunkingServiceImpl(
            new TokenChunker(),
            new WordChunker(),
            new SentenceChunker(new SentenceSplitter()),
            semanticChunker,
            tokenizer,
            properties,
            meterRegistry);
  }

  @Nested
  @DisplayName("option resolution")
  class OptionResolution {

    @Test
    @DisplayName("should apply request overrides on top of configured defaults")
    void shouldApplyOverrides() {
      List<Chunk> chunks =
          service.wordChunk(ChunkRequest.builder().text(TEXT).chunkSize(3).build());

      assertThat(chunks)
          .extracting(Chunk::text)
          .containsExactly("Hey there my", " friend, how", " is it going", " out there?");
    }

    @Test
    @DisplayName("should prefer a configured absolute overlap over the fraction")
    void shouldUseConfiguredAbsoluteOverlap() {
      properties.getToken().setOverlap(1);

      ChunkRequest request = ChunkRequest.builder().text(TEXT).chunkSize(4).build();

      assertThat(service.tokenOptions(request).overlapTokens()).isEqualTo(1);
    }

    @Test
    @DisplayName("should resolve a fractional overlap override")
    void shouldResolveFractionOverride() {
      ChunkRequest request =
          ChunkRequest.builder().text(TEXT).chunkSize(10).chunkOverlapFraction(0.5).build();

      assertThat(service.tokenOptions(request).overlapTokens()).isEqualTo(5);
    }

    @Test
    @DisplayName("should reject both overlap forms at once")
    void shouldRejectBothOverlapForms() {
      ChunkRequest request =
          ChunkRequest.builder().text(TEXT).chunkOverlap(2).chunkOverlapFraction(0.1).build();

      assertThatThrownBy(() -> service.tokenChunk(request))
          .isInstanceOf(ChunkingConfigurationException.class)
          .hasMessageContaining("not both");
    }

    @Test
    @DisplayName("should reject a fractional overlap for sentence chunking")
    void shouldRejectFractionForSentences() {
      ChunkRequest request = ChunkRequest.builder().text(TEXT).chunkOverlapFraction(0.1).build();

      assertThatThrownBy(() -> service.sentenceChunk(request))
          .isInstanceOf(ChunkingConfigurationException.class)
          .satisfies(
              e ->
                  assertThat(((ChunkingConfigurationException) e).getOption())
                      .isEqualTo("chunkOverlapFraction"));
    }

    @Test
    @DisplayName("should read a numeric configured threshold")
    void shouldParseConfiguredThreshold() {
      properties.getSemantic().setThreshold("0.4");

      SemanticChunkerOptions options =
          service.semanticOptions(ChunkRequest.builder().text(TEXT).build());

      assertThat(options.threshold().value()).isEqualTo(0.4);
    }

    @Test
    @DisplayName("should let a request threshold override the configured one")
    void shouldOverrideThreshold() {
      SemanticChunkerOptions options =
          service.semanticOptions(ChunkRequest.builder().text(TEXT).threshold(0.7).build());

      assertThat(options.threshold().value()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("should reject an unparsable configured threshold")
    void shouldRejectBadConfiguredThreshold() {
      assertThatThrownBy(() -> ChunkingServiceImpl.parseThreshold("high"))
          .isInstanceOf(ChunkingConfigurationException.class)
          .hasMessageContaining("threshold");
      assertThat(ChunkingServiceImpl.parseThreshold("AUTO").isAuto()).isTrue();
    }
  }

  @Nested
  @DisplayName("chunking")
  class Chunking {

    @Test
    @DisplayName("should record request count and chunk total per strategy")
    void shouldRecordMetrics() {
      service.tokenChunk(ChunkRequest.builder().text(TEXT).chunkSize(4).chunkOverlap(0).build());

      assertThat(meterRegistry.get("chunking.requests").tag("strategy", "token").counter().count())
          .isEqualTo(1.0);
      assertThat(
              meterRegistry
                  .get("chunking.chunks.produced")
                  .tag("strategy", "token")
                  .summary()
                  .totalAmount())
          .isEqualTo(3.0);
    }

    @Test
    @DisplayName("should chunk sentences with configured defaults")
    void shouldChunkSentences() {
      List<SentenceChunk> chunks =
          service.sentenceChunk(ChunkRequest.builder().text("One. Two three. Four!").build());

      assertThat(chunks).hasSize(1);
      assertThat(chunks.get(0).text()).isEqualTo("One. Two three. Four!");
    }

    @Test
    @DisplayName("should pass resolved semantic options to the semantic chunker")
    void shouldDelegateSemanticChunking() {
      when(semanticChunker.chunk(eq(TEXT), eq(tokenizer), any(SemanticChunkerOptions.class)))
          .thenReturn(List.of());

      service.semanticChunk(ChunkRequest.builder().text(TEXT).similarityWindow(2).build());

      verify(semanticChunker).chunk(eq(TEXT), eq(tokenizer), semanticOptionsCaptor.capture());
      assertThat(semanticOptionsCaptor.getValue().threshold().isAuto()).isTrue();
      assertThat(semanticOptionsCaptor.getValue().similarityWindow()).isEqualTo(2);
    }

    @Test
    @DisplayName("should count requests and produced chunks per strategy")
    void shouldRecordMetricsPerStrategy() {
      ChunkRequest request = ChunkRequest.builder().text(TEXT).chunkSize(3).build();

      assertThat(service.wordChunk(request)).hasSize(4);
      assertThat(meterRegistry.get("chunking.requests").tag("strategy", "word").counter().count())
          .isEqualTo(1.0);
      assertThat(
              meterRegistry
                  .get("chunking.chunks.produced")
                  .tag("strategy", "word")
                  .summary()
                  .totalAmount())
          .isEqualTo(4.0);
    }
  }
}
