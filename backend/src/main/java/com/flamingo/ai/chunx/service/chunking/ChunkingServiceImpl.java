package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.api.dto.request.ChunkRequest;
import com.flamingo.ai.chunx.config.ChunkingProperties;
import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import com.flamingo.ai.chunx.service.chunking.model.TextSpan;
import com.flamingo.ai.chunx.service.chunking.options.ChunkOverlap;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SentenceChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.SimilarityThreshold;
import com.flamingo.ai.chunx.service.chunking.options.TokenChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.options.WordChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.semantic.SemanticChunker;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Implementation of the ChunkingService. */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChunkingServiceImpl implements ChunkingService {

  private final TokenChunker tokenChunker;
  private final WordChunker wordChunker;
  private final SentenceChunker sentenceChunker;
  private final SemanticChunker semanticChunker;
  private final Tokenizer tokenizer;
  private final ChunkingProperties properties;
  private final MeterRegistry meterRegistry;

  @Override
  @Timed(value = "chunking.token", description = "Time to chunk text into token windows")
  public List<Chunk> tokenChunk(ChunkRequest request) {
    TokenChunkerOptions options = tokenOptions(request);
    return record(
        ChunkingStrategy.TOKEN, request, tokenChunker.chunk(request.getText(), tokenizer, options));
  }

  @Override
  @Timed(value = "chunking.word", description = "Time to chunk text into word windows")
  public List<Chunk> wordChunk(ChunkRequest request) {
    WordChunkerOptions options = wordOptions(request);
    return record(
        ChunkingStrategy.WORD, request, wordChunker.chunk(request.getText(), tokenizer, options));
  }

  @Override
  @Timed(value = "chunking.sentence", description = "Time to chunk text into sentence windows")
  public List<SentenceChunk> sentenceChunk(ChunkRequest request) {
    SentenceChunkerOptions options = sentenceOptions(request);
    return record(
        ChunkingStrategy.SENTENCE,
        request,
        sentenceChunker.chunk(request.getText(), tokenizer, options));
  }

  @Override
  @Timed(value = "chunking.semantic", description = "Time to group text by semantic similarity")
  public List<SentenceChunk> semanticChunk(ChunkRequest request) {
    SemanticChunkerOptions options = semanticOptions(request);
    return record(
        ChunkingStrategy.SEMANTIC,
        request,
        semanticChunker.chunk(request.getText(), tokenizer, options));
  }

  private <C extends TextSpan> List<C> record(
      ChunkingStrategy strategy, ChunkRequest request, List<C> chunks) {
    meterRegistry.counter("chunking.requests", "strategy", strategy.key()).increment();
    meterRegistry
        .summary("chunking.chunks.produced", "strategy", strategy.key())
        .record(chunks.size());
    log.info(
        "Chunked {} chars with {} strategy into {} chunks",
        request.getText().length(),
        strategy.key(),
        chunks.size());
    return chunks;
  }

  // Request fields override the configured defaults one by one.

  TokenChunkerOptions tokenOptions(ChunkRequest request) {
    ChunkingProperties.Windowed defaults = properties.getToken();
    int size = orDefault(request.getChunkSize(), defaults.getSize());
    return new TokenChunkerOptions(size, overlap(request, defaults));
  }

  WordChunkerOptions wordOptions(ChunkRequest request) {
    ChunkingProperties.Windowed defaults = properties.getWord();
    int size = orDefault(request.getChunkSize(), defaults.getSize());
    return new WordChunkerOptions(size, overlap(request, defaults));
  }

  SentenceChunkerOptions sentenceOptions(ChunkRequest request) {
    if (request.getChunkOverlapFraction() != null) {
      throw new ChunkingConfigurationException(
          "chunkOverlapFraction", "sentence overlap must be given in tokens (chunkOverlap)");
    }
    ChunkingProperties.Sentence defaults = properties.getSentence();
    return new SentenceChunkerOptions(
        orDefault(request.getChunkSize(), defaults.getSize()),
        orDefault(request.getChunkOverlap(), defaults.getOverlap()),
        orDefault(request.getMinSentencesPerChunk(), defaults.getMinSentencesPerChunk()),
        orDefault(request.getDelimiters(), defaults.getDelimiters()),
        orDefault(request.getShortSentenceThreshold(), defaults.getShortSentenceThreshold()));
  }

  SemanticChunkerOptions semanticOptions(ChunkRequest request) {
    ChunkingProperties.Semantic defaults = properties.getSemantic();
    SimilarityThreshold threshold =
        request.getThreshold() != null
            ? SimilarityThreshold.fixed(request.getThreshold())
            : parseThreshold(defaults.getThreshold());
    return new SemanticChunkerOptions(
        orDefault(request.getChunkSize(), defaults.getSize()),
        threshold,
        orDefault(request.getMinSentences(), defaults.getMinSentences()),
        orDefault(request.getMinChunkSize(), defaults.getMinChunkSize()),
        orDefault(request.getThresholdStep(), defaults.getThresholdStep()),
        orDefault(request.getDelimiters(), defaults.getDelimiters()),
        orDefault(request.getMinCharsPerSentence(), defaults.getMinCharsPerSentence()),
        orDefault(request.getSimilarityWindow(), defaults.getSimilarityWindow()));
  }

  private ChunkOverlap overlap(ChunkRequest request, ChunkingProperties.Windowed defaults) {
    if (request.getChunkOverlap() != null && request.getChunkOverlapFraction() != null) {
      throw new ChunkingConfigurationException(
          "chunkOverlap", "give either chunkOverlap or chunkOverlapFraction, not both");
    }
    if (request.getChunkOverlap() != null) {
      return ChunkOverlap.tokens(request.getChunkOverlap());
    }
    if (request.getChunkOverlapFraction() != null) {
      return ChunkOverlap.fraction(request.getChunkOverlapFraction());
    }
    return defaults.getOverlap() != null
        ? ChunkOverlap.tokens(defaults.getOverlap())
        : ChunkOverlap.fraction(defaults.getOverlapFraction());
  }

  static SimilarityThreshold parseThreshold(String value) {
    if (value == null || value.isBlank() || "auto".equalsIgnoreCase(value.trim())) {
      return SimilarityThreshold.auto();
    }
    try {
      return SimilarityThreshold.fixed(Double.parseDouble(value.trim()));
    } catch (NumberFormatException e) {
      throw new ChunkingConfigurationException(
          "threshold", "must be \"auto\" or a number in [0, 1], got " + value);
    }
  }

  private static <T> T orDefault(T value, T fallback) {
    return value != null ? value : fallback;
  }
}
