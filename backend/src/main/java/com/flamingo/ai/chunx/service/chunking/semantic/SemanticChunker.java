package com.flamingo.ai.chunx.service.chunking.semantic;

import com.flamingo.ai.chunx.service.chunking.ChunkingStrategy;
import com.flamingo.ai.chunx.service.chunking.TextChunker;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.semantic.SimilarityGroups.Range;
import com.flamingo.ai.chunx.service.embedding.EmbeddingFunction;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} that groups sentences by embedding similarity.
 *
 * <p>The algorithm:
 *
 * <ol>
 *   <li>Split into sentences and embed each one with its neighbouring context ({@link
 *       SemanticSentencePreparer})
 *   <li>Score each sentence by the mean cosine similarity to its neighbours
 *   <li>Use the fixed threshold, or search one with {@link SimilarityThresholdResolver}
 *   <li>Cut after every sentence scoring {@code <= threshold}; drop groups below {@code
 *       minSentences}
 *   <li>Pack each group into chunks of at most {@code chunkSize} tokens
 * </ol>
 *
 * <p>A higher threshold cuts more often, so it never produces fewer chunks for the same text. When
 * the text has no more than {@code minSentences} sentences, the whole text is one chunk.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticChunker implements TextChunker<SemanticChunkerOptions, SentenceChunk> {

  private final SemanticSentencePreparer preparer;
  private final SimilarityThresholdResolver thresholdResolver;
  private final EmbeddingFunction embeddingFunction;

  @Override
  public List<SentenceChunk> chunk(
      String text, Tokenizer tokenizer, SemanticChunkerOptions options) {
    return chunk(text, tokenizer, embeddingFunction, options);
  }

  /**
   * Chunks {@code text} with a caller-supplied embedding function.
   *
   * @param text source text; blank text yields an empty list
   * @param tokenizer tokenizer for sentence token counts
   * @param embeddings embedding function, called exactly once for non-blank text
   * @param options validated options
   * @return chunks in source order
   */
  public List<SentenceChunk> chunk(
      String text,
      Tokenizer tokenizer,
      EmbeddingFunction embeddings,
      SemanticChunkerOptions options) {
    if (text.isBlank()) {
      return List.of();
    }
    List<Chunk> sentences = preparer.prepare(text, tokenizer, embeddings, options);
    if (sentences.size() <= options.minSentences()) {
      return List.of(SentenceChunk.of(sentences));
    }

    double[] pairwise = SimilarityGroups.pairwiseSimilarities(sentences);
    double[] scores = SimilarityGroups.averageNeighbourScores(pairwise, sentences.size());
    double threshold =
        options.threshold().isAuto()
            ? thresholdResolver.resolve(sentences, pairwise, scores, options)
            : options.threshold().value();

    List<Range> groups = SimilarityGroups.splitRanges(scores, threshold, options.minSentences());
    List<SentenceChunk> chunks = new ArrayList<>();
    for (Range group : groups) {
      chunks.addAll(pack(sentences.subList(group.start(), group.end()), options));
    }

    log.debug(
        "Semantic chunking: {} sentences, threshold={}, {} groups -> {} chunks",
        sentences.size(),
        threshold,
        groups.size(),
        chunks.size());
    return chunks;
  }

  @Override
  public ChunkingStrategy strategy() {
    return ChunkingStrategy.SEMANTIC;
  }

  /** Greedy packing without overlap; a sentence is forced in while the chunk is below minimum. */
  private List<SentenceChunk> pack(List<Chunk> group, SemanticChunkerOptions options) {
    List<SentenceChunk> chunks = new ArrayList<>();
    List<Chunk> current = new ArrayList<>();
    int tokens = 0;
    for (Chunk sentence : group) {
      int next = tokens + sentence.tokenCount();
      if (next <= options.chunkSize() || current.size() < options.minSentences()) {
        current.add(sentence);
        tokens = next;
      } else {
        chunks.add(SentenceChunk.of(current));
        current = new ArrayList<>();
        current.add(sentence);
        tokens = sentence.tokenCount();
      }
    }
    if (!current.isEmpty()) {
      chunks.add(SentenceChunk.of(current));
    }
    return chunks;
  }
}
