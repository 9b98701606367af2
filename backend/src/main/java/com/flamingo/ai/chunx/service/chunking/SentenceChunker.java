package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import com.flamingo.ai.chunx.service.chunking.options.SentenceChunkerOptions;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} that packs whole sentences under a token budget.
 *
 * <p>Sentences come from {@link SentenceSplitter}; fragments shorter than {@code
 * shortSentenceThreshold} bytes are glued onto the previous one. Each chunk takes sentences while
 * the running total stays within {@code chunkSize}, but always at least {@code
 * minSentencesPerChunk} of them. The next chunk starts with the trailing sentences of the previous
 * one whose token total does not exceed {@code chunkOverlap}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SentenceChunker implements TextChunker<SentenceChunkerOptions, SentenceChunk> {

  private final SentenceSplitter splitter;

  @Override
  public List<SentenceChunk> chunk(
      String text, Tokenizer tokenizer, SentenceChunkerOptions options) {
    if (text.isBlank()) {
      return List.of();
    }
    List<Chunk> sentences = prepareSentences(text, tokenizer, options);

    List<SentenceChunk> chunks = new ArrayList<>();
    int pos = 0;
    while (pos < sentences.size()) {
      List<Chunk> window = takeWithinBudget(sentences, pos, options);
      if (window.isEmpty()) {
        break;
      }
      chunks.add(SentenceChunk.of(window));
      pos = nextStart(sentences, pos, pos + window.size(), options.chunkOverlap());
    }

    log.debug(
        "Sentence chunking: {} sentences, size={}, overlap={} -> {} chunks",
        sentences.size(),
        options.chunkSize(),
        options.chunkOverlap(),
        chunks.size());
    return chunks;
  }

  @Override
  public ChunkingStrategy strategy() {
    return ChunkingStrategy.SENTENCE;
  }

  /** Splits, merges short fragments and lays the sentences end to end over the source bytes. */
  List<Chunk> prepareSentences(String text, Tokenizer tokenizer, SentenceChunkerOptions options) {
    int threshold = options.shortSentenceThreshold();
    List<String> fragments =
        splitter.mergeShort(
            splitter.split(text, options.delimiters()),
            fragment -> Utf8.encodedLength(fragment) < threshold);

    List<Chunk> sentences = new ArrayList<>(fragments.size());
    int offset = 0;
    for (String fragment : fragments) {
      int length = Utf8.encodedLength(fragment);
      sentences.add(new Chunk(fragment, offset, offset + length, tokenizer.countTokens(fragment)));
      offset += length;
    }
    return sentences;
  }

  private List<Chunk> takeWithinBudget(
      List<Chunk> sentences, int pos, SentenceChunkerOptions options) {
    List<Chunk> window = new ArrayList<>();
    int total = 0;
    for (int i = pos; i < sentences.size(); i++) {
      Chunk sentence = sentences.get(i);
      int next = total + sentence.tokenCount();
      if (next > options.chunkSize() && window.size() >= options.minSentencesPerChunk()) {
        break;
      }
      window.add(sentence);
      total = next;
    }
    return window;
  }

  /**
   * Walks back from the end of the closed chunk and returns the first sentence of the next one.
   * Sentences are carried over while their total stays within {@code overlap}; the result is
   * always past {@code pos} so every chunk advances.
   */
  private int nextStart(List<Chunk> sentences, int pos, int splitIdx, int overlap) {
    if (overlap <= 0 || splitIdx >= sentences.size()) {
      return splitIdx;
    }
    int start = splitIdx;
    int total = 0;
    for (int idx = splitIdx - 1; idx >= pos; idx--) {
      total += sentences.get(idx).tokenCount();
      if (total > overlap) {
        break;
      }
      start = idx;
    }
    return Math.max(start, pos + 1);
  }
}
