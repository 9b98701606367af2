package com.flamingo.ai.chunx.service.chunking.semantic;

import com.flamingo.ai.chunx.exception.EmbeddingContractException;
import com.flamingo.ai.chunx.service.chunking.SentenceSplitter;
import com.flamingo.ai.chunx.service.chunking.SpanResolver;
import com.flamingo.ai.chunx.service.chunking.SpanResolver.SentenceSpan;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.embedding.EmbeddingFunction;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Turns text into sentence {@link Chunk}s carrying context-window embeddings.
 *
 * <p>Every sentence is embedded together with up to {@code similarityWindow} neighbours on each
 * side. All windows go to the embedding function in a single call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticSentencePreparer {

  private final SentenceSplitter splitter;

  public List<Chunk> prepare(
      String text,
      Tokenizer tokenizer,
      EmbeddingFunction embeddingFunction,
      SemanticChunkerOptions options) {
    List<String> sentences = splitSentences(text, options);
    List<SentenceSpan> spans = SpanResolver.resolve(text, sentences);
    List<String> windows = buildContextWindows(sentences, options.similarityWindow());

    List<List<Float>> embeddings = embeddingFunction.embed(windows);
    if (embeddings == null || embeddings.size() != sentences.size()) {
      throw new EmbeddingContractException(
          sentences.size(), embeddings == null ? 0 : embeddings.size());
    }

    List<Chunk> prepared = new ArrayList<>(spans.size());
    for (int i = 0; i < spans.size(); i++) {
      SentenceSpan span = spans.get(i);
      prepared.add(
          new Chunk(
              span.text(),
              span.startByte(),
              span.endByte(),
              tokenizer.countTokens(span.text()),
              embeddings.get(i)));
    }
    log.debug("Prepared {} sentences for semantic grouping", prepared.size());
    return prepared;
  }

  List<String> splitSentences(String text, SemanticChunkerOptions options) {
    List<String> fragments = splitter.split(text, options.delimiters());
    int minChars = options.minCharsPerSentence();
    if (minChars <= 0) {
      return fragments;
    }
    return splitter.mergeShort(
        fragments,
        fragment -> {
          String stripped = fragment.strip();
          return stripped.codePointCount(0, stripped.length()) < minChars;
        });
  }

  /** Joins each sentence with up to {@code window} neighbours on either side. */
  static List<String> buildContextWindows(List<String> sentences, int window) {
    if (window == 0) {
      return List.copyOf(sentences);
    }
    List<String> windows = new ArrayList<>(sentences.size());
    for (int i = 0; i < sentences.size(); i++) {
      int from = Math.max(0, i - window);
      int to = Math.min(sentences.size(), i + window + 1);
      windows.add(String.join("", sentences.subList(from, to)));
    }
    return windows;
  }
}
