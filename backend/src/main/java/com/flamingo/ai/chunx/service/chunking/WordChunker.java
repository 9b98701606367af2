package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.WordChunkerOptions;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import com.google.common.base.Utf8;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} that packs whole words under a token budget.
 *
 * <p>A word is a run of non-whitespace together with the whitespace before it, so the words of a
 * text concatenate back to the text. Words are added while the running token total stays within
 * {@code chunkSize}; the word that overflows opens the next chunk, preceded by as many trailing
 * words of the closed chunk as fit into the overlap budget.
 */
@Component
@Slf4j
public class WordChunker implements TextChunker<WordChunkerOptions, Chunk> {

  private static final Pattern WORD = Pattern.compile("\\s*\\S+");

  @Override
  public List<Chunk> chunk(String text, Tokenizer tokenizer, WordChunkerOptions options) {
    if (text.isBlank()) {
      return List.of();
    }
    int chunkSize = options.chunkSize();
    int overlap = options.overlapTokens();

    List<String> words = splitIntoWords(text);
    int[] tokenCounts = countTokens(words, tokenizer);
    int[] byteOffsets = new int[words.size() + 1];
    for (int i = 0; i < words.size(); i++) {
      byteOffsets[i + 1] = byteOffsets[i] + Utf8.encodedLength(words.get(i));
    }

    List<Chunk> chunks = new ArrayList<>();
    int first = 0;
    int size = 0;
    int running = 0;
    for (int idx = 0; idx < words.size(); idx++) {
      int length = tokenCounts[idx];
      if (running + length <= chunkSize) {
        size++;
        running += length;
        continue;
      }
      if (size > 0) {
        chunks.add(createChunk(words, byteOffsets, first, idx, running));
      }

      // Trailing words of the closed chunk, never pushing the new chunk past the budget.
      int budget = Math.min(overlap, chunkSize - length);
      int overlapStart = idx;
      int overlapTokens = 0;
      for (int back = idx - 1; back >= idx - size && back >= 0; back--) {
        if (overlapTokens + tokenCounts[back] > budget) {
          break;
        }
        overlapTokens += tokenCounts[back];
        overlapStart = back;
      }
      first = overlapStart;
      size = idx - overlapStart + 1;
      running = overlapTokens + length;
    }
    if (size > 0) {
      chunks.add(createChunk(words, byteOffsets, first, first + size, running));
    }

    log.debug(
        "Word chunking: {} words, size={}, overlap={} -> {} chunks",
        words.size(),
        chunkSize,
        overlap,
        chunks.size());
    return chunks;
  }

  @Override
  public ChunkingStrategy strategy() {
    return ChunkingStrategy.WORD;
  }

  /** Splits {@code text} into words; a trailing whitespace remainder becomes the last word. */
  List<String> splitIntoWords(String text) {
    List<String> words = new ArrayList<>();
    Matcher matcher = WORD.matcher(text);
    int end = 0;
    while (matcher.find()) {
      words.add(matcher.group());
      end = matcher.end();
    }
    if (end < text.length()) {
      words.add(text.substring(end));
    }
    return words;
  }

  /** Token counts per word, memoized by word text for this call only. */
  private int[] countTokens(List<String> words, Tokenizer tokenizer) {
    Map<String, Integer> cache = new HashMap<>();
    int[] counts = new int[words.size()];
    for (int i = 0; i < words.size(); i++) {
      counts[i] = cache.computeIfAbsent(words.get(i), tokenizer::countTokens);
    }
    return counts;
  }

  private Chunk createChunk(
      List<String> words, int[] byteOffsets, int from, int to, int tokenCount) {
    String chunkText = String.join("", words.subList(from, to));
    return new Chunk(chunkText, byteOffsets[from], byteOffsets[to], tokenCount);
  }
}
