package com.flamingo.ai.chunx.service.chunking;

import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.TokenChunkerOptions;
import com.flamingo.ai.chunx.service.tokenizer.TokenSpan;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {@link TextChunker} producing fixed windows of {@code chunkSize} tokens with a stride of {@code
 * chunkSize - overlap}.
 *
 * <p>The text is encoded once. Zero-width tokens are dropped, and each window is cut from the
 * source bytes between its first token's start and its last token's end, so whitespace and
 * punctuation between tokens survive exactly.
 */
@Component
@Slf4j
public class TokenChunker implements TextChunker<TokenChunkerOptions, Chunk> {

  @Override
  public List<Chunk> chunk(String text, Tokenizer tokenizer, TokenChunkerOptions options) {
    if (text.isBlank()) {
      return List.of();
    }
    int chunkSize = options.chunkSize();
    int step = chunkSize - options.overlapTokens();

    List<TokenSpan> tokens =
        tokenizer.encode(text).stream().filter(span -> !span.isEmpty()).toList();
    if (tokens.isEmpty()) {
      return List.of();
    }

    byte[] source = text.getBytes(StandardCharsets.UTF_8);
    List<Chunk> chunks = new ArrayList<>();
    for (int start = 0; start < tokens.size(); start += step) {
      int end = Math.min(start + chunkSize, tokens.size());
      int startByte = tokens.get(start).startByte();
      int endByte = tokens.get(end - 1).endByte();
      String slice = new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8);
      chunks.add(new Chunk(slice, startByte, endByte, end - start));
    }

    log.debug(
        "Token chunking: {} tokens, size={}, step={} -> {} chunks",
        tokens.size(),
        chunkSize,
        step,
        chunks.size());
    return chunks;
  }

  @Override
  public ChunkingStrategy strategy() {
    return ChunkingStrategy.TOKEN;
  }
}
