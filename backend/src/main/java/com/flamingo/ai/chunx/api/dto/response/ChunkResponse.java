package com.flamingo.ai.chunx.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.chunx.service.chunking.model.SentenceChunk;
import com.flamingo.ai.chunx.service.chunking.model.TextSpan;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one chunk; {@code sentences} is present for sentence-based strategies. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChunkResponse {

  private String text;
  private int startByte;
  private int endByte;
  private int tokenCount;
  private List<ChunkResponse> sentences;

  /** Creates a ChunkResponse from any chunk; embeddings are left out. */
  public static ChunkResponse from(TextSpan chunk) {
    ChunkResponseBuilder builder =
        ChunkResponse.builder()
            .text(chunk.text())
            .startByte(chunk.startByte())
            .endByte(chunk.endByte())
            .tokenCount(chunk.tokenCount());
    if (chunk instanceof SentenceChunk sentenceChunk) {
      builder.sentences(sentenceChunk.sentences().stream().map(ChunkResponse::from).toList());
    }
    return builder.build();
  }
}
