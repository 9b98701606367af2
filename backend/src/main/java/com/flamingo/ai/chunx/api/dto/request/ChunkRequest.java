package com.flamingo.ai.chunx.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for chunking a text. Every option is optional and falls back to the configured
 * default; options a strategy does not use are ignored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChunkRequest {

  @NotNull(message = "Text is required")
  private String text;

  private Integer chunkSize;

  /** Absolute overlap in tokens. */
  private Integer chunkOverlap;

  /** Overlap as a fraction of the chunk size (token and word strategies). */
  private Double chunkOverlapFraction;

  private Integer minSentencesPerChunk;
  private List<String> delimiters;
  private Integer shortSentenceThreshold;

  /** Fixed similarity threshold; absent means "auto". */
  private Double threshold;

  private Integer minSentences;
  private Integer minChunkSize;
  private Double thresholdStep;
  private Integer minCharsPerSentence;
  private Integer similarityWindow;
}
