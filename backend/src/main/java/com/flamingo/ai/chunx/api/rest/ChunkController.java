package com.flamingo.ai.chunx.api.rest;

import com.flamingo.ai.chunx.api.dto.request.ChunkRequest;
import com.flamingo.ai.chunx.api.dto.response.ChunkResponse;
import com.flamingo.ai.chunx.exception.UnknownStrategyException;
import com.flamingo.ai.chunx.service.chunking.ChunkingService;
import com.flamingo.ai.chunx.service.chunking.ChunkingStrategy;
import com.flamingo.ai.chunx.service.chunking.model.TextSpan;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for chunking text. */
@RestController
@RequestMapping("/api/chunks")
@RequiredArgsConstructor
public class ChunkController {

  private final ChunkingService chunkingService;

  /** Chunks the request text with the named strategy. */
  @PostMapping("/{strategy}")
  public ResponseEntity<List<ChunkResponse>> chunk(
      @PathVariable String strategy, @Valid @RequestBody ChunkRequest request) {
    ChunkingStrategy resolved =
        ChunkingStrategy.fromKey(strategy)
            .orElseThrow(() -> new UnknownStrategyException(strategy));
    List<? extends TextSpan> chunks =
        switch (resolved) {
          case TOKEN -> chunkingService.tokenChunk(request);
          case WORD -> chunkingService.wordChunk(request);
          case SENTENCE -> chunkingService.sentenceChunk(request);
          case SEMANTIC -> chunkingService.semanticChunk(request);
        };
    return ResponseEntity.ok(chunks.stream().map(ChunkResponse::from).toList());
  }

  /** Lists the available strategies. */
  @GetMapping("/strategies")
  public ResponseEntity<List<String>> strategies() {
    return ResponseEntity.ok(
        Arrays.stream(ChunkingStrategy.values()).map(ChunkingStrategy::key).toList());
  }
}
