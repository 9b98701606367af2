package com.flamingo.ai.chunx.service.embedding;

import com.flamingo.ai.chunx.exception.EmbeddingContractException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * {@link EmbeddingFunction} backed by a LangChain4j {@link EmbeddingModel}.
 *
 * <p>All texts go out in one {@code embedAll} call. Model failures are not retried or wrapped.
 */
@RequiredArgsConstructor
@Slf4j
public class LangChain4jEmbeddingFunction implements EmbeddingFunction {

  private final EmbeddingModel embeddingModel;

  @Override
  public List<List<Float>> embed(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<TextSegment> segments = texts.stream().map(TextSegment::from).toList();

    log.debug("Embedding {} context windows", segments.size());
    Response<List<Embedding>> response = embeddingModel.embedAll(segments);
    List<Embedding> embeddings = response.content();

    if (embeddings == null || embeddings.size() != texts.size()) {
      throw new EmbeddingContractException(
          texts.size(), embeddings == null ? 0 : embeddings.size());
    }

    List<List<Float>> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(toFloatList(embedding.vector()));
    }
    return vectors;
  }

  private List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }
}
