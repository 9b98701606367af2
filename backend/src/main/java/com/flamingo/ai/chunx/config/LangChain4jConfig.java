package com.flamingo.ai.chunx.config;

import com.flamingo.ai.chunx.service.embedding.EmbeddingFunction;
import com.flamingo.ai.chunx.service.embedding.LangChain4jEmbeddingFunction;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

/** Configuration for the LangChain4j embedding model behind semantic chunking. */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  @Bean
  @Lazy
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  /** The model is resolved on the first semantic request, so other strategies run without a key. */
  @Bean
  public EmbeddingFunction embeddingFunction(@Lazy EmbeddingModel embeddingModel) {
    return new LangChain4jEmbeddingFunction(embeddingModel);
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required for semantic chunking. Set OPENAI_API_KEY environment"
              + " variable.");
    }
  }
}
