package com.flamingo.ai.chunx;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.chunx.api.dto.request.ChunkRequest;
import com.flamingo.ai.chunx.api.rest.ChunkController;
import com.flamingo.ai.chunx.service.chunking.ChunkingService;
import com.flamingo.ai.chunx.service.embedding.EmbeddingFunction;
import com.flamingo.ai.chunx.service.tokenizer.JTokkitTokenizer;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import dev.langchain4j.model.embedding.EmbeddingModel;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Verifies the Spring application context loads. The embedding model is mocked so the test runs
 * without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private EmbeddingModel embeddingModel;

  @Autowired private ApplicationContext applicationContext;
  @Autowired private ChunkController chunkController;
  @Autowired private MeterRegistry meterRegistry;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Chunking beans should be available")
  void chunkingBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(ChunkingService.class)).isNotNull();
    assertThat(applicationContext.getBean(EmbeddingFunction.class)).isNotNull();
    assertThat(applicationContext.getBean(Tokenizer.class)).isInstanceOf(JTokkitTokenizer.class);
  }

  @Test
  @DisplayName("Strategy operations should be timed when called from the controller")
  void strategyOperationsShouldBeTimed() {
    long before = wordTimerCount();

    chunkController.chunk("word", ChunkRequest.builder().text("Hello world").build());

    assertThat(meterRegistry.find("chunking.word").timer()).isNotNull();
    assertThat(wordTimerCount()).isEqualTo(before + 1);
  }

  private long wordTimerCount() {
    Timer timer = meterRegistry.find("chunking.word").timer();
    return timer == null ? 0 : timer.count();
  }
}
