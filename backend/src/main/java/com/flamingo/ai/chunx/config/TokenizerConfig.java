package com.flamingo.ai.chunx.config;

import com.flamingo.ai.chunx.service.tokenizer.JTokkitTokenizer;
import com.flamingo.ai.chunx.service.tokenizer.Tokenizer;
import com.flamingo.ai.chunx.service.tokenizer.WordPunctuationTokenizer;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.EncodingType;
import java.util.Locale;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the tokenizer used by every chunking strategy. */
@Configuration
@Slf4j
public class TokenizerConfig {

  @Bean
  public Tokenizer tokenizer(ChunkingProperties properties) {
    ChunkingProperties.TokenizerSettings settings = properties.getTokenizer();
    String type = settings.getType() == null ? "" : settings.getType().toLowerCase(Locale.ROOT);

    switch (type) {
      case "word-punctuation":
        log.info("Using word/punctuation tokenizer");
        return new WordPunctuationTokenizer();
      case "jtokkit":
        EncodingType encodingType =
            EncodingType.valueOf(settings.getEncoding().toUpperCase(Locale.ROOT));
        log.info("Using JTokkit tokenizer with encoding {}", encodingType);
        return new JTokkitTokenizer(
            Encodings.newDefaultEncodingRegistry().getEncoding(encodingType));
      default:
        throw new IllegalStateException(
            "Unknown tokenizer type '"
                + settings.getType()
                + "'. Set chunx.tokenizer.type to jtokkit or word-punctuation.");
    }
  }
}
