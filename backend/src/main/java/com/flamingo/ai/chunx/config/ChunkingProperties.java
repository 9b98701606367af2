package com.flamingo.ai.chunx.config;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Service-level chunking defaults. Request fields override them one by one. */
@Configuration
@ConfigurationProperties(prefix = "chunx")
@Getter
@Setter
public class ChunkingProperties {

  private TokenizerSettings tokenizer = new TokenizerSettings();
  private Windowed token = new Windowed();
  private Windowed word = new Windowed();
  private Sentence sentence = new Sentence();
  private Semantic semantic = new Semantic();

  @Getter
  @Setter
  public static class TokenizerSettings {
    /** "jtokkit" (BPE via JTokkit) or "word-punctuation". */
    private String type = "jtokkit";

    /** JTokkit encoding, e.g. CL100K_BASE or O200K_BASE. */
    private String encoding = "CL100K_BASE";
  }

  /** Settings shared by the token and word strategies. */
  @Getter
  @Setter
  public static class Windowed {
    private int size = 512;

    /** Absolute overlap in tokens; takes precedence over {@link #overlapFraction} when set. */
    private Integer overlap;

    private double overlapFraction = 0.25;
  }

  @Getter
  @Setter
  public static class Sentence {
    private int size = 512;
    private int overlap = 128;
    private int minSentencesPerChunk = 1;
    private List<String> delimiters = new ArrayList<>(List.of(".", "!", "?", "\n"));
    private int shortSentenceThreshold = 6;
  }

  @Getter
  @Setter
  public static class Semantic {
    private int size = 512;

    /** "auto" or a number in [0, 1]. */
    private String threshold = "auto";

    private int minSentences = 1;
    private int minChunkSize = 2;
    private double thresholdStep = 0.01;
    private List<String> delimiters = new ArrayList<>(List.of(".", "!", "?", "\n"));

    /** Fragments with fewer trimmed characters are merged; 0 disables merging. */
    private int minCharsPerSentence = 0;

    /** Neighbouring sentences per side included in each embedded context window. */
    private int similarityWindow = 1;
  }
}
