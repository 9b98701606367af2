package com.flamingo.ai.chunx.service.chunking;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/** The fixed set of chunking strategies. */
public enum ChunkingStrategy {
  TOKEN,
  WORD,
  SENTENCE,
  SEMANTIC;

  /** Lower-case name used in URLs and metric tags. */
  public String key() {
    return name().toLowerCase(Locale.ROOT);
  }

  public static Optional<ChunkingStrategy> fromKey(String key) {
    if (key == null) {
      return Optional.empty();
    }
    return Arrays.stream(values()).filter(s -> s.key().equalsIgnoreCase(key.trim())).findFirst();
  }
}
