package com.flamingo.ai.chunx.service.chunking.options;

import com.flamingo.ai.chunx.exception.ChunkingConfigurationException;
import java.util.Objects;

/**
 * Overlap between consecutive chunks, given either as an absolute token count or as a fraction of
 * the chunk size.
 *
 * <p>Use {@link #tokens(int)} or {@link #fraction(double)}; {@link #resolve(int)} turns either form
 * into a token count for a concrete chunk size.
 */
public final class ChunkOverlap {

  private final Integer tokens;
  private final Double fraction;

  private ChunkOverlap(Integer tokens, Double fraction) {
    this.tokens = tokens;
    this.fraction = fraction;
  }

  public static ChunkOverlap tokens(int tokens) {
    return new ChunkOverlap(tokens, null);
  }

  public static ChunkOverlap fraction(double fraction) {
    return new ChunkOverlap(null, fraction);
  }

  public static ChunkOverlap none() {
    return tokens(0);
  }

  /**
   * Validates this overlap against {@code chunkSize} and returns it in tokens.
   *
   * @param chunkSize the chunk size the overlap applies to
   * @return overlap in tokens, {@code floor(fraction * chunkSize)} for the fractional form
   * @throws ChunkingConfigurationException if the overlap is out of range
   */
  public int resolve(int chunkSize) {
    if (fraction != null) {
      if (fraction.isNaN() || fraction < 0.0 || fraction >= 1.0) {
        throw new ChunkingConfigurationException(
            "chunkOverlap", "overlap fraction must be in [0, 1), got " + fraction);
      }
      return (int) Math.floor(fraction * chunkSize);
    }
    if (tokens < 0 || tokens >= chunkSize) {
      throw new ChunkingConfigurationException(
          "chunkOverlap",
          "overlap must be non-negative and less than chunkSize ("
              + chunkSize
              + "), got "
              + tokens);
    }
    return tokens;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof ChunkOverlap other)) {
      return false;
    }
    return Objects.equals(tokens, other.tokens)
        && Objects.equals(fraction, other.fraction);
  }

  @Override
  public int hashCode() {
    return Objects.hash(tokens, fraction);
  }

  @Override
  public String toString() {
    return fraction != null
        ? "ChunkOverlap[fraction=" + fraction + "]"
        : "ChunkOverlap[tokens=" + tokens + "]";
  }
}
