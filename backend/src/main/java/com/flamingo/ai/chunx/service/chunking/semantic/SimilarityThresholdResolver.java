package com.flamingo.ai.chunx.service.chunking.semantic;

import com.flamingo.ai.chunx.service.chunking.Statistics;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import com.flamingo.ai.chunx.service.chunking.options.SemanticChunkerOptions;
import com.flamingo.ai.chunx.service.chunking.semantic.SimilarityGroups.Range;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Searches for a similarity threshold whose groups all hold between {@code minChunkSize} and
 * {@code chunkSize} tokens.
 *
 * <p>The search starts from {@code [median - std, median + std]} of the adjacent-pair
 * similarities, clipped to {@code [0, 1]}, and bisects it. Groups that are too large raise the
 * floor, groups that are too small lower the ceiling. Group sizes do not move monotonically with
 * the threshold, so the result is a best effort: after {@value #MAX_ITERATIONS} rounds, or once the
 * interval is no wider than {@code thresholdStep}, the midpoint of what is left is returned.
 */
@Component
@Slf4j
public class SimilarityThresholdResolver {

  static final int MAX_ITERATIONS = 10;

  /**
   * Resolves the threshold for {@code sentences}.
   *
   * @param sentences prepared sentences, at least two
   * @param pairwise adjacent-pair similarities
   * @param scores averaged per-sentence similarity scores
   * @param options chunking options
   * @return threshold in {@code [0, 1]}
   */
  public double resolve(
      List<Chunk> sentences, double[] pairwise, double[] scores, SemanticChunkerOptions options) {
    double median = Statistics.median(pairwise);
    double std = Statistics.standardDeviation(pairwise);
    double low = Math.max(median - std, 0.0);
    double high = Math.min(median + std, 1.0);
    double step = options.thresholdStep();

    for (int iteration = 0;
        iteration < MAX_ITERATIONS && Math.abs(high - low) > step;
        iteration++) {
      double threshold = (low + high) / 2.0;
      List<Range> ranges = SimilarityGroups.splitRanges(scores, threshold, options.minSentences());

      boolean tooLarge = false;
      boolean allValid = true;
      for (Range range : ranges) {
        int tokens = SimilarityGroups.tokenTotal(sentences, range);
        if (tokens > options.chunkSize()) {
          tooLarge = true;
          allValid = false;
        } else if (tokens < options.minChunkSize()) {
          allValid = false;
        }
      }

      if (allValid) {
        log.debug("Threshold {} satisfies size bounds after {} rounds", threshold, iteration + 1);
        return threshold;
      }
      if (tooLarge) {
        low = threshold + step;
      } else {
        high = threshold - step;
      }
    }

    double threshold = Math.min(1.0, Math.max(0.0, (low + high) / 2.0));
    log.debug("Threshold search ended at [{}, {}], using {}", low, high, threshold);
    return threshold;
  }
}
