package com.flamingo.ai.chunx.service.chunking.semantic;

import com.flamingo.ai.chunx.service.chunking.Statistics;
import com.flamingo.ai.chunx.service.chunking.model.Chunk;
import java.util.ArrayList;
import java.util.List;

/** Similarity scoring and partitioning of a sentence sequence. */
final class SimilarityGroups {

  /**
   * Half-open range of sentence indices.
   *
   * @param start first sentence
   * @param end one past the last sentence
   */
  record Range(int start, int end) {

    int size() {
      return end - start;
    }
  }

  private SimilarityGroups() {}

  /** Cosine similarity of every adjacent pair of sentence embeddings. */
  static double[] pairwiseSimilarities(List<Chunk> sentences) {
    double[] similarities = new double[Math.max(0, sentences.size() - 1)];
    for (int i = 0; i + 1 < sentences.size(); i++) {
      similarities[i] =
          Statistics.cosineSimilarity(
              sentences.get(i).embedding(), sentences.get(i + 1).embedding());
    }
    return similarities;
  }

  /**
   * Per-sentence mean of the similarities to its neighbours. The first and last sentence have one
   * neighbour only.
   */
  static double[] averageNeighbourScores(double[] pairwise, int sentenceCount) {
    double[] sums = new double[sentenceCount];
    int[] counts = new int[sentenceCount];
    for (int i = 0; i < pairwise.length; i++) {
      sums[i] += pairwise[i];
      counts[i]++;
      sums[i + 1] += pairwise[i];
      counts[i + 1]++;
    }
    double[] averages = new double[sentenceCount];
    for (int i = 0; i < sentenceCount; i++) {
      averages[i] = counts[i] == 0 ? 1.0 : sums[i] / counts[i];
    }
    return averages;
  }

  /**
   * Cuts after every sentence whose score is {@code <= threshold} and keeps only ranges of at
   * least {@code minSentences} sentences. Dropped ranges are not merged into their neighbours.
   */
  static List<Range> splitRanges(double[] scores, double threshold, int minSentences) {
    List<Range> ranges = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < scores.length; i++) {
      boolean last = i == scores.length - 1;
      if (last || scores[i] <= threshold) {
        Range range = new Range(start, i + 1);
        if (range.size() >= minSentences) {
          ranges.add(range);
        }
        start = i + 1;
      }
    }
    return ranges;
  }

  static int tokenTotal(List<Chunk> sentences, Range range) {
    int total = 0;
    for (int i = range.start(); i < range.end(); i++) {
      total += sentences.get(i).tokenCount();
    }
    return total;
  }
}
