package com.flamingo.ai.chunx.service.chunking;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;
import org.springframework.stereotype.Component;

/**
 * Splits text into sentence fragments at configurable delimiters.
 *
 * <p>The text is cut immediately after every occurrence of every delimiter, so each delimiter
 * stays at the end of its fragment and whitespace after it opens the next one. Only empty
 * fragments are discarded: the fragments always concatenate back to the input.
 */
@Component
public class SentenceSplitter {

  /**
   * Cuts {@code text} after each delimiter occurrence.
   *
   * @param text the text to split
   * @param delimiters non-empty delimiters
   * @return non-empty fragments in source order
   */
  public List<String> split(String text, List<String> delimiters) {
    TreeSet<Integer> cuts = new TreeSet<>();
    for (String delimiter : delimiters) {
      int from = 0;
      int at;
      while ((at = text.indexOf(delimiter, from)) >= 0) {
        from = at + delimiter.length();
        cuts.add(from);
      }
    }
    cuts.add(text.length());

    List<String> fragments = new ArrayList<>();
    int start = 0;
    for (int cut : cuts) {
      if (cut > start) {
        fragments.add(text.substring(start, cut));
      }
      start = cut;
    }
    return fragments;
  }

  /**
   * Glues short fragments onto the fragment accumulated before them in one left-to-right pass. A
   * short fragment with nothing before it seeds the first accumulated fragment; the next long
   * fragment still starts a fragment of its own.
   *
   * @param fragments fragments in source order
   * @param isShort decides whether a fragment is too short to stand alone
   * @return merged fragments, still concatenating to the same text
   */
  public List<String> mergeShort(List<String> fragments, Predicate<String> isShort) {
    List<String> merged = new ArrayList<>();
    for (String fragment : fragments) {
      if (isShort.test(fragment) && !merged.isEmpty()) {
        int last = merged.size() - 1;
        merged.set(last, merged.get(last) + fragment);
      } else {
        merged.add(fragment);
      }
    }
    return merged;
  }
}
