package com.promptsmith.optimizer.service.evaluation;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;

/** Normalized string comparisons used by the built-in metrics. */
final class TextSimilarity {

  private static final CharMatcher PUNCTUATION =
      CharMatcher.anyOf("!\"#$%&'()*+,-./:;<=>?@[\\]^_`{|}~");
  private static final Splitter WORDS =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings().trimResults();

  private TextSimilarity() {}

  static String normalize(String text) {
    if (text == null) {
      return "";
    }
    String lower = text.toLowerCase(Locale.ROOT);
    return CharMatcher.whitespace().collapseFrom(PUNCTUATION.replaceFrom(lower, ' '), ' ').trim();
  }

  static List<String> tokens(String text) {
    return WORDS.splitToList(normalize(text));
  }

  static double exactMatch(String expected, String actual) {
    return normalize(expected).equals(normalize(actual)) ? 1.0 : 0.0;
  }

  /** Bag-of-words F1 between the two texts. */
  static double tokenF1(String expected, String actual) {
    List<String> gold = tokens(expected);
    List<String> predicted = tokens(actual);
    if (gold.isEmpty() || predicted.isEmpty()) {
      return gold.isEmpty() && predicted.isEmpty() ? 1.0 : 0.0;
    }
    Map<String, Integer> counts = new HashMap<>();
    gold.forEach(token -> counts.merge(token, 1, Integer::sum));
    int overlap = 0;
    for (String token : predicted) {
      Integer remaining = counts.get(token);
      if (remaining != null && remaining > 0) {
        overlap++;
        counts.put(token, remaining - 1);
      }
    }
    return f1(overlap, predicted.size(), gold.size());
  }

  /** ROUGE-L style F1 over the longest common token subsequence. */
  static double longestCommonSubsequenceF1(String expected, String actual) {
    List<String> gold = tokens(expected);
    List<String> predicted = tokens(actual);
    if (gold.isEmpty() || predicted.isEmpty()) {
      return gold.isEmpty() && predicted.isEmpty() ? 1.0 : 0.0;
    }
    int[][] table = new int[gold.size() + 1][predicted.size() + 1];
    for (int i = 1; i <= gold.size(); i++) {
      for (int j = 1; j <= predicted.size(); j++) {
        table[i][j] =
            gold.get(i - 1).equals(predicted.get(j - 1))
                ? table[i - 1][j - 1] + 1
                : Math.max(table[i - 1][j], table[i][j - 1]);
      }
    }
    return f1(table[gold.size()][predicted.size()], predicted.size(), gold.size());
  }

  private static double f1(int overlap, int predictedSize, int goldSize) {
    if (overlap == 0) {
      return 0.0;
    }
    double precision = (double) overlap / predictedSize;
    double recall = (double) overlap / goldSize;
    return 2 * precision * recall / (precision + recall);
  }
}
