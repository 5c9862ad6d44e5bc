package com.flamingo.ai.labmatch.service.retrieval;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Whitespace and punctuation tokenizer with stopword removal. Shared by the lexical index and the
 * keyword-overlap similarity measures so both see the same vocabulary.
 */
public final class TextTokenizer {

  private static final int MIN_TOKEN_LENGTH = 2;

  private static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "doing", "would", "could", "might", "must",
          "shall", "may", "about", "above", "after", "again", "against", "before", "below",
          "between", "down", "during", "into", "over", "through", "under", "until", "up", "while",
          "am", "i", "me", "my", "we", "our", "you", "your", "him", "her", "them", "their", "if",
          "then", "also", "here", "there", "these", "those", "else", "any", "many", "much", "even",
          // Korean function words
          "및", "등", "또는", "그리고", "통한", "위한", "대한", "관한", "있는", "있습니다", "합니다",
          "하는", "저는", "우리", "에서", "으로", "있으며", "하며");

  private TextTokenizer() {}

  /** Lowercases and splits on anything that is not a letter or digit, dropping stopwords. */
  public static List<String> tokenize(String text) {
    if (text == null || text.isBlank()) {
      return List.of();
    }
    // \\p{L} = any Unicode letter (including Korean), \\p{N} = any Unicode number
    String[] words = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
    List<String> tokens = new ArrayList<>(words.length);
    for (String word : words) {
      if (word.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(word)) {
        tokens.add(word);
      }
    }
    return tokens;
  }

  public static Set<String> tokenSet(String text) {
    return new LinkedHashSet<>(tokenize(text));
  }

  /** Jaccard overlap of two token sets; 0 when both are empty. */
  public static double jaccard(Set<String> a, Set<String> b) {
    if (a.isEmpty() && b.isEmpty()) {
      return 0.0;
    }
    int intersection = 0;
    for (String token : a) {
      if (b.contains(token)) {
        intersection++;
      }
    }
    int union = a.size() + b.size() - intersection;
    return (double) intersection / union;
  }
}
