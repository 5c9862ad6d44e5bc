package com.flamingo.ai.labmatch.service.similarity;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/** Splits comma-separated term lists such as certifications or tech stacks. */
final class TermLists {

  private TermLists() {}

  /** Trimmed, non-empty terms in input order. */
  static List<String> split(String text) {
    List<String> terms = new ArrayList<>();
    for (String term : text.split("[,\\n;]")) {
      String trimmed = term.strip();
      if (!trimmed.isEmpty()) {
        terms.add(trimmed);
      }
    }
    return terms;
  }

  /** Lowercased distinct terms in input order. */
  static List<String> splitDistinctLower(String text) {
    LinkedHashSet<String> terms = new LinkedHashSet<>();
    for (String term : split(text)) {
      terms.add(term.toLowerCase(Locale.ROOT));
    }
    return List.copyOf(terms);
  }
}
