package com.flamingo.ai.labmatch.service.retrieval;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scores topical overlap between a query and a candidate using the domain taxonomy. Variants are
 * matched case-insensitively. Hangul variants match as substrings so Korean words followed by
 * particles still count. Other variants match whole words only, with an optional plural "s".
 */
@Component
public class DomainTaxonomyMatcher {

  // A third of a category's variants appearing is already a full match
  private static final double MATCH_RATIO_BOOST = 3.0;

  private static final Pattern HANGUL = Pattern.compile("\\p{IsHangul}");

  private final DomainTaxonomy taxonomy;
  private final Map<DomainTaxonomy.Category, List<Predicate<String>>> variantMatchers =
      new IdentityHashMap<>();

  public DomainTaxonomyMatcher(DomainTaxonomy taxonomy) {
    this.taxonomy = taxonomy;
    for (DomainTaxonomy.Category category : taxonomy.getCategories()) {
      variantMatchers.put(
          category,
          category.variants().stream().map(DomainTaxonomyMatcher::matcherFor).toList());
    }
  }

  /** Names of categories with at least one variant present in the text, in taxonomy order. */
  public Set<String> categoriesIn(String text) {
    if (text == null || text.isBlank()) {
      return Set.of();
    }
    String lower = text.toLowerCase(Locale.ROOT);
    Set<String> found = new LinkedHashSet<>();
    for (DomainTaxonomy.Category category : taxonomy.getCategories()) {
      if (countVariants(category, lower) > 0) {
        found.add(category.name());
      }
    }
    return Collections.unmodifiableSet(found);
  }

  public DomainMatch match(String queryText, String candidateText) {
    Set<String> queryCategories = categoriesIn(queryText);
    Set<String> candidateCategories = categoriesIn(candidateText);
    if (queryCategories.isEmpty() || candidateCategories.isEmpty()) {
      return new DomainMatch(0.0, queryCategories, candidateCategories, Set.of());
    }

    String candidateLower = candidateText.toLowerCase(Locale.ROOT);
    Set<String> shared = new LinkedHashSet<>();
    double total = 0.0;
    for (DomainTaxonomy.Category category : taxonomy.getCategories()) {
      if (!queryCategories.contains(category.name())) {
        continue;
      }
      int candidateMatches = countVariants(category, candidateLower);
      if (candidateMatches == 0) {
        continue;
      }
      double matchRatio = (double) candidateMatches / category.variants().size();
      total += Math.min(matchRatio * MATCH_RATIO_BOOST, 1.0) * category.weight();
      shared.add(category.name());
    }
    double score = shared.isEmpty() ? 0.0 : total / shared.size();
    return new DomainMatch(
        score,
        queryCategories,
        candidateCategories,
        Collections.unmodifiableSet(shared));
  }

  private int countVariants(DomainTaxonomy.Category category, String lowerText) {
    int count = 0;
    for (Predicate<String> variant : variantMatchers.get(category)) {
      if (variant.test(lowerText)) {
        count++;
      }
    }
    return count;
  }

  static Predicate<String> matcherFor(String variant) {
    if (HANGUL.matcher(variant).find()) {
      return text -> text.contains(variant);
    }
    Pattern word =
        Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(variant) + "s?(?![\\p{L}\\p{N}])");
    return text -> word.matcher(text).find();
  }
}
