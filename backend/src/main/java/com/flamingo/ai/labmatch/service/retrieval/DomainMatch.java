package com.flamingo.ai.labmatch.service.retrieval;

import java.util.Set;

/**
 * Result of matching a query against a candidate text.
 *
 * @param score mean per-category score over categories found on both sides, in [0, 1]
 * @param queryCategories categories whose variants appear in the query
 * @param candidateCategories categories whose variants appear in the candidate text
 * @param sharedCategories categories that contributed to the score
 */
public record DomainMatch(
    double score,
    Set<String> queryCategories,
    Set<String> candidateCategories,
    Set<String> sharedCategories) {

  public static DomainMatch none() {
    return new DomainMatch(0.0, Set.of(), Set.of(), Set.of());
  }

  /** True when both sides are categorized but share no category. */
  public boolean isDisjoint() {
    return !queryCategories.isEmpty()
        && !candidateCategories.isEmpty()
        && sharedCategories.isEmpty();
  }
}
