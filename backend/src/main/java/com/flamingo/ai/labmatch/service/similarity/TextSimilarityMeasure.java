package com.flamingo.ai.labmatch.service.similarity;

/**
 * Base for narrative and categorical measures. Handles absent values uniformly: a blank reference
 * yields the neutral default, a blank subject against a present reference yields zero.
 */
public abstract class TextSimilarityMeasure implements SimilarityMeasure {

  @Override
  public final CriterionScore calculate(
      String subject, String reference, SimilarityOptions options) {
    if (isBlank(reference)) {
      return CriterionScore.neutralDefault(isBlank(subject) ? "both_empty" : "reference_empty");
    }
    if (isBlank(subject)) {
      return CriterionScore.missing("subject_empty");
    }
    return compare(subject.strip(), reference.strip(), options);
  }

  /** Compares two non-blank, stripped values. */
  protected abstract CriterionScore compare(
      String subject, String reference, SimilarityOptions options);

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
