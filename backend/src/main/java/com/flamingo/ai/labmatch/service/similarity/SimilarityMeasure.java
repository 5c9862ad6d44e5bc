package com.flamingo.ai.labmatch.service.similarity;

/**
 * Compares a student-side value with a lab-side or required value.
 *
 * <p>Implementations are stateless apart from the shared embedding cache and safe for concurrent
 * use.
 */
public interface SimilarityMeasure {

  /**
   * Computes the similarity.
   *
   * @param subject student-side value, possibly blank
   * @param reference lab-side or required value, possibly blank
   * @param options tuning parameters
   * @return a score in [0, 1]
   */
  CriterionScore calculate(String subject, String reference, SimilarityOptions options);

  default CriterionScore calculate(String subject, String reference) {
    return calculate(subject, reference, SimilarityOptions.defaults());
  }
}
