package com.flamingo.ai.labmatch.service.similarity;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A bounded similarity score with the method that produced it and details for explainability.
 *
 * @param score value in [0, 1]
 * @param method how the score was computed, e.g. {@code "cosine"} or {@code "neutral_default"}
 * @param details intermediate values; never null
 */
public record CriterionScore(double score, String method, Map<String, Object> details) {

  public static final double NEUTRAL_SCORE = 0.5;

  public static final String NEUTRAL_DEFAULT = "neutral_default";
  public static final String INVALID = "invalid";
  public static final String MISSING = "missing";

  public CriterionScore {
    if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
      throw new IllegalArgumentException("Score must be within [0, 1]: " + score);
    }
    if (method == null || method.isBlank()) {
      throw new IllegalArgumentException("Score method must not be blank");
    }
    details =
        details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }

  /**
   * Bounds a weighted blend of unit scores to [0, 1]. Blends of in-range inputs can land a few
   * ulps outside the interval, which the constructor rejects.
   */
  public static double unitInterval(double blended) {
    return Math.max(0.0, Math.min(1.0, blended));
  }

  public static CriterionScore of(double score, String method) {
    return new CriterionScore(score, method, Map.of());
  }

  /** Both sides lack a value: neither penalize nor reward. */
  public static CriterionScore neutralDefault(String reason) {
    return new CriterionScore(NEUTRAL_SCORE, NEUTRAL_DEFAULT, Map.of("reason", reason));
  }

  /** The value is present but cannot be interpreted. */
  public static CriterionScore invalid(String reason) {
    return new CriterionScore(0.0, INVALID, Map.of("reason", reason));
  }

  /** The subject lacks a value the reference asks for. */
  public static CriterionScore missing(String reason) {
    return new CriterionScore(0.0, MISSING, Map.of("reason", reason));
  }
}
