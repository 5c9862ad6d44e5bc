package com.flamingo.ai.labmatch.service.similarity;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Spoken proficiency level against a required level. Levels map onto a fixed ladder; a shortfall
 * decays in bands by gap size.
 */
@Component
public class ProficiencySimilarity implements SimilarityMeasure {

  private static final Map<String, Double> LEVELS = new LinkedHashMap<>();

  static {
    LEVELS.put("상", 1.0);
    LEVELS.put("중상", 0.85);
    LEVELS.put("중", 0.7);
    LEVELS.put("중하", 0.55);
    LEVELS.put("하", 0.4);
    LEVELS.put("native", 1.0);
    LEVELS.put("fluent", 1.0);
    LEVELS.put("advanced", 0.85);
    LEVELS.put("intermediate", 0.7);
    LEVELS.put("beginner", 0.4);
  }

  private static final double BAND_EPSILON = 1e-9;

  @Override
  public CriterionScore calculate(String subject, String reference, SimilarityOptions options) {
    Optional<Double> level = levelOf(subject);
    if (level.isEmpty()) {
      return CriterionScore.invalid("unknown_level");
    }
    Optional<Double> required = levelOf(reference);
    if (required.isEmpty()) {
      return CriterionScore.invalid("unknown_required_level");
    }

    double gap = required.get() - level.get();
    Map<String, Object> details =
        Map.of("level", level.get(), "required", required.get(), "gap", gap);
    if (gap <= BAND_EPSILON) {
      return new CriterionScore(1.0, "meets_requirement", details);
    }
    return new CriterionScore(bandScore(gap), "gap_band", details);
  }

  static double bandScore(double gap) {
    if (gap <= 0.15 + BAND_EPSILON) {
      return 0.9;
    }
    if (gap <= 0.3 + BAND_EPSILON) {
      return 0.7;
    }
    if (gap <= 0.45 + BAND_EPSILON) {
      return 0.4;
    }
    return 0.0;
  }

  /** Exact label first, then the longest known label contained in the text. */
  static Optional<Double> levelOf(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.strip().toLowerCase(Locale.ROOT);
    Double exact = LEVELS.get(normalized);
    if (exact != null) {
      return Optional.of(exact);
    }
    String bestLabel = null;
    for (String label : LEVELS.keySet()) {
      boolean longer = bestLabel == null || label.length() > bestLabel.length();
      if (longer && normalized.contains(label)) {
        bestLabel = label;
      }
    }
    return bestLabel == null ? Optional.empty() : Optional.of(LEVELS.get(bestLabel));
  }
}
