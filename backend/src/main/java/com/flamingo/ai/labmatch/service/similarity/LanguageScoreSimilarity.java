package com.flamingo.ai.labmatch.service.similarity;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Language test score against a required threshold. Scores at or above the threshold earn 1.0;
 * below it the ratio {@code subject / required} is scaled linearly from the minimum ratio (0.0)
 * to 1.0 (1.0). Accepts numeric scores and OPIc grades.
 */
@Component
public class LanguageScoreSimilarity implements SimilarityMeasure {

  /** OPIc grades on a TOEIC-like scale. */
  private static final Map<String, Double> OPIC_GRADES =
      Map.of(
          "AL", 990.0,
          "IH", 900.0,
          "IM3", 850.0,
          "IM2", 800.0,
          "IM1", 750.0,
          "IL", 700.0,
          "NH", 650.0,
          "NM", 600.0,
          "NL", 550.0);

  @Override
  public CriterionScore calculate(String subject, String reference, SimilarityOptions options) {
    Optional<Double> score = parse(subject);
    if (score.isEmpty()) {
      return CriterionScore.invalid("unparseable_score");
    }
    Optional<Double> required = parse(reference);
    if (required.isEmpty() || required.get() <= 0) {
      return CriterionScore.invalid("unparseable_requirement");
    }

    double ratio = score.get() / required.get();
    Map<String, Object> details =
        Map.of("score", score.get(), "required", required.get(), "ratio", ratio);
    if (score.get() >= required.get()) {
      return new CriterionScore(1.0, "meets_requirement", details);
    }
    double minRatio = options.getLanguageMinRatio();
    if (ratio < minRatio) {
      return new CriterionScore(0.0, "below_minimum", details);
    }
    return new CriterionScore(
        CriterionScore.unitInterval((ratio - minRatio) / (1.0 - minRatio)),
        "linear_scaled",
        details);
  }

  static Optional<Double> parse(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.strip().toUpperCase(Locale.ROOT);
    Double grade = OPIC_GRADES.get(normalized);
    if (grade != null) {
      return Optional.of(grade);
    }
    try {
      double parsed = Double.parseDouble(normalized);
      return parsed < 0 || Double.isNaN(parsed) || Double.isInfinite(parsed)
          ? Optional.empty()
          : Optional.of(parsed);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
