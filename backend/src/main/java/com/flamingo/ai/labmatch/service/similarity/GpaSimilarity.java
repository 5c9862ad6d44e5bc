package com.flamingo.ai.labmatch.service.similarity;

import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * GPA against an expected value. Meeting it earns 1.0; a shortfall decays linearly to 0.0 at the
 * maximum acceptable gap. GPAs written as {@code "3.8/4.3"} are rescaled to the configured scale.
 */
@Component
public class GpaSimilarity implements SimilarityMeasure {

  @Override
  public CriterionScore calculate(String subject, String reference, SimilarityOptions options) {
    double scaleMax = options.getGpaScaleMax();
    Optional<Double> gpa = parse(subject, scaleMax);
    if (gpa.isEmpty()) {
      return CriterionScore.invalid("unparseable_gpa");
    }
    Optional<Double> expected = parse(reference, scaleMax);
    if (expected.isEmpty()) {
      return CriterionScore.invalid("unparseable_expected_gpa");
    }

    double gap = expected.get() - gpa.get();
    Map<String, Object> details = Map.of("gpa", gpa.get(), "expected", expected.get(), "gap", gap);
    if (gap <= 0) {
      return new CriterionScore(1.0, "meets_expectation", details);
    }
    double maxGap = options.getGpaMaxGap();
    if (gap >= maxGap) {
      return new CriterionScore(0.0, "beyond_max_gap", details);
    }
    return new CriterionScore(1.0 - gap / maxGap, "linear_decay", details);
  }

  /** Parses a GPA in [0, scaleMax]; anything else is unparseable. */
  static Optional<Double> parse(String value, double scaleMax) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    try {
      String[] parts = value.strip().split("\\s*/\\s*");
      double gpa = Double.parseDouble(parts[0]);
      if (parts.length == 2) {
        double outOf = Double.parseDouble(parts[1]);
        if (outOf <= 0) {
          return Optional.empty();
        }
        gpa = gpa / outOf * scaleMax;
      } else if (parts.length > 2) {
        return Optional.empty();
      }
      return gpa < 0 || gpa > scaleMax || Double.isNaN(gpa) ? Optional.empty() : Optional.of(gpa);
    } catch (NumberFormatException e) {
      return Optional.empty();
    }
  }
}
