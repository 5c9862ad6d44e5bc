package com.flamingo.ai.labmatch.service.rerank;

import com.flamingo.ai.labmatch.exception.InvalidScorerConfigurationException;
import java.util.Locale;

/** Validation shared by every weight group. */
final class Weights {

  static final double SUM_TOLERANCE = 0.01;

  // Lets sums such as 0.3 + 0.3 + 0.4 sit exactly on the tolerance edge
  private static final double ROUNDING = 1e-9;

  private Weights() {}

  /**
   * Requires each weight to lie in [0, 1] and the group to sum to 1.0 within tolerance. Invalid
   * groups are rejected, never renormalized.
   */
  static void requireUnitSum(String group, double... weights) {
    double sum = 0.0;
    for (double weight : weights) {
      if (!Double.isFinite(weight) || weight < 0 || weight > 1) {
        throw new InvalidScorerConfigurationException(
            group, group + " weight out of range [0, 1]: " + weight);
      }
      sum += weight;
    }
    if (Math.abs(sum - 1.0) > SUM_TOLERANCE + ROUNDING) {
      throw new InvalidScorerConfigurationException(
          group,
          String.format(
              Locale.ROOT,
              "%s weights sum to %.4f, expected 1.0 ± %.2f",
              group,
              sum,
              SUM_TOLERANCE));
    }
  }
}
