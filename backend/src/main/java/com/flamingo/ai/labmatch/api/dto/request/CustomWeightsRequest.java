package com.flamingo.ai.labmatch.api.dto.request;

import com.flamingo.ai.labmatch.service.rerank.CategoricalWeights;
import com.flamingo.ai.labmatch.service.rerank.NumericWeights;
import com.flamingo.ai.labmatch.service.rerank.ScorerConfiguration;
import com.flamingo.ai.labmatch.service.rerank.SentenceWeights;
import com.flamingo.ai.labmatch.service.rerank.TierWeights;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for a custom scorer configuration. Unset values are taken from the base preset;
 * every weight group that results must still sum to 1.0.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CustomWeightsRequest {

  // Tier weights
  private Double sentence;
  private Double categorical;
  private Double numeric;

  // Sentence tier
  private Double interest;
  private Double experience;
  private Double goal;
  private Double portfolio;

  // Categorical tier
  private Double major;
  private Double certifications;
  private Double awards;
  private Double techStack;

  // Numeric tier
  private Double languageScore;
  private Double proficiency;
  private Double gpa;

  private Double minScoreThreshold;

  /** Applies the overrides on top of a base configuration. */
  public ScorerConfiguration applyTo(ScorerConfiguration base) {
    TierWeights tier = base.getTierWeights();
    SentenceWeights sw = base.getSentenceWeights();
    CategoricalWeights cw = base.getCategoricalWeights();
    NumericWeights nw = base.getNumericWeights();
    return base.toBuilder()
        .name("custom")
        .tierWeights(
            new TierWeights(
                or(sentence, tier.sentence()),
                or(categorical, tier.categorical()),
                or(numeric, tier.numeric())))
        .sentenceWeights(
            new SentenceWeights(
                or(interest, sw.interest()),
                or(experience, sw.experience()),
                or(goal, sw.goal()),
                or(portfolio, sw.portfolio())))
        .categoricalWeights(
            new CategoricalWeights(
                or(major, cw.major()),
                or(certifications, cw.certifications()),
                or(awards, cw.awards()),
                or(techStack, cw.techStack())))
        .numericWeights(
            new NumericWeights(
                or(languageScore, nw.languageScore()),
                or(proficiency, nw.proficiency()),
                or(gpa, nw.gpa())))
        .minScoreThreshold(or(minScoreThreshold, base.getMinScoreThreshold()))
        .build();
  }

  private static double or(Double value, double fallback) {
    return value == null ? fallback : value;
  }
}
