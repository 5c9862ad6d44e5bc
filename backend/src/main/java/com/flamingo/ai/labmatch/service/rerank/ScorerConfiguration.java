package com.flamingo.ai.labmatch.service.rerank;

import com.flamingo.ai.labmatch.exception.InvalidScorerConfigurationException;
import com.flamingo.ai.labmatch.service.similarity.SimilarityOptions;
import lombok.Builder;
import lombok.Getter;

/**
 * Immutable weight tree and auxiliary parameters for the reranking scorer.
 *
 * <p>Every weight group sums to 1.0 within 0.01; the groups validate on construction and this
 * class validates the remaining parameters, so an instance is always usable. Start from {@link
 * #builder()}, which is pre-filled with the default preset's values.
 */
@Getter
public final class ScorerConfiguration {

  private final String name;
  private final TierWeights tierWeights;
  private final SentenceWeights sentenceWeights;
  private final CategoricalWeights categoricalWeights;
  private final NumericWeights numericWeights;
  private final SimilarityOptions similarityOptions;

  /** Candidates whose final score falls below this value are dropped. */
  private final double minScoreThreshold;

  private final String requiredLanguageScore;
  private final String requiredProficiency;
  private final String expectedGpa;

  @Builder(toBuilder = true)
  private ScorerConfiguration(
      String name,
      TierWeights tierWeights,
      SentenceWeights sentenceWeights,
      CategoricalWeights categoricalWeights,
      NumericWeights numericWeights,
      SimilarityOptions similarityOptions,
      double minScoreThreshold,
      String requiredLanguageScore,
      String requiredProficiency,
      String expectedGpa) {
    this.name = requireText("name", name);
    this.tierWeights = requireGroup("tier", tierWeights);
    this.sentenceWeights = requireGroup("sentence", sentenceWeights);
    this.categoricalWeights = requireGroup("categorical", categoricalWeights);
    this.numericWeights = requireGroup("numeric", numericWeights);
    this.similarityOptions = validate(requireGroup("options", similarityOptions));
    if (!(minScoreThreshold >= 0 && minScoreThreshold <= 1)) {
      throw new InvalidScorerConfigurationException(
          "threshold", "minimum score threshold must be within [0, 1]: " + minScoreThreshold);
    }
    this.minScoreThreshold = minScoreThreshold;
    this.requiredLanguageScore = requireText("requiredLanguageScore", requiredLanguageScore);
    this.requiredProficiency = requireText("requiredProficiency", requiredProficiency);
    this.expectedGpa = requireText("expectedGpa", expectedGpa);
  }

  /** A builder pre-filled with the default weights and requirements. */
  public static ScorerConfigurationBuilder builder() {
    return new ScorerConfigurationBuilder()
        .name("custom")
        .tierWeights(new TierWeights(0.6, 0.3, 0.1))
        .sentenceWeights(new SentenceWeights(0.3, 0.25, 0.2, 0.25))
        .categoricalWeights(new CategoricalWeights(0.35, 0.25, 0.2, 0.2))
        .numericWeights(new NumericWeights(0.3, 0.3, 0.4))
        .similarityOptions(SimilarityOptions.defaults())
        .minScoreThreshold(0.3)
        .requiredLanguageScore("800")
        .requiredProficiency("중")
        .expectedGpa("3.5");
  }

  private static SimilarityOptions validate(SimilarityOptions options) {
    Weights.requireUnitSum(
        "techStack", options.getTechJaccardWeight(), options.getTechEmbeddingWeight());
    requireUnit("keywordWeight", options.getKeywordWeight());
    if (!(options.getLanguageMinRatio() >= 0 && options.getLanguageMinRatio() < 1)) {
      throw new InvalidScorerConfigurationException(
          "options", "languageMinRatio must be within [0, 1): " + options.getLanguageMinRatio());
    }
    if (options.getChunkSize() <= 0 || options.getTfidfThreshold() < 0) {
      throw new InvalidScorerConfigurationException(
          "options", "chunkSize must be positive and tfidfThreshold non-negative");
    }
    if (!(options.getGpaMaxGap() > 0) || !(options.getGpaScaleMax() > 0)) {
      throw new InvalidScorerConfigurationException(
          "options", "gpaMaxGap and gpaScaleMax must be positive");
    }
    return options;
  }

  private static void requireUnit(String field, double value) {
    if (!(value >= 0 && value <= 1)) {
      throw new InvalidScorerConfigurationException(
          "options", field + " must be within [0, 1]: " + value);
    }
  }

  private static <T> T requireGroup(String group, T value) {
    if (value == null) {
      throw new InvalidScorerConfigurationException(group, group + " weights are required");
    }
    return value;
  }

  private static String requireText(String field, String value) {
    if (value == null || value.isBlank()) {
      throw new InvalidScorerConfigurationException(field, field + " must not be blank");
    }
    return value;
  }
}
