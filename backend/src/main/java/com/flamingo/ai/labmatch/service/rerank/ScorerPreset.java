package com.flamingo.ai.labmatch.service.rerank;

import com.flamingo.ai.labmatch.exception.UnknownPresetException;
import java.util.Locale;

/** Named, immutable scorer configurations. */
public enum ScorerPreset {
  DEFAULT("default", ScorerConfiguration.builder().name("default").build()),

  RESEARCH_FOCUSED(
      "research",
      ScorerConfiguration.builder()
          .name("research")
          .tierWeights(new TierWeights(0.5, 0.3, 0.2))
          .sentenceWeights(new SentenceWeights(0.4, 0.2, 0.2, 0.2))
          .build()),

  SKILL_FOCUSED(
      "skill",
      ScorerConfiguration.builder()
          .name("skill")
          .tierWeights(new TierWeights(0.3, 0.45, 0.25))
          .categoricalWeights(new CategoricalWeights(0.25, 0.25, 0.15, 0.35))
          .build()),

  ACADEMIC_FOCUSED(
      "academic",
      ScorerConfiguration.builder()
          .name("academic")
          .tierWeights(new TierWeights(0.3, 0.3, 0.4))
          .numericWeights(new NumericWeights(0.25, 0.25, 0.5))
          .build());

  private final String key;
  private final ScorerConfiguration configuration;

  ScorerPreset(String key, ScorerConfiguration configuration) {
    this.key = key;
    this.configuration = configuration;
  }

  public String getKey() {
    return key;
  }

  public ScorerConfiguration getConfiguration() {
    return configuration;
  }

  /**
   * Looks up a preset by its short key ("research") or enum name ("RESEARCH_FOCUSED"),
   * case-insensitively.
   *
   * @throws UnknownPresetException if nothing matches
   */
  public static ScorerPreset fromName(String name) {
    if (name != null) {
      String normalized = name.strip().toLowerCase(Locale.ROOT).replace('-', '_');
      for (ScorerPreset preset : values()) {
        if (preset.key.equals(normalized)
            || preset.name().toLowerCase(Locale.ROOT).equals(normalized)) {
          return preset;
        }
      }
    }
    throw new UnknownPresetException(name);
  }
}
