package com.flamingo.ai.labmatch.api.dto.response;

import com.flamingo.ai.labmatch.service.rerank.CategoricalWeights;
import com.flamingo.ai.labmatch.service.rerank.NumericWeights;
import com.flamingo.ai.labmatch.service.rerank.ScorerConfiguration;
import com.flamingo.ai.labmatch.service.rerank.ScorerPreset;
import com.flamingo.ai.labmatch.service.rerank.SentenceWeights;
import com.flamingo.ai.labmatch.service.rerank.TierWeights;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO describing a scorer preset's weight tree. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PresetResponse {

  private String name;
  private String preset;
  private TierWeights tierWeights;
  private SentenceWeights sentenceWeights;
  private CategoricalWeights categoricalWeights;
  private NumericWeights numericWeights;
  private double minScoreThreshold;

  public static PresetResponse fromPreset(ScorerPreset preset) {
    ScorerConfiguration configuration = preset.getConfiguration();
    return PresetResponse.builder()
        .name(preset.getKey())
        .preset(preset.name())
        .tierWeights(configuration.getTierWeights())
        .sentenceWeights(configuration.getSentenceWeights())
        .categoricalWeights(configuration.getCategoricalWeights())
        .numericWeights(configuration.getNumericWeights())
        .minScoreThreshold(configuration.getMinScoreThreshold())
        .build();
  }
}
