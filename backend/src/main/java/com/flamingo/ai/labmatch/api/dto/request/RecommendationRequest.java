package com.flamingo.ai.labmatch.api.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for lab recommendations. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationRequest {

  /** Free-text research interest. Falls back to the profile's interest statement. */
  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  @Valid private ProfileRequest profile;

  /** Preset name: default, research, skill or academic. */
  private String preset;

  /** Optional overrides applied on top of the preset. */
  @Valid private CustomWeightsRequest weights;

  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 50, message = "topK must be at most 50")
  private Integer topK;
}
