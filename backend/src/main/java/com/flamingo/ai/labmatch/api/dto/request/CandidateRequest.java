package com.flamingo.ai.labmatch.api.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for stage-1 candidate generation only. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateRequest {

  @Size(max = 2000, message = "Query must not exceed 2000 characters")
  private String query;

  @Min(value = 1, message = "topK must be at least 1")
  @Max(value = 100, message = "topK must be at most 100")
  private Integer topK;
}
