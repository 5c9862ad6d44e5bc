package com.flamingo.ai.labmatch.api.dto.response;

import com.flamingo.ai.labmatch.service.similarity.CriterionScore;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one field-level score. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldScoreResponse {

  private double score;
  private String method;
  private Map<String, Object> details;

  public static FieldScoreResponse fromCriterion(CriterionScore criterion) {
    return FieldScoreResponse.builder()
        .score(criterion.score())
        .method(criterion.method())
        .details(criterion.details())
        .build();
  }
}
