package com.flamingo.ai.labmatch.api.dto.response;

import com.flamingo.ai.labmatch.domain.enums.FitnessLevel;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.service.recommend.Recommendation;
import com.flamingo.ai.labmatch.service.rerank.FinalScore;
import com.flamingo.ai.labmatch.service.rerank.ScoreField;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Response DTO for a ranked recommendation.
 *
 * <p>{@code fieldScores} always holds twelve entries: the eleven profile criteria followed by
 * {@code retrieval}, the stage-1 combined score.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

  public static final String RETRIEVAL_FIELD = "retrieval";

  private int rank;
  private String labId;
  private String name;
  private String owner;
  private String contact;
  private String department;
  private String homepage;
  private String description;
  private double finalScore;
  private FitnessLevel fitnessLevel;
  private Map<String, Double> tierScores;
  private Map<String, FieldScoreResponse> fieldScores;

  public static RecommendationResponse fromRecommendation(Recommendation recommendation) {
    FinalScore score = recommendation.score();
    CorpusEntity entity = score.getEntity();

    Map<String, Double> tiers = new LinkedHashMap<>();
    tiers.put("sentence", score.getSentenceScore());
    tiers.put("categorical", score.getCategoricalScore());
    tiers.put("numeric", score.getNumericScore());

    Map<String, FieldScoreResponse> fields = new LinkedHashMap<>();
    for (ScoreField field : ScoreField.values()) {
      fields.put(field.getKey(), FieldScoreResponse.fromCriterion(score.field(field)));
    }
    fields.put(
        RETRIEVAL_FIELD,
        FieldScoreResponse.builder()
            .score(score.getRetrievalScore())
            .method("stage1_combined")
            .details(Map.of())
            .build());

    return RecommendationResponse.builder()
        .rank(recommendation.rank())
        .labId(entity.getId())
        .name(entity.getName())
        .owner(entity.getOwner())
        .contact(entity.getContact())
        .department(entity.getDepartment())
        .homepage(entity.getHomepage())
        .description(entity.getDescription())
        .finalScore(score.getFinalScore())
        .fitnessLevel(recommendation.fitnessLevel())
        .tierScores(tiers)
        .fieldScores(fields)
        .build();
  }
}
