package com.flamingo.ai.labmatch.service.recommend;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.enums.FitnessLevel;
import com.flamingo.ai.labmatch.domain.model.Query;
import com.flamingo.ai.labmatch.domain.model.StructuredProfile;
import com.flamingo.ai.labmatch.exception.UnknownPresetException;
import com.flamingo.ai.labmatch.service.rerank.RerankingScorer;
import com.flamingo.ai.labmatch.service.rerank.ScorerConfiguration;
import com.flamingo.ai.labmatch.service.rerank.ScorerPreset;
import com.flamingo.ai.labmatch.service.retrieval.CandidateGenerator;
import com.flamingo.ai.labmatch.service.retrieval.CandidateScoreRecord;
import com.flamingo.ai.labmatch.support.TestScores;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecommendationService Tests")
class RecommendationServiceTest {

  private static final ScorerConfiguration DEFAULT = ScorerPreset.DEFAULT.getConfiguration();

  @Mock private CandidateGenerator candidateGenerator;
  @Mock private RerankingScorer rerankingScorer;

  private MatchingConfig matchingConfig;
  private RecommendationService recommendationService;

  @BeforeEach
  void setUp() {
    matchingConfig = new MatchingConfig();
    recommendationService =
        new RecommendationService(candidateGenerator, rerankingScorer, matchingConfig);
  }

  @Nested
  @DisplayName("recommend")
  class Recommend {

    @Test
    @DisplayName("Should rank results and label fitness")
    void shouldRankAndLabel() {
      List<CandidateScoreRecord> candidates =
          List.of(
              TestScores.candidate("a", 0, 0.9),
              TestScores.candidate("b", 1, 0.7),
              TestScores.candidate("c", 2, 0.5));
      Query query = Query.of("robot vision");
      when(candidateGenerator.generate(query)).thenReturn(candidates);
      when(rerankingScorer.rerank(any(StructuredProfile.class), eq(candidates), eq(DEFAULT), eq(3)))
          .thenReturn(
              List.of(
                  TestScores.finalScore("b", 0.8, 0.7),
                  TestScores.finalScore("a", 0.6, 0.9),
                  TestScores.finalScore("c", 0.35, 0.5)));

      List<Recommendation> result =
          recommendationService.recommend(query, StructuredProfile.empty(), DEFAULT, 3);

      assertThat(result).extracting(Recommendation::rank).containsExactly(1, 2, 3);
      assertThat(result)
          .extracting(r -> r.score().getEntity().getId())
          .containsExactly("b", "a", "c");
      assertThat(result)
          .extracting(Recommendation::fitnessLevel)
          .containsExactly(FitnessLevel.VERY_HIGH, FitnessLevel.HIGH, FitnessLevel.LOW);
    }

    @Test
    @DisplayName("Should use the interest statement when the query is blank")
    void shouldFallBackToInterestStatement() {
      StructuredProfile profile =
          StructuredProfile.builder().interestStatement("power electronics").build();
      when(candidateGenerator.generate(Query.of("power electronics"))).thenReturn(List.of());

      assertThat(recommendationService.recommend(Query.of(" "), profile, DEFAULT, 5)).isEmpty();
      verify(candidateGenerator).generate(Query.of("power electronics"));
    }

    @Test
    @DisplayName("Should skip reranking when stage 1 finds nothing")
    void shouldSkipRerankingWithoutCandidates() {
      when(candidateGenerator.generate(any(Query.class))).thenReturn(List.of());

      assertThat(
              recommendationService.recommend(
                  Query.of("quantum"), StructuredProfile.empty(), DEFAULT, 5))
          .isEmpty();
      verifyNoInteractions(rerankingScorer);
    }

    @Test
    @DisplayName("Should return empty when every candidate falls below the threshold")
    void shouldReturnEmptyWhenAllBelowThreshold() {
      when(candidateGenerator.generate(any(Query.class)))
          .thenReturn(List.of(TestScores.candidate("a", 0, 0.9)));
      when(rerankingScorer.rerank(any(), anyList(), any(), eq(5))).thenReturn(List.of());

      assertThat(
              recommendationService.recommend(
                  Query.of("robot"), StructuredProfile.empty(), DEFAULT, 5))
          .isEmpty();
    }
  }

  @Nested
  @DisplayName("Request resolution")
  class RequestResolution {

    @Test
    @DisplayName("Should resolve presets by name with configured default")
    void shouldResolvePresets() {
      assertThat(recommendationService.resolvePreset(null)).isSameAs(DEFAULT);
      assertThat(recommendationService.resolvePreset(" ")).isSameAs(DEFAULT);
      assertThat(recommendationService.resolvePreset("skill"))
          .isSameAs(ScorerPreset.SKILL_FOCUSED.getConfiguration());

      matchingConfig.getReranking().setDefaultPreset("academic");
      assertThat(recommendationService.resolvePreset(null))
          .isSameAs(ScorerPreset.ACADEMIC_FOCUSED.getConfiguration());
    }

    @Test
    @DisplayName("Should reject unknown presets")
    void shouldRejectUnknownPresets() {
      assertThatThrownBy(() -> recommendationService.resolvePreset("nope"))
          .isInstanceOf(UnknownPresetException.class);
    }

    @Test
    @DisplayName("Should clamp topK")
    void shouldClampTopK() {
      assertThat(recommendationService.resolveTopK(null)).isEqualTo(5);
      assertThat(recommendationService.resolveTopK(0)).isEqualTo(1);
      assertThat(recommendationService.resolveTopK(500)).isEqualTo(50);
      assertThat(recommendationService.resolveTopK(7)).isEqualTo(7);
    }
  }
}
