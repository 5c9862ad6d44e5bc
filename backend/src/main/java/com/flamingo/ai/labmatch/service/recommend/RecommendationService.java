package com.flamingo.ai.labmatch.service.recommend;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.enums.FitnessLevel;
import com.flamingo.ai.labmatch.domain.model.Query;
import com.flamingo.ai.labmatch.domain.model.StructuredProfile;
import com.flamingo.ai.labmatch.service.rerank.FinalScore;
import com.flamingo.ai.labmatch.service.rerank.RerankingScorer;
import com.flamingo.ai.labmatch.service.rerank.ScorerConfiguration;
import com.flamingo.ai.labmatch.service.rerank.ScorerPreset;
import com.flamingo.ai.labmatch.service.retrieval.CandidateGenerator;
import com.flamingo.ai.labmatch.service.retrieval.CandidateScoreRecord;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/** Runs stage 1 and stage 2 for a student and labels the results. */
@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationService {

  private final CandidateGenerator candidateGenerator;
  private final RerankingScorer rerankingScorer;
  private final MatchingConfig matchingConfig;

  /**
   * Recommends labs for a student.
   *
   * @param query free-text research interest; the profile's interest statement is used when blank
   * @param profile structured profile for reranking
   * @param configuration weights and thresholds for stage 2
   * @param topK maximum number of recommendations
   * @return ranked recommendations, possibly empty
   */
  @Timed(value = "matching.recommend", description = "Full recommendation pipeline")
  public List<Recommendation> recommend(
      Query query, StructuredProfile profile, ScorerConfiguration configuration, int topK) {
    Query effectiveQuery = query.isBlank() ? Query.of(profile.getInterestStatement()) : query;
    List<CandidateScoreRecord> candidates = candidateGenerator.generate(effectiveQuery);
    if (candidates.isEmpty()) {
      log.debug("No stage-1 candidates for '{}'", effectiveQuery.text());
      return List.of();
    }

    List<FinalScore> ranked = rerankingScorer.rerank(profile, candidates, configuration, topK);
    List<Recommendation> recommendations = new ArrayList<>(ranked.size());
    for (int i = 0; i < ranked.size(); i++) {
      FinalScore score = ranked.get(i);
      recommendations.add(new Recommendation(i + 1, score, FitnessLevel.of(score.getFinalScore())));
    }
    log.info(
        "Recommended {} of {} candidates using '{}'",
        recommendations.size(),
        candidates.size(),
        configuration.getName());
    return List.copyOf(recommendations);
  }

  /** Resolves a preset by name, falling back to the configured default when none is given. */
  public ScorerConfiguration resolvePreset(String presetName) {
    String name =
        presetName == null || presetName.isBlank()
            ? matchingConfig.getReranking().getDefaultPreset()
            : presetName;
    return ScorerPreset.fromName(name).getConfiguration();
  }

  /** Clamps a requested top-K into [1, max-top-k], using the default when absent. */
  public int resolveTopK(Integer requested) {
    MatchingConfig.Reranking settings = matchingConfig.getReranking();
    if (requested == null) {
      return settings.getDefaultTopK();
    }
    return Math.max(1, Math.min(requested, settings.getMaxTopK()));
  }
}
