package com.flamingo.ai.labmatch.service.rerank;

import com.flamingo.ai.labmatch.domain.enums.SectionType;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.domain.model.StructuredProfile;
import com.flamingo.ai.labmatch.service.retrieval.CandidateScoreRecord;
import com.flamingo.ai.labmatch.service.similarity.AwardSimilarity;
import com.flamingo.ai.labmatch.service.similarity.CertificationSimilarity;
import com.flamingo.ai.labmatch.service.similarity.CriterionScore;
import com.flamingo.ai.labmatch.service.similarity.GpaSimilarity;
import com.flamingo.ai.labmatch.service.similarity.LanguageScoreSimilarity;
import com.flamingo.ai.labmatch.service.similarity.MajorSimilarity;
import com.flamingo.ai.labmatch.service.similarity.PortfolioSimilarity;
import com.flamingo.ai.labmatch.service.similarity.ProficiencySimilarity;
import com.flamingo.ai.labmatch.service.similarity.SentenceKeywordSimilarity;
import com.flamingo.ai.labmatch.service.similarity.SentenceSimilarity;
import com.flamingo.ai.labmatch.service.similarity.SimilarityOptions;
import com.flamingo.ai.labmatch.service.similarity.TechStackSimilarity;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stage 2: scores a structured profile against each candidate's text sections and ranks the
 * candidates.
 *
 * <p>Scoring is a pure function of profile, candidate and configuration. The only shared state
 * touched is the embedding cache.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RerankingScorer {

  private final SentenceSimilarity sentenceSimilarity;
  private final SentenceKeywordSimilarity sentenceKeywordSimilarity;
  private final PortfolioSimilarity portfolioSimilarity;
  private final MajorSimilarity majorSimilarity;
  private final CertificationSimilarity certificationSimilarity;
  private final AwardSimilarity awardSimilarity;
  private final TechStackSimilarity techStackSimilarity;
  private final LanguageScoreSimilarity languageScoreSimilarity;
  private final ProficiencySimilarity proficiencySimilarity;
  private final GpaSimilarity gpaSimilarity;

  /** Reranks stage-1 candidates, carrying their combined score along. */
  @Timed(value = "matching.rerank", description = "Stage-2 reranking")
  public List<FinalScore> rerank(
      StructuredProfile profile,
      List<CandidateScoreRecord> candidates,
      ScorerConfiguration configuration,
      int topK) {
    List<FinalScore> scored = new ArrayList<>(candidates.size());
    for (int i = 0; i < candidates.size(); i++) {
      CandidateScoreRecord candidate = candidates.get(i);
      scored.add(
          score(profile, candidate.entity(), i, candidate.combinedScore(), configuration));
    }
    return rank(scored, configuration, topK);
  }

  /** Reranks plain corpus entities; the retrieval score is reported as zero. */
  public List<FinalScore> rerankEntities(
      StructuredProfile profile,
      List<CorpusEntity> entities,
      ScorerConfiguration configuration,
      int topK) {
    List<FinalScore> scored = new ArrayList<>(entities.size());
    for (int i = 0; i < entities.size(); i++) {
      scored.add(score(profile, entities.get(i), i, 0.0, configuration));
    }
    return rank(scored, configuration, topK);
  }

  /** Scores one candidate without thresholding. */
  public FinalScore score(
      StructuredProfile profile, CorpusEntity entity, ScorerConfiguration configuration) {
    return score(profile, entity, 0, 0.0, configuration);
  }

  private FinalScore score(
      StructuredProfile profile,
      CorpusEntity entity,
      int inputIndex,
      double retrievalScore,
      ScorerConfiguration configuration) {
    Map<ScoreField, CriterionScore> fields = scoreFields(profile, entity, configuration);

    SentenceWeights sw = configuration.getSentenceWeights();
    double sentence =
        fields.get(ScoreField.INTEREST).score() * sw.interest()
            + fields.get(ScoreField.EXPERIENCE).score() * sw.experience()
            + fields.get(ScoreField.GOAL).score() * sw.goal()
            + fields.get(ScoreField.PORTFOLIO).score() * sw.portfolio();

    CategoricalWeights cw = configuration.getCategoricalWeights();
    double categorical =
        fields.get(ScoreField.MAJOR).score() * cw.major()
            + fields.get(ScoreField.CERTIFICATIONS).score() * cw.certifications()
            + fields.get(ScoreField.AWARDS).score() * cw.awards()
            + fields.get(ScoreField.TECH_STACK).score() * cw.techStack();

    NumericWeights nw = configuration.getNumericWeights();
    double numeric =
        fields.get(ScoreField.LANGUAGE_SCORE).score() * nw.languageScore()
            + fields.get(ScoreField.PROFICIENCY).score() * nw.proficiency()
            + fields.get(ScoreField.GPA).score() * nw.gpa();

    TierWeights tw = configuration.getTierWeights();
    double finalScore =
        sentence * tw.sentence() + categorical * tw.categorical() + numeric * tw.numeric();

    return FinalScore.builder()
        .entity(entity)
        .inputIndex(inputIndex)
        .finalScore(finalScore)
        .sentenceScore(sentence)
        .categoricalScore(categorical)
        .numericScore(numeric)
        .fieldScores(Collections.unmodifiableMap(fields))
        .retrievalScore(retrievalScore)
        .build();
  }

  private Map<ScoreField, CriterionScore> scoreFields(
      StructuredProfile profile, CorpusEntity entity, ScorerConfiguration configuration) {
    SimilarityOptions options = configuration.getSimilarityOptions();
    Map<ScoreField, CriterionScore> fields = new EnumMap<>(ScoreField.class);

    fields.put(
        ScoreField.INTEREST,
        sentenceSimilarity.calculate(
            profile.getInterestStatement(),
            entity.joinSections(SectionType.RESEARCH, SectionType.ABOUT),
            options));
    fields.put(
        ScoreField.EXPERIENCE,
        sentenceKeywordSimilarity.calculate(
            profile.getExperienceStatement(),
            entity.joinSections(SectionType.METHODS, SectionType.PROJECTS),
            options));
    fields.put(
        ScoreField.GOAL,
        sentenceSimilarity.calculate(
            profile.getGoalStatement(),
            entity.sectionOrElse(SectionType.VISION, SectionType.ABOUT),
            options));
    fields.put(
        ScoreField.PORTFOLIO,
        portfolioSimilarity.calculate(profile.getPortfolio(), entity.fullText(), options));

    fields.put(
        ScoreField.MAJOR,
        majorSimilarity.calculate(profile.getMajor(), entity.getDepartment(), options));
    fields.put(
        ScoreField.CERTIFICATIONS,
        certificationSimilarity.calculate(
            String.join(", ", profile.getCertifications()),
            entity.section(SectionType.REQUIREMENTS),
            options));
    fields.put(
        ScoreField.AWARDS,
        awardSimilarity.calculate(
            String.join(", ", profile.getAwards()),
            entity.section(SectionType.ACHIEVEMENTS),
            options));
    fields.put(
        ScoreField.TECH_STACK,
        techStackSimilarity.calculate(
            String.join(", ", profile.getTechStack()),
            entity.sectionOrElse(SectionType.TECHNOLOGIES, SectionType.METHODS),
            options));

    fields.put(
        ScoreField.LANGUAGE_SCORE,
        languageScoreSimilarity.calculate(
            profile.getLanguageScore(), configuration.getRequiredLanguageScore(), options));
    fields.put(
        ScoreField.PROFICIENCY,
        proficiencySimilarity.calculate(
            profile.getProficiencyLevel(), configuration.getRequiredProficiency(), options));
    fields.put(
        ScoreField.GPA,
        gpaSimilarity.calculate(profile.getGpa(), configuration.getExpectedGpa(), options));
    return fields;
  }

  private List<FinalScore> rank(
      List<FinalScore> scored, ScorerConfiguration configuration, int topK) {
    List<FinalScore> kept = new ArrayList<>(scored.size());
    for (FinalScore score : scored) {
      if (score.getFinalScore() >= configuration.getMinScoreThreshold()) {
        kept.add(score);
      }
    }
    // List.sort is stable, so equal scores keep input order
    kept.sort(Comparator.comparingDouble(FinalScore::getFinalScore).reversed());
    List<FinalScore> top = List.copyOf(kept.subList(0, Math.max(0, Math.min(topK, kept.size()))));
    log.debug(
        "Reranked {} candidates with '{}': {} above threshold {}, returning {}",
        scored.size(),
        configuration.getName(),
        kept.size(),
        configuration.getMinScoreThreshold(),
        top.size());
    return top;
  }
}
