package com.flamingo.ai.labmatch.service.retrieval;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.domain.model.Query;
import com.flamingo.ai.labmatch.exception.EmbeddingUnavailableException;
import com.flamingo.ai.labmatch.service.corpus.CorpusService;
import com.flamingo.ai.labmatch.service.corpus.CorpusSnapshot;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import com.flamingo.ai.labmatch.service.embedding.VectorMath;
import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Stage 1: hybrid candidate generation.
 *
 * <p>Fuses BM25, embedding similarity and taxonomy matches into one combined score per lab:
 *
 * <ol>
 *   <li>BM25 scores are log-dampened and min-max normalized.
 *   <li>Cosine scores below the similarity floor are zeroed, the rest rescaled to [0, 1].
 *   <li>A confident domain match replaces a weaker lexical score.
 *   <li>Labs whose categories are disjoint from the query's are dropped unless their combined
 *       score reaches the override threshold.
 *   <li>Labs under the minimum combined score are dropped.
 * </ol>
 *
 * Results are sorted by combined score, ties kept in corpus order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CandidateGenerator {

  private final CorpusService corpusService;
  private final EmbeddingService embeddingService;
  private final DomainTaxonomyMatcher domainTaxonomyMatcher;
  private final MatchingConfig matchingConfig;
  private final MeterRegistry meterRegistry;

  public List<CandidateScoreRecord> generate(Query query) {
    return generate(query, matchingConfig.getRetrieval().getTopK());
  }

  /**
   * Generates up to {@code topK} candidates for the query.
   *
   * @return ranked candidates; empty for a blank query or an empty corpus
   */
  @Timed(value = "matching.candidates.generate", description = "Stage-1 candidate generation")
  public List<CandidateScoreRecord> generate(Query query, int topK) {
    CorpusSnapshot snapshot = corpusService.current();
    if (query.isBlank() || snapshot.isEmpty() || topK <= 0) {
      log.debug("No candidates: blank query or empty corpus");
      return List.of();
    }

    MatchingConfig.Retrieval settings = matchingConfig.getRetrieval();
    double[] rawLexical = snapshot.getLexicalIndex().score(query.text());
    double[] lexical = ScoreNormalizer.logMinMax(rawLexical);
    double[] rawSemantic = semanticScores(query, snapshot);
    double[] semantic = ScoreNormalizer.floorAndRescale(rawSemantic, settings.getSimilarityFloor());

    List<CandidateScoreRecord> kept = new ArrayList<>();
    int negativeFiltered = 0;
    int belowFloor = 0;

    for (int i = 0; i < snapshot.size(); i++) {
      CorpusEntity entity = snapshot.getEntities().get(i);
      DomainMatch domain = domainTaxonomyMatcher.match(query.text(), entity.searchText());

      boolean substitute = domain.score() > settings.getDomainSubstitutionThreshold();
      double effectiveLexical = substitute ? Math.max(domain.score(), lexical[i]) : lexical[i];
      double combined =
          effectiveLexical * settings.getKeywordWeight()
              + semantic[i] * settings.getSemanticWeight();

      if (!passesNegativeFilter(domain, combined, settings.getNegativeFilterOverride())) {
        negativeFiltered++;
        continue;
      }
      if (combined < settings.getMinCombinedScore()) {
        belowFloor++;
        continue;
      }

      kept.add(
          new CandidateScoreRecord(
              entity,
              i,
              rawLexical[i],
              lexical[i],
              rawSemantic[i],
              semantic[i],
              domain.score(),
              effectiveLexical,
              domain.sharedCategories(),
              combined,
              sources(lexical[i], semantic[i], domain.score(), effectiveLexical > lexical[i])));
    }

    meterRegistry
        .counter("matching.candidates.filtered", "reason", "negative_category")
        .increment(negativeFiltered);
    meterRegistry
        .counter("matching.candidates.filtered", "reason", "below_floor")
        .increment(belowFloor);

    // List.sort is stable, so equal scores keep corpus order
    kept.sort(Comparator.comparingDouble(CandidateScoreRecord::combinedScore).reversed());
    List<CandidateScoreRecord> top = List.copyOf(kept.subList(0, Math.min(topK, kept.size())));

    log.debug(
        "Stage 1 for '{}': {} labs, {} negative-filtered, {} below floor, returning {}",
        query.text(),
        snapshot.size(),
        negativeFiltered,
        belowFloor,
        top.size());
    return top;
  }

  /**
   * Keeps a candidate unless query and candidate are both categorized, share no category, and the
   * combined score is under the override threshold.
   */
  @VisibleForTesting
  static boolean passesNegativeFilter(DomainMatch domain, double combined, double override) {
    return !domain.isDisjoint() || combined >= override;
  }

  private double[] semanticScores(Query query, CorpusSnapshot snapshot) {
    double[] scores = new double[snapshot.size()];
    if (!snapshot.hasEmbeddings()) {
      return scores;
    }
    float[] queryVector;
    try {
      queryVector = embeddingService.encode(query.text(), EmbeddingRole.QUERY);
    } catch (EmbeddingUnavailableException e) {
      if (!matchingConfig.getRetrieval().isAllowLexicalOnlyFallback()) {
        throw e;
      }
      log.warn("Query embedding unavailable, scoring lexical-only: {}", e.getMessage());
      return scores;
    }
    for (int i = 0; i < scores.length; i++) {
      scores[i] = VectorMath.cosine(queryVector, snapshot.passageEmbedding(i));
    }
    return scores;
  }

  private static Set<SignalSource> sources(
      double lexical, double semantic, double domain, boolean substituted) {
    Set<SignalSource> sources = EnumSet.noneOf(SignalSource.class);
    if (lexical > 0) {
      sources.add(SignalSource.LEXICAL);
    }
    if (semantic > 0) {
      sources.add(SignalSource.SEMANTIC);
    }
    if (domain > 0) {
      sources.add(SignalSource.DOMAIN);
    }
    if (substituted) {
      sources.add(SignalSource.DOMAIN_SUBSTITUTED);
    }
    return Collections.unmodifiableSet(sources);
  }
}
