package com.flamingo.ai.labmatch.service.retrieval;

import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import java.util.Set;

/**
 * Stage-1 score breakdown for one corpus item.
 *
 * @param entity the candidate lab
 * @param corpusIndex position in the corpus snapshot, used as the tie-breaker
 * @param rawLexicalScore BM25 score
 * @param lexicalScore log and min-max normalized BM25 score
 * @param rawSemanticScore cosine similarity between query and passage embeddings
 * @param semanticScore cosine after the similarity floor and rescaling
 * @param domainScore taxonomy match score
 * @param effectiveLexicalScore lexical score after domain substitution
 * @param matchedCategories taxonomy categories shared by query and candidate
 * @param combinedScore weighted sum of effective lexical and semantic scores
 * @param sources signals that contributed
 */
public record CandidateScoreRecord(
    CorpusEntity entity,
    int corpusIndex,
    double rawLexicalScore,
    double lexicalScore,
    double rawSemanticScore,
    double semanticScore,
    double domainScore,
    double effectiveLexicalScore,
    Set<String> matchedCategories,
    double combinedScore,
    Set<SignalSource> sources) {}
