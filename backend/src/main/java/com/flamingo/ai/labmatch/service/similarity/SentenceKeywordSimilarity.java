package com.flamingo.ai.labmatch.service.similarity;

import com.flamingo.ai.labmatch.service.retrieval.TextTokenizer;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Blends sentence similarity with token-set Jaccard overlap, so statements that share exact
 * technical terms score above ones that are merely on-topic.
 */
@Component
@RequiredArgsConstructor
public class SentenceKeywordSimilarity extends TextSimilarityMeasure {

  private final SentenceSimilarity sentenceSimilarity;

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    double keywordWeight = options.getKeywordWeight();
    double sentence = Math.max(0.0, sentenceSimilarity.cosine(subject, reference));
    double jaccard =
        TextTokenizer.jaccard(TextTokenizer.tokenSet(subject), TextTokenizer.tokenSet(reference));
    double score =
        CriterionScore.unitInterval(sentence * (1 - keywordWeight) + jaccard * keywordWeight);
    return new CriterionScore(
        score,
        "sentence_keyword_hybrid",
        Map.of("sentence", sentence, "jaccard", jaccard, "keywordWeight", keywordWeight));
  }
}
