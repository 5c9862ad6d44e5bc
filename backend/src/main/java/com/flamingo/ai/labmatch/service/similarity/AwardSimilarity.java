package com.flamingo.ai.labmatch.service.similarity;

import com.flamingo.ai.labmatch.service.retrieval.TextTokenizer;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Award similarity. Longer texts are compared by TF-IDF cosine over the two-document collection;
 * short label-like texts by token-set Jaccard, where frequency statistics add nothing.
 */
@Component
public class AwardSimilarity extends TextSimilarityMeasure {

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    double meanLength = (subject.length() + reference.length()) / 2.0;
    if (meanLength > options.getTfidfThreshold()) {
      List<String> subjectTokens = TextTokenizer.tokenize(subject);
      List<String> referenceTokens = TextTokenizer.tokenize(reference);
      if (!subjectTokens.isEmpty() && !referenceTokens.isEmpty()) {
        double cosine = tfidfCosine(subjectTokens, referenceTokens);
        return new CriterionScore(cosine, "tfidf_cosine", Map.of("meanLength", meanLength));
      }
    }
    double jaccard =
        TextTokenizer.jaccard(TextTokenizer.tokenSet(subject), TextTokenizer.tokenSet(reference));
    return new CriterionScore(jaccard, "jaccard", Map.of("meanLength", meanLength));
  }

  /** Smoothed idf, ln((1 + n) / (1 + df)) + 1 with n = 2, and L2-normalized tf-idf vectors. */
  static double tfidfCosine(List<String> a, List<String> b) {
    Map<String, Integer> tfA = termCounts(a);
    Map<String, Integer> tfB = termCounts(b);
    Set<String> vocabulary = new HashSet<>(tfA.keySet());
    vocabulary.addAll(tfB.keySet());

    double dot = 0.0;
    double normA = 0.0;
    double normB = 0.0;
    for (String term : vocabulary) {
      int df = (tfA.containsKey(term) ? 1 : 0) + (tfB.containsKey(term) ? 1 : 0);
      double idf = Math.log(3.0 / (1.0 + df)) + 1.0;
      double wA = tfA.getOrDefault(term, 0) * idf;
      double wB = tfB.getOrDefault(term, 0) * idf;
      dot += wA * wB;
      normA += wA * wA;
      normB += wB * wB;
    }
    if (normA == 0 || normB == 0) {
      return 0.0;
    }
    return Math.min(1.0, dot / (Math.sqrt(normA) * Math.sqrt(normB)));
  }

  private static Map<String, Integer> termCounts(List<String> tokens) {
    Map<String, Integer> counts = new HashMap<>();
    for (String token : tokens) {
      counts.merge(token, 1, Integer::sum);
    }
    return counts;
  }
}
