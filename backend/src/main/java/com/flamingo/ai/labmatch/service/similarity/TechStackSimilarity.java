package com.flamingo.ai.labmatch.service.similarity;

import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import com.flamingo.ai.labmatch.service.embedding.VectorMath;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Tech-stack similarity: exact term overlap blended with the cosine of the mean term embeddings,
 * which credits related tools such as PyTorch and TensorFlow.
 */
@Component
@RequiredArgsConstructor
public class TechStackSimilarity extends TextSimilarityMeasure {

  private final EmbeddingService embeddingService;

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    List<String> subjectTerms = TermLists.splitDistinctLower(subject);
    List<String> referenceTerms = TermLists.splitDistinctLower(reference);
    if (subjectTerms.isEmpty() || referenceTerms.isEmpty()) {
      return CriterionScore.of(0.0, "empty_stacks");
    }

    Set<String> intersection = new HashSet<>(subjectTerms);
    intersection.retainAll(referenceTerms);
    Set<String> union = new HashSet<>(subjectTerms);
    union.addAll(referenceTerms);
    double jaccard = (double) intersection.size() / union.size();

    // Terms are compared symmetrically, so both sides use query framing
    float[] subjectMean =
        VectorMath.meanPool(embeddingService.encodeAll(subjectTerms, EmbeddingRole.QUERY));
    float[] referenceMean =
        VectorMath.meanPool(embeddingService.encodeAll(referenceTerms, EmbeddingRole.QUERY));
    double embedding = Math.max(0.0, VectorMath.cosine(subjectMean, referenceMean));

    double jaccardWeight = options.getTechJaccardWeight();
    double embeddingWeight = options.getTechEmbeddingWeight();
    double score =
        CriterionScore.unitInterval(
            (jaccard * jaccardWeight + embedding * embeddingWeight)
                / (jaccardWeight + embeddingWeight));

    Map<String, Object> details = new LinkedHashMap<>();
    details.put("jaccard", jaccard);
    details.put("embeddingSimilarity", embedding);
    details.put("intersection", intersection.stream().sorted().toList());
    return new CriterionScore(score, "jaccard_embedding_hybrid", details);
  }
}
