package com.flamingo.ai.labmatch.service.similarity;

import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import com.flamingo.ai.labmatch.service.embedding.VectorMath;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cosine similarity of the two texts' embeddings. The subject is framed as a query and the
 * reference as a passage. Negative cosines carry no similarity and score zero.
 */
@Component
@RequiredArgsConstructor
public class SentenceSimilarity extends TextSimilarityMeasure {

  private final EmbeddingService embeddingService;

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    double cosine = cosine(subject, reference);
    return new CriterionScore(Math.max(0.0, cosine), "cosine", Map.of("cosine", cosine));
  }

  double cosine(String subject, String reference) {
    float[] subjectVector = embeddingService.encode(subject, EmbeddingRole.QUERY);
    float[] referenceVector = embeddingService.encode(reference, EmbeddingRole.PASSAGE);
    return VectorMath.cosine(subjectVector, referenceVector);
  }
}
