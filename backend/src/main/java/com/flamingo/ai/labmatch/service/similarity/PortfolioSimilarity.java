package com.flamingo.ai.labmatch.service.similarity;

import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import com.flamingo.ai.labmatch.service.embedding.VectorMath;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Long-form similarity. Each text is split into word chunks of bounded length, the chunk
 * embeddings are mean-pooled per text, and the pooled vectors are compared by cosine.
 */
@Component
@RequiredArgsConstructor
public class PortfolioSimilarity extends TextSimilarityMeasure {

  private final EmbeddingService embeddingService;

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    List<String> subjectChunks = chunk(subject, options.getChunkSize());
    List<String> referenceChunks = chunk(reference, options.getChunkSize());

    float[] subjectVector =
        VectorMath.meanPool(embeddingService.encodeAll(subjectChunks, EmbeddingRole.QUERY));
    float[] referenceVector =
        VectorMath.meanPool(embeddingService.encodeAll(referenceChunks, EmbeddingRole.PASSAGE));
    double cosine = VectorMath.cosine(subjectVector, referenceVector);

    return new CriterionScore(
        Math.max(0.0, cosine),
        "chunked_mean_pool",
        Map.of(
            "cosine", cosine,
            "subjectChunks", subjectChunks.size(),
            "referenceChunks", referenceChunks.size()));
  }

  /**
   * Greedily packs whole words into chunks of at most {@code chunkSize} characters. A single word
   * longer than the limit becomes its own chunk.
   */
  static List<String> chunk(String text, int chunkSize) {
    if (chunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
    }
    List<String> chunks = new ArrayList<>();
    StringBuilder current = new StringBuilder();
    for (String word : text.strip().split("\\s+")) {
      if (word.isEmpty()) {
        continue;
      }
      if (current.length() > 0 && current.length() + 1 + word.length() > chunkSize) {
        chunks.add(current.toString());
        current.setLength(0);
      }
      if (current.length() > 0) {
        current.append(' ');
      }
      current.append(word);
    }
    if (current.length() > 0) {
      chunks.add(current.toString());
    }
    return chunks;
  }
}
