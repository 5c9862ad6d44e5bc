package com.flamingo.ai.labmatch.service.similarity;

import lombok.Builder;
import lombok.Value;

/** Tuning parameters shared by the similarity measures. */
@Value
@Builder(toBuilder = true)
public class SimilarityOptions {

  private static final SimilarityOptions DEFAULTS = SimilarityOptions.builder().build();

  /** Share of the token-overlap score in sentence-with-keyword similarity. */
  @Builder.Default double keywordWeight = 0.3;

  /** Maximum characters per portfolio chunk. */
  @Builder.Default int chunkSize = 512;

  /** Mean text length above which awards are compared with TF-IDF instead of Jaccard. */
  @Builder.Default int tfidfThreshold = 20;

  @Builder.Default double techJaccardWeight = 0.6;
  @Builder.Default double techEmbeddingWeight = 0.4;

  /** Score ratio under which a language score earns nothing. */
  @Builder.Default double languageMinRatio = 0.7;

  /** GPA gap at which the score reaches zero. */
  @Builder.Default double gpaMaxGap = 0.5;

  @Builder.Default double gpaScaleMax = 4.5;

  public static SimilarityOptions defaults() {
    return DEFAULTS;
  }
}
