package com.flamingo.ai.labmatch.service.rerank;

import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.service.similarity.CriterionScore;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/** Stage-2 result for one candidate. */
@Value
@Builder
public class FinalScore {

  CorpusEntity entity;

  /** Position in the reranking input; breaks ties. */
  int inputIndex;

  double finalScore;
  double sentenceScore;
  double categoricalScore;
  double numericScore;

  /** One entry per {@link ScoreField}, in declaration order. */
  Map<ScoreField, CriterionScore> fieldScores;

  /** Stage-1 combined score; informational, not weighted into {@link #finalScore}. */
  double retrievalScore;

  public CriterionScore field(ScoreField field) {
    return fieldScores.get(field);
  }
}
