package com.flamingo.ai.labmatch.service.rerank;

/** Field weights of the narrative tier. */
public record SentenceWeights(double interest, double experience, double goal, double portfolio) {

  public SentenceWeights {
    Weights.requireUnitSum("sentence", interest, experience, goal, portfolio);
  }
}
