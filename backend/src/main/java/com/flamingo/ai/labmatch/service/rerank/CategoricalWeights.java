package com.flamingo.ai.labmatch.service.rerank;

/** Field weights of the categorical tier. */
public record CategoricalWeights(
    double major, double certifications, double awards, double techStack) {

  public CategoricalWeights {
    Weights.requireUnitSum("categorical", major, certifications, awards, techStack);
  }
}
