package com.flamingo.ai.labmatch.service.rerank;

/** Top-level weights of the three scoring tiers. */
public record TierWeights(double sentence, double categorical, double numeric) {

  public TierWeights {
    Weights.requireUnitSum("tier", sentence, categorical, numeric);
  }
}
