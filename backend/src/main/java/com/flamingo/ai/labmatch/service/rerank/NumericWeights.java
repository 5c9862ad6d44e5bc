package com.flamingo.ai.labmatch.service.rerank;

/** Field weights of the numeric and ordinal tier. */
public record NumericWeights(double languageScore, double proficiency, double gpa) {

  public NumericWeights {
    Weights.requireUnitSum("numeric", languageScore, proficiency, gpa);
  }
}
