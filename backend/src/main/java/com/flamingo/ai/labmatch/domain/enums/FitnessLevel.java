package com.flamingo.ai.labmatch.domain.enums;

/** Coarse label attached to a recommendation for display. */
public enum FitnessLevel {
  VERY_HIGH(0.7),
  HIGH(0.5),
  LOW(0.0);

  private final double minScore;

  FitnessLevel(double minScore) {
    this.minScore = minScore;
  }

  public double getMinScore() {
    return minScore;
  }

  public static FitnessLevel of(double finalScore) {
    for (FitnessLevel level : values()) {
      if (finalScore >= level.minScore) {
        return level;
      }
    }
    return LOW;
  }
}
