package com.flamingo.ai.labmatch.service.rerank;

/** The eleven profile criteria scored in stage 2, grouped by tier. */
public enum ScoreField {
  INTEREST("interest", Tier.SENTENCE),
  EXPERIENCE("experience", Tier.SENTENCE),
  GOAL("goal", Tier.SENTENCE),
  PORTFOLIO("portfolio", Tier.SENTENCE),
  MAJOR("major", Tier.CATEGORICAL),
  CERTIFICATIONS("certifications", Tier.CATEGORICAL),
  AWARDS("awards", Tier.CATEGORICAL),
  TECH_STACK("techStack", Tier.CATEGORICAL),
  LANGUAGE_SCORE("languageScore", Tier.NUMERIC),
  PROFICIENCY("proficiency", Tier.NUMERIC),
  GPA("gpa", Tier.NUMERIC);

  /** Scoring tiers. */
  public enum Tier {
    SENTENCE,
    CATEGORICAL,
    NUMERIC
  }

  private final String key;
  private final Tier tier;

  ScoreField(String key, Tier tier) {
    this.key = key;
    this.tier = tier;
  }

  /** Name used in API responses. */
  public String getKey() {
    return key;
  }

  public Tier getTier() {
    return tier;
  }
}
