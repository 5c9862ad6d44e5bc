package com.flamingo.ai.labmatch.domain.model;

import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/** A student's profile used for stage-2 reranking. Every field may be empty. */
@Value
@Builder(toBuilder = true)
public class StructuredProfile {

  // Narrative fields
  @Builder.Default String interestStatement = "";
  @Builder.Default String experienceStatement = "";
  @Builder.Default String goalStatement = "";
  @Builder.Default String portfolio = "";

  // Categorical fields
  @Builder.Default String major = "";
  @Singular List<String> certifications;
  @Singular List<String> awards;
  @Singular("techStackItem") List<String> techStack;

  // Numeric and ordinal fields
  /** A numeric test score ("850") or an OPIc-style grade ("IM2"). */
  @Builder.Default String languageScore = "";

  /** Spoken proficiency level, e.g. "중상" or "advanced". */
  @Builder.Default String proficiencyLevel = "";

  @Builder.Default String gpa = "";

  public static StructuredProfile empty() {
    return StructuredProfile.builder().build();
  }
}
