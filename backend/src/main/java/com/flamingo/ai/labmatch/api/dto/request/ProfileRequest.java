package com.flamingo.ai.labmatch.api.dto.request;

import com.flamingo.ai.labmatch.domain.model.StructuredProfile;
import jakarta.validation.constraints.Size;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO carrying a student's structured profile. Every field is optional. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileRequest {

  @Size(max = 5000, message = "Interest statement must not exceed 5000 characters")
  private String interestStatement;

  @Size(max = 5000, message = "Experience statement must not exceed 5000 characters")
  private String experienceStatement;

  @Size(max = 5000, message = "Goal statement must not exceed 5000 characters")
  private String goalStatement;

  @Size(max = 50000, message = "Portfolio must not exceed 50000 characters")
  private String portfolio;

  private String major;

  @Size(max = 50, message = "At most 50 certifications")
  private List<String> certifications;

  @Size(max = 50, message = "At most 50 awards")
  private List<String> awards;

  @Size(max = 100, message = "At most 100 tech stack entries")
  private List<String> techStack;

  /** Numeric test score or OPIc grade. */
  private String languageScore;

  private String proficiencyLevel;
  private String gpa;

  public StructuredProfile toProfile() {
    return StructuredProfile.builder()
        .interestStatement(orEmpty(interestStatement))
        .experienceStatement(orEmpty(experienceStatement))
        .goalStatement(orEmpty(goalStatement))
        .portfolio(orEmpty(portfolio))
        .major(orEmpty(major))
        .certifications(orEmpty(certifications))
        .awards(orEmpty(awards))
        .techStack(orEmpty(techStack))
        .languageScore(orEmpty(languageScore))
        .proficiencyLevel(orEmpty(proficiencyLevel))
        .gpa(orEmpty(gpa))
        .build();
  }

  private static String orEmpty(String value) {
    return value == null ? "" : value;
  }

  private static List<String> orEmpty(List<String> values) {
    return values == null
        ? List.of()
        : values.stream().filter(value -> value != null && !value.isBlank()).toList();
  }
}
