package com.flamingo.ai.labmatch.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Categories of derived text a lab profile is split into. */
public enum SectionType {
  RESEARCH("research"),
  ABOUT("about"),
  METHODS("methods", "method"),
  PROJECTS("projects", "project"),
  VISION("vision"),
  ACHIEVEMENTS("achievements", "publications", "awards"),
  TECHNOLOGIES("technologies", "technology", "tech"),
  REQUIREMENTS("requirements", "requirement", "admission");

  private final String[] labels;

  SectionType(String... labels) {
    this.labels = labels;
  }

  public String getLabel() {
    return labels[0];
  }

  /**
   * Resolves a section label as produced by the content extractor.
   *
   * @param label raw section label, case-insensitive
   * @return the matching section, or empty for labels that carry no ranking signal
   */
  public static Optional<SectionType> fromLabel(String label) {
    if (label == null || label.isBlank()) {
      return Optional.empty();
    }
    String normalized = label.trim().toLowerCase(Locale.ROOT);
    for (SectionType type : values()) {
      for (String candidate : type.labels) {
        if (candidate.equals(normalized)) {
          return Optional.of(type);
        }
      }
    }
    return Optional.empty();
  }
}
