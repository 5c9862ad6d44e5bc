package com.flamingo.ai.labmatch.domain.model;

import com.flamingo.ai.labmatch.domain.enums.SectionType;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * A laboratory profile as loaded from the document store. Immutable for the lifetime of a corpus
 * snapshot.
 */
@Value
@Builder(toBuilder = true)
public class CorpusEntity {

  String id;
  String name;

  /** Principal investigator. */
  String owner;

  String contact;
  String description;

  /** Department the lab belongs to, compared against a student's major. */
  String department;

  String homepage;
  String location;

  @Singular Map<SectionType, String> sections;

  /** Returns the section text, or an empty string when the section was not extracted. */
  public String section(SectionType type) {
    String text = sections.get(type);
    return text == null ? "" : text;
  }

  /** Returns the first non-blank section among the given ones. */
  public String sectionOrElse(SectionType preferred, SectionType fallback) {
    String text = section(preferred);
    return text.isBlank() ? section(fallback) : text;
  }

  public boolean hasSection(SectionType type) {
    return !section(type).isBlank();
  }

  /** Joins the given sections with single spaces, skipping blank ones. */
  public String joinSections(SectionType... types) {
    return Stream.of(types)
        .map(this::section)
        .filter(text -> !text.isBlank())
        .collect(Collectors.joining(" "));
  }

  /** Text indexed for candidate generation: the description followed by every section. */
  public String searchText() {
    Map<SectionType, String> ordered = new EnumMap<>(SectionType.class);
    ordered.putAll(sections);
    String lead = description == null ? "" : description;
    return Stream.concat(Stream.of(lead), ordered.values().stream())
        .filter(text -> text != null && !text.isBlank())
        .collect(Collectors.joining(" "));
  }

  /** All sections joined in declaration order; used for long-form comparisons. */
  public String fullText() {
    return joinSections(SectionType.values());
  }
}
