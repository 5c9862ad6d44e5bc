package com.flamingo.ai.labmatch.service.similarity;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Rule ladder comparing a student's major with a lab's department: exact 1.0, same discipline
 * group 0.8, substring 0.6, both in engineering groups 0.5, otherwise 0.
 */
@Component
public class MajorSimilarity extends TextSimilarityMeasure {

  private static final Map<String, List<String>> MAJOR_GROUPS = new LinkedHashMap<>();

  static {
    MAJOR_GROUPS.put(
        "computing",
        List.of(
            "컴퓨터공학", "소프트웨어", "인공지능", "데이터사이언스", "computer science",
            "computer engineering", "software engineering", "artificial intelligence",
            "data science"));
    MAJOR_GROUPS.put(
        "electrical",
        List.of(
            "전기공학", "전자공학", "전기전자공학", "제어계측", "electrical engineering",
            "electronic engineering", "electronics", "control and instrumentation"));
    MAJOR_GROUPS.put(
        "mechanical",
        List.of(
            "기계공학", "기계설계", "자동차공학", "항공우주", "mechanical engineering",
            "automotive engineering", "aerospace engineering"));
    MAJOR_GROUPS.put(
        "chemical_bio",
        List.of(
            "화학공학", "생명공학", "환경공학", "신소재", "chemical engineering", "biotechnology",
            "environmental engineering", "materials science"));
    MAJOR_GROUPS.put(
        "business",
        List.of(
            "경영학", "경제학", "회계학", "금융학", "business administration", "economics",
            "accounting", "finance"));
  }

  private static final Set<String> ENGINEERING_GROUPS =
      Set.of("computing", "electrical", "mechanical", "chemical_bio");

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    String major = subject.toLowerCase(Locale.ROOT);
    String department = reference.toLowerCase(Locale.ROOT);
    Map<String, Object> details = new LinkedHashMap<>();
    details.put("major", subject);
    details.put("department", reference);

    if (major.equals(department)) {
      return new CriterionScore(1.0, "exact_match", details);
    }

    Optional<String> majorGroup = groupOf(major);
    Optional<String> departmentGroup = groupOf(department);
    majorGroup.ifPresent(group -> details.put("majorGroup", group));
    departmentGroup.ifPresent(group -> details.put("departmentGroup", group));

    if (majorGroup.isPresent() && majorGroup.equals(departmentGroup)) {
      return new CriterionScore(0.8, "same_group", details);
    }
    if (major.contains(department) || department.contains(major)) {
      return new CriterionScore(0.6, "partial_match", details);
    }
    if (majorGroup.isPresent()
        && departmentGroup.isPresent()
        && ENGINEERING_GROUPS.contains(majorGroup.get())
        && ENGINEERING_GROUPS.contains(departmentGroup.get())) {
      return new CriterionScore(0.5, "related_engineering", details);
    }
    return new CriterionScore(0.0, "no_match", details);
  }

  /**
   * Resolves the discipline group: an exact member first, then the longest member contained in the
   * name, so "전기전자공학부" resolves through "전기전자공학".
   */
  static Optional<String> groupOf(String lowerName) {
    String bestGroup = null;
    int bestLength = 0;
    for (Map.Entry<String, List<String>> group : MAJOR_GROUPS.entrySet()) {
      for (String member : group.getValue()) {
        if (member.equals(lowerName)) {
          return Optional.of(group.getKey());
        }
        if (lowerName.contains(member) && member.length() > bestLength) {
          bestGroup = group.getKey();
          bestLength = member.length();
        }
      }
    }
    return Optional.ofNullable(bestGroup);
  }
}
