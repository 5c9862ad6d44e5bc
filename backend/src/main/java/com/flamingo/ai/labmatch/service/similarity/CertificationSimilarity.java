package com.flamingo.ai.labmatch.service.similarity;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Weighted best-match certification similarity.
 *
 * <p>Each student certification is matched against every required one (exact 1.0, substring 0.7,
 * otherwise word-overlap ratio) and the best match is scaled by the certification's grade weight.
 * The score is the mean over the student's certifications.
 */
@Component
public class CertificationSimilarity extends TextSimilarityMeasure {

  private static final Map<String, Double> GRADE_WEIGHTS = new LinkedHashMap<>();

  static {
    // Checked longest first, so 산업기사 is not mistaken for 기사
    GRADE_WEIGHTS.put("산업기사", 0.7);
    GRADE_WEIGHTS.put("민간자격", 0.3);
    GRADE_WEIGHTS.put("기능사", 0.5);
    GRADE_WEIGHTS.put("기사", 1.0);
  }

  static final double DEFAULT_GRADE_WEIGHT = 0.3;

  @Override
  protected CriterionScore compare(String subject, String reference, SimilarityOptions options) {
    List<String> held = TermLists.split(subject);
    List<String> required = TermLists.split(reference);
    if (held.isEmpty() || required.isEmpty()) {
      return CriterionScore.of(0.0, "empty_lists");
    }

    List<Double> itemScores = new ArrayList<>(held.size());
    for (String certification : held) {
      double weight = gradeWeight(certification);
      double best = 0.0;
      for (String candidate : required) {
        best = Math.max(best, textMatch(certification, candidate) * weight);
      }
      itemScores.add(best);
    }
    double score =
        CriterionScore.unitInterval(
            itemScores.stream().mapToDouble(Double::doubleValue).average().orElse(0.0));
    return new CriterionScore(
        score,
        "weighted_jaccard",
        Map.of("held", held, "required", required, "itemScores", itemScores));
  }

  static double gradeWeight(String certification) {
    for (Map.Entry<String, Double> grade : GRADE_WEIGHTS.entrySet()) {
      if (certification.contains(grade.getKey())) {
        return grade.getValue();
      }
    }
    return DEFAULT_GRADE_WEIGHT;
  }

  static double textMatch(String a, String b) {
    String left = a.toLowerCase(Locale.ROOT);
    String right = b.toLowerCase(Locale.ROOT);
    if (left.equals(right)) {
      return 1.0;
    }
    if (left.contains(right) || right.contains(left)) {
      return 0.7;
    }
    Set<String> leftWords = new HashSet<>(Arrays.asList(left.split("\\s+")));
    Set<String> rightWords = new HashSet<>(Arrays.asList(right.split("\\s+")));
    Set<String> intersection = new HashSet<>(leftWords);
    intersection.retainAll(rightWords);
    if (intersection.isEmpty()) {
      return 0.0;
    }
    Set<String> union = new HashSet<>(leftWords);
    union.addAll(rightWords);
    return (double) intersection.size() / union.size();
  }
}
