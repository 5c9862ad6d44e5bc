package com.flamingo.ai.labmatch.service.similarity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("AwardSimilarity Tests")
class AwardSimilarityTest {

  private final AwardSimilarity awardSimilarity = new AwardSimilarity();

  @Test
  @DisplayName("Should use Jaccard for short texts")
  void shouldUseJaccardForShortTexts() {
    CriterionScore score = awardSimilarity.calculate("IEEE best paper", "best paper award");

    assertThat(score.method()).isEqualTo("jaccard");
    assertThat(score.score()).isEqualTo(0.5);
  }

  @Test
  @DisplayName("Should use TF-IDF cosine for long texts")
  void shouldUseTfidfForLongTexts() {
    String text = "캡스톤 디자인 경진대회 대상 수상 및 자율주행 로봇 부문 우수상";

    CriterionScore same = awardSimilarity.calculate(text, text);
    CriterionScore disjoint =
        awardSimilarity.calculate(text, "international mathematics olympiad silver medal");

    assertThat(same.method()).isEqualTo("tfidf_cosine");
    assertThat(same.score()).isCloseTo(1.0, within(1e-9));
    assertThat(disjoint.score()).isZero();
  }

  @Test
  @DisplayName("Should down-weight terms shared by both texts")
  void shouldDownWeightSharedTerms() {
    double cosine =
        AwardSimilarity.tfidfCosine(List.of("robot", "contest"), List.of("robot", "olympiad"));

    // shared idf = 1, unique idf = ln(1.5) + 1
    double unique = Math.log(1.5) + 1;
    assertThat(cosine).isCloseTo(1.0 / (1.0 + unique * unique), within(1e-9));
  }

  @Test
  @DisplayName("Should respect configured TF-IDF threshold")
  void shouldRespectThreshold() {
    SimilarityOptions options =
        SimilarityOptions.defaults().toBuilder().tfidfThreshold(1_000).build();
    String text = "캡스톤 디자인 경진대회 대상 수상 및 자율주행 로봇 부문 우수상";

    assertThat(awardSimilarity.calculate(text, text, options).method()).isEqualTo("jaccard");
  }
}
