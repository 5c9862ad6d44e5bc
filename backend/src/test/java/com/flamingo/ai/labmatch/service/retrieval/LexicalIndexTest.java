package com.flamingo.ai.labmatch.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("LexicalIndex Tests")
class LexicalIndexTest {

  @Test
  @DisplayName("Should rank documents containing query terms first")
  void shouldRankMatchingDocumentsFirst() {
    LexicalIndex index =
        LexicalIndex.build(
            List.of("robot control lab", "power grid lab", "robot vision lab"), 1.5, 0.75);

    double[] scores = index.score("robot vision");

    assertThat(scores[2]).isGreaterThan(scores[0]);
    assertThat(scores[0]).isGreaterThan(scores[1]);
    assertThat(scores[1]).isZero();
  }

  @Test
  @DisplayName("Should weight rare terms more heavily")
  void shouldWeightRareTermsMoreHeavily() {
    LexicalIndex index =
        LexicalIndex.build(List.of("robot vision", "robot grid", "robot power"), 1.5, 0.75);

    assertThat(index.idf(1)).isGreaterThan(index.idf(3));
    assertThat(index.idf(3)).isPositive();

    double[] scores = index.score("vision");
    double[] common = index.score("robot");
    assertThat(scores[0]).isGreaterThan(common[0]);
  }

  @Test
  @DisplayName("Should saturate term frequency")
  void shouldSaturateTermFrequency() {
    LexicalIndex index =
        LexicalIndex.build(
            List.of(
                "robot",
                "robot robot",
                "robot ".repeat(10),
                "robot ".repeat(11),
                "unrelated text"),
            1.5,
            0.0);

    double[] scores = index.score("robot");
    double firstGain = scores[1] - scores[0];
    double laterGain = scores[3] - scores[2];
    double bound = index.idf(4) * (1.5 + 1);

    assertThat(firstGain).isPositive();
    assertThat(laterGain).isPositive().isLessThan(firstGain);
    assertThat(scores[3]).isLessThan(bound);
  }

  @Test
  @DisplayName("Should return zeros for empty or unknown query")
  void shouldReturnZerosForEmptyQuery() {
    LexicalIndex index = LexicalIndex.build(List.of("robot arm", "power grid"), 1.5, 0.75);

    assertThat(index.score("")).containsExactly(0.0, 0.0);
    assertThat(index.score("the and of")).containsExactly(0.0, 0.0);
    assertThat(index.score("quantum")).containsExactly(0.0, 0.0);
  }

  @Test
  @DisplayName("Should return empty scores for empty index")
  void shouldReturnEmptyScoresForEmptyIndex() {
    assertThat(LexicalIndex.empty().score("robot")).isEmpty();
    assertThat(LexicalIndex.empty().size()).isZero();
  }

  @Test
  @DisplayName("Should score Korean text")
  void shouldScoreKoreanText() {
    LexicalIndex index =
        LexicalIndex.build(List.of("컴퓨터 비전 연구", "전력 시스템 연구"), 1.5, 0.75);

    double[] scores = index.score("컴퓨터 비전");

    assertThat(scores[0]).isPositive();
    assertThat(scores[1]).isZero();
  }

  @Test
  @DisplayName("Should reject invalid parameters")
  void shouldRejectInvalidParameters() {
    assertThatThrownBy(() -> LexicalIndex.build(List.of("a"), 1.5, 1.5))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
