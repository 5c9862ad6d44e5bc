package com.flamingo.ai.labmatch.service.retrieval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("DomainTaxonomyMatcher Tests")
class DomainTaxonomyMatcherTest {

  private DomainTaxonomyMatcher matcher;

  @BeforeEach
  void setUp() {
    matcher =
        new DomainTaxonomyMatcher(
            new DomainTaxonomy(
                List.of(
                    new DomainTaxonomy.Category(
                        "vision",
                        List.of("Vision", "비전", "image", "영상", "camera", "카메라"),
                        1.0),
                    new DomainTaxonomy.Category(
                        "power", List.of("power", "전력", "grid", "그리드", "energy", "에너지"), 0.5),
                    new DomainTaxonomy.Category(
                        "robotics", List.of("robot", "로봇", "drone"), 1.0))));
  }

  @Nested
  @DisplayName("categoriesIn")
  class CategoriesIn {

    @Test
    @DisplayName("Should find categories case-insensitively in taxonomy order")
    void shouldFindCategories() {
      assertThat(matcher.categoriesIn("Smart GRID with VISION sensors"))
          .containsExactly("vision", "power");
    }

    @Test
    @DisplayName("Should match Korean variants followed by particles")
    void shouldMatchKoreanWithParticles() {
      assertThat(matcher.categoriesIn("로봇을 이용한 연구")).containsExactly("robotics");
    }

    @Test
    @DisplayName("Should return empty set for blank text")
    void shouldReturnEmptyForBlank() {
      assertThat(matcher.categoriesIn(" ")).isEmpty();
      assertThat(matcher.categoriesIn(null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("match")
  class Match {

    @Test
    @DisplayName("Should scale single variant by match ratio boost")
    void shouldScaleSingleVariant() {
      DomainMatch match = matcher.match("vision research", "영상 분석 연구실");

      // 1 of 6 variants, boosted by 3
      assertThat(match.score()).isCloseTo(0.5, within(1e-9));
      assertThat(match.sharedCategories()).containsExactly("vision");
      assertThat(match.isDisjoint()).isFalse();
    }

    @Test
    @DisplayName("Should cap category score at its weight")
    void shouldCapCategoryScore() {
      DomainMatch full = matcher.match("vision", "vision image camera lab");
      DomainMatch weighted = matcher.match("power", "power grid energy lab");

      assertThat(full.score()).isCloseTo(1.0, within(1e-9));
      assertThat(weighted.score()).isCloseTo(0.5, within(1e-9));
    }

    @Test
    @DisplayName("Should average over shared categories")
    void shouldAverageOverSharedCategories() {
      DomainMatch match = matcher.match("robot vision power", "robot drone lab with vision");

      // robotics: min(2/3 * 3, 1) = 1.0; vision: 1/6 * 3 = 0.5; power absent
      assertThat(match.score()).isCloseTo(0.75, within(1e-9));
      assertThat(match.sharedCategories()).containsExactly("vision", "robotics");
    }

    @Test
    @DisplayName("Should report disjoint categories")
    void shouldReportDisjointCategories() {
      DomainMatch match = matcher.match("컴퓨터 비전", "전력 계통 연구");

      assertThat(match.score()).isZero();
      assertThat(match.queryCategories()).containsExactly("vision");
      assertThat(match.candidateCategories()).containsExactly("power");
      assertThat(match.isDisjoint()).isTrue();
    }

    @Test
    @DisplayName("Should not be disjoint when either side is uncategorized")
    void shouldNotBeDisjointWhenUncategorized() {
      assertThat(matcher.match("quantum optics", "전력 연구").isDisjoint()).isFalse();
      assertThat(matcher.match("vision", "general lab").isDisjoint()).isFalse();
    }
  }

  @Test
  @DisplayName("Should reject category weight outside (0, 1]")
  void shouldRejectInvalidWeight() {
    assertThatThrownBy(() -> new DomainTaxonomy.Category("x", List.of("x"), 1.5))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new DomainTaxonomy.Category("x", List.of("x"), 0.0))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Nested
  @DisplayName("variant boundaries")
  class VariantBoundaries {

    @Test
    @DisplayName("Should match English variants as whole words with optional plural")
    void shouldMatchEnglishVariantsAsWholeWords() {
      assertThat(matcher.categoriesIn("Robots for warehouse picking")).containsExactly("robotics");
      assertThat(matcher.categoriesIn("robotic manipulation")).isEmpty();
      assertThat(matcher.categoriesIn("powerful imagery")).isEmpty();
    }

    @Test
    @DisplayName("Should keep substring matching for Hangul variants")
    void shouldKeepSubstringMatchingForHangul() {
      assertThat(matcher.categoriesIn("초고속카메라와 영상")).containsExactly("vision");
    }

    @Test
    @DisplayName("Default taxonomy should keep a neural network lab disjoint from a wireless query")
    void neuralNetworkLabShouldStayDisjointFromWirelessQuery() {
      DomainTaxonomyMatcher defaults = new DomainTaxonomyMatcher(DomainTaxonomy.defaults());

      DomainMatch match =
          defaults.match(
              "5G wireless antenna design",
              "deep learning with convolutional neural network models for image classification");

      assertThat(match.queryCategories()).containsExactly("communications");
      assertThat(match.candidateCategories())
          .containsExactly("computer_vision", "machine_learning");
      assertThat(match.sharedCategories()).isEmpty();
      assertThat(match.score()).isZero();
      assertThat(match.isDisjoint()).isTrue();
    }

    @Test
    @DisplayName("Default taxonomy should not read biochemical as chemical")
    void shouldNotReadBiochemicalAsChemical() {
      DomainTaxonomyMatcher defaults = new DomainTaxonomyMatcher(DomainTaxonomy.defaults());

      assertThat(defaults.categoriesIn("biochemical assays")).isEmpty();
      assertThat(defaults.categoriesIn("chemical vapor deposition"))
          .containsExactly("materials_chemistry");
    }
  }

  @Test
  @DisplayName("Default taxonomy should categorize common Korean research terms")
  void defaultTaxonomyShouldCategorizeKoreanTerms() {
    DomainTaxonomyMatcher defaults = new DomainTaxonomyMatcher(DomainTaxonomy.defaults());

    assertThat(defaults.categoriesIn("컴퓨터 비전 기반 자율주행"))
        .containsExactly("computer_vision", "robotics");
    assertThat(defaults.categoriesIn("스마트 그리드 전력 시스템")).containsExactly("power_energy");
  }
}
