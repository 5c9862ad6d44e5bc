package com.flamingo.ai.labmatch.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.labmatch.api.rest.CorpusController;
import com.flamingo.ai.labmatch.api.rest.HealthController;
import com.flamingo.ai.labmatch.api.rest.RecommendationController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify controllers stay on their published paths:
 *
 * <ul>
 *   <li>POST /api/recommendations - Run both stages
 *   <li>POST /api/candidates - Run stage 1 only
 *   <li>GET /api/presets - List scorer presets
 *   <li>POST /api/corpus/reload - Rebuild the corpus snapshot
 *   <li>GET /api/corpus/stats - Describe the active snapshot
 *   <li>GET /health - Liveness
 * </ul>
 *
 * <p>If these tests fail, clients calling the old paths will break. Update the mappings back.
 */
class ApiContractTest {

  @Nested
  @DisplayName("RecommendationController API contract")
  class RecommendationControllerContract {

    @Test
    @DisplayName("should be mapped under /api prefix")
    void shouldBeMappedUnderApiPrefix() {
      RequestMapping mapping = RecommendationController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api");
    }
  }

  @Nested
  @DisplayName("CorpusController API contract")
  class CorpusControllerContract {

    @Test
    @DisplayName("should be mapped to /api/corpus")
    void shouldBeMappedToApiCorpus() {
      RequestMapping mapping = CorpusController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/corpus");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /health")
    void shouldBeMappedToHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/health");
    }
  }
}
