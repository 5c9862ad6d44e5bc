package com.flamingo.ai.labmatch.service.corpus;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.enums.SectionType;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.exception.CorpusReloadException;
import com.flamingo.ai.labmatch.exception.EmbeddingUnavailableException;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("CorpusService Tests")
class CorpusServiceTest {

  @Mock private CorpusSource corpusSource;
  @Mock private EmbeddingService embeddingService;

  private MatchingConfig matchingConfig;
  private SimpleMeterRegistry meterRegistry;
  private CorpusService corpusService;

  @BeforeEach
  void setUp() {
    matchingConfig = new MatchingConfig();
    meterRegistry = new SimpleMeterRegistry();
    corpusService =
        new CorpusService(corpusSource, embeddingService, matchingConfig, meterRegistry);
    lenient().when(corpusSource.describe()).thenReturn("test corpus");
  }

  private static CorpusEntity lab(String id, String name, String research) {
    return CorpusEntity.builder()
        .id(id)
        .name(name)
        .description("")
        .section(SectionType.RESEARCH, research)
        .build();
  }

  private void givenEmbeddingsSucceed() {
    when(embeddingService.encodeAll(anyList(), eq(EmbeddingRole.PASSAGE)))
        .thenAnswer(
            invocation -> {
              List<String> texts = invocation.getArgument(0);
              return texts.stream().map(text -> new float[] {1f, 0f}).toList();
            });
  }

  private double reloadCount(String status) {
    return meterRegistry.counter("corpus.reload", "status", status).count();
  }

  @Test
  @DisplayName("Should start with an empty snapshot")
  void shouldStartEmpty() {
    assertThat(corpusService.current().isEmpty()).isTrue();
  }

  @Nested
  @DisplayName("reload")
  class Reload {

    @Test
    @DisplayName("Should build and swap in a snapshot with index and embeddings")
    void shouldSwapInNewSnapshot() throws IOException {
      when(corpusSource.listEntities())
          .thenReturn(List.of(lab("1", "Vision Lab", "robot vision"), lab("2", "Grid Lab", "")));
      givenEmbeddingsSucceed();

      CorpusSnapshot snapshot = corpusService.reload();

      assertThat(corpusService.current()).isSameAs(snapshot);
      assertThat(snapshot.size()).isEqualTo(2);
      assertThat(snapshot.hasEmbeddings()).isTrue();
      assertThat(snapshot.findById("2")).isPresent();
      // The lab without text is indexed by its name
      assertThat(snapshot.getLexicalIndex().score("grid")[1]).isPositive();
      assertThat(reloadCount("success")).isEqualTo(1.0);
      assertThat(meterRegistry.timer("corpus.reload.duration").count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep previous snapshot when source fails")
    void shouldKeepPreviousSnapshotOnSourceFailure() throws IOException {
      when(corpusSource.listEntities())
          .thenReturn(List.of(lab("1", "Vision Lab", "robot vision")))
          .thenThrow(new IOException("disk gone"));
      givenEmbeddingsSucceed();
      CorpusSnapshot first = corpusService.reload();

      assertThatThrownBy(() -> corpusService.reload())
          .isInstanceOf(CorpusReloadException.class)
          .hasMessageContaining("disk gone");
      assertThat(corpusService.current()).isSameAs(first);
      assertThat(reloadCount("failure")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should reject empty corpus")
    void shouldRejectEmptyCorpus() throws IOException {
      when(corpusSource.listEntities()).thenReturn(List.of());

      assertThatThrownBy(() -> corpusService.reload())
          .isInstanceOf(CorpusReloadException.class)
          .hasMessageContaining("empty");
      assertThat(corpusService.current().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should reject duplicate ids")
    void shouldRejectDuplicateIds() throws IOException {
      when(corpusSource.listEntities())
          .thenReturn(List.of(lab("1", "A Lab", "x"), lab("1", "B Lab", "y")));

      assertThatThrownBy(() -> corpusService.reload())
          .isInstanceOf(CorpusReloadException.class)
          .hasMessageContaining("Duplicate lab id: 1");
    }

    @Test
    @DisplayName("Should reject labs without a name")
    void shouldRejectLabsWithoutName() throws IOException {
      when(corpusSource.listEntities()).thenReturn(List.of(lab("7", " ", "text")));

      assertThatThrownBy(() -> corpusService.reload())
          .isInstanceOf(CorpusReloadException.class)
          .hasMessageContaining("Lab 7 has no name");
    }
  }

  @Nested
  @DisplayName("Embedding failures")
  class EmbeddingFailures {

    @Test
    @DisplayName("Should fail reload when embeddings are unavailable")
    void shouldFailWhenEmbeddingsUnavailable() throws IOException {
      when(corpusSource.listEntities()).thenReturn(List.of(lab("1", "Vision Lab", "vision")));
      when(embeddingService.encodeAll(anyList(), eq(EmbeddingRole.PASSAGE)))
          .thenThrow(new EmbeddingUnavailableException("timeout"));

      assertThatThrownBy(() -> corpusService.reload())
          .isInstanceOf(CorpusReloadException.class)
          .hasMessageContaining("Passage embeddings unavailable");
      assertThat(corpusService.current().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should build lexical-only snapshot when fallback is allowed")
    void shouldBuildLexicalOnlySnapshot() throws IOException {
      matchingConfig.getRetrieval().setAllowLexicalOnlyFallback(true);
      when(corpusSource.listEntities()).thenReturn(List.of(lab("1", "Vision Lab", "vision")));
      when(embeddingService.encodeAll(anyList(), eq(EmbeddingRole.PASSAGE)))
          .thenThrow(new EmbeddingUnavailableException("timeout"));

      CorpusSnapshot snapshot = corpusService.reload();

      assertThat(snapshot.size()).isEqualTo(1);
      assertThat(snapshot.hasEmbeddings()).isFalse();
    }
  }
}
