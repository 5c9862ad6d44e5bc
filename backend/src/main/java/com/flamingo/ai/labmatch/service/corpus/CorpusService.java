package com.flamingo.ai.labmatch.service.corpus;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.exception.CorpusReloadException;
import com.flamingo.ai.labmatch.exception.EmbeddingUnavailableException;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingRole;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingService;
import com.flamingo.ai.labmatch.service.retrieval.LexicalIndex;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Owns the active corpus snapshot. A reload builds the replacement off to the side and swaps it in
 * atomically; when any step fails the active snapshot is left untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CorpusService {

  private final CorpusSource corpusSource;
  private final EmbeddingService embeddingService;
  private final MatchingConfig matchingConfig;
  private final MeterRegistry meterRegistry;

  private final AtomicReference<CorpusSnapshot> active =
      new AtomicReference<>(CorpusSnapshot.empty());

  /** The snapshot currently in service. Never null; empty before the first load. */
  public CorpusSnapshot current() {
    return active.get();
  }

  /**
   * Rebuilds the snapshot from the corpus source. Concurrent reloads are serialized; readers keep
   * using the previous snapshot until the swap.
   *
   * @throws CorpusReloadException if the source cannot be read, the data is invalid, or passage
   *     embeddings cannot be computed
   */
  public synchronized CorpusSnapshot reload() {
    log.info("Reloading corpus from {}", corpusSource.describe());
    Timer.Sample sample = Timer.start();
    try {
      CorpusSnapshot snapshot = build(readEntities());
      CorpusSnapshot previous = active.getAndSet(snapshot);
      meterRegistry.counter("corpus.reload", "status", "success").increment();
      log.info(
          "Corpus reloaded: {} labs (previously {}), embeddings {}",
          snapshot.size(),
          previous.size(),
          snapshot.hasEmbeddings() ? "ready" : "disabled");
      return snapshot;
    } catch (CorpusReloadException e) {
      meterRegistry.counter("corpus.reload", "status", "failure").increment();
      log.warn(
          "Corpus reload rejected, keeping {} active labs: {}",
          active.get().size(),
          e.getMessage());
      throw e;
    } finally {
      sample.stop(meterRegistry.timer("corpus.reload.duration"));
    }
  }

  private List<CorpusEntity> readEntities() {
    try {
      return corpusSource.listEntities();
    } catch (IOException | RuntimeException e) {
      throw new CorpusReloadException("Failed to read corpus: " + e.getMessage(), e);
    }
  }

  CorpusSnapshot build(List<CorpusEntity> entities) {
    validate(entities);
    List<String> texts = entities.stream().map(CorpusService::indexText).toList();

    MatchingConfig.Retrieval retrieval = matchingConfig.getRetrieval();
    LexicalIndex index = LexicalIndex.build(texts, retrieval.getBm25K1(), retrieval.getBm25B());

    List<float[]> embeddings;
    try {
      embeddings = embeddingService.encodeAll(texts, EmbeddingRole.PASSAGE);
    } catch (EmbeddingUnavailableException e) {
      if (!retrieval.isAllowLexicalOnlyFallback()) {
        throw new CorpusReloadException("Passage embeddings unavailable: " + e.getMessage(), e);
      }
      log.warn("Embedding model unavailable, building lexical-only snapshot: {}", e.getMessage());
      embeddings = List.of();
    }
    if (!embeddings.isEmpty() && embeddings.size() != entities.size()) {
      throw new CorpusReloadException(
          "Got " + embeddings.size() + " passage embeddings for " + entities.size() + " labs");
    }
    return new CorpusSnapshot(entities, index, embeddings, Instant.now());
  }

  private static void validate(List<CorpusEntity> entities) {
    if (entities == null || entities.isEmpty()) {
      throw new CorpusReloadException("Corpus is empty");
    }
    Set<String> ids = new HashSet<>();
    for (CorpusEntity entity : entities) {
      if (entity.getId() == null || entity.getId().isBlank()) {
        throw new CorpusReloadException("Corpus contains a lab without an id");
      }
      if (entity.getName() == null || entity.getName().isBlank()) {
        throw new CorpusReloadException("Lab " + entity.getId() + " has no name");
      }
      if (!ids.add(entity.getId())) {
        throw new CorpusReloadException("Duplicate lab id: " + entity.getId());
      }
    }
  }

  /** Search text, or the lab name when no text was extracted. */
  private static String indexText(CorpusEntity entity) {
    String text = entity.searchText();
    return text.isBlank() ? entity.getName() : text;
  }
}
