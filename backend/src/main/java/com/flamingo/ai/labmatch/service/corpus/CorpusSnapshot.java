package com.flamingo.ai.labmatch.service.corpus;

import com.flamingo.ai.labmatch.domain.model.CorpusEntity;
import com.flamingo.ai.labmatch.service.retrieval.LexicalIndex;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Getter;

/**
 * Point-in-time view of the corpus with its lexical index and passage embeddings. Read-only and
 * shared across concurrent requests; a reload replaces the whole snapshot.
 */
@Getter
public final class CorpusSnapshot {

  private final List<CorpusEntity> entities;
  private final LexicalIndex lexicalIndex;

  /** Aligned with {@link #entities}; empty when the snapshot was built lexical-only. */
  private final List<float[]> passageEmbeddings;

  private final Instant loadedAt;

  public CorpusSnapshot(
      List<CorpusEntity> entities,
      LexicalIndex lexicalIndex,
      List<float[]> passageEmbeddings,
      Instant loadedAt) {
    if (lexicalIndex.size() != entities.size()) {
      throw new IllegalArgumentException(
          "Lexical index covers " + lexicalIndex.size() + " of " + entities.size() + " entities");
    }
    if (!passageEmbeddings.isEmpty() && passageEmbeddings.size() != entities.size()) {
      throw new IllegalArgumentException(
          "Got " + passageEmbeddings.size() + " embeddings for " + entities.size() + " entities");
    }
    this.entities = List.copyOf(entities);
    this.lexicalIndex = lexicalIndex;
    this.passageEmbeddings = List.copyOf(passageEmbeddings);
    this.loadedAt = loadedAt;
  }

  public static CorpusSnapshot empty() {
    return new CorpusSnapshot(List.of(), LexicalIndex.empty(), List.of(), Instant.EPOCH);
  }

  public int size() {
    return entities.size();
  }

  public boolean isEmpty() {
    return entities.isEmpty();
  }

  public boolean hasEmbeddings() {
    return !passageEmbeddings.isEmpty();
  }

  public float[] passageEmbedding(int index) {
    return passageEmbeddings.get(index);
  }

  public Optional<CorpusEntity> findById(String id) {
    return entities.stream().filter(entity -> entity.getId().equals(id)).findFirst();
  }
}
