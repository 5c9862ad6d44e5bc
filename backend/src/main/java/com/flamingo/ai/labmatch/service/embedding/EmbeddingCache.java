package com.flamingo.ai.labmatch.service.embedding;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Bounded, thread-safe cache of computed embeddings.
 *
 * <p>Entries are keyed by the framed text and the model identity and version, so a model upgrade
 * never serves stale vectors. Cached arrays are shared and must not be modified by callers.
 */
public class EmbeddingCache {

  /** Cache key: normalized framed text plus model identity. */
  public record Key(String text, String modelName, int modelVersion) {}

  private final Cache<Key, float[]> cache;
  private final long maxSize;

  public EmbeddingCache(long maxSize) {
    this(maxSize, ForkJoinPool.commonPool());
  }

  EmbeddingCache(long maxSize, Executor maintenanceExecutor) {
    if (maxSize <= 0) {
      throw new IllegalArgumentException("Embedding cache size must be positive: " + maxSize);
    }
    this.maxSize = maxSize;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(maxSize)
            .executor(maintenanceExecutor)
            .recordStats()
            .build();
  }

  public Optional<float[]> get(Key key) {
    return Optional.ofNullable(cache.getIfPresent(key));
  }

  public void put(Key key, float[] vector) {
    cache.put(key, vector);
  }

  public long size() {
    return cache.estimatedSize();
  }

  public long getMaxSize() {
    return maxSize;
  }

  public void clear() {
    cache.invalidateAll();
  }

  /** Runs pending eviction work; size is within bounds afterwards. */
  void cleanUp() {
    cache.cleanUp();
  }

  /** Publishes hit, miss and eviction statistics. */
  public void bindTo(MeterRegistry registry) {
    CaffeineCacheMetrics.monitor(registry, cache, "embeddings");
  }
}
