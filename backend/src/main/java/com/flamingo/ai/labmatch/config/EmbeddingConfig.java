package com.flamingo.ai.labmatch.config;

import com.flamingo.ai.labmatch.service.embedding.EmbeddingCache;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for the shared embedding cache. */
@Configuration
public class EmbeddingConfig {

  @Bean
  public EmbeddingCache embeddingCache(MatchingConfig matchingConfig, MeterRegistry meterRegistry) {
    EmbeddingCache cache = new EmbeddingCache(matchingConfig.getEmbedding().getCacheMaxSize());
    cache.bindTo(meterRegistry);
    return cache;
  }
}
