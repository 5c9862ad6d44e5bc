package com.flamingo.ai.labmatch.config;

import com.flamingo.ai.labmatch.service.corpus.CorpusService;
import com.flamingo.ai.labmatch.service.corpus.CorpusSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Builds the initial corpus snapshot on application startup.
 *
 * <p>A failed load is fatal: the exception propagates and aborts startup, so the service never
 * comes up serving an empty corpus or silently without embeddings.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CorpusStartupLoader implements CommandLineRunner {

  private final CorpusService corpusService;
  private final MatchingConfig matchingConfig;

  @Override
  public void run(String... args) {
    if (!matchingConfig.getCorpus().isLoadOnStartup()) {
      log.info("Corpus loading on startup disabled, waiting for an explicit reload");
      return;
    }
    try {
      CorpusSnapshot snapshot = corpusService.reload();
      log.info("Initial corpus loaded with {} labs", snapshot.size());
    } catch (RuntimeException e) {
      log.error("Initial corpus load failed, aborting startup: {}", e.getMessage());
      throw e;
    }
  }
}
