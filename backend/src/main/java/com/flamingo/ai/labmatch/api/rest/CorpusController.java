package com.flamingo.ai.labmatch.api.rest;

import com.flamingo.ai.labmatch.api.dto.response.CorpusStatsResponse;
import com.flamingo.ai.labmatch.service.corpus.CorpusService;
import com.flamingo.ai.labmatch.service.corpus.CorpusSnapshot;
import com.flamingo.ai.labmatch.service.embedding.EmbeddingCache;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for the corpus snapshot. */
@RestController
@RequestMapping("/api/corpus")
@RequiredArgsConstructor
public class CorpusController {

  private final CorpusService corpusService;
  private final EmbeddingCache embeddingCache;

  /** Rebuilds the snapshot from the corpus source; on failure the old snapshot stays active. */
  @PostMapping("/reload")
  public ResponseEntity<CorpusStatsResponse> reload() {
    return ResponseEntity.ok(toStats(corpusService.reload()));
  }

  @GetMapping("/stats")
  public ResponseEntity<CorpusStatsResponse> stats() {
    return ResponseEntity.ok(toStats(corpusService.current()));
  }

  private CorpusStatsResponse toStats(CorpusSnapshot snapshot) {
    return CorpusStatsResponse.builder()
        .labCount(snapshot.size())
        .embeddingsReady(snapshot.hasEmbeddings())
        .loadedAt(snapshot.getLoadedAt())
        .embeddingCacheSize(embeddingCache.size())
        .build();
  }
}
