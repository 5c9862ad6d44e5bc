package com.flamingo.ai.labmatch.api.dto.response;

import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for the active corpus snapshot. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CorpusStatsResponse {

  private int labCount;
  private boolean embeddingsReady;
  private Instant loadedAt;
  private long embeddingCacheSize;
}
