package com.flamingo.ai.labmatch.api.dto.response;

import com.flamingo.ai.labmatch.service.retrieval.CandidateScoreRecord;
import com.flamingo.ai.labmatch.service.retrieval.SignalSource;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a stage-1 candidate with its score breakdown. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateResponse {

  private String labId;
  private String name;
  private String owner;
  private double rawLexicalScore;
  private double lexicalScore;
  private double rawSemanticScore;
  private double semanticScore;
  private double domainScore;
  private double effectiveLexicalScore;
  private Set<String> matchedCategories;
  private double combinedScore;
  private Set<SignalSource> sources;

  public static CandidateResponse fromRecord(CandidateScoreRecord record) {
    return CandidateResponse.builder()
        .labId(record.entity().getId())
        .name(record.entity().getName())
        .owner(record.entity().getOwner())
        .rawLexicalScore(record.rawLexicalScore())
        .lexicalScore(record.lexicalScore())
        .rawSemanticScore(record.rawSemanticScore())
        .semanticScore(record.semanticScore())
        .domainScore(record.domainScore())
        .effectiveLexicalScore(record.effectiveLexicalScore())
        .matchedCategories(record.matchedCategories())
        .combinedScore(record.combinedScore())
        .sources(record.sources())
        .build();
  }
}
