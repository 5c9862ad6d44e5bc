package com.flamingo.ai.labmatch.api.rest;

import com.flamingo.ai.labmatch.api.dto.request.CandidateRequest;
import com.flamingo.ai.labmatch.api.dto.request.ProfileRequest;
import com.flamingo.ai.labmatch.api.dto.request.RecommendationRequest;
import com.flamingo.ai.labmatch.api.dto.response.CandidateResponse;
import com.flamingo.ai.labmatch.api.dto.response.PresetResponse;
import com.flamingo.ai.labmatch.api.dto.response.RecommendationResponse;
import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.domain.model.Query;
import com.flamingo.ai.labmatch.domain.model.StructuredProfile;
import com.flamingo.ai.labmatch.service.recommend.RecommendationService;
import com.flamingo.ai.labmatch.service.rerank.ScorerConfiguration;
import com.flamingo.ai.labmatch.service.rerank.ScorerPreset;
import com.flamingo.ai.labmatch.service.retrieval.CandidateGenerator;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for lab recommendations. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RecommendationController {

  private final RecommendationService recommendationService;
  private final CandidateGenerator candidateGenerator;
  private final MatchingConfig matchingConfig;

  /** Runs both stages and returns ranked labs with their score breakdown. */
  @PostMapping("/recommendations")
  public ResponseEntity<List<RecommendationResponse>> recommend(
      @Valid @RequestBody RecommendationRequest request) {
    ScorerConfiguration configuration = recommendationService.resolvePreset(request.getPreset());
    if (request.getWeights() != null) {
      configuration = request.getWeights().applyTo(configuration);
    }
    StructuredProfile profile =
        request.getProfile() == null ? StructuredProfile.empty() : request.getProfile().toProfile();

    List<RecommendationResponse> responses =
        recommendationService
            .recommend(
                Query.of(request.getQuery()),
                profile,
                configuration,
                recommendationService.resolveTopK(request.getTopK()))
            .stream()
            .map(RecommendationResponse::fromRecommendation)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Runs stage 1 only. */
  @PostMapping("/candidates")
  public ResponseEntity<List<CandidateResponse>> candidates(
      @Valid @RequestBody CandidateRequest request) {
    int topK =
        request.getTopK() == null
            ? matchingConfig.getRetrieval().getTopK()
            : request.getTopK();
    List<CandidateResponse> responses =
        candidateGenerator.generate(Query.of(request.getQuery()), topK).stream()
            .map(CandidateResponse::fromRecord)
            .toList();
    return ResponseEntity.ok(responses);
  }

  /** Lists the named scorer presets. */
  @GetMapping("/presets")
  public ResponseEntity<List<PresetResponse>> presets() {
    return ResponseEntity.ok(
        Arrays.stream(ScorerPreset.values()).map(PresetResponse::fromPreset).toList());
  }
}
