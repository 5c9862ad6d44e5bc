package com.flamingo.ai.labmatch.service.embedding;

import com.flamingo.ai.labmatch.config.MatchingConfig;
import com.flamingo.ai.labmatch.exception.EmbeddingUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Encodes text into L2-normalized vectors using the configured embedding model.
 *
 * <p>Query and passage texts are framed with distinct configurable prefixes, which asymmetric
 * encoders such as the E5 family expect. Results are cached per framed text and model version.
 * Failures are never retried here; the circuit breaker only fails fast while the model is down.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final EmbeddingCache embeddingCache;
  private final MatchingConfig matchingConfig;
  private final MeterRegistry meterRegistry;

  /** Encodes a single text. Blank text is rejected. */
  @CircuitBreaker(name = "embedding", fallbackMethod = "encodeFallback")
  public float[] encode(String text, EmbeddingRole role) {
    return encodeBatch(List.of(text), role).get(0);
  }

  /**
   * Encodes a batch of texts in one model call, skipping texts already cached. The result is
   * aligned with the input order.
   */
  @CircuitBreaker(name = "embedding", fallbackMethod = "encodeAllFallback")
  public List<float[]> encodeAll(List<String> texts, EmbeddingRole role) {
    return encodeBatch(texts, role);
  }

  /** Applies whitespace normalization, truncation and the role prefix. */
  String frame(String text, EmbeddingRole role) {
    String normalized = text == null ? "" : text.strip().replaceAll("\\s+", " ");
    if (normalized.isEmpty()) {
      throw new IllegalArgumentException("Cannot embed blank text");
    }
    int maxChars = matchingConfig.getEmbedding().getMaxChars();
    if (normalized.length() > maxChars) {
      log.warn(
          "Text too long for embedding, truncating from {} chars to {} chars",
          normalized.length(),
          maxChars);
      normalized = normalized.substring(0, maxChars);
    }
    return prefixFor(role) + normalized;
  }

  private List<float[]> encodeBatch(List<String> texts, EmbeddingRole role) {
    if (texts.isEmpty()) {
      return List.of();
    }
    MatchingConfig.Embedding settings = matchingConfig.getEmbedding();
    List<EmbeddingCache.Key> keys = new ArrayList<>(texts.size());
    Map<EmbeddingCache.Key, float[]> resolved = new HashMap<>();
    Map<EmbeddingCache.Key, String> misses = new LinkedHashMap<>();

    for (String text : texts) {
      EmbeddingCache.Key key =
          new EmbeddingCache.Key(
              frame(text, role), settings.getModelName(), settings.getModelVersion());
      keys.add(key);
      if (resolved.containsKey(key) || misses.containsKey(key)) {
        continue;
      }
      Optional<float[]> cached = embeddingCache.get(key);
      if (cached.isPresent()) {
        resolved.put(key, cached.get());
      } else {
        misses.put(key, key.text());
      }
    }

    log.debug(
        "Encoding {} {} texts: {} cached, {} to compute",
        texts.size(),
        tag(role),
        resolved.size(),
        misses.size());

    if (!misses.isEmpty()) {
      List<float[]> computed = callModel(new ArrayList<>(misses.values()), role);
      int i = 0;
      for (EmbeddingCache.Key key : misses.keySet()) {
        float[] vector = computed.get(i++);
        embeddingCache.put(key, vector);
        resolved.put(key, vector);
      }
    }

    List<float[]> result = new ArrayList<>(keys.size());
    for (EmbeddingCache.Key key : keys) {
      result.add(resolved.get(key));
    }
    return result;
  }

  private List<float[]> callModel(List<String> framedTexts, EmbeddingRole role) {
    Response<List<Embedding>> response;
    try {
      List<TextSegment> segments = framedTexts.stream().map(TextSegment::from).toList();
      response = embeddingModel.embedAll(segments);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", tag(role)).increment();
      throw new EmbeddingUnavailableException(
          "Embedding model call failed for " + framedTexts.size() + " texts", e);
    }

    List<Embedding> embeddings = response == null ? null : response.content();
    if (embeddings == null || embeddings.size() != framedTexts.size()) {
      meterRegistry.counter("embedding.requests.failure", "type", tag(role)).increment();
      throw new EmbeddingUnavailableException(
          "Embedding model returned "
              + (embeddings == null ? 0 : embeddings.size())
              + " vectors for "
              + framedTexts.size()
              + " texts");
    }

    meterRegistry.counter("embedding.requests.success", "type", tag(role)).increment();
    List<float[]> vectors = new ArrayList<>(embeddings.size());
    for (Embedding embedding : embeddings) {
      vectors.add(VectorMath.normalize(embedding.vector()));
    }
    return vectors;
  }

  private String prefixFor(EmbeddingRole role) {
    MatchingConfig.Embedding settings = matchingConfig.getEmbedding();
    String prefix =
        role == EmbeddingRole.QUERY ? settings.getQueryPrefix() : settings.getPassagePrefix();
    return prefix == null ? "" : prefix;
  }

  private static String tag(EmbeddingRole role) {
    return role.name().toLowerCase(Locale.ROOT);
  }

  @SuppressWarnings("unused")
  private float[] encodeFallback(String text, EmbeddingRole role, CallNotPermittedException e) {
    log.error("Embedding circuit open, rejecting {} request: {}", tag(role), e.getMessage());
    throw new EmbeddingUnavailableException("Embedding circuit breaker is open", e);
  }

  @SuppressWarnings("unused")
  private List<float[]> encodeAllFallback(
      List<String> texts, EmbeddingRole role, CallNotPermittedException e) {
    log.error(
        "Embedding circuit open, rejecting batch of {} {} texts: {}",
        texts.size(),
        tag(role),
        e.getMessage());
    throw new EmbeddingUnavailableException("Embedding circuit breaker is open", e);
  }
}
