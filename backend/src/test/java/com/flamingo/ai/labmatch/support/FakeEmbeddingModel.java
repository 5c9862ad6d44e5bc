package com.flamingo.ai.labmatch.support;

import com.flamingo.ai.labmatch.service.retrieval.TextTokenizer;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedding model: each token increments one hashed dimension. Texts
 * sharing tokens have positive cosine, disjoint texts score zero. The role prefix is stripped so
 * it does not count as shared vocabulary.
 */
public class FakeEmbeddingModel implements EmbeddingModel {

  public static final int DIMENSION = 256;

  private final AtomicInteger calls = new AtomicInteger();
  private final List<String> embeddedTexts = new ArrayList<>();

  @Override
  public Response<List<Embedding>> embedAll(List<TextSegment> textSegments) {
    calls.incrementAndGet();
    List<Embedding> embeddings = new ArrayList<>(textSegments.size());
    for (TextSegment segment : textSegments) {
      synchronized (embeddedTexts) {
        embeddedTexts.add(segment.text());
      }
      embeddings.add(Embedding.from(vectorFor(segment.text())));
    }
    return Response.from(embeddings);
  }

  public static float[] vectorFor(String text) {
    float[] vector = new float[DIMENSION];
    for (String token : TextTokenizer.tokenize(stripPrefix(text))) {
      vector[Math.floorMod(token.hashCode(), DIMENSION)] += 1f;
    }
    return vector;
  }

  private static String stripPrefix(String text) {
    if (text.startsWith("query: ")) {
      return text.substring("query: ".length());
    }
    if (text.startsWith("passage: ")) {
      return text.substring("passage: ".length());
    }
    return text;
  }

  public int getCalls() {
    return calls.get();
  }

  public List<String> getEmbeddedTexts() {
    synchronized (embeddedTexts) {
      return List.copyOf(embeddedTexts);
    }
  }
}
