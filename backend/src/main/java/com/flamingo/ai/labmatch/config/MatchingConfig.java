package com.flamingo.ai.labmatch.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the matching pipeline. */
@Configuration
@ConfigurationProperties(prefix = "matching")
@Getter
@Setter
public class MatchingConfig {

  private Corpus corpus = new Corpus();
  private Embedding embedding = new Embedding();
  private Retrieval retrieval = new Retrieval();
  private Reranking reranking = new Reranking();

  @Getter
  @Setter
  public static class Corpus {
    private String labsPath = "data/corpus/labs.json";
    private String documentsPath = "data/corpus/documents.json";

    /** Whether the corpus snapshot is built when the application starts. */
    private boolean loadOnStartup = true;

    /** Documents kept per lab and section when section text is assembled. */
    private int maxDocumentsPerSection = 3;
  }

  @Getter
  @Setter
  public static class Embedding {
    private String modelName = "text-embedding-3-small";

    /** Bumped whenever the model changes in a way that invalidates cached vectors. */
    private int modelVersion = 1;

    /**
     * Framing applied to query text. Asymmetric encoders (E5 family) are trained with distinct
     * query and passage prefixes.
     */
    private String queryPrefix = "query: ";

    private String passagePrefix = "passage: ";
    private int cacheMaxSize = 10_000;
    private int maxChars = 5000;
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int topK = 15;

    /** Cosine similarities below this value carry no signal and are zeroed. */
    private double similarityFloor = 0.70;

    private double keywordWeight = 0.5;
    private double semanticWeight = 0.5;

    /** Domain scores above this value replace a weaker lexical score. */
    private double domainSubstitutionThreshold = 0.3;

    /** Combined score at which a topically disjoint candidate is still kept. */
    private double negativeFilterOverride = 0.8;

    private double minCombinedScore = 0.05;
    private double bm25K1 = 1.5;
    private double bm25B = 0.75;

    /**
     * Serve lexical-only candidates when the embedding model cannot be reached. Off by default:
     * an unavailable model is a startup failure.
     */
    private boolean allowLexicalOnlyFallback = false;
  }

  @Getter
  @Setter
  public static class Reranking {
    /** Preset used when a request names none. */
    private String defaultPreset = "default";

    private int defaultTopK = 5;
    private int maxTopK = 50;
  }
}
