package com.flamingo.ai.labmatch.service.retrieval;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Okapi BM25 index over a fixed list of documents. Immutable once built; a corpus reload builds a
 * new index rather than updating this one.
 */
public final class LexicalIndex {

  private final List<Map<String, Integer>> termFrequencies;
  private final int[] documentLengths;
  private final Map<String, Integer> documentFrequencies;
  private final double averageDocumentLength;
  private final double k1;
  private final double b;

  private LexicalIndex(
      List<Map<String, Integer>> termFrequencies,
      int[] documentLengths,
      Map<String, Integer> documentFrequencies,
      double k1,
      double b) {
    this.termFrequencies = termFrequencies;
    this.documentLengths = documentLengths;
    this.documentFrequencies = documentFrequencies;
    this.k1 = k1;
    this.b = b;
    long total = 0;
    for (int length : documentLengths) {
      total += length;
    }
    this.averageDocumentLength =
        documentLengths.length == 0 ? 0.0 : (double) total / documentLengths.length;
  }

  /**
   * Tokenizes and indexes the documents.
   *
   * @param documents document texts, in corpus order
   * @param k1 term-frequency saturation, must be non-negative
   * @param b length normalization strength in [0, 1]
   */
  public static LexicalIndex build(List<String> documents, double k1, double b) {
    if (k1 < 0 || b < 0 || b > 1) {
      throw new IllegalArgumentException("Invalid BM25 parameters k1=" + k1 + ", b=" + b);
    }
    List<Map<String, Integer>> frequencies = new ArrayList<>(documents.size());
    int[] lengths = new int[documents.size()];
    Map<String, Integer> documentFrequencies = new HashMap<>();

    for (int i = 0; i < documents.size(); i++) {
      List<String> tokens = TextTokenizer.tokenize(documents.get(i));
      Map<String, Integer> tf = new HashMap<>();
      for (String token : tokens) {
        tf.merge(token, 1, Integer::sum);
      }
      for (String term : tf.keySet()) {
        documentFrequencies.merge(term, 1, Integer::sum);
      }
      frequencies.add(Map.copyOf(tf));
      lengths[i] = tokens.size();
    }
    return new LexicalIndex(
        List.copyOf(frequencies), lengths, Map.copyOf(documentFrequencies), k1, b);
  }

  public static LexicalIndex empty() {
    return build(List.of(), 1.5, 0.75);
  }

  public int size() {
    return documentLengths.length;
  }

  /** Scores every document against the query; all zeros for an empty query or index. */
  public double[] score(String query) {
    double[] scores = new double[size()];
    if (scores.length == 0) {
      return scores;
    }
    for (String term : new LinkedHashSet<>(TextTokenizer.tokenize(query))) {
      Integer df = documentFrequencies.get(term);
      if (df == null) {
        continue;
      }
      double idf = idf(df);
      for (int i = 0; i < scores.length; i++) {
        Integer tf = termFrequencies.get(i).get(term);
        if (tf != null) {
          scores[i] += idf * saturate(tf, documentLengths[i]);
        }
      }
    }
    return scores;
  }

  /** Rarer terms weigh more; always positive so common terms never subtract. */
  double idf(int documentFrequency) {
    int n = size();
    return Math.log(1.0 + (n - documentFrequency + 0.5) / (documentFrequency + 0.5));
  }

  private double saturate(int tf, int documentLength) {
    double lengthRatio = averageDocumentLength == 0 ? 1.0 : documentLength / averageDocumentLength;
    return tf * (k1 + 1) / (tf + k1 * (1 - b + b * lengthRatio));
  }
}
