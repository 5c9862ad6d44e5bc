package com.flamingo.ai.labmatch.service.embedding;

import java.util.List;

/** Vector helpers for L2-normalized embeddings. */
public final class VectorMath {

  private VectorMath() {}

  /** Returns a unit-length copy of the vector. A zero vector is returned unchanged. */
  public static float[] normalize(float[] vector) {
    double norm = norm(vector);
    float[] result = new float[vector.length];
    if (norm == 0.0) {
      return result;
    }
    for (int i = 0; i < vector.length; i++) {
      result[i] = (float) (vector[i] / norm);
    }
    return result;
  }

  public static double norm(float[] vector) {
    double sum = 0.0;
    for (float v : vector) {
      sum += (double) v * v;
    }
    return Math.sqrt(sum);
  }

  public static double dot(float[] a, float[] b) {
    if (a.length != b.length) {
      throw new IllegalArgumentException(
          "Vector dimensions differ: " + a.length + " vs " + b.length);
    }
    double sum = 0.0;
    for (int i = 0; i < a.length; i++) {
      sum += (double) a[i] * b[i];
    }
    return sum;
  }

  /**
   * Cosine similarity of two vectors, clamped to [-1, 1]. Returns 0 when either vector has zero
   * length.
   */
  public static double cosine(float[] a, float[] b) {
    double normA = norm(a);
    double normB = norm(b);
    if (normA == 0.0 || normB == 0.0) {
      return 0.0;
    }
    double cosine = dot(a, b) / (normA * normB);
    return Math.max(-1.0, Math.min(1.0, cosine));
  }

  /** Averages the vectors component-wise and re-normalizes the mean. */
  public static float[] meanPool(List<float[]> vectors) {
    if (vectors.isEmpty()) {
      throw new IllegalArgumentException("Cannot mean-pool an empty vector list");
    }
    int dimension = vectors.get(0).length;
    double[] sum = new double[dimension];
    for (float[] vector : vectors) {
      if (vector.length != dimension) {
        throw new IllegalArgumentException(
            "Vector dimensions differ: " + dimension + " vs " + vector.length);
      }
      for (int i = 0; i < dimension; i++) {
        sum[i] += vector[i];
      }
    }
    float[] mean = new float[dimension];
    for (int i = 0; i < dimension; i++) {
      mean[i] = (float) (sum[i] / vectors.size());
    }
    return normalize(mean);
  }
}
