package com.flamingo.ai.labmatch.service.retrieval;

/** Normalizations that bring lexical and semantic scores onto a common [0, 1] range. */
public final class ScoreNormalizer {

  private static final double EPSILON = 1e-12;

  private ScoreNormalizer() {}

  /**
   * Applies log(1 + x) then min-max scaling. Zero variance yields all zeros.
   *
   * <p>The log dampens the heavy tail of BM25 scores before linear scaling.
   */
  public static double[] logMinMax(double[] raw) {
    double[] logged = new double[raw.length];
    for (int i = 0; i < raw.length; i++) {
      logged[i] = Math.log1p(Math.max(0.0, raw[i]));
    }
    return minMax(logged);
  }

  /**
   * Zeroes scores below the floor and min-max rescales the survivors among themselves.
   *
   * <p>When every survivor has the same score they all map to 1.0, since each cleared the floor.
   */
  public static double[] floorAndRescale(double[] raw, double floor) {
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : raw) {
      if (value >= floor) {
        min = Math.min(min, value);
        max = Math.max(max, value);
      }
    }
    double[] result = new double[raw.length];
    if (min == Double.POSITIVE_INFINITY) {
      return result;
    }
    double range = max - min;
    for (int i = 0; i < raw.length; i++) {
      if (raw[i] < floor) {
        continue;
      }
      result[i] = range < EPSILON ? 1.0 : (raw[i] - min) / range;
    }
    return result;
  }

  static double[] minMax(double[] values) {
    double[] result = new double[values.length];
    if (values.length == 0) {
      return result;
    }
    double min = Double.POSITIVE_INFINITY;
    double max = Double.NEGATIVE_INFINITY;
    for (double value : values) {
      min = Math.min(min, value);
      max = Math.max(max, value);
    }
    double range = max - min;
    if (range < EPSILON) {
      return result;
    }
    for (int i = 0; i < values.length; i++) {
      result[i] = (values[i] - min) / range;
    }
    return result;
  }
}
