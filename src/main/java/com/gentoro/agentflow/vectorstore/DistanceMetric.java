package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.exception.ConfigException;
import java.util.Locale;

/** Similarity function used to rank stored vectors. Scores are always "higher is closer". */
public enum DistanceMetric {
  COSINE {
    @Override
    public double score(float[] a, float[] b) {
      double dot = 0, na = 0, nb = 0;
      for (int i = 0; i < a.length; i++) {
        dot += (double) a[i] * b[i];
        na += (double) a[i] * a[i];
        nb += (double) b[i] * b[i];
      }
      if (na == 0 || nb == 0) return 0.0;
      return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
  },
  EUCLIDEAN {
    @Override
    public double score(float[] a, float[] b) {
      double sum = 0;
      for (int i = 0; i < a.length; i++) {
        double d = (double) a[i] - b[i];
        sum += d * d;
      }
      return 1.0 / (1.0 + Math.sqrt(sum));
    }
  };

  /** Similarity of two equally sized vectors. */
  public abstract double score(float[] a, float[] b);

  public static DistanceMetric parse(String value) {
    if (value == null || value.isBlank()) return COSINE;
    String v = value.trim().toUpperCase(Locale.ROOT);
    if ("L2".equals(v)) return EUCLIDEAN;
    try {
      return DistanceMetric.valueOf(v);
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown distance metric: " + value, e);
    }
  }
}
