package com.gentoro.agentflow.vectorstore;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.ConfigException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DistanceMetricTest {

  @Test
  @DisplayName("Cosine similarity ignores magnitude and scores a zero vector as 0")
  void cosine() {
    assertEquals(1.0, DistanceMetric.COSINE.score(new float[] {1, 2}, new float[] {2, 4}), 1e-9);
    assertEquals(0.0, DistanceMetric.COSINE.score(new float[] {1, 0}, new float[] {0, 3}), 1e-9);
    assertEquals(0.0, DistanceMetric.COSINE.score(new float[] {0, 0}, new float[] {1, 1}));
  }

  @Test
  @DisplayName("Euclidean scores are 1 / (1 + distance)")
  void euclidean() {
    assertEquals(1.0, DistanceMetric.EUCLIDEAN.score(new float[] {1, 1}, new float[] {1, 1}));
    assertEquals(
        1.0 / 6.0, DistanceMetric.EUCLIDEAN.score(new float[] {0, 0}, new float[] {3, 4}), 1e-9);
  }

  @Test
  @DisplayName("Metric names are parsed case-insensitively with cosine as default")
  void parse() {
    assertEquals(DistanceMetric.COSINE, DistanceMetric.parse(null));
    assertEquals(DistanceMetric.EUCLIDEAN, DistanceMetric.parse("euclidean"));
    assertEquals(DistanceMetric.EUCLIDEAN, DistanceMetric.parse("L2"));
    assertThrows(ConfigException.class, () -> DistanceMetric.parse("manhattan"));
  }
}
