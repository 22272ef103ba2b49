package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.knowledge.Chunk;
import java.util.Map;
import java.util.Objects;

/** One stored embedding: the vector, the chunk it was computed from and provenance metadata. */
public record VectorRecord(
    String id,
    String fingerprint,
    String modelId,
    float[] vector,
    Chunk chunk,
    Map<String, String> metadata) {

  public VectorRecord {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(fingerprint, "fingerprint");
    Objects.requireNonNull(modelId, "modelId");
    Objects.requireNonNull(vector, "vector");
    Objects.requireNonNull(chunk, "chunk");
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
