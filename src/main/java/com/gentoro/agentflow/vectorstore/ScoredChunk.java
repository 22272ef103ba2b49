package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.knowledge.Chunk;
import java.util.Map;

public record ScoredChunk(Chunk chunk, double score, Map<String, String> metadata) {
  public ScoredChunk {
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /** Source path the chunk was ingested from, or the document id when unknown. */
  public String source() {
    return metadata.getOrDefault(VectorStoreAdapter.META_SOURCE, chunk.documentId());
  }
}
