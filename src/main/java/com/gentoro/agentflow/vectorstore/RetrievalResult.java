package com.gentoro.agentflow.vectorstore;

import java.util.List;

/** Chunks ordered by non-increasing score. */
public record RetrievalResult(List<ScoredChunk> items) {
  private static final RetrievalResult EMPTY = new RetrievalResult(List.of());

  public RetrievalResult {
    items = List.copyOf(items);
  }

  public static RetrievalResult empty() {
    return EMPTY;
  }

  public boolean isEmpty() {
    return items.isEmpty();
  }

  public int size() {
    return items.size();
  }
}
