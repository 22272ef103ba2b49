package com.gentoro.agentflow.vectorstore;

import java.util.List;
import java.util.Set;

/**
 * Backend for a single collection. Implementations are not thread-safe on their own; {@link
 * VectorStoreAdapter} serializes writers and admits concurrent readers.
 */
public interface VectorStore {

  /**
   * Insert or replace records by id. A replaced record keeps its original insertion position.
   * Records replaced by the batch do not count when checking the vector dimension.
   */
  void upsert(List<VectorRecord> records);

  /** Top-{@code k} records by similarity; equal scores keep insertion order. */
  List<ScoredChunk> query(float[] vector, int k);

  int size();

  /** Fingerprints of records embedded with {@code modelId}. */
  Set<String> fingerprints(String modelId);

  /** Every record whose model differs from {@code activeModelId}, left in place. */
  List<VectorRecord> stale(String activeModelId);

  /** Remove and return every record whose model differs from {@code activeModelId}. */
  List<VectorRecord> removeStale(String activeModelId);

  /** Delete all data of the collection, including anything persisted. */
  void drop();
}
