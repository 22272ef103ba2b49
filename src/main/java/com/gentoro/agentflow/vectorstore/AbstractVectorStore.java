package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.exception.VectorStoreException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Exact nearest-neighbour search over records kept in insertion order. Subclasses decide where the
 * records live between runs through {@link #persist()}.
 */
public abstract class AbstractVectorStore implements VectorStore {
  protected final CollectionConfig config;
  protected final LinkedHashMap<String, VectorRecord> records = new LinkedHashMap<>();

  protected AbstractVectorStore(CollectionConfig config) {
    this.config = config;
  }

  /** Called after every mutation. */
  protected abstract void persist();

  @Override
  public void upsert(List<VectorRecord> batch) {
    if (batch.isEmpty()) return;
    Set<String> replaced = new HashSet<>();
    batch.forEach(r -> replaced.add(r.id()));
    int dimension = dimensionExcluding(replaced);
    for (VectorRecord r : batch) {
      if (dimension < 0) dimension = r.vector().length;
      if (r.vector().length != dimension) {
        throw new VectorStoreException(
            "Vector dimension mismatch in collection '%s': expected %d, got %d for %s"
                .formatted(config.collectionName(), dimension, r.vector().length, r.id()));
      }
    }
    for (VectorRecord r : batch) {
      records.put(r.id(), r);
    }
    persist();
  }

  @Override
  public List<ScoredChunk> query(float[] vector, int k) {
    if (k <= 0 || records.isEmpty()) return List.of();
    int dimension = dimension();
    if (vector.length != dimension) {
      throw new VectorStoreException(
          "Query dimension %d does not match collection '%s' dimension %d"
              .formatted(vector.length, config.collectionName(), dimension));
    }
    List<ScoredChunk> scored = new ArrayList<>(records.size());
    for (VectorRecord r : records.values()) {
      double score = config.distanceMetric().score(vector, r.vector());
      scored.add(new ScoredChunk(r.chunk(), score, r.metadata()));
    }
    // List.sort is stable: equal scores stay in insertion order
    scored.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
    return List.copyOf(scored.subList(0, Math.min(k, scored.size())));
  }

  @Override
  public int size() {
    return records.size();
  }

  @Override
  public Set<String> fingerprints(String modelId) {
    Set<String> out = new HashSet<>();
    for (VectorRecord r : records.values()) {
      if (r.modelId().equals(modelId)) out.add(r.fingerprint());
    }
    return out;
  }

  @Override
  public List<VectorRecord> stale(String activeModelId) {
    List<VectorRecord> out = new ArrayList<>();
    for (VectorRecord r : records.values()) {
      if (!r.modelId().equals(activeModelId)) out.add(r);
    }
    return out;
  }

  @Override
  public List<VectorRecord> removeStale(String activeModelId) {
    List<VectorRecord> removed = new ArrayList<>();
    Iterator<Map.Entry<String, VectorRecord>> it = records.entrySet().iterator();
    while (it.hasNext()) {
      VectorRecord r = it.next().getValue();
      if (!r.modelId().equals(activeModelId)) {
        removed.add(r);
        it.remove();
      }
    }
    if (!removed.isEmpty()) persist();
    return removed;
  }

  private int dimension() {
    return dimensionExcluding(Set.of());
  }

  private int dimensionExcluding(Set<String> ids) {
    for (VectorRecord r : records.values()) {
      if (!ids.contains(r.id())) return r.vector().length;
    }
    return -1;
  }
}
