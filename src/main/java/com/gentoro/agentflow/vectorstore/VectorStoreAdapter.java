package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.exception.VectorStoreException;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Uniform facade over the vector store backends.
 *
 * <p>Collections are addressed by {@link CollectionConfig#namespaceKey()}; configurations sharing
 * the key share the same data. Each collection is guarded by a {@link ReentrantReadWriteLock}:
 * queries run concurrently, writes are exclusive, and a query sees either none or all of an upsert
 * batch. A collection is unregistered while its write lock is held, so an operation that raced
 * with {@link #deleteCollection} works on the collection as it exists afterwards.
 */
public class VectorStoreAdapter {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(VectorStoreAdapter.class);

  public static final String META_SOURCE = "source";
  public static final String META_DOCUMENT_ID = "documentId";
  public static final String META_SEQUENCE = "sequenceIndex";
  public static final String META_SPAN = "span";
  public static final String META_SECTION = "sectionPath";
  public static final String META_MODEL = "modelId";

  private final VectorStoreProviders providers;
  private final Map<CollectionConfig.NamespaceKey, Handle> handles = new ConcurrentHashMap<>();

  public VectorStoreAdapter(VectorStoreProviders providers) {
    this.providers = providers;
  }

  public VectorStoreProviders providers() {
    return providers;
  }

  public void upsert(CollectionConfig collection, List<VectorRecord> items) {
    if (items.isEmpty()) return;
    write(collection, true, null, h -> {
      h.store().upsert(items);
      return null;
    });
    log.debug("Upserted {} vectors into {}", items.size(), collection.namespaceKey());
  }

  /** Top-{@code k} chunks; an unknown or empty collection yields an empty result. */
  public RetrievalResult query(CollectionConfig collection, float[] vector, int k) {
    if (k <= 0) return RetrievalResult.empty();
    return read(
        collection,
        RetrievalResult.empty(),
        h -> new RetrievalResult(h.store().query(vector, k)));
  }

  public boolean deleteCollection(CollectionConfig collection) {
    boolean deleted =
        write(collection, false, false, h -> {
          h.store().drop();
          handles.remove(collection.namespaceKey(), h);
          return true;
        });
    if (deleted) log.info("Deleted collection {}", collection.namespaceKey());
    return deleted;
  }

  public boolean contains(CollectionConfig collection) {
    return handle(collection, false) != null;
  }

  public int size(CollectionConfig collection) {
    return read(collection, 0, h -> h.store().size());
  }

  /** Fingerprints already stored in the collection for {@code modelId}. */
  public Set<String> fingerprints(CollectionConfig collection, String modelId) {
    return read(collection, Set.of(), h -> Set.copyOf(h.store().fingerprints(modelId)));
  }

  /** Records embedded with another model, still stored. Replace them with {@link #upsert}. */
  public List<VectorRecord> staleRecords(CollectionConfig collection, String activeModelId) {
    return read(collection, List.of(), h -> List.copyOf(h.store().stale(activeModelId)));
  }

  /** Remove the records embedded with another model and return them for re-embedding. */
  public List<VectorRecord> invalidateStale(CollectionConfig collection, String activeModelId) {
    List<VectorRecord> removed =
        write(collection, false, List.of(), h -> h.store().removeStale(activeModelId));
    if (!removed.isEmpty()) {
      log.info(
          "Invalidated {} vectors of {} not embedded with {}",
          removed.size(),
          collection.namespaceKey(),
          activeModelId);
    }
    return removed;
  }

  private Handle handle(CollectionConfig collection, boolean create) {
    Handle h = handles.get(collection.namespaceKey());
    if (h != null) return h;
    VectorStoreProvider provider = providers.get(collection.provider());
    if (!create && !provider.exists(collection)) return null;
    return handles.computeIfAbsent(
        collection.namespaceKey(),
        key -> {
          try {
            return new Handle(provider.open(collection), new ReentrantReadWriteLock());
          } catch (VectorStoreException e) {
            throw e;
          } catch (RuntimeException e) {
            throw new VectorStoreException("Failed to open collection " + key, e);
          }
        });
  }

  // A handle dropped while we waited for its lock is stale: look the collection up again.
  private <T> T read(CollectionConfig collection, T absent, Function<Handle, T> body) {
    while (true) {
      Handle h = handle(collection, false);
      if (h == null) return absent;
      h.lock().readLock().lock();
      try {
        if (handles.get(collection.namespaceKey()) == h) {
          return guard(collection, () -> body.apply(h));
        }
      } finally {
        h.lock().readLock().unlock();
      }
    }
  }

  private <T> T write(
      CollectionConfig collection, boolean create, T absent, Function<Handle, T> body) {
    while (true) {
      Handle h = handle(collection, create);
      if (h == null) return absent;
      h.lock().writeLock().lock();
      try {
        if (handles.get(collection.namespaceKey()) == h) {
          return guard(collection, () -> body.apply(h));
        }
      } finally {
        h.lock().writeLock().unlock();
      }
    }
  }

  private static <T> T guard(CollectionConfig collection, Supplier<T> body) {
    try {
      return body.get();
    } catch (VectorStoreException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new VectorStoreException(
          "Vector store operation failed on " + collection.namespaceKey(), e);
    }
  }

  private record Handle(VectorStore store, ReentrantReadWriteLock lock) {}
}
