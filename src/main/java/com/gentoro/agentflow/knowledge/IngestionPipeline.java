package com.gentoro.agentflow.knowledge;

import com.gentoro.agentflow.embedding.EmbeddingClient;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.IngestionException;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.VectorRecord;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads, chunks, embeds and stores knowledge sources.
 *
 * <p>Chunks whose fingerprint is already stored for the active embedding model are not embedded
 * again, so re-ingesting a document is a no-op. Vectors computed with a different model are
 * re-embedded before new chunks are considered. All vectors of one document are written in a
 * single upsert.
 */
public class IngestionPipeline {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(IngestionPipeline.class);

  private final DocumentLoader loader;
  private final Chunker chunker;
  private final EmbeddingClient embeddingClient;
  private final VectorStoreAdapter vectorStore;
  private final int batchSize;

  public IngestionPipeline(
      DocumentLoader loader,
      Chunker chunker,
      EmbeddingClient embeddingClient,
      VectorStoreAdapter vectorStore,
      int batchSize) {
    if (batchSize <= 0) throw new IllegalArgumentException("batchSize must be > 0");
    this.loader = loader;
    this.chunker = chunker;
    this.embeddingClient = embeddingClient;
    this.vectorStore = vectorStore;
    this.batchSize = batchSize;
  }

  /**
   * Ingest an already loaded document.
   *
   * @throws com.gentoro.agentflow.exception.EmbeddingServiceException when embedding fails after
   *     the retry budget; nothing of this document is stored in that case and vectors of an
   *     earlier model stay as they were.
   */
  public IngestReport ingest(Document document, CollectionConfig collection) {
    String modelId = embeddingClient.modelId();
    int restored = reembedStale(collection, modelId);

    List<Chunk> chunks = chunker.chunk(document);
    Set<String> known = new HashSet<>(vectorStore.fingerprints(collection, modelId));
    List<Chunk> pending = new ArrayList<>();
    for (Chunk c : chunks) {
      if (known.add(c.fingerprint())) {
        pending.add(c);
      }
    }

    List<VectorRecord> records = new ArrayList<>(pending.size());
    for (int from = 0; from < pending.size(); from += batchSize) {
      List<Chunk> batch = pending.subList(from, Math.min(pending.size(), from + batchSize));
      List<float[]> vectors = embeddingClient.embed(batch.stream().map(Chunk::text).toList());
      for (int i = 0; i < batch.size(); i++) {
        Chunk c = batch.get(i);
        records.add(
            new VectorRecord(
                c.id(),
                c.fingerprint(),
                modelId,
                vectors.get(i),
                c,
                metadata(document.sourcePath(), c, modelId)));
      }
    }
    vectorStore.upsert(collection, records);

    IngestReport report =
        new IngestReport(
            document.id(),
            document.sourcePath(),
            collection.namespaceKey().toString(),
            chunks.size(),
            records.size(),
            chunks.size() - records.size(),
            restored);
    log.info(
        "Ingested {} into {}: {} chunks, {} embedded, {} already present",
        document.sourcePath(),
        collection.namespaceKey(),
        report.totalChunks(),
        report.embeddedChunks(),
        report.skippedChunks());
    return report;
  }

  public IngestReport ingest(Path source, CollectionConfig collection) {
    return ingest(loader.load(source), collection);
  }

  /**
   * Ingest many sources. Unreadable sources are skipped and reported; embedding and vector store
   * failures propagate to the caller.
   */
  public KnowledgeLoadReport ingestAll(List<Path> sources, CollectionConfig collection) {
    List<IngestReport> reports = new ArrayList<>();
    Map<String, String> failures = new LinkedHashMap<>();
    for (Path source : sources) {
      try {
        reports.add(ingest(source, collection));
      } catch (IngestionException e) {
        log.warn("Skipping knowledge source {}: {}", source, ExceptionUtil.summarize(e));
        failures.put(source.toString(), e.getMessage());
      }
    }
    return new KnowledgeLoadReport(reports, failures);
  }

  /** Stale vectors are replaced by id in one upsert, so a failed embed leaves them untouched. */
  private int reembedStale(CollectionConfig collection, String modelId) {
    List<VectorRecord> stale = vectorStore.staleRecords(collection, modelId);
    if (stale.isEmpty()) return 0;
    List<VectorRecord> refreshed = new ArrayList<>(stale.size());
    for (int from = 0; from < stale.size(); from += batchSize) {
      List<VectorRecord> batch = stale.subList(from, Math.min(stale.size(), from + batchSize));
      List<float[]> vectors =
          embeddingClient.embed(batch.stream().map(r -> r.chunk().text()).toList());
      for (int i = 0; i < batch.size(); i++) {
        VectorRecord old = batch.get(i);
        Map<String, String> meta = new LinkedHashMap<>(old.metadata());
        meta.put(VectorStoreAdapter.META_MODEL, modelId);
        refreshed.add(
            new VectorRecord(
                old.id(), old.fingerprint(), modelId, vectors.get(i), old.chunk(), meta));
      }
    }
    vectorStore.upsert(collection, refreshed);
    log.info(
        "Re-embedded {} vectors of {} with {}",
        refreshed.size(),
        collection.namespaceKey(),
        modelId);
    return refreshed.size();
  }

  private static Map<String, String> metadata(String source, Chunk c, String modelId) {
    Map<String, String> meta = new LinkedHashMap<>();
    meta.put(VectorStoreAdapter.META_SOURCE, source);
    meta.put(VectorStoreAdapter.META_DOCUMENT_ID, c.documentId());
    meta.put(VectorStoreAdapter.META_SEQUENCE, Integer.toString(c.sequenceIndex()));
    meta.put(VectorStoreAdapter.META_SPAN, c.span().start() + "-" + c.span().end());
    meta.put(VectorStoreAdapter.META_SECTION, c.sectionPath());
    meta.put(VectorStoreAdapter.META_MODEL, modelId);
    return meta;
  }
}
