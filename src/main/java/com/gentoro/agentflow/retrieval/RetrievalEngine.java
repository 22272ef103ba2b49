package com.gentoro.agentflow.retrieval;

import com.gentoro.agentflow.embedding.EmbeddingClient;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;

/**
 * Embeds a query and returns the closest stored chunks. A missing or empty collection gives an
 * empty result without calling the embedding service.
 */
public class RetrievalEngine {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(RetrievalEngine.class);

  private final EmbeddingClient embeddingClient;
  private final VectorStoreAdapter vectorStore;

  public RetrievalEngine(EmbeddingClient embeddingClient, VectorStoreAdapter vectorStore) {
    this.embeddingClient = embeddingClient;
    this.vectorStore = vectorStore;
  }

  public RetrievalResult retrieve(String queryText, CollectionConfig collection, int k) {
    if (k <= 0 || queryText == null || queryText.isBlank()) return RetrievalResult.empty();
    if (vectorStore.size(collection) == 0) {
      log.debug("Collection {} is missing or empty", collection.namespaceKey());
      return RetrievalResult.empty();
    }
    float[] vector = embeddingClient.embed(queryText);
    RetrievalResult result = vectorStore.query(collection, vector, k);
    log.debug(
        "Retrieved {} chunks from {} (k={})", result.size(), collection.namespaceKey(), k);
    return result;
  }
}
