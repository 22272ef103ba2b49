package com.gentoro.agentflow.vectorstore;

/**
 * Service Provider Interface (SPI) for vector store backends.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} from {@code
 * META-INF/services/com.gentoro.agentflow.vectorstore.VectorStoreProvider}.
 */
public interface VectorStoreProvider {

  /** A stable, lowercase identifier used as {@code vector_store.provider}. */
  String providerId();

  /** Whether data for the collection already exists outside of this process. */
  boolean exists(CollectionConfig config);

  /** Open (creating when missing) the collection described by {@code config}. */
  VectorStore open(CollectionConfig config);
}
