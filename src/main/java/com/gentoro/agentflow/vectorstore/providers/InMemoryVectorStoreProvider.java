package com.gentoro.agentflow.vectorstore.providers;

import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.InMemoryVectorStore;
import com.gentoro.agentflow.vectorstore.VectorStore;
import com.gentoro.agentflow.vectorstore.VectorStoreProvider;

/** Service provider for the in-process {@code memory} backend. */
public class InMemoryVectorStoreProvider implements VectorStoreProvider {
  @Override
  public String providerId() {
    return "memory";
  }

  @Override
  public boolean exists(CollectionConfig config) {
    // nothing survives outside the adapter that created it
    return false;
  }

  @Override
  public VectorStore open(CollectionConfig config) {
    return new InMemoryVectorStore(config);
  }
}
