package com.gentoro.agentflow.vectorstore;

/** Process-local collection; data lives as long as the owning {@link VectorStoreAdapter}. */
public class InMemoryVectorStore extends AbstractVectorStore {

  public InMemoryVectorStore(CollectionConfig config) {
    super(config);
  }

  @Override
  protected void persist() {}

  @Override
  public void drop() {
    records.clear();
  }
}
