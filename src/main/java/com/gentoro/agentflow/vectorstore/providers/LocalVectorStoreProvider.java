package com.gentoro.agentflow.vectorstore.providers;

import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.LocalVectorStore;
import com.gentoro.agentflow.vectorstore.VectorStore;
import com.gentoro.agentflow.vectorstore.VectorStoreProvider;
import java.nio.file.Files;

/** Service provider for the file-backed {@code local} backend. */
public class LocalVectorStoreProvider implements VectorStoreProvider {
  @Override
  public String providerId() {
    return "local";
  }

  @Override
  public boolean exists(CollectionConfig config) {
    return Files.isRegularFile(LocalVectorStore.fileFor(config));
  }

  @Override
  public VectorStore open(CollectionConfig config) {
    return new LocalVectorStore(config);
  }
}
