package com.gentoro.agentflow.vectorstore;

import com.gentoro.agentflow.exception.ConfigException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.Set;

/** Registry of the vector store backends available to the engine. */
public final class VectorStoreProviders {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(VectorStoreProviders.class);

  private final Map<String, VectorStoreProvider> providers = new LinkedHashMap<>();

  public VectorStoreProviders(Iterable<VectorStoreProvider> providers) {
    for (VectorStoreProvider p : providers) {
      VectorStoreProvider previous = this.providers.putIfAbsent(p.providerId(), p);
      if (previous != null) {
        log.warn(
            "Duplicate vector store provider '{}': keeping {}, ignoring {}",
            p.providerId(),
            previous.getClass().getName(),
            p.getClass().getName());
      }
    }
  }

  /** Providers registered through {@link ServiceLoader}. */
  public static VectorStoreProviders load() {
    return new VectorStoreProviders(ServiceLoader.load(VectorStoreProvider.class));
  }

  public Set<String> ids() {
    return Collections.unmodifiableSet(providers.keySet());
  }

  public VectorStoreProvider get(String providerId) {
    VectorStoreProvider provider = providers.get(providerId);
    if (provider == null) {
      throw new ConfigException(
          "Unknown vector store provider '%s'; available: %s".formatted(providerId, ids()));
    }
    return provider;
  }
}
