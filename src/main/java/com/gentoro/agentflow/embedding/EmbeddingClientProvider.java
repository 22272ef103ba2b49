package com.gentoro.agentflow.embedding;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable embedding providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader} and registered in {@code
 * META-INF/services/com.gentoro.agentflow.embedding.EmbeddingClientProvider}.
 */
public interface EmbeddingClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured client.
   *
   * @param subConfiguration provider-specific subset (e.g. {@code embedding.default.*}).
   * @throws com.gentoro.agentflow.exception.ConfigException when required keys are missing.
   */
  EmbeddingClient create(Configuration subConfiguration);
}
