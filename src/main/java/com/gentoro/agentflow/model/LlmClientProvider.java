package com.gentoro.agentflow.model;

import org.apache.commons.configuration2.Configuration;

/**
 * Service Provider Interface (SPI) for pluggable LLM providers.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Each provider identifies
 * itself with a stable {@code providerId}. To register a provider, add its fully qualified class
 * name to {@code META-INF/services/com.gentoro.agentflow.model.LlmClientProvider}.
 */
public interface LlmClientProvider {

  /** A stable, lowercase identifier for this provider (e.g. "openai"). */
  String providerId();

  /**
   * Creates a configured {@link LlmClient} instance.
   *
   * @param subConfiguration provider-specific configuration subset (e.g. {@code llm.default.*}).
   * @throws com.gentoro.agentflow.exception.ConfigException when the configuration is invalid,
   *     for instance when the API key is missing.
   */
  LlmClient create(Configuration subConfiguration);
}
