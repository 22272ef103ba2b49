package com.gentoro.agentflow.model;

import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import org.apache.commons.configuration2.Configuration;

/**
 * Factory utility to create {@link LlmClient} instances from configuration.
 *
 * <pre>
 *   llm.active-profile = default
 *   llm.default.provider = openai
 *   llm.default.model = gpt-4o-mini
 *   llm.default.api-key = ${env:OPENAI_API_KEY}
 * </pre>
 */
public final class LlmClientFactory {
  private LlmClientFactory() {}

  /** The active client, wrapped with the model timeout and retry policy. */
  public static LlmClient create(
      Configuration configuration, EngineSettings settings, ExecutorService executor) {
    return new RetryingLlmClient(
        createProvider(configuration),
        settings,
        new TimeBoundedCall("model", settings.modelTimeout(), executor));
  }

  public static LlmClient createProvider(Configuration configuration) {
    String namespace = configuration.getString("llm.active-profile", "default").trim();
    if (namespace.isEmpty() || !configuration.getKeys("llm.%s".formatted(namespace)).hasNext()) {
      throw new ConfigException("Missing llm.%s configuration".formatted(namespace));
    }
    return create(configuration.subset("llm.%s".formatted(namespace)));
  }

  /** Creates a client from a provider-specific subset configuration. */
  public static LlmClient create(Configuration subConfig) {
    String provider = subConfig.getString("provider", "");
    if (provider.isBlank()) {
      throw new ConfigException("Missing llm provider");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (LlmClientProvider p : ServiceLoader.load(LlmClientProvider.class)) {
      if (id.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown llm provider: " + provider);
  }
}
