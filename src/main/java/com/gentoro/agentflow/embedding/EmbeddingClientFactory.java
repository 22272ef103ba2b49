package com.gentoro.agentflow.embedding;

import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import org.apache.commons.configuration2.Configuration;

/**
 * Creates the active {@link EmbeddingClient} from configuration.
 *
 * <pre>
 *   embedding.active-profile = default
 *   embedding.default.provider = openai
 *   embedding.default.model = text-embedding-3-small
 *   embedding.default.api-key = ${env:OPENAI_API_KEY}
 * </pre>
 *
 * The returned client is wrapped with retry and timeout handling.
 */
public final class EmbeddingClientFactory {
  private EmbeddingClientFactory() {}

  public static EmbeddingClient create(
      Configuration configuration, EngineSettings settings, ExecutorService executor) {
    String namespace = configuration.getString("embedding.active-profile", "default").trim();
    String prefix = "embedding." + namespace;
    if (namespace.isEmpty() || !configuration.getKeys(prefix).hasNext()) {
      throw new ConfigException("Missing %s configuration".formatted(prefix));
    }
    EmbeddingClient raw = create(configuration.subset(prefix));
    return new RetryingEmbeddingClient(
        raw, settings, new TimeBoundedCall("embedding", settings.embeddingTimeout(), executor));
  }

  /** Resolve a provider by {@code provider} id and build an unwrapped client. */
  public static EmbeddingClient create(Configuration subConfig) {
    String provider = subConfig.getString("provider", "");
    if (provider.isBlank()) {
      throw new ConfigException("Missing embedding provider");
    }
    String id = provider.trim().toLowerCase(Locale.ROOT);
    for (EmbeddingClientProvider p : ServiceLoader.load(EmbeddingClientProvider.class)) {
      if (id.equals(p.providerId())) {
        return p.create(subConfig);
      }
    }
    throw new ConfigException("Unknown embedding provider: " + provider);
  }
}
