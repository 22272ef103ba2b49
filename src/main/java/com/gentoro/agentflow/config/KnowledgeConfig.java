package com.gentoro.agentflow.config;

import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.DistanceMetric;
import java.nio.file.Path;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Parsed form of an agent's {@code knowledge_config} block.
 *
 * <pre>
 * vector_store:
 *   provider: local
 *   config:
 *     collection_name: kb1
 *     path: .agentflow/vectors
 *     distance_metric: cosine
 * </pre>
 *
 * Unknown keys and providers that are not registered are rejected when the block is parsed.
 */
public record KnowledgeConfig(CollectionConfig collection) {
  public static final String DEFAULT_PROVIDER = "memory";
  public static final String DEFAULT_COLLECTION = "knowledge";
  public static final String DEFAULT_PATH = ".agentflow/vectors";

  private static final Set<String> ROOT_KEYS = Set.of("vector_store");
  private static final Set<String> STORE_KEYS = Set.of("provider", "config");
  private static final Set<String> CONFIG_KEYS =
      Set.of("collection_name", "path", "distance_metric");

  public static KnowledgeConfig parse(Map<String, ?> raw, Collection<String> knownProviders) {
    if (raw == null || raw.isEmpty()) {
      return defaults(knownProviders);
    }
    checkKeys("knowledge_config", raw, ROOT_KEYS);
    Map<String, ?> store = section("knowledge_config.vector_store", raw.get("vector_store"));
    checkKeys("knowledge_config.vector_store", store, STORE_KEYS);
    Map<String, ?> cfg = section("knowledge_config.vector_store.config", store.get("config"));
    checkKeys("knowledge_config.vector_store.config", cfg, CONFIG_KEYS);

    String provider = text(store.get("provider"), DEFAULT_PROVIDER);
    requireKnown(provider, knownProviders);
    return new KnowledgeConfig(
        new CollectionConfig(
            provider,
            text(cfg.get("collection_name"), DEFAULT_COLLECTION),
            Path.of(text(cfg.get("path"), DEFAULT_PATH)),
            DistanceMetric.parse(text(cfg.get("distance_metric"), null))));
  }

  public static KnowledgeConfig defaults(Collection<String> knownProviders) {
    requireKnown(DEFAULT_PROVIDER, knownProviders);
    return new KnowledgeConfig(
        CollectionConfig.of(DEFAULT_PROVIDER, DEFAULT_COLLECTION, Path.of(DEFAULT_PATH)));
  }

  private static void requireKnown(String provider, Collection<String> knownProviders) {
    String normalized = provider.trim().toLowerCase(java.util.Locale.ROOT);
    if (!knownProviders.contains(normalized)) {
      throw new ConfigException(
          "Unknown vector store provider '%s'; available: %s"
              .formatted(provider, new TreeSet<>(knownProviders)));
    }
  }

  @SuppressWarnings("unchecked")
  private static Map<String, ?> section(String path, Object value) {
    if (value == null) return Map.of();
    if (value instanceof Map<?, ?> m) {
      return (Map<String, ?>) m;
    }
    throw new ConfigException("%s must be a mapping, got %s".formatted(path, value));
  }

  private static void checkKeys(String path, Map<String, ?> map, Set<String> allowed) {
    for (String key : map.keySet()) {
      if (!allowed.contains(key)) {
        throw new ConfigException(
            "Unknown key '%s' in %s (allowed: %s)".formatted(key, path, new TreeSet<>(allowed)));
      }
    }
  }

  private static String text(Object value, String defaultValue) {
    if (value == null) return defaultValue;
    String s = String.valueOf(value).trim();
    return s.isEmpty() ? defaultValue : s;
  }
}
