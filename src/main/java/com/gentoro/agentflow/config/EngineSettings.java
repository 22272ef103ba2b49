package com.gentoro.agentflow.config;

import com.gentoro.agentflow.exception.ConfigException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Iterator;
import java.util.Map;
import java.util.Set;
import org.apache.commons.configuration2.Configuration;

/**
 * Typed view over the engine tuning sections of the application configuration.
 *
 * <p>Every field has a default. Unknown keys inside a known section are rejected so that a typo
 * does not silently fall back to the default.
 */
public record EngineSettings(
    int chunkMaxTokens,
    int chunkOverlapTokens,
    int embeddingBatchSize,
    int retrievalTopK,
    int contextMaxTokens,
    int memorySnippets,
    int agentMaxIterations,
    int parallelism,
    Duration runTimeout,
    Duration modelTimeout,
    Duration embeddingTimeout,
    Duration toolTimeout,
    int retryMaxAttempts,
    Duration retryInitialBackoff,
    double retryMultiplier,
    Duration retryMaxBackoff) {

  private static final Map<String, Set<String>> KNOWN_KEYS =
      Map.of(
          "ingestion",
          Set.of("chunk.max-tokens", "chunk.overlap-tokens", "embedding-batch-size"),
          "retrieval",
          Set.of("top-k"),
          "context",
          Set.of("max-tokens", "memory-snippets"),
          "agent",
          Set.of("max-iterations"),
          "orchestrator",
          Set.of("parallelism", "run-timeout"),
          "timeouts",
          Set.of("model", "embedding", "tool"),
          "retry",
          Set.of("max-attempts", "initial-backoff", "multiplier", "max-backoff"));

  public EngineSettings {
    requirePositive("ingestion.chunk.max-tokens", chunkMaxTokens);
    if (chunkOverlapTokens < 0 || chunkOverlapTokens >= chunkMaxTokens) {
      throw new ConfigException(
          "ingestion.chunk.overlap-tokens must be >= 0 and smaller than max-tokens, got "
              + chunkOverlapTokens);
    }
    requirePositive("ingestion.embedding-batch-size", embeddingBatchSize);
    requirePositive("retrieval.top-k", retrievalTopK);
    requirePositive("context.max-tokens", contextMaxTokens);
    if (memorySnippets < 0) {
      throw new ConfigException("context.memory-snippets must be >= 0");
    }
    requirePositive("agent.max-iterations", agentMaxIterations);
    requirePositive("orchestrator.parallelism", parallelism);
    requirePositive("retry.max-attempts", retryMaxAttempts);
    if (retryMultiplier < 1.0) {
      throw new ConfigException("retry.multiplier must be >= 1.0, got " + retryMultiplier);
    }
  }

  public static EngineSettings defaults() {
    return new EngineSettings(
        256,
        32,
        32,
        4,
        6000,
        3,
        10,
        4,
        Duration.ofMinutes(10),
        Duration.ofSeconds(60),
        Duration.ofSeconds(30),
        Duration.ofSeconds(30),
        3,
        Duration.ofMillis(500),
        2.0,
        Duration.ofSeconds(8));
  }

  public static EngineSettings from(Configuration cfg) {
    rejectUnknownKeys(cfg);
    EngineSettings d = defaults();
    try {
      return new EngineSettings(
          cfg.getInt("ingestion.chunk.max-tokens", d.chunkMaxTokens()),
          cfg.getInt("ingestion.chunk.overlap-tokens", d.chunkOverlapTokens()),
          cfg.getInt("ingestion.embedding-batch-size", d.embeddingBatchSize()),
          cfg.getInt("retrieval.top-k", d.retrievalTopK()),
          cfg.getInt("context.max-tokens", d.contextMaxTokens()),
          cfg.getInt("context.memory-snippets", d.memorySnippets()),
          cfg.getInt("agent.max-iterations", d.agentMaxIterations()),
          cfg.getInt("orchestrator.parallelism", d.parallelism()),
          duration(cfg, "orchestrator.run-timeout", d.runTimeout()),
          duration(cfg, "timeouts.model", d.modelTimeout()),
          duration(cfg, "timeouts.embedding", d.embeddingTimeout()),
          duration(cfg, "timeouts.tool", d.toolTimeout()),
          cfg.getInt("retry.max-attempts", d.retryMaxAttempts()),
          duration(cfg, "retry.initial-backoff", d.retryInitialBackoff()),
          cfg.getDouble("retry.multiplier", d.retryMultiplier()),
          duration(cfg, "retry.max-backoff", d.retryMaxBackoff()));
    } catch (org.apache.commons.configuration2.ex.ConversionException e) {
      throw new ConfigException("Invalid engine setting: " + e.getMessage(), e);
    }
  }

  /** Accepts ISO-8601 durations ("PT30S") or a plain number of milliseconds. */
  static Duration duration(Configuration cfg, String key, Duration defaultValue) {
    String raw = cfg.getString(key, null);
    if (raw == null || raw.isBlank()) return defaultValue;
    String v = raw.trim();
    try {
      Duration parsed =
          v.chars().allMatch(Character::isDigit)
              ? Duration.ofMillis(Long.parseLong(v))
              : Duration.parse(v.toUpperCase(java.util.Locale.ROOT));
      if (parsed.isNegative() || parsed.isZero()) {
        throw new ConfigException("%s must be a positive duration, got %s".formatted(key, raw));
      }
      return parsed;
    } catch (DateTimeParseException | NumberFormatException e) {
      throw new ConfigException("%s is not a valid duration: %s".formatted(key, raw), e);
    }
  }

  private static void rejectUnknownKeys(Configuration cfg) {
    for (Map.Entry<String, Set<String>> section : KNOWN_KEYS.entrySet()) {
      Iterator<String> it = cfg.getKeys(section.getKey());
      while (it.hasNext()) {
        String key = it.next();
        if (key.equals(section.getKey())) {
          throw new ConfigException("Configuration key '%s' must be a section".formatted(key));
        }
        String relative = key.substring(section.getKey().length() + 1);
        if (!section.getValue().contains(relative)) {
          throw new ConfigException("Unknown configuration key: " + key);
        }
      }
    }
  }

  private static void requirePositive(String key, int value) {
    if (value <= 0) {
      throw new ConfigException("%s must be > 0, got %d".formatted(key, value));
    }
  }
}
