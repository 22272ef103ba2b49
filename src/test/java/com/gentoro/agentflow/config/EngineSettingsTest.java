package com.gentoro.agentflow.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.ConfigException;
import java.time.Duration;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;

class EngineSettingsTest {

  private static Configuration yaml(String content) {
    return ConfigurationProvider.fromYaml(content).config();
  }

  @Test
  void bundledConfigurationMatchesDefaults() {
    Configuration cfg = new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config();

    assertEquals(EngineSettings.defaults(), EngineSettings.from(cfg));
  }

  @Test
  void emptyConfigurationUsesDefaults() {
    assertEquals(EngineSettings.defaults(), EngineSettings.from(yaml("llm:\n  active-profile: x")));
  }

  @Test
  void overrides() {
    EngineSettings settings =
        EngineSettings.from(
            yaml(
                """
                ingestion:
                  chunk:
                    max-tokens: 128
                    overlap-tokens: 0
                retrieval:
                  top-k: 8
                orchestrator:
                  parallelism: 2
                  run-timeout: PT2M
                timeouts:
                  tool: 1500
                retry:
                  multiplier: 1.5
                """));

    assertEquals(128, settings.chunkMaxTokens());
    assertEquals(0, settings.chunkOverlapTokens());
    assertEquals(8, settings.retrievalTopK());
    assertEquals(2, settings.parallelism());
    assertEquals(Duration.ofMinutes(2), settings.runTimeout());
    assertEquals(Duration.ofMillis(1500), settings.toolTimeout());
    assertEquals(1.5, settings.retryMultiplier());
    assertEquals(EngineSettings.defaults().modelTimeout(), settings.modelTimeout());
  }

  @Test
  void durations() {
    Configuration cfg = yaml("timeouts:\n  model: pt45s\n  embedding: '250'\n  tool: soon");
    Duration fallback = Duration.ofSeconds(1);

    assertEquals(Duration.ofSeconds(45), EngineSettings.duration(cfg, "timeouts.model", fallback));
    assertEquals(
        Duration.ofMillis(250), EngineSettings.duration(cfg, "timeouts.embedding", fallback));
    assertEquals(fallback, EngineSettings.duration(cfg, "timeouts.absent", fallback));
    assertThrows(
        ConfigException.class, () -> EngineSettings.duration(cfg, "timeouts.tool", fallback));
    assertThrows(
        ConfigException.class,
        () -> EngineSettings.duration(yaml("timeouts:\n  tool: 0"), "timeouts.tool", fallback));
  }

  @Test
  void unknownKeyInKnownSection() {
    ConfigException e =
        assertThrows(
            ConfigException.class,
            () -> EngineSettings.from(yaml("retrieval:\n  topk: 8")));
    assertTrue(e.getMessage().contains("retrieval.topk"), e.getMessage());
  }

  @Test
  void invalidValues() {
    assertThrows(
        ConfigException.class,
        () ->
            EngineSettings.from(
                yaml("ingestion:\n  chunk:\n    max-tokens: 64\n    overlap-tokens: 64")));
    assertThrows(
        ConfigException.class,
        () -> EngineSettings.from(yaml("orchestrator:\n  parallelism: 0")));
    assertThrows(
        ConfigException.class, () -> EngineSettings.from(yaml("retry:\n  multiplier: 0.5")));
    assertThrows(
        ConfigException.class, () -> EngineSettings.from(yaml("agent:\n  max-iterations: many")));
  }
}
