package com.gentoro.agentflow.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.ConfigException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @Test
  void classpathDefault() {
    Configuration cfg = new ConfigurationProvider(ConfigurationProvider.DEFAULT_LOCATION).config();

    assertEquals("default", cfg.getString("llm.active-profile"));
    assertEquals("openai", cfg.getString("llm.default.provider"));
    assertEquals(4, cfg.getInt("retrieval.top-k"));
  }

  @Test
  void missingClasspathResourceGivesEmptyConfiguration() {
    Configuration cfg = new ConfigurationProvider("classpath:absent.yaml").config();

    assertTrue(cfg.isEmpty());
  }

  @Test
  void fileLocations(@TempDir Path dir) throws Exception {
    Path file = dir.resolve("agentflow.yaml");
    Files.writeString(file, "retrieval:\n  top-k: 9\n");

    assertEquals(9, new ConfigurationProvider(file.toString()).config().getInt("retrieval.top-k"));
    assertEquals(
        9, new ConfigurationProvider(file.toUri().toString()).config().getInt("retrieval.top-k"));
    assertThrows(
        ConfigException.class,
        () -> new ConfigurationProvider(dir.resolve("absent.yaml").toString()));
  }

  @Test
  void inlineYamlWithInterpolation() {
    Configuration cfg =
        ConfigurationProvider.fromYaml("base: /srv\nllm:\n  home: ${base}/llm\n").config();

    assertEquals("/srv/llm", cfg.getString("llm.home"));
  }

  @Test
  void malformedInlineYaml() {
    assertThrows(ConfigException.class, () -> ConfigurationProvider.fromYaml("a: [1, 2"));
  }
}
