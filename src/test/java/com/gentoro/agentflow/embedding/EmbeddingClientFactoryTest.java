package com.gentoro.agentflow.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.config.ConfigurationProvider;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.testing.TestSettings;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class EmbeddingClientFactoryTest {

  private final ExecutorService executor = Executors.newSingleThreadExecutor();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static Configuration yaml(String content) {
    return ConfigurationProvider.fromYaml(content).config();
  }

  @Test
  void wrapsProviderClient() {
    Configuration cfg =
        yaml(
            """
            embedding:
              default:
                provider: openai
                model: text-embedding-3-large
                dimensions: 256
                api-key: sk-test
            """);

    EmbeddingClient client = EmbeddingClientFactory.create(cfg, TestSettings.fast(), executor);

    assertInstanceOf(RetryingEmbeddingClient.class, client);
    assertEquals("text-embedding-3-large@256", client.modelId());
  }

  @Test
  void rejectsMissingOrUnknownProvider() {
    assertThrows(
        ConfigException.class,
        () -> EmbeddingClientFactory.create(yaml("llm: {}\n"), TestSettings.fast(), executor));
    assertThrows(
        ConfigException.class,
        () ->
            EmbeddingClientFactory.create(
                yaml("embedding:\n  default:\n    provider: nope\n"),
                TestSettings.fast(),
                executor));
    assertThrows(
        ConfigException.class,
        () ->
            EmbeddingClientFactory.create(
                yaml("embedding:\n  default:\n    provider: openai\n"),
                TestSettings.fast(),
                executor));
  }
}
