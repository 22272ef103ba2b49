package com.gentoro.agentflow.model;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.config.ConfigurationProvider;
import com.gentoro.agentflow.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class LlmClientFactoryTest {

  private static Configuration yaml(String content) {
    return ConfigurationProvider.fromYaml(content).config();
  }

  @Test
  @DisplayName("The active profile selects the provider and model")
  void createsActiveProfile() {
    Configuration cfg =
        yaml(
            """
            llm:
              active-profile: fast
              fast:
                provider: OpenAI
                model: gpt-4.1-nano
                api-key: sk-test
            """);

    LlmClient client = LlmClientFactory.createProvider(cfg);

    assertInstanceOf(OpenAiLlmClient.class, client);
    assertEquals("gpt-4.1-nano", client.modelId());
  }

  @Test
  @DisplayName("A missing profile is a configuration error")
  void missingProfile() {
    Configuration cfg =
        yaml(
            """
            llm:
              active-profile: other
              default:
                provider: openai
                api-key: sk-test
            """);

    ConfigException e =
        assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(cfg));
    assertTrue(e.getMessage().contains("llm.other"), e.getMessage());
  }

  @Test
  @DisplayName("Unknown providers are rejected")
  void unknownProvider() {
    Configuration cfg =
        yaml(
            """
            llm:
              default:
                provider: carrier-pigeon
            """);

    assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(cfg));
  }

  @Test
  @DisplayName("An unresolved api-key placeholder is reported before any call")
  void unresolvedApiKey() {
    Configuration cfg =
        yaml(
            """
            llm:
              default:
                provider: openai
                api-key: ${env:AGENTFLOW_TEST_KEY_THAT_IS_NOT_SET}
            """);

    ConfigException e =
        assertThrows(ConfigException.class, () -> LlmClientFactory.createProvider(cfg));
    assertTrue(e.getMessage().contains("api-key"), e.getMessage());
  }
}
