package com.gentoro.agentflow.model;

import com.gentoro.agentflow.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for OpenAI-based {@link LlmClient} implementations. */
public final class OpenAiLlmClientProvider implements LlmClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public LlmClient create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("api-key");
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("Missing llm api-key (set OPENAI_API_KEY)");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("base-url", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    return new OpenAiLlmClient(client, subConfiguration);
  }
}
