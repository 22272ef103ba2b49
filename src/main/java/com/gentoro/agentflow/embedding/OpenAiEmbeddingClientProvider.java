package com.gentoro.agentflow.embedding;

import com.gentoro.agentflow.exception.ConfigException;
import com.openai.client.OpenAIClient;
import com.openai.client.okhttp.OpenAIOkHttpClient;
import org.apache.commons.configuration2.Configuration;

/** SPI provider for OpenAI embeddings. */
public final class OpenAiEmbeddingClientProvider implements EmbeddingClientProvider {

  @Override
  public String providerId() {
    return "openai";
  }

  @Override
  public EmbeddingClient create(Configuration subConfiguration) {
    String apiKey = subConfiguration.getString("api-key");
    if (apiKey == null || apiKey.isBlank() || apiKey.startsWith("${")) {
      throw new ConfigException("Missing embedding api-key (set OPENAI_API_KEY)");
    }
    OpenAIOkHttpClient.Builder builder = OpenAIOkHttpClient.builder().apiKey(apiKey);
    String baseUrl = subConfiguration.getString("base-url", null);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    OpenAIClient client = builder.build();
    Long dimensions =
        subConfiguration.containsKey("dimensions") ? subConfiguration.getLong("dimensions") : null;
    return new OpenAiEmbeddingClient(
        client, subConfiguration.getString("model", "text-embedding-3-small"), dimensions);
  }
}
