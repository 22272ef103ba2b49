package com.gentoro.agentflow.embedding;

import com.gentoro.agentflow.exception.EmbeddingServiceException;
import com.openai.client.OpenAIClient;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.Embedding;
import com.openai.models.embeddings.EmbeddingCreateParams;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** OpenAI implementation of {@link EmbeddingClient} using the openai-java SDK. */
public class OpenAiEmbeddingClient implements EmbeddingClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(OpenAiEmbeddingClient.class);

  private final OpenAIClient client;
  private final String model;
  private final Long dimensions;

  public OpenAiEmbeddingClient(OpenAIClient client, String model, Long dimensions) {
    this.client = client;
    this.model = model;
    this.dimensions = dimensions;
  }

  @Override
  public String modelId() {
    return dimensions == null ? model : model + "@" + dimensions;
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    EmbeddingCreateParams.Builder builder =
        EmbeddingCreateParams.builder().model(model).inputOfArrayOfStrings(texts);
    if (dimensions != null) {
      builder.dimensions(dimensions);
    }
    long start = System.currentTimeMillis();
    CreateEmbeddingResponse response;
    try {
      response = client.embeddings().create(builder.build());
    } catch (RuntimeException e) {
      throw new EmbeddingServiceException("OpenAI embedding request failed: " + e.getMessage(), e);
    }
    log.debug(
        "Embedded {} texts with {} in {} ms",
        texts.size(),
        model,
        System.currentTimeMillis() - start);

    List<Embedding> data = new ArrayList<>(response.data());
    data.sort(Comparator.comparingLong(Embedding::index));
    List<float[]> vectors = new ArrayList<>(data.size());
    for (Embedding e : data) {
      List<? extends Number> values = e.embedding();
      float[] vector = new float[values.size()];
      for (int i = 0; i < vector.length; i++) {
        vector[i] = values.get(i).floatValue();
      }
      vectors.add(vector);
    }
    return vectors;
  }
}
