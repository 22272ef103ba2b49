package com.gentoro.agentflow.embedding;

import java.util.List;

/**
 * Maps text to fixed-length vectors. Implementations wrap a provider SDK and are selected through
 * {@link EmbeddingClientFactory}.
 */
public interface EmbeddingClient {

  /** Identifier of the model producing the vectors; stored next to every vector. */
  String modelId();

  /**
   * Embed a batch of texts.
   *
   * @return one vector per input, in input order.
   */
  List<float[]> embed(List<String> texts);

  default float[] embed(String text) {
    return embed(List.of(text)).get(0);
  }
}
