package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.model.ToolProperty;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import com.gentoro.agentflow.vectorstore.ScoredChunk;

/** Lets an agent search its knowledge collection on demand. */
public class RetrievalTool extends AbstractTool {
  private static final int MAX_K = 20;

  private final RetrievalEngine engine;
  private final CollectionConfig collection;
  private final int defaultK;

  public RetrievalTool(
      String name, RetrievalEngine engine, CollectionConfig collection, int defaultK) {
    super(
        ToolDefinition.builder()
            .name(name)
            .description(
                "Search the knowledge base and return the most relevant passages with their"
                    + " source.")
            .schema(
                ToolProperty.builder()
                    .name("arguments")
                    .type(ToolProperty.Type.OBJECT)
                    .property(
                        ToolProperty.builder()
                            .name("query")
                            .description("What to look for")
                            .type(ToolProperty.Type.STRING)
                            .required(true)
                            .build())
                    .property(
                        ToolProperty.builder()
                            .name("k")
                            .description("Number of passages, %d at most".formatted(MAX_K))
                            .type(ToolProperty.Type.INTEGER)
                            .build())
                    .build())
            .build(),
        ToolKind.RETRIEVAL);
    this.engine = engine;
    this.collection = collection;
    this.defaultK = defaultK;
  }

  @Override
  protected JsonNode execute(JsonNode arguments) {
    int k = Math.min(MAX_K, arguments.path("k").asInt(defaultK));
    RetrievalResult result = engine.retrieve(arguments.get("query").asText(), collection, k);
    ObjectNode out = JsonNodeFactory.instance.objectNode();
    ArrayNode items = out.putArray("results");
    for (ScoredChunk sc : result.items()) {
      ObjectNode item = items.addObject();
      item.put("source", sc.source());
      item.put("section", sc.chunk().sectionPath());
      item.put("score", sc.score());
      item.put("text", sc.chunk().text());
    }
    return out;
  }
}
