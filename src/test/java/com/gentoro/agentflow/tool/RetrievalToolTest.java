package com.gentoro.agentflow.tool;

import static com.gentoro.agentflow.tool.SqlQueryToolTest.args;
import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.knowledge.Chunker;
import com.gentoro.agentflow.knowledge.Document;
import com.gentoro.agentflow.knowledge.DocumentLoader;
import com.gentoro.agentflow.knowledge.IngestionPipeline;
import com.gentoro.agentflow.knowledge.MediaType;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.testing.FakeEmbeddingClient;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;
import com.gentoro.agentflow.vectorstore.VectorStoreProviders;
import com.gentoro.agentflow.vectorstore.providers.InMemoryVectorStoreProvider;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;

class RetrievalToolTest {

  @Test
  void returnsRankedPassagesWithSources() throws Exception {
    FakeEmbeddingClient embedding = new FakeEmbeddingClient();
    VectorStoreAdapter adapter =
        new VectorStoreAdapter(
            new VectorStoreProviders(List.of(new InMemoryVectorStoreProvider())));
    CollectionConfig kb = CollectionConfig.of("memory", "docs", Path.of("target"));
    new IngestionPipeline(new DocumentLoader(), new Chunker(32, 4), embedding, adapter, 8)
        .ingest(
            Document.of(
                "handbook.md",
                MediaType.MARKDOWN,
                "# Holidays\n\nEmployees get twenty holidays per year.\n\n"
                    + "# Expenses\n\nTravel expenses are reimbursed within a month.\n"),
            kb);
    RetrievalTool tool =
        new RetrievalTool("search", new RetrievalEngine(embedding, adapter), kb, 5);

    ToolResult result = tool.invoke(args("{\"query\": \"how many holidays per year\", \"k\": 1}"));

    assertFalse(result.isError(), result.error());
    JsonNode results = result.payload().get("results");
    assertEquals(1, results.size());
    assertEquals("handbook.md", results.get(0).get("source").asText());
    assertEquals("Holidays", results.get(0).get("section").asText());
    assertTrue(results.get(0).get("text").asText().contains("twenty holidays"));
    assertEquals(ToolKind.RETRIEVAL, tool.kind());
  }
}
