package com.gentoro.agentflow.workflow;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

import com.gentoro.agentflow.agent.Agent;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.task.OutputFormat;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.testing.EchoTool;
import com.gentoro.agentflow.tool.RetrievalTool;
import com.gentoro.agentflow.tool.ToolRegistry;
import com.gentoro.agentflow.vectorstore.DistanceMetric;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkflowLoaderTest {

  private ToolRegistry registry;
  private WorkflowLoader loader;

  @BeforeEach
  void setUp() {
    registry = new ToolRegistry().register(new EchoTool("echo", 0));
    loader =
        new WorkflowLoader(registry, Set.of("memory", "local"), mock(RetrievalEngine.class), 4);
  }

  private static Path resource(String name) throws Exception {
    return Path.of(WorkflowLoaderTest.class.getResource(name).toURI());
  }

  @Test
  void loadsWorkflowFile() throws Exception {
    Path file = resource("/workflows/research.yaml");

    Workflow workflow = loader.load(file);

    assertEquals(ProcessMode.PARALLEL, workflow.process());
    assertEquals("ana", workflow.userId());
    assertEquals(2, workflow.agents().size());

    Agent researcher = workflow.agent("researcher").orElseThrow();
    assertEquals(
        List.of(file.getParent().resolve("docs/product.md").toAbsolutePath().normalize()),
        researcher.knowledgeSources());
    assertTrue(Files.exists(researcher.knowledgeSources().get(0)));
    assertEquals("product", researcher.knowledgeScope().orElseThrow().collectionName());
    assertEquals(
        DistanceMetric.EUCLIDEAN, researcher.knowledgeScope().orElseThrow().distanceMetric());
    assertEquals(6, researcher.maxIterations());
    assertInstanceOf(RetrievalTool.class, researcher.tool("knowledge_search").orElseThrow());
    assertSame(registry.get("echo"), researcher.tool("echo").orElseThrow());

    Agent writer = workflow.agent("writer").orElseThrow();
    assertTrue(writer.selfReflect());
    assertTrue(writer.knowledgeScope().isEmpty());

    Task facts = workflow.tasks().get(0);
    Task brief = workflow.tasks().get(1);
    assertEquals(OutputFormat.JSON, facts.outputFormat());
    assertSame(researcher, facts.agent());
    assertEquals(List.of("facts"), brief.dependsOn());
    assertEquals("Two short paragraphs", brief.expectedOutput());
  }

  @Test
  void knowledgeWithoutConfigUsesDefaultCollection(@TempDir Path dir) {
    String yaml =
        """
        agents:
          - name: a
            role: r
            goal: g
            knowledge: [notes.txt]
        tasks:
          - name: t
            description: d
            agent: a
        """;

    Workflow workflow = loader.parse(yaml, dir);

    Agent agent = workflow.agents().get(0);
    assertEquals(List.of(dir.resolve("notes.txt")), agent.knowledgeSources());
    assertEquals("memory", agent.knowledgeScope().orElseThrow().provider());
    assertEquals("knowledge", agent.knowledgeScope().orElseThrow().collectionName());
    assertEquals(ProcessMode.SEQUENTIAL, workflow.process());
    assertEquals("t", workflow.tasks().get(0).id());
  }

  @Test
  void rejectsUnknownKeys() {
    String yaml =
        """
        agents:
          - name: a
            role: r
            goal: g
            temperature: 0.2
        tasks:
          - name: t
            description: d
            agent: a
        """;

    ConfigException e = assertThrows(ConfigException.class, () -> loader.parse(yaml, null));
    assertTrue(e.getMessage().contains("temperature"), e.getMessage());
  }

  @Test
  void rejectsUnknownAgentAndTool() {
    String unknownAgent =
        """
        agents: [{name: a, role: r, goal: g}]
        tasks: [{name: t, description: d, agent: b}]
        """;
    String unknownTool =
        """
        agents: [{name: a, role: r, goal: g, tools: [shell]}]
        tasks: [{name: t, description: d, agent: a}]
        """;
    String searchWithoutKnowledge =
        """
        agents: [{name: a, role: r, goal: g, tools: [knowledge_search]}]
        tasks: [{name: t, description: d, agent: a}]
        """;

    assertThrows(ConfigException.class, () -> loader.parse(unknownAgent, null));
    assertThrows(ConfigException.class, () -> loader.parse(unknownTool, null));
    assertThrows(ConfigException.class, () -> loader.parse(searchWithoutKnowledge, null));
  }

  @Test
  void rejectsIncompleteWorkflows() {
    assertThrows(ConfigException.class, () -> loader.parse("tasks: []", null));
    assertThrows(
        ConfigException.class,
        () -> loader.parse("agents: [{name: a, role: r, goal: g}]\ntasks: []", null));
    assertThrows(ConfigException.class, () -> loader.parse("- just a list", null));
    assertThrows(
        ConfigException.class,
        () ->
            loader.parse(
                "agents: [{name: a, role: r, goal: g}]\n"
                    + "tasks: [{name: t, description: d, agent: a, output_format: xml}]",
                null));
    assertThrows(
        ConfigException.class,
        () ->
            loader.parse(
                "process: hierarchical\nagents: [{name: a, role: r, goal: g}]\n"
                    + "tasks: [{name: t, description: d, agent: a}]",
                null));
  }

  @Test
  void unknownVectorStoreProvider() {
    String yaml =
        """
        agents:
          - name: a
            role: r
            goal: g
            knowledge: [doc.md]
            knowledge_config: {vector_store: {provider: pinecone}}
        tasks: [{name: t, description: d, agent: a}]
        """;

    assertThrows(ConfigException.class, () -> loader.parse(yaml, null));
  }

  @Test
  void missingFile(@TempDir Path dir) {
    assertThrows(ConfigException.class, () -> loader.load(dir.resolve("absent.yaml")));
  }
}
