package com.gentoro.agentflow.workflow;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.agent.Agent;
import com.gentoro.agentflow.config.KnowledgeConfig;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.task.OutputFormat;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.tool.RetrievalTool;
import com.gentoro.agentflow.tool.Tool;
import com.gentoro.agentflow.tool.ToolRegistry;
import com.gentoro.agentflow.utility.JacksonUtility;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads a YAML workflow definition.
 *
 * <pre>
 * process: sequential          # or parallel
 * user_id: alice               # optional
 * agents:
 *   - name: analyst
 *     role: Data analyst
 *     goal: Answer questions about sales
 *     backstory: ...
 *     knowledge: [docs/sales.md]
 *     knowledge_config:
 *       vector_store:
 *         provider: local
 *         config: {collection_name: sales, path: .agentflow/vectors}
 *     tools: [sql_query, knowledge_search]
 *     self_reflect: true
 *     verbose: false
 *     max_iterations: 8
 * tasks:
 *   - name: summary
 *     description: Summarize last quarter
 *     expected_output: Three bullet points
 *     agent: analyst
 *     depends_on: []
 *     output_format: text      # or json
 *     async_execution: false
 * </pre>
 *
 * Tool names refer to the {@link ToolRegistry}; {@value #KNOWLEDGE_SEARCH} is always available to
 * agents with a knowledge collection. Relative knowledge paths resolve against the directory of
 * the workflow file. Unknown keys are rejected.
 */
public class WorkflowLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(WorkflowLoader.class);

  public static final String KNOWLEDGE_SEARCH = "knowledge_search";

  private static final Set<String> ROOT_KEYS = Set.of("process", "user_id", "agents", "tasks");
  private static final Set<String> AGENT_KEYS =
      Set.of(
          "name",
          "role",
          "goal",
          "backstory",
          "knowledge",
          "knowledge_config",
          "tools",
          "self_reflect",
          "verbose",
          "max_iterations");
  private static final Set<String> TASK_KEYS =
      Set.of(
          "id",
          "name",
          "description",
          "expected_output",
          "agent",
          "depends_on",
          "output_format",
          "async_execution");

  private final ToolRegistry tools;
  private final Collection<String> vectorStoreProviders;
  private final RetrievalEngine retrievalEngine;
  private final int retrievalTopK;

  public WorkflowLoader(
      ToolRegistry tools,
      Collection<String> vectorStoreProviders,
      RetrievalEngine retrievalEngine,
      int retrievalTopK) {
    this.tools = tools;
    this.vectorStoreProviders = vectorStoreProviders;
    this.retrievalEngine = retrievalEngine;
    this.retrievalTopK = retrievalTopK;
  }

  public Workflow load(Path file) {
    String yaml;
    try {
      yaml = Files.readString(file, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new ConfigException("Cannot read workflow file " + file, e);
    }
    Path base = file.toAbsolutePath().getParent();
    return parse(yaml, base);
  }

  public Workflow parse(String yaml, Path baseDir) {
    JsonNode root;
    try {
      root = JacksonUtility.getYamlMapper().readTree(yaml);
    } catch (JsonProcessingException e) {
      throw new ConfigException("Workflow is not valid YAML: " + e.getOriginalMessage(), e);
    }
    if (root == null || !root.isObject()) {
      throw new ConfigException("Workflow must be a YAML mapping");
    }
    checkKeys("workflow", root, ROOT_KEYS);

    Map<String, Agent> agents = new LinkedHashMap<>();
    for (JsonNode node : list(root, "agents", "workflow")) {
      Agent agent = agent(node, baseDir);
      if (agents.putIfAbsent(agent.name(), agent) != null) {
        throw new ConfigException("Duplicate agent name: " + agent.name());
      }
    }
    if (agents.isEmpty()) {
      throw new ConfigException("Workflow defines no agents");
    }

    List<Task> tasks = new ArrayList<>();
    for (JsonNode node : list(root, "tasks", "workflow")) {
      tasks.add(task(node, agents));
    }
    if (tasks.isEmpty()) {
      throw new ConfigException("Workflow defines no tasks");
    }

    ProcessMode mode = ProcessMode.parse(text(root, "process", null));
    String userId = text(root, "user_id", null);
    log.debug("Loaded workflow: {} agents, {} tasks, {} mode", agents.size(), tasks.size(), mode);
    return new Workflow(List.copyOf(agents.values()), tasks, mode, userId);
  }

  private Agent agent(JsonNode node, Path baseDir) {
    String where = "agent '" + node.path("name").asText("?") + "'";
    checkKeys(where, node, AGENT_KEYS);
    Agent.Builder b =
        Agent.builder()
            .name(text(node, "name", null))
            .role(text(node, "role", null))
            .goal(text(node, "goal", null))
            .backstory(text(node, "backstory", null))
            .selfReflect(node.path("self_reflect").asBoolean(false))
            .verbose(node.path("verbose").asBoolean(false))
            .maxIterations(node.path("max_iterations").asInt(0));

    List<Path> knowledge = new ArrayList<>();
    for (JsonNode source : list(node, "knowledge", where)) {
      Path p = Path.of(source.asText());
      knowledge.add(p.isAbsolute() || baseDir == null ? p : baseDir.resolve(p).normalize());
    }
    KnowledgeConfig knowledgeConfig = null;
    if (node.has("knowledge_config")) {
      Map<String, Object> raw =
          JacksonUtility.getYamlMapper()
              .convertValue(node.get("knowledge_config"), new TypeReference<>() {});
      knowledgeConfig = KnowledgeConfig.parse(raw, vectorStoreProviders);
    } else if (!knowledge.isEmpty()) {
      knowledgeConfig = KnowledgeConfig.defaults(vectorStoreProviders);
    }
    b.knowledge(knowledge);
    if (knowledgeConfig != null) b.knowledgeScope(knowledgeConfig.collection());

    for (JsonNode t : list(node, "tools", where)) {
      b.tool(tool(t.asText(), knowledgeConfig, where));
    }
    try {
      return b.build();
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid " + where + ": " + e.getMessage(), e);
    }
  }

  private Tool tool(String name, KnowledgeConfig knowledge, String where) {
    if (tools.find(name).isPresent()) return tools.get(name);
    if (KNOWLEDGE_SEARCH.equals(name)) {
      if (knowledge == null) {
        throw new ConfigException(
            "%s uses %s but has no knowledge configured".formatted(where, KNOWLEDGE_SEARCH));
      }
      return new RetrievalTool(name, retrievalEngine, knowledge.collection(), retrievalTopK);
    }
    return tools.get(name);
  }

  private Task task(JsonNode node, Map<String, Agent> agents) {
    String where = "task '" + node.path("name").asText(node.path("id").asText("?")) + "'";
    checkKeys(where, node, TASK_KEYS);
    String agentName = text(node, "agent", null);
    if (agentName == null) {
      throw new ConfigException(where + " has no agent");
    }
    Agent agent = agents.get(agentName);
    if (agent == null) {
      throw new ConfigException(
          "%s refers to unknown agent '%s'".formatted(where, agentName));
    }
    List<String> dependsOn = new ArrayList<>();
    list(node, "depends_on", where).forEach(d -> dependsOn.add(d.asText()));
    String description = text(node, "description", null);
    if (description == null) {
      throw new ConfigException(where + " has no description");
    }
    try {
      return Task.builder()
          .id(text(node, "id", null))
          .name(text(node, "name", null))
          .description(description)
          .expectedOutput(text(node, "expected_output", null))
          .agent(agent)
          .dependsOn(dependsOn)
          .outputFormat(outputFormat(text(node, "output_format", null), where))
          .asyncExecution(node.path("async_execution").asBoolean(false))
          .build();
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Invalid " + where + ": " + e.getMessage(), e);
    }
  }

  private static OutputFormat outputFormat(String value, String where) {
    if (value == null) return OutputFormat.TEXT;
    try {
      return OutputFormat.valueOf(value.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("%s has unknown output_format '%s'".formatted(where, value), e);
    }
  }

  private static List<JsonNode> list(JsonNode parent, String field, String where) {
    JsonNode n = parent.get(field);
    if (n == null || n.isNull()) return List.of();
    if (!n.isArray()) {
      throw new ConfigException("%s: '%s' must be a list".formatted(where, field));
    }
    List<JsonNode> out = new ArrayList<>();
    n.forEach(out::add);
    return out;
  }

  private static String text(JsonNode parent, String field, String defaultValue) {
    JsonNode n = parent.get(field);
    if (n == null || n.isNull()) return defaultValue;
    String s = n.asText().trim();
    return s.isEmpty() ? defaultValue : s;
  }

  private static void checkKeys(String where, JsonNode node, Set<String> allowed) {
    if (!node.isObject()) {
      throw new ConfigException(where + " must be a mapping");
    }
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String key = names.next();
      if (!allowed.contains(key)) {
        throw new ConfigException(
            "Unknown key '%s' in %s (allowed: %s)".formatted(key, where, new TreeSet<>(allowed)));
      }
    }
  }
}
