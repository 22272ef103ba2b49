package com.gentoro.agentflow.agent;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectReader;
import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.AgentLoopExceededException;
import com.gentoro.agentflow.exception.EmbeddingServiceException;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.TaskTimeoutException;
import com.gentoro.agentflow.exception.ValidationException;
import com.gentoro.agentflow.exception.VectorStoreException;
import com.gentoro.agentflow.memory.MemoryEntry;
import com.gentoro.agentflow.memory.MemoryStore;
import com.gentoro.agentflow.model.LlmClient;
import com.gentoro.agentflow.model.LlmResponse;
import com.gentoro.agentflow.model.ToolCall;
import com.gentoro.agentflow.model.ToolDefinition;
import com.gentoro.agentflow.orchestrator.AuditEvent;
import com.gentoro.agentflow.orchestrator.ExecutionContext;
import com.gentoro.agentflow.prompt.PromptTemplate;
import com.gentoro.agentflow.retrieval.ContextAssembler;
import com.gentoro.agentflow.retrieval.PromptContext;
import com.gentoro.agentflow.retrieval.RetrievalEngine;
import com.gentoro.agentflow.retrieval.TaskInputs;
import com.gentoro.agentflow.task.OutputFormat;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.tool.Tool;
import com.gentoro.agentflow.tool.ToolArgumentValidator;
import com.gentoro.agentflow.tool.ToolResult;
import com.gentoro.agentflow.utility.JacksonUtility;
import com.gentoro.agentflow.utility.StringUtility;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Runs one agent on one task.
 *
 * <p>The loop is {@code IDLE -> REASONING -> (TOOL_INVOCATION -> REASONING)* -> SUCCEEDED |
 * FAILED}. Each model call counts as one iteration; a task that needs more than the agent's limit
 * fails with {@link AgentLoopExceededException}. Tool problems (unknown tool, malformed or invalid
 * arguments, tool errors, tool timeouts) are returned to the model as {@code {"error": ...}}
 * results. An answer that must be JSON and does not parse is sent back for correction while
 * iterations remain.
 *
 * <p>With self-reflection enabled, a successful draft gets exactly one critique pass, outside the
 * iteration limit. The critique either approves the draft or replaces it.
 */
public class AgentExecutor {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(AgentExecutor.class);

  static final String APPROVED = "APPROVED";

  private static final ObjectReader STRICT_JSON =
      JacksonUtility.getJsonMapper()
          .reader()
          .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

  private final LlmClient llmClient;
  private final RetrievalEngine retrievalEngine;
  private final ContextAssembler contextAssembler;
  private final MemoryStore memoryStore;
  private final PromptTemplate prompts;
  private final EngineSettings settings;
  private final TimeBoundedCall toolCall;

  public AgentExecutor(
      LlmClient llmClient,
      RetrievalEngine retrievalEngine,
      ContextAssembler contextAssembler,
      MemoryStore memoryStore,
      PromptTemplate prompts,
      EngineSettings settings,
      TimeBoundedCall toolCall) {
    this.llmClient = llmClient;
    this.retrievalEngine = retrievalEngine;
    this.contextAssembler = contextAssembler;
    this.memoryStore = memoryStore;
    this.prompts = prompts;
    this.settings = settings;
    this.toolCall = toolCall;
  }

  public AgentOutcome execute(Task task, ExecutionContext ctx, TaskInputs inputs) {
    return new Run(task, ctx, inputs).execute();
  }

  /** Mutable state of a single agent loop. Confined to the thread running the task. */
  private final class Run {
    private final Task task;
    private final Agent agent;
    private final ExecutionContext ctx;
    private final TaskInputs inputs;
    private final int maxIterations;
    private final List<LlmClient.Message> messages = new ArrayList<>();
    private final List<ToolInvocation> invocations = new ArrayList<>();
    private AgentState state = AgentState.IDLE;
    private int iterations;

    Run(Task task, ExecutionContext ctx, TaskInputs inputs) {
      this.task = task;
      this.agent = task.agent();
      this.ctx = ctx;
      this.inputs = inputs;
      this.maxIterations =
          agent.maxIterations() > 0 ? agent.maxIterations() : settings.agentMaxIterations();
    }

    AgentOutcome execute() {
      RetrievalResult retrieved = retrieve();
      List<MemoryEntry> memory =
          memoryStore.recall(ctx.userId(), inputs.description(), settings.memorySnippets());
      PromptContext context = contextAssembler.assemble(inputs, retrieved, memory);

      messages.addAll(systemPrompt());
      messages.add(LlmClient.Message.user(context.render()));
      trace(
          "Agent {} starting task {} ({} knowledge chunks, {} memory entries, ~{} tokens)",
          agent.name(),
          task.id(),
          retrieved.size(),
          memory.size(),
          context.estimatedTokens());

      try {
        Answer answer = reason();
        boolean reflected = false;
        if (agent.selfReflect()) {
          answer = reflect(answer);
          reflected = true;
        }
        transition(AgentState.SUCCEEDED);
        return new AgentOutcome(
            answer.text(), answer.json(), invocations, iterations, reflected, retrieved.size());
      } catch (RuntimeException e) {
        transition(AgentState.FAILED);
        throw e;
      }
    }

    private Answer reason() {
      List<ToolDefinition> tools = agent.tools().stream().map(Tool::definition).toList();
      while (true) {
        transition(AgentState.REASONING);
        LlmResponse response = callModel(tools);

        if (response.hasToolCall()) {
          transition(AgentState.TOOL_INVOCATION);
          ToolCall call = response.toolCall();
          messages.add(
              LlmClient.Message.assistant(
                  "Calling tool `%s` with %s".formatted(call.toolName(), call.rawArguments())));
          ToolInvocation invocation = invokeTool(call);
          invocations.add(invocation);
          messages.add(
              LlmClient.Message.tool(
                  call.id(), call.toolName(), JacksonUtility.toJson(invocation.result())));
          continue;
        }

        String text = response.content() == null ? "" : response.content().trim();
        if (inputs.outputFormat() != OutputFormat.JSON) {
          return new Answer(text, null);
        }
        try {
          return new Answer(text, parseJson(text));
        } catch (JsonProcessingException e) {
          String problem = StringUtility.abbreviate(e.getOriginalMessage(), 200);
          if (iterations >= maxIterations) {
            throw new ValidationException(
                "Agent '%s' did not produce valid JSON for task '%s': %s"
                    .formatted(agent.name(), task.id(), problem),
                e);
          }
          log.debug("Task {}: answer is not valid JSON, asking for a correction", task.id());
          messages.add(LlmClient.Message.assistant(text));
          messages.add(
              LlmClient.Message.user(
                  prompts
                      .newSession()
                      .enable("json-correction", Map.of("problem", problem))
                      .renderText()));
        }
      }
    }

    private LlmResponse callModel(List<ToolDefinition> tools) {
      ctx.throwIfCancelled();
      if (iterations >= maxIterations) {
        throw new AgentLoopExceededException(agent.name(), maxIterations);
      }
      iterations++;
      long start = System.currentTimeMillis();
      LlmResponse response = llmClient.chat(List.copyOf(messages), tools);
      long elapsed = System.currentTimeMillis() - start;
      ctx.auditTrail()
          .append(
              AuditEvent.Type.MODEL_CALL,
              task.id(),
              agent.name(),
              Map.of(
                  "iteration", iterations,
                  "model", llmClient.modelId(),
                  "toolCall", response.hasToolCall() ? response.toolCall().toolName() : "",
                  "durationMs", elapsed));
      trace(
          "Agent {} iteration {}/{}: {}",
          agent.name(),
          iterations,
          maxIterations,
          response.hasToolCall()
              ? "tool " + response.toolCall().toolName()
              : StringUtility.abbreviate(response.content(), 120));
      return response;
    }

    private ToolInvocation invokeTool(ToolCall call) {
      long start = System.currentTimeMillis();
      ToolResult result = runTool(call);
      long elapsed = System.currentTimeMillis() - start;
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put("tool", call.toolName());
      attrs.put("arguments", StringUtility.abbreviate(call.rawArguments(), 500));
      attrs.put("error", result.isError());
      if (result.isError()) attrs.put("message", result.error());
      attrs.put("durationMs", elapsed);
      ctx.auditTrail().append(AuditEvent.Type.TOOL_INVOCATION, task.id(), agent.name(), attrs);
      trace(
          "Agent {} tool {} -> {}",
          agent.name(),
          call.toolName(),
          result.isError() ? "error: " + result.error() : "ok");
      return new ToolInvocation(
          call.id(),
          call.toolName(),
          call.rawArguments(),
          result.toJson(),
          result.isError(),
          elapsed);
    }

    private ToolResult runTool(ToolCall call) {
      Optional<Tool> tool = agent.tool(call.toolName());
      if (tool.isEmpty()) {
        return ToolResult.error(
            "Unknown tool '%s'. Available tools: %s"
                .formatted(call.toolName(), agent.tools().stream().map(Tool::name).toList()));
      }
      JsonNode arguments;
      try {
        arguments = STRICT_JSON.readTree(call.rawArguments());
      } catch (JsonProcessingException e) {
        return ToolResult.error("Arguments are not valid JSON: " + e.getOriginalMessage());
      }
      if (arguments == null || !arguments.isObject()) {
        return ToolResult.error("Arguments must be a JSON object");
      }
      List<String> problems =
          ToolArgumentValidator.validate(tool.get().definition().schema(), arguments);
      if (!problems.isEmpty()) {
        return ToolResult.error("Invalid arguments: " + String.join("; ", problems));
      }
      ctx.throwIfCancelled();
      try {
        ToolResult result = toolCall.call(() -> tool.get().invoke(arguments));
        return result != null ? result : ToolResult.error("Tool returned no result");
      } catch (TaskTimeoutException e) {
        if (ctx.isCancelled() || Thread.currentThread().isInterrupted()) throw e;
        return ToolResult.error("Tool call timed out after " + toolCall.timeout());
      } catch (RuntimeException e) {
        // tools outside AbstractTool may still throw
        log.warn("Tool {} failed unexpectedly", call.toolName(), e);
        return ToolResult.error(ExceptionUtil.summarize(e));
      }
    }

    private Answer reflect(Answer draft) {
      ctx.throwIfCancelled();
      boolean json = inputs.outputFormat() == OutputFormat.JSON;
      List<LlmClient.Message> critique = new ArrayList<>(messages);
      critique.add(LlmClient.Message.assistant(draft.text()));
      critique.add(
          LlmClient.Message.user(
              prompts
                  .newSession()
                  .enable("reflection", Map.of("json", json, "draft", draft.text()))
                  .renderText()));
      LlmResponse response = llmClient.chat(critique, List.of());
      String text = response.content() == null ? "" : response.content().trim();

      String verdict;
      Answer result = draft;
      if (response.hasToolCall() || text.isEmpty() || isApproval(text)) {
        verdict = "approved";
      } else if (!json) {
        verdict = "revised";
        result = new Answer(text, null);
      } else {
        try {
          result = new Answer(text, parseJson(text));
          verdict = "revised";
        } catch (JsonProcessingException e) {
          log.debug("Task {}: reflection produced invalid JSON, keeping the draft", task.id());
          verdict = "rejected";
        }
      }
      ctx.auditTrail()
          .append(
              AuditEvent.Type.REFLECTION, task.id(), agent.name(), Map.of("verdict", verdict));
      trace("Agent {} reflection: {}", agent.name(), verdict);
      return result;
    }

    private RetrievalResult retrieve() {
      Optional<CollectionConfig> scope = agent.knowledgeScope();
      if (scope.isEmpty()) return RetrievalResult.empty();
      RetrievalResult result;
      String problem = null;
      try {
        result =
            retrievalEngine.retrieve(inputs.description(), scope.get(), settings.retrievalTopK());
      } catch (EmbeddingServiceException | VectorStoreException e) {
        log.warn(
            "Retrieval for task {} failed, continuing without knowledge: {}",
            task.id(),
            ExceptionUtil.summarize(e));
        problem = ExceptionUtil.summarize(e);
        result = RetrievalResult.empty();
      }
      Map<String, Object> attrs = new LinkedHashMap<>();
      attrs.put("collection", scope.get().collectionName());
      attrs.put("k", settings.retrievalTopK());
      attrs.put("returned", result.size());
      if (problem != null) attrs.put("error", problem);
      ctx.auditTrail().append(AuditEvent.Type.RETRIEVAL, task.id(), agent.name(), attrs);
      return result;
    }

    private List<LlmClient.Message> systemPrompt() {
      Map<String, Object> vars = new LinkedHashMap<>();
      vars.put("name", agent.name());
      vars.put("role", agent.role());
      vars.put("goal", agent.goal());
      vars.put("backstory", agent.backstory());
      vars.put("tools", agent.tools().stream().map(Tool::name).toList());
      vars.put("json", inputs.outputFormat() == OutputFormat.JSON);
      return prompts.newSession().enable("system", vars).renderMessages();
    }

    private void transition(AgentState next) {
      log.trace("Agent {} task {}: {} -> {}", agent.name(), task.id(), state, next);
      state = next;
    }

    private void trace(String format, Object... args) {
      if (agent.verbose()) {
        log.info(format, args);
      } else {
        log.debug(format, args);
      }
    }
  }

  private record Answer(String text, JsonNode json) {}

  /** Parse a JSON answer, accepting a fenced {@code json} block around it. */
  static JsonNode parseJson(String text) throws JsonProcessingException {
    if (text == null || text.isBlank()) {
      throw new JsonParseException((JsonParser) null, "empty answer");
    }
    try {
      return STRICT_JSON.readTree(text);
    } catch (JsonProcessingException e) {
      String fenced = StringUtility.extractSnippet(text, "json");
      if (fenced == null) throw e;
      return STRICT_JSON.readTree(fenced);
    }
  }

  private static boolean isApproval(String text) {
    String normalized = text.replaceAll("[^A-Za-z]", "").toUpperCase(Locale.ROOT);
    return normalized.equals(APPROVED);
  }
}
