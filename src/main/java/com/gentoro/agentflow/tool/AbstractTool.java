package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.ToolExecutionException;
import com.gentoro.agentflow.model.ToolDefinition;
import java.util.List;

/**
 * Base class enforcing the tool contract: arguments are validated against the definition, and any
 * failure during {@link #execute(JsonNode)} becomes an error result.
 */
public abstract class AbstractTool implements Tool {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(AbstractTool.class);

  private final ToolDefinition definition;
  private final ToolKind kind;

  protected AbstractTool(ToolDefinition definition, ToolKind kind) {
    this.definition = definition;
    this.kind = kind;
  }

  @Override
  public ToolDefinition definition() {
    return definition;
  }

  @Override
  public ToolKind kind() {
    return kind;
  }

  @Override
  public final ToolResult invoke(JsonNode arguments) {
    List<String> problems = ToolArgumentValidator.validate(definition.schema(), arguments);
    if (!problems.isEmpty()) {
      log.debug("Rejected call to {}: {}", name(), problems);
      return ToolResult.error("Invalid arguments: " + String.join("; ", problems));
    }
    long start = System.currentTimeMillis();
    try {
      ToolResult result = ToolResult.ok(execute(arguments));
      log.debug("Tool {} completed in {} ms", name(), System.currentTimeMillis() - start);
      return result;
    } catch (ToolExecutionException e) {
      log.debug("Tool {} failed: {}", name(), e.getMessage());
      return ToolResult.error(e.getMessage());
    } catch (RuntimeException e) {
      log.warn("Tool {} failed unexpectedly", name(), e);
      return ToolResult.error(ExceptionUtil.summarize(e));
    }
  }

  /**
   * Run the tool with validated arguments.
   *
   * @throws ToolExecutionException for failures the caller should see as an error result.
   */
  protected abstract JsonNode execute(JsonNode arguments);

  protected static String text(JsonNode args, String field, String defaultValue) {
    JsonNode n = args.get(field);
    return n == null || n.isNull() ? defaultValue : n.asText();
  }
}
