package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.model.ToolDefinition;

/**
 * Capability offered to agents. {@link #invoke(JsonNode)} should not throw: failures come back as
 * {@link ToolResult#error(String)}. The agent checks arguments against {@link #definition()}
 * before invoking and turns anything thrown into an error result.
 */
public interface Tool {
  default String name() {
    return definition().name();
  }

  ToolKind kind();

  ToolDefinition definition();

  ToolResult invoke(JsonNode arguments);
}
