package com.gentoro.agentflow.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Outcome of a tool invocation: either a payload or an error message. Errors are ordinary values
 * that the agent reasons about.
 */
public record ToolResult(JsonNode payload, String error) {

  public static ToolResult ok(JsonNode payload) {
    return new ToolResult(payload == null ? JsonNodeFactory.instance.nullNode() : payload, null);
  }

  public static ToolResult error(String message) {
    return new ToolResult(null, message == null || message.isBlank() ? "unknown error" : message);
  }

  public boolean isError() {
    return error != null;
  }

  /** The payload, or {@code {"error": message}}. */
  public JsonNode toJson() {
    if (!isError()) return payload;
    ObjectNode node = JsonNodeFactory.instance.objectNode();
    node.put("error", error);
    return node;
  }
}
