package com.gentoro.agentflow.model;

/** A tool requested by the model. Arguments are kept as the raw JSON text the model produced. */
public record ToolCall(String id, String toolName, String rawArguments) {
  public ToolCall {
    if (rawArguments == null || rawArguments.isBlank()) rawArguments = "{}";
  }
}
