package com.gentoro.agentflow.model;

/** One model turn: either final {@code content} or a {@code toolCall} request. */
public record LlmResponse(String content, ToolCall toolCall) {

  public static LlmResponse text(String content) {
    return new LlmResponse(content == null ? "" : content, null);
  }

  public static LlmResponse toolCall(ToolCall call) {
    return new LlmResponse(null, call);
  }

  public boolean hasToolCall() {
    return toolCall != null;
  }
}
