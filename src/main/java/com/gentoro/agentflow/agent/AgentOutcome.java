package com.gentoro.agentflow.agent;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/** Successful end of an agent loop. {@code json} is set when a JSON answer was required. */
public record AgentOutcome(
    String answer,
    JsonNode json,
    List<ToolInvocation> toolInvocations,
    int iterations,
    boolean reflected,
    int retrievedChunks) {

  public AgentOutcome {
    toolInvocations = List.copyOf(toolInvocations);
  }
}
