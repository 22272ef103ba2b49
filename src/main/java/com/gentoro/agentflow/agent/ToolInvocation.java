package com.gentoro.agentflow.agent;

import com.fasterxml.jackson.databind.JsonNode;

/** A tool call made by an agent, with what the tool returned. */
public record ToolInvocation(
    String callId,
    String toolName,
    String rawArguments,
    JsonNode result,
    boolean error,
    long durationMs) {}
