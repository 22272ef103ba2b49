package com.gentoro.agentflow.exception;

import java.time.Instant;
import java.util.Map;

/** Lightweight DTO exposing structured error information to logs and run reports. */
public record ErrorDetails(
    String type,
    String message,
    AgentFlowErrorCode code,
    Map<String, Object> context,
    Instant timestamp) {}
