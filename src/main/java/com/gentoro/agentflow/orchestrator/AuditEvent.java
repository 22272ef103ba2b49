package com.gentoro.agentflow.orchestrator;

import java.time.Instant;
import java.util.Map;

/** One entry of a run's audit trail. {@code taskId} and {@code agent} are null for run events. */
public record AuditEvent(
    long sequence,
    Instant at,
    Type type,
    String taskId,
    String agent,
    Map<String, Object> attributes) {

  public AuditEvent {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public enum Type {
    RUN_STARTED,
    TASK_STARTED,
    RETRIEVAL,
    MODEL_CALL,
    TOOL_INVOCATION,
    REFLECTION,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_SKIPPED,
    CALLBACK_FAILED,
    RUN_CANCELLED,
    RUN_FINISHED
  }
}
