package com.gentoro.agentflow.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.agentflow.agent.ToolInvocation;
import java.util.List;
import java.util.Optional;

/**
 * Terminal outcome of a task. {@code json} is set for completed tasks with a JSON output
 * contract; {@code cause} describes why a task failed or was skipped.
 */
public record TaskResult(
    String taskId,
    String agentName,
    String outputText,
    JsonNode json,
    List<ToolInvocation> rawToolCalls,
    TaskStatus status,
    String cause) {

  public TaskResult {
    rawToolCalls = rawToolCalls == null ? List.of() : List.copyOf(rawToolCalls);
    if (!status.isTerminal()) {
      throw new IllegalArgumentException("TaskResult needs a terminal status, got " + status);
    }
  }

  public static TaskResult completed(
      String taskId, String agentName, String output, JsonNode json, List<ToolInvocation> calls) {
    return new TaskResult(taskId, agentName, output, json, calls, TaskStatus.COMPLETED, null);
  }

  public static TaskResult failed(
      String taskId, String agentName, String cause, List<ToolInvocation> calls) {
    return new TaskResult(taskId, agentName, "", null, calls, TaskStatus.FAILED, cause);
  }

  public static TaskResult skipped(String taskId, String agentName, String cause) {
    return new TaskResult(taskId, agentName, "", null, List.of(), TaskStatus.SKIPPED, cause);
  }

  public Optional<JsonNode> jsonOutput() {
    return Optional.ofNullable(json);
  }

  public boolean isCompleted() {
    return status == TaskStatus.COMPLETED;
  }
}
