package com.gentoro.agentflow.exception;

import java.util.List;
import java.util.Map;

/**
 * The task graph is not executable: it contains a cycle, a reference to an unknown task, or a
 * duplicated task id. Raised during validation, before any task runs.
 */
public class TaskDependencyException extends AgentFlowException {
  private final List<String> offendingTasks;

  public TaskDependencyException(String message, List<String> offendingTasks) {
    super(
        AgentFlowErrorCode.TASK_DEPENDENCY_ERROR,
        message,
        Map.of("tasks", List.copyOf(offendingTasks)));
    this.offendingTasks = List.copyOf(offendingTasks);
  }

  /** Task ids involved in the problem; for a cycle, the cycle path in dependency order. */
  public List<String> getOffendingTasks() {
    return offendingTasks;
  }
}
