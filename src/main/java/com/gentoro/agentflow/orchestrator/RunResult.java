package com.gentoro.agentflow.orchestrator;

import com.gentoro.agentflow.task.TaskResult;
import com.gentoro.agentflow.task.TaskStatus;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Outcome of one orchestration run. Maps are keyed by task id in listed task order. */
public record RunResult(
    String runId,
    Map<String, TaskResult> taskResults,
    List<AuditEvent> auditTrail,
    boolean cancelled,
    Duration elapsed) {

  public RunResult {
    taskResults = Collections.unmodifiableMap(new LinkedHashMap<>(taskResults));
    auditTrail = List.copyOf(auditTrail);
  }

  public Map<String, TaskStatus> taskStatus() {
    Map<String, TaskStatus> out = new LinkedHashMap<>();
    taskResults.forEach((id, r) -> out.put(id, r.status()));
    return Collections.unmodifiableMap(out);
  }

  public Optional<TaskResult> result(String taskId) {
    return Optional.ofNullable(taskResults.get(taskId));
  }

  public TaskStatus status(String taskId) {
    TaskResult r = taskResults.get(taskId);
    if (r == null) throw new IllegalArgumentException("Unknown task: " + taskId);
    return r.status();
  }

  public boolean allCompleted() {
    return taskResults.values().stream().allMatch(TaskResult::isCompleted);
  }

  public long count(TaskStatus status) {
    return taskResults.values().stream().filter(r -> r.status() == status).count();
  }
}
