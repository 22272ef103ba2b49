package com.gentoro.agentflow.orchestrator;

import com.gentoro.agentflow.exception.TaskTimeoutException;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.TaskGraph;
import com.gentoro.agentflow.task.TaskResult;
import com.gentoro.agentflow.task.TaskStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * State of one orchestration run: results, statuses, audit trail and the cancellation signal.
 * Created at run start and never shared between runs.
 *
 * <p>Each task writes its own result slot exactly once; dependents read the slots of their
 * dependencies after those finished.
 */
public final class ExecutionContext {
  private final String runId;
  private final String userId;
  private final TaskGraph graph;
  private final Instant deadline;
  private final AuditTrail auditTrail = new AuditTrail();
  private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
  private final Map<String, TaskStatus> statuses = new ConcurrentHashMap<>();
  private final AtomicReference<String> cancellation = new AtomicReference<>();

  public ExecutionContext(String runId, String userId, TaskGraph graph, Instant deadline) {
    this.runId = runId;
    this.userId = userId;
    this.graph = graph;
    this.deadline = deadline;
    graph.tasks().forEach(t -> statuses.put(t.id(), TaskStatus.PENDING));
  }

  public String runId() {
    return runId;
  }

  public String userId() {
    return userId;
  }

  public ProcessMode processMode() {
    return graph.mode();
  }

  public TaskGraph taskGraph() {
    return graph;
  }

  public AuditTrail auditTrail() {
    return auditTrail;
  }

  public Instant deadline() {
    return deadline;
  }

  public Duration remaining() {
    Duration d = Duration.between(Instant.now(), deadline);
    return d.isNegative() ? Duration.ZERO : d;
  }

  /** Store a terminal result; returns false when the task already has one. */
  public boolean recordResult(TaskResult result) {
    boolean first = results.putIfAbsent(result.taskId(), result) == null;
    if (first) statuses.put(result.taskId(), result.status());
    return first;
  }

  public Optional<TaskResult> result(String taskId) {
    return Optional.ofNullable(results.get(taskId));
  }

  public void markRunning(String taskId) {
    statuses.computeIfPresent(
        taskId, (k, s) -> s == TaskStatus.PENDING ? TaskStatus.RUNNING : s);
  }

  public TaskStatus status(String taskId) {
    return statuses.getOrDefault(taskId, TaskStatus.PENDING);
  }

  /** Results in listed task order. */
  public Map<String, TaskResult> results() {
    Map<String, TaskResult> out = new LinkedHashMap<>();
    graph.tasks().forEach(t -> result(t.id()).ifPresent(r -> out.put(t.id(), r)));
    return Collections.unmodifiableMap(out);
  }

  /** Request cancellation; only the first reason is kept. */
  public void cancel(String reason) {
    cancellation.compareAndSet(null, reason);
  }

  public boolean isCancelled() {
    return cancellation.get() != null;
  }

  public Optional<String> cancellationReason() {
    return Optional.ofNullable(cancellation.get());
  }

  public void throwIfCancelled() {
    String reason = cancellation.get();
    if (reason != null) {
      throw new TaskTimeoutException("Run " + runId + " cancelled: " + reason);
    }
  }
}
