package com.gentoro.agentflow.orchestrator;

import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.orchestrator.progress.ProgressSink;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.task.TaskCallback;
import com.gentoro.agentflow.task.TaskResult;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Settles tasks of one run. The first terminal result of a task wins; later ones (for example a
 * task thread finishing after the run was cancelled) are ignored. Settling audits the outcome,
 * reports progress and invokes the task callback.
 */
final class ResultRecorder {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(ResultRecorder.class);

  private final ExecutionContext ctx;
  private final ProgressSink progress;
  private final String stageId;
  private final AtomicInteger settled = new AtomicInteger();

  ResultRecorder(ExecutionContext ctx, ProgressSink progress, String stageId) {
    this.ctx = ctx;
    this.progress = progress;
    this.stageId = stageId;
  }

  /** Returns false when the task already had a result. */
  boolean settle(Task task, TaskResult result) {
    if (!ctx.recordResult(result)) {
      log.debug("Task {} already settled, ignoring {}", task.id(), result.status());
      return false;
    }
    task.complete(result);

    Map<String, Object> attrs = new LinkedHashMap<>();
    attrs.put("status", result.status().name());
    attrs.put("toolCalls", result.rawToolCalls().size());
    if (result.cause() != null) attrs.put("cause", result.cause());
    ctx.auditTrail().append(eventType(result), task.id(), task.agent().name(), attrs);

    int done = settled.incrementAndGet();
    progress.step(
        stageId,
        done,
        "task %s %s".formatted(task.id(), result.status().name().toLowerCase()),
        Map.of("task", task.id(), "status", result.status().name()));
    switch (result.status()) {
      case COMPLETED -> log.info("Task {} completed", task.id());
      case FAILED -> log.warn("Task {} failed: {}", task.id(), result.cause());
      default -> log.info("Task {} skipped: {}", task.id(), result.cause());
    }

    Optional<TaskCallback> callback = task.callback();
    if (callback.isPresent()) {
      try {
        callback.get().onTaskFinished(task, result);
      } catch (RuntimeException e) {
        log.warn("Callback of task {} failed", task.id(), e);
        ctx.auditTrail()
            .append(
                AuditEvent.Type.CALLBACK_FAILED,
                task.id(),
                task.agent().name(),
                Map.of("error", ExceptionUtil.summarize(e)));
      }
    }
    return true;
  }

  int settledCount() {
    return settled.get();
  }

  private static AuditEvent.Type eventType(TaskResult result) {
    return switch (result.status()) {
      case COMPLETED -> AuditEvent.Type.TASK_COMPLETED;
      case FAILED -> AuditEvent.Type.TASK_FAILED;
      default -> AuditEvent.Type.TASK_SKIPPED;
    };
  }
}
