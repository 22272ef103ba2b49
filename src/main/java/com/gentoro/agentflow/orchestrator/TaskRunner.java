package com.gentoro.agentflow.orchestrator;

import com.gentoro.agentflow.agent.AgentExecutor;
import com.gentoro.agentflow.agent.AgentOutcome;
import com.gentoro.agentflow.exception.AgentFlowException;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.TaskTimeoutException;
import com.gentoro.agentflow.logging.LoggingService;
import com.gentoro.agentflow.memory.MemoryStore;
import com.gentoro.agentflow.retrieval.TaskInputs;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.task.TaskResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Executes a single task on a worker thread and settles its result. */
final class TaskRunner implements Runnable {
  private static final org.slf4j.Logger log = LoggingService.getLogger(TaskRunner.class);

  private final Task task;
  private final ExecutionContext ctx;
  private final AgentExecutor executor;
  private final MemoryStore memoryStore;
  private final ResultRecorder recorder;

  TaskRunner(
      Task task,
      ExecutionContext ctx,
      AgentExecutor executor,
      MemoryStore memoryStore,
      ResultRecorder recorder) {
    this.task = task;
    this.ctx = ctx;
    this.executor = executor;
    this.memoryStore = memoryStore;
    this.recorder = recorder;
  }

  @Override
  public void run() {
    try (LoggingService.MdcScope ignored =
        LoggingService.withMdc(
            Map.of(
                LoggingService.MDC_RUN_ID, ctx.runId(),
                LoggingService.MDC_TASK_ID, task.id(),
                LoggingService.MDC_AGENT, task.agent().name()))) {
      TaskResult result = execute();
      // a result that lost the race against cancellation is not remembered
      if (recorder.settle(task, result) && result.isCompleted()) {
        memoryStore.remember(ctx.userId(), task.name(), result.outputText());
      }
    }
  }

  TaskResult execute() {
    if (ctx.isCancelled()) {
      return TaskResult.skipped(
          task.id(), task.agent().name(), "Run cancelled: " + ctx.cancellationReason().orElse(""));
    }
    ctx.markRunning(task.id());
    ctx.auditTrail()
        .append(
            AuditEvent.Type.TASK_STARTED,
            task.id(),
            task.agent().name(),
            Map.of("dependencies", ctx.taskGraph().dependencies(task.id())));
    log.info("Task {} started by agent {}", task.id(), task.agent().name());
    try {
      AgentOutcome outcome = executor.execute(task, ctx, inputs());
      return TaskResult.completed(
          task.id(),
          task.agent().name(),
          outcome.answer(),
          outcome.json(),
          outcome.toolInvocations());
    } catch (TaskTimeoutException e) {
      String cause =
          ctx.isCancelled()
              ? "Timeout: run cancelled (" + ctx.cancellationReason().orElse("") + ")"
              : "Timeout: " + e.getMessage();
      return TaskResult.failed(task.id(), task.agent().name(), cause, List.of());
    } catch (AgentFlowException e) {
      log.debug("Task {} failed", task.id(), e);
      return TaskResult.failed(
          task.id(), task.agent().name(), ExceptionUtil.summarize(e), List.of());
    } catch (RuntimeException e) {
      log.error("Task {} failed unexpectedly", task.id(), e);
      return TaskResult.failed(
          task.id(), task.agent().name(), ExceptionUtil.summarize(e), List.of());
    }
  }

  /** Upstream outputs of the effective dependencies, keyed by task name in dependency order. */
  private TaskInputs inputs() {
    Map<String, String> upstream = new LinkedHashMap<>();
    for (String dep : ctx.taskGraph().dependencies(task.id())) {
      ctx.result(dep)
          .filter(TaskResult::isCompleted)
          .ifPresent(r -> upstream.put(ctx.taskGraph().task(dep).name(), r.outputText()));
    }
    return new TaskInputs(
        task.description(), task.expectedOutput(), task.outputFormat(), upstream);
  }
}
