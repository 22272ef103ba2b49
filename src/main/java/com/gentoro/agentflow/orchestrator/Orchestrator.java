package com.gentoro.agentflow.orchestrator;

import com.gentoro.agentflow.agent.Agent;
import com.gentoro.agentflow.agent.AgentExecutor;
import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.StateException;
import com.gentoro.agentflow.exception.TaskDependencyException;
import com.gentoro.agentflow.logging.LoggingService;
import com.gentoro.agentflow.memory.MemoryStore;
import com.gentoro.agentflow.orchestrator.progress.NoOpProgressSink;
import com.gentoro.agentflow.orchestrator.progress.ProgressSink;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.Task;
import com.gentoro.agentflow.task.TaskGraph;
import com.gentoro.agentflow.task.TaskResult;
import com.gentoro.agentflow.task.TaskStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs a set of tasks with their agents.
 *
 * <p>The task graph is validated before anything happens; a cycle, an unknown or duplicated task,
 * or a task whose agent is not part of the run raises {@link TaskDependencyException} with no side
 * effects. Tasks are then released as soon as all their effective dependencies completed, on a
 * pool of {@code orchestrator.parallelism} threads. A task with a failed or skipped dependency is
 * skipped. When the run exceeds {@code orchestrator.run-timeout}, running tasks are interrupted and
 * fail with a timeout cause and tasks that never started are skipped.
 *
 * <p>{@link #run} returns once every task has a terminal result.
 */
public class Orchestrator {
  private static final org.slf4j.Logger log = LoggingService.getLogger(Orchestrator.class);

  static final String DEFAULT_USER = "anonymous";
  private static final String STAGE = "run";

  private final AgentExecutor agentExecutor;
  private final MemoryStore memoryStore;
  private final EngineSettings settings;
  private final ProgressSink progress;

  public Orchestrator(
      AgentExecutor agentExecutor,
      MemoryStore memoryStore,
      EngineSettings settings,
      ProgressSink progress) {
    this.agentExecutor = agentExecutor;
    this.memoryStore = memoryStore;
    this.settings = settings;
    this.progress = progress == null ? new NoOpProgressSink() : progress;
  }

  /**
   * Check that the tasks can run: the graph is acyclic and complete, every agent is part of the
   * run and no task has a result yet. Nothing is executed.
   *
   * @throws TaskDependencyException for graph or agent problems
   * @throws StateException when a task already ran
   */
  public TaskGraph validate(List<Agent> agents, List<Task> tasks, ProcessMode mode) {
    TaskGraph graph = TaskGraph.build(tasks, Objects.requireNonNull(mode, "mode"));
    validateAgents(agents, graph);
    List<String> finished =
        graph.tasks().stream().filter(t -> t.result().isPresent()).map(Task::id).toList();
    if (!finished.isEmpty()) {
      throw new StateException("Tasks already have a result from an earlier run: " + finished);
    }
    return graph;
  }

  public RunResult run(List<Agent> agents, List<Task> tasks, ProcessMode mode, String userId) {
    TaskGraph graph = validate(agents, tasks, mode);

    String runId = UUID.randomUUID().toString();
    Instant started = Instant.now();
    ExecutionContext ctx =
        new ExecutionContext(
            runId,
            userId == null || userId.isBlank() ? DEFAULT_USER : userId,
            graph,
            started.plus(settings.runTimeout()));

    try (LoggingService.MdcScope ignored =
        LoggingService.withMdc(Map.of(LoggingService.MDC_RUN_ID, runId))) {
      ctx.auditTrail()
          .append(
              AuditEvent.Type.RUN_STARTED,
              null,
              null,
              Map.of("mode", mode.name(), "tasks", graph.size(), "user", ctx.userId()));
      log.info("Run {} started: {} tasks, {} mode", runId, graph.size(), mode);
      progress.beginStage(STAGE, "Run " + runId, graph.size());

      ResultRecorder recorder = new ResultRecorder(ctx, progress, STAGE);
      ExecutorService pool =
          Executors.newFixedThreadPool(
              Math.min(settings.parallelism(), Math.max(1, graph.size())),
              threadFactory(runId));
      try {
        new Scheduler(ctx, recorder, pool).runToCompletion();
      } finally {
        pool.shutdownNow();
        awaitQuietly(pool);
      }

      Duration elapsed = Duration.between(started, Instant.now());
      Map<String, Long> counts =
          ctx.results().values().stream()
              .collect(Collectors.groupingBy(r -> r.status().name(), Collectors.counting()));
      ctx.auditTrail()
          .append(
              AuditEvent.Type.RUN_FINISHED,
              null,
              null,
              Map.of("elapsedMs", elapsed.toMillis(), "statuses", counts));
      if (ctx.isCancelled()) {
        progress.endStageError(STAGE, ctx.cancellationReason().orElse("cancelled"), Map.of());
      } else {
        progress.endStageOk(STAGE, Map.of("statuses", counts));
      }
      log.info("Run {} finished in {} ms: {}", runId, elapsed.toMillis(), counts);
      return new RunResult(
          runId, ctx.results(), ctx.auditTrail().events(), ctx.isCancelled(), elapsed);
    }
  }

  private static void validateAgents(List<Agent> agents, TaskGraph graph) {
    Set<Agent> members = Collections.newSetFromMap(new IdentityHashMap<>());
    members.addAll(Objects.requireNonNull(agents, "agents"));
    List<String> offending =
        graph.tasks().stream().filter(t -> !members.contains(t.agent())).map(Task::id).toList();
    if (!offending.isEmpty()) {
      throw new TaskDependencyException(
          "Tasks are assigned to agents that are not part of the run: " + offending, offending);
    }
  }

  /** Dependency-driven release of the tasks of one run. Only touched by the calling thread. */
  private final class Scheduler {
    private final ExecutionContext ctx;
    private final TaskGraph graph;
    private final ResultRecorder recorder;
    private final ExecutorService pool;
    private final BlockingQueue<String> done = new LinkedBlockingQueue<>();
    private final Map<String, Integer> waitingOn = new HashMap<>();
    private final Map<String, Future<?>> inFlight = new LinkedHashMap<>();

    Scheduler(ExecutionContext ctx, ResultRecorder recorder, ExecutorService pool) {
      this.ctx = ctx;
      this.graph = ctx.taskGraph();
      this.recorder = recorder;
      this.pool = pool;
      graph.tasks().forEach(t -> waitingOn.put(t.id(), graph.dependencies(t.id()).size()));
    }

    void runToCompletion() {
      for (String id : graph.topologicalOrder()) {
        if (waitingOn.get(id) == 0) release(id);
      }
      int terminal = 0;
      while (terminal < graph.size()) {
        String id;
        try {
          id = done.poll(ctx.remaining().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          cancel("run interrupted");
          return;
        }
        if (id == null) {
          cancel("run timeout of " + settings.runTimeout() + " exceeded");
          return;
        }
        terminal++;
        inFlight.remove(id);
        for (String next : graph.dependents(id)) {
          if (waitingOn.merge(next, -1, Integer::sum) == 0) release(next);
        }
      }
    }

    private void release(String id) {
      Task task = graph.task(id);
      List<String> blocking =
          graph.dependencies(id).stream()
              .filter(d -> ctx.status(d) != TaskStatus.COMPLETED)
              .toList();
      if (!blocking.isEmpty()) {
        String cause =
            "Dependency %s %s"
                .formatted(blocking.get(0), ctx.status(blocking.get(0)).name().toLowerCase());
        recorder.settle(task, TaskResult.skipped(id, task.agent().name(), cause));
        done.add(id);
        return;
      }
      TaskRunner runner = new TaskRunner(task, ctx, agentExecutor, memoryStore, recorder);
      inFlight.put(
          id,
          pool.submit(
              () -> {
                try {
                  runner.run();
                } finally {
                  done.add(id);
                }
              }));
    }

    private void cancel(String reason) {
      ctx.cancel(reason);
      ctx.auditTrail()
          .append(
              AuditEvent.Type.RUN_CANCELLED,
              null,
              null,
              Map.of("reason", reason, "inFlight", List.copyOf(inFlight.keySet())));
      log.warn("Run {} cancelled: {}", ctx.runId(), reason);
      for (Map.Entry<String, Future<?>> e : inFlight.entrySet()) {
        Task task = graph.task(e.getKey());
        if (ctx.status(task.id()) == TaskStatus.RUNNING) {
          String cause = "Timeout: run cancelled (" + reason + ")";
          recorder.settle(
              task, TaskResult.failed(task.id(), task.agent().name(), cause, List.of()));
        }
        e.getValue().cancel(true);
      }
      for (Task task : graph.tasks()) {
        if (ctx.result(task.id()).isEmpty()) {
          recorder.settle(
              task,
              TaskResult.skipped(task.id(), task.agent().name(), "Run cancelled: " + reason));
        }
      }
    }
  }

  private static ThreadFactory threadFactory(String runId) {
    AtomicInteger counter = new AtomicInteger();
    String prefix = "agentflow-" + runId.substring(0, 8) + "-";
    return r -> {
      Thread t = new Thread(r, prefix + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }

  private static void awaitQuietly(ExecutorService pool) {
    try {
      if (!pool.awaitTermination(5, TimeUnit.SECONDS)) {
        log.warn("Task threads still running after cancellation");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }
}
