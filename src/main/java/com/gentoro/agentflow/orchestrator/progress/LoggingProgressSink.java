package com.gentoro.agentflow.orchestrator.progress;

import com.gentoro.agentflow.utility.JacksonUtility;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Emits progress as one structured JSON log line per accepted event, under the marker text
 * {@code [agentflow.progress]}. Steps are rate limited per stage; stage begin and end lines are
 * always written.
 *
 * <pre>
 * {
 *   "stageId": "run",
 *   "label": "Run 5f0c...",
 *   "completed": 2,
 *   "total": 3,
 *   "percent": 67,
 *   "message": "task research completed",
 *   "attrs": { "task": "research", "status": "COMPLETED" },
 *   "status": "running|ok|error"
 * }
 * </pre>
 */
public class LoggingProgressSink implements ProgressSink {
  private final org.slf4j.Logger log;
  private final long minIntervalMs;
  private final long minDelta;

  private final Map<String, Long> totals = new ConcurrentHashMap<>();
  private final Map<String, Long> completions = new ConcurrentHashMap<>();
  private final Map<String, String> labels = new ConcurrentHashMap<>();
  private final Map<String, ProgressRateLimiter> limiters = new ConcurrentHashMap<>();

  public LoggingProgressSink(org.slf4j.Logger logger, long minIntervalMs, long minDelta) {
    this.log = Objects.requireNonNull(logger, "logger");
    this.minIntervalMs = minIntervalMs;
    this.minDelta = minDelta;
  }

  @Override
  public void beginStage(String id, String label, long totalWork) {
    totals.put(id, Math.max(0, totalWork));
    completions.put(id, 0L);
    labels.put(id, label);
    limiters.put(id, new ProgressRateLimiter(minIntervalMs, minDelta));
    emit(id, label, 0L, totalWork, "begin", Map.of(), "running");
  }

  @Override
  public void step(String id, long completed, String message, Map<String, Object> attrs) {
    completions.merge(id, completed, Math::max);
    ProgressRateLimiter limiter =
        limiters.computeIfAbsent(id, k -> new ProgressRateLimiter(minIntervalMs, minDelta));
    if (limiter.tryAcquire(System.currentTimeMillis(), completed)) {
      emit(
          id,
          labels.getOrDefault(id, id),
          completed,
          totals.getOrDefault(id, 0L),
          message,
          attrs == null ? Map.of() : attrs,
          "running");
    }
  }

  @Override
  public void endStageOk(String id, Map<String, Object> attrs) {
    long total = totals.getOrDefault(id, completions.getOrDefault(id, 0L));
    long done = Math.max(total, completions.getOrDefault(id, total));
    emit(
        id,
        labels.getOrDefault(id, id),
        done,
        total,
        "end",
        attrs == null ? Map.of() : attrs,
        "ok");
    forget(id);
  }

  @Override
  public void endStageError(String id, String errorSummary, Map<String, Object> attrs) {
    Map<String, Object> merged = new HashMap<>();
    if (attrs != null) merged.putAll(attrs);
    if (errorSummary != null) merged.put("error", errorSummary);
    long total = totals.getOrDefault(id, completions.getOrDefault(id, 0L));
    long done = completions.getOrDefault(id, 0L);
    emit(id, labels.getOrDefault(id, id), done, total, "error", merged, "error");
    forget(id);
  }

  private void forget(String id) {
    totals.remove(id);
    completions.remove(id);
    labels.remove(id);
    limiters.remove(id);
  }

  /** Build the payload map. Protected so tests can inspect it through a subclass. */
  protected Map<String, Object> createPayload(
      String id,
      String label,
      long completed,
      long total,
      String message,
      Map<String, Object> attrs,
      String status) {
    long safeTotal = Math.max(0, total);
    long safeCompleted = Math.max(0, Math.min(completed, safeTotal == 0 ? completed : safeTotal));
    int percent =
        safeTotal > 0 ? (int) Math.min(100, Math.round((safeCompleted * 100.0) / safeTotal)) : 0;
    Map<String, Object> payload = new LinkedHashMap<>();
    payload.put("stageId", id);
    payload.put("label", label);
    payload.put("completed", safeCompleted);
    payload.put("total", safeTotal);
    payload.put("percent", percent);
    payload.put("message", message);
    payload.put("attrs", attrs == null ? Map.of() : attrs);
    payload.put("status", status);
    return payload;
  }

  void emit(
      String id,
      String label,
      long completed,
      long total,
      String message,
      Map<String, Object> attrs,
      String status) {
    Map<String, Object> payload =
        createPayload(id, label, completed, total, message, attrs, status);
    log.info("[agentflow.progress] {}", JacksonUtility.toJson(payload));
  }
}
