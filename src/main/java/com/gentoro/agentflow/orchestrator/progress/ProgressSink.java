package com.gentoro.agentflow.orchestrator.progress;

import java.util.Map;

/**
 * Receives progress of long-running work: knowledge loading and orchestration runs.
 *
 * <p>The orchestrator calls a sink from several worker threads at once, so implementations must be
 * thread-safe. They should be cheap and never throw.
 */
public interface ProgressSink {

  /**
   * Signal the beginning of a stage.
   *
   * @param id stable stage identifier (e.g. "knowledge", "run")
   * @param label human-readable label
   * @param totalWork total work units, for a run the number of tasks; 0 when unknown
   */
  void beginStage(String id, String label, long totalWork);

  /**
   * Report an incremental step within a stage.
   *
   * @param completed completed work units so far
   * @param attrs optional structured attributes (task, status, ...)
   */
  void step(String id, long completed, String message, Map<String, Object> attrs);

  void endStageOk(String id, Map<String, Object> attrs);

  /** Mark a stage as failed with a short error summary. */
  void endStageError(String id, String errorSummary, Map<String, Object> attrs);
}
