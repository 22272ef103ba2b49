package com.gentoro.agentflow.exception;

/** A blocking call or the whole run exceeded its time budget, or the run was cancelled. */
public class TaskTimeoutException extends AgentFlowException {
  public TaskTimeoutException(String message) {
    super(AgentFlowErrorCode.DEADLINE_EXCEEDED, message);
  }

  public TaskTimeoutException(String message, Throwable cause) {
    super(AgentFlowErrorCode.DEADLINE_EXCEEDED, message, cause);
  }
}
