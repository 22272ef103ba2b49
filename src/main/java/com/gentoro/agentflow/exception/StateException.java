package com.gentoro.agentflow.exception;

/** Illegal or unexpected state encountered. */
public class StateException extends AgentFlowException {
  public StateException(String message) {
    super(AgentFlowErrorCode.FAILED_PRECONDITION, message);
  }

  public StateException(String message, Throwable cause) {
    super(AgentFlowErrorCode.FAILED_PRECONDITION, message, cause);
  }
}
