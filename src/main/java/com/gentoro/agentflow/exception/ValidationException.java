package com.gentoro.agentflow.exception;

/** Input validation failure or illegal argument. */
public class ValidationException extends AgentFlowException {
  public ValidationException(String message) {
    super(AgentFlowErrorCode.INVALID_ARGUMENT, message);
  }

  public ValidationException(String message, Throwable cause) {
    super(AgentFlowErrorCode.INVALID_ARGUMENT, message, cause);
  }
}
