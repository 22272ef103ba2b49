package com.gentoro.agentflow.exception;

/** Failure inside a tool. Tools turn it into an error result, it never leaves the tool. */
public class ToolExecutionException extends AgentFlowException {
  public ToolExecutionException(String message) {
    super(AgentFlowErrorCode.TOOL_EXECUTION_ERROR, message);
  }

  public ToolExecutionException(String message, Throwable cause) {
    super(AgentFlowErrorCode.TOOL_EXECUTION_ERROR, message, cause);
  }
}
