package com.gentoro.agentflow.exception;

/** Errors raised while calling the language model or interpreting its responses. */
public class LlmException extends AgentFlowException {
  public LlmException(String message) {
    super(AgentFlowErrorCode.LLM_ERROR, message);
  }

  public LlmException(String message, Throwable cause) {
    super(AgentFlowErrorCode.LLM_ERROR, message, cause);
  }
}
