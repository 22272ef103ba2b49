package com.gentoro.agentflow.exception;

/** JSON/YAML serialization or deserialization error. */
public class SerializationException extends AgentFlowException {
  public SerializationException(String message) {
    super(AgentFlowErrorCode.SERIALIZATION_ERROR, message);
  }

  public SerializationException(String message, Throwable cause) {
    super(AgentFlowErrorCode.SERIALIZATION_ERROR, message, cause);
  }
}
