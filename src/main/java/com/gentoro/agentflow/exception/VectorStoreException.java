package com.gentoro.agentflow.exception;

/** Storage or schema problem of a vector-store backend. Fatal for the affected collection. */
public class VectorStoreException extends AgentFlowException {
  public VectorStoreException(String message) {
    super(AgentFlowErrorCode.VECTOR_STORE_ERROR, message);
  }

  public VectorStoreException(String message, Throwable cause) {
    super(AgentFlowErrorCode.VECTOR_STORE_ERROR, message, cause);
  }
}
