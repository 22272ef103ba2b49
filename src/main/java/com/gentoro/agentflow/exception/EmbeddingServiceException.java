package com.gentoro.agentflow.exception;

/** The embedding service failed, after its retry budget when raised by the retrying client. */
public class EmbeddingServiceException extends AgentFlowException {
  public EmbeddingServiceException(String message) {
    super(AgentFlowErrorCode.EMBEDDING_SERVICE_ERROR, message);
  }

  public EmbeddingServiceException(String message, Throwable cause) {
    super(AgentFlowErrorCode.EMBEDDING_SERVICE_ERROR, message, cause);
  }
}
