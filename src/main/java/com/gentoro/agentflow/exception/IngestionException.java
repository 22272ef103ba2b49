package com.gentoro.agentflow.exception;

import java.util.Map;

/** A knowledge source could not be read or parsed into text. */
public class IngestionException extends AgentFlowException {
  private final String sourcePath;

  public IngestionException(String sourcePath, String message) {
    super(
        AgentFlowErrorCode.INGESTION_ERROR, message, Map.of("source", String.valueOf(sourcePath)));
    this.sourcePath = sourcePath;
  }

  public IngestionException(String sourcePath, String message, Throwable cause) {
    super(
        AgentFlowErrorCode.INGESTION_ERROR,
        message,
        Map.of("source", String.valueOf(sourcePath)),
        cause);
    this.sourcePath = sourcePath;
  }

  public String getSourcePath() {
    return sourcePath;
  }
}
