package com.gentoro.agentflow.exception;

/** Configuration or environment problem detected at startup. Always fatal for the run. */
public class ConfigException extends AgentFlowException {
  public ConfigException(String message) {
    super(AgentFlowErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigException(String message, Throwable cause) {
    super(AgentFlowErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
