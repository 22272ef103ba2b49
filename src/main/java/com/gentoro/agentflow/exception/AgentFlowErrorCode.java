package com.gentoro.agentflow.exception;

/**
 * Canonical error codes for AgentFlow. Codes are stable and suitable for logs and run reports.
 * Prefer the most specific code that reflects the failure origin.
 */
public enum AgentFlowErrorCode {
  // Generic
  UNKNOWN,
  INVALID_ARGUMENT,
  FAILED_PRECONDITION,
  DEADLINE_EXCEEDED,

  // I/O and configuration
  CONFIGURATION_ERROR,
  SERIALIZATION_ERROR,

  // Knowledge pipeline
  INGESTION_ERROR,
  EMBEDDING_SERVICE_ERROR,
  VECTOR_STORE_ERROR,

  // Agents and tasks
  LLM_ERROR,
  TOOL_EXECUTION_ERROR,
  TASK_DEPENDENCY_ERROR,
  AGENT_LOOP_EXCEEDED,
  EXECUTION_ERROR,
}
