package com.gentoro.agentflow.agent;

/** States of the agent execution loop. */
public enum AgentState {
  IDLE,
  REASONING,
  TOOL_INVOCATION,
  SUCCEEDED,
  FAILED
}
