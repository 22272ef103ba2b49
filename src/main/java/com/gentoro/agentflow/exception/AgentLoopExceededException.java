package com.gentoro.agentflow.exception;

import java.util.Map;

/** The agent kept reasoning or calling tools past its iteration limit. Fails that task only. */
public class AgentLoopExceededException extends AgentFlowException {
  private final int maxIterations;

  public AgentLoopExceededException(String agentName, int maxIterations) {
    super(
        AgentFlowErrorCode.AGENT_LOOP_EXCEEDED,
        "Agent '%s' did not produce a final answer within %d iterations"
            .formatted(agentName, maxIterations),
        Map.of("agent", agentName, "maxIterations", maxIterations));
    this.maxIterations = maxIterations;
  }

  public int getMaxIterations() {
    return maxIterations;
  }
}
