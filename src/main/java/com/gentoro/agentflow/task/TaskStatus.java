package com.gentoro.agentflow.task;

public enum TaskStatus {
  PENDING,
  RUNNING,
  COMPLETED,
  FAILED,
  SKIPPED;

  public boolean isTerminal() {
    return this == COMPLETED || this == FAILED || this == SKIPPED;
  }
}
