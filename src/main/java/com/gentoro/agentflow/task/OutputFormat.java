package com.gentoro.agentflow.task;

/** Shape of a task's final answer. */
public enum OutputFormat {
  TEXT,
  /** The answer must parse as a single JSON document. */
  JSON
}
