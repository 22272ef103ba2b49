package com.gentoro.agentflow.tool;

/** Tool families understood by the engine. */
public enum ToolKind {
  QUERY_EXECUTION,
  BULK_LOAD,
  BULK_EXPORT,
  RETRIEVAL,
  CUSTOM
}
