package com.gentoro.agentflow.task;

import com.gentoro.agentflow.exception.ConfigException;
import java.util.Locale;

/** How a task graph is executed. */
public enum ProcessMode {
  /** Listed order; each task implicitly depends on the previous one. */
  SEQUENTIAL,
  /** Only declared dependencies order tasks; ready tasks run concurrently. */
  PARALLEL;

  public static ProcessMode parse(String value) {
    if (value == null || value.isBlank()) return SEQUENTIAL;
    try {
      return valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ConfigException("Unknown process mode: " + value, e);
    }
  }
}
