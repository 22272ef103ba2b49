package com.gentoro.agentflow.tool;

import com.gentoro.agentflow.exception.ToolExecutionException;
import java.nio.file.Path;

final class CsvFiles {
  private CsvFiles() {}

  /** Resolve {@code relative} under {@code base}; paths escaping the base are rejected. */
  static Path resolve(Path base, String relative) {
    Path resolved = base.resolve(relative).toAbsolutePath().normalize();
    if (!resolved.startsWith(base)) {
      throw new ToolExecutionException("File is outside of the data directory: " + relative);
    }
    return resolved;
  }

  static char delimiter(String value) {
    if (value == null || value.length() != 1) {
      throw new ToolExecutionException("Delimiter must be a single character, got: " + value);
    }
    return value.charAt(0);
  }
}
