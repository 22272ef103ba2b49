package com.gentoro.agentflow.retrieval;

import com.gentoro.agentflow.task.OutputFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a task contributes to its prompt: the description, the expected-output contract and the
 * outputs of upstream tasks in dependency order (task name to output).
 */
public record TaskInputs(
    String description,
    String expectedOutput,
    OutputFormat outputFormat,
    Map<String, String> upstreamOutputs) {

  public TaskInputs {
    Objects.requireNonNull(description, "description");
    if (outputFormat == null) outputFormat = OutputFormat.TEXT;
    upstreamOutputs =
        upstreamOutputs == null
            ? Map.of()
            : java.util.Collections.unmodifiableMap(new LinkedHashMap<>(upstreamOutputs));
  }

  public static TaskInputs of(String description) {
    return new TaskInputs(description, null, OutputFormat.TEXT, Map.of());
  }
}
