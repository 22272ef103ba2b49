package com.gentoro.agentflow.tool;

import com.gentoro.agentflow.exception.ConfigException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Named tools available to workflow definitions. */
public class ToolRegistry {
  private final Map<String, Tool> tools = new LinkedHashMap<>();

  public synchronized ToolRegistry register(Tool tool) {
    Tool previous = tools.putIfAbsent(tool.name(), tool);
    if (previous != null && previous != tool) {
      throw new ConfigException("Tool '%s' is already registered".formatted(tool.name()));
    }
    return this;
  }

  public synchronized Optional<Tool> find(String name) {
    return Optional.ofNullable(tools.get(name));
  }

  public synchronized Tool get(String name) {
    Tool tool = tools.get(name);
    if (tool == null) {
      throw new ConfigException(
          "Unknown tool '%s'; registered: %s".formatted(name, tools.keySet()));
    }
    return tool;
  }

  public synchronized Collection<Tool> all() {
    return Collections.unmodifiableCollection(new java.util.ArrayList<>(tools.values()));
  }
}
