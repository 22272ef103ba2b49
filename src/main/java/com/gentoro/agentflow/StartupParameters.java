package com.gentoro.agentflow;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Command line arguments of {@link AgentFlowApp}: {@code --name value} pairs.
 *
 * <ul>
 *   <li>{@code --config-file}: application configuration, default {@code
 *       classpath:application.yaml}
 *   <li>{@code --workflow}: workflow definition to run (required in run mode)
 *   <li>{@code --user}: user id for conversation memory, overrides the workflow's
 *   <li>{@code --mode}: {@code run} (default) or {@code help}
 * </ul>
 */
public class StartupParameters {
  private static final Set<String> MODES = Set.of("run", "help");

  final Map<String, Object> parameters = new HashMap<>();

  {
    parameters.put("config-file", "classpath:application.yaml");
    parameters.put("mode", "run");
  }

  public StartupParameters(String[] arguments) {
    this.parameters.putAll(parseArguments(arguments));
    this.validate();
  }

  private Map<String, Object> parseArguments(String[] arguments) {
    Map<String, Object> result = new HashMap<>();
    for (int p = 0; p < arguments.length; p++) {
      if (!arguments[p].startsWith("--")) {
        continue;
      }
      String paramName = arguments[p].substring(2);
      String paramValue = null;
      if (p < arguments.length - 1 && !arguments[p + 1].startsWith("--")) {
        paramValue = arguments[p + 1];
        p++;
      }
      result.put(paramName, paramValue);
    }
    return result;
  }

  private void validate() {
    Object mode = parameters.get("mode");
    if (mode == null || !MODES.contains(mode.toString())) {
      throw new IllegalArgumentException("Invalid mode: " + mode);
    }
    if (parameters.get("config-file") == null
        || parameters.get("config-file").toString().isBlank()) {
      throw new IllegalArgumentException("Missing config file location");
    }
    if ("run".equals(mode) && getOptionalParameter("workflow", String.class).isEmpty()) {
      throw new IllegalArgumentException("Missing --workflow <file>");
    }
  }

  /** Examples: "classpath:application.yaml", "/etc/agentflow.yaml", "config/local.yaml". */
  public String configFile() {
    return getOptionalParameter("config-file", String.class).orElse("classpath:application.yaml");
  }

  public String mode() {
    return getParameter("mode", String.class);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return type.cast(parameters.get(name));
  }

  public <T> Optional<T> getOptionalParameter(String name, Class<T> type) {
    return Optional.ofNullable(type.cast(parameters.get(name)));
  }

  public boolean isParameterPresent(String name) {
    return parameters.containsKey(name);
  }
}
