package com.gentoro.agentflow;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.agentflow.exception.ErrorDetails;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.orchestrator.RunResult;
import com.gentoro.agentflow.task.TaskResult;
import com.gentoro.agentflow.utility.JacksonUtility;
import com.gentoro.agentflow.workflow.Workflow;
import java.nio.file.Path;

/** Runs a workflow file and prints the task results as JSON on standard output. */
public class AgentFlowApp {

  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(AgentFlowApp.class);

  private static final String USAGE =
      """
      Usage: agentflow --workflow <file> [--config-file <location>] [--user <id>]
        --workflow     YAML workflow definition (agents, tasks, process)
        --config-file  application configuration, default classpath:application.yaml
        --user         user id for conversation memory
      """;

  public static void main(String[] args) {
    StartupParameters params;
    try {
      params = new StartupParameters(args);
    } catch (IllegalArgumentException e) {
      System.err.println(e.getMessage());
      System.err.print(USAGE);
      System.exit(2);
      return;
    }
    if ("help".equals(params.mode())) {
      System.out.print(USAGE);
      return;
    }

    int exitCode;
    try (AgentFlow agentFlow = AgentFlow.create(params.configFile())) {
      Workflow workflow =
          agentFlow.workflowLoader().load(Path.of(params.getParameter("workflow", String.class)));
      String user = params.getOptionalParameter("user", String.class).orElse(workflow.userId());
      RunResult result =
          agentFlow.run(
              new Workflow(workflow.agents(), workflow.tasks(), workflow.process(), user));
      System.out.println(JacksonUtility.toJson(summary(result)));
      exitCode = result.allCompleted() ? 0 : 1;
    } catch (Exception e) {
      log.error("Workflow run failed", e);
      System.out.println(JacksonUtility.toJson(errorSummary(e)));
      exitCode = 3;
    }
    System.exit(exitCode);
  }

  static ObjectNode errorSummary(Throwable t) {
    ErrorDetails details = ExceptionUtil.toErrorDetails(ExceptionUtil.unwrap(t));
    ObjectNode error = JsonNodeFactory.instance.objectNode();
    error.put("type", details.type());
    error.put("code", details.code().name());
    error.put("message", details.message());
    if (details.context() != null && !details.context().isEmpty()) {
      error.set("context", JacksonUtility.getJsonMapper().valueToTree(details.context()));
    }
    error.put("timestamp", details.timestamp().toString());
    ObjectNode root = JsonNodeFactory.instance.objectNode();
    root.set("error", error);
    return root;
  }

  static ObjectNode summary(RunResult result) {
    ObjectNode root = JsonNodeFactory.instance.objectNode();
    root.put("runId", result.runId());
    root.put("cancelled", result.cancelled());
    root.put("elapsedMs", result.elapsed().toMillis());
    ArrayNode tasks = root.putArray("tasks");
    for (TaskResult r : result.taskResults().values()) {
      ObjectNode t = tasks.addObject();
      t.put("id", r.taskId());
      t.put("agent", r.agentName());
      t.put("status", r.status().name());
      if (r.json() != null) {
        t.set("output", r.json());
      } else {
        t.put("output", r.outputText());
      }
      if (r.cause() != null) t.put("cause", r.cause());
      t.put("toolCalls", r.rawToolCalls().size());
    }
    return root;
  }
}
