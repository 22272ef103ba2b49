package com.gentoro.agentflow.workflow;

import com.gentoro.agentflow.agent.Agent;
import com.gentoro.agentflow.task.ProcessMode;
import com.gentoro.agentflow.task.Task;
import java.util.List;
import java.util.Optional;

/** Agents and tasks of a workflow definition, ready to be handed to the orchestrator. */
public record Workflow(List<Agent> agents, List<Task> tasks, ProcessMode process, String userId) {
  public Workflow {
    agents = List.copyOf(agents);
    tasks = List.copyOf(tasks);
  }

  public Optional<Agent> agent(String name) {
    return agents.stream().filter(a -> a.name().equals(name)).findFirst();
  }
}
