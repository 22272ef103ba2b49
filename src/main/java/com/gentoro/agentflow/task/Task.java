package com.gentoro.agentflow.task;

import com.gentoro.agentflow.agent.Agent;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A unit of work bound to one agent. Everything but the result is fixed at construction; the
 * result is set exactly once by the orchestrator.
 */
public final class Task {
  private final String id;
  private final String name;
  private final String description;
  private final String expectedOutput;
  private final Agent agent;
  private final List<String> dependsOn;
  private final OutputFormat outputFormat;
  private final boolean asyncExecution;
  private final TaskCallback callback;
  private final AtomicReference<TaskResult> result = new AtomicReference<>();

  private Task(Builder b) {
    String resolvedId = b.id != null ? b.id : b.name;
    if (resolvedId == null || resolvedId.isBlank()) {
      throw new IllegalArgumentException("Task needs an id or a name");
    }
    this.id = resolvedId;
    this.name = b.name != null ? b.name : resolvedId;
    this.description = Objects.requireNonNull(b.description, "description");
    this.expectedOutput = b.expectedOutput;
    this.agent = Objects.requireNonNull(b.agent, "agent");
    this.dependsOn = List.copyOf(b.dependsOn);
    this.outputFormat = b.outputFormat != null ? b.outputFormat : OutputFormat.TEXT;
    this.asyncExecution = b.asyncExecution;
    this.callback = b.callback;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String description() {
    return description;
  }

  public String expectedOutput() {
    return expectedOutput;
  }

  public Agent agent() {
    return agent;
  }

  /** Explicit dependencies in declaration order; empty when none were declared. */
  public List<String> dependsOn() {
    return dependsOn;
  }

  public OutputFormat outputFormat() {
    return outputFormat;
  }

  public boolean asyncExecution() {
    return asyncExecution;
  }

  public Optional<TaskCallback> callback() {
    return Optional.ofNullable(callback);
  }

  public Optional<TaskResult> result() {
    return Optional.ofNullable(result.get());
  }

  /** Set the result; returns false when one was already set. */
  public boolean complete(TaskResult taskResult) {
    return result.compareAndSet(null, Objects.requireNonNull(taskResult, "taskResult"));
  }

  @Override
  public String toString() {
    return "Task{id=" + id + ", agent=" + agent.name() + ", dependsOn=" + dependsOn + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String name;
    private String description;
    private String expectedOutput;
    private Agent agent;
    private final List<String> dependsOn = new ArrayList<>();
    private OutputFormat outputFormat;
    private boolean asyncExecution;
    private TaskCallback callback;

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder description(String description) {
      this.description = description;
      return this;
    }

    public Builder expectedOutput(String expectedOutput) {
      this.expectedOutput = expectedOutput;
      return this;
    }

    public Builder agent(Agent agent) {
      this.agent = agent;
      return this;
    }

    public Builder dependsOn(String... taskIds) {
      this.dependsOn.addAll(List.of(taskIds));
      return this;
    }

    public Builder dependsOn(List<String> taskIds) {
      this.dependsOn.addAll(taskIds);
      return this;
    }

    public Builder outputFormat(OutputFormat outputFormat) {
      this.outputFormat = outputFormat;
      return this;
    }

    public Builder asyncExecution(boolean asyncExecution) {
      this.asyncExecution = asyncExecution;
      return this;
    }

    public Builder callback(TaskCallback callback) {
      this.callback = callback;
      return this;
    }

    public Task build() {
      return new Task(this);
    }
  }
}
