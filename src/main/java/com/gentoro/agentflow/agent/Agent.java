package com.gentoro.agentflow.agent;

import com.gentoro.agentflow.tool.Tool;
import com.gentoro.agentflow.vectorstore.CollectionConfig;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Identity, persona, knowledge scope and tools of an agent. Immutable; the same agent may serve
 * several tasks of a run.
 */
public final class Agent {
  private final String id;
  private final String name;
  private final String role;
  private final String goal;
  private final String backstory;
  private final List<Path> knowledgeSources;
  private final CollectionConfig knowledgeScope;
  private final List<Tool> tools;
  private final boolean selfReflect;
  private final boolean verbose;
  private final int maxIterations;

  private Agent(Builder b) {
    this.id = b.id != null ? b.id : UUID.randomUUID().toString();
    this.name = requireText(b.name, "name");
    this.role = requireText(b.role, "role");
    this.goal = requireText(b.goal, "goal");
    this.backstory = b.backstory == null ? "" : b.backstory;
    this.knowledgeSources = List.copyOf(b.knowledgeSources);
    this.knowledgeScope = b.knowledgeScope;
    this.tools = List.copyOf(b.tools);
    this.selfReflect = b.selfReflect;
    this.verbose = b.verbose;
    this.maxIterations = b.maxIterations;
    if (maxIterations < 0) {
      throw new IllegalArgumentException("maxIterations must be >= 0");
    }
    Set<String> names = new HashSet<>();
    for (Tool t : tools) {
      if (!names.add(t.name())) {
        throw new IllegalArgumentException(
            "Agent '%s' has two tools named '%s'".formatted(name, t.name()));
      }
    }
    if (!knowledgeSources.isEmpty() && knowledgeScope == null) {
      throw new IllegalArgumentException(
          "Agent '%s' declares knowledge sources but no knowledge collection".formatted(name));
    }
  }

  private static String requireText(String value, String field) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("Agent " + field + " is required");
    }
    return value;
  }

  public String id() {
    return id;
  }

  public String name() {
    return name;
  }

  public String role() {
    return role;
  }

  public String goal() {
    return goal;
  }

  public String backstory() {
    return backstory;
  }

  public List<Path> knowledgeSources() {
    return knowledgeSources;
  }

  public Optional<CollectionConfig> knowledgeScope() {
    return Optional.ofNullable(knowledgeScope);
  }

  public List<Tool> tools() {
    return tools;
  }

  public Optional<Tool> tool(String name) {
    return tools.stream().filter(t -> t.name().equals(name)).findFirst();
  }

  public boolean selfReflect() {
    return selfReflect;
  }

  public boolean verbose() {
    return verbose;
  }

  /** Model call limit; 0 means the engine default. */
  public int maxIterations() {
    return maxIterations;
  }

  @Override
  public String toString() {
    return "Agent{name=" + name + ", role=" + role + ", tools=" + tools.size() + '}';
  }

  public static Builder builder() {
    return new Builder();
  }

  public static final class Builder {
    private String id;
    private String name;
    private String role;
    private String goal;
    private String backstory;
    private final List<Path> knowledgeSources = new ArrayList<>();
    private CollectionConfig knowledgeScope;
    private final List<Tool> tools = new ArrayList<>();
    private boolean selfReflect;
    private boolean verbose;
    private int maxIterations;

    public Builder id(String id) {
      this.id = id;
      return this;
    }

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder role(String role) {
      this.role = role;
      return this;
    }

    public Builder goal(String goal) {
      this.goal = goal;
      return this;
    }

    public Builder backstory(String backstory) {
      this.backstory = backstory;
      return this;
    }

    public Builder knowledge(List<Path> sources) {
      this.knowledgeSources.addAll(sources);
      return this;
    }

    public Builder knowledgeScope(CollectionConfig knowledgeScope) {
      this.knowledgeScope = knowledgeScope;
      return this;
    }

    public Builder tool(Tool tool) {
      this.tools.add(Objects.requireNonNull(tool, "tool"));
      return this;
    }

    public Builder tools(List<Tool> tools) {
      tools.forEach(this::tool);
      return this;
    }

    public Builder selfReflect(boolean selfReflect) {
      this.selfReflect = selfReflect;
      return this;
    }

    public Builder verbose(boolean verbose) {
      this.verbose = verbose;
      return this;
    }

    public Builder maxIterations(int maxIterations) {
      this.maxIterations = maxIterations;
      return this;
    }

    public Agent build() {
      return new Agent(this);
    }
  }
}
