package com.gentoro.agentflow.task;

import com.gentoro.agentflow.exception.TaskDependencyException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Validated dependency graph of a run.
 *
 * <p>In {@link ProcessMode#SEQUENTIAL} mode a task without declared dependencies depends on the
 * task listed before it. Consecutive {@code asyncExecution} tasks without declared dependencies
 * form a group: they share the dependency of the first member, and the next task depends on every
 * member of the group. In {@link ProcessMode#PARALLEL} mode only declared dependencies count.
 *
 * <p>Construction fails with {@link TaskDependencyException} on duplicate ids, unknown
 * dependencies and cycles.
 */
public final class TaskGraph {
  private final ProcessMode mode;
  private final List<Task> tasks;
  private final Map<String, Task> byId;
  private final Map<String, List<String>> dependencies;
  private final Map<String, List<String>> dependents;
  private final List<String> order;

  private TaskGraph(
      ProcessMode mode,
      List<Task> tasks,
      Map<String, Task> byId,
      Map<String, List<String>> dependencies,
      Map<String, List<String>> dependents,
      List<String> order) {
    this.mode = mode;
    this.tasks = tasks;
    this.byId = byId;
    this.dependencies = dependencies;
    this.dependents = dependents;
    this.order = order;
  }

  public static TaskGraph build(List<Task> tasks, ProcessMode mode) {
    Map<String, Task> byId = new LinkedHashMap<>();
    Map<String, Integer> index = new HashMap<>();
    List<String> duplicates = new ArrayList<>();
    for (Task t : tasks) {
      if (byId.putIfAbsent(t.id(), t) != null) {
        duplicates.add(t.id());
      } else {
        index.put(t.id(), index.size());
      }
    }
    if (!duplicates.isEmpty()) {
      throw new TaskDependencyException("Duplicate task ids: " + duplicates, duplicates);
    }

    List<String> unknown = new ArrayList<>();
    for (Task t : tasks) {
      for (String dep : t.dependsOn()) {
        if (!byId.containsKey(dep)) unknown.add(t.id() + " -> " + dep);
      }
    }
    if (!unknown.isEmpty()) {
      throw new TaskDependencyException(
          "Unknown task dependencies: " + unknown,
          unknown.stream().map(s -> s.substring(0, s.indexOf(" -> "))).distinct().toList());
    }

    Map<String, List<String>> deps = effectiveDependencies(tasks, mode);
    Map<String, List<String>> dependents = new LinkedHashMap<>();
    byId.keySet().forEach(id -> dependents.put(id, new ArrayList<>()));
    deps.forEach((id, ds) -> ds.forEach(d -> dependents.get(d).add(id)));

    // Kahn's algorithm, ties broken by listed order
    Map<String, Integer> inDegree = new HashMap<>();
    deps.forEach((id, ds) -> inDegree.put(id, ds.size()));
    PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparingInt(index::get));
    inDegree.forEach((id, d) -> {
      if (d == 0) ready.add(id);
    });
    List<String> order = new ArrayList<>(tasks.size());
    while (!ready.isEmpty()) {
      String id = ready.poll();
      order.add(id);
      for (String next : dependents.get(id)) {
        if (inDegree.merge(next, -1, Integer::sum) == 0) ready.add(next);
      }
    }
    if (order.size() != byId.size()) {
      List<String> cycle = findCycle(deps, inDegree);
      throw new TaskDependencyException(
          "Task dependencies contain a cycle: " + String.join(" -> ", cycle), cycle);
    }

    Map<String, List<String>> frozenDeps = new LinkedHashMap<>();
    deps.forEach((k, v) -> frozenDeps.put(k, List.copyOf(v)));
    Map<String, List<String>> frozenDependents = new LinkedHashMap<>();
    dependents.forEach((k, v) -> frozenDependents.put(k, List.copyOf(v)));
    return new TaskGraph(
        mode,
        List.copyOf(tasks),
        Collections.unmodifiableMap(byId),
        Collections.unmodifiableMap(frozenDeps),
        Collections.unmodifiableMap(frozenDependents),
        List.copyOf(order));
  }

  private static Map<String, List<String>> effectiveDependencies(
      List<Task> tasks, ProcessMode mode) {
    Map<String, List<String>> deps = new LinkedHashMap<>();
    if (mode == ProcessMode.PARALLEL) {
      tasks.forEach(t -> deps.put(t.id(), new ArrayList<>(new LinkedHashSet<>(t.dependsOn()))));
      return deps;
    }
    List<String> base = List.of();
    List<String> group = new ArrayList<>();
    for (Task t : tasks) {
      boolean explicit = !t.dependsOn().isEmpty();
      if (t.asyncExecution()) {
        deps.put(t.id(), new ArrayList<>(explicit ? dedup(t.dependsOn()) : base));
        group.add(t.id());
        continue;
      }
      List<String> implicit = group.isEmpty() ? base : group;
      deps.put(t.id(), new ArrayList<>(explicit ? dedup(t.dependsOn()) : implicit));
      base = List.of(t.id());
      group = new ArrayList<>();
    }
    return deps;
  }

  private static List<String> dedup(List<String> ids) {
    return new ArrayList<>(new LinkedHashSet<>(ids));
  }

  // Walk dependencies among the nodes Kahn could not release until a node repeats.
  private static List<String> findCycle(
      Map<String, List<String>> deps, Map<String, Integer> inDegree) {
    Set<String> remaining = new LinkedHashSet<>();
    inDegree.forEach((id, d) -> {
      if (d > 0) remaining.add(id);
    });
    String start = remaining.iterator().next();
    List<String> path = new ArrayList<>();
    Map<String, Integer> seenAt = new HashMap<>();
    String current = start;
    while (!seenAt.containsKey(current)) {
      seenAt.put(current, path.size());
      path.add(current);
      current =
          deps.get(current).stream().filter(remaining::contains).findFirst().orElseThrow();
    }
    List<String> cycle = new ArrayList<>(path.subList(seenAt.get(current), path.size()));
    cycle.add(current);
    return cycle;
  }

  public ProcessMode mode() {
    return mode;
  }

  /** Tasks in listed order. */
  public List<Task> tasks() {
    return tasks;
  }

  public Task task(String id) {
    Task t = byId.get(id);
    if (t == null) throw new IllegalArgumentException("Unknown task: " + id);
    return t;
  }

  /** Effective dependencies, including the implicit ones of sequential mode. */
  public List<String> dependencies(String id) {
    return dependencies.getOrDefault(id, List.of());
  }

  public List<String> dependents(String id) {
    return dependents.getOrDefault(id, List.of());
  }

  /** A topological order; among ready tasks the one listed first comes first. */
  public List<String> topologicalOrder() {
    return order;
  }

  public int size() {
    return tasks.size();
  }
}
