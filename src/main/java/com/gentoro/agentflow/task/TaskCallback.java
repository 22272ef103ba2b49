package com.gentoro.agentflow.task;

/**
 * Invoked once a task reaches a terminal state. Exceptions thrown by a callback are logged and do
 * not change the task's result.
 */
@FunctionalInterface
public interface TaskCallback {
  void onTaskFinished(Task task, TaskResult result);
}
