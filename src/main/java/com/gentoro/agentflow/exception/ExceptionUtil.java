package com.gentoro.agentflow.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails}. If the throwable is an {@link
   * AgentFlowException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof AgentFlowException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(),
        safeMessage(t.getMessage()),
        AgentFlowErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Short "Type: message" summary used in task results and audit entries. */
  public static String summarize(Throwable t) {
    if (t == null) return "";
    Throwable root = unwrap(t);
    return root.getClass().getSimpleName() + ": " + safeMessage(root.getMessage());
  }

  /** Strip the wrappers added by executors and futures. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException
            || current instanceof java.util.concurrent.ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  public static AgentFlowException rethrowIfUnchecked(
      Throwable t, Function<Throwable, AgentFlowException> supplier) {
    if (t instanceof AgentFlowException ex) {
      return ex;
    } else {
      return supplier.apply(t);
    }
  }
}
