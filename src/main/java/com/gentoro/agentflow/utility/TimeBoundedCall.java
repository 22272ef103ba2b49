package com.gentoro.agentflow.utility;

import com.gentoro.agentflow.exception.AgentFlowErrorCode;
import com.gentoro.agentflow.exception.AgentFlowException;
import com.gentoro.agentflow.exception.TaskTimeoutException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs a blocking collaborator call (model, embedding, tool) on a worker thread under a
 * Resilience4j {@link TimeLimiter}.
 *
 * <p>A call that exceeds the limit is cancelled and surfaces as {@link TaskTimeoutException}. When
 * the calling thread is interrupted (run cancellation) the in-flight call is cancelled too.
 */
public class TimeBoundedCall {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(TimeBoundedCall.class);

  private final String name;
  private final TimeLimiter limiter;
  private final ExecutorService executor;

  public TimeBoundedCall(String name, Duration timeout, ExecutorService executor) {
    this.name = name;
    this.executor = executor;
    this.limiter =
        TimeLimiter.of(
            name,
            TimeLimiterConfig.custom().timeoutDuration(timeout).cancelRunningFuture(true).build());
  }

  public Duration timeout() {
    return limiter.getTimeLimiterConfig().getTimeoutDuration();
  }

  public <T> T call(Callable<T> body) {
    AtomicReference<Future<T>> inFlight = new AtomicReference<>();
    try {
      return limiter.executeFutureSupplier(
          () -> {
            Future<T> f = executor.submit(body);
            inFlight.set(f);
            return f;
          });
    } catch (TimeoutException e) {
      log.warn("{} call exceeded {}", name, timeout());
      throw new TaskTimeoutException("%s call timed out after %s".formatted(name, timeout()), e);
    } catch (InterruptedException e) {
      Future<T> f = inFlight.get();
      if (f != null) f.cancel(true);
      Thread.currentThread().interrupt();
      throw new TaskTimeoutException("%s call interrupted by cancellation".formatted(name), e);
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception e) {
      throw new AgentFlowException(
          AgentFlowErrorCode.EXECUTION_ERROR,
          "%s call failed: %s".formatted(name, e.getMessage()),
          e);
    }
  }
}
