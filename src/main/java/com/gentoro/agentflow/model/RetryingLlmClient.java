package com.gentoro.agentflow.model;

import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.LlmException;
import com.gentoro.agentflow.exception.TaskTimeoutException;
import com.gentoro.agentflow.exception.ValidationException;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.List;

/**
 * Runs every model turn under the {@code timeouts.model} limit and retries failed turns with
 * exponential backoff. A failure that outlives the retry budget fails the calling task.
 */
public class RetryingLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(RetryingLlmClient.class);

  private final LlmClient delegate;
  private final Retry retry;
  private final TimeBoundedCall timeBound;

  public RetryingLlmClient(LlmClient delegate, EngineSettings settings, TimeBoundedCall timeBound) {
    this.delegate = delegate;
    this.timeBound = timeBound;
    RetryConfig config =
        RetryConfig.custom()
            .maxAttempts(settings.retryMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(
                    settings.retryInitialBackoff().toMillis(),
                    settings.retryMultiplier(),
                    settings.retryMaxBackoff().toMillis()))
            .retryOnException(e -> !Thread.currentThread().isInterrupted())
            .ignoreExceptions(ConfigException.class, ValidationException.class)
            .build();
    this.retry = Retry.of("llm-" + delegate.modelId(), config);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Model call failed (attempt {}), retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    ExceptionUtil.summarize(event.getLastThrowable())));
  }

  @Override
  public String modelId() {
    return delegate.modelId();
  }

  @Override
  public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
    try {
      return retry.executeSupplier(() -> timeBound.call(() -> delegate.chat(messages, tools)));
    } catch (LlmException | TaskTimeoutException | ConfigException | ValidationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new LlmException(
          "Model call failed after %d attempts: %s"
              .formatted(retry.getRetryConfig().getMaxAttempts(), ExceptionUtil.summarize(e)),
          e);
    }
  }
}
