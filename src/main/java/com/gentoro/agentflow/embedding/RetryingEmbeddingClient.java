package com.gentoro.agentflow.embedding;

import com.gentoro.agentflow.config.EngineSettings;
import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.exception.EmbeddingServiceException;
import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.ValidationException;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.List;

/**
 * Decorates an {@link EmbeddingClient} with a bounded exponential-backoff retry and a per-attempt
 * timeout. Once the retry budget is spent the last failure is reported as {@link
 * EmbeddingServiceException}.
 */
public class RetryingEmbeddingClient implements EmbeddingClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(RetryingEmbeddingClient.class);

  private final EmbeddingClient delegate;
  private final Retry retry;
  private final TimeBoundedCall timeBound;

  public RetryingEmbeddingClient(
      EmbeddingClient delegate, EngineSettings settings, TimeBoundedCall timeBound) {
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
    this.retry = Retry.of("embedding-" + delegate.modelId(), config);
    this.retry
        .getEventPublisher()
        .onRetry(
            event ->
                log.warn(
                    "Embedding call failed (attempt {}), retrying in {}: {}",
                    event.getNumberOfRetryAttempts(),
                    event.getWaitInterval(),
                    ExceptionUtil.summarize(event.getLastThrowable())));
  }

  @Override
  public String modelId() {
    return delegate.modelId();
  }

  @Override
  public List<float[]> embed(List<String> texts) {
    if (texts.isEmpty()) return List.of();
    try {
      List<float[]> vectors =
          retry.executeSupplier(() -> timeBound.call(() -> delegate.embed(texts)));
      if (vectors.size() != texts.size()) {
        throw new EmbeddingServiceException(
            "Embedding service returned %d vectors for %d inputs"
                .formatted(vectors.size(), texts.size()));
      }
      return vectors;
    } catch (EmbeddingServiceException | ConfigException | ValidationException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new EmbeddingServiceException(
          "Embedding failed after %d attempts: %s"
              .formatted(retry.getRetryConfig().getMaxAttempts(), ExceptionUtil.summarize(e)),
          e);
    }
  }
}
