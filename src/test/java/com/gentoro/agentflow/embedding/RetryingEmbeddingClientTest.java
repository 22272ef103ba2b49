package com.gentoro.agentflow.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.exception.ConfigException;
import com.gentoro.agentflow.exception.EmbeddingServiceException;
import com.gentoro.agentflow.testing.FakeEmbeddingClient;
import com.gentoro.agentflow.testing.TestSettings;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryingEmbeddingClientTest {

  private final ExecutorService executor = Executors.newCachedThreadPool();

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private RetryingEmbeddingClient wrap(EmbeddingClient delegate, Duration timeout) {
    return new RetryingEmbeddingClient(
        delegate, TestSettings.fast(), new TimeBoundedCall("embedding", timeout, executor));
  }

  @Test
  @DisplayName("Transient failures are retried until the call succeeds")
  void retriesTransientFailures() {
    FakeEmbeddingClient fake =
        new FakeEmbeddingClient().failNext(2, new IllegalStateException("503 from provider"));
    RetryingEmbeddingClient client = wrap(fake, Duration.ofSeconds(5));

    List<float[]> vectors = client.embed(List.of("alpha", "beta"));

    assertEquals(2, vectors.size());
    assertEquals(3, fake.calls());
    assertEquals(fake.modelId(), client.modelId());
  }

  @Test
  @DisplayName("After the retry budget the failure is an EmbeddingServiceException")
  void exhaustsRetryBudget() {
    FakeEmbeddingClient fake =
        new FakeEmbeddingClient().failNext(10, new IllegalStateException("service down"));
    RetryingEmbeddingClient client = wrap(fake, Duration.ofSeconds(5));

    EmbeddingServiceException e =
        assertThrows(EmbeddingServiceException.class, () -> client.embed(List.of("alpha")));
    assertTrue(e.getMessage().contains("after 3 attempts"), e.getMessage());
    assertTrue(e.getMessage().contains("service down"), e.getMessage());
    assertEquals(3, fake.calls());
  }

  @Test
  @DisplayName("Configuration errors are not retried")
  void configErrorsNotRetried() {
    FakeEmbeddingClient fake =
        new FakeEmbeddingClient().failNext(10, new ConfigException("invalid model"));
    RetryingEmbeddingClient client = wrap(fake, Duration.ofSeconds(5));

    assertThrows(ConfigException.class, () -> client.embed(List.of("alpha")));
    assertEquals(1, fake.calls());
  }

  @Test
  @DisplayName("Calls that exceed the timeout are cancelled and retried")
  void timesOut() {
    AtomicInteger attempts = new AtomicInteger();
    EmbeddingClient slow =
        new EmbeddingClient() {
          @Override
          public String modelId() {
            return "slow";
          }

          @Override
          public List<float[]> embed(List<String> texts) {
            attempts.incrementAndGet();
            try {
              Thread.sleep(5_000);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            return List.of(new float[] {1f});
          }
        };
    RetryingEmbeddingClient client = wrap(slow, Duration.ofMillis(100));

    long start = System.currentTimeMillis();
    assertThrows(EmbeddingServiceException.class, () -> client.embed(List.of("alpha")));
    assertTrue(System.currentTimeMillis() - start < 4_000);
    assertEquals(3, attempts.get());
  }

  @Test
  @DisplayName("A vector count that does not match the input is rejected")
  void rejectsWrongVectorCount() {
    EmbeddingClient broken =
        new EmbeddingClient() {
          @Override
          public String modelId() {
            return "broken";
          }

          @Override
          public List<float[]> embed(List<String> texts) {
            return List.of(new float[] {1f});
          }
        };
    RetryingEmbeddingClient client = wrap(broken, Duration.ofSeconds(5));

    assertThrows(EmbeddingServiceException.class, () -> client.embed(List.of("a", "b")));
    assertTrue(client.embed(List.of()).isEmpty());
  }
}
