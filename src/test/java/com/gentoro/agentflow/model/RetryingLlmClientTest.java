package com.gentoro.agentflow.model;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

import com.gentoro.agentflow.exception.LlmException;
import com.gentoro.agentflow.exception.ValidationException;
import com.gentoro.agentflow.testing.TestSettings;
import com.gentoro.agentflow.utility.TimeBoundedCall;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RetryingLlmClientTest {

  @Mock LlmClient delegate;

  private final ExecutorService executor = Executors.newCachedThreadPool();
  private final List<LlmClient.Message> messages = List.of(LlmClient.Message.user("hello"));

  @BeforeEach
  void setUp() {
    when(delegate.modelId()).thenReturn("test-model");
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private RetryingLlmClient client() {
    return new RetryingLlmClient(
        delegate,
        TestSettings.fast(),
        new TimeBoundedCall("model", Duration.ofSeconds(5), executor));
  }

  @Test
  @DisplayName("A failed turn is retried")
  void retries() {
    when(delegate.chat(anyList(), anyList()))
        .thenThrow(new LlmException("rate limited"))
        .thenReturn(LlmResponse.text("hi"));

    LlmResponse response = client().chat(messages, List.of());

    assertEquals("hi", response.content());
    verify(delegate, times(2)).chat(anyList(), anyList());
  }

  @Test
  @DisplayName("Failures past the retry budget surface as LlmException")
  void exhausts() {
    when(delegate.chat(anyList(), anyList())).thenThrow(new IllegalStateException("boom"));

    LlmException e = assertThrows(LlmException.class, () -> client().chat(messages, List.of()));
    assertTrue(e.getMessage().contains("after 3 attempts"), e.getMessage());
    verify(delegate, times(3)).chat(anyList(), anyList());
  }

  @Test
  @DisplayName("Validation errors are not retried")
  void validationNotRetried() {
    when(delegate.chat(anyList(), anyList())).thenThrow(new ValidationException("bad request"));

    assertThrows(ValidationException.class, () -> client().chat(messages, List.of()));
    verify(delegate, times(1)).chat(anyList(), anyList());
    assertEquals("test-model", client().modelId());
  }
}
