package com.gentoro.agentflow.model;

import com.gentoro.agentflow.exception.ExceptionUtil;
import com.gentoro.agentflow.exception.LlmException;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.apache.commons.configuration2.Configuration;

/**
 * Base {@link LlmClient} with the common plumbing: trace logging, timing and mapping of provider
 * failures to {@link LlmException}.
 *
 * <p>Subclasses implement {@link #runInference(List, List)} to execute a single turn with a
 * concrete provider SDK.
 */
public abstract class AbstractLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(AbstractLlmClient.class);
  protected final Configuration configuration;

  protected AbstractLlmClient(Configuration configuration) {
    this.configuration = configuration;
  }

  @Override
  public LlmResponse chat(List<Message> messages, List<ToolDefinition> tools) {
    List<ToolDefinition> offered = Objects.requireNonNullElse(tools, List.of());
    log.trace(
        "chat() called with: messages = [{}], tools = [{}]",
        messages.size(),
        offered.stream().map(ToolDefinition::name).collect(Collectors.joining(", ")));
    long start = System.currentTimeMillis();
    try {
      return runInference(messages, offered);
    } catch (Exception e) {
      throw ExceptionUtil.rethrowIfUnchecked(
          e,
          (ex) ->
              new LlmException(
                  "There was a problem while running the inference with the chosen model.", ex));
    } finally {
      log.trace("chat() took {} ms", System.currentTimeMillis() - start);
    }
  }

  protected abstract LlmResponse runInference(List<Message> messages, List<ToolDefinition> tools)
      throws Exception;
}
