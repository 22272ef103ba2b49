package com.gentoro.agentflow.model;

import java.util.List;
import java.util.Objects;

/**
 * Abstraction over the language-model completion service: messages in, either text or a single
 * tool call out.
 *
 * <p>Concrete providers live behind this interface and are selected via {@link LlmClientFactory}
 * or the {@link java.util.ServiceLoader} managed SPI {@link LlmClientProvider}. Implementations do
 * not run tools themselves; the caller executes the requested tool and continues the
 * conversation.
 */
public interface LlmClient {

  String modelId();

  /**
   * Run one completion turn.
   *
   * @param tools tools the model may request; empty when none are offered.
   * @throws com.gentoro.agentflow.exception.LlmException when the provider call fails.
   */
  LlmResponse chat(List<Message> messages, List<ToolDefinition> tools);

  enum Role {
    SYSTEM,
    USER,
    ASSISTANT,
    /** Result of a tool call, fed back to the model. */
    TOOL
  }

  record Message(Role role, String content, String toolCallId, String toolName) {
    public Message {
      Objects.requireNonNull(role, "role");
      Objects.requireNonNull(content, "content");
    }

    public static Message system(String content) {
      return new Message(Role.SYSTEM, content, null, null);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content, null, null);
    }

    public static Message assistant(String content) {
      return new Message(Role.ASSISTANT, content, null, null);
    }

    public static Message tool(String toolCallId, String toolName, String content) {
      return new Message(Role.TOOL, content, toolCallId, toolName);
    }

    static List<Message> allExcept(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role() != role).toList();
    }

    static boolean contains(List<Message> messages, Role role) {
      return messages.stream().anyMatch(m -> m.role() == role);
    }

    static Message findFirst(List<Message> messages, Role role) {
      return messages.stream().filter(m -> m.role() == role).findFirst().orElseThrow();
    }
  }
}
