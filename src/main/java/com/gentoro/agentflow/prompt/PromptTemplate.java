package com.gentoro.agentflow.prompt;

import com.gentoro.agentflow.model.LlmClient;
import java.util.List;
import java.util.Map;

/**
 * Immutable definition of a prompt template composed of multiple sections. Use {@link
 * PromptSession} to select sections and render.
 */
public interface PromptTemplate {
  /** Identifier of this template (e.g., "agent"). */
  String id();

  /** Read-only view of the sections defined by this template. */
  List<PromptSection> sections();

  /** Create a new mutable session to enable sections and render. */
  PromptSession newSession();

  /** A single prompt section (message) definition. */
  record PromptSection(LlmClient.Role role, String id, boolean enabledByDefault, String content) {}

  /** Per-render mutable context used to enable sections and render output. */
  interface PromptSession {
    PromptSession enable(String sectionId, Map<String, Object> vars);

    /** Disable all sections. */
    PromptSession clear();

    List<LlmClient.Message> renderMessages();

    /** Content of the only enabled section, or all enabled sections joined by a blank line. */
    String renderText();
  }
}
