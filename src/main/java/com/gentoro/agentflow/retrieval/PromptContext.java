package com.gentoro.agentflow.retrieval;

import com.gentoro.agentflow.knowledge.Tokenizer;
import java.util.List;
import java.util.stream.Collectors;

/** The assembled prompt, kept as labeled sections in prompt order. */
public record PromptContext(List<Section> sections, boolean truncated) {

  public PromptContext {
    sections = List.copyOf(sections);
  }

  public enum Kind {
    TASK,
    UPSTREAM,
    KNOWLEDGE,
    MEMORY,
    OUTPUT_FORMAT
  }

  public record Section(Kind kind, String title, String content) {}

  public String render() {
    return sections.stream()
        .map(s -> "## " + s.title() + "\n" + s.content())
        .collect(Collectors.joining("\n\n"));
  }

  public int estimatedTokens() {
    return Tokenizer.estimateTokens(render());
  }

  public List<Section> sections(Kind kind) {
    return sections.stream().filter(s -> s.kind() == kind).toList();
  }
}
