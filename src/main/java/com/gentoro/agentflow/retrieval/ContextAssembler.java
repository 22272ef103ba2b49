package com.gentoro.agentflow.retrieval;

import com.gentoro.agentflow.knowledge.Tokenizer;
import com.gentoro.agentflow.memory.MemoryEntry;
import com.gentoro.agentflow.task.OutputFormat;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import com.gentoro.agentflow.vectorstore.ScoredChunk;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the prompt context of a task.
 *
 * <p>Section order: task description, upstream task outputs, retrieved knowledge (score order,
 * labeled with its source), memory, output-format instructions. When the whole would exceed the
 * token budget, memory is cut first, then knowledge, then upstream outputs. The description and
 * the format instructions are always kept whole.
 */
public class ContextAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.agentflow.logging.LoggingService.getLogger(ContextAssembler.class);

  /** Items that would be cut below this many tokens are dropped instead. */
  static final int MIN_PARTIAL_TOKENS = 16;

  // "## Title\n" plus the separator between sections
  private static final int SECTION_OVERHEAD_TOKENS = 4;

  private final int maxTokens;

  public ContextAssembler(int maxTokens) {
    this.maxTokens = maxTokens;
  }

  public PromptContext assemble(
      TaskInputs inputs, RetrievalResult retrieval, List<MemoryEntry> memorySnippets) {
    String format = formatInstructions(inputs);
    int budget =
        maxTokens
            - Tokenizer.estimateTokens(inputs.description())
            - Tokenizer.estimateTokens(format)
            - 2 * SECTION_OVERHEAD_TOKENS;

    // fill by priority: upstream outputs, then knowledge, then memory
    Budget remaining = new Budget(budget);
    List<String> upstream = new ArrayList<>();
    for (Map.Entry<String, String> e : inputs.upstreamOutputs().entrySet()) {
      remaining.take(upstream, "### " + e.getKey() + "\n" + e.getValue());
    }
    List<String> knowledge = new ArrayList<>();
    int rank = 1;
    for (ScoredChunk sc : retrieval.items()) {
      String label =
          "[%d] source=%s%s score=%s"
              .formatted(
                  rank++,
                  sc.source(),
                  sc.chunk().sectionPath().isEmpty() ? "" : " section=" + sc.chunk().sectionPath(),
                  String.format(Locale.ROOT, "%.4f", sc.score()));
      remaining.take(knowledge, label + "\n" + sc.chunk().text());
    }
    List<String> memory = new ArrayList<>();
    for (MemoryEntry m : memorySnippets) {
      remaining.take(memory, "- (" + m.source() + ") " + m.text());
    }

    List<PromptContext.Section> sections = new ArrayList<>();
    sections.add(new PromptContext.Section(PromptContext.Kind.TASK, "Task", inputs.description()));
    if (!upstream.isEmpty()) {
      sections.add(
          new PromptContext.Section(
              PromptContext.Kind.UPSTREAM,
              "Results of previous tasks",
              String.join("\n\n", upstream)));
    }
    if (!knowledge.isEmpty()) {
      sections.add(
          new PromptContext.Section(
              PromptContext.Kind.KNOWLEDGE, "Relevant knowledge", String.join("\n\n", knowledge)));
    }
    if (!memory.isEmpty()) {
      sections.add(
          new PromptContext.Section(
              PromptContext.Kind.MEMORY, "From earlier conversations", String.join("\n", memory)));
    }
    sections.add(
        new PromptContext.Section(PromptContext.Kind.OUTPUT_FORMAT, "Expected output", format));

    if (remaining.truncated) {
      log.debug(
          "Context over budget of {} tokens, kept {} upstream, {} knowledge, {} memory items",
          maxTokens,
          upstream.size(),
          knowledge.size(),
          memory.size());
    }
    return new PromptContext(sections, remaining.truncated);
  }

  static String formatInstructions(TaskInputs inputs) {
    StringBuilder sb = new StringBuilder();
    String expected = inputs.expectedOutput();
    sb.append(expected == null || expected.isBlank() ? "A concise, complete answer." : expected);
    if (inputs.outputFormat() == OutputFormat.JSON) {
      sb.append("\nRespond with a single valid JSON document and nothing else.");
    }
    return sb.toString();
  }

  private static final class Budget {
    private int tokens;
    private boolean truncated;

    Budget(int tokens) {
      this.tokens = Math.max(0, tokens);
    }

    void take(List<String> into, String item) {
      int cost = Tokenizer.estimateTokens(item) + 1;
      if (cost <= tokens) {
        into.add(item);
        tokens -= cost;
        return;
      }
      truncated = true;
      if (tokens - 1 >= MIN_PARTIAL_TOKENS) {
        into.add(Tokenizer.truncate(item, tokens - 1) + " ...");
      }
      tokens = 0;
    }
  }
}
