package com.gentoro.agentflow.retrieval;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.knowledge.Chunk;
import com.gentoro.agentflow.memory.MemoryEntry;
import com.gentoro.agentflow.task.OutputFormat;
import com.gentoro.agentflow.utility.Fingerprints;
import com.gentoro.agentflow.vectorstore.RetrievalResult;
import com.gentoro.agentflow.vectorstore.ScoredChunk;
import com.gentoro.agentflow.vectorstore.VectorStoreAdapter;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ContextAssemblerTest {

  private static final String DESCRIPTION = "Summarize the quarterly report.";
  // description 7 tokens, default format 6 tokens, two section headers 8 tokens
  private static final int FIXED = 21;
  private static final String UPSTREAM_TEXT = "u".repeat(100);
  private static final String CHUNK_TEXT = "k".repeat(100);
  private static final String MEMORY_TEXT = "m".repeat(100);
  // cost of each item including its separator
  private static final int UPSTREAM_COST = 29;
  private static final int KNOWLEDGE_COST = 33;
  private static final int MEMORY_COST = 29;

  private static ScoredChunk scored(String text, String section, double score, String source) {
    Chunk chunk =
        new Chunk(
            "doc#0",
            "doc",
            0,
            text,
            new Chunk.Span(0, text.length()),
            section,
            Fingerprints.sha256(text));
    return new ScoredChunk(chunk, score, Map.of(VectorStoreAdapter.META_SOURCE, source));
  }

  private static TaskInputs inputs() {
    return new TaskInputs(
        DESCRIPTION, null, OutputFormat.TEXT, Map.of("research", UPSTREAM_TEXT));
  }

  private static PromptContext assemble(int maxTokens) {
    return new ContextAssembler(maxTokens)
        .assemble(
            inputs(),
            new RetrievalResult(List.of(scored(CHUNK_TEXT, "", 0.9, "a.md"))),
            List.of(new MemoryEntry(1, "u1", "research", MEMORY_TEXT, Instant.now())));
  }

  @Test
  @DisplayName("Sections come in task, upstream, knowledge, memory, format order")
  void sectionOrder() {
    PromptContext ctx = assemble(FIXED + UPSTREAM_COST + KNOWLEDGE_COST + MEMORY_COST);

    assertFalse(ctx.truncated());
    assertEquals(
        List.of(
            PromptContext.Kind.TASK,
            PromptContext.Kind.UPSTREAM,
            PromptContext.Kind.KNOWLEDGE,
            PromptContext.Kind.MEMORY,
            PromptContext.Kind.OUTPUT_FORMAT),
        ctx.sections().stream().map(PromptContext.Section::kind).toList());
    String rendered = ctx.render();
    assertTrue(rendered.startsWith("## Task\n" + DESCRIPTION));
    assertTrue(rendered.contains("### research\n" + UPSTREAM_TEXT));
    assertTrue(rendered.contains("[1] source=a.md score=0.9000\n" + CHUNK_TEXT));
    assertTrue(rendered.contains("- (research) " + MEMORY_TEXT));
    assertTrue(rendered.endsWith("## Expected output\nA concise, complete answer."));
  }

  @Test
  @DisplayName("Memory is cut first when over budget")
  void memoryCutFirst() {
    PromptContext ctx = assemble(FIXED + UPSTREAM_COST + KNOWLEDGE_COST + 5);

    assertTrue(ctx.truncated());
    assertTrue(ctx.sections(PromptContext.Kind.MEMORY).isEmpty());
    assertTrue(ctx.sections(PromptContext.Kind.KNOWLEDGE).get(0).content().endsWith(CHUNK_TEXT));
    assertEquals(1, ctx.sections(PromptContext.Kind.UPSTREAM).size());
  }

  @Test
  @DisplayName("Knowledge is cut after memory, upstream outputs last")
  void knowledgeThenUpstream() {
    PromptContext partial = assemble(FIXED + UPSTREAM_COST + 20);
    String knowledge = partial.sections(PromptContext.Kind.KNOWLEDGE).get(0).content();
    assertTrue(knowledge.endsWith(" ..."));
    assertFalse(knowledge.contains(CHUNK_TEXT));
    assertTrue(partial.sections(PromptContext.Kind.MEMORY).isEmpty());
    assertTrue(
        partial.sections(PromptContext.Kind.UPSTREAM).get(0).content().endsWith(UPSTREAM_TEXT));

    PromptContext minimal = assemble(FIXED + 10);
    assertEquals(
        List.of(PromptContext.Kind.TASK, PromptContext.Kind.OUTPUT_FORMAT),
        minimal.sections().stream().map(PromptContext.Section::kind).toList());
  }

  @Test
  @DisplayName("Description and format instructions are never truncated")
  void fixedPartsKept() {
    TaskInputs json =
        new TaskInputs(DESCRIPTION.repeat(50), "A list of risks.", OutputFormat.JSON, Map.of());
    PromptContext ctx = new ContextAssembler(10).assemble(json, RetrievalResult.empty(), List.of());

    assertEquals(DESCRIPTION.repeat(50), ctx.sections(PromptContext.Kind.TASK).get(0).content());
    String format = ctx.sections(PromptContext.Kind.OUTPUT_FORMAT).get(0).content();
    assertTrue(format.startsWith("A list of risks."));
    assertTrue(format.contains("valid JSON"));
  }

  @Test
  @DisplayName("Knowledge items are ranked and labeled with source and section")
  void knowledgeLabels() {
    Map<String, String> upstream = new LinkedHashMap<>();
    upstream.put("first", "one");
    upstream.put("second", "two");
    PromptContext ctx =
        new ContextAssembler(6000)
            .assemble(
                new TaskInputs("Task", "Answer", OutputFormat.TEXT, upstream),
                new RetrievalResult(
                    List.of(
                        scored("alpha", "Guide > Install", 0.75, "guide.md"),
                        scored("beta", "", 0.5, "notes.txt"))),
                List.of());

    String knowledge = ctx.sections(PromptContext.Kind.KNOWLEDGE).get(0).content();
    assertEquals(
        "[1] source=guide.md section=Guide > Install score=0.7500\nalpha\n\n"
            + "[2] source=notes.txt score=0.5000\nbeta",
        knowledge);
    String up = ctx.sections(PromptContext.Kind.UPSTREAM).get(0).content();
    assertTrue(up.indexOf("### first") < up.indexOf("### second"));
  }
}
