package com.gentoro.agentflow.knowledge;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.agentflow.utility.Fingerprints;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ChunkerTest {

  private static final String GUIDE =
      """
      # Guide

      Intro text for the guide.

      ## Install

      Run the installer and accept the defaults.

      ## Configure

      Edit the configuration file.
      """;

  @Test
  @DisplayName("Markdown chunks follow heading sections and keep the section path")
  void markdownSections() {
    Document doc = Document.of("guide.md", MediaType.MARKDOWN, GUIDE);
    List<Chunk> chunks = new Chunker(256, 32).chunk(doc);

    assertEquals(3, chunks.size());
    assertEquals("Guide", chunks.get(0).sectionPath());
    assertEquals("Guide > Install", chunks.get(1).sectionPath());
    assertEquals("Guide > Configure", chunks.get(2).sectionPath());
    assertTrue(chunks.get(1).text().startsWith("## Install"));
    assertTrue(chunks.get(1).text().endsWith("accept the defaults."));
  }

  @Test
  @DisplayName("Chunk text, id, sequence and fingerprint are consistent with the document")
  void spansAndIdentity() {
    Document doc = Document.of("notes.txt", MediaType.TEXT, longProse(40));
    List<Chunk> chunks = new Chunker(20, 5).chunk(doc);

    assertTrue(chunks.size() > 5);
    for (int i = 0; i < chunks.size(); i++) {
      Chunk c = chunks.get(i);
      assertEquals(i, c.sequenceIndex());
      assertEquals(doc.id(), c.documentId());
      assertEquals(Chunk.idOf(doc.id(), i), c.id());
      assertEquals(doc.text().substring(c.span().start(), c.span().end()), c.text());
      assertEquals(Fingerprints.sha256(c.text()), c.fingerprint());
    }
  }

  @Test
  @DisplayName("Chunks stay within the token limit, overlap included, and overlap the previous one")
  void boundedAndOverlapping() {
    int max = 20;
    int overlap = 5;
    Document doc = Document.of("notes.txt", MediaType.TEXT, longProse(40));
    List<Chunk> chunks = new Chunker(max, overlap).chunk(doc);

    for (Chunk c : chunks) {
      assertTrue(
          Tokenizer.estimateTokens(c.text()) <= max,
          "chunk too large: " + c.text().length() + " chars");
    }
    for (int i = 1; i < chunks.size(); i++) {
      assertTrue(
          chunks.get(i).span().start() < chunks.get(i - 1).span().end(),
          "chunk " + i + " does not overlap its predecessor");
      assertTrue(chunks.get(i).span().end() > chunks.get(i - 1).span().end());
    }
    // together the chunks cover the whole text
    assertEquals(0, chunks.get(0).span().start());
    assertEquals(doc.text().length(), chunks.get(chunks.size() - 1).span().end());
  }

  @Test
  @DisplayName("Without overlap chunks are disjoint")
  void noOverlap() {
    Document doc = Document.of("notes.txt", MediaType.TEXT, longProse(20));
    List<Chunk> chunks = new Chunker(16, 0).chunk(doc);
    for (int i = 1; i < chunks.size(); i++) {
      assertTrue(chunks.get(i).span().start() >= chunks.get(i - 1).span().end());
    }
  }

  @Test
  @DisplayName("A fenced code block that fits is never split")
  void codeBlockKeptWhole() {
    String code = "```java\nint a = 1;\nint b = 2;\nSystem.out.println(a + b);\n```";
    String md = "# Example\n\n" + longProse(6) + "\n\n" + code + "\n\nThat is all.";
    Document doc = Document.of("example.md", MediaType.MARKDOWN, md);
    List<Chunk> chunks = new Chunker(30, 0).chunk(doc);

    assertTrue(chunks.stream().anyMatch(c -> c.text().contains(code)), "code block was split");
  }

  @Test
  @DisplayName("An oversized paragraph without sentence breaks is split by size")
  void forceSplit() {
    String word = "lorem ";
    String text = word.repeat(200).trim();
    Document doc = Document.of("blob.txt", MediaType.TEXT, text);
    List<Chunk> chunks = new Chunker(10, 0).chunk(doc);

    assertTrue(chunks.size() >= 25);
    chunks.forEach(c -> assertTrue(Tokenizer.estimateTokens(c.text()) <= 10));
    assertEquals(
        text.replace(" ", ""),
        chunks.stream().map(c -> c.text().replace(" ", "")).collect(Collectors.joining()));
  }

  @Test
  @DisplayName("Chunking is deterministic and a blank document has no chunks")
  void deterministic() {
    Document doc = Document.of("guide.md", MediaType.MARKDOWN, GUIDE);
    Chunker chunker = new Chunker(8, 2);
    assertEquals(chunker.chunk(doc), chunker.chunk(doc));
    assertTrue(chunker.chunk(Document.of("empty.txt", MediaType.TEXT, "  \n\n ")).isEmpty());
  }

  @Test
  @DisplayName("Overlap must be smaller than the chunk size")
  void rejectsInvalidSizes() {
    assertThrows(IllegalArgumentException.class, () -> new Chunker(0, 0));
    assertThrows(IllegalArgumentException.class, () -> new Chunker(10, 10));
    assertThrows(IllegalArgumentException.class, () -> new Chunker(10, -1));
  }

  static String longProse(int sentences) {
    return IntStream.rangeClosed(1, sentences)
        .mapToObj(i -> "Sentence number " + i + " talks about topic " + (i % 7) + ".")
        .collect(Collectors.joining(" "));
  }
}
