package com.gentoro.agentflow.knowledge;

import java.util.Objects;

/**
 * A bounded slice of a {@link Document}. {@code text} is exactly {@code document.text()} between
 * the span offsets.
 */
public record Chunk(
    String id,
    String documentId,
    int sequenceIndex,
    String text,
    Span span,
    String sectionPath,
    String fingerprint) {

  public Chunk {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(documentId, "documentId");
    Objects.requireNonNull(text, "text");
    Objects.requireNonNull(span, "span");
    Objects.requireNonNull(fingerprint, "fingerprint");
    if (sectionPath == null) sectionPath = "";
  }

  public static String idOf(String documentId, int sequenceIndex) {
    return documentId + "#" + sequenceIndex;
  }

  /** Half-open character range {@code [start, end)}. */
  public record Span(int start, int end) {
    public Span {
      if (start < 0 || end < start) {
        throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
      }
    }

    public int length() {
      return end - start;
    }
  }
}
