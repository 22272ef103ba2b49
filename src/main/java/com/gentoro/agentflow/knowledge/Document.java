package com.gentoro.agentflow.knowledge;

import com.gentoro.agentflow.utility.Fingerprints;
import java.util.Objects;

/**
 * A loaded knowledge source. The identity is the SHA-256 of the normalized text, so the same
 * content loaded from two paths is the same document.
 */
public record Document(String id, String sourcePath, MediaType mediaType, String text) {

  public Document {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(sourcePath, "sourcePath");
    Objects.requireNonNull(mediaType, "mediaType");
    Objects.requireNonNull(text, "text");
  }

  public static Document of(String sourcePath, MediaType mediaType, String rawText) {
    String text = normalize(rawText);
    return new Document(Fingerprints.sha256(text), sourcePath, mediaType, text);
  }

  /** Unix line endings, no NUL characters, at most one blank line in a row, trimmed. */
  static String normalize(String raw) {
    if (raw == null) return "";
    String text = raw.replace("\r\n", "\n").replace('\r', '\n').replace("\u0000", "");
    text = text.replaceAll("[ \\t]+\\n", "\n");
    text = text.replaceAll("\\n{3,}", "\n\n");
    return text.strip();
  }
}
