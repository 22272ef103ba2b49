package com.gentoro.agentflow.knowledge;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/** Source formats understood by {@link DocumentLoader}. */
public enum MediaType {
  PDF("pdf"),
  TEXT("txt", "text", "log"),
  MARKDOWN("md", "markdown"),
  CSV("csv"),
  JSON("json"),
  YAML("yaml", "yml");

  private final String[] extensions;

  MediaType(String... extensions) {
    this.extensions = extensions;
  }

  public static Optional<MediaType> fromPath(Path path) {
    String name = path.getFileName() == null ? "" : path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    if (dot < 0 || dot == name.length() - 1) return Optional.empty();
    String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
    for (MediaType type : values()) {
      for (String e : type.extensions) {
        if (e.equals(ext)) return Optional.of(type);
      }
    }
    return Optional.empty();
  }
}
