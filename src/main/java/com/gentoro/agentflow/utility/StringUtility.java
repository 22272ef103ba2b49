package com.gentoro.agentflow.utility;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Small text helpers for prompts and log lines. */
public final class StringUtility {
  private StringUtility() {}

  /** Returns the body of the first fenced block of the given type (e.g. json), or null. */
  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    String regex = "(?s)```%s\\s*(.+?)\\s*```".formatted(Pattern.quote(type));
    Matcher matcher = Pattern.compile(regex).matcher(text);
    if (matcher.find()) {
      return matcher.group(1).trim();
    }
    return null;
  }

  /** Truncate to {@code max} characters, appending an ellipsis when cut. */
  public static String abbreviate(String text, int max) {
    if (text == null) return "";
    if (text.length() <= max) return text;
    return text.substring(0, Math.max(0, max - 1)) + "…";
  }
}
