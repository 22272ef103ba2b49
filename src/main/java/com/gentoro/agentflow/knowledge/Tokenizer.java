package com.gentoro.agentflow.knowledge;

public final class Tokenizer {
  /** Characters per token used by the estimate. */
  public static final int CHARS_PER_TOKEN = 4;

  private Tokenizer() {}

  /**
   * Very small heuristic: 1 token ~ 4 characters (approx for many LLMs). Good enough for chunk
   * sizing and prompt budgets, not for billing.
   */
  public static int estimateTokens(String text) {
    if (text == null || text.isEmpty()) return 0;
    return estimateTokens(text.length());
  }

  public static int estimateTokens(int chars) {
    if (chars <= 0) return 0;
    return Math.max(1, chars / CHARS_PER_TOKEN);
  }

  /** Largest character count still estimated at or below {@code tokens}. */
  public static int maxCharsFor(int tokens) {
    if (tokens <= 0) return 0;
    return tokens * CHARS_PER_TOKEN + (CHARS_PER_TOKEN - 1);
  }

  /**
   * Return a prefix of {@code text} approximating the first {@code maxTokens} tokens, cut on a
   * whitespace boundary when one is close.
   */
  public static String truncate(String text, int maxTokens) {
    if (text == null) return "";
    if (estimateTokens(text) <= maxTokens) return text;
    if (maxTokens <= 0) return "";
    int cut = Math.min(text.length(), maxTokens * CHARS_PER_TOKEN);
    int lastSpace = -1;
    for (int i = cut - 1; i > 0 && i > cut - 40; i--) {
      if (Character.isWhitespace(text.charAt(i))) {
        lastSpace = i;
        break;
      }
    }
    if (lastSpace > 0) cut = lastSpace;
    return text.substring(0, cut).stripTrailing();
  }
}
