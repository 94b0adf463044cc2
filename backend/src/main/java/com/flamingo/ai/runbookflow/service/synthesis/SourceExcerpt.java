package com.flamingo.ai.runbookflow.service.synthesis;

/** Bounds the source text sent to the oracle next to a graph or concept graph. */
public final class SourceExcerpt {

  static final String TRUNCATION_MARKER = "\n\n[... document truncated ...]";

  private SourceExcerpt() {}

  public static String truncate(String text, int maxChars) {
    if (text == null) {
      return "";
    }
    if (text.length() <= maxChars) {
      return text;
    }
    return text.substring(0, maxChars) + TRUNCATION_MARKER;
  }
}
