package com.flamingo.ai.runbookflow.exception;

/** Exception thrown before any oracle call when a document needs more chunks than allowed. */
public class ContentTooLargeException extends RuntimeException {

  private final int chunksNeeded;
  private final int maxChunks;

  public ContentTooLargeException(int chunksNeeded, int maxChunks) {
    super("Content needs " + chunksNeeded + " chunks, limit is " + maxChunks);
    this.chunksNeeded = chunksNeeded;
    this.maxChunks = maxChunks;
  }

  public int getChunksNeeded() {
    return chunksNeeded;
  }

  public int getMaxChunks() {
    return maxChunks;
  }

  public String getUserMessage() {
    return "Document is too large to analyze: it would need "
        + chunksNeeded
        + " chunks but at most "
        + maxChunks
        + " are supported. Please split it into smaller runbooks.";
  }
}
