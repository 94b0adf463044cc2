package com.flamingo.ai.runbookflow.exception;

/** Exception thrown when the oracle returns an empty or structurally invalid decision graph. */
public class MalformedGraphException extends RuntimeException {

  private final String userMessage;

  public MalformedGraphException(String message) {
    super(message);
    this.userMessage = "The generated flowchart was empty or malformed. Please try again.";
  }

  public String getUserMessage() {
    return userMessage;
  }
}
