package com.flamingo.ai.runbookflow.exception;

/** Exception thrown when a call to the generative oracle fails or returns unusable output. */
public class OracleCallException extends RuntimeException {

  private final String operation;
  private final boolean rateLimited;
  private final String userMessage;

  public OracleCallException(String operation, String message, Throwable cause) {
    this(operation, message, cause, false);
  }

  public OracleCallException(
      String operation, String message, Throwable cause, boolean rateLimited) {
    super(message, cause);
    this.operation = operation;
    this.rateLimited = rateLimited;
    this.userMessage =
        rateLimited
            ? "AI service is rate limited. Please wait a moment and try again."
            : "AI service failed while " + operation + ". Please try again later.";
  }

  public String getOperation() {
    return operation;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  public String getUserMessage() {
    return userMessage;
  }
}
