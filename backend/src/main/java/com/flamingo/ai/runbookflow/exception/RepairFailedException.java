package com.flamingo.ai.runbookflow.exception;

/** Exception thrown when truncated oracle output cannot be salvaged into valid JSON. */
public class RepairFailedException extends RuntimeException {

  public RepairFailedException(String message) {
    super(message);
  }

  public RepairFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
