package com.flamingo.ai.runbookflow.exception;

/** Exception thrown inside a run when its consumer has gone away. */
public class PipelineCancelledException extends RuntimeException {

  public PipelineCancelledException(String message) {
    super(message);
  }
}
