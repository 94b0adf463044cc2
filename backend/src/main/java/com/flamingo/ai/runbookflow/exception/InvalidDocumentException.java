package com.flamingo.ai.runbookflow.exception;

/** Exception thrown when the submitted runbook text cannot be analyzed at all. */
public class InvalidDocumentException extends RuntimeException {

  public InvalidDocumentException(String message) {
    super(message);
  }
}
