package com.flamingo.ai.runbookflow.exception;

/**
 * Exception thrown when the oracle call was never attempted because its circuit breaker rejected
 * it. Not retried.
 */
public class OracleUnavailableException extends OracleCallException {

  public OracleUnavailableException(String operation, Throwable cause) {
    super(operation, "Oracle circuit breaker is not permitting calls", cause);
  }
}
