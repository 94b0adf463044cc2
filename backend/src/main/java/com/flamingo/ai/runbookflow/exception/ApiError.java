package com.flamingo.ai.runbookflow.exception;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;

/** Structured API error response. */
@Getter
@Builder
public class ApiError {

  // Error codes
  public static final String CONTENT_TOO_LARGE = "CONTENT_001";
  public static final String INVALID_DOCUMENT = "CONTENT_002";
  public static final String NODE_NOT_FOUND = "GRAPH_001";
  public static final String MALFORMED_GRAPH = "GRAPH_002";
  public static final String ORACLE_UNAVAILABLE = "ORACLE_001";
  public static final String ORACLE_RATE_LIMITED = "ORACLE_002";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";

  /** Unique error ID for log correlation. */
  private final String errorId;

  /** Machine-readable error code. */
  private final String code;

  /** User-friendly error message. */
  private final String message;

  /** Timestamp of the error. */
  private final Instant timestamp;

  /** Request path that caused the error. */
  private final String path;
}
