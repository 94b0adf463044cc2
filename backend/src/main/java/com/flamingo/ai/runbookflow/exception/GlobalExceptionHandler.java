package com.flamingo.ai.runbookflow.exception;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Global exception handler for REST controllers. */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

  private final MeterRegistry meterRegistry;

  @ExceptionHandler(ContentTooLargeException.class)
  public ResponseEntity<ApiError> handleContentTooLarge(
      ContentTooLargeException ex, HttpServletRequest request) {

    incrementErrorCounter("content_too_large");
    String errorId = generateErrorId();
    log.warn(
        "Content too large [{}]: needs {} chunks, limit {}",
        errorId,
        ex.getChunksNeeded(),
        ex.getMaxChunks());

    return build(
        HttpStatus.PAYLOAD_TOO_LARGE,
        errorId,
        ApiError.CONTENT_TOO_LARGE,
        ex.getUserMessage(),
        request);
  }

  @ExceptionHandler(InvalidDocumentException.class)
  public ResponseEntity<ApiError> handleInvalidDocument(
      InvalidDocumentException ex, HttpServletRequest request) {

    incrementErrorCounter("invalid_document");
    String errorId = generateErrorId();
    log.warn("Invalid document [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_DOCUMENT, ex.getMessage(), request);
  }

  @ExceptionHandler(NodeNotFoundException.class)
  public ResponseEntity<ApiError> handleNodeNotFound(
      NodeNotFoundException ex, HttpServletRequest request) {

    incrementErrorCounter("node_not_found");
    String errorId = generateErrorId();
    log.warn("Node not found [{}]: {}", errorId, ex.getNodeId());

    return build(HttpStatus.NOT_FOUND, errorId, ApiError.NODE_NOT_FOUND, "Node not found", request);
  }

  @ExceptionHandler(MalformedGraphException.class)
  public ResponseEntity<ApiError> handleMalformedGraph(
      MalformedGraphException ex, HttpServletRequest request) {

    incrementErrorCounter("malformed_graph");
    String errorId = generateErrorId();
    log.error("Malformed graph [{}]: {}", errorId, ex.getMessage());

    return build(
        HttpStatus.BAD_GATEWAY, errorId, ApiError.MALFORMED_GRAPH, ex.getUserMessage(), request);
  }

  @ExceptionHandler(OracleCallException.class)
  public ResponseEntity<ApiError> handleOracleCall(
      OracleCallException ex, HttpServletRequest request) {

    String errorType = ex.isRateLimited() ? "oracle_rate_limited" : "oracle_error";
    incrementErrorCounter(errorType);
    String errorId = generateErrorId();
    log.error(
        "Oracle call error [{}] during {}: {}", errorId, ex.getOperation(), ex.getMessage(), ex);

    String code = ex.isRateLimited() ? ApiError.ORACLE_RATE_LIMITED : ApiError.ORACLE_UNAVAILABLE;
    HttpStatus status =
        ex.isRateLimited() ? HttpStatus.TOO_MANY_REQUESTS : HttpStatus.SERVICE_UNAVAILABLE;

    return build(status, errorId, code, ex.getUserMessage(), request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {

    incrementErrorCounter("validation_error");
    String errorId = generateErrorId();

    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .orElse("Validation failed");

    log.warn("Validation error [{}]: {}", errorId, message);

    return build(HttpStatus.BAD_REQUEST, errorId, ApiError.VALIDATION_ERROR, message, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleGeneric(Exception ex, HttpServletRequest request) {

    incrementErrorCounter("internal_error");
    String errorId = generateErrorId();
    log.error("Unexpected error [{}]: {}", errorId, ex.getMessage(), ex);

    return build(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        "An unexpected error occurred. Please try again later.",
        request);
  }

  private ResponseEntity<ApiError> build(
      HttpStatus status, String errorId, String code, String message, HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            ApiError.builder()
                .errorId(errorId)
                .code(code)
                .message(message)
                .path(request.getRequestURI())
                .timestamp(Instant.now())
                .build());
  }

  private void incrementErrorCounter(String errorType) {
    meterRegistry.counter("api_errors_total", "error_type", errorType).increment();
  }

  private String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}
