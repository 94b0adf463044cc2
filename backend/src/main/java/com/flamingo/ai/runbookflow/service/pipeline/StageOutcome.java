package com.flamingo.ai.runbookflow.service.pipeline;

import java.util.Objects;

/**
 * Result of one pipeline stage.
 *
 * <ul>
 *   <li>{@code OK}: the stage produced {@code value}.
 *   <li>{@code FALLBACK}: the stage failed but {@code value} holds a usable substitute (the neutral
 *       critique, the previous graph) and {@code reason} says why.
 *   <li>{@code FATAL}: the stage failed with {@code error} and the run cannot continue.
 * </ul>
 *
 * @param <T> the stage's value type
 */
public record StageOutcome<T>(Status status, T value, String reason, RuntimeException error) {

  public enum Status {
    OK,
    FALLBACK,
    FATAL
  }

  public StageOutcome {
    Objects.requireNonNull(status, "status");
    if (status != Status.FATAL) {
      Objects.requireNonNull(value, "value");
    } else {
      Objects.requireNonNull(error, "error");
    }
  }

  public static <T> StageOutcome<T> ok(T value) {
    return new StageOutcome<>(Status.OK, value, null, null);
  }

  public static <T> StageOutcome<T> fallback(T value, String reason) {
    return new StageOutcome<>(Status.FALLBACK, value, reason, null);
  }

  public static <T> StageOutcome<T> fatal(RuntimeException error) {
    return new StageOutcome<>(Status.FATAL, null, error.getMessage(), error);
  }

  public boolean isOk() {
    return status == Status.OK;
  }

  public boolean isFallback() {
    return status == Status.FALLBACK;
  }

  public boolean isFatal() {
    return status == Status.FATAL;
  }
}
