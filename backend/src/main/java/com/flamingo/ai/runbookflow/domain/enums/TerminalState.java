package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Outcome tag carried by end nodes. */
public enum TerminalState {
  /** Issue is fixed, user is unblocked. */
  RESOLVED("resolved"),
  /** Needs engineering or higher tier support. */
  ESCALATE("escalate"),
  /** Requires manual intervention or external action. */
  MANUAL("manual"),
  /** Cannot proceed, waiting on something external. */
  BLOCKED("blocked");

  private final String value;

  TerminalState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  public static Optional<TerminalState> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (TerminalState state : values()) {
      if (state.value.equals(normalized)) {
        return Optional.of(state);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  static TerminalState fromJson(String value) {
    return fromValue(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown terminal state: " + value));
  }
}
