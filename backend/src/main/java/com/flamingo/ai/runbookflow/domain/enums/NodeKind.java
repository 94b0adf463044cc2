package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Kind of a node in a decision graph. */
public enum NodeKind {
  START("start"),
  QUESTION("question"),
  ANSWER("answer"),
  RUNBOOK("runbook"),
  END("end");

  private final String value;

  NodeKind(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** End nodes are the only terminal kind. */
  public boolean isTerminal() {
    return this == END;
  }

  /**
   * Resolves a wire value case-insensitively.
   *
   * @param value the wire value, may be null
   * @return the matching kind, or empty when unknown
   */
  public static Optional<NodeKind> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (NodeKind kind : values()) {
      if (kind.value.equals(normalized)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  static NodeKind fromJson(String value) {
    return fromValue(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown node kind: " + value));
  }
}
