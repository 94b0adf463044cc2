package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Optional;

/** Fixed taxonomy of structural defects reported by the critic. */
public enum IssueType {
  MERGED_PATHS("merged_paths", true),
  DISCONNECTED_NODE("disconnected_node", true),
  COLLAPSED_PROCEDURE("collapsed_procedure", false),
  MISSING_WHY("missing_why", false),
  UNSEPARATED_PREREQUISITE("unseparated_prerequisite", false),
  SHALLOW_RUNBOOK("shallow_runbook", false),
  COMPLEX_RUNBOOK("complex_runbook", false);

  private final String value;
  private final boolean blocking;

  IssueType(String value, boolean blocking) {
    this.value = value;
    this.blocking = blocking;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Blocking issues fail review regardless of the numeric score. */
  public boolean isBlocking() {
    return blocking;
  }

  public static Optional<IssueType> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
    for (IssueType type : values()) {
      if (type.value.equals(normalized)) {
        return Optional.of(type);
      }
    }
    return Optional.empty();
  }

  @JsonCreator
  static IssueType fromJson(String value) {
    return fromValue(value)
        .orElseThrow(() -> new IllegalArgumentException("Unknown issue type: " + value));
  }
}
