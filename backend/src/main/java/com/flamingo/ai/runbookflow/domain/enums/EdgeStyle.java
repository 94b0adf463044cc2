package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** Rendering hint for an edge. */
public enum EdgeStyle {
  DEFAULT("default"),
  SUCCESS("success"),
  FAILURE("failure");

  private final String value;

  EdgeStyle(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /** Unknown or missing values map to {@link #DEFAULT}. */
  @JsonCreator
  public static EdgeStyle fromValue(String value) {
    if (value == null) {
      return DEFAULT;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (EdgeStyle style : values()) {
      if (style.value.equals(normalized)) {
        return style;
      }
    }
    return DEFAULT;
  }
}
