package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How a single node should be rewritten. */
public enum RegenerationMode {
  /** Rewrite the node with improved wording. */
  REGENERATE("regenerate"),
  /** Rewrite the node with more detail. */
  EXPAND("expand");

  private final String value;

  RegenerationMode(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static RegenerationMode fromValue(String value) {
    if (value != null && value.trim().toLowerCase(Locale.ROOT).equals("expand")) {
      return EXPAND;
    }
    return REGENERATE;
  }
}
