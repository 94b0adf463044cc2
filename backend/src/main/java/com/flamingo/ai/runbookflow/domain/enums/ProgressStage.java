package com.flamingo.ai.runbookflow.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/** Coarse stage reported on progress events. */
public enum ProgressStage {
  PARSING("parsing"),
  IDENTIFYING("identifying"),
  STRUCTURING("structuring"),
  GENERATING("generating");

  private final String value;

  ProgressStage(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }
}
