package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** Descriptive metadata of a generated graph. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphMetadata(
    String title,
    String description,
    String version,
    Instant generatedAt,
    String originalMarkdown) {

  public GraphMetadata withGeneration(Instant generatedAt, String originalMarkdown) {
    return new GraphMetadata(title, description, version, generatedAt, originalMarkdown);
  }
}
