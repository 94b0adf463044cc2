package com.flamingo.ai.runbookflow.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for analyzing a runbook. Size is bounded by the chunk ceiling, not here, and the
 * minimum length is checked by the pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeRequest {

  @NotBlank(message = "Markdown content is required")
  private String markdown;
}
