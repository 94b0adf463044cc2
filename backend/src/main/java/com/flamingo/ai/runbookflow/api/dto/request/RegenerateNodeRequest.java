package com.flamingo.ai.runbookflow.api.dto.request;

import com.flamingo.ai.runbookflow.domain.enums.RegenerationMode;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for regenerating one node of a flowchart. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegenerateNodeRequest {

  @NotNull(message = "Flowchart is required")
  private DecisionGraph flowchart;

  @Size(max = 2000, message = "Feedback must not exceed 2000 characters")
  private String feedback;

  /** Defaults to regenerate. */
  private RegenerationMode mode;
}
