package com.flamingo.ai.runbookflow.api.dto.request;

import com.flamingo.ai.runbookflow.domain.model.Runbook;
import jakarta.validation.constraints.NotEmpty;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for enriching runbooks before export. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichRunbooksRequest {

  @NotEmpty(message = "At least one runbook is required")
  private List<Runbook> runbooks;
}
