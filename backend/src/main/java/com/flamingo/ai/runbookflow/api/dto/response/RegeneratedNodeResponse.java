package com.flamingo.ai.runbookflow.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import com.flamingo.ai.runbookflow.service.regeneration.RegeneratedNode;

/** Response DTO for node regeneration. {@code runbook} is omitted unless one was produced. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RegeneratedNodeResponse(FlowNode node, Runbook runbook) {

  public static RegeneratedNodeResponse fromResult(RegeneratedNode result) {
    return new RegeneratedNodeResponse(result.node(), result.runbook());
  }
}
