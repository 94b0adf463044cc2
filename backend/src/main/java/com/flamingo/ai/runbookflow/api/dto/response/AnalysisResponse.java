package com.flamingo.ai.runbookflow.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.runbookflow.domain.model.FlowEdge;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.GraphMetadata;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisResult;
import com.flamingo.ai.runbookflow.service.pipeline.AnalysisSummary;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for a completed analysis. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisResponse {

  private List<FlowNode> nodes;
  private List<FlowEdge> edges;
  private List<Runbook> runbooks;
  private GraphMetadata metadata;
  private String reasoning;
  private AnalysisSummary summary;

  public static AnalysisResponse fromResult(AnalysisResult result) {
    return AnalysisResponse.builder()
        .nodes(result.graph().getNodes())
        .edges(result.graph().getEdges())
        .runbooks(result.graph().getRunbooks())
        .metadata(result.graph().getMetadata())
        .reasoning(result.reasoning())
        .summary(result.summary())
        .build();
  }
}
