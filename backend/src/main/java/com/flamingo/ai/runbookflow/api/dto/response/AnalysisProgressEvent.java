package com.flamingo.ai.runbookflow.api.dto.response;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.flamingo.ai.runbookflow.domain.enums.ProgressStage;
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

/** Response DTO for SSE analysis events. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnalysisProgressEvent {

  public static final String PROGRESS = "progress";
  public static final String COMPLETE = "complete";
  public static final String ERROR = "error";

  /** Event type: progress, complete, error. */
  private String type;

  private ProgressStage stage;
  private String message;
  private String detail;

  /** 0-100, never decreases within a run. */
  private Integer percent;

  // complete only
  private List<FlowNode> nodes;
  private List<FlowEdge> edges;
  private List<Runbook> runbooks;
  private GraphMetadata metadata;
  private String reasoning;
  private AnalysisSummary summary;

  /** Error id for log correlation, error only. */
  private String errorId;

  /** Creates a progress event. */
  public static AnalysisProgressEvent progress(
      ProgressStage stage, String message, String detail, int percent) {
    return AnalysisProgressEvent.builder()
        .type(PROGRESS)
        .stage(stage)
        .message(message)
        .detail(detail)
        .percent(percent)
        .build();
  }

  /** Creates a complete event from the final result. */
  public static AnalysisProgressEvent complete(AnalysisResult result) {
    return AnalysisProgressEvent.builder()
        .type(COMPLETE)
        .percent(100)
        .nodes(result.graph().getNodes())
        .edges(result.graph().getEdges())
        .runbooks(result.graph().getRunbooks())
        .metadata(result.graph().getMetadata())
        .reasoning(result.reasoning())
        .summary(result.summary())
        .build();
  }

  /** Creates an error event. */
  public static AnalysisProgressEvent error(String errorId, String message) {
    return AnalysisProgressEvent.builder().type(ERROR).errorId(errorId).message(message).build();
  }

  @JsonIgnore
  public boolean isTerminal() {
    return COMPLETE.equals(type) || ERROR.equals(type);
  }
}
