package com.flamingo.ai.runbookflow.domain.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.enums.TerminalState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A node of the decision graph.
 *
 * <p>Mutable: the label normalizer rewrites {@code label} and the layout decorates {@code depth},
 * {@code position} and {@code collapsed} in place while the pipeline owns the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlowNode {

  private String id;

  /** Serialized as {@code type} to match the renderer contract. */
  @JsonProperty("type")
  private NodeKind kind;

  private String label;
  private String description;

  /** Full question text, question nodes only. */
  private String question;

  private SourceReference sourceRef;

  /** Id of the runbook executed at this node, runbook nodes only. */
  private String runbookId;

  /** End nodes only. */
  private TerminalState endStateType;

  private Position position;
  private Integer depth;
  private Boolean collapsed;
}
