package com.flamingo.ai.runbookflow.domain.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * The decision tree: question, answer, runbook and end nodes connected by edges, plus the runbooks
 * the runbook nodes point to.
 *
 * <p>A single mutable value owned by the pipeline until it is returned. Consumers get a {@link
 * #snapshot()}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionGraph {

  @Builder.Default private List<FlowNode> nodes = new ArrayList<>();
  @Builder.Default private List<FlowEdge> edges = new ArrayList<>();
  @Builder.Default private List<Runbook> runbooks = new ArrayList<>();
  private GraphMetadata metadata;

  public Optional<FlowNode> findNode(String id) {
    return nodes.stream()
        .filter(node -> node != null && Objects.equals(node.getId(), id))
        .findFirst();
  }

  public Optional<Runbook> findRunbook(String id) {
    return runbooks.stream().filter(runbook -> Objects.equals(runbook.id(), id)).findFirst();
  }

  /**
   * Deep copy with unmodifiable lists. Nodes are copied, edges and runbooks are immutable records.
   */
  public DecisionGraph snapshot() {
    return new DecisionGraph(
        nodes.stream().map(node -> node.toBuilder().build()).toList(),
        List.copyOf(edges),
        List.copyOf(runbooks),
        metadata);
  }
}
