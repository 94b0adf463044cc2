package com.flamingo.ai.runbookflow.service.graph;

import com.flamingo.ai.runbookflow.agent.dto.EdgePayload;
import com.flamingo.ai.runbookflow.agent.dto.GraphPayload;
import com.flamingo.ai.runbookflow.agent.dto.MetadataPayload;
import com.flamingo.ai.runbookflow.agent.dto.NodePayload;
import com.flamingo.ai.runbookflow.agent.dto.RunbookPayload;
import com.flamingo.ai.runbookflow.agent.dto.RunbookStepPayload;
import com.flamingo.ai.runbookflow.domain.enums.EdgeStyle;
import com.flamingo.ai.runbookflow.domain.enums.NodeKind;
import com.flamingo.ai.runbookflow.domain.enums.TerminalState;
import com.flamingo.ai.runbookflow.domain.model.DecisionGraph;
import com.flamingo.ai.runbookflow.domain.model.FlowEdge;
import com.flamingo.ai.runbookflow.domain.model.FlowNode;
import com.flamingo.ai.runbookflow.domain.model.GraphMetadata;
import com.flamingo.ai.runbookflow.domain.model.Runbook;
import com.flamingo.ai.runbookflow.domain.model.RunbookStep;
import com.flamingo.ai.runbookflow.exception.MalformedGraphException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Validates oracle graph payloads and maps them to the domain model.
 *
 * <p>Rejects instead of repairing: a payload with no nodes, a node without id or with an unknown
 * kind, duplicate node ids, or an edge to an unknown node raises {@link MalformedGraphException}.
 * Only cosmetic gaps are filled in (missing edge ids, step order, metadata defaults).
 */
@Component
@Slf4j
public class DecisionGraphMapper {

  static final String DEFAULT_TITLE = "Untitled Flowchart";
  static final String DEFAULT_VERSION = "1.0";

  public DecisionGraph toDecisionGraph(GraphPayload payload) {
    if (payload == null || payload.nodes() == null || payload.nodes().isEmpty()) {
      throw new MalformedGraphException("Generated graph has no nodes");
    }

    Map<String, FlowNode> nodes = new LinkedHashMap<>();
    for (NodePayload nodePayload : payload.nodes()) {
      FlowNode node = toNode(nodePayload);
      if (nodes.putIfAbsent(node.getId(), node) != null) {
        throw new MalformedGraphException("Duplicate node id: " + node.getId());
      }
    }

    List<FlowEdge> edges = new ArrayList<>();
    Set<String> edgeIds = new HashSet<>();
    List<EdgePayload> edgePayloads = payload.edges() != null ? payload.edges() : List.of();
    for (EdgePayload edgePayload : edgePayloads) {
      if (edgePayload == null) {
        continue;
      }
      if (!nodes.containsKey(edgePayload.source()) || !nodes.containsKey(edgePayload.target())) {
        throw new MalformedGraphException(
            "Edge "
                + edgePayload.source()
                + " -> "
                + edgePayload.target()
                + " references an unknown node");
      }
      String id = edgePayload.id();
      if (isBlank(id) || edgeIds.contains(id)) {
        id = uniqueEdgeId(edgePayload.source(), edgePayload.target(), edgeIds);
      }
      edgeIds.add(id);
      edges.add(
          new FlowEdge(
              id,
              edgePayload.source(),
              edgePayload.target(),
              edgePayload.label(),
              EdgeStyle.fromValue(edgePayload.type())));
    }

    List<Runbook> runbooks = new ArrayList<>();
    if (payload.runbooks() != null) {
      for (RunbookPayload runbookPayload : payload.runbooks()) {
        if (runbookPayload == null || isBlank(runbookPayload.id())) {
          log.debug("Dropping runbook without id");
          continue;
        }
        runbooks.add(toRunbook(runbookPayload));
      }
    }

    log.debug(
        "Mapped graph payload: {} nodes, {} edges, {} runbooks",
        nodes.size(),
        edges.size(),
        runbooks.size());

    return DecisionGraph.builder()
        .nodes(new ArrayList<>(nodes.values()))
        .edges(edges)
        .runbooks(runbooks)
        .metadata(toMetadata(payload.metadata()))
        .build();
  }

  public FlowNode toNode(NodePayload payload) {
    if (payload == null || isBlank(payload.id())) {
      throw new MalformedGraphException("Node without id");
    }
    NodeKind kind =
        NodeKind.fromValue(payload.type())
            .orElseThrow(
                () ->
                    new MalformedGraphException(
                        "Node " + payload.id() + " has unknown type: " + payload.type()));

    TerminalState endState = null;
    if (kind == NodeKind.END) {
      endState = TerminalState.fromValue(payload.endStateType()).orElse(null);
    }

    return FlowNode.builder()
        .id(payload.id())
        .kind(kind)
        .label(payload.label() != null ? payload.label() : payload.id())
        .description(payload.description())
        .question(kind == NodeKind.QUESTION ? payload.question() : null)
        .sourceRef(payload.sourceRef())
        .runbookId(kind == NodeKind.RUNBOOK ? payload.runbookId() : null)
        .endStateType(endState)
        .build();
  }

  public Runbook toRunbook(RunbookPayload payload) {
    List<RunbookStep> steps = new ArrayList<>();
    if (payload.steps() != null) {
      int position = 0;
      for (RunbookStepPayload step : payload.steps()) {
        position++;
        if (step == null || isBlank(step.instruction())) {
          continue;
        }
        steps.add(
            new RunbookStep(
                step.order() != null ? step.order() : position,
                step.instruction(),
                step.details(),
                step.warning(),
                step.toolsRequired()));
      }
    }
    return new Runbook(
        payload.id(),
        payload.title() != null ? payload.title() : payload.id(),
        payload.description(),
        steps,
        payload.prerequisites(),
        payload.notes(),
        payload.relatedRunbookIds(),
        payload.sourceRef());
  }

  private GraphMetadata toMetadata(MetadataPayload payload) {
    if (payload == null) {
      return new GraphMetadata(DEFAULT_TITLE, null, DEFAULT_VERSION, null, null);
    }
    return new GraphMetadata(
        isBlank(payload.title()) ? DEFAULT_TITLE : payload.title(),
        payload.description(),
        isBlank(payload.version()) ? DEFAULT_VERSION : payload.version(),
        null,
        null);
  }

  private static String uniqueEdgeId(String source, String target, Set<String> taken) {
    String base = "e-" + source + "-" + target;
    String candidate = base;
    int suffix = 2;
    while (taken.contains(candidate)) {
      candidate = base + "-" + suffix++;
    }
    return candidate;
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
